package com.cgrera.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts ordered sections of labeled fields from a persisted CG RERA detail page using jsoup.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Walks the document in reading order. Headings ({@code h1}-{@code h6}, {@code legend}, panel headings,
 *   bold text outside table cells) open the section that following content belongs to; content before any
 *   heading lands in {@value #DEFAULT_SECTION_TITLE}. Repeated titles are merged.</li>
 *   <li>Label/value tables: the first cell of a row is the label, the following cell(s) the value. A label
 *   cell with {@code rowspan} folds the spanned rows into its value; rows alternating label/value cells are
 *   split into pairs; single spanning cells inside a table act as sub-section titles.</li>
 *   <li>Rows holding nested tables are layout rows: their cells are walked so the nested tables are parsed
 *   on their own.</li>
 *   <li>Tables led by a row of {@code th} cells are data tables and become {@link RawTable}s. Data rows that
 *   carry a preview trigger also become fields so their artifact is tracked.</li>
 *   <li>{@code <label>} elements outside tables read their value from the following siblings or the next
 *   column; form controls contribute their current value.</li>
 *   <li>Every value cell is scanned for direct links and for a preview/view/download trigger.</li>
 * </ul>
 * A failure while parsing a table or label is logged and attached to the section as an
 * {@link WarningKind#EXTRACTION_FAILURE}; the rest of the page is still extracted.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class FieldExtractor implements FieldExtractorInterface {
    private static final Logger logger = LoggerFactory.getLogger(FieldExtractor.class);

    public static final String DEFAULT_SECTION_TITLE = "General";

    // Substring match: "Downloads" and "ViewDocument" are triggers too.
    private static final Pattern TRIGGER_MARKER = Pattern.compile("preview|view|download", Pattern.CASE_INSENSITIVE);
    private static final Set<String> HEADING_TAGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6", "legend");
    private static final Set<String> HEADING_CLASSES = Set.of("card-header", "panel-heading", "section-title", "box-title");

    @Override
    public List<RawSection> extract(PersistedPage page) {
        if (page == null || Utils.isBlank(page.html())) {
            logger.warn("extract called with an empty page ({}). Returning no sections.", page == null ? "null" : page.entityKey());
            return List.of();
        }
        Document doc = Jsoup.parse(page.html(), page.sourceUrl() == null ? "" : page.sourceUrl());
        PageContext ctx = new PageContext();
        walk(doc.body(), DEFAULT_SECTION_TITLE, ctx);
        List<RawSection> sections = ctx.build();
        int fieldCount = sections.stream().mapToInt(s -> s.fields().size()).sum();
        long triggers = sections.stream().flatMap(s -> s.fields().stream()).filter(RawField::artifactBearing).count();
        logger.info("Extracted {} sections, {} fields ({} artifact-bearing) from {}", sections.size(), fieldCount, triggers, page.entityKey());
        return sections;
    }

    // --- Document walk ---

    private String walk(Element element, String currentTitle, PageContext ctx) {
        String title = currentTitle;
        for (Element child : element.children()) {
            if (isHeading(child)) {
                String heading = Utils.collapseWhitespace(child.text());
                if (!heading.isEmpty()) {
                    title = heading;
                    if (!isInlineBold(child)) ctx.section(title);
                }
                continue;
            }
            if (child.normalName().equals("table")) {
                try {
                    title = parseTable(child, title, ctx);
                } catch (RuntimeException e) {
                    logger.warn("Failed to parse table in section '{}': {}", title, e.getMessage());
                    ctx.section(title).warnings.add(new ProcessingWarning(WarningKind.EXTRACTION_FAILURE, title,
                        "Table could not be parsed: " + e.getMessage()));
                }
                continue;
            }
            if (child.normalName().equals("label")) {
                try {
                    parseFormLabel(child, title, ctx);
                } catch (RuntimeException e) {
                    logger.warn("Failed to parse label in section '{}': {}", title, e.getMessage());
                    ctx.section(title).warnings.add(new ProcessingWarning(WarningKind.EXTRACTION_FAILURE, title,
                        "Label could not be parsed: " + e.getMessage()));
                }
                continue;
            }
            title = walk(child, title, ctx);
        }
        return title;
    }

    private boolean isHeading(Element el) {
        String tag = el.normalName();
        if (HEADING_TAGS.contains(tag)) return true;
        for (String cls : el.classNames()) {
            if (HEADING_CLASSES.contains(cls) && el.select("table, label").isEmpty()) return true;
        }
        if (isInlineBold(el)) {
            return el.closest("td, th, label, a, button") == null && el.text().length() <= 120;
        }
        return false;
    }

    private static boolean isInlineBold(Element el) {
        return el.normalName().equals("strong") || el.normalName().equals("b");
    }

    // --- Tables ---

    private String parseTable(Element table, String currentTitle, PageContext ctx) {
        List<Element> rows = ownRows(table);
        String title = currentTitle;
        int start = 0;
        while (start < rows.size() && isTitleRow(cells(rows.get(start)))) {
            title = Utils.collapseWhitespace(rows.get(start).text());
            ctx.section(title);
            start++;
        }
        rows = rows.subList(start, rows.size());
        if (rows.isEmpty()) return title;
        if (isDataTable(rows)) {
            parseDataTable(rows, title, ctx);
            return title;
        }
        for (int i = 0; i < rows.size(); i++) {
            Element row = rows.get(i);
            List<Element> cells = cells(row);
            if (cells.isEmpty()) continue;
            if (!row.select("table").isEmpty()) {
                for (Element cell : cells) title = walk(cell, title, ctx);
                continue;
            }
            if (isTitleRow(cells)) {
                title = Utils.collapseWhitespace(cells.get(0).text());
                ctx.section(title);
                continue;
            }
            if (cells.size() < 2) continue;
            if (isAlternatingPairs(cells)) {
                for (int c = 0; c + 1 < cells.size(); c += 2) {
                    addField(ctx.section(title), cells.get(c), List.of(cells.get(c + 1)));
                }
                continue;
            }
            Element labelCell = cells.get(0);
            List<Element> valueCells = new ArrayList<>(cells.subList(1, cells.size()));
            int span = rowspan(labelCell);
            for (int extra = 1; extra < span && i + 1 < rows.size(); extra++) {
                i++;
                valueCells.addAll(cells(rows.get(i)));
            }
            addField(ctx.section(title), labelCell, valueCells);
        }
        return title;
    }

    private void parseDataTable(List<Element> rows, String title, PageContext ctx) {
        SectionBuilder section = ctx.section(title);
        List<String> headers = new ArrayList<>();
        for (Element cell : cells(rows.get(0))) headers.add(Utils.collapseWhitespace(cell.text()));
        List<List<String>> data = new ArrayList<>();
        for (Element row : rows.subList(1, rows.size())) {
            List<Element> cells = cells(row);
            List<String> values = new ArrayList<>();
            for (Element cell : cells) values.add(valueText(cell));
            if (values.stream().allMatch(String::isEmpty)) continue;
            data.add(values);
            if (findTrigger(row) != null) {
                addDataRowField(section, cells, headers, data.size());
            }
        }
        if (!data.isEmpty()) section.tables.add(new RawTable(headers, data));
    }

    private void addDataRowField(SectionBuilder section, List<Element> cells, List<String> headers, int rowNumber) {
        Element labelCell = null;
        for (Element cell : cells) {
            String text = Utils.collapseWhitespace(cell.text());
            if (!text.isEmpty() && !isNumeric(text) && findTrigger(cell) == null) {
                labelCell = cell;
                break;
            }
        }
        // The row's other cells stay in the RawTable; the field carries only the trigger or link cells.
        List<Element> valueCells = new ArrayList<>();
        for (Element cell : cells) {
            if (cell != labelCell && (findTrigger(cell) != null || !explicitLinks(cell).isEmpty())) valueCells.add(cell);
        }
        String label;
        if (labelCell != null) {
            label = cleanLabel(labelCell.text());
        } else {
            String header = headers.isEmpty() ? "Row" : headers.get(0);
            label = cleanLabel(header) + " " + rowNumber;
        }
        section.fields.add(buildField(label, valueCells));
    }

    private static boolean isNumeric(String text) {
        return text.matches("[0-9.]+");
    }

    private List<Element> ownRows(Element table) {
        List<Element> rows = new ArrayList<>();
        for (Element row : table.select("tr")) {
            if (row.closest("table") == table) rows.add(row);
        }
        return rows;
    }

    private static List<Element> cells(Element row) {
        List<Element> cells = new ArrayList<>();
        for (Element child : row.children()) {
            if (child.normalName().equals("td") || child.normalName().equals("th")) cells.add(child);
        }
        return cells;
    }

    private boolean isDataTable(List<Element> rows) {
        if (rows.size() < 2) return false;
        List<Element> first = cells(rows.get(0));
        if (first.size() < 2) return false;
        for (Element cell : first) {
            if (!cell.normalName().equals("th")) return false;
        }
        return true;
    }

    private boolean isTitleRow(List<Element> cells) {
        if (cells.size() != 1) return false;
        Element cell = cells.get(0);
        if (Utils.collapseWhitespace(cell.text()).isEmpty() || findTrigger(cell) != null) return false;
        return cell.normalName().equals("th") || colspan(cell) > 1;
    }

    private boolean isAlternatingPairs(List<Element> cells) {
        if (cells.size() < 4 || cells.size() % 2 != 0) return false;
        for (int c = 0; c < cells.size(); c += 2) {
            if (cells.get(c).selectFirst("label") == null) return false;
        }
        return true;
    }

    private static int rowspan(Element cell) {
        return intAttr(cell, "rowspan");
    }

    private static int colspan(Element cell) {
        return intAttr(cell, "colspan");
    }

    private static int intAttr(Element cell, String attr) {
        String value = cell.attr(attr).trim();
        if (value.isEmpty()) return 1;
        try {
            return Math.max(1, Integer.parseInt(value));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    // --- Form labels outside tables ---

    private void parseFormLabel(Element label, String title, PageContext ctx) {
        String labelText = cleanLabel(label.text());
        if (labelText.isEmpty()) return;
        List<Element> valueElements = new ArrayList<>();
        String inlineText = null;
        for (Node sibling = label.nextSibling(); sibling != null; sibling = sibling.nextSibling()) {
            if (sibling instanceof TextNode textNode) {
                String text = Utils.collapseWhitespace(textNode.text());
                if (!text.isEmpty() && !text.equals(":")) {
                    inlineText = text.replaceFirst("^:\\s*", "");
                    break;
                }
            } else if (sibling instanceof Element el) {
                if (el.normalName().equals("label")) break;
                valueElements.add(el);
                if (!valueText(el).isEmpty() || findTrigger(el) != null) break;
            }
        }
        if (inlineText == null && valueElements.stream().allMatch(el -> valueText(el).isEmpty() && findTrigger(el) == null)) {
            Element column = label.parent() == null ? null : label.parent().nextElementSibling();
            if (column != null && column.selectFirst("label") == null) {
                valueElements = List.of(column);
            }
        }
        SectionBuilder section = ctx.section(title);
        if (inlineText != null) {
            section.fields.add(new RawField(labelText, Utils.normalizeLabel(labelText), inlineText, List.of(), null, null));
        } else {
            section.fields.add(buildField(labelText, valueElements));
        }
    }

    // --- Field construction ---

    private void addField(SectionBuilder section, Element labelCell, List<Element> valueCells) {
        String label = cleanLabel(labelCell.text());
        if (label.isEmpty()) return;
        section.fields.add(buildField(label, valueCells));
    }

    private RawField buildField(String label, List<Element> valueCells) {
        List<String> texts = new ArrayList<>();
        Set<String> links = new LinkedHashSet<>();
        Element trigger = null;
        for (Element cell : valueCells) {
            String text = valueText(cell);
            if (!text.isEmpty()) texts.add(text);
            links.addAll(explicitLinks(cell));
            if (trigger == null) trigger = findTrigger(cell);
        }
        String hint = trigger == null ? null : triggerHint(trigger);
        String triggerText = trigger == null ? null : triggerText(trigger);
        Integer index = trigger == null ? null : triggerIndex(trigger, hint);
        return new RawField(label, Utils.normalizeLabel(label), String.join(" ", texts), new ArrayList<>(links), hint,
            triggerText, index);
    }

    private static String cleanLabel(String text) {
        String collapsed = Utils.collapseWhitespace(text);
        return collapsed.replaceAll("[\\s:*]+$", "").replaceAll("^\\*\\s*", "").trim();
    }

    /**
     * Visible value of a cell. Form controls report their current value; a select still showing its
     * "Select ..." prompt counts as empty.
     */
    private String valueText(Element cell) {
        String formValue = formValue(cell);
        if (formValue != null) return Utils.collapseWhitespace(formValue);
        return Utils.collapseWhitespace(cell.text());
    }

    private String formValue(Element el) {
        String tag = el.normalName();
        if (tag.equals("input")) {
            String type = el.attr("type").toLowerCase(Locale.ROOT);
            if (type.isEmpty()) type = "text";
            if (Set.of("hidden", "submit", "button", "reset", "image", "file").contains(type)) return null;
            if (type.equals("checkbox") || type.equals("radio")) {
                return el.hasAttr("checked") ? (el.attr("value").isEmpty() ? "on" : el.attr("value")) : null;
            }
            return el.attr("value");
        }
        if (tag.equals("textarea")) return el.text();
        if (tag.equals("select")) {
            Element selected = el.selectFirst("option[selected]");
            if (selected == null) selected = el.selectFirst("option");
            if (selected == null) return "";
            String optionText = Utils.collapseWhitespace(selected.text());
            String lowered = optionText.toLowerCase(Locale.ROOT);
            if (lowered.startsWith("select") || lowered.equals("please select") || (optionText.isEmpty() && Set.of("", "0", "-1").contains(selected.attr("value").trim()))) {
                return "";
            }
            return optionText.isEmpty() ? selected.attr("value") : optionText;
        }
        for (Element control : el.select("input, select, textarea")) {
            if (control == el) continue;
            String value = formValue(control);
            if (value != null) return value;
        }
        return null;
    }

    private List<String> explicitLinks(Element cell) {
        List<String> links = new ArrayList<>();
        for (Element anchor : cell.select("a[href]")) {
            String href = anchor.attr("href").trim();
            String lowered = href.toLowerCase(Locale.ROOT);
            if (href.isEmpty() || href.startsWith("#") || lowered.startsWith("javascript:")
                || lowered.startsWith("mailto:") || lowered.startsWith("tel:")) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            links.add(absolute.isEmpty() ? href : absolute);
        }
        return links;
    }

    private Element findTrigger(Element scope) {
        for (Element el : scope.select(TriggerHints.TRIGGER_SELECTOR)) {
            if (TRIGGER_MARKER.matcher(triggerText(el)).find()) return el;
        }
        return null;
    }

    private static String triggerText(Element el) {
        String text = el.normalName().equals("input") ? el.attr("value") : el.text();
        return Utils.collapseWhitespace(text);
    }

    /**
     * Stable locator for a trigger: {@code #id}, else {@code tag.class1.class2}, else its trimmed text.
     */
    static String triggerHint(Element el) {
        String id = el.id().trim();
        if (!id.isEmpty()) return "#" + id;
        Set<String> classes = el.classNames();
        classes.removeIf(String::isBlank);
        if (!classes.isEmpty()) {
            String hint = el.normalName() + "." + String.join(".", classes);
            if (TriggerHints.isClassHint(hint)) return hint;
        }
        return triggerText(el);
    }

    /**
     * Position of a trigger among the page's trigger elements that its hint also matches, in document order.
     * Class hints are narrowed by visible text, the same way the browsing session narrows them.
     */
    static int triggerIndex(Element trigger, String hint) {
        Document doc = trigger.ownerDocument();
        if (doc == null) return 0;
        String text = triggerText(trigger);
        int index = 0;
        for (Element candidate : doc.select(TriggerHints.TRIGGER_SELECTOR)) {
            if (candidate == trigger) return index;
            if (matchesHint(candidate, hint, text)) index++;
        }
        return 0;
    }

    private static boolean matchesHint(Element candidate, String hint, String text) {
        if (TriggerHints.isIdHint(hint)) {
            return candidate.id().equals(hint.substring(1));
        }
        if (TriggerHints.isClassHint(hint)) {
            return candidate.normalName().equals(TriggerHints.tag(hint))
                && candidate.classNames().containsAll(TriggerHints.classes(hint))
                && triggerText(candidate).equalsIgnoreCase(text);
        }
        return triggerText(candidate).equalsIgnoreCase(hint);
    }

    // --- Section accumulation ---

    private static final class SectionBuilder {
        private final String title;
        private final List<RawField> fields = new ArrayList<>();
        private final List<RawTable> tables = new ArrayList<>();
        private final List<ProcessingWarning> warnings = new ArrayList<>();

        private SectionBuilder(String title) {
            this.title = title;
        }
    }

    private static final class PageContext {
        private final Map<String, SectionBuilder> sections = new LinkedHashMap<>();

        SectionBuilder section(String title) {
            return sections.computeIfAbsent(title, SectionBuilder::new);
        }

        List<RawSection> build() {
            List<RawSection> result = new ArrayList<>();
            for (SectionBuilder b : sections.values()) {
                result.add(new RawSection(b.title, b.fields, b.tables, b.warnings));
            }
            return result;
        }
    }
}
