package com.cgrera.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Type-specific normalization of canonical values.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Dates are tried against a fixed priority list of portal formats and re-emitted as {@code yyyy-MM-dd}.
 *   When the whole string does not parse, a date embedded in it ("Valid till 31/12/2026") is tried.</li>
 *   <li>Integers and decimals drop thousands separators and units.</li>
 *   <li>Postal codes are the first run of exactly six digits bounded by non-digits.</li>
 * </ul>
 * A parse miss returns an empty Optional; callers keep the original string and record a warning, values are
 * never coerced.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class FieldNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(FieldNormalizer.class);

    private static final List<DateTimeFormatter> DATE_FORMATTERS = List.of(
        strict("d/M/uuuu"),
        strict("d-M-uuuu"),
        strict("d.M.uuuu"),
        strict("uuuu-M-d"),
        strict("d MMM uuuu"),
        strict("d MMMM uuuu"),
        strict("uuuu/M/d")
    );

    private static final Pattern EMBEDDED_DATE = Pattern.compile(
        "\\d{1,2}[/.\\-]\\d{1,2}[/.\\-]\\d{4}|\\d{4}[/\\-]\\d{1,2}[/\\-]\\d{1,2}|\\d{1,2}\\s+[A-Za-z]{3,9}\\s+\\d{4}");
    private static final Pattern POSTAL_CODE = Pattern.compile("(?<!\\d)(\\d{6})(?!\\d)");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Normalizes a date to ISO {@code yyyy-MM-dd}.
     * @param value raw date text
     * @return normalized date, empty when no known format matches
     */
    public Optional<String> normalizeDate(String value) {
        String text = Utils.collapseWhitespace(value);
        if (text.isEmpty()) return Optional.empty();
        Optional<LocalDate> parsed = parseDate(text);
        if (parsed.isEmpty()) {
            Matcher m = EMBEDDED_DATE.matcher(text);
            while (m.find() && parsed.isEmpty()) {
                parsed = parseDate(m.group());
            }
        }
        if (parsed.isEmpty()) {
            logger.debug("No date format matched '{}'", text);
        }
        return parsed.map(DateTimeFormatter.ISO_LOCAL_DATE::format);
    }

    private Optional<LocalDate> parseDate(String text) {
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return Optional.of(LocalDate.parse(text, formatter));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    /**
     * Extracts the digits of an integer value ("1,250 units" → "1250").
     */
    public Optional<String> normalizeInteger(String value) {
        String digits = Utils.collapseWhitespace(value).replaceAll("[^0-9]", "");
        if (digits.isEmpty()) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(digits).toBigInteger().toString());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Extracts the first decimal number of a value ("4,046.86 sq m" → "4046.86").
     */
    public Optional<String> normalizeDecimal(String value) {
        String cleaned = Utils.collapseWhitespace(value).replace(",", "");
        Matcher m = DECIMAL.matcher(cleaned);
        if (!m.find()) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(m.group()).stripTrailingZeros().toPlainString());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Normalizes a value according to its declared type. Text is only whitespace-collapsed.
     */
    public Optional<String> normalize(FieldType type, String value) {
        return switch (type) {
            case DATE -> normalizeDate(value);
            case INTEGER -> normalizeInteger(value);
            case DECIMAL -> normalizeDecimal(value);
            case TEXT -> Optional.of(Utils.collapseWhitespace(value));
        };
    }

    /**
     * Finds a six digit postal code in an address.
     * @param address address text (may be null)
     * @return the first six digit run bounded by non-digits, empty when there is none
     */
    public Optional<String> extractPostalCode(String address) {
        if (Utils.isBlank(address)) return Optional.empty();
        Matcher m = POSTAL_CODE.matcher(address);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
