package com.cgrera.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads and validates the synonym table JSON.
 * <p>
 * Expected layout:
 * <pre>
 * {
 *   "schema_version": "1.0",
 *   "documents_section": "documents",
 *   "postal_code": {"section": "project_details", "target_key": "pincode", "address_keys": ["project_address"]},
 *   "sections": [
 *     {
 *       "logical_section": "project_details",
 *       "section_title_variants": ["Project Details", "Project Information"],
 *       "keys": {"registration_number": ["Registration No", "RERA Registration Number"]},
 *       "field_types": {"launch_date": "date"}
 *     }
 *   ]
 * }
 * </pre>
 * Any structural problem is reported as a {@link ConfigurationException}; an empty or partial table cannot
 * produce a meaningful record, so nothing is defaulted.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public final class SynonymTableLoader {
    private static final Logger logger = LoggerFactory.getLogger(SynonymTableLoader.class);
    public static final String DEFAULT_RESOURCE = "synonym-table.json";

    private final ObjectMapper mapper = Utils.jsonMapper();

    /**
     * Loads the table from a file path.
     * @param path JSON file
     * @return validated table
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public SynonymTable load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Synonym table not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read synonym table " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads the table from the classpath.
     * @param resource resource name, e.g. {@value #DEFAULT_RESOURCE}
     * @return validated table
     * @throws ConfigurationException if the resource is missing or invalid
     */
    public SynonymTable loadResource(String resource) {
        InputStream in = SynonymTableLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigurationException("Synonym table resource not found on classpath: " + resource);
        }
        try (in) {
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read synonym table resource " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads from a path when one is given, otherwise from the bundled default resource.
     */
    public SynonymTable loadConfigured(String pathOrNull) {
        if (Utils.isBlank(pathOrNull)) return loadResource(DEFAULT_RESOURCE);
        return load(Path.of(pathOrNull));
    }

    SynonymTable parse(InputStream in, String origin) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Synonym table " + origin + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Synonym table " + origin + " must be a JSON object");
        }
        JsonNode sectionsNode = root.path("sections");
        if (!sectionsNode.isArray() || sectionsNode.isEmpty()) {
            throw new ConfigurationException("Synonym table " + origin + " declares no sections");
        }
        List<SynonymTable.LogicalSection> sections = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int index = 0;
        for (JsonNode sectionNode : sectionsNode) {
            SynonymTable.LogicalSection section = parseSection(sectionNode, origin, index++);
            if (!names.add(section.name())) {
                throw new ConfigurationException("Synonym table " + origin + " declares logical section '" + section.name() + "' twice");
            }
            sections.add(section);
        }
        String documentsSection = textOrNull(root.get("documents_section"));
        SynonymTable.PostalCodeRule postalCodeRule = parsePostalCodeRule(root.get("postal_code"), sections, origin);
        String schemaVersion = textOrNull(root.get("schema_version"));
        SynonymTable table = new SynonymTable(schemaVersion == null ? CanonicalRecord.SCHEMA_VERSION : schemaVersion,
            sections, documentsSection, postalCodeRule);
        logger.info("Loaded synonym table from {}: {} logical sections, {} canonical keys", origin, sections.size(),
            sections.stream().mapToInt(s -> s.keys().size()).sum());
        return table;
    }

    private SynonymTable.LogicalSection parseSection(JsonNode node, String origin, int index) {
        String where = origin + " sections[" + index + "]";
        if (!node.isObject()) {
            throw new ConfigurationException(where + " must be an object");
        }
        String name = textOrNull(node.get("logical_section"));
        if (Utils.isBlank(name)) {
            throw new ConfigurationException(where + " is missing 'logical_section'");
        }
        List<String> titles = stringList(node.get("section_title_variants"), where + ".section_title_variants");
        if (titles.isEmpty()) {
            throw new ConfigurationException(where + " (" + name + ") needs at least one section title variant");
        }
        JsonNode keysNode = node.get("keys");
        if (keysNode == null || !keysNode.isObject() || keysNode.isEmpty()) {
            throw new ConfigurationException(where + " (" + name + ") declares no canonical keys");
        }
        Map<String, List<String>> keys = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = keysNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            List<String> variants = stringList(entry.getValue(), where + ".keys." + entry.getKey());
            if (variants.isEmpty()) {
                throw new ConfigurationException(where + ".keys." + entry.getKey() + " has no label variants");
            }
            keys.put(entry.getKey(), variants);
        }
        Map<String, FieldType> types = new LinkedHashMap<>();
        JsonNode typesNode = node.get("field_types");
        if (typesNode != null && !typesNode.isNull()) {
            if (!typesNode.isObject()) {
                throw new ConfigurationException(where + ".field_types must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> typeIt = typesNode.fields();
            while (typeIt.hasNext()) {
                Map.Entry<String, JsonNode> entry = typeIt.next();
                if (!keys.containsKey(entry.getKey())) {
                    throw new ConfigurationException(where + ".field_types references unknown key '" + entry.getKey() + "'");
                }
                try {
                    types.put(entry.getKey(), FieldType.parse(entry.getValue().asText()));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(where + ".field_types." + entry.getKey() + " has unknown type '" + entry.getValue().asText() + "'", e);
                }
            }
        }
        return new SynonymTable.LogicalSection(name, titles, keys, types);
    }

    private SynonymTable.PostalCodeRule parsePostalCodeRule(JsonNode node, List<SynonymTable.LogicalSection> sections, String origin) {
        if (node == null || node.isNull()) return null;
        String where = origin + " postal_code";
        String section = textOrNull(node.get("section"));
        String target = textOrNull(node.get("target_key"));
        List<String> addressKeys = stringList(node.get("address_keys"), where + ".address_keys");
        if (Utils.isBlank(section) || Utils.isBlank(target) || addressKeys.isEmpty()) {
            throw new ConfigurationException(where + " needs 'section', 'target_key' and 'address_keys'");
        }
        SynonymTable.LogicalSection logical = sections.stream().filter(s -> s.name().equals(section)).findFirst()
            .orElseThrow(() -> new ConfigurationException(where + " references unknown section '" + section + "'"));
        for (String key : addressKeys) {
            if (!logical.keys().containsKey(key)) {
                throw new ConfigurationException(where + " references unknown address key '" + key + "'");
            }
        }
        return new SynonymTable.PostalCodeRule(section, target, addressKeys);
    }

    private static List<String> stringList(JsonNode node, String where) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) return values;
        if (!node.isArray()) {
            throw new ConfigurationException(where + " must be an array of strings");
        }
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new ConfigurationException(where + " contains a blank or non-string entry");
            }
            values.add(item.asText());
        }
        return values;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
