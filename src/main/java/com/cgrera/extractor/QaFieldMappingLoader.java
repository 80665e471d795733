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
import java.util.List;
import java.util.regex.Pattern;

/**
 * Loads the QA field mapping.
 * <pre>
 * {"fields": [{"logical_path": "project_details.launch_date", "label": "Launch Date", "compare_as": "date"}]}
 * </pre>
 */
public final class QaFieldMappingLoader {
    private static final Logger logger = LoggerFactory.getLogger(QaFieldMappingLoader.class);
    public static final String DEFAULT_RESOURCE = "qa-field-mapping.json";

    static final Pattern LOGICAL_PATH = Pattern.compile("^(?:[a-z0-9_]+\\.[a-z0-9_]+|documents\\[\\d+]\\.[a-z_]+)$");

    private final ObjectMapper mapper = Utils.jsonMapper();

    public List<QaFieldMapping> loadConfigured(String pathOrNull) {
        if (Utils.isBlank(pathOrNull)) {
            InputStream in = QaFieldMappingLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
            if (in == null) throw new ConfigurationException("QA field mapping resource not found: " + DEFAULT_RESOURCE);
            try (in) {
                return parse(in, "classpath:" + DEFAULT_RESOURCE);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read QA field mapping: " + e.getMessage(), e);
            }
        }
        Path path = Path.of(pathOrNull);
        if (!Files.isRegularFile(path)) throw new ConfigurationException("QA field mapping not found: " + path);
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read QA field mapping " + path + ": " + e.getMessage(), e);
        }
    }

    List<QaFieldMapping> parse(InputStream in, String origin) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("QA field mapping " + origin + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode fields = root == null ? null : root.get("fields");
        if (fields == null || !fields.isArray() || fields.isEmpty()) {
            throw new ConfigurationException("QA field mapping " + origin + " declares no fields");
        }
        List<QaFieldMapping> mappings = new ArrayList<>();
        int index = 0;
        for (JsonNode node : fields) {
            String where = origin + " fields[" + index++ + "]";
            String path = node.path("logical_path").asText("");
            String label = node.path("label").asText("");
            if (!LOGICAL_PATH.matcher(path).matches()) {
                throw new ConfigurationException(where + " has an invalid logical_path '" + path + "'");
            }
            if (label.isBlank()) {
                throw new ConfigurationException(where + " is missing 'label'");
            }
            QaFieldMapping mapping = new QaFieldMapping(path, label, node.path("compare_as").asText(null));
            if (!QaFieldMapping.COMPARE_AS_TEXT.equals(mapping.compareAs()) && !mapping.comparesDates()) {
                throw new ConfigurationException(where + " has unknown compare_as '" + mapping.compareAs() + "'");
            }
            mappings.add(mapping);
        }
        logger.info("Loaded {} QA field mappings from {}", mappings.size(), origin);
        return mappings;
    }
}
