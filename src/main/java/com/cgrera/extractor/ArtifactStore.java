package com.cgrera.extractor;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File storage for captured artifacts.
 * <p>
 * Layout under the output directory:
 * <pre>
 * previews/&lt;entity&gt;/&lt;field_key&gt;/preview.&lt;ext&gt;
 * previews/&lt;entity&gt;/&lt;field_key&gt;/modal_1.html, modal_1.png
 * previews/&lt;entity&gt;/metadata.json
 * </pre>
 * Paths stored in artifact records are relative to the output directory and use forward slashes.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class ArtifactStore {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String PREVIEWS_DIR = "previews";
    public static final String METADATA_FILE = "metadata.json";

    private final Path outputDir;
    private final ObjectMapper mapper = Utils.jsonMapper();

    public ArtifactStore(Path outputDir) {
        if (outputDir == null) throw new IllegalArgumentException("outputDir cannot be null");
        this.outputDir = outputDir;
    }

    public Path outputDir() {
        return outputDir;
    }

    public Path previewDir(String entityKey) {
        return outputDir.resolve(PREVIEWS_DIR).resolve(Utils.sanitizeFilename(entityKey));
    }

    /**
     * Writes captured content to {@code preview.<ext>} in the field's directory. Inline modal content goes to
     * {@code modal_1.html}, with its screenshot, when one was taken, in {@code modal_1.png}.
     * @return persisted paths relative to the output directory
     * @throws IOException if the file cannot be written
     */
    public List<String> persist(String entityKey, String fieldKey, CapturedPage page) throws IOException {
        Path dir = previewDir(entityKey).resolve(Utils.sanitizeFilename(fieldKey));
        Files.createDirectories(dir);
        String base = page.inlineModal() ? "modal_1" : "preview";
        Path file = dir.resolve(base + ArtifactType.extensionFor(page.contentType()));
        Files.write(file, page.body());
        String relative = outputDir.relativize(file).toString().replace('\\', '/');
        logger.debug("Stored {} bytes for {}/{} at {}", page.body().length, entityKey, fieldKey, relative);
        if (page.screenshot() == null) return List.of(relative);
        Path shot = dir.resolve(base + ".png");
        Files.write(shot, page.screenshot());
        return List.of(relative, outputDir.relativize(shot).toString().replace('\\', '/'));
    }

    /**
     * Writes the artifact records of one entity to its {@value #METADATA_FILE}.
     */
    public Path writeMetadata(String entityKey, Map<String, ArtifactRecord> artifacts) throws IOException {
        Path dir = previewDir(entityKey);
        Files.createDirectories(dir);
        Path file = dir.resolve(METADATA_FILE);
        mapper.writeValue(file.toFile(), artifacts);
        logger.info("Wrote artifact metadata for {} ({} records) to {}", entityKey, artifacts.size(), file);
        return file;
    }

    /**
     * Reads the artifact metadata of one entity.
     * @return field key → artifact record, empty when no metadata was written
     */
    public Map<String, ArtifactRecord> readMetadata(String entityKey) throws IOException {
        Path file = previewDir(entityKey).resolve(METADATA_FILE);
        if (!Files.exists(file)) return new LinkedHashMap<>();
        return mapper.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, ArtifactRecord>>() {});
    }
}
