package com.cgrera.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * JSON storage of canonical records under {@code <output>/records/<entity>.json}.
 */
public class RecordStore {
    private static final Logger logger = LoggerFactory.getLogger(RecordStore.class);

    public static final String RECORDS_DIR = "records";

    private final Path recordsDir;
    private final ObjectMapper mapper = Utils.jsonMapper();

    public RecordStore(Path outputDir) {
        this.recordsDir = outputDir.resolve(RECORDS_DIR);
    }

    public Path recordsDir() {
        return recordsDir;
    }

    public String toJson(CanonicalRecord record) throws JsonProcessingException {
        return mapper.writeValueAsString(record);
    }

    public Path write(CanonicalRecord record) throws IOException {
        Files.createDirectories(recordsDir);
        Path file = recordsDir.resolve(Utils.sanitizeFilename(record.getEntityKey()) + ".json");
        Files.writeString(file, toJson(record), StandardCharsets.UTF_8);
        logger.debug("Wrote record {} to {}", record.getEntityKey(), file);
        return file;
    }

    public CanonicalRecord read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), CanonicalRecord.class);
    }

    /**
     * @return every stored record, sorted by entity key
     */
    public List<CanonicalRecord> readAll() throws IOException {
        List<CanonicalRecord> records = new ArrayList<>();
        if (!Files.isDirectory(recordsDir)) return records;
        List<Path> files;
        try (Stream<Path> stream = Files.list(recordsDir)) {
            files = stream.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList();
        }
        for (Path file : files) {
            records.add(read(file));
        }
        records.sort(Comparator.comparing(CanonicalRecord::getEntityKey));
        return records;
    }
}
