package com.cgrera.extractor;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads persisted detail pages ({@code project_<key>.html}) from a directory, with source URLs taken from an
 * optional {@code index.csv} ({@code entity_key,source_url}).
 */
public class PersistedPageReader {
    private static final Logger logger = LoggerFactory.getLogger(PersistedPageReader.class);

    public static final String INDEX_FILE = "index.csv";
    private static final Pattern PAGE_FILE = Pattern.compile("^project_(.+)\\.html?$", Pattern.CASE_INSENSITIVE);

    /**
     * @return pages sorted by entity key
     * @throws IOException if the directory or the index cannot be read
     */
    public List<PersistedPage> readAll(Path pagesDir) throws IOException {
        if (!Files.isDirectory(pagesDir)) {
            throw new IOException("Pages directory not found: " + pagesDir);
        }
        Map<String, String> index = readIndex(pagesDir.resolve(INDEX_FILE));
        List<Path> files;
        try (Stream<Path> stream = Files.list(pagesDir)) {
            files = stream.filter(Files::isRegularFile)
                .filter(p -> PAGE_FILE.matcher(p.getFileName().toString()).matches())
                .toList();
        }
        List<PersistedPage> pages = new ArrayList<>();
        for (Path file : files) {
            pages.add(read(file, index));
        }
        pages.sort(Comparator.comparing(PersistedPage::entityKey));
        logger.info("Found {} persisted pages in {} ({} indexed source URLs)", pages.size(), pagesDir, index.size());
        return pages;
    }

    public PersistedPage read(Path file, Map<String, String> index) throws IOException {
        String entityKey = entityKey(file);
        String html = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return new PersistedPage(entityKey, file.getFileName().toString(), index == null ? null : index.get(entityKey), html);
    }

    static String entityKey(Path file) {
        String name = file.getFileName().toString();
        Matcher m = PAGE_FILE.matcher(name);
        if (m.matches()) return m.group(1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Reads {@code entity_key,source_url} rows. A header row is recognised by its first cell.
     * @return entity key → source URL, empty when the file does not exist
     */
    public Map<String, String> readIndex(Path indexFile) throws IOException {
        Map<String, String> index = new LinkedHashMap<>();
        if (!Files.exists(indexFile)) return index;
        try (Reader in = Files.newBufferedReader(indexFile, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length < 2 || Utils.isBlank(row[0]) || "entity_key".equalsIgnoreCase(row[0].trim())) continue;
                if (!Utils.isBlank(row[1])) index.put(row[0].trim(), row[1].trim());
            }
        } catch (CsvValidationException e) {
            throw new IOException("Invalid page index " + indexFile + ": " + e.getMessage(), e);
        }
        return index;
    }
}
