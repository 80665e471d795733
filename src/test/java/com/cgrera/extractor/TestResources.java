package com.cgrera.extractor;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Classpath helpers shared by the tests.
 */
final class TestResources {
    static final String SAMPLE_URL = "https://rera.cgstate.gov.in/Promoter_Reg_Only_View_Application_new.aspx?MyID=100";

    private TestResources() {}

    static String read(String name) {
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) throw new IllegalStateException("Missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    static Path path(String name) {
        URL url = TestResources.class.getClassLoader().getResource(name);
        if (url == null) throw new IllegalStateException("Missing test resource " + name);
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static PersistedPage samplePage() {
        return new PersistedPage("PCGRERA100", "project_PCGRERA100.html", SAMPLE_URL, read("pages/project_PCGRERA100.html"));
    }

    static SynonymResolver bundledResolver() {
        return new SynonymResolver(new SynonymTableLoader().loadResource(SynonymTableLoader.DEFAULT_RESOURCE));
    }
}
