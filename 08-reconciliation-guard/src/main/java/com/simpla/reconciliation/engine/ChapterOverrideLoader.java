package com.simpla.reconciliation.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads chapter overrides from a JSON array.
 */
public final class ChapterOverrideLoader {

    private static final Logger log = LoggerFactory.getLogger(ChapterOverrideLoader.class);

    /** Overrides shipped with the service. */
    public static final String DEFAULT_RESOURCE = "chapter-overrides.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ChapterOverrideLoader() {}

    public static List<ChapterOverride> load(InputStream in) throws IOException {
        List<ChapterOverride> overrides = MAPPER.readValue(in, new TypeReference<List<ChapterOverride>>() {});
        List<ChapterOverride> valid = new ArrayList<>();
        for (ChapterOverride override : overrides) {
            if (override.getCapitulo() == null || override.getCapitulo().isBlank()) {
                throw new IOException("Chapter override without 'capitulo'");
            }
            if (override.getMotivo() == null || override.getMotivo().isBlank()) {
                throw new IOException("Chapter override for capitulo " + override.getCapitulo() + " does not document its 'motivo'");
            }
            valid.add(override);
        }
        log.info("Loaded {} chapter override(s)", valid.size());
        return valid;
    }

    public static List<ChapterOverride> load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /**
     * Loads {@link #DEFAULT_RESOURCE} from the classpath; empty when it is not packaged.
     */
    public static List<ChapterOverride> loadDefault() throws IOException {
        try (InputStream in = ChapterOverrideLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.warn("No {} on the classpath, chapter repeals rely on the statute only", DEFAULT_RESOURCE);
                return new ArrayList<>();
            }
            return load(in);
        }
    }
}
