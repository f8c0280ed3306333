package com.micaixbrl.core.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.micaixbrl.core.model.WhitepaperData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads {@link WhitepaperData} records from JSON or YAML files.
 *
 * <p>The format follows the file extension: {@code .yaml} and {@code .yml} are read as
 * YAML, everything else as JSON. Unknown properties are ignored.</p>
 */
public final class WhitepaperReader {

    private static final Logger log = LoggerFactory.getLogger(WhitepaperReader.class);

    private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());
    private static final ObjectMapper YAML_MAPPER = configure(new ObjectMapper(new YAMLFactory()));

    private WhitepaperReader() {
        // Utility class
    }

    /**
     * Reads a record.
     *
     * @param path JSON or YAML file
     * @return record
     * @throws UncheckedIOException if the file cannot be read or parsed
     */
    public static WhitepaperData read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new UncheckedIOException(new IOException("White paper record not found: " + path));
        }
        try {
            WhitepaperData data = mapperFor(path).readValue(path.toFile(), WhitepaperData.class);
            if (data == null) {
                throw new IOException("White paper record is empty: " + path);
            }
            log.debug("Read white paper record from {}", path);
            return data;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read white paper record: " + path, e);
        }
    }

    /**
     * Parses a JSON record held in memory.
     *
     * @param json JSON text
     * @return record
     */
    public static WhitepaperData fromJson(String json) {
        try {
            return JSON_MAPPER.readValue(json, WhitepaperData.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse white paper record", e);
        }
    }

    static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static ObjectMapper mapperFor(Path path) {
        return isYaml(path) ? YAML_MAPPER : JSON_MAPPER;
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
