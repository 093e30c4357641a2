package org.carball.expectedqueries.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.expectedqueries.model.expectation.ExpectationSpec;
import org.carball.expectedqueries.model.expectation.InvalidExpectationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads expectation specs from YAML or JSON documents shaped as
 * {@code table -> operation -> outcome}. A null outcome ({@code ~} in YAML) means don't care.
 * Comparison strings starting with {@code >} or {@code <} must be quoted in YAML.
 */
@Slf4j
public final class ExpectationSpecLoader {

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ExpectationSpecLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Loads a spec file; {@code .json} files are read as JSON, everything else as YAML.
     */
    public static ExpectationSpec load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Expectation file not found: " + file);
        }

        String content = Files.readString(file);
        boolean json = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
        log.debug("Loading expectations from {} as {}", file, json ? "JSON" : "YAML");
        return json ? fromJson(content) : fromYaml(content);
    }

    public static ExpectationSpec fromYaml(String yaml) {
        return read(YAML_MAPPER, yaml, "YAML");
    }

    public static ExpectationSpec fromJson(String json) {
        return read(JSON_MAPPER, json, "JSON");
    }

    private static ExpectationSpec read(ObjectMapper mapper, String content, String format) {
        if (content == null || content.isBlank()) {
            return ExpectationSpec.empty();
        }

        Map<String, Object> document;
        try {
            document = mapper.readValue(content, DOCUMENT_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Error parsing {} expectations: {}", format, e.getOriginalMessage());
            throw new InvalidExpectationException("Invalid " + format + " expectations: " + e.getOriginalMessage(), e);
        }

        return ExpectationSpec.fromMap(document);
    }
}
