package com.consent.reconciliation.rules;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link StudyMapping} from JSON.
 */
public class StudyMappingLoader {
    private static final Logger log = LoggerFactory.getLogger(StudyMappingLoader.class);

    private final ObjectMapper objectMapper;

    public StudyMappingLoader() {
        this.objectMapper = JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
    }

    public StudyMapping load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new StudyMappingException("Cannot read study mapping " + path + ": " + e.getMessage(), e);
        }
    }

    public StudyMapping load(InputStream in, String source) {
        try {
            StudyMapping mapping = objectMapper.readValue(in, StudyMapping.class);
            log.info("mapping.loaded source={} study='{}' columns={}",
                    source, mapping.getStudy(), mapping.getColumns().size());
            return mapping;
        } catch (IOException e) {
            throw new StudyMappingException("Invalid study mapping " + source + ": " + e.getMessage(), e);
        }
    }

    public String toJson(StudyMapping mapping) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(mapping);
        } catch (IOException e) {
            throw new StudyMappingException("Cannot serialize study mapping: " + e.getMessage(), e);
        }
    }
}
