package com.consent.reconciliation.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StudyMappingLoaderTest {

    private final StudyMappingLoader loader = new StudyMappingLoader();

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load a mapping with case-insensitive codes and field names")
    void loadsMapping() {
        StudyMapping mapping = loader.load(json("""
                {
                  "study": "MNP-2",
                  "columns": { "Pat_No": "participant_id", "ic_sign_dt": "SIGNATURE_DATE" },
                  "comment": "ignored"
                }
                """), "inline");

        assertEquals("MNP-2", mapping.getStudy());
        assertEquals(Optional.of(CanonicalField.PARTICIPANT_ID), mapping.lookup("PAT_NO"));
        assertEquals(Optional.of(CanonicalField.SIGNATURE_DATE), mapping.lookup("ic_sign_dt"));
        assertEquals(Optional.empty(), mapping.lookup("other"));
    }

    @Test
    @DisplayName("Should load from a file")
    void loadsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("study.json");
        Files.writeString(file, "{\"study\": \"S\", \"columns\": {\"end_dt\": \"EXIT_DATE\"}}");

        assertEquals(Optional.of(CanonicalField.EXIT_DATE), loader.load(file).lookup("end_dt"));
    }

    @Test
    @DisplayName("Unknown field names are rejected")
    void unknownField() {
        assertThrows(StudyMappingException.class,
                () -> loader.load(json("{\"columns\": {\"x\": \"NO_SUCH_FIELD\"}}"), "inline"));
    }

    @Test
    @DisplayName("Missing file is rejected")
    void missingFile(@TempDir Path dir) {
        assertThrows(StudyMappingException.class, () -> loader.load(dir.resolve("absent.json")));
    }

    @Test
    @DisplayName("A written mapping reads back to the same entries")
    void writesJson() {
        StudyMapping mapping = new StudyMapping("S", Map.of("pat_no", CanonicalField.PARTICIPANT_ID));

        String text = loader.toJson(mapping);
        StudyMapping reread = loader.load(json(text), "written");

        assertFalse(text.contains("empty"));
        assertEquals(mapping.getColumns(), reread.getColumns());
        assertEquals("S", reread.getStudy());
    }

    @Test
    @DisplayName("Missing sections yield an empty mapping")
    void emptyDocument() {
        StudyMapping mapping = loader.load(json("{}"), "inline");

        assertTrue(mapping.isEmpty());
        assertEquals("", mapping.getStudy());
    }
}
