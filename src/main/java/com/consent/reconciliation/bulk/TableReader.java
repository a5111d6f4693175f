package com.consent.reconciliation.bulk;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads an input file into a {@link RawTable}.
 * Implementations handle one physical format (CSV, JSON, ...).
 */
public interface TableReader {

    /**
     * Reads a table from a reader.
     *
     * @param reader the reader to read from
     * @param source a label for log and warning messages
     * @return the table, empty if the input is empty
     * @throws TableReadException if the input is not a table in this format
     */
    RawTable read(Reader reader, String source);

    /**
     * Reads a UTF-8 encoded table from an input stream.
     */
    default RawTable read(InputStream input, String source) {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8), source);
    }

    /**
     * Reads a UTF-8 encoded table from a file.
     */
    default RawTable read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.getFileName().toString());
        } catch (IOException e) {
            throw new TableReadException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the format supported by this reader (e.g., "csv", "json").
     */
    String getFormat();
}
