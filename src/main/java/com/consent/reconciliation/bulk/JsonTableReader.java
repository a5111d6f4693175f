package com.consent.reconciliation.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON table reader.
 *
 * <p>Expected format: an array of flat objects, one per row.</p>
 * <pre>
 * [
 *   {"mnpaid": "1001", "eosdat": "2021-03-01", "dthdat": null},
 *   {"mnpaid": "1002", "eosdat": "2021-05-12"}
 * ]
 * </pre>
 *
 * <p>The headers are the union of all field names in first-seen order. Missing and
 * null fields read as empty cells; numbers and booleans read as their JSON text.</p>
 */
public class JsonTableReader implements TableReader {
    private static final Logger log = LoggerFactory.getLogger(JsonTableReader.class);

    private final ObjectMapper objectMapper;

    public JsonTableReader() {
        this(new ObjectMapper());
    }

    public JsonTableReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public RawTable read(Reader reader, String source) {
        JsonNode root;
        try (reader) {
            root = objectMapper.readTree(reader);
        } catch (IOException e) {
            log.error("table.read.failed source={} error={}", source, e.getMessage());
            throw new TableReadException("Invalid JSON in " + source + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return RawTable.empty(source);
        }
        if (!root.isArray()) {
            throw new TableReadException("Expected a JSON array of objects in " + source);
        }

        Set<String> headerSet = new LinkedHashSet<>();
        for (JsonNode record : root) {
            if (record.isObject()) {
                record.fieldNames().forEachRemaining(headerSet::add);
            }
        }
        List<String> headers = List.copyOf(headerSet);

        List<RawTable.Row> rows = new ArrayList<>();
        long recordNumber = 0;
        for (JsonNode record : root) {
            recordNumber++;
            if (!record.isObject()) {
                log.warn("table.record.skipped source={} record={} reason=not-an-object", source, recordNumber);
                continue;
            }
            List<String> values = new ArrayList<>(headers.size());
            for (String header : headers) {
                values.add(text(record.get(header)));
            }
            rows.add(new RawTable.Row(recordNumber, values));
        }

        log.info("table.read source={} format=json columns={} rows={}", source, headers.size(), rows.size());
        return new RawTable(source, headers, rows);
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }
}
