package com.papertrail.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.papertrail.core.model.DataQualityWarning;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Reads collector output into raw records.
 *
 * <p>Accepts either a JSON array of objects or JSON Lines, one object per line:</p>
 * <pre>
 * {"id": "philgeps:1042", "kind": "contractor", "name": "Acme Builders, Inc.",
 *  "address": "12 Rizal St., Quezon City", "registration_number": "CS201912345",
 *  "source_system": "PHILGEPS", "retrieved_at": "2024-03-01T08:00:00Z"}
 * </pre>
 *
 * <p>Entries without an id or with an unknown kind are skipped with a warning,
 * as are lines that are not valid JSON; the rest of the batch is kept. A
 * missing name is left for the resolver to report.</p>
 */
public class JsonRecordImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonRecordImporter.class);

    private final ObjectMapper objectMapper;
    private final EntityKind defaultKind;

    public JsonRecordImporter() {
        this(null);
    }

    /**
     * @param defaultKind kind for entries that carry none, or null to require one
     */
    public JsonRecordImporter(EntityKind defaultKind) {
        this.objectMapper = new ObjectMapper();
        this.defaultKind = defaultKind;
    }

    public RawRecordBatch read(InputStream input) throws IOException {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    public RawRecordBatch read(Reader reader) throws IOException {
        String content;
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            content = br.lines().collect(Collectors.joining("\n"));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        List<RawRecord> records = new ArrayList<>();
        List<DataQualityWarning> warnings = new ArrayList<>();
        if (content.stripLeading().startsWith("[")) {
            readArray(content, records, warnings);
        } else {
            readLines(content, records, warnings);
        }
        log.info("import.completed records={} warnings={}", records.size(), warnings.size());
        return new RawRecordBatch(records, warnings);
    }

    public RawRecordBatch read(String content) {
        try {
            return read(new StringReader(content));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void readArray(String content, List<RawRecord> records, List<DataQualityWarning> warnings) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            warn(warnings, "batch", "json", "Malformed JSON array: " + e.getOriginalMessage());
            return;
        }
        int index = 0;
        for (JsonNode node : root) {
            index++;
            convert(node, "element " + index, records, warnings);
        }
    }

    private void readLines(String content, List<RawRecord> records, List<DataQualityWarning> warnings) {
        String[] lines = content.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String position = "line " + (i + 1);
            try {
                convert(objectMapper.readTree(line), position, records, warnings);
            } catch (JsonProcessingException e) {
                warn(warnings, position, "json", "Malformed JSON: " + e.getOriginalMessage());
            }
        }
    }

    private void convert(JsonNode node, String position, List<RawRecord> records,
                         List<DataQualityWarning> warnings) {
        if (!node.isObject()) {
            warn(warnings, position, "json", "Expected an object");
            return;
        }
        String id = text(node, "id");
        if (id == null) {
            warn(warnings, position, "id", "Missing record id");
            return;
        }

        EntityKind kind = defaultKind;
        String kindText = text(node, "kind");
        if (kindText != null) {
            try {
                kind = EntityKind.valueOf(kindText.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                warn(warnings, id, "kind", "Unknown entity kind '" + kindText + "'");
                return;
            }
        }
        if (kind == null) {
            warn(warnings, id, "kind", "Missing entity kind");
            return;
        }

        Instant retrievedAt = null;
        String retrieved = text(node, "retrieved_at");
        if (retrieved != null) {
            try {
                retrievedAt = Instant.parse(retrieved);
            } catch (DateTimeParseException e) {
                warn(warnings, id, "retrieved_at", "Unparseable timestamp '" + retrieved + "'");
            }
        }

        records.add(RawRecord.builder()
                .id(id)
                .kind(kind)
                .name(text(node, "name"))
                .address(text(node, "address"))
                .registrationNumber(text(node, "registration_number"))
                .sourceSystem(text(node, "source_system"))
                .retrievedAt(retrievedAt)
                .build());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static void warn(List<DataQualityWarning> warnings, String recordId, String field, String reason) {
        warnings.add(new DataQualityWarning(recordId, field, reason));
        log.warn("import.skipped record={} field={} reason={}", recordId, field, reason);
    }
}
