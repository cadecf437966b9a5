package com.papertrail.core.io;

import com.papertrail.core.model.DataQualityWarning;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.RawRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonRecordImporter")
class JsonRecordImporterTest {

    private final JsonRecordImporter importer = new JsonRecordImporter();

    @Test
    @DisplayName("Should read a JSON array of records")
    void testArray() {
        String json = """
                [
                  {"id": "philgeps:1", "kind": "contractor", "name": "Acme Builders, Inc.",
                   "address": "12 Rizal St.", "registration_number": "CS201912345",
                   "source_system": "PHILGEPS", "retrieved_at": "2024-03-01T08:00:00Z"},
                  {"id": "dbm:9", "kind": "Agency", "name": "DPWH Region VII"}
                ]
                """;

        RawRecordBatch batch = importer.read(json);

        assertEquals(2, batch.size());
        assertTrue(batch.warnings().isEmpty());
        RawRecord first = batch.records().get(0);
        assertEquals("philgeps:1", first.getId());
        assertEquals(EntityKind.CONTRACTOR, first.getKind());
        assertEquals("CS201912345", first.getRegistrationNumber());
        assertEquals(Instant.parse("2024-03-01T08:00:00Z"), first.getRetrievedAt());
        assertEquals(EntityKind.AGENCY, batch.records().get(1).getKind());
        assertEquals(1, batch.ofKind(EntityKind.AGENCY).size());
    }

    @Test
    @DisplayName("Should read JSON lines and keep the good lines around bad ones")
    void testJsonLines() throws IOException {
        String lines = """
                {"id": "a", "kind": "person", "name": "Juan dela Cruz"}
                {not json
                {"kind": "person", "name": "No Id"}

                {"id": "b", "kind": "spaceship", "name": "Unknown"}
                {"id": "c", "kind": "politician", "name": "Hon. Maria Santos", "retrieved_at": "yesterday"}
                """;

        RawRecordBatch batch = importer.read(new ByteArrayInputStream(lines.getBytes(StandardCharsets.UTF_8)));

        assertEquals(List.of("a", "c"), batch.records().stream().map(RawRecord::getId).toList());
        assertNull(batch.records().get(1).getRetrievedAt());
        assertEquals(List.of("json", "id", "kind", "retrieved_at"),
                batch.warnings().stream().map(DataQualityWarning::field).toList());
        assertEquals("line 2", batch.warnings().get(0).recordId());
        assertEquals("b", batch.warnings().get(2).recordId());
    }

    @Test
    @DisplayName("Should apply the default kind and require one otherwise")
    void testDefaultKind() {
        String json = "[{\"id\": \"x\", \"name\": \"Golden Dragon Corp\"}]";

        RawRecordBatch defaulted = new JsonRecordImporter(EntityKind.CONTRACTOR).read(json);
        RawRecordBatch strict = importer.read(json);

        assertEquals(EntityKind.CONTRACTOR, defaulted.records().get(0).getKind());
        assertEquals(0, strict.size());
        assertEquals("kind", strict.warnings().get(0).field());
    }

    @Test
    @DisplayName("Should report a malformed array as a single warning")
    void testMalformedArray() {
        RawRecordBatch batch = importer.read("[{\"id\": \"x\",");

        assertEquals(0, batch.size());
        assertEquals(1, batch.warnings().size());
        assertEquals("batch", batch.warnings().get(0).recordId());
    }

    @Test
    @DisplayName("Should keep records with a missing name for the resolver to report")
    void testMissingNameKept() {
        RawRecordBatch batch = importer.read("{\"id\": \"x\", \"kind\": \"agency\", \"name\": \"  \"}");

        assertEquals(1, batch.size());
        assertFalse(batch.records().get(0).hasName());
    }

    @Test
    @DisplayName("Should merge batches keeping both warning lists")
    void testMerge() {
        RawRecordBatch a = importer.read("{\"id\": \"a\", \"kind\": \"agency\", \"name\": \"A\"}\n{bad");
        RawRecordBatch b = importer.read("{\"id\": \"b\", \"kind\": \"agency\", \"name\": \"B\"}");

        RawRecordBatch merged = a.merge(b);

        assertEquals(2, merged.size());
        assertEquals(1, merged.warnings().size());
    }
}
