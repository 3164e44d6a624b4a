package com.document.verification.reconcile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OcrDocumentParserTest {

    private OcrDocumentParser parser;

    @BeforeEach
    void setUp() {
        parser = new OcrDocumentParser();
    }

    @Test
    @DisplayName("Null or empty input parses as Empty")
    void emptyInput() {
        assertInstanceOf(OcrDocument.Empty.class, parser.parse(null));
        assertInstanceOf(OcrDocument.Empty.class, parser.parse(Map.of()));
    }

    @Test
    @DisplayName("Mapping without fields key parses as Flat")
    void flat() {
        OcrDocument doc = parser.parse(Map.of("name", "Jon", "name_confidence", 80, "raw_text", "..."));

        OcrDocument.Flat flat = assertInstanceOf(OcrDocument.Flat.class, doc);
        assertEquals(Set.of("name", "name_confidence", "raw_text"), flat.candidateKeys());
        assertEquals("Jon", flat.rawValue("name"));
        assertEquals(80, flat.rawConfidence("name"));
        assertNull(flat.rawConfidence("missing"));
    }

    @Test
    @DisplayName("Mapping with fields key parses as Nested with confidences from fields_meta")
    void nested() {
        OcrDocument doc = parser.parse(Map.of(
                "fields", Map.of("city", "Pune"),
                "fields_meta", Map.of("city_confidence", 60),
                "raw_text", "PUNE"));

        OcrDocument.Nested nested = assertInstanceOf(OcrDocument.Nested.class, doc);
        assertEquals(Set.of("city"), nested.candidateKeys());
        assertEquals("Pune", nested.rawValue("city"));
        assertEquals(60, nested.rawConfidence("city"));
    }

    @Test
    @DisplayName("Nested lookups fall back to the top level")
    void nestedFallback() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("name", null);
        OcrDocument doc = parser.parse(Map.of(
                "fields", fields,
                "name", "Jon",
                "name_confidence", "75"));

        assertEquals(Set.of("name"), doc.candidateKeys());
        assertEquals("Jon", doc.rawValue("name"));
        assertEquals("75", doc.rawConfidence("name"));
    }

    @Test
    @DisplayName("Non-mapping fields yields Empty")
    void malformedFields() {
        assertInstanceOf(OcrDocument.Empty.class, parser.parse(Map.of("fields", List.of("a", "b"))));
        assertInstanceOf(OcrDocument.Empty.class, parser.parse(Map.of("fields", "oops")));
    }

    @Test
    @DisplayName("Non-mapping fields_meta is treated as empty metadata")
    void malformedMeta() {
        OcrDocument doc = parser.parse(Map.of(
                "fields", Map.of("city", "Pune"),
                "fields_meta", "broken"));

        OcrDocument.Nested nested = assertInstanceOf(OcrDocument.Nested.class, doc);
        assertTrue(nested.meta().isEmpty());
        assertNull(nested.rawConfidence("city"));
    }

    @Test
    @DisplayName("Keys present with null values are kept")
    void nullValuesKept() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("name", null);
        OcrDocument doc = parser.parse(raw);

        assertTrue(doc.candidateKeys().contains("name"));
        assertNull(doc.rawValue("name"));
    }
}
