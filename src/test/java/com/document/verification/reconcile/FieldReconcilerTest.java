package com.document.verification.reconcile;

import com.document.verification.core.InvalidInputException;
import com.document.verification.core.model.ReconciledField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldReconcilerTest {

    private FieldReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new FieldReconciler();
    }

    @Test
    @DisplayName("Field set is the union of user and OCR keys in lexicographic order")
    void unionSorted() {
        List<ReconciledField> fields = reconciler.reconcile(
                Map.of("name", "Jon", "dob", "1990"),
                Map.of("name", "John", "email", "a@b.com"));

        assertEquals(List.of("dob", "email", "name"), fields.stream().map(ReconciledField::field).toList());
    }

    @ParameterizedTest
    @DisplayName("Metadata keys never become fields")
    @ValueSource(strings = {"raw_text", "lines", "raw_lines", "text", "average_confidence",
            "confidence", "error", "name_confidence"})
    void excludesMetadata(String key) {
        List<ReconciledField> fields = reconciler.reconcile(
                Map.of("name", "Jon", key, "x"),
                Map.of(key, "y"));

        assertEquals(List.of("name"), fields.stream().map(ReconciledField::field).toList());
    }

    @Test
    @DisplayName("Flat OCR confidence comes from the _confidence sibling")
    void flatConfidence() {
        List<ReconciledField> fields = reconciler.reconcile(
                Map.of("name", "Jon Smith", "name_confidence", 80),
                Map.of("name", "John Smith"));

        ReconciledField name = fields.get(0);
        assertEquals("Jon Smith", name.ocrValue());
        assertEquals("John Smith", name.userValue());
        assertEquals(80.0, name.ocrConfidence());
    }

    @Test
    @DisplayName("Nested OCR fields and metadata are normalized")
    void nested() {
        List<ReconciledField> fields = reconciler.reconcile(
                Map.of("fields", Map.of("city", "Pune"),
                        "fields_meta", Map.of("city_confidence", 60),
                        "raw_text", "PUNE"),
                Map.of("city", "pune"));

        assertEquals(1, fields.size());
        assertEquals(new ReconciledField("city", "Pune", 60.0, "pune"), fields.get(0));
    }

    @Test
    @DisplayName("Missing side contributes empty values")
    void missingSide() {
        List<ReconciledField> fields = reconciler.reconcile(null, Map.of("email", "a@b.com"));

        assertEquals(new ReconciledField("email", "", 0.0, "a@b.com"), fields.get(0));
    }

    @Test
    @DisplayName("Flat OCR keys holding lists or mappings are not fields")
    void nonScalarValue() {
        List<ReconciledField> fields = reconciler.reconcile(
                Map.of("name", "Jon", "boxes", List.of(1, 2, 3), "layout", Map.of("line1", "x")),
                Map.of("name", "Jon"));

        assertEquals(List.of("name"), fields.stream().map(ReconciledField::field).toList());
    }

    @Test
    @DisplayName("User value for a structured OCR key is compared against an empty OCR value")
    void nonScalarValueWithUserValue() {
        List<ReconciledField> fields = reconciler.reconcile(
                Map.of("address", Map.of("line1", "x")),
                Map.of("address", "12 Main St"));

        assertEquals(new ReconciledField("address", "", 0.0, "12 Main St"), fields.get(0));
    }

    @Test
    @DisplayName("Both inputs missing or empty is rejected")
    void bothMissing() {
        assertThrows(InvalidInputException.class, () -> reconciler.reconcile(null, null));
        assertThrows(InvalidInputException.class, () -> reconciler.reconcile(Map.of(), Map.of()));
    }

    @Test
    @DisplayName("Only metadata in OCR and empty user data yields no fields")
    void onlyMetadata() {
        List<ReconciledField> fields = reconciler.reconcile(Map.of("raw_text", "abc"), Map.of());
        assertTrue(fields.isEmpty());
    }
}
