package com.document.verification.reconcile;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Canonical view of the OCR stage output, whichever shape it arrived in.
 *
 * <p>Three variants exist:</p>
 * <ul>
 *   <li>{@link Flat}: values and {@code <field>_confidence} siblings share one mapping</li>
 *   <li>{@link Nested}: values under {@code fields}, confidences under {@code fields_meta}</li>
 *   <li>{@link Empty}: input absent or malformed; contributes no fields</li>
 * </ul>
 * Values and confidences are returned raw; coercion happens in {@link FieldReconciler}.
 */
public sealed interface OcrDocument permits OcrDocument.Flat, OcrDocument.Nested, OcrDocument.Empty {

    /**
     * Keys this document proposes as fields, before metadata keys are excluded.
     */
    Set<String> candidateKeys();

    /**
     * Raw value of a field, or null when absent.
     */
    Object rawValue(String field);

    /**
     * Raw confidence of a field, or null when absent.
     */
    Object rawConfidence(String field);

    /**
     * Flat shape: {@code {name: "Jon", name_confidence: 80, raw_text: "..."}}.
     * Keys holding a mapping or a list (bounding boxes, word lists) are document structure,
     * not fields, and are left out.
     */
    record Flat(Map<String, Object> entries) implements OcrDocument {
        public Flat {
            entries = copyOf(entries);
        }

        @Override
        public Set<String> candidateKeys() {
            Set<String> keys = new LinkedHashSet<>();
            for (Map.Entry<String, Object> entry : entries.entrySet()) {
                if (!isStructure(entry.getValue())) {
                    keys.add(entry.getKey());
                }
            }
            return Collections.unmodifiableSet(keys);
        }

        @Override
        public Object rawValue(String field) {
            Object value = entries.get(field);
            return isStructure(value) ? null : value;
        }

        @Override
        public Object rawConfidence(String field) {
            return entries.get(MetadataKeys.confidenceKey(field));
        }
    }

    /**
     * Nested shape: {@code {fields: {name: "Jon"}, fields_meta: {name_confidence: 80}}}.
     * Lookups fall back to the top-level mapping when the nested one lacks the key.
     */
    record Nested(Map<String, Object> fields, Map<String, Object> meta, Map<String, Object> topLevel)
            implements OcrDocument {
        public Nested {
            fields = copyOf(fields);
            meta = copyOf(meta);
            topLevel = copyOf(topLevel);
        }

        @Override
        public Set<String> candidateKeys() {
            return fields.keySet();
        }

        @Override
        public Object rawValue(String field) {
            Object nested = fields.get(field);
            return nested != null ? nested : topLevel.get(field);
        }

        @Override
        public Object rawConfidence(String field) {
            String key = MetadataKeys.confidenceKey(field);
            Object nested = meta.get(key);
            return nested != null ? nested : topLevel.get(key);
        }
    }

    /**
     * No OCR fields at all.
     */
    record Empty() implements OcrDocument {
        @Override
        public Set<String> candidateKeys() {
            return Set.of();
        }

        @Override
        public Object rawValue(String field) {
            return null;
        }

        @Override
        public Object rawConfidence(String field) {
            return null;
        }
    }

    /**
     * Returns true for values that describe document structure rather than a field value.
     */
    static boolean isStructure(Object value) {
        return value instanceof Map<?, ?> || value instanceof Collection<?>
                || (value != null && value.getClass().isArray());
    }

    /**
     * Read-only copy with stringified keys. Null keys are dropped; null values are kept
     * so a key present with no value still counts as present.
     */
    static Map<String, Object> copyOf(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<?, ?> entry : source.entrySet()) {
                if (entry.getKey() != null) {
                    copy.put(String.valueOf(entry.getKey()), entry.getValue());
                }
            }
        }
        return Collections.unmodifiableMap(copy);
    }
}
