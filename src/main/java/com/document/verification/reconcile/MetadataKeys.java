package com.document.verification.reconcile;

import java.util.Set;

/**
 * Keys the OCR stage mixes into its output that describe the whole document rather than a field.
 */
public final class MetadataKeys {

    public static final String FIELDS = "fields";
    public static final String FIELDS_META = "fields_meta";
    public static final String CONFIDENCE_SUFFIX = "_confidence";

    public static final Set<String> EXCLUDED = Set.of(
            "raw_text",
            "lines",
            "raw_lines",
            "text",
            "average_confidence",
            FIELDS,
            FIELDS_META,
            "confidence",
            "error"
    );

    private MetadataKeys() {
    }

    /**
     * Returns true when the key can never name a field.
     */
    public static boolean isExcluded(String key) {
        return key == null || EXCLUDED.contains(key) || key.endsWith(CONFIDENCE_SUFFIX);
    }

    /**
     * Returns the sibling key under which the confidence of {@code field} is stored.
     */
    public static String confidenceKey(String field) {
        return field + CONFIDENCE_SUFFIX;
    }
}
