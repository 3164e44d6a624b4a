package com.document.verification.core.model;

import java.util.Objects;

/**
 * Raw inputs for one field after both sources have been aligned.
 * Values are already stringified but not yet trimmed.
 */
public record ReconciledField(
        String field,
        String ocrValue,
        double ocrConfidence,
        String userValue
) {
    public ReconciledField {
        Objects.requireNonNull(field, "field is required");
        ocrValue = ocrValue != null ? ocrValue : "";
        userValue = userValue != null ? userValue : "";
    }
}
