package com.document.verification.core.model;

import java.util.Objects;

/**
 * Result of comparing the OCR value of one field against the user's value.
 * Scores are percentages in [0, 100]; similarity and combined score carry two decimals.
 */
public record VerificationOutcome(
        String field,
        String ocrValue,
        String userValue,
        double similarity,
        double ocrConfidence,
        double combinedScore,
        VerificationStatus status,
        String notes
) {
    public VerificationOutcome {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(status, "status is required");
        requirePercentage(similarity, "similarity");
        requirePercentage(ocrConfidence, "ocrConfidence");
        requirePercentage(combinedScore, "combinedScore");
        ocrValue = ocrValue != null ? ocrValue : "";
        userValue = userValue != null ? userValue : "";
        notes = notes != null ? notes : "";
    }

    /**
     * Creates an outcome for a field decided by value presence alone; both scores are zero.
     */
    public static VerificationOutcome unscored(String field, String ocrValue, String userValue,
                                               double ocrConfidence, VerificationStatus status, String notes) {
        return new VerificationOutcome(field, ocrValue, userValue, 0.0, ocrConfidence, 0.0, status, notes);
    }

    private static void requirePercentage(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(name + " must be between 0 and 100, got " + value);
        }
    }
}
