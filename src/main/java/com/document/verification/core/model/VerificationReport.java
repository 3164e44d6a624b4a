package com.document.verification.core.model;

import java.util.List;

/**
 * Document-level verification result: one outcome per reconciled field plus aggregate statistics.
 * Built fresh for every request and never mutated.
 */
public record VerificationReport(
        List<VerificationOutcome> results,
        double averageConfidence,
        int totalFields,
        int matchedFields,
        int partialMatchFields,
        int mismatchFields
) {
    public VerificationReport {
        results = results != null ? List.copyOf(results) : List.of();
    }

    /**
     * Creates a report with no fields.
     */
    public static VerificationReport empty() {
        return new VerificationReport(List.of(), 0.0, 0, 0, 0, 0);
    }

    /**
     * Returns the number of fields whose status was decided by presence alone.
     */
    public int unscoredFields() {
        return totalFields - matchedFields - partialMatchFields - mismatchFields;
    }
}
