package com.document.verification.core.model;

/**
 * Outcome category of a single field comparison.
 * The first three values are decided by presence alone; the last three by the combined score.
 */
public enum VerificationStatus {
    /**
     * Neither OCR nor the user supplied a value.
     */
    NotProvided,

    /**
     * The user supplied a value that OCR did not detect.
     */
    UserAdded,

    /**
     * OCR detected a value but the user left the field empty.
     */
    OcrPresent,

    /**
     * Both values present, combined score at or above the match threshold (95).
     */
    Match,

    /**
     * Both values present, combined score in the partial band [75, 95).
     */
    PartialMatch,

    /**
     * Both values present, combined score below 75.
     */
    Mismatch;

    /**
     * Returns true for the statuses decided by comparing two present values.
     */
    public boolean isScored() {
        return this == Match || this == PartialMatch || this == Mismatch;
    }
}
