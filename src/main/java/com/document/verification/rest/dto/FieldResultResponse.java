package com.document.verification.rest.dto;

import com.document.verification.core.model.VerificationOutcome;
import com.document.verification.scoring.Scores;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * REST response DTO for one verified field.
 * Similarity and combined score are two-decimal strings; OCR confidence stays numeric.
 */
@JsonPropertyOrder({"field", "ocrValue", "userValue", "similarity", "ocr_confidence",
        "combinedScore", "status", "notes"})
public record FieldResultResponse(
        String field,
        String ocrValue,
        String userValue,
        String similarity,
        @JsonProperty("ocr_confidence") double ocrConfidence,
        String combinedScore,
        String status,
        String notes
) {
    public static FieldResultResponse from(VerificationOutcome outcome) {
        return new FieldResultResponse(
                outcome.field(),
                outcome.ocrValue(),
                outcome.userValue(),
                Scores.format(outcome.similarity()),
                outcome.ocrConfidence(),
                Scores.format(outcome.combinedScore()),
                outcome.status().name(),
                outcome.notes()
        );
    }
}
