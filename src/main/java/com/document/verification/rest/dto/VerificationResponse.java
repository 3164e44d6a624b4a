package com.document.verification.rest.dto;

import com.document.verification.core.model.VerificationReport;
import com.document.verification.scoring.Scores;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * REST response DTO for a verification report.
 */
@JsonPropertyOrder({"results", "averageConfidence", "totalFields", "matchedFields",
        "partialMatchFields", "mismatchFields"})
public record VerificationResponse(
        List<FieldResultResponse> results,
        String averageConfidence,
        int totalFields,
        int matchedFields,
        int partialMatchFields,
        int mismatchFields
) {
    public static VerificationResponse from(VerificationReport report) {
        return new VerificationResponse(
                report.results().stream().map(FieldResultResponse::from).toList(),
                Scores.format(report.averageConfidence()),
                report.totalFields(),
                report.matchedFields(),
                report.partialMatchFields(),
                report.mismatchFields()
        );
    }
}
