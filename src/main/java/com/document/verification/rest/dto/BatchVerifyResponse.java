package com.document.verification.rest.dto;

import java.util.List;

/**
 * REST response DTO for batch verification. Every report and every error carries the
 * position of its document in the request.
 */
public record BatchVerifyResponse(
        List<BatchReport> reports,
        List<ErrorResponse> errors,
        int totalProcessed,
        int totalErrors
) {
    public BatchVerifyResponse(List<BatchReport> reports, List<ErrorResponse> errors) {
        this(List.copyOf(reports), List.copyOf(errors), reports.size(), errors.size());
    }

    /**
     * Report of one successfully verified document.
     */
    public record BatchReport(int index, VerificationResponse report) {
    }
}
