package com.document.verification.rest.dto;

import java.util.List;

/**
 * Request DTO for batch verification.
 * Individual documents are validated one by one so a bad item does not fail the batch.
 */
public record BatchVerifyRequest(
        List<VerifyRequest> documents
) {
    private static final int MAX_BATCH_SIZE = 1000;

    public BatchVerifyRequest {
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("documents must not be empty");
        }
        if (documents.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException(
                    "batch size " + documents.size() + " exceeds maximum of " + MAX_BATCH_SIZE);
        }
    }
}
