package com.document.verification.rest.dto;

import com.document.verification.api.VerificationRequest;

import java.util.Map;

/**
 * Request DTO for verifying a single document.
 * Both parts must be present in the request body; either may be an empty object.
 */
public record VerifyRequest(
        Map<String, Object> ocrData,
        Map<String, Object> userData
) {
    /**
     * Checks that both parts were sent.
     *
     * @throws IllegalArgumentException naming the first missing part
     */
    public void validate() {
        if (ocrData == null) {
            throw new IllegalArgumentException("ocrData is required");
        }
        if (userData == null) {
            throw new IllegalArgumentException("userData is required");
        }
    }

    public VerificationRequest toVerificationRequest() {
        return new VerificationRequest(ocrData, userData);
    }
}
