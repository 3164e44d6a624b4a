package com.document.verification.api;

import java.util.Map;

/**
 * A single document to verify: the OCR output and the user's edited values.
 * Either map may be null; the engine rejects the request only when both are missing.
 */
public record VerificationRequest(
        Map<String, Object> ocrData,
        Map<String, Object> userData
) {
    public static VerificationRequest of(Map<String, Object> ocrData, Map<String, Object> userData) {
        return new VerificationRequest(ocrData, userData);
    }
}
