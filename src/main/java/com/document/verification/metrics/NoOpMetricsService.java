package com.document.verification.metrics;

import com.document.verification.core.model.VerificationStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordVerificationDuration(Duration duration) {
    }

    @Override
    public void incrementFieldStatus(VerificationStatus status) {
    }

    @Override
    public void recordAverageConfidence(double averageConfidence) {
    }

    @Override
    public void recordFieldCount(int fieldCount) {
    }

    @Override
    public void incrementInvalidInput() {
    }
}
