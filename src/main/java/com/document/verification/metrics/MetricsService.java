package com.document.verification.metrics;

import com.document.verification.core.model.VerificationStatus;

import java.time.Duration;

/**
 * Interface for recording verification metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordVerificationDuration(Duration duration);

    void incrementFieldStatus(VerificationStatus status);

    void recordAverageConfidence(double averageConfidence);

    void recordFieldCount(int fieldCount);

    void incrementInvalidInput();
}
