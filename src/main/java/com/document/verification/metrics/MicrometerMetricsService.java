package com.document.verification.metrics;

import com.document.verification.core.model.VerificationStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code verification.duration}: Timer</li>
 *   <li>{@code verification.field.status}: Counter (tag: status)</li>
 *   <li>{@code verification.average.confidence}: DistributionSummary</li>
 *   <li>{@code verification.field.count}: DistributionSummary</li>
 *   <li>{@code verification.invalid.input}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer durationTimer;
    private final Map<VerificationStatus, Counter> statusCounters = new EnumMap<>(VerificationStatus.class);
    private final DistributionSummary averageConfidenceSummary;
    private final DistributionSummary fieldCountSummary;
    private final Counter invalidInputCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.durationTimer = Timer.builder("verification.duration")
                .description("Duration of document verification requests")
                .register(registry);
        for (VerificationStatus status : VerificationStatus.values()) {
            statusCounters.put(status, Counter.builder("verification.field.status")
                    .description("Number of verified fields per outcome status")
                    .tag("status", status.name())
                    .register(registry));
        }
        this.averageConfidenceSummary = DistributionSummary.builder("verification.average.confidence")
                .description("Distribution of document-level average confidence")
                .register(registry);
        this.fieldCountSummary = DistributionSummary.builder("verification.field.count")
                .description("Distribution of reconciled fields per document")
                .register(registry);
        this.invalidInputCounter = Counter.builder("verification.invalid.input")
                .description("Number of requests rejected for missing input")
                .register(registry);
    }

    @Override
    public void recordVerificationDuration(Duration duration) {
        durationTimer.record(duration);
    }

    @Override
    public void incrementFieldStatus(VerificationStatus status) {
        statusCounters.get(status).increment();
    }

    @Override
    public void recordAverageConfidence(double averageConfidence) {
        averageConfidenceSummary.record(averageConfidence);
    }

    @Override
    public void recordFieldCount(int fieldCount) {
        fieldCountSummary.record(fieldCount);
    }

    @Override
    public void incrementInvalidInput() {
        invalidInputCounter.increment();
    }
}
