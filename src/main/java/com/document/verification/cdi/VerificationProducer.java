package com.document.verification.cdi;

import com.document.verification.api.AsyncVerifier;
import com.document.verification.api.VerificationEngine;
import com.document.verification.api.VerificationOptions;
import com.document.verification.metrics.MetricsService;
import com.document.verification.metrics.MicrometerMetricsService;
import com.document.verification.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the verification engine from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus), it produces
 * the {@link VerificationEngine} and its {@link AsyncVerifier}. All properties are optional:</p>
 * <pre>
 * verification.engine.field-parallelism=1
 * verification.engine.parallel-threshold=32
 * verification.async.timeout-ms=30000
 * verification.async.max-batch-size=1000
 * verification.metrics.enabled=true
 * </pre>
 * <p>Metrics go to the container's {@link MeterRegistry} when one is available.</p>
 */
@ApplicationScoped
public class VerificationProducer {

    private static final Logger log = LoggerFactory.getLogger(VerificationProducer.class);

    // ── Engine ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "verification.engine.field-parallelism", defaultValue = "1")
    int fieldParallelism;

    @Inject
    @ConfigProperty(name = "verification.engine.parallel-threshold", defaultValue = "32")
    int parallelThreshold;

    // ── Async / Batch ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "verification.async.timeout-ms", defaultValue = "30000")
    long asyncTimeoutMs;

    @Inject
    @ConfigProperty(name = "verification.async.max-batch-size", defaultValue = "1000")
    int maxBatchSize;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "verification.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public VerificationOptions verificationOptions() {
        return VerificationOptions.builder()
                .fieldParallelism(fieldParallelism)
                .parallelThreshold(parallelThreshold)
                .asyncTimeoutMs(asyncTimeoutMs)
                .maxBatchSize(maxBatchSize)
                .build();
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (metricsEnabled && meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Verification metrics enabled");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("Verification metrics disabled: enabled={}", metricsEnabled);
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public VerificationEngine verificationEngine(VerificationOptions options, MetricsService metricsService) {
        log.info("Producing VerificationEngine: {}", options);
        return VerificationEngine.builder()
                .options(options)
                .metricsService(metricsService)
                .build();
    }

    public void closeEngine(@Disposes VerificationEngine engine) {
        log.info("Closing VerificationEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public AsyncVerifier asyncVerifier(VerificationEngine engine) {
        return engine.async();
    }

    public void closeAsyncVerifier(@Disposes AsyncVerifier asyncVerifier) {
        asyncVerifier.close();
    }
}
