package com.document.verification.api;

import com.document.verification.core.InvalidInputException;
import com.document.verification.core.model.ReconciledField;
import com.document.verification.core.model.VerificationOutcome;
import com.document.verification.core.model.VerificationReport;
import com.document.verification.decision.StatusClassifier;
import com.document.verification.logging.LogContext;
import com.document.verification.metrics.MetricsService;
import com.document.verification.metrics.NoOpMetricsService;
import com.document.verification.reconcile.FieldReconciler;
import com.document.verification.report.ReportAggregator;
import com.document.verification.scoring.ConfidenceCombiner;
import com.document.verification.similarity.LevenshteinSimilarity;
import com.document.verification.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for field verification.
 * Compares OCR-extracted values against user-edited values and produces a per-field report.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (VerificationEngine engine = VerificationEngine.builder()
 *         .options(VerificationOptions.builder().fieldParallelism(4).build())
 *         .metricsService(new MicrometerMetricsService(registry))
 *         .build()) {
 *
 *     VerificationReport report = engine.verify(
 *             Map.of("name", "Jon Smith", "name_confidence", 80),
 *             Map.of("name", "John Smith"));
 *
 *     // Async and batch verification
 *     CompletableFuture&lt;VerificationReport&gt; future = engine.async().verifyAsync(request);
 * }
 * </pre>
 *
 * <p>The engine holds no per-request state. Concurrent calls to {@link #verify} are safe.</p>
 */
public class VerificationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

    private final VerificationOptions options;
    private final FieldReconciler reconciler;
    private final StatusClassifier classifier;
    private final ReportAggregator aggregator;
    private final MetricsService metricsService;
    private final ExecutorService fieldExecutor;

    private VerificationEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.reconciler = new FieldReconciler();
        this.classifier = new StatusClassifier(builder.similarityAlgorithm,
                new ConfidenceCombiner(options.getCombinerWeights()));
        this.aggregator = new ReportAggregator();
        this.fieldExecutor = options.getFieldParallelism() > 1
                ? Executors.newFixedThreadPool(options.getFieldParallelism())
                : null;

        log.info("VerificationEngine initialized with {}", options);
    }

    /**
     * Verifies one document.
     *
     * @param ocrData  OCR output, flat or nested; may be null
     * @param userData user-edited values; may be null
     * @return the verification report, results in ascending field-name order
     * @throws InvalidInputException if both inputs are null or empty
     */
    public VerificationReport verify(Map<String, ?> ocrData, Map<String, ?> userData) {
        long start = System.nanoTime();
        try (LogContext logCtx = LogContext.forVerification(LogContext.generateCorrelationId())) {
            List<ReconciledField> fields;
            try {
                fields = reconciler.reconcile(ocrData, userData);
            } catch (InvalidInputException e) {
                metricsService.incrementInvalidInput();
                log.warn("verification.rejected reason={}", e.getMessage());
                throw e;
            }
            logCtx.with("fieldCount", String.valueOf(fields.size()));

            List<VerificationOutcome> outcomes = options.isParallelFor(fields.size())
                    ? evaluateParallel(fields)
                    : evaluateSequential(fields);
            VerificationReport report = aggregator.aggregate(outcomes);

            recordMetrics(report, Duration.ofNanos(System.nanoTime() - start));
            log.info("verification.completed totalFields={} matched={} partial={} mismatched={} averageConfidence={}",
                    report.totalFields(), report.matchedFields(), report.partialMatchFields(),
                    report.mismatchFields(), report.averageConfidence());
            return report;
        }
    }

    /**
     * Verifies one request.
     */
    public VerificationReport verify(VerificationRequest request) {
        if (request == null) {
            throw new InvalidInputException("Both ocrData and userData are missing");
        }
        return verify(request.ocrData(), request.userData());
    }

    private List<VerificationOutcome> evaluateSequential(List<ReconciledField> fields) {
        List<VerificationOutcome> outcomes = new ArrayList<>(fields.size());
        for (ReconciledField field : fields) {
            outcomes.add(classifier.evaluate(field));
        }
        return outcomes;
    }

    private List<VerificationOutcome> evaluateParallel(List<ReconciledField> fields) {
        log.debug("fields.parallel fieldCount={} parallelism={}", fields.size(), options.getFieldParallelism());
        Map<String, String> callerContext = LogContext.capture();
        List<CompletableFuture<VerificationOutcome>> futures = fields.stream()
                .map(field -> CompletableFuture.supplyAsync(
                        () -> evaluateInContext(field, callerContext), fieldExecutor))
                .toList();

        // futures are in field order, so joining them keeps the report sorted
        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    private VerificationOutcome evaluateInContext(ReconciledField field, Map<String, String> callerContext) {
        try (LogContext ignored = LogContext.adopt(callerContext)) {
            return classifier.evaluate(field);
        }
    }

    private void recordMetrics(VerificationReport report, Duration duration) {
        metricsService.recordVerificationDuration(duration);
        metricsService.recordFieldCount(report.totalFields());
        metricsService.recordAverageConfidence(report.averageConfidence());
        for (VerificationOutcome outcome : report.results()) {
            metricsService.incrementFieldStatus(outcome.status());
        }
    }

    public VerificationOptions getOptions() {
        return options;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    /**
     * Creates an {@link AsyncVerifier} wrapping this engine.
     * The caller owns the returned verifier and must close it.
     */
    public AsyncVerifier async() {
        return new AsyncVerifierImpl(this, options);
    }

    @Override
    public void close() {
        if (fieldExecutor == null) {
            return;
        }
        fieldExecutor.shutdown();
        try {
            if (!fieldExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                fieldExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fieldExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private VerificationOptions options = VerificationOptions.defaults();
        private SimilarityAlgorithm similarityAlgorithm = new LevenshteinSimilarity();
        private MetricsService metricsService;

        /**
         * Sets verification options.
         */
        public Builder options(VerificationOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the string similarity algorithm. Defaults to {@link LevenshteinSimilarity}.
         */
        public Builder similarityAlgorithm(SimilarityAlgorithm similarityAlgorithm) {
            this.similarityAlgorithm = similarityAlgorithm;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public VerificationEngine build() {
            if (options == null) {
                throw new IllegalStateException("VerificationOptions are required");
            }
            if (similarityAlgorithm == null) {
                throw new IllegalStateException("SimilarityAlgorithm is required");
            }
            return new VerificationEngine(this);
        }
    }
}
