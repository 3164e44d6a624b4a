package com.document.verification.api;

import com.document.verification.core.model.VerificationReport;
import com.document.verification.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Thread pool based implementation of {@link AsyncVerifier}.
 * Runs verifications on an owned fixed pool sized to the available processors.
 */
public class AsyncVerifierImpl implements AsyncVerifier {
    private static final Logger log = LoggerFactory.getLogger(AsyncVerifierImpl.class);

    private final VerificationEngine engine;
    private final ExecutorService executor;
    private final long timeoutMs;
    private final int maxBatchSize;

    public AsyncVerifierImpl(VerificationEngine engine, VerificationOptions options) {
        this(engine, options.getAsyncTimeoutMs(), options.getMaxBatchSize(),
                Runtime.getRuntime().availableProcessors());
    }

    public AsyncVerifierImpl(VerificationEngine engine, long timeoutMs, int maxBatchSize, int poolSize) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be > 0");
        }
        this.engine = engine;
        this.timeoutMs = timeoutMs;
        this.maxBatchSize = maxBatchSize;
        this.executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @Override
    public CompletableFuture<VerificationReport> verifyAsync(VerificationRequest request) {
        return CompletableFuture.supplyAsync(() -> engine.verify(request), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<List<VerificationReport>> verifyBatchAsync(List<VerificationRequest> requests) {
        checkBatchSize(requests);
        String batchId = LogContext.generateCorrelationId();
        try (LogContext logCtx = LogContext.forBatch(batchId, requests.size())) {
            log.debug("batch.submitted size={}", requests.size());
        }

        List<CompletableFuture<VerificationReport>> futures = requests.stream()
                .map(this::verifyAsync)
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    @Override
    public CompletableFuture<List<VerificationReport>> verifyBatchAsync(List<VerificationRequest> requests,
                                                                        int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        checkBatchSize(requests);

        Semaphore semaphore = new Semaphore(maxConcurrency);

        List<CompletableFuture<VerificationReport>> futures = requests.stream()
                .map(req -> CompletableFuture.supplyAsync(() -> {
                    try {
                        semaphore.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CompletionException(e);
                    }
                    try {
                        return engine.verify(req);
                    } finally {
                        semaphore.release();
                    }
                }, executor).orTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    private void checkBatchSize(List<VerificationRequest> requests) {
        if (requests == null) {
            throw new IllegalArgumentException("requests must not be null");
        }
        if (requests.size() > maxBatchSize) {
            throw new IllegalArgumentException(
                    "Batch size " + requests.size() + " exceeds maximum of " + maxBatchSize);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
