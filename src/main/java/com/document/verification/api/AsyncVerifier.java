package com.document.verification.api;

import com.document.verification.core.model.VerificationReport;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous verification API.
 * Futures complete exceptionally with the engine's exception, or with a
 * {@link java.util.concurrent.TimeoutException} when the configured timeout elapses.
 */
public interface AsyncVerifier extends AutoCloseable {

    /**
     * Verifies a single document asynchronously.
     */
    CompletableFuture<VerificationReport> verifyAsync(VerificationRequest request);

    /**
     * Verifies multiple documents in parallel. Reports are returned in request order.
     *
     * @throws IllegalArgumentException if the batch exceeds the configured maximum size
     */
    CompletableFuture<List<VerificationReport>> verifyBatchAsync(List<VerificationRequest> requests);

    /**
     * Verifies multiple documents with bounded concurrency. Reports are returned in request order.
     *
     * @param maxConcurrency maximum number of documents verified at the same time
     * @throws IllegalArgumentException if maxConcurrency is not positive or the batch is too large
     */
    CompletableFuture<List<VerificationReport>> verifyBatchAsync(List<VerificationRequest> requests,
                                                                 int maxConcurrency);

    @Override
    void close();
}
