package com.document.verification.api;

import com.document.verification.scoring.CombinerWeights;

/**
 * Options for document verification.
 * Configures combiner weights, per-field parallelism and the async/batch limits.
 */
public class VerificationOptions {

    private static final int DEFAULT_FIELD_PARALLELISM = 1;
    private static final int DEFAULT_PARALLEL_THRESHOLD = 32;
    private static final long DEFAULT_ASYNC_TIMEOUT_MS = 30_000;
    private static final int DEFAULT_MAX_BATCH_SIZE = 1_000;

    private final CombinerWeights combinerWeights;
    private final int fieldParallelism;
    private final int parallelThreshold;
    private final long asyncTimeoutMs;
    private final int maxBatchSize;

    private VerificationOptions(Builder builder) {
        this.combinerWeights = builder.combinerWeights;
        this.fieldParallelism = builder.fieldParallelism;
        this.parallelThreshold = builder.parallelThreshold;
        this.asyncTimeoutMs = builder.asyncTimeoutMs;
        this.maxBatchSize = builder.maxBatchSize;
    }

    public CombinerWeights getCombinerWeights() {
        return combinerWeights;
    }

    public int getFieldParallelism() {
        return fieldParallelism;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    /**
     * Returns true when a document with the given number of fields should be evaluated in parallel.
     */
    public boolean isParallelFor(int fieldCount) {
        return fieldParallelism > 1 && fieldCount >= parallelThreshold;
    }

    /**
     * Creates default options: sequential evaluation, 30 s async timeout, batches of up to 1000.
     */
    public static VerificationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CombinerWeights combinerWeights = CombinerWeights.defaultWeights();
        private int fieldParallelism = DEFAULT_FIELD_PARALLELISM;
        private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
        private long asyncTimeoutMs = DEFAULT_ASYNC_TIMEOUT_MS;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;

        public Builder combinerWeights(CombinerWeights combinerWeights) {
            if (combinerWeights == null) {
                throw new IllegalArgumentException("combinerWeights must not be null");
            }
            this.combinerWeights = combinerWeights;
            return this;
        }

        public Builder fieldParallelism(int fieldParallelism) {
            if (fieldParallelism <= 0) {
                throw new IllegalArgumentException("fieldParallelism must be positive");
            }
            this.fieldParallelism = fieldParallelism;
            return this;
        }

        public Builder parallelThreshold(int parallelThreshold) {
            if (parallelThreshold <= 0) {
                throw new IllegalArgumentException("parallelThreshold must be positive");
            }
            this.parallelThreshold = parallelThreshold;
            return this;
        }

        public Builder asyncTimeoutMs(long asyncTimeoutMs) {
            if (asyncTimeoutMs <= 0) {
                throw new IllegalArgumentException("asyncTimeoutMs must be positive");
            }
            this.asyncTimeoutMs = asyncTimeoutMs;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize <= 0) {
                throw new IllegalArgumentException("maxBatchSize must be positive");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public VerificationOptions build() {
            return new VerificationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "VerificationOptions{" +
                "combinerWeights=" + combinerWeights +
                ", fieldParallelism=" + fieldParallelism +
                ", parallelThreshold=" + parallelThreshold +
                ", asyncTimeoutMs=" + asyncTimeoutMs +
                ", maxBatchSize=" + maxBatchSize +
                '}';
    }
}
