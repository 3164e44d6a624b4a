package com.document.verification.scoring;

/**
 * Weights used to blend textual similarity with the OCR stage's own confidence.
 */
public record CombinerWeights(
        double similarityWeight,
        double confidenceWeight
) {
    public static final double DEFAULT_SIMILARITY_WEIGHT = 0.55;
    public static final double DEFAULT_CONFIDENCE_WEIGHT = 0.45;

    public CombinerWeights {
        if (similarityWeight < 0 || confidenceWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = similarityWeight + confidenceWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: content agreement outweighs the extractor's self-reported confidence.
     */
    public static CombinerWeights defaultWeights() {
        return new CombinerWeights(DEFAULT_SIMILARITY_WEIGHT, DEFAULT_CONFIDENCE_WEIGHT);
    }
}
