package com.document.verification.scoring;

/**
 * Folds the OCR confidence of a field into its textual similarity.
 * Formula when confidence is known: {@code w1*similarity + w2*ocrConfidence};
 * a confidence of zero means "unknown" and the similarity is used as-is.
 */
public class ConfidenceCombiner {

    private final CombinerWeights weights;

    public ConfidenceCombiner() {
        this(CombinerWeights.defaultWeights());
    }

    public ConfidenceCombiner(CombinerWeights weights) {
        this.weights = weights;
    }

    /**
     * Computes the combined trust score for a field whose values are both present.
     *
     * @param similarity    similarity percentage in [0, 100]
     * @param ocrConfidence OCR confidence percentage in [0, 100]
     * @return combined score in [0, 100]
     */
    public double combine(double similarity, double ocrConfidence) {
        if (ocrConfidence > 0) {
            return weights.similarityWeight() * similarity
                    + weights.confidenceWeight() * ocrConfidence;
        }
        return similarity;
    }

    public CombinerWeights getWeights() {
        return weights;
    }
}
