package com.document.verification.decision;

import com.document.verification.core.model.ReconciledField;
import com.document.verification.core.model.VerificationOutcome;
import com.document.verification.core.model.VerificationStatus;
import com.document.verification.scoring.ConfidenceCombiner;
import com.document.verification.scoring.Scores;
import com.document.verification.similarity.LevenshteinSimilarity;
import com.document.verification.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides the status of one reconciled field.
 *
 * <p>Presence cases are evaluated first, in this order:</p>
 * <ol>
 *   <li>both values empty: {@link VerificationStatus#NotProvided}</li>
 *   <li>only the user value present: {@link VerificationStatus#UserAdded}</li>
 *   <li>only the OCR value present: {@link VerificationStatus#OcrPresent}</li>
 *   <li>both present: similarity and combined score decide between
 *       {@link VerificationStatus#Match}, {@link VerificationStatus#PartialMatch} and
 *       {@link VerificationStatus#Mismatch}</li>
 * </ol>
 * The first three cases report zero similarity and zero combined score.
 */
public class StatusClassifier {
    private static final Logger log = LoggerFactory.getLogger(StatusClassifier.class);

    public static final double MATCH_THRESHOLD = 95.0;
    public static final double PARTIAL_MATCH_THRESHOLD = 75.0;

    public static final String NOTE_NOT_PROVIDED = "No value provided by either OCR or user";
    public static final String NOTE_USER_ADDED = "Value provided by user but not detected by OCR";
    public static final String NOTE_OCR_PRESENT = "OCR found a value but user left the field empty";
    public static final String NOTE_MISMATCH = "Values differ significantly; please verify the correct value";

    private final SimilarityAlgorithm similarity;
    private final ConfidenceCombiner combiner;

    public StatusClassifier() {
        this(new LevenshteinSimilarity(), new ConfidenceCombiner());
    }

    public StatusClassifier(SimilarityAlgorithm similarity, ConfidenceCombiner combiner) {
        this.similarity = similarity;
        this.combiner = combiner;
    }

    /**
     * Evaluates one field and returns its outcome. Never throws for field content.
     */
    public VerificationOutcome evaluate(ReconciledField field) {
        String ocrValue = field.ocrValue().trim();
        String userValue = field.userValue().trim();
        double ocrConfidence = field.ocrConfidence();

        if (userValue.isEmpty() && ocrValue.isEmpty()) {
            return VerificationOutcome.unscored(field.field(), ocrValue, userValue, ocrConfidence,
                    VerificationStatus.NotProvided, NOTE_NOT_PROVIDED);
        }
        if (ocrValue.isEmpty()) {
            return VerificationOutcome.unscored(field.field(), ocrValue, userValue, ocrConfidence,
                    VerificationStatus.UserAdded, NOTE_USER_ADDED);
        }
        if (userValue.isEmpty()) {
            return VerificationOutcome.unscored(field.field(), ocrValue, userValue, ocrConfidence,
                    VerificationStatus.OcrPresent, NOTE_OCR_PRESENT);
        }

        double similarityScore = Scores.round2(Scores.clamp(similarity.compute(ocrValue, userValue)));
        double combinedScore = Scores.round2(Scores.clamp(combiner.combine(similarityScore, ocrConfidence)));
        VerificationStatus status = classify(combinedScore);

        log.debug("field.scored field={} similarity={} ocrConfidence={} combined={} status={}",
                field.field(), similarityScore, ocrConfidence, combinedScore, status);

        return new VerificationOutcome(field.field(), ocrValue, userValue, similarityScore, ocrConfidence,
                combinedScore, status, status == VerificationStatus.Mismatch ? NOTE_MISMATCH : "");
    }

    /**
     * Maps a combined score of two present values to a status.
     */
    public static VerificationStatus classify(double combinedScore) {
        if (combinedScore >= MATCH_THRESHOLD) {
            return VerificationStatus.Match;
        } else if (combinedScore >= PARTIAL_MATCH_THRESHOLD) {
            return VerificationStatus.PartialMatch;
        }
        return VerificationStatus.Mismatch;
    }
}
