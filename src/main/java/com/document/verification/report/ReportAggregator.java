package com.document.verification.report;

import com.document.verification.core.model.VerificationOutcome;
import com.document.verification.core.model.VerificationReport;
import com.document.verification.scoring.Scores;

import java.util.List;

/**
 * Reduces per-field outcomes to document-level statistics.
 *
 * <p>The average covers every outcome, so fields decided by presence alone pull it down
 * with their zero combined score.</p>
 */
public class ReportAggregator {

    public VerificationReport aggregate(List<VerificationOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return VerificationReport.empty();
        }

        double total = 0.0;
        int matched = 0;
        int partial = 0;
        int mismatched = 0;

        for (VerificationOutcome outcome : outcomes) {
            total += outcome.combinedScore();
            switch (outcome.status()) {
                case Match -> matched++;
                case PartialMatch -> partial++;
                case Mismatch -> mismatched++;
                default -> {
                    // presence-only statuses are counted in totalFields only
                }
            }
        }

        double average = Scores.round2(total / outcomes.size());
        return new VerificationReport(outcomes, average, outcomes.size(), matched, partial, mismatched);
    }
}
