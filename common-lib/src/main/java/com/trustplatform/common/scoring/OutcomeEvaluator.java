package com.trustplatform.common.scoring;

import com.trustplatform.common.model.ValidationResult;
import com.trustplatform.common.policy.ReputationPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts a single {@link ValidationResult} into a signed score delta.
 *
 * <p><b>Correct</b>
 * <pre>
 *   reward = baseReward × difficulty
 *   reward = reward × recoveryBonus        (only while recovering)
 *   newRaw = decayed + reward
 * </pre>
 *
 * <p><b>Incorrect</b>
 * <pre>
 *   penalty = basePenalty
 *   penalty = penalty × confidentMistakeMultiplier   (confidence &gt; confidentMistakeThreshold)
 *   penalty = penalty × edgeCaseMultiplier           (edge case)
 *   penalty = penalty × (2 − difficulty)
 *   newRaw  = decayed − penalty
 * </pre>
 *
 * <p>A failure on an easy task costs more than a failure on a hard one. Inputs are
 * assumed to be validated already; see {@code ValidationGuard}.
 */
public final class OutcomeEvaluator {

    private final ReputationPolicy policy;

    public OutcomeEvaluator(ReputationPolicy policy) {
        this.policy = policy;
    }

    /**
     * @param decayedScore stored score after decay
     * @param result       the validation being scored
     * @param recovering   recovery flag; ignored for incorrect results
     */
    public OutcomeEvaluation evaluate(double decayedScore, ValidationResult result, boolean recovering) {
        if (result.correct()) {
            double reward = reward(result.difficulty(), recovering);
            return new OutcomeEvaluation(decayedScore + reward, reward,
                rewardReason(result.difficulty(), reward, recovering));
        }
        double penalty = penalty(result.confidence(), result.difficulty(), result.edgeCase());
        return new OutcomeEvaluation(decayedScore - penalty, -penalty,
            penaltyReason(result, penalty));
    }

    public double reward(double difficulty, boolean recovering) {
        double reward = policy.baseReward() * difficulty;
        if (recovering) {
            reward *= policy.recoveryBonus();
        }
        return reward;
    }

    public double penalty(double confidence, double difficulty, boolean edgeCase) {
        double penalty = policy.basePenalty();
        if (isConfidentMistake(confidence)) {
            penalty *= policy.confidentMistakeMultiplier();
        }
        if (edgeCase) {
            penalty *= policy.edgeCaseMultiplier();
        }
        return penalty * (2.0 - difficulty);
    }

    private boolean isConfidentMistake(double confidence) {
        return confidence > policy.confidentMistakeThreshold();
    }

    // ── Reason text ────────────────────────────────────────────────

    private String rewardReason(double difficulty, double reward, boolean recovering) {
        String base = String.format(Locale.ROOT,
            "Correct validation (difficulty %.2f): +%.2f", difficulty, reward);
        return recovering ? base + " incl. recovery bonus x" + fmt(policy.recoveryBonus()) : base;
    }

    private String penaltyReason(ValidationResult result, double penalty) {
        List<String> factors = new ArrayList<>();
        if (isConfidentMistake(result.confidence())) {
            factors.add("confident mistake");
        }
        if (result.edgeCase()) {
            factors.add("edge case");
        }
        String base = String.format(Locale.ROOT,
            "Incorrect validation (difficulty %.2f): -%.2f", result.difficulty(), penalty);
        return factors.isEmpty() ? base : base + " [" + String.join(", ", factors) + "]";
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
