package com.trustplatform.common.scoring;

import com.trustplatform.common.model.ValidationResult;
import com.trustplatform.common.policy.ReputationPolicy;

import java.util.List;

/**
 * Decides whether an agent is trending upward and should receive the recovery bonus.
 *
 * <p>Takes the last {@code recoveryWindow} validations (oldest-first), splits them
 * into two equal halves and compares correct rates:
 * <pre>
 *   recovering  ⇔  rate(newer half) &gt; rate(older half) + recoveryThreshold
 * </pre>
 * Fewer than {@code recoveryWindow} validations means not recovering.
 */
public final class RecoveryDetector {

    private final int window;
    private final double threshold;

    public RecoveryDetector(ReputationPolicy policy) {
        this.window = policy.recoveryWindow();
        this.threshold = policy.recoveryThreshold();
    }

    /**
     * @param history validation history, oldest-first
     */
    public boolean isRecovering(List<ValidationResult> history) {
        if (history == null || history.size() < window) {
            return false;
        }
        List<ValidationResult> recent = history.subList(history.size() - window, history.size());
        int half = window / 2;
        double olderRate = correctRate(recent.subList(0, half));
        double newerRate = correctRate(recent.subList(half, window));
        return newerRate > olderRate + threshold;
    }

    /** Fraction of correct validations; 0.0 for an empty list. */
    public static double correctRate(List<ValidationResult> validations) {
        if (validations == null || validations.isEmpty()) return 0.0;
        long correct = validations.stream().filter(ValidationResult::correct).count();
        return (double) correct / validations.size();
    }
}
