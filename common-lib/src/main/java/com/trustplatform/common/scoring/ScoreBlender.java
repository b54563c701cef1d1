package com.trustplatform.common.scoring;

import com.trustplatform.common.policy.ReputationPolicy;

/**
 * Smooths single-event volatility, then enforces bounds.
 *
 * <pre>
 *   finalRaw = newRaw × freshWeight + decayed × (1 − freshWeight)
 *   bounded  = clamp(finalRaw, minRepId, maxRepId)
 * </pre>
 */
public final class ScoreBlender {

    private final ReputationPolicy policy;

    public ScoreBlender(ReputationPolicy policy) {
        this.policy = policy;
    }

    public double blend(double newRaw, double decayedScore) {
        double finalRaw = newRaw * policy.freshWeight() + decayedScore * policy.historicalWeight();
        return policy.clamp(finalRaw);
    }
}
