package com.trustplatform.common.policy;

import com.trustplatform.common.exception.InvalidPolicyException;

/**
 * Immutable trust policy shared by every scoring component.
 *
 * <p><b>Core parameters</b>
 * <pre>
 *   decayRate      0.95   fraction of score retained per 24h without updates
 *   recoveryBonus  1.2    reward multiplier while an agent is recovering
 *   baseReward     10     reward for a correct validation at difficulty 1.0
 *   basePenalty    15     penalty before context multipliers
 *   minRepId       10     lower score bound
 *   maxRepId       1000   upper score bound
 *   defaultRepId   100    score of an agent never seen before
 * </pre>
 *
 * <p><b>Shaping constants</b>. These encode the policy itself and are tunable
 * without a code change. None of them is derived from data.
 * <pre>
 *   freshWeight                 0.7   blend weight of the newly evaluated score (1 - w kept from history)
 *   confidentMistakeThreshold   0.9   confidence above which a mistake counts as confident
 *   confidentMistakeMultiplier  1.5   penalty multiplier for confident mistakes
 *   edgeCaseMultiplier          0.7   penalty multiplier for edge cases
 *   recoveryWindow              10    validations inspected for recovery (split into equal halves)
 *   recoveryThreshold           0.15  required correct-rate gain between halves
 *   recentWindow                10    validations behind recentCorrectRate
 *   trendWindow                 5     updates behind trend classification
 *   trendThreshold              2.0   mean change beyond which trend is IMPROVING/DECLINING
 *   validationHistoryCapacity   100   validations retained per agent
 *   updateHistoryCapacity       50    updates retained per agent
 *   outOfOrderPolicy            REJECT
 * </pre>
 *
 * <p>The canonical constructor validates every invariant and throws
 * {@link InvalidPolicyException} on the first violation.
 */
public record ReputationPolicy(
    double decayRate,
    double recoveryBonus,
    double baseReward,
    double basePenalty,
    double minRepId,
    double maxRepId,
    double defaultRepId,
    double freshWeight,
    double confidentMistakeThreshold,
    double confidentMistakeMultiplier,
    double edgeCaseMultiplier,
    int    recoveryWindow,
    double recoveryThreshold,
    int    recentWindow,
    int    trendWindow,
    double trendThreshold,
    int    validationHistoryCapacity,
    int    updateHistoryCapacity,
    OutOfOrderPolicy outOfOrderPolicy
) {

    public static final double DEFAULT_DECAY_RATE     = 0.95;
    public static final double DEFAULT_RECOVERY_BONUS = 1.2;
    public static final double DEFAULT_BASE_REWARD    = 10.0;
    public static final double DEFAULT_BASE_PENALTY   = 15.0;
    public static final double DEFAULT_MIN_REP_ID     = 10.0;
    public static final double DEFAULT_MAX_REP_ID     = 1000.0;
    public static final double DEFAULT_REP_ID         = 100.0;

    public ReputationPolicy {
        if (outOfOrderPolicy == null) {
            outOfOrderPolicy = OutOfOrderPolicy.REJECT;
        }
        requireFinite("decayRate", decayRate);
        requireFinite("recoveryBonus", recoveryBonus);
        requireFinite("baseReward", baseReward);
        requireFinite("basePenalty", basePenalty);
        requireFinite("minRepId", minRepId);
        requireFinite("maxRepId", maxRepId);
        requireFinite("defaultRepId", defaultRepId);
        requireFinite("freshWeight", freshWeight);
        requireFinite("confidentMistakeThreshold", confidentMistakeThreshold);
        requireFinite("confidentMistakeMultiplier", confidentMistakeMultiplier);
        requireFinite("edgeCaseMultiplier", edgeCaseMultiplier);
        requireFinite("recoveryThreshold", recoveryThreshold);
        requireFinite("trendThreshold", trendThreshold);

        if (minRepId >= maxRepId) {
            throw new InvalidPolicyException(
                "minRepId must be below maxRepId (min=" + minRepId + ", max=" + maxRepId + ")");
        }
        if (decayRate <= 0.0 || decayRate > 1.0) {
            throw new InvalidPolicyException("decayRate must be in (0, 1], got " + decayRate);
        }
        if (recoveryBonus < 1.0) {
            throw new InvalidPolicyException("recoveryBonus must be >= 1, got " + recoveryBonus);
        }
        if (baseReward < 0.0 || basePenalty < 0.0) {
            throw new InvalidPolicyException(
                "baseReward and basePenalty must be non-negative (reward=" + baseReward
                    + ", penalty=" + basePenalty + ")");
        }
        if (defaultRepId < minRepId || defaultRepId > maxRepId) {
            throw new InvalidPolicyException(
                "defaultRepId " + defaultRepId + " outside [" + minRepId + ", " + maxRepId + "]");
        }
        if (freshWeight < 0.0 || freshWeight > 1.0) {
            throw new InvalidPolicyException("freshWeight must be in [0, 1], got " + freshWeight);
        }
        if (confidentMistakeThreshold < 0.0 || confidentMistakeThreshold > 1.0) {
            throw new InvalidPolicyException(
                "confidentMistakeThreshold must be in [0, 1], got " + confidentMistakeThreshold);
        }
        if (confidentMistakeMultiplier <= 0.0 || edgeCaseMultiplier <= 0.0) {
            throw new InvalidPolicyException("penalty multipliers must be positive");
        }
        if (recoveryThreshold < 0.0 || trendThreshold < 0.0) {
            throw new InvalidPolicyException("recoveryThreshold and trendThreshold must be non-negative");
        }
        if (validationHistoryCapacity <= 0 || updateHistoryCapacity <= 0) {
            throw new InvalidPolicyException("history capacities must be positive");
        }
        if (recoveryWindow <= 0 || recoveryWindow % 2 != 0) {
            throw new InvalidPolicyException("recoveryWindow must be a positive even number, got " + recoveryWindow);
        }
        if (recoveryWindow > validationHistoryCapacity) {
            throw new InvalidPolicyException("recoveryWindow exceeds validationHistoryCapacity");
        }
        if (recentWindow <= 0 || recentWindow > validationHistoryCapacity) {
            throw new InvalidPolicyException("recentWindow must be in [1, validationHistoryCapacity]");
        }
        if (trendWindow <= 0 || trendWindow > updateHistoryCapacity) {
            throw new InvalidPolicyException("trendWindow must be in [1, updateHistoryCapacity]");
        }
    }

    /** Policy with every parameter at its documented default. */
    public static ReputationPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Weight kept from the decayed historical score when blending. */
    public double historicalWeight() {
        return 1.0 - freshWeight;
    }

    /** Clamps {@code score} into {@code [minRepId, maxRepId]}. */
    public double clamp(double score) {
        return Math.max(minRepId, Math.min(maxRepId, score));
    }

    public boolean withinBounds(double score) {
        return !Double.isNaN(score) && score >= minRepId && score <= maxRepId;
    }

    public Builder toBuilder() {
        return new Builder()
            .decayRate(decayRate)
            .recoveryBonus(recoveryBonus)
            .baseReward(baseReward)
            .basePenalty(basePenalty)
            .minRepId(minRepId)
            .maxRepId(maxRepId)
            .defaultRepId(defaultRepId)
            .freshWeight(freshWeight)
            .confidentMistakeThreshold(confidentMistakeThreshold)
            .confidentMistakeMultiplier(confidentMistakeMultiplier)
            .edgeCaseMultiplier(edgeCaseMultiplier)
            .recoveryWindow(recoveryWindow)
            .recoveryThreshold(recoveryThreshold)
            .recentWindow(recentWindow)
            .trendWindow(trendWindow)
            .trendThreshold(trendThreshold)
            .validationHistoryCapacity(validationHistoryCapacity)
            .updateHistoryCapacity(updateHistoryCapacity)
            .outOfOrderPolicy(outOfOrderPolicy);
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidPolicyException(name + " must be a finite number, got " + value);
        }
    }

    public static final class Builder {
        private double decayRate                  = DEFAULT_DECAY_RATE;
        private double recoveryBonus              = DEFAULT_RECOVERY_BONUS;
        private double baseReward                 = DEFAULT_BASE_REWARD;
        private double basePenalty                = DEFAULT_BASE_PENALTY;
        private double minRepId                   = DEFAULT_MIN_REP_ID;
        private double maxRepId                   = DEFAULT_MAX_REP_ID;
        private double defaultRepId               = DEFAULT_REP_ID;
        private double freshWeight                = 0.7;
        private double confidentMistakeThreshold  = 0.9;
        private double confidentMistakeMultiplier = 1.5;
        private double edgeCaseMultiplier         = 0.7;
        private int    recoveryWindow             = 10;
        private double recoveryThreshold          = 0.15;
        private int    recentWindow               = 10;
        private int    trendWindow                = 5;
        private double trendThreshold             = 2.0;
        private int    validationHistoryCapacity  = 100;
        private int    updateHistoryCapacity      = 50;
        private OutOfOrderPolicy outOfOrderPolicy = OutOfOrderPolicy.REJECT;

        private Builder() {}

        public Builder decayRate(double v)                  { this.decayRate = v; return this; }
        public Builder recoveryBonus(double v)              { this.recoveryBonus = v; return this; }
        public Builder baseReward(double v)                 { this.baseReward = v; return this; }
        public Builder basePenalty(double v)                { this.basePenalty = v; return this; }
        public Builder minRepId(double v)                   { this.minRepId = v; return this; }
        public Builder maxRepId(double v)                   { this.maxRepId = v; return this; }
        public Builder defaultRepId(double v)               { this.defaultRepId = v; return this; }
        public Builder freshWeight(double v)                { this.freshWeight = v; return this; }
        public Builder confidentMistakeThreshold(double v)  { this.confidentMistakeThreshold = v; return this; }
        public Builder confidentMistakeMultiplier(double v) { this.confidentMistakeMultiplier = v; return this; }
        public Builder edgeCaseMultiplier(double v)         { this.edgeCaseMultiplier = v; return this; }
        public Builder recoveryWindow(int v)                { this.recoveryWindow = v; return this; }
        public Builder recoveryThreshold(double v)          { this.recoveryThreshold = v; return this; }
        public Builder recentWindow(int v)                  { this.recentWindow = v; return this; }
        public Builder trendWindow(int v)                   { this.trendWindow = v; return this; }
        public Builder trendThreshold(double v)             { this.trendThreshold = v; return this; }
        public Builder validationHistoryCapacity(int v)     { this.validationHistoryCapacity = v; return this; }
        public Builder updateHistoryCapacity(int v)         { this.updateHistoryCapacity = v; return this; }
        public Builder outOfOrderPolicy(OutOfOrderPolicy v) { this.outOfOrderPolicy = v; return this; }

        public ReputationPolicy build() {
            return new ReputationPolicy(
                decayRate, recoveryBonus, baseReward, basePenalty,
                minRepId, maxRepId, defaultRepId, freshWeight,
                confidentMistakeThreshold, confidentMistakeMultiplier, edgeCaseMultiplier,
                recoveryWindow, recoveryThreshold, recentWindow,
                trendWindow, trendThreshold,
                validationHistoryCapacity, updateHistoryCapacity, outOfOrderPolicy);
        }
    }
}
