package com.trustplatform.reputation.config;

import com.trustplatform.common.policy.OutOfOrderPolicy;
import com.trustplatform.common.policy.ReputationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised trust policy.
 *
 * Reads from application.yml under the "reputation" prefix:
 *
 * reputation:
 *   decay-rate: 0.95
 *   recovery-bonus: 1.2
 *   base-reward: 10
 *   base-penalty: 15
 *   min-rep-id: 10
 *   max-rep-id: 1000
 *   out-of-order-policy: REJECT
 *   lock-stripes: 64
 *
 * Every shaping constant of {@link ReputationPolicy} is exposed as well; see
 * that class for meanings. Invalid combinations fail application startup.
 */
@ConfigurationProperties(prefix = "reputation")
public record ReputationProperties(
        @DefaultValue("0.95")   double decayRate,
        @DefaultValue("1.2")    double recoveryBonus,
        @DefaultValue("10")     double baseReward,
        @DefaultValue("15")     double basePenalty,
        @DefaultValue("10")     double minRepId,
        @DefaultValue("1000")   double maxRepId,
        @DefaultValue("100")    double defaultRepId,
        @DefaultValue("0.7")    double freshWeight,
        @DefaultValue("0.9")    double confidentMistakeThreshold,
        @DefaultValue("1.5")    double confidentMistakeMultiplier,
        @DefaultValue("0.7")    double edgeCaseMultiplier,
        @DefaultValue("10")     int    recoveryWindow,
        @DefaultValue("0.15")   double recoveryThreshold,
        @DefaultValue("10")     int    recentWindow,
        @DefaultValue("5")      int    trendWindow,
        @DefaultValue("2.0")    double trendThreshold,
        @DefaultValue("100")    int    validationHistoryCapacity,
        @DefaultValue("50")     int    updateHistoryCapacity,
        @DefaultValue("REJECT") OutOfOrderPolicy outOfOrderPolicy,
        @DefaultValue("64")     int    lockStripes
) {

    public ReputationPolicy toPolicy() {
        return ReputationPolicy.builder()
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
            .outOfOrderPolicy(outOfOrderPolicy)
            .build();
    }
}
