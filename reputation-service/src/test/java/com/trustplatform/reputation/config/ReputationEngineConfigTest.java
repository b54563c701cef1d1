package com.trustplatform.reputation.config;

import com.trustplatform.common.engine.ReputationEngine;
import com.trustplatform.common.exception.InvalidPolicyException;
import com.trustplatform.common.policy.OutOfOrderPolicy;
import com.trustplatform.common.policy.ReputationPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.annotation.UserConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class ReputationEngineConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(UserConfigurations.of(ReputationEngineConfig.class));

    @Test
    @DisplayName("no properties → documented defaults")
    void defaults() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(ReputationEngine.class);
            assertThat(ctx.getBean(ReputationPolicy.class)).isEqualTo(ReputationPolicy.defaults());
        });
    }

    @Test
    @DisplayName("properties under reputation.* override the policy")
    void overrides() {
        runner.withPropertyValues(
                "reputation.decay-rate=0.9",
                "reputation.base-penalty=20",
                "reputation.max-rep-id=500",
                "reputation.out-of-order-policy=CLAMP")
            .run(ctx -> {
                ReputationPolicy policy = ctx.getBean(ReputationEngine.class).policy();
                assertThat(policy.decayRate()).isEqualTo(0.9);
                assertThat(policy.basePenalty()).isEqualTo(20.0);
                assertThat(policy.maxRepId()).isEqualTo(500.0);
                assertThat(policy.outOfOrderPolicy()).isEqualTo(OutOfOrderPolicy.CLAMP);
            });
    }

    @Test
    @DisplayName("invalid policy fails startup")
    void invalidPolicy() {
        runner.withPropertyValues("reputation.min-rep-id=2000")
            .run(ctx -> {
                assertThat(ctx).hasFailed();
                assertThat(ctx.getStartupFailure()).hasRootCauseInstanceOf(InvalidPolicyException.class);
            });
    }
}
