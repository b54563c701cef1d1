package com.trustplatform.reputation;

import com.trustplatform.common.engine.ReputationEngine;
import com.trustplatform.reputation.service.ReputationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ReputationServiceApplicationTest {

    @Autowired
    private ReputationEngine engine;

    @Autowired
    private ReputationService service;

    @Test
    void contextLoadsWithApplicationYml() {
        assertThat(engine.policy().decayRate()).isEqualTo(0.95);
        assertThat(engine.policy().updateHistoryCapacity()).isEqualTo(50);
        assertThat(service).isNotNull();
    }
}
