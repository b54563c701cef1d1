package com.trustplatform.reputation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustplatform.common.engine.ReputationEngine;
import com.trustplatform.common.policy.ReputationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ReputationProperties.class)
public class ReputationEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(ReputationEngineConfig.class);

    @Bean
    public ReputationPolicy reputationPolicy(ReputationProperties properties) {
        ReputationPolicy policy = properties.toPolicy();
        log.info("Reputation policy loaded. decayRate={} recoveryBonus={} reward={} penalty={} bounds=[{}, {}] outOfOrder={}",
                 policy.decayRate(), policy.recoveryBonus(), policy.baseReward(), policy.basePenalty(),
                 policy.minRepId(), policy.maxRepId(), policy.outOfOrderPolicy());
        return policy;
    }

    @Bean
    public ReputationEngine reputationEngine(ReputationPolicy policy, ReputationProperties properties) {
        return new ReputationEngine(policy, properties.lockStripes());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
