package com.trustplatform.reputation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustplatform.common.engine.ReputationEngine;
import com.trustplatform.common.exception.InvalidInputException;
import com.trustplatform.common.model.LeaderboardEntry;
import com.trustplatform.common.model.ReputationTrend;
import com.trustplatform.common.model.ValidationResult;
import com.trustplatform.common.policy.ReputationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ReputationServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private ReputationEngine engine;
    private ReputationService service;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        engine = new ReputationEngine(ReputationPolicy.defaults());
        objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        service = new ReputationService(engine, objectMapper);
    }

    @Nested
    @DisplayName("scoring")
    class Scoring {

        @Test
        @DisplayName("recordValidation emits the update and the score follows")
        void recordValidation() {
            StepVerifier.create(service.recordValidation("a1", ValidationResult.correct(0.5, 1.0, T0)))
                .assertNext(update -> assertEquals(107.0, update.newRepId(), 1e-9))
                .verifyComplete();

            StepVerifier.create(service.getRepId("a1"))
                .assertNext(score -> assertEquals(107.0, score, 1e-9))
                .verifyComplete();
        }

        @Test
        @DisplayName("nothing happens until subscription")
        void lazy() {
            service.recordValidation("a1", ValidationResult.correct(0.5, 1.0, T0));
            assertEquals(0, engine.knownAgents());
        }

        @Test
        @DisplayName("invalid input surfaces as an error signal")
        void invalidInput() {
            StepVerifier.create(service.recordValidation("a1", new ValidationResult(true, 3.0, 0.5, false, T0)))
                .expectError(InvalidInputException.class)
                .verify();
            assertEquals(0, engine.knownAgents());
        }

        @Test
        @DisplayName("stats reflect recorded validations")
        void stats() {
            service.recordValidation("a1", ValidationResult.correct(0.5, 1.0, T0)).block();
            service.recordValidation("a1", ValidationResult.incorrect(0.95, 1.0, false, T0)).block();

            StepVerifier.create(service.getAgentStats("a1"))
                .assertNext(stats -> {
                    assertEquals(91.25, stats.currentRepId(), 1e-9);
                    assertEquals(2, stats.totalValidations());
                    assertEquals(ReputationTrend.DECLINING, stats.trend());
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("reporting and admin")
    class Reporting {

        @Test
        @DisplayName("leaderboard streams entries in rank order")
        void leaderboard() {
            service.recordValidation("high", ValidationResult.correct(0.5, 1.0, T0)).block();
            service.recordValidation("low", ValidationResult.incorrect(0.5, 0.5, false, T0)).block();

            StepVerifier.create(service.getLeaderboard(5).map(LeaderboardEntry::agentId))
                .expectNext("high", "low")
                .verifyComplete();

            StepVerifier.create(service.getLeaderboard(-1))
                .expectError(InvalidInputException.class)
                .verify();
        }

        @Test
        @DisplayName("reset with and without an explicit score")
        void reset() {
            service.recordValidation("a1", ValidationResult.correct(0.5, 1.0, T0)).block();

            StepVerifier.create(service.resetRepId("a1", null)).verifyComplete();
            assertEquals(100.0, engine.getRepId("a1"));

            StepVerifier.create(service.resetRepId("a1", 640.0)).verifyComplete();
            assertEquals(640.0, engine.getRepId("a1"));

            StepVerifier.create(service.resetRepId("a1", 9999.0))
                .expectError(InvalidInputException.class)
                .verify();
        }

        @Test
        @DisplayName("meetsThreshold and recent updates")
        void thresholdAndRecent() {
            service.recordValidation("a1", ValidationResult.correct(0.5, 1.0, T0)).block();

            StepVerifier.create(service.meetsThreshold("a1", 105.0)).expectNext(true).verifyComplete();
            StepVerifier.create(service.meetsThreshold("a1", 200.0)).expectNext(false).verifyComplete();
            StepVerifier.create(service.getRecentUpdates("a1", 10)).expectNextCount(1).verifyComplete();
        }
    }

    @Nested
    @DisplayName("snapshot export and import")
    class Snapshots {

        @Test
        @DisplayName("exported JSON restores into a fresh engine")
        void exportImport() {
            service.recordValidation("a1", ValidationResult.correct(0.5, 1.0, T0)).block();
            service.recordValidation("a2", ValidationResult.incorrect(0.95, 0.2, true, T0)).block();

            String json = service.exportSnapshots().block();
            assertNotNull(json);

            ReputationEngine fresh = new ReputationEngine(ReputationPolicy.defaults());
            ReputationService restored = new ReputationService(fresh, objectMapper);

            StepVerifier.create(restored.importSnapshots(json)).expectNext(2).verifyComplete();
            assertEquals(engine.getRepId("a1"), fresh.getRepId("a1"));
            assertEquals(engine.getAgentStats("a2"), fresh.getAgentStats("a2"));
        }

        @Test
        @DisplayName("a rejected import leaves every agent as it was")
        void rejectedImportChangesNothing() {
            service.recordValidation("ok", ValidationResult.correct(0.5, 1.0, T0)).block();
            String json = "[{\"agentId\":\"ok\",\"score\":500,\"validations\":[],\"updates\":[]},"
                + "{\"agentId\":\"bad\",\"score\":99999,\"validations\":[],\"updates\":[]}]";

            StepVerifier.create(service.importSnapshots(json))
                .expectError(InvalidInputException.class)
                .verify();
            assertEquals(107.0, engine.getRepId("ok"), 1e-9);
            assertEquals(1, engine.knownAgents());
        }

        @Test
        @DisplayName("malformed JSON is an error, not a silent no-op")
        void malformed() {
            StepVerifier.create(service.importSnapshots("{not json"))
                .expectError()
                .verify();
        }
    }
}
