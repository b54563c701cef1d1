package com.trustplatform.reputation.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustplatform.common.engine.ReputationEngine;
import com.trustplatform.common.model.AgentSnapshot;
import com.trustplatform.common.model.AgentStats;
import com.trustplatform.common.model.LeaderboardEntry;
import com.trustplatform.common.model.RepIdUpdate;
import com.trustplatform.common.model.ValidationResult;
import com.trustplatform.common.trace.AgentLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reactive facade over the process-wide {@link ReputationEngine} bean.
 *
 * <p>Engine calls are CPU-bound and run on the subscribing thread through
 * {@link Mono#fromCallable}. Rejected input surfaces as
 * {@code Mono.error(InvalidInputException)} and is logged at WARN with the agent id.
 *
 * <p>Snapshot export/import is the hook a storage adapter uses to persist
 * reputation across restarts. The JSON shape is a list of {@link AgentSnapshot}.
 */
@Service
public class ReputationService {

    private static final Logger log = LoggerFactory.getLogger(ReputationService.class);

    private static final TypeReference<List<AgentSnapshot>> SNAPSHOT_LIST = new TypeReference<>() {};

    private final ReputationEngine engine;
    private final ObjectMapper objectMapper;

    public ReputationService(ReputationEngine engine, ObjectMapper objectMapper) {
        this.engine       = engine;
        this.objectMapper = objectMapper;
    }

    public Mono<RepIdUpdate> recordValidation(String agentId, ValidationResult result) {
        Mono<RepIdUpdate> pipeline = Mono.fromCallable(() -> engine.updateRepId(agentId, result))
            .doOnEach(signal -> {
                if (signal.isOnError()) {
                    String id = AgentLogContext.getAgentId(signal.getContextView());
                    AgentLogContext.withMdc(id, () ->
                        log.warn("Validation rejected. agentId={} reason={}",
                                 id, signal.getThrowable().getMessage()));
                }
            });
        return AgentLogContext.withAgentId(pipeline, agentId);
    }

    public Mono<Double> getRepId(String agentId) {
        return Mono.fromCallable(() -> engine.getRepId(agentId))
            .doOnError(e -> log.warn("RepID lookup failed. agentId={} reason={}", agentId, e.getMessage()));
    }

    public Mono<AgentStats> getAgentStats(String agentId) {
        return Mono.fromCallable(() -> engine.getAgentStats(agentId))
            .doOnNext(stats -> log.debug("Stats served. agentId={} score={} trend={}",
                                         agentId, stats.currentRepId(), stats.trend()))
            .doOnError(e -> log.warn("Stats lookup failed. agentId={} reason={}", agentId, e.getMessage()));
    }

    public Flux<LeaderboardEntry> getLeaderboard(int limit) {
        return Mono.fromCallable(() -> engine.getLeaderboard(limit))
            .flatMapMany(Flux::fromIterable)
            .doOnError(e -> log.warn("Leaderboard failed. limit={} reason={}", limit, e.getMessage()));
    }

    public Flux<RepIdUpdate> getRecentUpdates(String agentId, int limit) {
        return Mono.fromCallable(() -> engine.getRecentUpdates(agentId, limit))
            .flatMapMany(Flux::fromIterable);
    }

    public Mono<Boolean> meetsThreshold(String agentId, double requiredScore) {
        return Mono.fromCallable(() -> engine.meetsThreshold(agentId, requiredScore));
    }

    /**
     * Administrative reset. A {@code null} score resets to the policy default.
     */
    public Mono<Void> resetRepId(String agentId, Double newScore) {
        return Mono.fromRunnable(() -> {
                if (newScore == null) {
                    engine.resetRepId(agentId);
                } else {
                    engine.resetRepId(agentId, newScore);
                }
            })
            .doOnError(e -> log.warn("Reset rejected. agentId={} reason={}", agentId, e.getMessage()))
            .then();
    }

    /** Serializes every known agent's snapshot to a JSON array. */
    public Mono<String> exportSnapshots() {
        return Mono.fromCallable(() -> {
                List<AgentSnapshot> snapshots = engine.snapshotAll();
                String json = objectMapper.writeValueAsString(snapshots);
                log.info("Snapshots exported. agents={}", snapshots.size());
                return json;
            })
            .doOnError(e -> log.error("Snapshot export failed.", e));
    }

    /**
     * Restores every snapshot in a JSON array produced by {@link #exportSnapshots()}.
     * Nothing is restored when any snapshot in the array is rejected.
     *
     * @return number of agents restored
     */
    public Mono<Integer> importSnapshots(String json) {
        return Mono.fromCallable(() -> objectMapper.readValue(json, SNAPSHOT_LIST))
            .map(snapshots -> {
                int restored = engine.restoreAll(snapshots);
                log.info("Snapshots imported. agents={}", restored);
                return restored;
            })
            .doOnError(e -> log.error("Snapshot import failed.", e));
    }
}
