package com.trustplatform.common.engine;

import com.trustplatform.common.exception.InvalidInputException;
import com.trustplatform.common.history.AgentLedger;
import com.trustplatform.common.model.AgentSnapshot;
import com.trustplatform.common.model.AgentStats;
import com.trustplatform.common.model.LeaderboardEntry;
import com.trustplatform.common.model.RepIdUpdate;
import com.trustplatform.common.model.ReputationTrend;
import com.trustplatform.common.model.ValidationResult;
import com.trustplatform.common.policy.OutOfOrderPolicy;
import com.trustplatform.common.policy.ReputationPolicy;
import com.trustplatform.common.scoring.DecayFunction;
import com.trustplatform.common.scoring.OutcomeEvaluation;
import com.trustplatform.common.scoring.OutcomeEvaluator;
import com.trustplatform.common.scoring.RecoveryDetector;
import com.trustplatform.common.scoring.ScoreBlender;
import com.trustplatform.common.scoring.TrendClassifier;
import com.trustplatform.common.store.ScoreStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Temporal reputation engine for autonomous agents.
 *
 * <h3>Update pipeline</h3>
 * <pre>
 *   validate input
 *   └─ lock agent stripe
 *      ├─ RecoveryDetector   (correct results only, reads validation history)
 *      ├─ DecayFunction      (stored score → decayed)
 *      ├─ OutcomeEvaluator   (decayed → newRaw)
 *      ├─ ScoreBlender       (blend newRaw with decayed, clamp)
 *      └─ AgentLedger.record (score, timestamp, both histories)
 * </pre>
 *
 * <p>{@link #updateRepId} is the only scoring mutator. {@link #resetRepId} and
 * {@link #restore} are administrative overrides and validate bounds before writing.
 *
 * <p>One instance per process or tenant; construct it explicitly and pass it to
 * callers. Thread-safe: same-agent operations are serialized by the store's
 * stripe locks, different agents proceed in parallel.
 */
public class ReputationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReputationEngine.class);

    private static final Comparator<LeaderboardCandidate> LEADERBOARD_ORDER =
        Comparator.comparingDouble((LeaderboardCandidate c) -> c.stats().currentRepId()).reversed()
            .thenComparing(LeaderboardCandidate::agentId);

    private final ReputationPolicy policy;
    private final ScoreStore store;
    private final DecayFunction decayFunction;
    private final OutcomeEvaluator evaluator;
    private final RecoveryDetector recoveryDetector;
    private final ScoreBlender blender;
    private final TrendClassifier trendClassifier;

    public ReputationEngine(ReputationPolicy policy) {
        this(policy, ScoreStore.DEFAULT_LOCK_STRIPES);
    }

    public ReputationEngine(ReputationPolicy policy, int lockStripes) {
        this.policy           = policy;
        this.store            = new ScoreStore(policy, lockStripes);
        this.decayFunction    = new DecayFunction(policy);
        this.evaluator        = new OutcomeEvaluator(policy);
        this.recoveryDetector = new RecoveryDetector(policy);
        this.blender          = new ScoreBlender(policy);
        this.trendClassifier  = new TrendClassifier(policy);
    }

    public ReputationPolicy policy() {
        return policy;
    }

    // ── Mutators ───────────────────────────────────────────────────

    /**
     * Scores one validation outcome and returns the resulting transition.
     *
     * @throws InvalidInputException for a blank agent id, a null result or timestamp,
     *         confidence/difficulty outside [0, 1], or an out-of-order timestamp
     *         under {@link OutOfOrderPolicy#REJECT}
     */
    public RepIdUpdate updateRepId(String agentId, ValidationResult result) {
        ValidationGuard.requireAgentId(agentId);
        ValidationGuard.requireResult(agentId, result);

        RepIdUpdate update = store.withLock(agentId, () -> applyLocked(agentId, result));

        log.info("REPID_UPDATE agentId={} old={} new={} change={} reason=\"{}\"",
                 agentId, round(update.oldRepId()), round(update.newRepId()),
                 round(update.change()), update.reason());
        return update;
    }

    /** Resets the agent to the default score and clears its history. */
    public void resetRepId(String agentId) {
        resetRepId(agentId, policy.defaultRepId());
    }

    /**
     * Resets the agent to {@code newScore} and clears its history and last-update instant.
     *
     * @throws InvalidInputException if {@code newScore} is outside the policy bounds
     */
    public void resetRepId(String agentId, double newScore) {
        ValidationGuard.requireAgentId(agentId);
        ValidationGuard.requireScore(agentId, newScore, policy);

        store.withLock(agentId, () -> {
            store.ledgerFor(agentId).reset(newScore);
            return null;
        });
        log.info("REPID_RESET agentId={} score={}", agentId, round(newScore));
    }

    /**
     * Loads a previously exported snapshot, replacing whatever the engine holds for
     * that agent. Histories longer than the configured capacities keep their newest entries.
     *
     * @throws InvalidInputException if the snapshot's score is outside the policy bounds
     */
    public void restore(AgentSnapshot snapshot) {
        ValidationGuard.requireSnapshot(snapshot, policy);
        apply(snapshot);
    }

    /**
     * Restores a batch of snapshots. Every snapshot is checked before any is
     * applied, so a rejected batch leaves the store untouched.
     *
     * @return number of snapshots applied
     */
    public int restoreAll(List<AgentSnapshot> snapshots) {
        if (snapshots == null) {
            throw new InvalidInputException("unknown", "snapshot list must not be null");
        }
        snapshots.forEach(snapshot -> ValidationGuard.requireSnapshot(snapshot, policy));
        snapshots.forEach(this::apply);
        return snapshots.size();
    }

    private void apply(AgentSnapshot snapshot) {
        String agentId = snapshot.agentId();

        store.withLock(agentId, () -> {
            store.ledgerFor(agentId).restore(snapshot);
            return null;
        });
        log.info("REPID_RESTORE agentId={} score={} validations={} updates={}",
                 agentId, round(snapshot.score()),
                 snapshot.validations().size(), snapshot.updates().size());
    }

    // ── Queries ────────────────────────────────────────────────────

    /** Current score; the policy default for an agent never seen. */
    public double getRepId(String agentId) {
        ValidationGuard.requireAgentId(agentId);
        return store.get(agentId);
    }

    public AgentStats getAgentStats(String agentId) {
        ValidationGuard.requireAgentId(agentId);
        return store.find(agentId)
            .map(ledger -> store.withLock(agentId, () -> statsOf(ledger)))
            .orElseGet(this::unseenStats);
    }

    /**
     * Known agents ordered by score descending (ties by agent id), at most {@code limit}.
     *
     * @throws InvalidInputException if {@code limit} is negative
     */
    public List<LeaderboardEntry> getLeaderboard(int limit) {
        ValidationGuard.requireLimit("leaderboard", limit);
        if (limit == 0) {
            return List.of();
        }

        List<LeaderboardCandidate> candidates = new ArrayList<>(store.size());
        for (AgentLedger ledger : store.ledgers()) {
            AgentStats stats = store.withLock(ledger.agentId(), () -> statsOf(ledger));
            candidates.add(new LeaderboardCandidate(ledger.agentId(), stats));
        }
        candidates.sort(LEADERBOARD_ORDER);

        int size = Math.min(limit, candidates.size());
        List<LeaderboardEntry> board = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            LeaderboardCandidate c = candidates.get(i);
            board.add(new LeaderboardEntry(i + 1, c.agentId(), c.stats().currentRepId(), c.stats()));
        }
        log.debug("Leaderboard built. requested={} returned={} known={}", limit, size, candidates.size());
        return board;
    }

    /** Newest {@code limit} updates, oldest-first. */
    public List<RepIdUpdate> getRecentUpdates(String agentId, int limit) {
        ValidationGuard.requireAgentId(agentId);
        ValidationGuard.requireLimit(agentId, limit);
        return store.find(agentId)
            .map(ledger -> store.withLock(agentId, () -> ledger.latestUpdates(limit)))
            .orElse(List.of());
    }

    /** Retained validations, oldest-first. */
    public List<ValidationResult> getValidationHistory(String agentId) {
        ValidationGuard.requireAgentId(agentId);
        return store.find(agentId)
            .map(ledger -> store.withLock(agentId, ledger::validations))
            .orElse(List.of());
    }

    /** Whether the agent's current score is at least {@code requiredScore}. */
    public boolean meetsThreshold(String agentId, double requiredScore) {
        ValidationGuard.requireAgentId(agentId);
        ValidationGuard.requireThreshold(agentId, requiredScore);
        return store.get(agentId) >= requiredScore;
    }

    public Optional<AgentSnapshot> snapshot(String agentId) {
        ValidationGuard.requireAgentId(agentId);
        return store.find(agentId)
            .map(ledger -> store.withLock(agentId, ledger::toSnapshot));
    }

    /** Snapshots of every known agent, ordered by agent id. */
    public List<AgentSnapshot> snapshotAll() {
        List<AgentSnapshot> snapshots = new ArrayList<>(store.size());
        for (AgentLedger ledger : store.ledgers()) {
            snapshots.add(store.withLock(ledger.agentId(), ledger::toSnapshot));
        }
        snapshots.sort(Comparator.comparing(AgentSnapshot::agentId));
        return snapshots;
    }

    public int knownAgents() {
        return store.size();
    }

    // ── Pipeline ───────────────────────────────────────────────────

    private RepIdUpdate applyLocked(String agentId, ValidationResult result) {
        Instant now = result.timestamp();
        Instant last = store.find(agentId).map(AgentLedger::lastUpdated).orElse(null);
        if (last != null && now.isBefore(last) && policy.outOfOrderPolicy() == OutOfOrderPolicy.REJECT) {
            throw new InvalidInputException(agentId,
                "timestamp " + now + " is earlier than last update " + last);
        }

        AgentLedger ledger = store.ledgerFor(agentId);
        double oldScore = ledger.score();

        boolean recovering = result.correct()
            && recoveryDetector.isRecovering(ledger.latestValidations(policy.recoveryWindow()));
        double decayed = decayFunction.decay(oldScore, last, now);
        OutcomeEvaluation evaluation = evaluator.evaluate(decayed, result, recovering);
        double newScore = blender.blend(evaluation.newRaw(), decayed);

        RepIdUpdate update = RepIdUpdate.of(agentId, oldScore, newScore, evaluation.reason(), now);
        ledger.record(result, update, now);
        return update;
    }

    private AgentStats statsOf(AgentLedger ledger) {
        List<ValidationResult> validations = ledger.validations();
        List<RepIdUpdate> updates = ledger.updates();
        double current = ledger.score();

        double avg = updates.stream()
            .mapToDouble(RepIdUpdate::newRepId)
            .average()
            .orElse(current);
        List<ValidationResult> recent =
            validations.subList(Math.max(0, validations.size() - policy.recentWindow()), validations.size());

        return new AgentStats(
            current,
            avg,
            validations.size(),
            RecoveryDetector.correctRate(validations),
            RecoveryDetector.correctRate(recent),
            recoveryDetector.isRecovering(validations),
            trendClassifier.classify(updates));
    }

    private AgentStats unseenStats() {
        double d = policy.defaultRepId();
        return new AgentStats(d, d, 0, 0.0, 0.0, false, ReputationTrend.STABLE);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private record LeaderboardCandidate(String agentId, AgentStats stats) {}
}
