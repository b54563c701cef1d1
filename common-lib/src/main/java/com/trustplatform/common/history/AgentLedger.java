package com.trustplatform.common.history;

import com.trustplatform.common.model.AgentSnapshot;
import com.trustplatform.common.model.RepIdUpdate;
import com.trustplatform.common.model.ValidationResult;

import java.time.Instant;
import java.util.List;

/**
 * Everything the engine keeps for one agent: the current score, the instant it
 * was last written, and the two bounded histories.
 *
 * <p>Mutators are called only by the engine while the agent's stripe lock in
 * {@link com.trustplatform.common.store.ScoreStore} is held; callers outside the
 * engine only ever see {@link AgentSnapshot} copies. The score is {@code volatile}
 * so leaderboard scans can read it without taking the agent lock.
 */
public final class AgentLedger {

    private final String agentId;
    private volatile double score;
    private Instant lastUpdated;
    private final BoundedHistory<ValidationResult> validations;
    private final BoundedHistory<RepIdUpdate> updates;

    public AgentLedger(String agentId, double initialScore,
                       int validationCapacity, int updateCapacity) {
        this.agentId = agentId;
        this.score = initialScore;
        this.validations = new BoundedHistory<>(validationCapacity);
        this.updates = new BoundedHistory<>(updateCapacity);
    }

    public String agentId() {
        return agentId;
    }

    public double score() {
        return score;
    }

    public Instant lastUpdated() {
        return lastUpdated;
    }

    public List<ValidationResult> validations() {
        return validations.snapshot();
    }

    public List<ValidationResult> latestValidations(int n) {
        return validations.latest(n);
    }

    public List<RepIdUpdate> updates() {
        return updates.snapshot();
    }

    public List<RepIdUpdate> latestUpdates(int n) {
        return updates.latest(n);
    }

    public int validationCount() {
        return validations.size();
    }

    /** Writes the outcome of one scored validation. */
    public void record(ValidationResult validation, RepIdUpdate update, Instant timestamp) {
        this.score = update.newRepId();
        if (lastUpdated == null || timestamp.isAfter(lastUpdated)) {
            this.lastUpdated = timestamp;
        }
        validations.append(validation);
        updates.append(update);
    }

    /** Administrative override: new score, no history, no last-update instant. */
    public void reset(double newScore) {
        this.score = newScore;
        this.lastUpdated = null;
        validations.clear();
        updates.clear();
    }

    /** Administrative load of a previously exported snapshot. */
    public void restore(AgentSnapshot snapshot) {
        this.score = snapshot.score();
        this.lastUpdated = snapshot.lastUpdated();
        validations.replaceWith(snapshot.validations());
        updates.replaceWith(snapshot.updates());
    }

    public AgentSnapshot toSnapshot() {
        return new AgentSnapshot(agentId, score, lastUpdated, validations.snapshot(), updates.snapshot());
    }
}
