package com.trustplatform.common.engine;

import com.trustplatform.common.exception.InvalidInputException;
import com.trustplatform.common.model.AgentSnapshot;
import com.trustplatform.common.model.RepIdUpdate;
import com.trustplatform.common.model.ValidationResult;
import com.trustplatform.common.policy.ReputationPolicy;

import java.time.Instant;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Input checks applied at the engine boundary before any state is touched.
 * Every failure is an {@link InvalidInputException}.
 */
final class ValidationGuard {

    private static final String UNKNOWN_AGENT = "unknown";

    private ValidationGuard() {}

    static void requireAgentId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new InvalidInputException(UNKNOWN_AGENT, "agentId must not be blank");
        }
    }

    static void requireResult(String agentId, ValidationResult result) {
        if (result == null) {
            throw new InvalidInputException(agentId, "validation result must not be null");
        }
        if (result.timestamp() == null) {
            throw new InvalidInputException(agentId, "validation timestamp must not be null");
        }
        requireUnitInterval(agentId, "confidence", result.confidence());
        requireUnitInterval(agentId, "difficulty", result.difficulty());
    }

    static void requireScore(String agentId, double score, ReputationPolicy policy) {
        if (!policy.withinBounds(score)) {
            throw new InvalidInputException(agentId,
                "score " + score + " outside [" + policy.minRepId() + ", " + policy.maxRepId() + "]");
        }
    }

    static void requireThreshold(String agentId, double requiredScore) {
        if (Double.isNaN(requiredScore)) {
            throw new InvalidInputException(agentId, "required score must be a number");
        }
    }

    static void requireLimit(String agentId, int limit) {
        if (limit < 0) {
            throw new InvalidInputException(agentId, "limit must not be negative, got " + limit);
        }
    }

    static void requireSnapshot(AgentSnapshot snapshot, ReputationPolicy policy) {
        if (snapshot == null) {
            throw new InvalidInputException(UNKNOWN_AGENT, "snapshot must not be null");
        }
        requireAgentId(snapshot.agentId());
        requireScore(snapshot.agentId(), snapshot.score(), policy);
        if (snapshot.validations().stream().anyMatch(Objects::isNull)
                || snapshot.updates().stream().anyMatch(Objects::isNull)) {
            throw new InvalidInputException(snapshot.agentId(), "snapshot history contains null entries");
        }
        String agentId = snapshot.agentId();
        snapshot.validations().forEach(v -> requireResult(agentId, v));
        snapshot.updates().forEach(u -> requireRestoredUpdate(agentId, u, policy));

        Instant newest = Stream.concat(
                snapshot.validations().stream().map(ValidationResult::timestamp),
                snapshot.updates().stream().map(RepIdUpdate::timestamp))
            .max(Instant::compareTo)
            .orElse(null);
        if (newest != null && (snapshot.lastUpdated() == null || snapshot.lastUpdated().isBefore(newest))) {
            throw new InvalidInputException(agentId,
                "lastUpdated " + snapshot.lastUpdated() + " is earlier than newest history entry " + newest);
        }
    }

    private static void requireRestoredUpdate(String agentId, RepIdUpdate update, ReputationPolicy policy) {
        if (!agentId.equals(update.agentId())) {
            throw new InvalidInputException(agentId, "snapshot update belongs to agent " + update.agentId());
        }
        if (update.timestamp() == null) {
            throw new InvalidInputException(agentId, "update timestamp must not be null");
        }
        requireScore(agentId, update.oldRepId(), policy);
        requireScore(agentId, update.newRepId(), policy);
    }

    private static void requireUnitInterval(String agentId, String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidInputException(agentId, field + " must be in [0, 1], got " + value);
        }
    }
}
