package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of everything the engine holds for one agent.
 *
 * <p>This is the unit a storage adapter persists and later hands back to
 * {@link com.trustplatform.common.engine.ReputationEngine#restore(AgentSnapshot)}.
 * {@code lastUpdated} is {@code null} for an agent that has been reset but not
 * updated since. Both lists are oldest-first.
 */
public record AgentSnapshot(
    @JsonProperty("agentId")     String                 agentId,
    @JsonProperty("score")       double                 score,
    @JsonProperty("lastUpdated") Instant                lastUpdated,
    @JsonProperty("validations") List<ValidationResult> validations,
    @JsonProperty("updates")     List<RepIdUpdate>      updates
) {

    public AgentSnapshot {
        validations = validations == null ? List.of() : List.copyOf(validations);
        updates     = updates     == null ? List.of() : List.copyOf(updates);
    }
}
