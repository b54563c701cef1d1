package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable record of one score transition produced by
 * {@link com.trustplatform.common.engine.ReputationEngine#updateRepId}.
 *
 * <p>{@code change} is always {@code newRepId - oldRepId}; {@code oldRepId} is the
 * stored score before decay was applied.
 */
public record RepIdUpdate(
    @JsonProperty("agentId")   String  agentId,
    @JsonProperty("oldRepId")  double  oldRepId,
    @JsonProperty("newRepId")  double  newRepId,
    @JsonProperty("change")    double  change,
    @JsonProperty("reason")    String  reason,
    @JsonProperty("timestamp") Instant timestamp
) {

    public static RepIdUpdate of(String agentId, double oldRepId, double newRepId,
                                 String reason, Instant timestamp) {
        return new RepIdUpdate(agentId, oldRepId, newRepId, newRepId - oldRepId, reason, timestamp);
    }
}
