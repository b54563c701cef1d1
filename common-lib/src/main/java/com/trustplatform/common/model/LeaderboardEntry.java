package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the reputation leaderboard. {@code rank} starts at 1.
 */
public record LeaderboardEntry(
    @JsonProperty("rank")    int        rank,
    @JsonProperty("agentId") String     agentId,
    @JsonProperty("score")   double     score,
    @JsonProperty("stats")   AgentStats stats
) {}
