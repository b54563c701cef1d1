package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate view of a single agent's reputation.
 *
 * <ul>
 *   <li>{@code currentRepId}      – score currently held by the store.</li>
 *   <li>{@code avgRepId}          – mean {@code newRepId} across retained updates
 *       (equals {@code currentRepId} when there are none).</li>
 *   <li>{@code totalValidations}  – validations currently retained in history.</li>
 *   <li>{@code correctRate}       – fraction correct across retained validations.</li>
 *   <li>{@code recentCorrectRate} – fraction correct across the recent window.</li>
 *   <li>{@code recovering}        – whether the recovery bonus would apply now.</li>
 *   <li>{@code trend}             – classification of recent score changes.</li>
 * </ul>
 */
public record AgentStats(
    @JsonProperty("currentRepId")      double          currentRepId,
    @JsonProperty("avgRepId")          double          avgRepId,
    @JsonProperty("totalValidations")  int             totalValidations,
    @JsonProperty("correctRate")       double          correctRate,
    @JsonProperty("recentCorrectRate") double          recentCorrectRate,
    @JsonProperty("recovering")        boolean         recovering,
    @JsonProperty("trend")             ReputationTrend trend
) {}
