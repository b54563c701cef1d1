package com.trustplatform.common.model;

/**
 * Direction of an agent's recent score changes.
 *
 * <ul>
 *   <li>{@link #IMPROVING}: mean recent change above the positive trend threshold.</li>
 *   <li>{@link #DECLINING}: mean recent change below the negative trend threshold.</li>
 *   <li>{@link #STABLE}:    anything in between, or no updates yet.</li>
 * </ul>
 */
public enum ReputationTrend {
    IMPROVING,
    DECLINING,
    STABLE
}
