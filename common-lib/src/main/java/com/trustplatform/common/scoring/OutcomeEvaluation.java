package com.trustplatform.common.scoring;

/**
 * Result of evaluating one validation against a decayed score.
 *
 * @param newRaw  decayed score plus reward, or minus penalty; not yet blended or clamped
 * @param delta   signed reward (positive) or penalty (negative)
 * @param reason  human-readable description carried into the update record
 */
public record OutcomeEvaluation(double newRaw, double delta, String reason) {}
