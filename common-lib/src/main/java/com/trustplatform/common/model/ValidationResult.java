package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A single validation outcome for one agent, as judged by an external oracle.
 *
 * <ul>
 *   <li>{@code correct}    – whether the agent's output was judged correct.</li>
 *   <li>{@code confidence} – the agent's own confidence in its output ([0.0, 1.0]).</li>
 *   <li>{@code difficulty} – task difficulty ([0.0, 1.0]; 1.0 = hardest).</li>
 *   <li>{@code edgeCase}   – caller flag for inherently ambiguous inputs.</li>
 *   <li>{@code timestamp}  – when the validation happened; non-decreasing per agent.</li>
 * </ul>
 *
 * Pure model. Range checks happen at the engine boundary.
 */
public record ValidationResult(
    @JsonProperty("correct")    boolean correct,
    @JsonProperty("confidence") double  confidence,
    @JsonProperty("difficulty") double  difficulty,
    @JsonProperty("edgeCase")   boolean edgeCase,
    @JsonProperty("timestamp")  Instant timestamp
) {

    public static ValidationResult correct(double confidence, double difficulty, Instant timestamp) {
        return new ValidationResult(true, confidence, difficulty, false, timestamp);
    }

    public static ValidationResult incorrect(double confidence, double difficulty,
                                             boolean edgeCase, Instant timestamp) {
        return new ValidationResult(false, confidence, difficulty, edgeCase, timestamp);
    }
}
