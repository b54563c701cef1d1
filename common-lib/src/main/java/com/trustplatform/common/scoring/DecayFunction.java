package com.trustplatform.common.scoring;

import com.trustplatform.common.policy.ReputationPolicy;

import java.time.Duration;
import java.time.Instant;

/**
 * Time-based attenuation of a stored score.
 *
 * <pre>
 *   decayed = score × decayRate ^ (hoursElapsed / 24)
 * </pre>
 *
 * <p>A run of bad validations caused by something outside the agent's control
 * fades instead of locking in. With {@code decayRate < 1} any positive elapsed
 * time strictly lowers a positive score; {@code decayRate == 1} disables decay.
 *
 * <p>No prior timestamp, or a {@code now} before {@code lastTimestamp}, counts as
 * zero elapsed time.
 */
public final class DecayFunction {

    static final double HOURS_PER_DAY = 24.0;
    private static final double SECONDS_PER_HOUR = 3_600.0;
    private static final double NANOS_PER_HOUR = 3_600_000_000_000.0;

    private final double decayRate;

    public DecayFunction(ReputationPolicy policy) {
        this.decayRate = policy.decayRate();
    }

    /**
     * @param score         stored score before attenuation
     * @param lastTimestamp instant of the last update; {@code null} for none
     * @param now           instant being scored
     * @return the attenuated score; equal to {@code score} when no time elapsed
     */
    public double decay(double score, Instant lastTimestamp, Instant now) {
        double hours = hoursElapsed(lastTimestamp, now);
        if (hours <= 0.0) {
            return score;
        }
        return score * Math.pow(decayRate, hours / HOURS_PER_DAY);
    }

    /** Hours between the two instants, never negative. */
    public static double hoursElapsed(Instant lastTimestamp, Instant now) {
        if (lastTimestamp == null || now == null || !now.isAfter(lastTimestamp)) {
            return 0.0;
        }
        Duration elapsed = Duration.between(lastTimestamp, now);
        return elapsed.getSeconds() / SECONDS_PER_HOUR + elapsed.getNano() / NANOS_PER_HOUR;
    }
}
