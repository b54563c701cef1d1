package com.trustplatform.common.scoring;

import com.trustplatform.common.policy.ReputationPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DecayFunctionTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final DecayFunction decay = new DecayFunction(ReputationPolicy.defaults());

    @Test
    @DisplayName("one day at 0.95 → 5% lower")
    void oneDay() {
        assertEquals(95.0, decay.decay(100.0, T0, T0.plus(Duration.ofDays(1))), 1e-9);
    }

    @Test
    @DisplayName("two days compound")
    void twoDays() {
        assertEquals(90.25, decay.decay(100.0, T0, T0.plus(Duration.ofDays(2))), 1e-9);
    }

    @Test
    @DisplayName("partial days use fractional exponent")
    void halfDay() {
        assertEquals(100.0 * Math.sqrt(0.95), decay.decay(100.0, T0, T0.plus(Duration.ofHours(12))), 1e-9);
    }

    @Test
    @DisplayName("no elapsed time → unchanged")
    void noElapsedTime() {
        assertEquals(100.0, decay.decay(100.0, T0, T0));
    }

    @Test
    @DisplayName("no prior timestamp → unchanged")
    void noPriorTimestamp() {
        assertEquals(100.0, decay.decay(100.0, null, T0));
    }

    @Test
    @DisplayName("now before last → treated as no elapsed time")
    void backwards() {
        assertEquals(100.0, decay.decay(100.0, T0, T0.minusSeconds(3600)));
    }

    @Test
    @DisplayName("decay strictly decreases for any positive interval when rate < 1")
    void strictlyDecreasing() {
        double previous = 250.0;
        for (long minutes = 1; minutes <= 10_000; minutes *= 3) {
            double decayed = decay.decay(250.0, T0, T0.plus(Duration.ofMinutes(minutes)));
            assertTrue(decayed < previous, "minutes=" + minutes);
            previous = decayed;
        }
    }

    @Test
    @DisplayName("rate of 1.0 disables decay")
    void rateOne() {
        DecayFunction none = new DecayFunction(ReputationPolicy.builder().decayRate(1.0).build());
        assertEquals(100.0, none.decay(100.0, T0, T0.plus(Duration.ofDays(30))));
    }

    @Test
    @DisplayName("hoursElapsed is never negative")
    void hoursElapsed() {
        assertEquals(1.5, DecayFunction.hoursElapsed(T0, T0.plus(Duration.ofMinutes(90))), 1e-12);
        assertEquals(0.0, DecayFunction.hoursElapsed(T0, T0.minusSeconds(10)));
        assertEquals(0.0, DecayFunction.hoursElapsed(null, T0));
    }

    @Test
    @DisplayName("extreme spans decay toward zero instead of overflowing")
    void extremeSpan() {
        DecayFunction decay = new DecayFunction(ReputationPolicy.defaults());
        assertTrue(DecayFunction.hoursElapsed(Instant.MIN, T0) > 1e15);
        assertEquals(0.0, decay.decay(100.0, Instant.MIN, T0), 1e-12);
    }
}
