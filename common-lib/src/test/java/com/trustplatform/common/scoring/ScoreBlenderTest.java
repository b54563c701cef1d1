package com.trustplatform.common.scoring;

import com.trustplatform.common.policy.ReputationPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreBlenderTest {

    private final ScoreBlender blender = new ScoreBlender(ReputationPolicy.defaults());

    @Test
    @DisplayName("70% new, 30% decayed history")
    void blend() {
        assertEquals(107.0, blender.blend(110.0, 100.0), 1e-9);
        assertEquals(91.25, blender.blend(84.5, 107.0), 1e-9);
    }

    @Test
    @DisplayName("result is clamped to bounds")
    void clamped() {
        assertEquals(10.0, blender.blend(-35.0, 10.0));
        assertEquals(1000.0, blender.blend(1010.0, 1000.0));
    }

    @Test
    @DisplayName("blend weight is configurable")
    void customWeight() {
        ScoreBlender allNew = new ScoreBlender(ReputationPolicy.builder().freshWeight(1.0).build());
        assertEquals(110.0, allNew.blend(110.0, 100.0), 1e-9);
    }
}
