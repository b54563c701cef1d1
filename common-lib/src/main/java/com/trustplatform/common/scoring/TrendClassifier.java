package com.trustplatform.common.scoring;

import com.trustplatform.common.model.RepIdUpdate;
import com.trustplatform.common.model.ReputationTrend;
import com.trustplatform.common.policy.ReputationPolicy;

import java.util.List;

/**
 * Classifies the mean {@code change} of the last {@code trendWindow} updates.
 *
 * <pre>
 *   mean &gt;  +trendThreshold → IMPROVING
 *   mean &lt;  −trendThreshold → DECLINING
 *   otherwise              → STABLE
 * </pre>
 * Fewer updates than the window uses what is available; none is {@code STABLE}.
 */
public final class TrendClassifier {

    private final int window;
    private final double threshold;

    public TrendClassifier(ReputationPolicy policy) {
        this.window = policy.trendWindow();
        this.threshold = policy.trendThreshold();
    }

    /**
     * @param updates update history, oldest-first
     */
    public ReputationTrend classify(List<RepIdUpdate> updates) {
        if (updates == null || updates.isEmpty()) {
            return ReputationTrend.STABLE;
        }
        double meanChange = updates.subList(Math.max(0, updates.size() - window), updates.size())
            .stream()
            .mapToDouble(RepIdUpdate::change)
            .average()
            .orElse(0.0);

        if (meanChange > threshold)  return ReputationTrend.IMPROVING;
        if (meanChange < -threshold) return ReputationTrend.DECLINING;
        return ReputationTrend.STABLE;
    }
}
