package com.querysentinel.core.detection;

import com.querysentinel.core.model.ActivityRecord;
import com.querysentinel.core.model.AnomalyFinding;
import com.querysentinel.core.model.AnomalyType;
import com.querysentinel.core.model.UserBaseline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Query complexity detector, with text length standing in for complexity.
 *
 * <p>
 * A query is an outlier when its length deviates from the user's mean length
 * by more than {@code deviationMultiplier × σ}. A zero standard deviation
 * gives a zero tolerance: every length other than the mean is flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class ComplexityDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ComplexityDetector.class);

    private final double deviationMultiplier;

    /**
     * @param deviationMultiplier number of standard deviations tolerated;
     *                            must be &gt; 0
     * @throws IllegalArgumentException if the multiplier is not positive
     */
    public ComplexityDetector(double deviationMultiplier) {
        if (!(deviationMultiplier > 0)) {
            throw new IllegalArgumentException(
                    "deviationMultiplier must be > 0, got: " + deviationMultiplier);
        }
        this.deviationMultiplier = deviationMultiplier;
    }

    @Override
    public Optional<AnomalyFinding> evaluate(ActivityRecord activity, UserBaseline baseline) {
        Objects.requireNonNull(activity, "ActivityRecord must not be null");
        Objects.requireNonNull(baseline, "UserBaseline must not be null");

        int length = activity.getQueryLength();
        double diff = Math.abs(length - baseline.getAvgLength());
        double allowedDeviation = deviationMultiplier * baseline.getStddevLength();

        if (diff <= allowedDeviation) {
            return Optional.empty();
        }

        LOG.debug("[{}] fired for query {}: length={} mean={} stddev={} deviation={}", getType(),
                activity.getQuery().getQueryId(), length, baseline.getAvgLength(),
                baseline.getStddevLength(), diff);

        return Optional.of(AnomalyFinding.forQuery(activity.getQuery())
                .anomalyType(getType())
                .anomalyDetails("Query length (" + length + ") deviates from normal pattern (avg: "
                        + DetailFormat.number(baseline.getAvgLength()) + ", stddev: "
                        + DetailFormat.number(baseline.getStddevLength()) + ")")
                .build());
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.COMPLEXITY;
    }

    public double getDeviationMultiplier() {
        return deviationMultiplier;
    }
}
