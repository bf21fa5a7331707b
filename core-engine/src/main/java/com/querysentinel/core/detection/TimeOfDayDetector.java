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
 * Time-of-day detector.
 *
 * <p>
 * Fires when the local hour of a query lies strictly outside the user's
 * 5th to 95th percentile band of historical query hours.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeOfDayDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TimeOfDayDetector.class);

    @Override
    public Optional<AnomalyFinding> evaluate(ActivityRecord activity, UserBaseline baseline) {
        Objects.requireNonNull(activity, "ActivityRecord must not be null");
        Objects.requireNonNull(baseline, "UserBaseline must not be null");

        int hour = activity.getQueryHour();
        if (hour >= baseline.getHourP05() && hour <= baseline.getHourP95()) {
            return Optional.empty();
        }

        LOG.debug("[{}] fired for query {}: hour={} outside [{}, {}]", getType(),
                activity.getQuery().getQueryId(), hour, baseline.getHourP05(), baseline.getHourP95());

        return Optional.of(AnomalyFinding.forQuery(activity.getQuery())
                .anomalyType(getType())
                .anomalyDetails("Query executed at hour " + hour + " outside normal hours ("
                        + DetailFormat.number(baseline.getHourP05()) + " to "
                        + DetailFormat.number(baseline.getHourP95()) + ")")
                .build());
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.TIME_OF_DAY;
    }
}
