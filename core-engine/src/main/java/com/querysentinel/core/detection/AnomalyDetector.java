package com.querysentinel.core.detection;

import com.querysentinel.core.model.ActivityRecord;
import com.querysentinel.core.model.AnomalyFinding;
import com.querysentinel.core.model.AnomalyType;
import com.querysentinel.core.model.UserBaseline;

import java.io.Serializable;
import java.util.Optional;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong> pure functions of their
 * inputs: the same record and baseline always yield the same result, so a
 * detector may be shared across threads and evaluated in any order.
 * </p>
 */
public interface AnomalyDetector extends Serializable {

    /**
     * Evaluate one recent query against its user's baseline.
     *
     * @param activity the recent query and its features
     * @param baseline the baseline of the same user
     * @return a finding if the query deviates, empty otherwise
     */
    Optional<AnomalyFinding> evaluate(ActivityRecord activity, UserBaseline baseline);

    /**
     * @return the anomaly type this detector reports
     */
    AnomalyType getType();
}
