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
 * Table access detector.
 *
 * <p>
 * Fires when a query reads a table the user never touched in the historical
 * window. Queries without an extracted table are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class TableAccessDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TableAccessDetector.class);

    @Override
    public Optional<AnomalyFinding> evaluate(ActivityRecord activity, UserBaseline baseline) {
        Objects.requireNonNull(activity, "ActivityRecord must not be null");
        Objects.requireNonNull(baseline, "UserBaseline must not be null");

        String table = activity.getTableAccessed();
        if (table == null || table.isEmpty()) {
            LOG.trace("[{}]: no table extracted from query {} – skipping", getType(),
                    activity.getQuery().getQueryId());
            return Optional.empty();
        }
        if (baseline.isCommonTable(table)) {
            return Optional.empty();
        }

        LOG.debug("[{}] fired for query {}: table={}", getType(), activity.getQuery().getQueryId(), table);

        return Optional.of(AnomalyFinding.forQuery(activity.getQuery())
                .anomalyType(getType())
                .anomalyDetails("Accessed table " + table + " which is not in commonly accessed tables")
                .build());
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.TABLE_ACCESS;
    }
}
