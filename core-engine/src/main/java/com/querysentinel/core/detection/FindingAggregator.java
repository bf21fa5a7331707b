package com.querysentinel.core.detection;

import com.querysentinel.core.model.AnomalyFinding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Combines the findings of all detectors into the final report order.
 *
 * <p>
 * The union keeps duplicates. Findings are ordered by user name ascending,
 * then start time descending; remaining ties fall back to query id and
 * anomaly type so that identical input always yields an identical sequence.
 * </p>
 *
 * @since 1.0.0
 */
public final class FindingAggregator {

    /** Report order of findings. */
    public static final Comparator<AnomalyFinding> REPORT_ORDER = Comparator
            .comparing(AnomalyFinding::getUserName)
            .thenComparing(AnomalyFinding::getStartTime, Comparator.reverseOrder())
            .thenComparing(AnomalyFinding::getQueryId)
            .thenComparing(AnomalyFinding::getAnomalyType);

    private FindingAggregator() {
        // utility class, not instantiable
    }

    /**
     * @param findingGroups findings of each detector; must not be {@code null}
     * @return unmodifiable, ordered list of every finding
     */
    public static List<AnomalyFinding> aggregate(Collection<? extends Collection<AnomalyFinding>> findingGroups) {
        Objects.requireNonNull(findingGroups, "findingGroups must not be null");
        List<AnomalyFinding> all = new ArrayList<>();
        for (Collection<AnomalyFinding> group : findingGroups) {
            all.addAll(group);
        }
        all.sort(REPORT_ORDER);
        return Collections.unmodifiableList(all);
    }
}
