package com.querysentinel.core.detection;

import com.querysentinel.core.config.DetectionConfig;
import com.querysentinel.core.model.AnomalyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances for each
 * {@link AnomalyType}.
 *
 * <p>
 * This is the single point of extension when adding a new anomaly type:
 * add the enum constant and map it to its detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create the detector for one anomaly type.
     *
     * @param type   the anomaly type; must not be {@code null}
     * @param config run configuration; must not be {@code null}
     * @return the matching {@link AnomalyDetector}
     */
    public static AnomalyDetector create(AnomalyType type, DetectionConfig config) {
        Objects.requireNonNull(type, "AnomalyType must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        return switch (type) {
            case TIME_OF_DAY -> new TimeOfDayDetector();
            case COMPLEXITY -> new ComplexityDetector(config.getDeviationMultiplier());
            case TABLE_ACCESS -> new TableAccessDetector();
        };
    }

    /**
     * Create one detector per anomaly type, in {@link AnomalyType} order.
     *
     * @param config run configuration; must not be {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        List<AnomalyDetector> detectors = Arrays.stream(AnomalyType.values())
                .map(type -> create(type, config))
                .toList();
        LOG.info("Created {} detector(s)", detectors.size());
        return Collections.unmodifiableList(detectors);
    }
}
