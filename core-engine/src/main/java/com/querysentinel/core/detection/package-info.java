/**
 * Anomaly detection engine.
 *
 * <p>
 * All detectors implement the
 * {@link com.querysentinel.core.detection.AnomalyDetector}
 * interface and are instantiated via
 * {@link com.querysentinel.core.detection.DetectorFactory}.
 * Built-in detector types:
 * </p>
 * <ul>
 * <li>{@link com.querysentinel.core.detection.TimeOfDayDetector}: query hour
 * outside the 5th-95th percentile band</li>
 * <li>{@link com.querysentinel.core.detection.ComplexityDetector}: query
 * length beyond mean ± N × σ</li>
 * <li>{@link com.querysentinel.core.detection.TableAccessDetector}: table not
 * accessed during the historical window</li>
 * </ul>
 *
 * <p>
 * {@link com.querysentinel.core.detection.FindingAggregator} merges their
 * findings into the report order.
 * </p>
 *
 * @since 1.0.0
 */
package com.querysentinel.core.detection;
