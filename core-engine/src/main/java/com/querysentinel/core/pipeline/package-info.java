/**
 * Composition of baseline building, feature extraction, detection and
 * aggregation into a single batch run.
 *
 * @since 1.0.0
 */
package com.querysentinel.core.pipeline;
