/**
 * Configuration of a detection run.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.querysentinel.core.config.DetectionConfigLoader} into a
 * {@link com.querysentinel.core.config.DetectionConfig}. Validation runs
 * right after parsing so that bad values fail fast.
 * </p>
 *
 * @since 1.0.0
 */
package com.querysentinel.core.config;
