/**
 * Domain model classes for Query Sentinel.
 *
 * <ul>
 * <li>{@link com.querysentinel.core.model.QueryRecord}: one query from the
 * query history</li>
 * <li>{@link com.querysentinel.core.model.UserBaseline}: per-user profile
 * built from the historical window</li>
 * <li>{@link com.querysentinel.core.model.ActivityRecord}: recent query with
 * derived features</li>
 * <li>{@link com.querysentinel.core.model.AnomalyFinding}: one flagged
 * deviation</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.querysentinel.core.model;
