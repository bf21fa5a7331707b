/**
 * Batch job for Query Sentinel.
 *
 * <p>
 * This package wires the core detection engine to a JSON-lines query history
 * export and a JSON-lines findings sink.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.querysentinel.job.QuerySentinelJob}: main entry point</li>
 * <li>{@link com.querysentinel.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.querysentinel.job.JsonLinesQueryLogSource}: query history
 * reader</li>
 * <li>{@link com.querysentinel.job.JsonLinesFindingSink}: findings
 * writer</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.querysentinel.job;
