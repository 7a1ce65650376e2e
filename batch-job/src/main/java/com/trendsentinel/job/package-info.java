/**
 * Batch job for Trend Sentinel.
 *
 * <p>
 * This package wires the core analysis engine into a file-to-file run: it
 * reads a CSV table, analyzes every series concurrently and writes one JSON
 * document per series.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.trendsentinel.job.TrendSentinelJob}: main entry point</li>
 * <li>{@link com.trendsentinel.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.trendsentinel.job.SeriesFanOut}: per-series worker pool</li>
 * <li>{@link com.trendsentinel.job.ReportJsonWriter}: JSON-lines output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.trendsentinel.job;
