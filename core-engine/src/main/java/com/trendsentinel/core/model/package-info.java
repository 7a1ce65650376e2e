/**
 * Domain model of Trend Sentinel.
 *
 * <p>
 * Inputs are expressed as a {@link com.trendsentinel.core.model.DataTable}
 * with a typed {@link com.trendsentinel.core.model.TableSchema}; preparation
 * turns it into {@link com.trendsentinel.core.model.TimeSeries} values. The
 * remaining classes are immutable analysis results, gathered per series into
 * an {@link com.trendsentinel.core.model.AnalysisReport}.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.model;
