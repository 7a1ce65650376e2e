/**
 * Analyzer façade: {@link com.trendsentinel.core.analysis.TimeSeriesAnalyzer}
 * and its non-throwing {@link com.trendsentinel.core.analysis.AnalysisOutcome}.
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.analysis;
