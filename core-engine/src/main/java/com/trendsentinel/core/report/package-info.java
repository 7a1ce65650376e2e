/**
 * Result assembly: merging detector, consensus, decomposition and forecast
 * outputs into an {@link com.trendsentinel.core.model.AnalysisReport} and
 * rendering it as an augmented table.
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.report;
