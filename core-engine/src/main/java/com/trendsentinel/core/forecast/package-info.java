/**
 * Trend and forecast engine: seasonality detection, classical
 * decomposition, exponential smoothing with bounded forecasts, trend
 * classification and growth metrics.
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.forecast;
