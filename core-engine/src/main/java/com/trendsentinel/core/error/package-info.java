/**
 * Error taxonomy of the analysis core.
 *
 * <p>
 * Every failure is an {@link com.trendsentinel.core.error.AnalysisException}
 * tagged with an {@link com.trendsentinel.core.error.ErrorCode}.
 * {@link com.trendsentinel.core.error.DetectorUnavailableException} is the only
 * one recovered locally (by the detection ensemble).
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.error;
