/**
 * Anomaly detection ensemble.
 *
 * <p>
 * All detectors implement {@link com.trendsentinel.core.detection.OutlierDetector}
 * and are created through
 * {@link com.trendsentinel.core.detection.DetectorFactory}:
 * </p>
 * <ul>
 * <li>{@link com.trendsentinel.core.detection.ZScoreDetector}: leave-one-out
 * z-score</li>
 * <li>{@link com.trendsentinel.core.detection.IqrFenceDetector}: interquartile
 * fence</li>
 * <li>{@link com.trendsentinel.core.detection.IsolationForestDetector}: seeded
 * isolation forest</li>
 * <li>{@link com.trendsentinel.core.detection.MovingAverageDeviationDetector}:
 * trailing moving average</li>
 * </ul>
 * <p>
 * {@link com.trendsentinel.core.detection.AnomalyEnsemble} runs them and
 * {@link com.trendsentinel.core.detection.ConsensusVoter} combines the
 * verdicts.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.detection;
