/**
 * Anomaly detection and correlation.
 *
 * <ul>
 * <li>{@link com.llmsentinel.core.detection.AnomalyEvaluator}: z-score test of
 * one value against its window, with severity mapping</li>
 * <li>{@link com.llmsentinel.core.detection.PatternCorrelator}: classifies a
 * group of co-occurring anomalies with a priority-ordered rule table</li>
 * <li>{@link com.llmsentinel.core.detection.DetectionRegistry}: owns the
 * per-metric windows and ties both together</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.llmsentinel.core.detection;
