/**
 * Domain model classes for LLM Sentinel.
 *
 * <p>
 * Records produced by the detection engine and handed to collaborators:
 * </p>
 * <ul>
 * <li>{@link com.llmsentinel.core.model.Anomaly}: one abnormal metric
 * observation</li>
 * <li>{@link com.llmsentinel.core.model.Pattern}: a named group of correlated
 * anomalies</li>
 * <li>{@link com.llmsentinel.core.model.PatternRule}: correlation rule
 * configuration POJO</li>
 * <li>{@link com.llmsentinel.core.model.DetectionSummary}: health / status
 * counters</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.llmsentinel.core.model;
