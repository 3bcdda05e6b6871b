/**
 * Apache Flink streaming job for LLM Sentinel.
 *
 * <p>
 * Consumes per-request LLM metrics from Kafka, runs the detection engine per
 * source, and publishes incident candidates back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.llmsentinel.flink.LlmSentinelJob}: main entry point</li>
 * <li>{@link com.llmsentinel.flink.DetectionProcessFunction}: keyed process
 * function holding one registry per source</li>
 * <li>{@link com.llmsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.llmsentinel.flink;
