/**
 * Configuration loading and validation for the detection engine.
 *
 * <p>
 * Settings and the correlation rule table are defined in YAML and loaded by
 * {@link com.llmsentinel.core.config.DetectorConfigLoader} into a
 * {@link com.llmsentinel.core.config.DetectorConfig} instance. Validation
 * runs automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.llmsentinel.core.config;
