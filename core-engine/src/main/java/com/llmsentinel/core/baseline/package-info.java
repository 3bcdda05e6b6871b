/**
 * Capturing, persisting and synthesizing per-metric history so detection
 * does not start cold.
 *
 * @since 1.0.0
 */
package com.llmsentinel.core.baseline;
