/**
 * Rolling per-metric statistics.
 *
 * @since 1.0.0
 */
package com.llmsentinel.core.stats;
