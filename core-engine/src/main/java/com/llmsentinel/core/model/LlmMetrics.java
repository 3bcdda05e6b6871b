package com.llmsentinel.core.model;

/**
 * Names of the well-known per-request metrics produced by the extraction
 * collaborator. The engine treats metric names as opaque strings; these
 * constants exist for the default pattern table and the synthetic baseline.
 */
public final class LlmMetrics {

    // Token economics
    public static final String TOKENS_TOTAL = "llm.tokens.total";
    public static final String TOKENS_PROMPT = "llm.tokens.prompt";
    public static final String TOKENS_RESPONSE = "llm.tokens.response";
    public static final String TOKENS_RATIO = "llm.tokens.ratio";

    // Cost
    public static final String COST_PER_REQUEST = "llm.cost.per_request";
    public static final String COST_INPUT = "llm.cost.input";
    public static final String COST_OUTPUT = "llm.cost.output";

    // Performance
    public static final String LATENCY_MS = "llm.latency.ms";
    public static final String THROUGHPUT_TOKENS_PER_SEC = "llm.throughput.tokens_per_sec";

    // Prompt patterns
    public static final String PROMPT_LENGTH = "llm.prompt.length";
    public static final String PROMPT_COMPLEXITY_SCORE = "llm.prompt.complexity_score";
    public static final String PROMPT_QUESTION_COUNT = "llm.prompt.question_count";
    public static final String PROMPT_CONTEXT_UTILIZATION = "llm.prompt.context_utilization";

    // Quality indicators
    public static final String RESPONSE_LENGTH = "llm.response.length";
    public static final String RESPONSE_IS_REFUSAL = "llm.response.is_refusal";
    public static final String RESPONSE_HAS_CODE = "llm.response.has_code";
    public static final String RESPONSE_IS_TRUNCATED = "llm.response.is_truncated";

    private LlmMetrics() {
        // constants holder
    }
}
