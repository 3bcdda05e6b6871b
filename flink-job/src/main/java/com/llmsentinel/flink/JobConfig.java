package com.llmsentinel.flink;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Kafka topics, parallelism and checkpointing of the detection job, read from
 * the container environment. Unset or blank variables take the defaults below.
 *
 * <pre>
 *   KAFKA_BOOTSTRAP_SERVERS        localhost:9092
 *   KAFKA_INPUT_TOPIC              llm-metrics
 *   KAFKA_INCIDENT_TOPIC           llm-incidents
 *   KAFKA_GROUP_ID                 llm-sentinel
 *   FLINK_PARALLELISM              1
 *   FLINK_CHECKPOINT_INTERVAL_MS   60000
 *   DETECTOR_CONFIG_PATH           (bundled detector.yml)
 * </pre>
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";
    static final String DEFAULT_INPUT_TOPIC = "llm-metrics";
    static final String DEFAULT_INCIDENT_TOPIC = "llm-incidents";
    static final String DEFAULT_GROUP_ID = "llm-sentinel";

    /** Upper bound Kafka brokers accept for a transactional producer by default. */
    private static final String PRODUCER_TRANSACTION_TIMEOUT_MS = "900000";

    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaIncidentTopic;
    private final String kafkaGroupId;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final String detectorConfigPath;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = nonBlank(b.kafkaBootstrapServers, "kafkaBootstrapServers");
        this.kafkaInputTopic = nonBlank(b.kafkaInputTopic, "kafkaInputTopic");
        this.kafkaIncidentTopic = nonBlank(b.kafkaIncidentTopic, "kafkaIncidentTopic");
        this.kafkaGroupId = nonBlank(b.kafkaGroupId, "kafkaGroupId");
        if (b.parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + b.parallelism);
        }
        if (b.checkpointIntervalMs < 1) {
            throw new IllegalArgumentException(
                    "checkpointIntervalMs must be >= 1, got: " + b.checkpointIntervalMs);
        }
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.detectorConfigPath = b.detectorConfigPath == null ? "" : b.detectorConfigPath.trim();
    }

    /**
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    static JobConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment map must not be null");
        Builder b = new Builder();
        b.kafkaBootstrapServers = env(env, "KAFKA_BOOTSTRAP_SERVERS", b.kafkaBootstrapServers);
        b.kafkaInputTopic = env(env, "KAFKA_INPUT_TOPIC", b.kafkaInputTopic);
        b.kafkaIncidentTopic = env(env, "KAFKA_INCIDENT_TOPIC", b.kafkaIncidentTopic);
        b.kafkaGroupId = env(env, "KAFKA_GROUP_ID", b.kafkaGroupId);
        long parallelism = envNumber(env, "FLINK_PARALLELISM", b.parallelism);
        if (parallelism > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("parallelism is too large: " + parallelism);
        }
        b.parallelism = (int) parallelism;
        b.checkpointIntervalMs = envNumber(env, "FLINK_CHECKPOINT_INTERVAL_MS", b.checkpointIntervalMs);
        b.detectorConfigPath = env(env, "DETECTOR_CONFIG_PATH", b.detectorConfigPath);
        return b.build();
    }

    /** Consumer settings on top of what the {@code KafkaSource} builder sets. */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", PRODUCER_TRANSACTION_TIMEOUT_MS);
        return props;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaIncidentTopic() {
        return kafkaIncidentTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /** @return the detector YAML path, or an empty string for the bundled defaults */
    public String getDetectorConfigPath() {
        return detectorConfigPath;
    }

    public boolean hasDetectorConfigPath() {
        return !detectorConfigPath.isEmpty();
    }

    @Override
    public String toString() {
        return "JobConfig{kafka=" + kafkaBootstrapServers
                + ", " + kafkaInputTopic + " -> " + kafkaIncidentTopic
                + ", group=" + kafkaGroupId
                + ", parallelism=" + parallelism
                + ", checkpointMs=" + checkpointIntervalMs
                + ", detectorConfig=" + (hasDetectorConfigPath() ? detectorConfigPath : "<bundled>")
                + '}';
    }

    /** Starts from the defaults; validation happens in {@link #build()}. */
    public static class Builder {
        private String kafkaBootstrapServers = DEFAULT_BOOTSTRAP_SERVERS;
        private String kafkaInputTopic = DEFAULT_INPUT_TOPIC;
        private String kafkaIncidentTopic = DEFAULT_INCIDENT_TOPIC;
        private String kafkaGroupId = DEFAULT_GROUP_ID;
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String detectorConfigPath = "";

        public Builder kafkaBootstrapServers(String servers) {
            this.kafkaBootstrapServers = servers;
            return this;
        }

        public Builder kafkaInputTopic(String topic) {
            this.kafkaInputTopic = topic;
            return this;
        }

        public Builder kafkaIncidentTopic(String topic) {
            this.kafkaIncidentTopic = topic;
            return this;
        }

        public Builder kafkaGroupId(String groupId) {
            this.kafkaGroupId = groupId;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder checkpointIntervalMs(long intervalMs) {
            this.checkpointIntervalMs = intervalMs;
            return this;
        }

        public Builder detectorConfigPath(String path) {
            this.detectorConfigPath = path;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a Kafka setting is blank or a
         *                                  number is out of range
         */
        public JobConfig build() {
            return new JobConfig(this);
        }
    }

    private static String nonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static long envNumber(Map<String, String> env, String name, long defaultValue) {
        String value = env(env, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable " + name + "='" + value + "'", e);
        }
    }
}
