package com.llmsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should apply defaults when no variables are set")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.fromMap(Map.of());

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("llm-metrics");
        assertThat(config.getKafkaIncidentTopic()).isEqualTo("llm-incidents");
        assertThat(config.getKafkaGroupId()).isEqualTo("llm-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000);
        assertThat(config.hasDetectorConfigPath()).isFalse();
    }

    @Test
    @DisplayName("Should read values from the environment map")
    void shouldReadVariables() {
        JobConfig config = JobConfig.fromMap(Map.of(
                "KAFKA_BOOTSTRAP_SERVERS", "kafka:29092",
                "KAFKA_INCIDENT_TOPIC", "incidents",
                "FLINK_PARALLELISM", "4",
                "DETECTOR_CONFIG_PATH", "/etc/sentinel/detector.yml",
                "KAFKA_GROUP_ID", "  "));

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("kafka:29092");
        assertThat(config.getKafkaIncidentTopic()).isEqualTo("incidents");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getDetectorConfigPath()).isEqualTo("/etc/sentinel/detector.yml");
        assertThat(config.hasDetectorConfigPath()).isTrue();
        // blank values fall back to defaults
        assertThat(config.getKafkaGroupId()).isEqualTo("llm-sentinel");
    }

    @Test
    @DisplayName("Should fail on unparseable numbers")
    void shouldRejectBadNumbers() {
        assertThatThrownBy(() -> JobConfig.fromMap(Map.of("FLINK_PARALLELISM", "many")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric");
        assertThatThrownBy(() -> JobConfig.fromMap(Map.of("FLINK_CHECKPOINT_INTERVAL_MS", "1m")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("FLINK_CHECKPOINT_INTERVAL_MS='1m'");
        assertThatThrownBy(() -> JobConfig.fromMap(Map.of("FLINK_PARALLELISM", "3000000000")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
    }

    @Test
    @DisplayName("Builder should validate ranges and topics")
    void builderShouldValidate() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaIncidentTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaIncidentTopic");
    }

    @Test
    @DisplayName("Kafka properties should carry bootstrap servers and group id")
    void shouldBuildKafkaProperties() {
        JobConfig config = new JobConfig.Builder().kafkaBootstrapServers("k:9092").kafkaGroupId("g").build();

        assertThat(config.kafkaConsumerProperties())
                .containsEntry("bootstrap.servers", "k:9092")
                .containsEntry("group.id", "g");
        assertThat(config.kafkaProducerProperties())
                .containsEntry("bootstrap.servers", "k:9092")
                .containsEntry("transaction.timeout.ms", "900000");
    }
}
