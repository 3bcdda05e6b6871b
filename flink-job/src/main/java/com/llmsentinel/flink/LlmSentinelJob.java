package com.llmsentinel.flink;

import com.llmsentinel.core.config.DetectorConfig;
import com.llmsentinel.core.config.DetectorConfigLoader;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Main entry point of the LLM Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (llm-metrics)
 *     → Deserialize JSON → MetricRecord
 *     → Key by source (model / deployment)
 *     → DetectionProcessFunction (per-key DetectionRegistry)
 *     → Serialize IncidentCandidate → JSON
 *     → Kafka (llm-incidents)
 * </pre>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing snapshots every key's registry, so baselines
 * survive restarts and failovers.
 * </p>
 *
 * @since 1.0.0
 */
public final class LlmSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(LlmSentinelJob.class);

    private LlmSentinelJob() {
        // entry-point class
    }

    public static void main(String[] args) throws Exception {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting LLM Sentinel with config: {}", config);

        DetectorConfig detectorConfig = loadDetectorConfig(config);

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        configureCheckpointing(env, config);

        buildPipeline(env, config, detectorConfig);

        env.execute("LLM Sentinel: Anomaly Detection");
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    static void buildPipeline(StreamExecutionEnvironment env, JobConfig config,
            DetectorConfig detectorConfig) {
        KafkaSource<MetricRecord> kafkaSource = KafkaSource.<MetricRecord>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaInputTopic())
                .setGroupId(config.getKafkaGroupId())
                .setProperties(config.kafkaConsumerProperties())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new MetricRecordDeserializationSchema())
                .build();

        DataStream<MetricRecord> records = env.fromSource(
                kafkaSource,
                WatermarkStrategy.<MetricRecord>forBoundedOutOfOrderness(Duration.ofSeconds(5))
                        .withIdleness(Duration.ofMinutes(1)),
                "kafka-llm-metrics-source");

        DataStream<IncidentCandidate> incidents = records
                .filter(Objects::nonNull) // drop deserialization failures
                .keyBy(MetricRecord::keyOrUnknown, Types.STRING)
                .process(new DetectionProcessFunction(detectorConfig))
                .name("llm-anomaly-detection");

        KafkaSink<IncidentCandidate> kafkaSink = KafkaSink.<IncidentCandidate>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setKafkaProducerConfig(config.kafkaProducerProperties())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.builder()
                                .setTopic(config.getKafkaIncidentTopic())
                                .setValueSerializationSchema(new IncidentSerializationSchema())
                                .build())
                .build();

        incidents.sinkTo(kafkaSink).name("kafka-llm-incidents-sink");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static DetectorConfig loadDetectorConfig(JobConfig config) {
        if (config.hasDetectorConfigPath()) {
            return DetectorConfigLoader.fromFile(config.getDetectorConfigPath());
        }
        return DetectorConfigLoader.defaults();
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
