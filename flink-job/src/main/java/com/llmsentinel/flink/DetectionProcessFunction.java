package com.llmsentinel.flink;

import com.llmsentinel.core.config.DetectorConfig;
import com.llmsentinel.core.detection.DetectionRegistry;
import com.llmsentinel.core.model.BatchResult;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Keyed process function that runs the detection engine over incoming
 * {@link MetricRecord}s.
 *
 * <p>
 * Each key (the record {@code source}, e.g. a model name) owns its own
 * {@link DetectionRegistry} in Flink keyed state, so baselines of different
 * models never mix and are included in every checkpoint.
 * </p>
 *
 * <h3>Error Handling</h3>
 * <p>
 * A record the engine rejects (non-finite value, blank metric name) is logged
 * at ERROR, counted and skipped; the key's state is left as it was.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionProcessFunction
        extends KeyedProcessFunction<String, MetricRecord, IncidentCandidate> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DetectionProcessFunction.class);

    /** Validated detector settings used to build each key's registry. */
    private final DetectorConfig detectorConfig;

    private transient ValueState<DetectionRegistry> registryState;

    private transient SentinelMetrics metrics;

    /**
     * @param detectorConfig detector settings; validated here
     * @throws NullPointerException  if {@code detectorConfig} is {@code null}
     * @throws IllegalStateException if the settings are invalid
     */
    public DetectionProcessFunction(DetectorConfig detectorConfig) {
        this.detectorConfig = Objects.requireNonNull(detectorConfig, "DetectorConfig must not be null");
        detectorConfig.validate();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        ValueStateDescriptor<DetectionRegistry> descriptor = new ValueStateDescriptor<>(
                "detection-registry", TypeInformation.of(DetectionRegistry.class));
        registryState = getRuntimeContext().getState(descriptor);

        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("DetectionProcessFunction opened with {} pattern rule(s)",
                detectorConfig.getPatterns().size());
    }

    @Override
    public void close() {
        LOG.info("DetectionProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(MetricRecord record,
            KeyedProcessFunction<String, MetricRecord, IncidentCandidate>.Context ctx,
            Collector<IncidentCandidate> out) throws Exception {
        long startNanos = System.nanoTime();

        DetectionRegistry registry = registryState.value();
        if (registry == null) {
            LOG.info("Creating detection registry for source [{}]", ctx.getCurrentKey());
            registry = new DetectionRegistry(detectorConfig);
        }

        Instant timestamp = record.getTimestamp() != null ? record.getTimestamp() : Instant.now();
        BatchResult result;
        try {
            result = registry.observeBatch(record.getMetrics(), timestamp);
        } catch (IllegalArgumentException e) {
            metrics.incrementRecordsRejected();
            LOG.error("Rejected record {} from source [{}]: {}",
                    record.getRequestId(), ctx.getCurrentKey(), e.getMessage());
            return;
        }

        registryState.update(registry);

        metrics.addDatapointsObserved(record.getMetrics().size());
        if (result.hasAnomalies()) {
            metrics.addAnomaliesDetected(result.getAnomalies().size());
            result.getPattern().ifPresent(p -> metrics.incrementPatternsDetected());

            IncidentCandidate incident = IncidentCandidate.from(record, result);
            out.collect(incident);
            LOG.info("Incident candidate emitted: {}", incident);
        }

        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }
}
