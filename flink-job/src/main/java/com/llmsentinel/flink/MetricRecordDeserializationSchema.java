package com.llmsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes to a
 * {@link MetricRecord}.
 *
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}) so a single
 * bad record does not crash the pipeline. A record without a timestamp is
 * stamped with the ingestion time.
 * </p>
 */
public class MetricRecordDeserializationSchema implements DeserializationSchema<MetricRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricRecordDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public MetricRecord deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            MetricRecord record = objectMapper().readValue(message, MetricRecord.class);
            if (record.getTimestamp() == null) {
                record.setTimestamp(Instant.now());
            }
            return record;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize metric record, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(MetricRecord nextElement) {
        return false;
    }

    @Override
    public TypeInformation<MetricRecord> getProducedType() {
        return TypeInformation.of(MetricRecord.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
