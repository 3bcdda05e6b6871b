package com.llmsentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts an {@link IncidentCandidate}
 * to JSON bytes for the incident topic.
 */
public class IncidentSerializationSchema implements SerializationSchema<IncidentCandidate> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(IncidentSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(IncidentCandidate incident) {
        try {
            return objectMapper().writeValueAsBytes(incident);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize incident candidate {}: {}", incident, e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
