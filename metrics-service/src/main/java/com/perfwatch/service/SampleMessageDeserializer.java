package com.perfwatch.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.kafka.common.serialization.Deserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka {@link Deserializer} that converts raw record bytes to a
 * {@link SampleMessage}.
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}), so a
 * single bad record never stops the ingestion loop.
 * </p>
 */
public class SampleMessageDeserializer implements Deserializer<SampleMessage> {

    private static final Logger LOG = LoggerFactory.getLogger(SampleMessageDeserializer.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public SampleMessage deserialize(String topic, byte[] data) {
        if (data == null || data.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(data, SampleMessage.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize sample from '{}', skipping: {}", topic, e.getMessage());
            return null;
        }
    }
}
