package com.perfwatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;

/**
 * Kafka {@link Serializer} writing engine events ({@code Alert},
 * {@code TrendEvent}) as JSON with ISO-8601 timestamps.
 *
 * @since 1.0.0
 */
public class EngineEventSerializer implements Serializer<Object> {

    private final ObjectMapper mapper = newObjectMapper();

    @Override
    public byte[] serialize(String topic, Object event) {
        if (event == null) {
            return null;
        }
        try {
            return mapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + event.getClass().getSimpleName()
                    + " for topic '" + topic + "'", e);
        }
    }

    /**
     * Mapper used for everything the service writes as JSON.
     */
    static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }
}
