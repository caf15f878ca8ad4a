package com.perfwatch.service;

import com.perfwatch.core.model.MetricSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SampleMessageDeserializer} and {@link SampleMessage}.
 */
class SampleMessageDeserializerTest {

    private static final Instant INGESTED = Instant.parse("2024-03-04T12:00:00Z");

    private final SampleMessageDeserializer deserializer = new SampleMessageDeserializer();

    @Test
    @DisplayName("Should decode a sample with an ISO-8601 timestamp")
    void shouldDecodeSample() {
        SampleMessage message = decode(
                "{\"entityId\":\"marketing\",\"metric\":\"quality\",\"value\":0.82,"
                        + "\"timestamp\":\"2024-03-04T10:00:00Z\",\"source\":\"crm\"}");

        MetricSample sample = message.toSample(INGESTED);

        assertThat(sample.getEntityId()).isEqualTo("marketing");
        assertThat(sample.getMetricName()).isEqualTo("quality");
        assertThat(sample.getValue()).isEqualTo(0.82);
        assertThat(sample.getTimestamp()).isEqualTo(Instant.parse("2024-03-04T10:00:00Z"));
    }

    @Test
    @DisplayName("Should stamp samples without timestamp with the ingestion time")
    void shouldUseIngestionTime() {
        SampleMessage message = decode("{\"entityId\":\"sales\",\"metric\":\"efficiency\",\"value\":1}");

        assertThat(message.toSample(INGESTED).getTimestamp()).isEqualTo(INGESTED);
    }

    @Test
    @DisplayName("Should return null for malformed or empty payloads")
    void shouldDropMalformed() {
        assertThat(decode("{not json")).isNull();
        assertThat(decode("{\"value\":\"high\"}")).isNull();
        assertThat(deserializer.deserialize("samples", new byte[0])).isNull();
        assertThat(deserializer.deserialize("samples", null)).isNull();
    }

    @Test
    @DisplayName("Should reject incomplete samples on conversion")
    void shouldRejectIncomplete() {
        SampleMessage noValue = decode("{\"entityId\":\"sales\",\"metric\":\"efficiency\"}");
        SampleMessage noEntity = decode("{\"metric\":\"efficiency\",\"value\":1}");

        assertThatThrownBy(() -> noValue.toSample(INGESTED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no value");
        assertThatThrownBy(() -> noEntity.toSample(INGESTED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("entityId");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private SampleMessage decode(String json) {
        return deserializer.deserialize("samples", json.getBytes(StandardCharsets.UTF_8));
    }
}
