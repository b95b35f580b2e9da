package com.questrail.homehub.ingest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SensorTopicTest {

    @Test
    void parsesPropertyThenSensor() {
        SensorTopic topic = SensorTopic.parse("pico/temperature/kitchen").orElseThrow();
        assertEquals("temperature", topic.property());
        assertEquals("kitchen", topic.sensorId());
        assertEquals("pico/temperature/kitchen", topic.toTopic());
    }

    @Test
    void emptySegmentsAreLeftToTheValidator() {
        SensorTopic topic = SensorTopic.parse("pico/temperature/").orElseThrow();
        assertEquals("", topic.sensorId());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "pico/temperature",
        "pico/temperature/kitchen/extra",
        "other/temperature/kitchen",
        "PICO/temperature/kitchen",
        "",
        "pico"
    })
    void rejectsWrongShape(String topic) {
        assertTrue(SensorTopic.parse(topic).isEmpty());
    }

    @Test
    void rejectsNull() {
        assertTrue(SensorTopic.parse(null).isEmpty());
    }
}
