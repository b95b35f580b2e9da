package com.questrail.homehub.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.homehub.api.Reading;
import com.questrail.homehub.api.SensorProperty;
import com.questrail.homehub.api.SensorStatus;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ViewerMessageCodecTest {

    private static final Instant T0 = Instant.parse("2025-03-01T08:00:00Z");

    private final ViewerMessageCodec codec = new ViewerMessageCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void sensorsMessageUsesDashboardFieldNames() throws Exception {
        Reading r = new Reading("kitchen", SensorProperty.TEMPERATURE, 21.5, T0);

        JsonNode json = parse(codec.encode(new SensorsMessage(List.of(r))));

        assertEquals("sensors", json.get("type").asText());
        JsonNode entry = json.get("data").get(0);
        assertEquals("kitchen", entry.get("sensor").asText());
        assertEquals("temperature", entry.get("prop").asText());
        assertEquals(21.5, entry.get("temp").asDouble());
        assertEquals("2025-03-01T08:00:00Z", entry.get("ts").asText());
    }

    @Test
    void statusMessageIsKeyedBySensor() throws Exception {
        Map<String, SensorStatus> statuses = new LinkedHashMap<>();
        statuses.put("attic", new SensorStatus("attic", false, T0, 31.04));

        JsonNode json = parse(codec.encode(new SensorStatusMessage(statuses)));

        assertEquals("sensor_status", json.get("type").asText());
        JsonNode attic = json.get("data").get("attic");
        assertFalse(attic.get("online").asBoolean());
        assertEquals(T0.getEpochSecond(), attic.get("last_seen").asDouble(), 1e-9);
        assertEquals(31.0, attic.get("seconds_ago").asDouble(), 1e-9);
    }

    @Test
    void heartbeatHasNoData() throws Exception {
        EncodedViewerMessage encoded = codec.encode(HeartbeatMessage.INSTANCE);

        assertEquals("{\"type\":\"heartbeat\"}", encoded.text());
        assertFalse(parse(encoded).has("data"));
    }

    @Test
    void feedMessagePassesPayloadThrough() throws Exception {
        JsonNode payload = mapper.readTree("{\"temp\":3.5,\"icon\":\"rain\"}");

        JsonNode json = parse(codec.encode(new FeedMessage(ViewerMessageType.WEATHER, payload)));

        assertEquals("weather", json.get("type").asText());
        assertEquals(payload, json.get("data"));
    }

    @Test
    void feedMessageRefusesNonFeedTypes() {
        assertThrows(IllegalArgumentException.class,
            () -> new FeedMessage(ViewerMessageType.SENSORS, mapper.createObjectNode()));
    }

    @Test
    void initialStateIsFlattenedWithNullForMissingFeeds() throws Exception {
        Reading r = new Reading("kitchen", SensorProperty.HUMIDITY, 40.0, T0);
        Map<ViewerMessageType, JsonNode> feeds = new EnumMap<>(ViewerMessageType.class);
        feeds.put(ViewerMessageType.NAMEDAY, mapper.readTree("{\"name\":\"Anežka\"}"));

        InitialStateMessage initial = new InitialStateMessage(
            List.of(r),
            Map.of("kitchen", new SensorStatus("kitchen", true, T0, 0.0)),
            feeds,
            new HubHealth(true, false, true));

        JsonNode json = parse(codec.encode(initial));

        assertEquals("initial", json.get("type").asText());
        assertFalse(json.has("data"));
        assertEquals(1, json.get("sensors").size());
        assertTrue(json.get("sensor_status").get("kitchen").get("online").asBoolean());
        assertEquals("Anežka", json.get("nameday").get("name").asText());
        for (String absent : List.of("system", "weather", "transport", "todoist", "calendar")) {
            assertTrue(json.has(absent), absent);
            assertTrue(json.get(absent).isNull(), absent);
        }
        assertTrue(json.get("health").get("mqtt").asBoolean());
        assertFalse(json.get("health").get("database").asBoolean());
        assertTrue(json.get("health").get("wifi").asBoolean());
    }

    @Test
    void bytesAreUtf8OfText() {
        EncodedViewerMessage encoded = new EncodedViewerMessage(ViewerMessageType.NAMEDAY, "{\"n\":\"Štěpán\"}");
        assertArrayEquals("{\"n\":\"Štěpán\"}".getBytes(StandardCharsets.UTF_8), encoded.utf8());
    }

    private JsonNode parse(EncodedViewerMessage encoded) throws Exception {
        return mapper.readTree(encoded.text());
    }
}
