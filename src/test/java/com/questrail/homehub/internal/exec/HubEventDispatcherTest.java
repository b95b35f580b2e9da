package com.questrail.homehub.internal.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.homehub.api.Reading;
import com.questrail.homehub.api.SensorProperty;
import com.questrail.homehub.broadcast.BroadcastHub;
import com.questrail.homehub.broadcast.FakeViewerConnection;
import com.questrail.homehub.internal.events.HubEvent;
import com.questrail.homehub.message.ViewerMessageCodec;
import com.questrail.homehub.observability.HubErrorEvent;
import com.questrail.homehub.observability.RecordingObservabilitySink;
import com.questrail.homehub.state.LiveReadingCache;
import com.questrail.homehub.state.SensorStatusTracker;
import com.questrail.homehub.time.TestClocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HubEventDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private TestClocks clocks;
    private LiveReadingCache cache;
    private SensorStatusTracker tracker;
    private RecordingObservabilitySink sink;
    private FakeViewerConnection viewer;
    private HubEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clocks = new TestClocks();
        cache = new LiveReadingCache();
        tracker = new SensorStatusTracker(clocks.monotonic, clocks.wall, Duration.ofSeconds(30));
        sink = new RecordingObservabilitySink();
        BroadcastHub hub = new BroadcastHub(new ViewerMessageCodec(mapper), 10, sink, clocks.wall);
        viewer = new FakeViewerConnection("viewer");
        hub.connect(viewer);
        dispatcher = new HubEventDispatcher(cache, tracker, hub, sink, clocks.wall);
    }

    @Test
    void telemetryBroadcastsTheWholeCache() throws Exception {
        Reading kitchen = new Reading("kitchen", SensorProperty.TEMPERATURE, 21.5, clocks.wall.now());
        Reading hall = new Reading("hall", SensorProperty.PRESSURE, 1001.0, clocks.wall.now());
        cache.put(kitchen);
        cache.put(hall);

        dispatcher.handle(new HubEvent.Telemetry(hall, hall.observedAt()));

        assertEquals(1, viewer.sent().size());
        JsonNode json = mapper.readTree(viewer.sentTexts().get(0));
        assertEquals("sensors", json.get("type").asText());
        assertEquals(2, json.get("data").size());
    }

    @Test
    void statusChangeBroadcastsEveryKnownSensor() throws Exception {
        tracker.recordSeen("attic");
        tracker.recordSeen("porch");

        dispatcher.handle(new HubEvent.StatusChange("porch", true, clocks.wall.now()));

        JsonNode json = mapper.readTree(viewer.sentTexts().get(0));
        assertEquals("sensor_status", json.get("type").asText());
        assertTrue(json.get("data").has("attic"));
        assertTrue(json.get("data").has("porch"));
    }

    @Test
    void eachEventIsOneBroadcast() {
        Reading r = new Reading("kitchen", SensorProperty.HUMIDITY, 45.0, clocks.wall.now());
        cache.put(r);
        tracker.recordSeen("kitchen");

        dispatcher.handle(new HubEvent.StatusChange("kitchen", true, clocks.wall.now()));
        dispatcher.handle(new HubEvent.Telemetry(r, r.observedAt()));
        dispatcher.handle(new HubEvent.Telemetry(r, r.observedAt()));

        assertEquals(3, viewer.sent().size());
        assertTrue(sink.eventsOfType(HubErrorEvent.class).isEmpty());
    }
}
