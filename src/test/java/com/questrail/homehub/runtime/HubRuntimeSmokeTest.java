package com.questrail.homehub.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.homehub.api.Reading;
import com.questrail.homehub.api.SensorProperty;
import com.questrail.homehub.config.HubConfig;
import com.questrail.homehub.message.ViewerMessageType;
import com.questrail.homehub.observability.RecordingObservabilitySink;
import com.questrail.homehub.store.PersistenceException;
import com.questrail.homehub.store.ReadingStore;
import com.questrail.homehub.store.RecordingReadingStore;
import com.questrail.homehub.transport.FakeSensorTransport;
import com.questrail.homehub.transport.SensorTransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HubRuntimeSmokeTest
 * -----------------------------------------------------------------------------
 * Full runtime on an ephemeral port with a fake sensor transport and a real
 * WebSocket viewer.
 */
class HubRuntimeSmokeTest {

    private static final long TIMEOUT_SECONDS = 5;

    private final ObjectMapper mapper = new ObjectMapper();

    private FakeSensorTransport transport;
    private RecordingReadingStore store;
    private RecordingObservabilitySink sink;
    private HubRuntime runtime;
    private WebSocket socket;

    @BeforeEach
    void setUp() {
        transport = new FakeSensorTransport();
        store = new RecordingReadingStore(List.of(
            new Reading("cellar", SensorProperty.HUMIDITY, 70.0, Instant.parse("2025-03-01T07:00:00Z"))));
        sink = new RecordingObservabilitySink();
        runtime = baseBuilder().withReadingStore(store).build();
    }

    private HubRuntime.Builder baseBuilder() {
        return HubRuntime.builder()
            .withConfig(HubConfig.builder().withViewerHost("127.0.0.1").withViewerPort(0).build())
            .withTransport(transport)
            .withObservabilitySink(sink);
    }

    /** Throw away the default runtime and build one with a fresh fake transport. */
    private void rebuild(UnaryOperator<HubRuntime.Builder> customize) {
        runtime.stop();
        transport = new FakeSensorTransport();
        runtime = customize.apply(baseBuilder()).build();
    }

    @AfterEach
    void tearDown() {
        if (socket != null) {
            socket.abort();
        }
        runtime.stop();
    }

    @Test
    void viewerGetsInitialStateThenLiveUpdates() throws Exception {
        runtime.start();
        assertTrue(runtime.health().mqtt());

        Viewer viewer = connectViewer();
        JsonNode initial = viewer.next();
        assertEquals("initial", initial.get("type").asText());
        assertEquals("cellar", initial.get("sensors").get(0).get("sensor").asText());
        assertTrue(initial.get("weather").isNull());
        assertTrue(initial.get("health").get("mqtt").asBoolean());
        assertEquals(1, runtime.activeViewers());

        transport.inject("pico/temperature/kitchen", "21.5");
        JsonNode sensorStatus = viewer.next();
        assertEquals("sensor_status", sensorStatus.get("type").asText());
        assertTrue(sensorStatus.get("data").get("kitchen").get("online").asBoolean());
        JsonNode sensors = viewer.next();
        assertEquals("sensors", sensors.get("type").asText());
        assertEquals(2, sensors.get("data").size());

        JsonNode weather = mapper.readTree("{\"temp\":4.0}");
        assertTrue(runtime.publishFeed(ViewerMessageType.WEATHER, weather).get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        JsonNode feed = viewer.next();
        assertEquals("weather", feed.get("type").asText());
        assertEquals(weather, feed.get("data"));

        assertFalse(runtime.publishFeed(ViewerMessageType.WEATHER, weather).get(TIMEOUT_SECONDS, TimeUnit.SECONDS),
            "unchanged feed is not rebroadcast");
    }

    @Test
    void readingsArrivingBeforeStartAreNotLost() throws Exception {
        transport.inject("pico/pressure/hall", "1012.5");

        runtime.start();

        Viewer viewer = connectViewer();
        JsonNode initial = viewer.next();
        boolean hall = false;
        for (JsonNode reading : initial.get("sensors")) {
            hall |= "hall".equals(reading.get("sensor").asText());
        }
        assertTrue(hall);
        assertEquals(1, store.persisted().size());
        assertEquals(2, store.loadLatest().size());
    }

    @Test
    void invalidFeedTypeIsRejected() {
        runtime.start();
        assertThrows(IllegalArgumentException.class,
            () -> runtime.publishFeed(ViewerMessageType.SENSORS, mapper.createObjectNode()));
    }

    @Test
    void brokerFailureAbortsStartup() {
        transport.failStartWith(new SensorTransportException("connection refused", null));

        assertThrows(HubStartupException.class, runtime::start);
        assertEquals(1, transport.stopCount());
        assertThrows(IllegalStateException.class, runtime::start);
    }

    @Test
    void storageFailureAbortsStartupBeforeTheBroker() {
        rebuild(b -> b.withReadingStore(new ReadingStore() {
            @Override
            public void persist(Reading reading) {
            }

            @Override
            public List<Reading> loadLatest() throws PersistenceException {
                throw new PersistenceException("database locked");
            }
        }));

        HubStartupException e = assertThrows(HubStartupException.class, runtime::start);

        assertInstanceOf(PersistenceException.class, e.getCause());
        assertEquals(0, transport.startCount(), "broker is never contacted");
        assertFalse(transport.isConnected());
        assertFalse(runtime.health().mqtt());
        assertThrows(IllegalStateException.class, runtime::start);
    }

    @Test
    void stopLetsRunningEventLoopWorkFinishBeforeTheBrokerGoes() throws Exception {
        SlowFirstWriteMapper slowMapper = new SlowFirstWriteMapper();
        rebuild(b -> b.withReadingStore(store).withObjectMapper(slowMapper));
        AtomicBoolean finishedWhenBrokerStopped = new AtomicBoolean(false);
        transport.onStop(() -> finishedWhenBrokerStopped.set(slowMapper.finished.get()));
        runtime.start();

        transport.inject("pico/temperature/kitchen", "21.5");
        assertTrue(slowMapper.entered.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        runtime.stop();

        assertTrue(finishedWhenBrokerStopped.get());
    }

    @Test
    void stopIsIdempotent() {
        runtime.start();
        runtime.stop();
        runtime.stop();

        assertEquals(1, transport.stopCount());
        assertFalse(runtime.health().mqtt());
    }

    private Viewer connectViewer() throws Exception {
        Viewer viewer = new Viewer();
        URI uri = URI.create("ws://127.0.0.1:" + runtime.viewerAddress().getPort() + "/ws");
        socket = HttpClient.newHttpClient()
            .newWebSocketBuilder()
            .buildAsync(uri, viewer)
            .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return viewer;
    }

    /** Blocks the first serialization for a while so it is still running when stop() is called. */
    private static final class SlowFirstWriteMapper extends ObjectMapper {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private final AtomicBoolean first = new AtomicBoolean(true);

        @Override
        public String writeValueAsString(Object value) throws JsonProcessingException {
            if (!first.compareAndSet(true, false)) {
                return super.writeValueAsString(value);
            }
            entered.countDown();
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            String text = super.writeValueAsString(value);
            finished.set(true);
            return text;
        }
    }

    private final class Viewer implements WebSocket.Listener {
        private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                messages.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        JsonNode next() throws Exception {
            String text = messages.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            assertNotNull(text, "no message within " + TIMEOUT_SECONDS + "s");
            return mapper.readTree(text);
        }
    }
}
