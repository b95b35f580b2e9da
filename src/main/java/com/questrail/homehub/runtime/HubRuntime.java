package com.questrail.homehub.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.homehub.broadcast.BroadcastHub;
import com.questrail.homehub.config.HubConfig;
import com.questrail.homehub.ingest.IngestionBridge;
import com.questrail.homehub.ingest.StartupBuffer;
import com.questrail.homehub.internal.exec.HubEventDispatcher;
import com.questrail.homehub.internal.exec.SensorTimeoutSweeper;
import com.questrail.homehub.internal.time.MonotonicClock;
import com.questrail.homehub.internal.time.MonotonicScheduler;
import com.questrail.homehub.internal.time.ScheduledExecutorScheduler;
import com.questrail.homehub.internal.time.SystemMonotonicClock;
import com.questrail.homehub.internal.time.SystemWallClock;
import com.questrail.homehub.internal.time.WallClock;
import com.questrail.homehub.message.FeedMessage;
import com.questrail.homehub.message.HubHealth;
import com.questrail.homehub.message.ViewerMessageCodec;
import com.questrail.homehub.message.ViewerMessageType;
import com.questrail.homehub.observability.HubErrorEvent;
import com.questrail.homehub.observability.HubObservabilitySink;
import com.questrail.homehub.observability.NullObservabilitySink;
import com.questrail.homehub.state.ExternalFeedBoard;
import com.questrail.homehub.state.HealthTracker;
import com.questrail.homehub.state.LiveReadingCache;
import com.questrail.homehub.state.PersistenceThrottle;
import com.questrail.homehub.state.SensorStatusTracker;
import com.questrail.homehub.store.InMemoryReadingStore;
import com.questrail.homehub.store.PersistenceException;
import com.questrail.homehub.store.ReadingStore;
import com.questrail.homehub.transport.SensorTransport;
import com.questrail.homehub.transport.SensorTransportException;
import com.questrail.homehub.transport.mqtt.PahoMqttSensorTransport;
import com.questrail.homehub.validation.ReadingValidator;
import com.questrail.homehub.viewer.netty.NettyViewerServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HubRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the hub core.
 *
 * <h2>Startup order</h2>
 * <ol>
 *   <li>Seed the live cache from the reading store.</li>
 *   <li>Connect the sensor transport. Messages arriving from here on are
 *       buffered by the {@link IngestionBridge}.</li>
 *   <li>Bind the viewer server.</li>
 *   <li>Mark the bridge ready (replays the buffer on the event loop) and
 *       start the offline sweep.</li>
 * </ol>
 * Any failure stops whatever already started and aborts with a
 * {@link HubStartupException}.
 *
 * <h2>Shutdown order</h2>
 * Cancel the sweeper and wait until every task already queued on the event
 * loop (a sweep in progress included) has finished; then transport, then
 * viewer server (which also shuts down the event loop).
 */
public final class HubRuntime {
    private static final Logger log = LoggerFactory.getLogger(HubRuntime.class);

    private static final long EVENT_LOOP_DRAIN_TIMEOUT_SECONDS = 5;

    private final SensorTransport transport;
    private final ReadingStore store;
    private final LiveReadingCache cache;
    private final SensorStatusTracker tracker;
    private final ExternalFeedBoard feedBoard;
    private final BroadcastHub hub;
    private final IngestionBridge bridge;
    private final SensorTimeoutSweeper sweeper;
    private final NettyViewerServer server;
    private final MonotonicScheduler scheduler;
    private final HealthTracker health;
    private final HubObservabilitySink sink;
    private final WallClock wallClock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private HubRuntime(Builder b, SensorTransport transport, ReadingStore store) {
        HubConfig config = b.config;
        this.transport = transport;
        this.store = store;
        this.sink = b.observabilitySink;
        this.wallClock = b.wallClock;

        this.cache = new LiveReadingCache();
        this.tracker = new SensorStatusTracker(b.monotonicClock, wallClock, config.timing().offlineTimeout());
        this.feedBoard = new ExternalFeedBoard();
        this.hub = new BroadcastHub(new ViewerMessageCodec(b.objectMapper), config.maxViewers(), sink, wallClock);

        this.health = new HealthTracker();

        this.server = new NettyViewerServer(
                config.viewerBindAddress(),
                config.webSocketPath(),
                config.timing().heartbeatIdle(),
                hub,
                new HubSnapshotProvider(cache, tracker, feedBoard, health),
                wallClock);
        this.scheduler = new ScheduledExecutorScheduler(server.eventLoop(), b.monotonicClock);

        HubEventDispatcher dispatcher = new HubEventDispatcher(cache, tracker, hub, sink, wallClock);
        this.bridge = new IngestionBridge(
                new ReadingValidator(wallClock),
                tracker,
                cache,
                new PersistenceThrottle(b.monotonicClock, config.timing().persistThrottleWindow()),
                store,
                new StartupBuffer(config.startupBufferCapacity()),
                scheduler,
                dispatcher,
                sink,
                health,
                wallClock,
                transport.brokerDescription());

        this.sweeper = new SensorTimeoutSweeper(tracker, dispatcher, scheduler, b.monotonicClock, wallClock,
                config.timing().sweepInterval(), sink);

        transport.setListener(bridge);
    }

    /**
     * @throws HubStartupException if any startup step fails
     * @throws IllegalStateException if called twice
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("HubRuntime already started");
        }

        try {
            cache.loadInitial(store.loadLatest());
            log.info("Loaded {} cached reading(s) from storage", cache.size());
        } catch (PersistenceException e) {
            stop();
            throw new HubStartupException("Cannot seed live cache from storage", e);
        }

        try {
            transport.start();
        } catch (SensorTransportException e) {
            stop();
            throw new HubStartupException("Cannot connect to sensor broker " + transport.brokerDescription(), e);
        }

        try {
            server.start();
        } catch (IOException e) {
            stop();
            throw new HubStartupException("Cannot start viewer server", e);
        }

        bridge.markReady();
        sweeper.start();
        log.info("Hub started: viewers on {}, broker {}", server.boundAddress(), transport.brokerDescription());
    }

    /**
     * Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        sweeper.stop();
        awaitEventLoopIdle();
        transport.stop();
        server.stop();
        log.info("Hub stopped");
    }

    /**
     * Queue a no-op behind everything already submitted and wait for it, so no
     * sweep or broadcast is still running when the transport goes down.
     */
    private void awaitEventLoopIdle() {
        CompletableFuture<Void> barrier = new CompletableFuture<>();
        try {
            scheduler.execute(() -> barrier.complete(null));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop already shut down", e);
            return;
        }
        try {
            barrier.get(EVENT_LOOP_DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Event loop did not drain within {}s, stopping anyway", EVENT_LOOP_DRAIN_TIMEOUT_SECONDS, e);
        }
    }

    /**
     * Entry point for the external feed pollers. Runs on the event loop:
     * stores the payload and broadcasts it only if it differs from the last
     * one published for the same feed.
     *
     * @return future of whether a broadcast was issued
     * @throws IllegalArgumentException if {@code feed} is not an external feed type
     */
    public CompletableFuture<Boolean> publishFeed(ViewerMessageType feed, JsonNode payload) {
        Objects.requireNonNull(feed, "feed");
        Objects.requireNonNull(payload, "payload");
        if (!feed.isFeed()) {
            throw new IllegalArgumentException(feed + " is not an external feed type");
        }

        CompletableFuture<Boolean> result = new CompletableFuture<>();
        scheduler.execute(() -> {
            try {
                boolean changed = feedBoard.update(feed, payload);
                if (changed) {
                    hub.broadcast(new FeedMessage(feed, payload));
                }
                result.complete(changed);
            } catch (RuntimeException e) {
                sink.onError(new HubErrorEvent(wallClock.now(), "Failed to publish " + feed.wireName() + " feed", e));
                result.complete(Boolean.FALSE);
            }
        });
        return result;
    }

    public HubHealth health() {
        return health.snapshot();
    }

    public InetSocketAddress viewerAddress() {
        return server.boundAddress();
    }

    public int activeViewers() {
        return hub.activeConnections();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private HubConfig config = HubConfig.defaults();
        private SensorTransport transport;
        private ReadingStore readingStore;
        private HubObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ObjectMapper objectMapper = new ObjectMapper();

        public Builder withConfig(HubConfig config) {
            this.config = config;
            return this;
        }

        /** Defaults to an MQTT transport built from the config. */
        public Builder withTransport(SensorTransport transport) {
            this.transport = transport;
            return this;
        }

        /** Defaults to an empty {@link InMemoryReadingStore}. */
        public Builder withReadingStore(ReadingStore store) {
            this.readingStore = store;
            return this;
        }

        public Builder withObservabilitySink(HubObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public Builder withObjectMapper(ObjectMapper mapper) {
            this.objectMapper = mapper;
            return this;
        }

        public HubRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(objectMapper, "objectMapper");

            SensorTransport t = transport != null ? transport : new PahoMqttSensorTransport(config.mqtt());
            ReadingStore s = readingStore != null ? readingStore : new InMemoryReadingStore();
            return new HubRuntime(this, t, s);
        }
    }
}
