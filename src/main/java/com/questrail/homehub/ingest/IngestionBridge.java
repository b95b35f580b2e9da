package com.questrail.homehub.ingest;

import com.questrail.homehub.api.Reading;
import com.questrail.homehub.api.StatusTransition;
import com.questrail.homehub.internal.events.HubEvent;
import com.questrail.homehub.internal.events.HubEventHandler;
import com.questrail.homehub.internal.time.MonotonicScheduler;
import com.questrail.homehub.internal.time.WallClock;
import com.questrail.homehub.observability.HubErrorEvent;
import com.questrail.homehub.observability.HubObservabilitySink;
import com.questrail.homehub.observability.IngestObservabilityEvent;
import com.questrail.homehub.observability.TransportObservabilityEvent;
import com.questrail.homehub.state.HealthTracker;
import com.questrail.homehub.state.LiveReadingCache;
import com.questrail.homehub.state.PersistenceThrottle;
import com.questrail.homehub.state.SensorStatusTracker;
import com.questrail.homehub.store.PersistenceException;
import com.questrail.homehub.store.ReadingStore;
import com.questrail.homehub.transport.SensorTransportListener;
import com.questrail.homehub.validation.ReadingValidator;
import com.questrail.homehub.validation.RejectReason;
import com.questrail.homehub.validation.ValidationResult;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * IngestionBridge
 * =============================================================================
 * Carries sensor messages from the MQTT callback thread into the event loop.
 *
 * <h2>Transport thread work</h2>
 * For every message: parse the topic, validate the payload, record the sensor
 * as seen, update the live cache and, when the throttle allows, persist. None
 * of this touches viewer connections.
 *
 * <h2>Handoff</h2>
 * The resulting {@link HubEvent}s (an optional {@code StatusChange} followed
 * by a {@code Telemetry}) cross the thread boundary as one unit:
 * <ul>
 *   <li>before {@link #markReady()}: appended to the {@link StartupBuffer},
 *       all or nothing;</li>
 *   <li>after: submitted as a single task via
 *       {@link MonotonicScheduler#execute(Runnable)}.</li>
 * </ul>
 *
 * <h2>Ordering across the transition</h2>
 * {@link #markReady()} flips the state, drains the buffer and submits the
 * replay task while holding the same lock the live path takes to choose
 * between buffering and submitting. The replay task is therefore queued ahead
 * of every live task, and no event can be buffered after the drain.
 *
 * <p>{@link #onMessage(String, byte[])} never throws; every failure is
 * reported to the {@link HubObservabilitySink}.</p>
 */
public final class IngestionBridge implements SensorTransportListener
{
    private enum State { NOT_READY, READY }

    private final ReadingValidator validator;
    private final SensorStatusTracker tracker;
    private final LiveReadingCache cache;
    private final PersistenceThrottle throttle;
    private final ReadingStore store;
    private final StartupBuffer buffer;
    private final MonotonicScheduler scheduler;
    private final HubEventHandler handler;
    private final HubObservabilitySink sink;
    private final HealthTracker health;
    private final WallClock wallClock;
    private final String brokerDescription;

    private final ReentrantLock lock = new ReentrantLock();
    private State state = State.NOT_READY;

    public IngestionBridge(
            ReadingValidator validator,
            SensorStatusTracker tracker,
            LiveReadingCache cache,
            PersistenceThrottle throttle,
            ReadingStore store,
            StartupBuffer buffer,
            MonotonicScheduler scheduler,
            HubEventHandler handler,
            HubObservabilitySink sink,
            HealthTracker health,
            WallClock wallClock,
            String brokerDescription)
    {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.throttle = Objects.requireNonNull(throttle, "throttle");
        this.store = Objects.requireNonNull(store, "store");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.health = Objects.requireNonNull(health, "health");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.brokerDescription = Objects.requireNonNull(brokerDescription, "brokerDescription");
    }

    /**
     * Switch from buffering to direct handoff and replay everything buffered
     * so far, in arrival order, on the scheduler.
     *
     * @throws IllegalStateException if called more than once
     */
    public void markReady()
    {
        lock.lock();
        try {
            if (state == State.READY) {
                throw new IllegalStateException("IngestionBridge is already ready");
            }
            state = State.READY;
            List<HubEvent> replay = buffer.drain();
            scheduler.execute(() -> deliver(replay));
        } finally {
            lock.unlock();
        }
    }

    public boolean isReady()
    {
        lock.lock();
        try {
            return state == State.READY;
        } finally {
            lock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // SensorTransportListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp()
    {
        health.brokerConnected(true);
        sink.onTransportEvent(new TransportObservabilityEvent.TransportUp(wallClock.now(), brokerDescription));
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        health.brokerConnected(false);
        sink.onTransportEvent(new TransportObservabilityEvent.TransportDown(wallClock.now(), brokerDescription, cause));
    }

    @Override
    public void onMessage(String topic, byte[] payload)
    {
        try {
            ingest(topic, payload);
        } catch (RuntimeException e) {
            sink.onError(new HubErrorEvent(wallClock.now(), "Failed to ingest message on " + topic, e));
        }
    }

    private void ingest(String topic, byte[] payload)
    {
        Optional<SensorTopic> parsed = SensorTopic.parse(topic);
        if (parsed.isEmpty()) {
            reject(topic, RejectReason.MALFORMED_TOPIC, "expected pico/{property}/{sensor}");
            return;
        }
        SensorTopic t = parsed.get();

        String raw = payload == null ? null : new String(payload, StandardCharsets.US_ASCII);
        ValidationResult result = validator.validate(t.sensorId(), t.property(), raw);
        if (result instanceof ValidationResult.Rejected rejected) {
            reject(topic, rejected.reason(), rejected.detail());
            return;
        }
        Reading reading = ((ValidationResult.Accepted) result).reading();

        Optional<StatusTransition> transition = tracker.recordSeen(reading.sensorId());
        cache.put(reading);
        persistIfDue(reading);

        List<HubEvent> events = new ArrayList<>(2);
        transition.ifPresent(tr -> {
            sink.onStatusTransition(tr);
            events.add(new HubEvent.StatusChange(tr.sensorId(), tr.online(), tr.at()));
        });
        events.add(new HubEvent.Telemetry(reading, reading.observedAt()));

        handOff(List.copyOf(events));
    }

    private void persistIfDue(Reading reading)
    {
        if (!throttle.shouldPersist(reading.key())) {
            return;
        }
        try {
            store.persist(reading);
            health.databaseHealthy(true);
        } catch (PersistenceException | RuntimeException e) {
            health.databaseHealthy(false);
            sink.onError(new HubErrorEvent(wallClock.now(),
                    "Failed to persist " + reading.property().wireName() + " of " + reading.sensorId(), e));
        }
    }

    private void handOff(List<HubEvent> events)
    {
        boolean dropped = false;

        lock.lock();
        try {
            if (state == State.NOT_READY) {
                dropped = !buffer.offer(events);
            } else {
                scheduler.execute(() -> deliver(events));
            }
        } finally {
            lock.unlock();
        }

        if (dropped) {
            sink.onIngestEvent(new IngestObservabilityEvent.OverflowDropped(wallClock.now(), events, buffer.capacity()));
        }
    }

    private void deliver(List<HubEvent> events)
    {
        for (HubEvent event : events) {
            handler.handle(event);
        }
    }

    private void reject(String topic, RejectReason reason, String detail)
    {
        sink.onIngestEvent(new IngestObservabilityEvent.InputRejected(wallClock.now(), topic, reason, detail));
    }
}
