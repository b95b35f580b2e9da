package com.questrail.homehub.internal.exec;

import com.questrail.homehub.api.StatusTransition;
import com.questrail.homehub.internal.events.HubEvent;
import com.questrail.homehub.internal.events.HubEventHandler;
import com.questrail.homehub.internal.time.Cancellable;
import com.questrail.homehub.internal.time.MonotonicClock;
import com.questrail.homehub.internal.time.MonotonicScheduler;
import com.questrail.homehub.internal.time.WallClock;
import com.questrail.homehub.observability.HubErrorEvent;
import com.questrail.homehub.observability.HubObservabilitySink;
import com.questrail.homehub.state.SensorStatusTracker;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SensorTimeoutSweeper
 * =============================================================================
 * Periodic task that notices sensors which have gone silent.
 *
 * <p>Every {@code interval} it asks the {@link SensorStatusTracker} for
 * online-to-offline transitions, reports each one, and hands it to the
 * dispatcher as a {@code StatusChange}. The next tick is armed only after the
 * current one finishes, so ticks never overlap.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   sweeper.start()  → arms the first tick
 *   sweeper.stop()   → cancels the pending tick; no further ticks run
 * </pre>
 */
public final class SensorTimeoutSweeper
{
    private final SensorStatusTracker tracker;
    private final HubEventHandler handler;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration interval;
    private final HubObservabilitySink sink;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean running;
    private volatile Cancellable pending;

    public SensorTimeoutSweeper(SensorStatusTracker tracker,
                                HubEventHandler handler,
                                MonotonicScheduler scheduler,
                                MonotonicClock clock,
                                WallClock wallClock,
                                Duration interval,
                                HubObservabilitySink sink)
    {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /**
     * Arms the first tick one interval from now.
     *
     * @throws IllegalStateException if already started
     */
    public void start()
    {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("SensorTimeoutSweeper already started");
        }
        running = true;
        arm();
    }

    public void stop()
    {
        running = false;
        Cancellable p = pending;
        if (p != null) {
            p.cancel();
            pending = null;
        }
    }

    public boolean isRunning()
    {
        return running;
    }

    /**
     * One sweep. Package-private so tests can drive it without a timer.
     */
    void sweepOnce()
    {
        List<StatusTransition> transitions = tracker.sweep();
        for (StatusTransition transition : transitions) {
            sink.onStatusTransition(transition);
            handler.handle(new HubEvent.StatusChange(transition.sensorId(), transition.online(), transition.at()));
        }
    }

    private void tick()
    {
        if (!running) {
            return;
        }
        try {
            sweepOnce();
        } catch (RuntimeException e) {
            sink.onError(new HubErrorEvent(wallClock.now(), "Sensor timeout sweep failed", e));
        } finally {
            if (running) {
                arm();
            }
        }
    }

    private void arm()
    {
        pending = scheduler.scheduleAfter(interval, clock, this::tick);
    }
}
