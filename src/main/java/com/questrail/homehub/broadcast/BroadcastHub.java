package com.questrail.homehub.broadcast;

import com.questrail.homehub.internal.time.WallClock;
import com.questrail.homehub.message.EncodedViewerMessage;
import com.questrail.homehub.message.ViewerMessage;
import com.questrail.homehub.message.ViewerMessageCodec;
import com.questrail.homehub.observability.HubObservabilitySink;
import com.questrail.homehub.observability.ViewerObservabilityEvent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * BroadcastHub
 * =============================================================================
 * The set of live viewers, capped, and fan-out to all of them.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>At most {@link #maxConnections()} members at any time. A connection
 *       arriving at the cap is closed with {@value #POLICY_VIOLATION} and
 *       {@value #CAP_REASON}.</li>
 *   <li>A broadcast serializes its message once and hands the same bytes to
 *       every member of a snapshot taken under the lock. No send happens
 *       while the lock is held.</li>
 *   <li>A failed delivery removes and closes that member only. The other
 *       members still receive the message.</li>
 * </ul>
 *
 * <p>Broadcasts are issued from the event loop. {@link #connect} and
 * {@link #disconnect} are safe from any thread.</p>
 */
public final class BroadcastHub
{
    /** WebSocket close code 1008. */
    public static final int POLICY_VIOLATION = 1008;

    /** WebSocket close code 1011. */
    public static final int INTERNAL_ERROR = 1011;

    public static final String CAP_REASON = "Maximum connections reached";

    private final ViewerMessageCodec codec;
    private final int maxConnections;
    private final HubObservabilitySink sink;
    private final WallClock wallClock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<ViewerConnection> members = new LinkedHashSet<>();

    public BroadcastHub(ViewerMessageCodec codec, int maxConnections, HubObservabilitySink sink, WallClock wallClock)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive");
        }
        this.maxConnections = maxConnections;
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Admit a connection, or close it if the hub is full.
     * Connecting a connection that is already a member is a no-op.
     */
    public ConnectResult connect(ViewerConnection connection)
    {
        Objects.requireNonNull(connection, "connection");

        int active;
        boolean admitted;
        lock.lock();
        try {
            if (members.contains(connection)) {
                return new ConnectResult.Accepted(members.size());
            }
            admitted = members.size() < maxConnections;
            if (admitted) {
                members.add(connection);
            }
            active = members.size();
        } finally {
            lock.unlock();
        }

        if (!admitted) {
            connection.close(POLICY_VIOLATION, CAP_REASON);
            sink.onViewerEvent(new ViewerObservabilityEvent.Rejected(
                    wallClock.now(), connection.remoteIdentity(), CAP_REASON, maxConnections));
            return new ConnectResult.Rejected(CAP_REASON);
        }

        sink.onViewerEvent(new ViewerObservabilityEvent.Connected(
                wallClock.now(), connection.remoteIdentity(), active, maxConnections));
        return new ConnectResult.Accepted(active);
    }

    /**
     * Remove a connection. Idempotent.
     *
     * @return {@code true} if the connection was a member
     */
    public boolean disconnect(ViewerConnection connection)
    {
        Objects.requireNonNull(connection, "connection");

        int active;
        lock.lock();
        try {
            if (!members.remove(connection)) {
                return false;
            }
            active = members.size();
        } finally {
            lock.unlock();
        }

        sink.onViewerEvent(new ViewerObservabilityEvent.Disconnected(
                wallClock.now(), connection.remoteIdentity(), active, maxConnections));
        return true;
    }

    /**
     * Send one message to every current member.
     *
     * @return future of the number of successful deliveries; never completes
     *         exceptionally
     * @throws com.questrail.homehub.message.MessageEncodingException if the
     *         message cannot be serialized (nothing is sent)
     */
    public CompletableFuture<Integer> broadcast(ViewerMessage message)
    {
        Objects.requireNonNull(message, "message");
        EncodedViewerMessage encoded = codec.encode(message);

        List<ViewerConnection> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(members);
        } finally {
            lock.unlock();
        }

        if (snapshot.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }

        List<CompletableFuture<Boolean>> deliveries = new ArrayList<>(snapshot.size());
        for (ViewerConnection connection : snapshot) {
            deliveries.add(deliver(connection, encoded));
        }

        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    int delivered = 0;
                    for (CompletableFuture<Boolean> d : deliveries) {
                        if (d.join()) {
                            delivered++;
                        }
                    }
                    return delivered;
                });
    }

    /**
     * Send one message to a single viewer (initial state, heartbeat).
     * A failure is handled exactly as in {@link #broadcast}.
     *
     * @return future of whether the message was delivered; never completes
     *         exceptionally
     */
    public CompletableFuture<Boolean> send(ViewerConnection connection, ViewerMessage message)
    {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(message, "message");
        return deliver(connection, codec.encode(message));
    }

    public int activeConnections()
    {
        lock.lock();
        try {
            return members.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxConnections()
    {
        return maxConnections;
    }

    public List<ViewerConnection> connections()
    {
        lock.lock();
        try {
            return List.copyOf(members);
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<Boolean> deliver(ViewerConnection connection, EncodedViewerMessage encoded)
    {
        CompletableFuture<Boolean> outcome = new CompletableFuture<>();
        try {
            connection.send(encoded).whenComplete((ignored, error) -> {
                if (error == null) {
                    outcome.complete(Boolean.TRUE);
                } else {
                    dropFailed(connection, error);
                    outcome.complete(Boolean.FALSE);
                }
            });
        } catch (RuntimeException e) {
            dropFailed(connection, e);
            outcome.complete(Boolean.FALSE);
        }
        return outcome;
    }

    private void dropFailed(ViewerConnection connection, Throwable cause)
    {
        sink.onViewerEvent(new ViewerObservabilityEvent.DeliveryFailed(
                wallClock.now(), connection.remoteIdentity(), cause));
        disconnect(connection);
        try {
            connection.close(INTERNAL_ERROR, "Delivery failed");
        } catch (RuntimeException e) {
            sink.onViewerEvent(new ViewerObservabilityEvent.DeliveryFailed(
                    wallClock.now(), connection.remoteIdentity(), e));
        }
    }
}
