package com.questrail.homehub.config;

import java.time.Duration;
import java.util.Objects;

/**
 * HubTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the hub.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>offlineTimeout</b> - A sensor not heard from for this long is
 *       reported offline.</li>
 *   <li><b>sweepInterval</b> - Period of the offline sweep. Together with
 *       {@code offlineTimeout} it bounds how late an offline transition can
 *       be noticed.</li>
 *   <li><b>persistThrottleWindow</b> - Minimum spacing between two durable
 *       writes for the same sensor and property. Broadcasts are not
 *       throttled.</li>
 *   <li><b>heartbeatIdle</b> - A viewer that has sent nothing for this long
 *       receives a heartbeat.</li>
 * </ul>
 */
public record HubTimingPolicy(
        Duration offlineTimeout,
        Duration sweepInterval,
        Duration persistThrottleWindow,
        Duration heartbeatIdle
) {
    public HubTimingPolicy {
        requirePositive(offlineTimeout, "offlineTimeout");
        requirePositive(sweepInterval, "sweepInterval");
        requirePositive(persistThrottleWindow, "persistThrottleWindow");
        requirePositive(heartbeatIdle, "heartbeatIdle");
    }

    /**
     * Default values:
     * <ul>
     *   <li>offlineTimeout: 30s</li>
     *   <li>sweepInterval: 5s</li>
     *   <li>persistThrottleWindow: 5s</li>
     *   <li>heartbeatIdle: 30s</li>
     * </ul>
     */
    public static HubTimingPolicy defaults() {
        return new HubTimingPolicy(
                Duration.ofSeconds(30),
                Duration.ofSeconds(5),
                Duration.ofSeconds(5),
                Duration.ofSeconds(30)
        );
    }

    public HubTimingPolicy withOfflineTimeout(Duration value) {
        return new HubTimingPolicy(value, sweepInterval, persistThrottleWindow, heartbeatIdle);
    }

    public HubTimingPolicy withSweepInterval(Duration value) {
        return new HubTimingPolicy(offlineTimeout, value, persistThrottleWindow, heartbeatIdle);
    }

    public HubTimingPolicy withPersistThrottleWindow(Duration value) {
        return new HubTimingPolicy(offlineTimeout, sweepInterval, value, heartbeatIdle);
    }

    public HubTimingPolicy withHeartbeatIdle(Duration value) {
        return new HubTimingPolicy(offlineTimeout, sweepInterval, persistThrottleWindow, value);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
