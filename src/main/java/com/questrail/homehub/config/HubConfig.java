package com.questrail.homehub.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for the hub runtime.
 *
 * <p>{@link #fromEnvironment(Map)} reads the deployment's environment
 * variables. All durations there are whole seconds. Unset variables keep
 * their defaults; a value that does not parse is rejected with an
 * {@link IllegalArgumentException} naming the variable.</p>
 */
public record HubConfig(
    MqttSettings mqtt,
    String viewerHost,
    int viewerPort,
    String webSocketPath,
    int maxViewers,
    int startupBufferCapacity,
    HubTimingPolicy timing
) {
    public static final int DEFAULT_MAX_VIEWERS = 10;

    public HubConfig {
        Objects.requireNonNull(mqtt, "mqtt");
        Objects.requireNonNull(viewerHost, "viewerHost");
        Objects.requireNonNull(webSocketPath, "webSocketPath");
        Objects.requireNonNull(timing, "timing");
        if (viewerPort < 0 || viewerPort > 65535) {
            throw new IllegalArgumentException("viewerPort out of range: " + viewerPort);
        }
        if (!webSocketPath.startsWith("/")) {
            throw new IllegalArgumentException("webSocketPath must start with '/'");
        }
        if (maxViewers <= 0) {
            throw new IllegalArgumentException("maxViewers must be positive");
        }
        if (startupBufferCapacity <= 0) {
            throw new IllegalArgumentException("startupBufferCapacity must be positive");
        }
    }

    public static HubConfig defaults() {
        return builder().build();
    }

    public InetSocketAddress viewerBindAddress() {
        return new InetSocketAddress(viewerHost, viewerPort);
    }

    public static HubConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");

        MqttSettings.Builder mqtt = MqttSettings.builder();
        String broker = env.get("MQTT_BROKER");
        if (broker != null && !broker.isBlank()) {
            mqtt.withHost(broker.trim());
        }
        Integer mqttPort = intVar(env, "MQTT_PORT");
        if (mqttPort != null) {
            mqtt.withPort(mqttPort);
        }
        String user = env.get("MQTT_USER");
        if (user != null && !user.isEmpty()) {
            mqtt.withCredentials(user, env.get("MQTT_PASS"));
        }
        Duration keepAlive = secondsVar(env, "MQTT_KEEPALIVE");
        if (keepAlive != null) {
            mqtt.withKeepAlive(keepAlive);
        }
        String clientId = env.get("MQTT_CLIENT_ID");
        if (clientId != null && !clientId.isBlank()) {
            mqtt.withClientId(clientId.trim());
        }

        HubTimingPolicy timing = HubTimingPolicy.defaults();
        Duration throttle = secondsVar(env, "MQTT_SAVE_THROTTLE");
        if (throttle != null) {
            timing = timing.withPersistThrottleWindow(throttle);
        }
        Duration offline = secondsVar(env, "SENSOR_OFFLINE_TIMEOUT");
        if (offline != null) {
            timing = timing.withOfflineTimeout(offline);
        }
        Duration sweep = secondsVar(env, "SENSOR_STATUS_CHECK_INTERVAL");
        if (sweep != null) {
            timing = timing.withSweepInterval(sweep);
        }
        Duration idle = secondsVar(env, "WEBSOCKET_HEARTBEAT_IDLE");
        if (idle != null) {
            timing = timing.withHeartbeatIdle(idle);
        }

        Builder builder = builder()
                .withMqtt(mqtt.build())
                .withTimingPolicy(timing);

        String host = env.get("HOST");
        if (host != null && !host.isBlank()) {
            builder.withViewerHost(host.trim());
        }
        Integer port = intVar(env, "PORT");
        if (port != null) {
            builder.withViewerPort(port);
        }
        Integer maxViewers = intVar(env, "MAX_VIEWERS");
        if (maxViewers != null) {
            builder.withMaxViewers(maxViewers);
        }
        Integer capacity = intVar(env, "STARTUP_BUFFER_CAPACITY");
        if (capacity != null) {
            builder.withStartupBufferCapacity(capacity);
        }
        return builder.build();
    }

    private static Integer intVar(Map<String, String> env, String name) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: '" + raw + "'", e);
        }
    }

    private static Duration secondsVar(Map<String, String> env, String name) {
        Integer seconds = intVar(env, name);
        if (seconds == null) {
            return null;
        }
        if (seconds <= 0) {
            throw new IllegalArgumentException(name + " must be a positive number of seconds: " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MqttSettings mqtt = MqttSettings.defaults();
        private String viewerHost = "0.0.0.0";
        private int viewerPort = 8000;
        private String webSocketPath = "/ws";
        private int maxViewers = DEFAULT_MAX_VIEWERS;
        private int startupBufferCapacity = 1000;
        private HubTimingPolicy timing = HubTimingPolicy.defaults();

        public Builder withMqtt(MqttSettings mqtt) {
            this.mqtt = mqtt;
            return this;
        }

        public Builder withViewerHost(String host) {
            this.viewerHost = host;
            return this;
        }

        public Builder withViewerPort(int port) {
            this.viewerPort = port;
            return this;
        }

        public Builder withWebSocketPath(String path) {
            this.webSocketPath = path;
            return this;
        }

        public Builder withMaxViewers(int maxViewers) {
            this.maxViewers = maxViewers;
            return this;
        }

        public Builder withStartupBufferCapacity(int capacity) {
            this.startupBufferCapacity = capacity;
            return this;
        }

        public Builder withTimingPolicy(HubTimingPolicy timing) {
            this.timing = timing;
            return this;
        }

        public HubConfig build() {
            return new HubConfig(mqtt, viewerHost, viewerPort, webSocketPath, maxViewers, startupBufferCapacity, timing);
        }
    }
}
