package com.questrail.homehub.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings for the sensor MQTT broker.
 *
 * @param username optional; {@code null} connects anonymously
 * @param password optional; only used together with a username
 */
public record MqttSettings(
        String host,
        int port,
        String username,
        String password,
        Duration keepAlive,
        Duration connectTimeout,
        String clientId
) {
    public MqttSettings {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(keepAlive, "keepAlive");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(clientId, "clientId");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (keepAlive.isNegative() || keepAlive.isZero()) {
            throw new IllegalArgumentException("keepAlive must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (clientId.isEmpty()) {
            throw new IllegalArgumentException("clientId must not be empty");
        }
    }

    public static MqttSettings defaults() {
        return builder().build();
    }

    /** {@code tcp://host:port}, the form Paho expects. */
    public String serverUri() {
        return "tcp://" + host + ":" + port;
    }

    public Optional<String> credentialsUser() {
        return username == null || username.isEmpty() ? Optional.empty() : Optional.of(username);
    }

    @Override
    public String toString() {
        // Never log the password.
        return "MqttSettings[" + serverUri() + ", user=" + credentialsUser().orElse("<anonymous>")
                + ", keepAlive=" + keepAlive + ", clientId=" + clientId + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "localhost";
        private int port = 1883;
        private String username;
        private String password;
        private Duration keepAlive = Duration.ofSeconds(60);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private String clientId = "homehub-core";

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withCredentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder withKeepAlive(Duration keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withClientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public MqttSettings build() {
            return new MqttSettings(host, port, username, password, keepAlive, connectTimeout, clientId);
        }
    }
}
