package com.questrail.homehub.transport.mqtt;

import com.questrail.homehub.config.MqttSettings;
import com.questrail.homehub.transport.SensorTransportException;
import com.questrail.homehub.transport.SensorTransportListener;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PahoMqttSensorTransportTest {

    private static final SensorTransportListener IGNORE = new SensorTransportListener() {
        @Override
        public void onTransportUp() {
        }

        @Override
        public void onTransportDown(Throwable cause) {
        }

        @Override
        public void onMessage(String topic, byte[] payload) {
        }
    };

    @Test
    void connectOptionsReflectSettings() {
        MqttSettings settings = MqttSettings.builder()
            .withHost("broker.lan")
            .withPort(1884)
            .withCredentials("hub", "secret")
            .withKeepAlive(Duration.ofSeconds(20))
            .withConnectTimeout(Duration.ofSeconds(3))
            .build();

        MqttConnectOptions options = new PahoMqttSensorTransport(settings).connectOptions();

        assertTrue(options.isAutomaticReconnect());
        assertTrue(options.isCleanSession());
        assertEquals(20, options.getKeepAliveInterval());
        assertEquals(3, options.getConnectionTimeout());
        assertEquals("hub", options.getUserName());
        assertArrayEquals("secret".toCharArray(), options.getPassword());
    }

    @Test
    void anonymousSettingsSendNoCredentials() {
        MqttConnectOptions options = new PahoMqttSensorTransport(MqttSettings.defaults()).connectOptions();
        assertNull(options.getUserName());
    }

    @Test
    void startWithoutListenerIsAnError() {
        PahoMqttSensorTransport transport = new PahoMqttSensorTransport(MqttSettings.defaults());
        assertThrows(IllegalStateException.class, transport::start);
    }

    @Test
    void unreachableBrokerFailsStart() throws IOException {
        int port;
        try (ServerSocket free = new ServerSocket(0)) {
            port = free.getLocalPort();
        }
        PahoMqttSensorTransport transport = new PahoMqttSensorTransport(MqttSettings.builder()
            .withHost("127.0.0.1")
            .withPort(port)
            .withConnectTimeout(Duration.ofSeconds(2))
            .build());
        transport.setListener(IGNORE);

        assertThrows(SensorTransportException.class, transport::start);
        assertFalse(transport.isConnected());
        transport.stop();
    }

    @Test
    void describesBrokerAsHostAndPort() {
        PahoMqttSensorTransport transport = new PahoMqttSensorTransport(
            MqttSettings.builder().withHost("mqtt.home").withPort(1883).build());
        assertEquals("mqtt.home:1883", transport.brokerDescription());
    }
}
