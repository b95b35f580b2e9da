package com.questrail.homehub.transport.mqtt;

import com.questrail.homehub.config.MqttSettings;
import com.questrail.homehub.transport.SensorTransport;
import com.questrail.homehub.transport.SensorTransportException;
import com.questrail.homehub.transport.SensorTransportListener;

import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * PahoMqttSensorTransport
 * =============================================================================
 * Eclipse Paho backed implementation of the {@link SensorTransport} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not parse
 * topics, validate payloads or touch hub state.
 *
 * <h2>Paho containment rule</h2>
 * Paho types ({@code MqttMessage}, {@code MqttAsyncClient}, tokens) MUST NOT
 * escape this package. Inbound payloads are handed to the listener as the
 * {@code byte[]} Paho already owns.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} connects and waits for the first connection.</li>
 *   <li>Paho reconnects automatically; every (re)connect subscribes to
 *       {@value #TOPIC_FILTER} at QoS {@value #QOS} again.</li>
 *   <li>{@link #stop()} disconnects and closes the client.</li>
 * </ul>
 */
public final class PahoMqttSensorTransport implements SensorTransport
{
    private static final Logger log = LoggerFactory.getLogger(PahoMqttSensorTransport.class);

    public static final String TOPIC_FILTER = "pico/+/+";
    public static final int QOS = 0;

    private static final long DISCONNECT_QUIESCE_MILLIS = 1_000;

    private final MqttSettings settings;

    private volatile SensorTransportListener listener;
    private volatile MqttAsyncClient client;

    public PahoMqttSensorTransport(MqttSettings settings)
    {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public void setListener(SensorTransportListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() throws SensorTransportException
    {
        requireListener();
        if (client != null) {
            throw new IllegalStateException("transport already started");
        }

        MqttAsyncClient c;
        try {
            c = new MqttAsyncClient(settings.serverUri(), settings.clientId(), new MemoryPersistence());
        } catch (MqttException e) {
            throw new SensorTransportException("Cannot create MQTT client for " + brokerDescription(), e);
        }
        c.setCallback(new Callback(c));

        try {
            c.connect(connectOptions()).waitForCompletion(settings.connectTimeout().toMillis());
        } catch (MqttException e) {
            closeQuietly(c);
            throw new SensorTransportException("Cannot connect to MQTT broker " + brokerDescription(), e);
        }
        client = c;
        log.info("Connected to MQTT broker {} as {}", brokerDescription(), settings.clientId());
    }

    @Override
    public void stop()
    {
        MqttAsyncClient c = client;
        if (c == null) {
            return;
        }
        client = null;

        try {
            if (c.isConnected()) {
                c.disconnect(DISCONNECT_QUIESCE_MILLIS).waitForCompletion(settings.connectTimeout().toMillis());
            }
        } catch (MqttException e) {
            log.warn("MQTT disconnect from {} did not complete cleanly", brokerDescription(), e);
        }
        closeQuietly(c);

        SensorTransportListener l = listener;
        if (l != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public boolean isConnected()
    {
        MqttAsyncClient c = client;
        return c != null && c.isConnected();
    }

    @Override
    public String brokerDescription()
    {
        return settings.host() + ":" + settings.port();
    }

    MqttConnectOptions connectOptions()
    {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(true);
        options.setCleanSession(true);
        options.setKeepAliveInterval((int) settings.keepAlive().toSeconds());
        options.setConnectionTimeout((int) Math.max(1, settings.connectTimeout().toSeconds()));
        settings.credentialsUser().ifPresent(user -> {
            options.setUserName(user);
            if (settings.password() != null) {
                options.setPassword(settings.password().toCharArray());
            }
        });
        return options;
    }

    private SensorTransportListener requireListener()
    {
        SensorTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("SensorTransportListener must be set before start()");
        }
        return l;
    }

    private void closeQuietly(MqttAsyncClient c)
    {
        try {
            c.close();
        } catch (MqttException e) {
            log.debug("Closing MQTT client for {} failed", brokerDescription(), e);
        }
    }

    /**
     * Callback
     * -------------------------------------------------------------------------
     * Runs on the Paho callback thread and forwards to the port listener.
     */
    private final class Callback implements MqttCallbackExtended
    {
        private final MqttAsyncClient owner;

        private Callback(MqttAsyncClient owner)
        {
            this.owner = owner;
        }

        @Override
        public void connectComplete(boolean reconnect, String serverURI)
        {
            // May run before start() has published the client field.
            subscribe(owner);

            SensorTransportListener l = listener;
            if (l != null) {
                l.onTransportUp();
            }
        }

        @Override
        public void connectionLost(Throwable cause)
        {
            SensorTransportListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
        }

        @Override
        public void messageArrived(String topic, MqttMessage message)
        {
            SensorTransportListener l = listener;
            if (l == null) {
                return;
            }
            l.onMessage(topic, message.getPayload());
        }

        @Override
        public void deliveryComplete(IMqttDeliveryToken token)
        {
            // Subscribe-only client; nothing is published.
        }
    }

    private void subscribe(MqttAsyncClient c)
    {
        try {
            c.subscribe(TOPIC_FILTER, QOS);
            log.info("Subscribed to {} on {}", TOPIC_FILTER, brokerDescription());
        } catch (MqttException e) {
            log.error("Subscribe to {} on {} failed", TOPIC_FILTER, brokerDescription(), e);
        }
    }
}
