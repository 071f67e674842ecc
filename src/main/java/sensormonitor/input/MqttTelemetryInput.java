package sensormonitor.input;

import org.eclipse.paho.client.mqttv3.IMqttActionListener;
import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sensormonitor.config.MonitorConfig;
import sensormonitor.domain.ConnectionState;
import sensormonitor.domain.ConnectionStatus;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * MQTT implementation of {@link TelemetryInput} on top of the Paho async client.
 * <p>
 * Reconnection is left to Paho's automatic reconnect. The topic subscription is
 * issued again every time the connection completes, which is safe to repeat.
 */
public class MqttTelemetryInput implements TelemetryInput {
    private static final Logger logger = LoggerFactory.getLogger(MqttTelemetryInput.class);

    private static final long CONNECT_TIMEOUT_MS = 10_000L;
    private static final long DISCONNECT_TIMEOUT_MS = 2_000L;

    private final MonitorConfig config;
    private final ClientFactory clientFactory;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ConnectionStatus> status;

    private volatile IMqttAsyncClient client;
    private volatile MessageListener messageListener;

    /**
     * Create an MQTT input for the configured broker and topic.
     *
     * @param config monitor configuration
     */
    public MqttTelemetryInput(MonitorConfig config) {
        this(config, (uri, clientId) -> new MqttAsyncClient(uri, clientId, new MemoryPersistence()));
    }

    MqttTelemetryInput(MonitorConfig config, ClientFactory clientFactory) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory cannot be null");
        this.status = new AtomicReference<>(ConnectionStatus.disconnected(config.brokerUri()));
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        transition(ConnectionState.CONNECTING);
        logger.info("Connecting to {} as {}...", config.brokerUri(), config.clientId());
        try {
            client = clientFactory.create(config.brokerUri(), config.clientId());
            client.setCallback(new Callback());
            IMqttToken token = client.connect(connectOptions());
            token.waitForCompletion(CONNECT_TIMEOUT_MS);
        } catch (MqttException e) {
            running.set(false);
            transition(ConnectionState.DISCONNECTED);
            closeClient();
            throw new RuntimeException("Could not connect to broker " + config.brokerUri(), e);
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            IMqttAsyncClient current = client;
            if (current != null) {
                try {
                    if (current.isConnected()) {
                        current.disconnect().waitForCompletion(DISCONNECT_TIMEOUT_MS);
                    }
                } catch (MqttException e) {
                    logger.warn("Error disconnecting from {}", config.brokerUri(), e);
                } finally {
                    closeClient();
                }
            }
            transition(ConnectionState.DISCONNECTED);
            logger.info("MQTT input stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public ConnectionStatus connectionStatus() {
        return status.get();
    }

    @Override
    public String subscriptionTopic() {
        return config.topic();
    }

    @Override
    public void setMessageListener(MessageListener listener) {
        this.messageListener = listener;
    }

    MqttConnectOptions connectOptions() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(true);
        options.setKeepAliveInterval(config.keepAliveSeconds());
        options.setConnectionTimeout((int) (CONNECT_TIMEOUT_MS / 1000));
        return options;
    }

    private void subscribe() {
        IMqttAsyncClient current = client;
        if (current == null) {
            return;
        }
        try {
            current.subscribe(config.topic(), config.qos(), null, new IMqttActionListener() {
                @Override
                public void onSuccess(IMqttToken asyncActionToken) {
                    logger.info("Subscribed to topic: {}", config.topic());
                }

                @Override
                public void onFailure(IMqttToken asyncActionToken, Throwable exception) {
                    logger.error("Failed to subscribe to topic {}", config.topic(), exception);
                }
            });
        } catch (MqttException e) {
            logger.error("Failed to subscribe to topic {}", config.topic(), e);
        }
    }

    private void transition(ConnectionState newState) {
        ConnectionStatus previous = status.getAndUpdate(s -> s.transition(newState));
        if (previous.state() != newState) {
            logger.debug("Connection state {} -> {}", previous.state(), newState);
        }
    }

    private void closeClient() {
        IMqttAsyncClient current = client;
        client = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (MqttException e) {
            logger.warn("Error closing MQTT client", e);
        }
    }

    private final class Callback implements MqttCallbackExtended {

        @Override
        public void connectComplete(boolean reconnect, String serverURI) {
            transition(ConnectionState.CONNECTED);
            logger.info("{} to MQTT broker: {}", reconnect ? "Reconnected" : "Connected", serverURI);
            subscribe();
        }

        @Override
        public void connectionLost(Throwable cause) {
            transition(ConnectionState.DISCONNECTED);
            logger.warn("Disconnected from MQTT broker {}: {}", config.brokerUri(),
                    cause != null ? cause.getMessage() : "unknown cause");
        }

        @Override
        public void messageArrived(String topic, MqttMessage message) {
            MessageListener listener = messageListener;
            if (listener == null) {
                return;
            }
            // An exception escaping here would make Paho drop the connection
            try {
                listener.onMessage(topic, message.getPayload());
            } catch (Exception e) {
                logger.error("Error processing message from topic {}", topic, e);
            }
        }

        @Override
        public void deliveryComplete(IMqttDeliveryToken token) {
            // subscribe-only client
        }
    }

    /**
     * Creates the underlying Paho client.
     */
    @FunctionalInterface
    interface ClientFactory {
        IMqttAsyncClient create(String serverUri, String clientId) throws MqttException;
    }
}
