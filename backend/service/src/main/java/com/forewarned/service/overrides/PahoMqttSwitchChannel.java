package com.forewarned.service.overrides;

import com.forewarned.service.config.OverrideConfig;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

import java.nio.charset.StandardCharsets;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MqttSwitchChannel} over the Eclipse Paho client. The session is kept across reconnects so
 * command-topic subscriptions survive a broker restart.
 */
public final class PahoMqttSwitchChannel implements MqttSwitchChannel {
    private static final Logger LOGGER = Logger.getLogger(PahoMqttSwitchChannel.class.getName());
    private static final int QOS = 1;
    private static final int CONNECT_TIMEOUT_SECONDS = 30;
    private static final int KEEP_ALIVE_SECONDS = 60;

    private final OverrideConfig.MqttSettings settings;
    private final MqttClient client;

    public PahoMqttSwitchChannel(OverrideConfig.MqttSettings settings, String clientId) {
        this.settings = settings;
        try {
            this.client = new MqttClient(settings.serverUri(), clientId, new MemoryPersistence());
        } catch (MqttException e) {
            throw new IllegalStateException("Invalid MQTT broker " + settings.serverUri() + ": " + e.getMessage(), e);
        }
        client.setCallback(new ConnectionLogger());
    }

    @Override
    public void connect() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(true);
        options.setCleanSession(false);
        options.setConnectionTimeout(CONNECT_TIMEOUT_SECONDS);
        options.setKeepAliveInterval(KEEP_ALIVE_SECONDS);
        if (!settings.username().isBlank()) {
            options.setUserName(settings.username());
            if (settings.password().isBlank()) {
                LOGGER.warning("MQTT username set but no password provided");
            } else {
                options.setPassword(settings.password().toCharArray());
            }
        }
        LOGGER.info("Connecting to MQTT broker at " + settings.serverUri() + " as " + client.getClientId());
        try {
            client.connect(options);
        } catch (MqttException e) {
            throw new IllegalStateException("MQTT connection to " + settings.serverUri() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void publish(String topic, String payload, boolean retained) {
        try {
            client.publish(topic, payload.getBytes(StandardCharsets.UTF_8), QOS, retained);
        } catch (MqttException e) {
            throw new IllegalStateException("MQTT publish to " + topic + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void subscribe(String topic, BiConsumer<String, String> handler) {
        try {
            client.subscribe(topic, QOS, (receivedTopic, message) ->
                    handler.accept(receivedTopic, new String(message.getPayload(), StandardCharsets.UTF_8)));
        } catch (MqttException e) {
            throw new IllegalStateException("MQTT subscribe to " + topic + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            if (client.isConnected()) {
                client.disconnect();
            }
            client.close();
            LOGGER.info("Disconnected from MQTT broker");
        } catch (MqttException e) {
            LOGGER.log(Level.WARNING, "Error closing MQTT client", e);
        }
    }

    private static final class ConnectionLogger implements MqttCallbackExtended {
        @Override
        public void connectComplete(boolean reconnect, String serverUri) {
            LOGGER.info((reconnect ? "Reconnected" : "Connected") + " to MQTT broker " + serverUri);
        }

        @Override
        public void connectionLost(Throwable cause) {
            LOGGER.warning("Lost MQTT broker connection: " + cause.getMessage());
        }

        @Override
        public void messageArrived(String topic, MqttMessage message) {
            LOGGER.fine("Unhandled MQTT message on " + topic);
        }

        @Override
        public void deliveryComplete(IMqttDeliveryToken token) {
        }
    }
}
