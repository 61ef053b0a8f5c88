package io.meterfleet.uplink;

import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

@FunctionalInterface
public interface MqttClientFactory {

    IMqttAsyncClient create(String serverUri, String clientId) throws MqttException;

    static MqttClientFactory paho() {
        return (serverUri, clientId) -> new MqttAsyncClient(serverUri, clientId, new MemoryPersistence());
    }
}
