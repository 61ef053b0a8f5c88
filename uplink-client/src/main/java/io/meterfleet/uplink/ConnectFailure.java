package io.meterfleet.uplink;

import org.eclipse.paho.client.mqttv3.MqttException;

import javax.net.ssl.SSLException;

/**
 * Why a connection attempt did not reach the connected state.
 */
public enum ConnectFailure {
    PROTOCOL_MISMATCH("broker rejected the protocol version"),
    BAD_CLIENT_ID("broker rejected the client identifier"),
    SERVER_UNAVAILABLE("broker unavailable"),
    BAD_CREDENTIALS("bad user name or password"),
    NOT_AUTHORIZED("not authorized"),
    TIMEOUT("no connect acknowledgment within timeout"),
    TLS_ERROR("TLS setup or handshake failed"),
    NETWORK_ERROR("network error");

    private final String description;

    ConnectFailure(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static ConnectFailure fromException(Throwable error) {
        if (error instanceof MqttException) {
            MqttException mqttError = (MqttException) error;
            switch (mqttError.getReasonCode()) {
                case MqttException.REASON_CODE_INVALID_PROTOCOL_VERSION:
                    return PROTOCOL_MISMATCH;
                case MqttException.REASON_CODE_INVALID_CLIENT_ID:
                    return BAD_CLIENT_ID;
                case MqttException.REASON_CODE_BROKER_UNAVAILABLE:
                    return SERVER_UNAVAILABLE;
                case MqttException.REASON_CODE_FAILED_AUTHENTICATION:
                    return BAD_CREDENTIALS;
                case MqttException.REASON_CODE_NOT_AUTHORIZED:
                    return NOT_AUTHORIZED;
                default:
                    break;
            }
        }
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof SSLException) {
                return TLS_ERROR;
            }
        }
        return NETWORK_ERROR;
    }
}
