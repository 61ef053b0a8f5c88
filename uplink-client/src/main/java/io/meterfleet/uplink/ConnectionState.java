package io.meterfleet.uplink;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
