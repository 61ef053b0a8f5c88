package io.meterfleet.uplink;

public enum RegistrationState {
    UNREGISTERED,
    REGISTERED
}
