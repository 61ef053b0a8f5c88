package io.meterfleet.supervisor;

import java.util.Locale;

/**
 * Last known intent for a device. Whether a worker really runs is decided by its handle.
 */
public enum DeviceStatus {
    ACTIVE("active"),
    STOPPED("stopped");

    private final String value;

    DeviceStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static DeviceStatus fromValue(String value) {
        if (value != null && ACTIVE.value.equals(value.trim().toLowerCase(Locale.ROOT))) {
            return ACTIVE;
        }
        return STOPPED;
    }
}
