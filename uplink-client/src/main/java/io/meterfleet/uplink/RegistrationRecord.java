package io.meterfleet.uplink;

public final class RegistrationRecord {

    private final String deviceName;
    private final String registeredAt;

    public RegistrationRecord(String deviceName, String registeredAt) {
        this.deviceName = deviceName;
        this.registeredAt = registeredAt;
    }

    public String getDeviceName() { return deviceName; }

    public String getRegisteredAt() { return registeredAt; }

    @Override
    public String toString() {
        return "RegistrationRecord{deviceName='" + deviceName + "', registeredAt='" + registeredAt + "'}";
    }
}
