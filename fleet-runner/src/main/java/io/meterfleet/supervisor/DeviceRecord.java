package io.meterfleet.supervisor;

import io.meterfleet.registry.DeviceType;

import java.util.Objects;

public final class DeviceRecord {

    private final String deviceId;
    private final DeviceType deviceType;
    private final DeviceStatus status;
    private final String createdAt;

    public DeviceRecord(String deviceId, DeviceType deviceType, DeviceStatus status, String createdAt) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.deviceType = Objects.requireNonNull(deviceType, "deviceType");
        this.status = Objects.requireNonNull(status, "status");
        this.createdAt = createdAt;
    }

    public DeviceRecord withStatus(DeviceStatus newStatus) {
        if (newStatus == status) {
            return this;
        }
        return new DeviceRecord(deviceId, deviceType, newStatus, createdAt);
    }

    public String getDeviceId() { return deviceId; }
    public DeviceType getDeviceType() { return deviceType; }
    public DeviceStatus getStatus() { return status; }
    public String getCreatedAt() { return createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceRecord)) return false;
        DeviceRecord that = (DeviceRecord) o;
        return deviceId.equals(that.deviceId)
                && deviceType == that.deviceType
                && status == that.status
                && Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, deviceType, status, createdAt);
    }

    @Override
    public String toString() {
        return "DeviceRecord{" +
                "deviceId='" + deviceId + '\'' +
                ", deviceType=" + deviceType.getDisplayName() +
                ", status=" + status.getValue() +
                ", createdAt='" + createdAt + '\'' +
                '}';
    }
}
