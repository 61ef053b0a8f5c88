package io.meterfleet.registry.model;

import java.time.LocalDateTime;

public class DeviceConfig {
    private String deviceId;
    private String deviceType;
    private String status;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public DeviceConfig() {}

    public DeviceConfig(String deviceId, String deviceType, String status) {
        this.deviceId = deviceId;
        this.deviceType = deviceType;
        this.status = status;
    }

    public String getDeviceId() { return deviceId; }
    public void setDeviceId(String deviceId) { this.deviceId = deviceId; }

    public String getDeviceType() { return deviceType; }
    public void setDeviceType(String deviceType) { this.deviceType = deviceType; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
