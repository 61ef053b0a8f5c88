package io.meterfleet.supervisor;

import io.meterfleet.registry.DeviceType;

/**
 * What a worker process needs to know at launch.
 */
public final class WorkerSpec {

    private final String deviceId;
    private final DeviceType deviceType;
    private final int intervalSeconds;

    public WorkerSpec(String deviceId, DeviceType deviceType, int intervalSeconds) {
        this.deviceId = deviceId;
        this.deviceType = deviceType;
        this.intervalSeconds = intervalSeconds;
    }

    public String getDeviceId() { return deviceId; }
    public DeviceType getDeviceType() { return deviceType; }
    public int getIntervalSeconds() { return intervalSeconds; }

    @Override
    public String toString() {
        return "WorkerSpec{deviceId='" + deviceId + "', deviceType=" + deviceType + ", intervalSeconds=" + intervalSeconds + '}';
    }
}
