package io.meterfleet.registry.model;

import java.time.Instant;
import java.util.Objects;

public final class MeasurementSample {

    private final String deviceId;
    private final Instant timestamp;
    private final double voltage;
    private final double current;
    private final double power;
    private final double kwh;

    public MeasurementSample(String deviceId, Instant timestamp, double voltage, double current,
                             double power, double kwh) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.voltage = voltage;
        this.current = current;
        this.power = power;
        this.kwh = kwh;
    }

    public String getDeviceId() { return deviceId; }
    public Instant getTimestamp() { return timestamp; }
    public double getVoltage() { return voltage; }
    public double getCurrent() { return current; }
    public double getPower() { return power; }
    public double getKwh() { return kwh; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MeasurementSample that = (MeasurementSample) o;
        return Double.compare(that.voltage, voltage) == 0
                && Double.compare(that.current, current) == 0
                && Double.compare(that.power, power) == 0
                && Double.compare(that.kwh, kwh) == 0
                && deviceId.equals(that.deviceId)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, timestamp, voltage, current, power, kwh);
    }

    @Override
    public String toString() {
        return "MeasurementSample{" +
                "deviceId='" + deviceId + '\'' +
                ", timestamp=" + timestamp +
                ", voltage=" + voltage +
                ", current=" + current +
                ", power=" + power +
                ", kwh=" + kwh +
                '}';
    }
}
