package io.meterfleet.registry;

import io.meterfleet.registry.model.DeviceConfig;
import io.meterfleet.registry.model.MeasurementSample;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of measurement samples plus one configuration row per device.
 *
 * <p>Implementations report storage failures as unchecked exceptions; callers on the
 * sampling path log them and carry on.
 */
public interface MeasurementSink extends AutoCloseable {

    void insert(MeasurementSample sample);

    /**
     * Most recently inserted sample of a device, used as the base of the cumulative energy counter.
     */
    Optional<MeasurementSample> findLatest(String deviceId);

    /**
     * Newest first. A {@code null} device id returns samples of all devices.
     */
    List<MeasurementSample> findRecent(String deviceId, int limit, int offset);

    long count(String deviceId);

    long countDevices();

    int deleteForDevice(String deviceId);

    void saveDeviceConfig(String deviceId, String deviceType, String status);

    Optional<DeviceConfig> findDeviceConfig(String deviceId);

    void deleteDeviceConfig(String deviceId);

    @Override
    void close();
}
