package io.meterfleet.registry;

import io.meterfleet.registry.model.DeviceConfig;
import io.meterfleet.registry.model.MeasurementSample;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * List-backed sink for tests that only care about sample sequencing.
 */
public class InMemoryMeasurementSink implements MeasurementSink {

    private final List<MeasurementSample> samples = new ArrayList<>();
    private final Map<String, DeviceConfig> configs = new HashMap<>();

    @Override
    public synchronized void insert(MeasurementSample sample) {
        samples.add(sample);
    }

    @Override
    public synchronized Optional<MeasurementSample> findLatest(String deviceId) {
        for (int i = samples.size() - 1; i >= 0; i--) {
            if (samples.get(i).getDeviceId().equals(deviceId)) {
                return Optional.of(samples.get(i));
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<MeasurementSample> findRecent(String deviceId, int limit, int offset) {
        List<MeasurementSample> matching = new ArrayList<>();
        for (int i = samples.size() - 1; i >= 0; i--) {
            MeasurementSample sample = samples.get(i);
            if (deviceId == null || sample.getDeviceId().equals(deviceId)) {
                matching.add(sample);
            }
        }
        return matching.stream().skip(offset).limit(limit).collect(Collectors.toList());
    }

    @Override
    public synchronized long count(String deviceId) {
        return samples.stream().filter(s -> deviceId == null || s.getDeviceId().equals(deviceId)).count();
    }

    @Override
    public synchronized long countDevices() {
        return samples.stream().map(MeasurementSample::getDeviceId).distinct().count();
    }

    @Override
    public synchronized int deleteForDevice(String deviceId) {
        int before = samples.size();
        samples.removeIf(s -> s.getDeviceId().equals(deviceId));
        return before - samples.size();
    }

    @Override
    public synchronized void saveDeviceConfig(String deviceId, String deviceType, String status) {
        configs.put(deviceId, new DeviceConfig(deviceId, deviceType, status));
    }

    @Override
    public synchronized Optional<DeviceConfig> findDeviceConfig(String deviceId) {
        return Optional.ofNullable(configs.get(deviceId));
    }

    @Override
    public synchronized void deleteDeviceConfig(String deviceId) {
        configs.remove(deviceId);
    }

    @Override
    public void close() {
    }
}
