package io.meterfleet.registry;

import io.meterfleet.registry.model.DeviceConfig;
import io.meterfleet.registry.model.MeasurementSample;
import io.meterfleet.registry.repository.DeviceConfigRepository;
import io.meterfleet.registry.repository.MeasurementRepository;

import java.util.List;
import java.util.Optional;

public class JdbcMeasurementSink implements MeasurementSink {

    private final DatabaseManager dbManager;
    private final MeasurementRepository measurementRepository;
    private final DeviceConfigRepository configRepository;

    public JdbcMeasurementSink(DatabaseManager dbManager) {
        this.dbManager = dbManager;
        this.measurementRepository = new MeasurementRepository(dbManager);
        this.configRepository = new DeviceConfigRepository(dbManager);
    }

    @Override
    public void insert(MeasurementSample sample) {
        measurementRepository.insert(sample);
    }

    @Override
    public Optional<MeasurementSample> findLatest(String deviceId) {
        return measurementRepository.findLatest(deviceId);
    }

    @Override
    public List<MeasurementSample> findRecent(String deviceId, int limit, int offset) {
        return measurementRepository.findRecent(deviceId, limit, offset);
    }

    @Override
    public long count(String deviceId) {
        return measurementRepository.count(deviceId);
    }

    @Override
    public long countDevices() {
        return measurementRepository.countDevices();
    }

    @Override
    public int deleteForDevice(String deviceId) {
        return measurementRepository.deleteByDevice(deviceId);
    }

    @Override
    public void saveDeviceConfig(String deviceId, String deviceType, String status) {
        configRepository.upsert(deviceId, deviceType, status);
    }

    @Override
    public Optional<DeviceConfig> findDeviceConfig(String deviceId) {
        return configRepository.findById(deviceId);
    }

    @Override
    public void deleteDeviceConfig(String deviceId) {
        configRepository.delete(deviceId);
    }

    @Override
    public void close() {
        dbManager.close();
    }
}
