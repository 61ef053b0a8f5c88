package io.meterfleet.supervisor;

import io.meterfleet.registry.DeviceType;
import io.meterfleet.registry.MeasurementSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Owns the device records and runs one worker process per active device.
 *
 * <p>Records and per-type counters live in the {@link DeviceStatusFile}; worker handles only in
 * memory. A status of {@link DeviceStatus#ACTIVE} on disk is an intent, so records loaded at
 * startup are reset to STOPPED.
 */
public class DeviceSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(DeviceSupervisor.class);

    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(3);
    public static final Duration DEFAULT_KILL_WAIT = Duration.ofSeconds(2);

    private final DeviceStatusFile statusFile;
    private final DeviceSettings deviceSettings;
    private final WorkerLauncher launcher;
    private final MeasurementSink sink;
    private final Clock clock;

    private final Map<String, Integer> counters = new TreeMap<>();
    private final Map<String, DeviceRecord> records = new TreeMap<>();
    private final Map<String, WorkerHandle> handles = new HashMap<>();

    // Set when the status file exists but cannot be read; it is then never overwritten.
    private boolean statusFileUnreadable;

    private Duration gracePeriod = DEFAULT_GRACE_PERIOD;
    private Duration killWait = DEFAULT_KILL_WAIT;

    public DeviceSupervisor(DeviceStatusFile statusFile, DeviceSettings deviceSettings,
                            WorkerLauncher launcher, MeasurementSink sink) {
        this(statusFile, deviceSettings, launcher, sink, Clock.systemDefaultZone());
    }

    public DeviceSupervisor(DeviceStatusFile statusFile, DeviceSettings deviceSettings,
                            WorkerLauncher launcher, MeasurementSink sink, Clock clock) {
        this.statusFile = statusFile;
        this.deviceSettings = deviceSettings;
        this.launcher = launcher;
        this.sink = sink;
        this.clock = clock;
    }

    /**
     * Creates a supervisor and reconciles it with the status file on disk.
     */
    public static DeviceSupervisor open(DeviceStatusFile statusFile, DeviceSettings deviceSettings,
                                        WorkerLauncher launcher, MeasurementSink sink) {
        DeviceSupervisor supervisor = new DeviceSupervisor(statusFile, deviceSettings, launcher, sink);
        supervisor.reconcileOnStartup();
        return supervisor;
    }

    public synchronized void reconcileOnStartup() {
        DeviceStatusFile.Snapshot snapshot;
        try {
            snapshot = statusFile.load();
        } catch (IOException e) {
            statusFileUnreadable = true;
            logger.error("Error loading device status from {}: {}; leaving the file untouched, devices are kept in memory only",
                statusFile.getFile(), e.getMessage());
            return;
        }
        statusFileUnreadable = false;

        boolean changed = false;
        counters.clear();
        records.clear();

        for (Map.Entry<String, Integer> entry : snapshot.getCounters().entrySet()) {
            String key = entry.getKey();
            String typeId = DeviceType.parse(key).map(DeviceType::getTypeId).orElse(key);
            if (!typeId.equals(key)) {
                logger.info("Migrating legacy counter '{}' to '{}'", key, typeId);
                changed = true;
            }
            counters.merge(typeId, entry.getValue(), Math::max);
        }

        for (DeviceRecord record : snapshot.getRecords().values()) {
            if (record.getStatus() == DeviceStatus.ACTIVE) {
                logger.info("Device {} was active before restart, marking stopped", record.getDeviceId());
                record = record.withStatus(DeviceStatus.STOPPED);
                changed = true;
                saveConfigRow(record);
            }
            records.put(record.getDeviceId(), record);
            if (raiseCounter(record)) {
                changed = true;
            }
        }

        if (changed) {
            persist();
        }
        logger.info("Loaded {} devices from {} (counters: {})", records.size(), statusFile.getFile(), counters);
    }

    private boolean raiseCounter(DeviceRecord record) {
        String typeId = record.getDeviceType().getTypeId();
        String suffix = record.getDeviceId().substring(Math.min(typeId.length(), record.getDeviceId().length()));
        int number;
        try {
            number = Integer.parseInt(suffix);
        } catch (NumberFormatException e) {
            return false;
        }
        if (number > counters.getOrDefault(typeId, 0)) {
            counters.put(typeId, number);
            return true;
        }
        return false;
    }

    /**
     * @param type display name, type id or enum name of a device type
     * @return the new device id
     * @throws IllegalArgumentException for an unknown type
     */
    public synchronized String addDevice(String type) {
        DeviceType deviceType = DeviceType.parse(type)
            .orElseThrow(() -> new IllegalArgumentException("Unknown device type: " + type));
        String typeId = deviceType.getTypeId();

        int counter = counters.getOrDefault(typeId, 0);
        String deviceId;
        do {
            counter++;
            deviceId = deviceType.formatDeviceId(counter);
        } while (records.containsKey(deviceId) || hasStoredData(deviceId));
        counters.put(typeId, counter);

        DeviceRecord record = new DeviceRecord(deviceId, deviceType, DeviceStatus.STOPPED,
            DeviceStatusFile.timestamp(clock.instant()));
        records.put(deviceId, record);
        saveConfigRow(record);
        persist();

        logger.info("Added device {} ({})", deviceId, deviceType.getDisplayName());
        return deviceId;
    }

    // Ids with samples or a configuration row left in the store are not handed out again.
    private boolean hasStoredData(String deviceId) {
        try {
            if (sink.count(deviceId) > 0 || sink.findDeviceConfig(deviceId).isPresent()) {
                logger.info("Skipping id {}: stored data from an earlier device exists", deviceId);
                return true;
            }
            return false;
        } catch (RuntimeException e) {
            logger.warn("Could not check stored data of {}: {}", deviceId, e.getMessage());
            return false;
        }
    }

    public synchronized boolean startDevice(String deviceId) {
        WorkerHandle existing = handles.get(deviceId);
        if (existing != null) {
            if (existing.isAlive()) {
                logger.warn("Device {} is already running (pid: {})", deviceId, existing.pid());
                return false;
            }
            handles.remove(deviceId);
        }

        DeviceRecord record = records.get(deviceId);
        Optional<DeviceType> type = record != null ? Optional.of(record.getDeviceType()) : DeviceType.fromDeviceId(deviceId);
        if (type.isEmpty()) {
            logger.error("Cannot start {}: device type not recognized", deviceId);
            return false;
        }
        if (record == null) {
            record = new DeviceRecord(deviceId, type.get(), DeviceStatus.STOPPED,
                DeviceStatusFile.timestamp(clock.instant()));
            records.put(deviceId, record);
            raiseCounter(record);
            logger.info("Created record for previously unknown device {}", deviceId);
        }

        WorkerSpec spec = new WorkerSpec(deviceId, type.get(), deviceSettings.getMeasurementInterval());
        WorkerHandle handle;
        try {
            handle = launcher.launch(spec);
        } catch (IOException | RuntimeException e) {
            logger.error("Error starting device {}: {}", deviceId, e.getMessage(), e);
            records.put(deviceId, record.withStatus(DeviceStatus.STOPPED));
            persist();
            return false;
        }

        handles.put(deviceId, handle);
        DeviceRecord active = record.withStatus(DeviceStatus.ACTIVE);
        records.put(deviceId, active);
        saveConfigRow(active);
        persist();
        logger.info("Started device {} with interval {}s (pid: {})", deviceId, spec.getIntervalSeconds(), handle.pid());
        return true;
    }

    /**
     * @return true when a worker was running and has been stopped
     */
    public synchronized boolean stopDevice(String deviceId) {
        WorkerHandle handle = handles.remove(deviceId);
        if (handle == null) {
            logger.info("Device {} has no running worker, marking stopped", deviceId);
            markStopped(deviceId);
            return false;
        }
        terminateWorker(deviceId, handle);
        markStopped(deviceId);
        logger.info("Stopped device {}", deviceId);
        return true;
    }

    private void terminateWorker(String deviceId, WorkerHandle handle) {
        try {
            if (!handle.isAlive()) {
                return;
            }
            handle.terminate();
            if (handle.awaitExit(gracePeriod)) {
                return;
            }
            logger.warn("Worker of {} (pid: {}) ignored SIGTERM for {}s, killing it",
                deviceId, handle.pid(), gracePeriod.getSeconds());
            handle.kill();
            if (!handle.awaitExit(killWait)) {
                logger.error("Worker of {} (pid: {}) is still alive after SIGKILL", deviceId, handle.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while stopping {}, killing worker", deviceId);
            handle.kill();
        } catch (RuntimeException e) {
            logger.error("Error stopping worker of {}", deviceId, e);
        }
    }

    private void markStopped(String deviceId) {
        DeviceRecord record = records.get(deviceId);
        if (record == null) {
            return;
        }
        DeviceRecord stopped = record.withStatus(DeviceStatus.STOPPED);
        records.put(deviceId, stopped);
        saveConfigRow(stopped);
        persist();
    }

    /**
     * Stops and forgets a device, including its stored samples. Unknown ids are a no-op.
     */
    public synchronized boolean deleteDevice(String deviceId) {
        if (handles.containsKey(deviceId)) {
            stopDevice(deviceId);
        }
        DeviceRecord removed = records.remove(deviceId);
        try {
            int deleted = sink.deleteForDevice(deviceId);
            sink.deleteDeviceConfig(deviceId);
            logger.info("Deleted {} measurements of {}", deleted, deviceId);
        } catch (RuntimeException e) {
            logger.error("Error purging stored data of {}", deviceId, e);
        }
        if (removed != null) {
            persist();
            logger.info("Deleted device {}", deviceId);
        }
        return true;
    }

    public synchronized Optional<DeviceRecord> getStatus(String deviceId) {
        DeviceRecord record = records.get(deviceId);
        if (record == null) {
            record = loadFromDisk().get(deviceId);
        }
        return Optional.ofNullable(record).map(this::withLiveStatus);
    }

    /**
     * All known devices sorted by id, including devices another process added to the status file.
     */
    public synchronized List<DeviceRecord> listAll() {
        Map<String, DeviceRecord> all = new TreeMap<>(loadFromDisk());
        all.putAll(records);
        List<DeviceRecord> result = new ArrayList<>(all.size());
        for (DeviceRecord record : all.values()) {
            result.add(withLiveStatus(record));
        }
        return result;
    }

    private DeviceRecord withLiveStatus(DeviceRecord record) {
        WorkerHandle handle = handles.get(record.getDeviceId());
        if (handle == null) {
            return record;
        }
        return record.withStatus(handle.isAlive() ? DeviceStatus.ACTIVE : DeviceStatus.STOPPED);
    }

    private Map<String, DeviceRecord> loadFromDisk() {
        try {
            return statusFile.load().getRecords();
        } catch (IOException e) {
            logger.warn("Could not read device status from {}: {}", statusFile.getFile(), e.getMessage());
            return Map.of();
        }
    }

    /**
     * Stops every running worker; a failure on one device does not affect the others.
     */
    public synchronized void cleanup() {
        List<String> running = new ArrayList<>(handles.keySet());
        logger.info("Stopping {} running devices...", running.size());
        for (String deviceId : running) {
            try {
                stopDevice(deviceId);
            } catch (RuntimeException e) {
                logger.error("Error stopping device {} during cleanup", deviceId, e);
            }
        }
    }

    public int getMeasurementInterval() {
        return deviceSettings.getMeasurementInterval();
    }

    /**
     * Applies to workers started afterwards.
     */
    public int setMeasurementInterval(int intervalSeconds) {
        return deviceSettings.setMeasurementInterval(intervalSeconds);
    }

    public synchronized Map<String, Integer> getCounters() {
        return new TreeMap<>(counters);
    }

    public synchronized boolean isRunning(String deviceId) {
        WorkerHandle handle = handles.get(deviceId);
        return handle != null && handle.isAlive();
    }

    public void setGracePeriod(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
    }

    public void setKillWait(Duration killWait) {
        this.killWait = killWait;
    }

    private void saveConfigRow(DeviceRecord record) {
        try {
            sink.saveDeviceConfig(record.getDeviceId(), record.getDeviceType().getDisplayName(),
                record.getStatus().getValue());
        } catch (RuntimeException e) {
            logger.warn("Could not store configuration of {}: {}", record.getDeviceId(), e.getMessage());
        }
    }

    private void persist() {
        if (statusFileUnreadable) {
            logger.warn("Not saving device status: {} could not be read at startup", statusFile.getFile());
            return;
        }
        try {
            statusFile.save(counters, records.values());
        } catch (IOException e) {
            logger.error("Error saving device status to {}: {}", statusFile.getFile(), e.getMessage());
        }
    }
}
