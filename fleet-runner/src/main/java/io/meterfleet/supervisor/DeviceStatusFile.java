package io.meterfleet.supervisor;

import io.meterfleet.registry.DeviceType;
import io.meterfleet.uplink.JsonFiles;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The device status document shared by the supervisor and its workers:
 *
 * <pre>
 * { "counters": { "pv": 2 },
 *   "devices": { "pv001": { "device_type": "PV", "status": "stopped", "created_at": "...",
 *                           "cumulocity_registered": true, ... } } }
 * </pre>
 *
 * Every write rewrites the whole file. Workers own the {@code cumulocity_*} fields of their
 * entry; a supervisor save carries them over from disk for devices that still exist.
 */
public class DeviceStatusFile {

    private static final Logger logger = LoggerFactory.getLogger(DeviceStatusFile.class);

    public static final String DEFAULT_FILE = "device_status.json";

    static final String REGISTERED = "cumulocity_registered";
    static final String REGISTERED_NAME = "cumulocity_device_name";
    static final String REGISTERED_AT = "cumulocity_registered_at";
    private static final String REGISTRATION_PREFIX = "cumulocity_";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final Path file;

    public DeviceStatusFile(Path file) {
        this.file = file;
    }

    public static DeviceStatusFile fromSystemProperties() {
        return new DeviceStatusFile(Paths.get(System.getProperty("fleet.status.file", DEFAULT_FILE)));
    }

    public static String timestamp(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneId.systemDefault()).truncatedTo(ChronoUnit.SECONDS).format(TIMESTAMP);
    }

    public Snapshot load() throws IOException {
        Optional<JSONObject> document = JsonFiles.read(file);
        if (document.isEmpty()) {
            return new Snapshot(Collections.emptyMap(), Collections.emptyMap());
        }
        JSONObject json = document.get();

        Map<String, Integer> counters = new LinkedHashMap<>();
        JSONObject countersJson = json.optJSONObject("counters");
        if (countersJson != null) {
            for (String key : countersJson.keySet()) {
                counters.put(key, countersJson.optInt(key, 0));
            }
        }

        Map<String, DeviceRecord> records = new TreeMap<>();
        JSONObject devicesJson = json.optJSONObject("devices");
        if (devicesJson != null) {
            for (String deviceId : devicesJson.keySet()) {
                JSONObject entry = devicesJson.optJSONObject(deviceId);
                if (entry == null) {
                    logger.warn("Skipping malformed status entry for {}", deviceId);
                    continue;
                }
                Optional<DeviceType> type = DeviceType.parse(entry.optString("device_type", null));
                if (type.isEmpty()) {
                    type = DeviceType.fromDeviceId(deviceId);
                }
                if (type.isEmpty()) {
                    logger.warn("Skipping status entry {} with unknown device type '{}'",
                        deviceId, entry.optString("device_type"));
                    continue;
                }
                records.put(deviceId, new DeviceRecord(deviceId, type.get(),
                    DeviceStatus.fromValue(entry.optString("status", null)),
                    entry.optString("created_at", null)));
            }
        }
        return new Snapshot(counters, records);
    }

    public void save(Map<String, Integer> counters, Collection<DeviceRecord> records) throws IOException {
        JSONObject previousDevices = readDevicesQuietly();

        JSONObject devices = new JSONObject();
        for (DeviceRecord record : records) {
            JSONObject entry = new JSONObject();
            entry.put("device_type", record.getDeviceType().getDisplayName());
            entry.put("status", record.getStatus().getValue());
            if (record.getCreatedAt() != null) {
                entry.put("created_at", record.getCreatedAt());
            }
            JSONObject previous = previousDevices.optJSONObject(record.getDeviceId());
            if (previous != null) {
                for (String key : previous.keySet()) {
                    if (key.startsWith(REGISTRATION_PREFIX)) {
                        entry.put(key, previous.get(key));
                    }
                }
            }
            devices.put(record.getDeviceId(), entry);
        }

        JSONObject document = new JSONObject();
        document.put("counters", new JSONObject(counters));
        document.put("devices", devices);
        JsonFiles.write(file, document);
        logger.debug("Device status saved to {} ({} devices)", file, records.size());
    }

    private JSONObject readDevicesQuietly() {
        try {
            return JsonFiles.read(file)
                .map(json -> json.optJSONObject("devices"))
                .orElseGet(JSONObject::new);
        } catch (IOException e) {
            logger.warn("Could not read previous device status from {}: {}", file, e.getMessage());
            return new JSONObject();
        }
    }

    Optional<JSONObject> readEntry(String deviceId) throws IOException {
        return JsonFiles.read(file)
            .map(json -> json.optJSONObject("devices"))
            .map(devices -> devices.optJSONObject(deviceId));
    }

    void updateEntry(String deviceId, Map<String, Object> fields) throws IOException {
        JSONObject document = JsonFiles.read(file).orElseGet(JSONObject::new);
        JSONObject devices = document.optJSONObject("devices");
        JSONObject entry = devices == null ? null : devices.optJSONObject(deviceId);
        if (entry == null) {
            throw new IOException("Device " + deviceId + " is not present in " + file);
        }
        fields.forEach(entry::put);
        JsonFiles.write(file, document);
    }

    public Path getFile() {
        return file;
    }

    public static final class Snapshot {

        private final Map<String, Integer> counters;
        private final Map<String, DeviceRecord> records;

        Snapshot(Map<String, Integer> counters, Map<String, DeviceRecord> records) {
            this.counters = counters;
            this.records = records;
        }

        public Map<String, Integer> getCounters() {
            return Collections.unmodifiableMap(counters);
        }

        public Map<String, DeviceRecord> getRecords() {
            return Collections.unmodifiableMap(records);
        }
    }
}
