package io.meterfleet.supervisor;

import io.meterfleet.uplink.RegistrationRecord;
import io.meterfleet.uplink.RegistrationStore;
import org.json.JSONObject;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the platform registration of a device in its entry of the device status file.
 */
public class StatusFileRegistrationStore implements RegistrationStore {

    private final DeviceStatusFile statusFile;

    public StatusFileRegistrationStore(DeviceStatusFile statusFile) {
        this.statusFile = statusFile;
    }

    @Override
    public Optional<RegistrationRecord> find(String deviceId) throws IOException {
        Optional<JSONObject> entry = statusFile.readEntry(deviceId);
        if (entry.isEmpty() || !entry.get().optBoolean(DeviceStatusFile.REGISTERED, false)) {
            return Optional.empty();
        }
        return Optional.of(new RegistrationRecord(
            entry.get().optString(DeviceStatusFile.REGISTERED_NAME, ""),
            entry.get().optString(DeviceStatusFile.REGISTERED_AT, "")));
    }

    @Override
    public void markRegistered(String deviceId, String deviceName, Instant registeredAt) throws IOException {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(DeviceStatusFile.REGISTERED, true);
        fields.put(DeviceStatusFile.REGISTERED_NAME, deviceName);
        fields.put(DeviceStatusFile.REGISTERED_AT, DeviceStatusFile.timestamp(registeredAt));
        statusFile.updateEntry(deviceId, fields);
    }
}
