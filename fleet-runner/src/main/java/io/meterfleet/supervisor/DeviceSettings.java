package io.meterfleet.supervisor;

import io.meterfleet.uplink.JsonFiles;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Fleet-wide device settings file. Values are read from disk on every call so a running
 * supervisor picks up edits made by other processes. Keys it does not know are preserved.
 */
public class DeviceSettings {

    private static final Logger logger = LoggerFactory.getLogger(DeviceSettings.class);

    public static final String DEFAULT_FILE = "device_settings.json";
    public static final int DEFAULT_MEASUREMENT_INTERVAL = 5;
    public static final int MIN_MEASUREMENT_INTERVAL = 1;
    public static final int MAX_MEASUREMENT_INTERVAL = 300;

    private static final String MEASUREMENT_INTERVAL = "measurement_interval";

    private final Path settingsFile;

    public DeviceSettings(Path settingsFile) {
        this.settingsFile = settingsFile;
    }

    public static DeviceSettings fromSystemProperties() {
        return new DeviceSettings(Paths.get(System.getProperty("fleet.device.settings.file", DEFAULT_FILE)));
    }

    public static int clamp(int intervalSeconds) {
        return Math.max(MIN_MEASUREMENT_INTERVAL, Math.min(MAX_MEASUREMENT_INTERVAL, intervalSeconds));
    }

    public int getMeasurementInterval() {
        JSONObject json = readQuietly();
        return clamp(json.optInt(MEASUREMENT_INTERVAL, DEFAULT_MEASUREMENT_INTERVAL));
    }

    /**
     * @return the value actually stored after clamping
     */
    public int setMeasurementInterval(int intervalSeconds) {
        int clamped = clamp(intervalSeconds);
        if (clamped != intervalSeconds) {
            logger.info("Measurement interval {}s clamped to {}s", intervalSeconds, clamped);
        }
        JSONObject json = readQuietly();
        json.put(MEASUREMENT_INTERVAL, clamped);
        try {
            JsonFiles.write(settingsFile, json);
            logger.info("Measurement interval set to {}s", clamped);
        } catch (IOException e) {
            logger.error("Error saving device settings to {}", settingsFile, e);
        }
        return clamped;
    }

    private JSONObject readQuietly() {
        try {
            return JsonFiles.read(settingsFile).orElseGet(JSONObject::new);
        } catch (IOException e) {
            logger.error("Error loading device settings from {}: {}", settingsFile, e.getMessage());
            return new JSONObject();
        }
    }

    public Path getSettingsFile() {
        return settingsFile;
    }
}
