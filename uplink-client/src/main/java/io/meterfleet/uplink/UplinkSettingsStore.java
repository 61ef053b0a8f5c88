package io.meterfleet.uplink;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * File-backed uplink settings. Every {@link #load()} reads the file again, so a supervisor
 * always starts workers with the latest saved values.
 */
public class UplinkSettingsStore {

    private static final Logger logger = LoggerFactory.getLogger(UplinkSettingsStore.class);

    public static final String DEFAULT_FILE = "mqtt_settings.json";

    private final Path settingsFile;

    public UplinkSettingsStore(Path settingsFile) {
        this.settingsFile = settingsFile;
    }

    public static UplinkSettingsStore fromSystemProperties() {
        return new UplinkSettingsStore(Paths.get(System.getProperty("fleet.uplink.settings.file", DEFAULT_FILE)));
    }

    public UplinkSettings load() {
        try {
            Optional<JSONObject> json = JsonFiles.read(settingsFile);
            if (json.isEmpty()) {
                logger.debug("No uplink settings at {}, using defaults", settingsFile);
                return UplinkSettings.defaults();
            }
            return UplinkSettings.fromJson(json.get());
        } catch (IOException e) {
            logger.error("Error loading uplink settings from {}: {}", settingsFile, e.getMessage());
            return UplinkSettings.defaults();
        }
    }

    public boolean save(UplinkSettings settings) {
        try {
            JsonFiles.write(settingsFile, settings.toJson());
            logger.info("Uplink settings saved to {}: {}", settingsFile, settings);
            return true;
        } catch (IOException e) {
            logger.error("Error saving uplink settings to {}", settingsFile, e);
            return false;
        }
    }

    public UplinkSettings update(Consumer<UplinkSettings> change) {
        UplinkSettings settings = load();
        change.accept(settings);
        save(settings);
        return settings;
    }

    public Path getSettingsFile() {
        return settingsFile;
    }
}
