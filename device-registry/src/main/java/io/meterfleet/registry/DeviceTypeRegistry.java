package io.meterfleet.registry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Table of device profiles. Adding a device kind means adding a {@link DeviceType}
 * constant and one entry here.
 */
public final class DeviceTypeRegistry {

    private static final Map<DeviceType, DeviceProfile> PROFILES;

    static {
        Map<DeviceType, DeviceProfile> profiles = new EnumMap<>(DeviceType.class);
        profiles.put(DeviceType.PV, new DeviceProfile(DeviceType.PV,
                new ValueRange(200, 250), new ValueRange(5, 15),
                "fas fa-solar-panel", "text-warning"));
        profiles.put(DeviceType.HEAT_PUMP, new DeviceProfile(DeviceType.HEAT_PUMP,
                new ValueRange(220, 240), new ValueRange(8, 20),
                "fas fa-thermometer-half", "text-info"));
        profiles.put(DeviceType.MAIN_GRID, new DeviceProfile(DeviceType.MAIN_GRID,
                new ValueRange(230, 240), new ValueRange(10, 50),
                "fas fa-bolt", "text-primary"));
        PROFILES = Collections.unmodifiableMap(profiles);
    }

    private DeviceTypeRegistry() {
    }

    public static DeviceProfile profileOf(DeviceType type) {
        DeviceProfile profile = PROFILES.get(type);
        if (profile == null) {
            throw new IllegalArgumentException("No profile registered for device type: " + type);
        }
        return profile;
    }

    public static Map<DeviceType, DeviceProfile> profiles() {
        return PROFILES;
    }
}
