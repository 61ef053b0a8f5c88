package io.meterfleet.registry;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of simulated device kinds.
 *
 * <p>The type id doubles as the device id prefix ({@code pv001}, {@code heatpump002}).
 * Ranges and display metadata live in {@link DeviceTypeRegistry}.
 */
public enum DeviceType {
    PV("PV", "pv"),
    HEAT_PUMP("Heat Pump", "heatpump"),
    MAIN_GRID("Main Grid", "maingrid");

    private final String displayName;
    private final String typeId;

    DeviceType(String displayName, String typeId) {
        this.displayName = displayName;
        this.typeId = typeId;
    }

    public String getDisplayName() { return displayName; }

    public String getTypeId() { return typeId; }

    /**
     * Accepts the display name ("Heat Pump"), the type id ("heatpump") or the enum name ("HEAT_PUMP").
     */
    public static Optional<DeviceType> parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (DeviceType type : values()) {
            if (type.displayName.equalsIgnoreCase(trimmed)
                    || type.typeId.equalsIgnoreCase(trimmed)
                    || type.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(type);
            }
        }
        String compact = trimmed.replace(" ", "").replace("_", "").toLowerCase(Locale.ROOT);
        for (DeviceType type : values()) {
            if (type.typeId.equals(compact)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the type from a device id prefix. The longest matching prefix wins.
     */
    public static Optional<DeviceType> fromDeviceId(String deviceId) {
        if (deviceId == null) {
            return Optional.empty();
        }
        DeviceType match = null;
        for (DeviceType type : values()) {
            if (deviceId.startsWith(type.typeId)
                    && (match == null || type.typeId.length() > match.typeId.length())) {
                match = type;
            }
        }
        return Optional.ofNullable(match);
    }

    public String formatDeviceId(int counter) {
        return String.format("%s%03d", typeId, counter);
    }
}
