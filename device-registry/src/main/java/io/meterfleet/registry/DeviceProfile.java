package io.meterfleet.registry;

/**
 * Electrical ranges and dashboard metadata of one {@link DeviceType}.
 */
public final class DeviceProfile {

    private final DeviceType type;
    private final ValueRange voltageRange;
    private final ValueRange currentRange;
    private final String iconClass;
    private final String colorClass;

    public DeviceProfile(DeviceType type, ValueRange voltageRange, ValueRange currentRange,
                         String iconClass, String colorClass) {
        this.type = type;
        this.voltageRange = voltageRange;
        this.currentRange = currentRange;
        this.iconClass = iconClass;
        this.colorClass = colorClass;
    }

    public DeviceType getType() { return type; }
    public ValueRange getVoltageRange() { return voltageRange; }
    public ValueRange getCurrentRange() { return currentRange; }
    public String getIconClass() { return iconClass; }
    public String getColorClass() { return colorClass; }
}
