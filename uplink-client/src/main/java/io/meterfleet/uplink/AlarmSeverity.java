package io.meterfleet.uplink;

public enum AlarmSeverity {
    CRITICAL(301),
    MAJOR(302),
    MINOR(303),
    WARNING(304);

    private final int templateId;

    AlarmSeverity(int templateId) {
        this.templateId = templateId;
    }

    public int getTemplateId() {
        return templateId;
    }
}
