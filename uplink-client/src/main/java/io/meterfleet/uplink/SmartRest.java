package io.meterfleet.uplink;

import io.meterfleet.registry.model.MeasurementSample;

import java.util.ArrayList;
import java.util.List;

/**
 * SmartREST static templates understood by the telemetry platform. Devices publish on
 * {@link #PUBLISH_TOPIC} and receive operations on {@link #COMMAND_TOPIC}.
 */
public final class SmartRest {

    public static final String PUBLISH_TOPIC = "s/us";
    public static final String COMMAND_TOPIC = "s/ds";

    public static final String HEARTBEAT = "400,c8y_Heartbeat,Device heartbeat";
    public static final String RESTART_EXECUTING = "501,c8y_Restart";
    public static final String RESTART_SUCCESSFUL = "503,c8y_Restart";

    private static final String RESTART_OPERATION = "510";

    private SmartRest() {
    }

    public static String registration(String deviceName, String deviceType) {
        return "100," + deviceName + "," + deviceType;
    }

    public static String measurement(MeasurementSample sample) {
        String ts = sample.getTimestamp().toString();
        return String.join("\n",
            "200,c8y_Voltage,V," + sample.getVoltage() + ",V," + ts,
            "200,c8y_Current,I," + sample.getCurrent() + ",A," + ts,
            "200,c8y_Power,P," + sample.getPower() + ",W," + ts,
            "200,c8y_EnergyConsumption,E," + sample.getKwh() + ",kWh," + ts);
    }

    public static String alarm(AlarmSeverity severity, String alarmType, String text) {
        return severity.getTemplateId() + "," + alarmType + "," + text;
    }

    /**
     * Splits an inbound payload into its template lines; one publish may carry several operations.
     */
    public static List<String> lines(String payload) {
        List<String> lines = new ArrayList<>();
        for (String line : payload.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    public static boolean isRestartCommand(String line) {
        return line.equals(RESTART_OPERATION) || line.startsWith(RESTART_OPERATION + ",");
    }
}
