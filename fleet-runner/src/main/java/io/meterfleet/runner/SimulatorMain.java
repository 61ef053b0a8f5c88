package io.meterfleet.runner;

import io.meterfleet.registry.DatabaseManager;
import io.meterfleet.registry.DeviceType;
import io.meterfleet.registry.JdbcMeasurementSink;
import io.meterfleet.registry.MeasurementSink;
import io.meterfleet.supervisor.DeviceRecord;
import io.meterfleet.supervisor.DeviceSettings;
import io.meterfleet.supervisor.DeviceStatusFile;
import io.meterfleet.supervisor.DeviceSupervisor;
import io.meterfleet.supervisor.ProcessWorkerLauncher;
import io.meterfleet.uplink.UplinkSettings;
import io.meterfleet.uplink.UplinkSettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Console control plane: brings up the devices requested in {@code fleet.devices}
 * (for example {@code PV:2,HeatPump:1}), logs the fleet state periodically and stops every
 * worker on exit.
 */
public class SimulatorMain {

    private static final Logger logger = LoggerFactory.getLogger(SimulatorMain.class);

    public static void main(String[] args) throws InterruptedException {
        String devicePlan = System.getProperty("fleet.devices", "PV:1");
        long runSeconds = Long.getLong("fleet.run.seconds", 0L);
        long reportSeconds = Math.max(1L, Long.getLong("fleet.report.seconds", 30L));
        String intervalOverride = System.getProperty("fleet.measurement.interval");

        DeviceStatusFile statusFile = DeviceStatusFile.fromSystemProperties();
        DeviceSettings deviceSettings = DeviceSettings.fromSystemProperties();
        UplinkSettings uplinkSettings = UplinkSettingsStore.fromSystemProperties().load();
        DatabaseManager dbManager = DatabaseManager.fromSystemProperties();

        logger.info("=== Meter Fleet Simulator ===");
        logger.info("Devices: {}", devicePlan);
        logger.info("Database: {}", dbManager.getUrl());
        logger.info("Status file: {}", statusFile.getFile());
        logger.info("Uplink: {}", uplinkSettings.isEnabled() ? uplinkSettings : "disabled");
        logger.info("Run time: {}", runSeconds > 0 ? runSeconds + "s" : "until Ctrl+C");
        logger.info("=============================");

        MeasurementSink sink = new JdbcMeasurementSink(dbManager);
        DeviceSupervisor supervisor = DeviceSupervisor.open(statusFile, deviceSettings, new ProcessWorkerLauncher(), sink);
        if (intervalOverride != null) {
            try {
                supervisor.setMeasurementInterval(Integer.parseInt(intervalOverride.trim()));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid fleet.measurement.interval '{}'", intervalOverride);
            }
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown hook triggered, performing cleanup...");
            try {
                supervisor.cleanup();
            } catch (RuntimeException e) {
                logger.error("Error during shutdown cleanup", e);
            } finally {
                sink.close();
                shutdown.countDown();
            }
            logger.info("Shutdown cleanup completed");
        }, "simulator-shutdown"));

        Map<DeviceType, Integer> plan;
        try {
            plan = parseDevicePlan(devicePlan);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid fleet.devices '{}': {}", devicePlan, e.getMessage());
            System.exit(2);
            return;
        }

        List<String> started = new ArrayList<>();
        for (String deviceId : selectDevices(supervisor, plan)) {
            if (supervisor.startDevice(deviceId)) {
                started.add(deviceId);
            }
        }
        logger.info("Started {} devices: {}", started.size(), started);

        long elapsed = 0;
        while (runSeconds <= 0 || elapsed < runSeconds) {
            long wait = runSeconds > 0 ? Math.min(reportSeconds, runSeconds - elapsed) : reportSeconds;
            if (shutdown.await(wait, TimeUnit.SECONDS)) {
                return;
            }
            elapsed += wait;
            report(supervisor);
        }

        logger.info("Run time elapsed, stopping fleet");
        System.exit(0);
    }

    /**
     * Reuses existing devices of each type before adding new ones.
     */
    static List<String> selectDevices(DeviceSupervisor supervisor, Map<DeviceType, Integer> plan) {
        List<String> selected = new ArrayList<>();
        List<DeviceRecord> existing = supervisor.listAll();
        for (Map.Entry<DeviceType, Integer> entry : plan.entrySet()) {
            int wanted = entry.getValue();
            for (DeviceRecord record : existing) {
                if (wanted == 0) {
                    break;
                }
                if (record.getDeviceType() == entry.getKey()) {
                    selected.add(record.getDeviceId());
                    wanted--;
                }
            }
            for (; wanted > 0; wanted--) {
                selected.add(supervisor.addDevice(entry.getKey().getTypeId()));
            }
        }
        return selected;
    }

    static Map<DeviceType, Integer> parseDevicePlan(String plan) {
        Map<DeviceType, Integer> result = new EnumMap<>(DeviceType.class);
        if (plan == null || plan.isBlank()) {
            return result;
        }
        for (String part : plan.split(",")) {
            String item = part.trim();
            if (item.isEmpty()) {
                continue;
            }
            String[] typeAndCount = item.split(":", 2);
            DeviceType type = DeviceType.parse(typeAndCount[0])
                .orElseThrow(() -> new IllegalArgumentException("Unknown device type: " + typeAndCount[0].trim()));
            int count;
            try {
                count = typeAndCount.length > 1 ? Integer.parseInt(typeAndCount[1].trim()) : 1;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid device count in '" + item + "'", e);
            }
            if (count < 0) {
                throw new IllegalArgumentException("Negative device count in '" + item + "'");
            }
            result.merge(type, count, Integer::sum);
        }
        return result;
    }

    private static void report(DeviceSupervisor supervisor) {
        List<DeviceRecord> devices = supervisor.listAll();
        long active = devices.stream().filter(d -> supervisor.isRunning(d.getDeviceId())).count();
        logger.info("Fleet status: {} devices, {} running", devices.size(), active);
        for (DeviceRecord device : devices) {
            logger.debug("  {} [{}] {}", device.getDeviceId(), device.getDeviceType().getDisplayName(),
                device.getStatus().getValue());
        }
    }
}
