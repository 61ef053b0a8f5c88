package io.meterfleet.worker;

import io.meterfleet.registry.DatabaseManager;
import io.meterfleet.registry.DeviceType;
import io.meterfleet.registry.JdbcMeasurementSink;
import io.meterfleet.registry.MeasurementGenerator;
import io.meterfleet.registry.MeasurementSink;
import io.meterfleet.supervisor.DeviceSettings;
import io.meterfleet.supervisor.DeviceStatusFile;
import io.meterfleet.supervisor.StatusFileRegistrationStore;
import io.meterfleet.uplink.UplinkSession;
import io.meterfleet.uplink.UplinkSettings;
import io.meterfleet.uplink.UplinkSettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Entry point of a worker process: {@code WorkerMain <deviceId> <deviceType> <intervalSeconds>}.
 * Runs until SIGTERM.
 */
public class WorkerMain {

    private static final Logger logger = LoggerFactory.getLogger(WorkerMain.class);

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(2);

    public static void main(String[] args) {
        if (args.length < 3) {
            logger.error("Usage: WorkerMain <deviceId> <deviceType> <intervalSeconds>");
            System.exit(2);
        }
        String deviceId = args[0];
        Optional<DeviceType> deviceType = DeviceType.parse(args[1]);
        if (deviceType.isEmpty()) {
            logger.error("Unknown device type: {}", args[1]);
            System.exit(2);
        }
        int intervalSeconds;
        try {
            intervalSeconds = DeviceSettings.clamp(Integer.parseInt(args[2]));
        } catch (NumberFormatException e) {
            logger.warn("Invalid interval '{}', using {}s", args[2], DeviceSettings.DEFAULT_MEASUREMENT_INTERVAL);
            intervalSeconds = DeviceSettings.DEFAULT_MEASUREMENT_INTERVAL;
        }
        Thread.currentThread().setName("worker-" + deviceId);

        MeasurementSink sink = new JdbcMeasurementSink(DatabaseManager.fromSystemProperties());
        UplinkSession session = createSession(deviceId);
        DeviceWorker worker = new DeviceWorker(deviceId, deviceType.get(), Duration.ofSeconds(intervalSeconds),
            sink, new MeasurementGenerator(sink), session);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown hook triggered, stopping worker {}...", deviceId);
            try {
                worker.stop(STOP_TIMEOUT);
            } catch (RuntimeException e) {
                logger.error("Error stopping worker {}", deviceId, e);
            } finally {
                sink.close();
            }
        }, "worker-" + deviceId + "-shutdown"));

        worker.run();
    }

    static UplinkSession createSession(String deviceId) {
        UplinkSettings settings = UplinkSettingsStore.fromSystemProperties().load();
        if (!settings.isEnabled()) {
            return null;
        }
        if (!settings.isConfigured()) {
            logger.warn("Uplink enabled but no broker host configured, running {} without uplink", deviceId);
            return null;
        }
        return new UplinkSession.Builder()
            .deviceId(deviceId)
            .settings(settings)
            .registrationStore(new StatusFileRegistrationStore(DeviceStatusFile.fromSystemProperties()))
            .build();
    }
}
