package io.meterfleet.worker;

import io.meterfleet.registry.DeviceType;
import io.meterfleet.registry.MeasurementGenerator;
import io.meterfleet.registry.MeasurementSink;
import io.meterfleet.registry.model.MeasurementSample;
import io.meterfleet.uplink.AlarmSeverity;
import io.meterfleet.uplink.UplinkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Sampling loop of one device: generate, store, forward, wait.
 *
 * <p>{@link #stop(Duration)} ends the wait early but lets a running iteration complete before
 * the uplink is closed.
 */
public class DeviceWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(DeviceWorker.class);

    static final String STOPPED_ALARM = "c8y_WorkerStopped";

    private final String deviceId;
    private final DeviceType deviceType;
    private final Duration interval;
    private final MeasurementSink sink;
    private final MeasurementGenerator generator;
    private final UplinkSession session;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean started = false;

    /**
     * @param session uplink to the platform, or {@code null} when the uplink is disabled
     */
    public DeviceWorker(String deviceId, DeviceType deviceType, Duration interval,
                        MeasurementSink sink, MeasurementGenerator generator, UplinkSession session) {
        this.deviceId = deviceId;
        this.deviceType = deviceType;
        this.interval = interval;
        this.sink = sink;
        this.generator = generator;
        this.session = session;
    }

    @Override
    public void run() {
        started = true;
        try {
            logger.info("Worker for {} ({}) running with interval {}s", deviceId, deviceType.getDisplayName(),
                interval.getSeconds());
            openUplink();
            while (stopSignal.getCount() > 0) {
                step();
                if (stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Worker for {} interrupted", deviceId);
        } finally {
            finished.countDown();
            logger.info("Sampling loop of {} ended", deviceId);
        }
    }

    void openUplink() {
        if (session == null) {
            logger.info("Uplink disabled for {}", deviceId);
            return;
        }
        if (!session.connect()) {
            logger.warn("Uplink of {} not connected ({}); retrying with the next sample",
                deviceId, session.getLastFailure().map(f -> f.getDescription()).orElse("unknown reason"));
            return;
        }
        registerUplink();
    }

    private void registerUplink() {
        if (!session.register(deviceType.getDisplayName(), session.getClientId(), false)) {
            logger.warn("Registration of {} failed, continuing without it", deviceId);
        }
    }

    // The platform must know the device before its first measurement arrives.
    private void forward(MeasurementSample sample) {
        if (!session.ensureConnected()) {
            logger.debug("Uplink of {} still down, sample kept locally", deviceId);
            return;
        }
        if (!session.isRegistered()) {
            registerUplink();
        }
        if (!session.sendMeasurement(sample)) {
            logger.warn("Measurement of {} was not forwarded", deviceId);
        }
    }

    /**
     * One iteration of the sampling loop.
     *
     * @return the stored sample, or {@code null} when the iteration failed
     */
    MeasurementSample step() {
        try {
            MeasurementSample sample = generator.generate(deviceId, deviceType, interval);
            sink.insert(sample);
            logger.debug("Stored sample of {}: {} W, {} kWh", deviceId, sample.getPower(), sample.getKwh());
            if (session != null) {
                forward(sample);
            }
            return sample;
        } catch (RuntimeException e) {
            logger.error("Error in sampling loop of {}", deviceId, e);
            return null;
        }
    }

    /**
     * Stops the loop, waits up to {@code timeout} for the current iteration, then leaves the platform.
     */
    public void stop(Duration timeout) {
        stopSignal.countDown();
        if (started) {
            try {
                if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Sampling loop of {} did not finish within {}s", deviceId, timeout.getSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        closeUplink();
    }

    private void closeUplink() {
        if (session == null) {
            return;
        }
        if (session.isConnected()) {
            session.sendAlarm(STOPPED_ALARM, "Device worker " + deviceId + " stopped", AlarmSeverity.WARNING);
        }
        session.close();
        logger.info("Uplink of {} closed", deviceId);
    }

    public String getDeviceId() {
        return deviceId;
    }
}
