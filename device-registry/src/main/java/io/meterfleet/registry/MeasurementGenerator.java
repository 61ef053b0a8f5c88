package io.meterfleet.registry;

import io.meterfleet.registry.model.MeasurementSample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;

/**
 * Produces the next sample of a device.
 *
 * <p>Voltage and current are drawn from the device profile, power is their product and the
 * energy counter grows by {@code power_kW * elapsed_h} on top of the previous stored sample.
 */
public class MeasurementGenerator {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private final MeasurementSink sink;
    private final Clock clock;
    private final Random random;

    public MeasurementGenerator(MeasurementSink sink) {
        this(sink, Clock.systemUTC(), new Random());
    }

    public MeasurementGenerator(MeasurementSink sink, Clock clock, Random random) {
        this.sink = sink;
        this.clock = clock;
        this.random = random;
    }

    public MeasurementSample generate(String deviceId, DeviceType type, Duration interval) {
        DeviceProfile profile = DeviceTypeRegistry.profileOf(type);
        double voltage = round(profile.getVoltageRange().sample(random), 2);
        double current = round(profile.getCurrentRange().sample(random), 2);
        return next(deviceId, voltage, current, interval);
    }

    /**
     * Builds a sample from given electrical values. The first sample of a device counts one
     * full interval of energy on top of zero.
     */
    public MeasurementSample next(String deviceId, double voltage, double current, Duration interval) {
        Instant now = clock.instant();
        double power = round(voltage * current, 2);

        Optional<MeasurementSample> previous = sink.findLatest(deviceId);
        double previousKwh = previous.map(MeasurementSample::getKwh).orElse(0.0);
        Duration elapsed = previous
                .map(p -> Duration.between(p.getTimestamp(), now))
                .orElse(interval);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }

        double elapsedHours = elapsed.toMillis() / 1000.0 / SECONDS_PER_HOUR;
        double kwh = round(previousKwh + power / 1000.0 * elapsedHours, 6);
        return new MeasurementSample(deviceId, now, voltage, current, power, kwh);
    }

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
