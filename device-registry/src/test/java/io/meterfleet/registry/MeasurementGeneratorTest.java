package io.meterfleet.registry;

import io.meterfleet.registry.model.MeasurementSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MeasurementGeneratorTest {

    private InMemoryMeasurementSink sink;
    private MutableClock clock;
    private MeasurementGenerator generator;

    @BeforeEach
    void setUp() {
        sink = new InMemoryMeasurementSink();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        generator = new MeasurementGenerator(sink, clock, new Random(42));
    }

    @Test
    void cumulativeEnergyAtConstantPowerGrowsLinearly() {
        Duration interval = Duration.ofSeconds(5);
        int samples = 20;
        double previousKwh = 0.0;

        for (int i = 0; i < samples; i++) {
            MeasurementSample sample = generator.next("pv001", 200.0, 5.0, interval);
            assertThat(sample.getPower()).isEqualTo(1000.0);
            assertThat(sample.getKwh()).isGreaterThanOrEqualTo(previousKwh);
            previousKwh = sample.getKwh();
            sink.insert(sample);
            clock.advance(interval);
        }

        double expected = samples * 1000.0 / 1000.0 * 5.0 / 3600.0;
        assertThat(previousKwh).isCloseTo(expected, within(1e-5));
    }

    @Test
    void firstSampleCountsOneIntervalFromZero() {
        MeasurementSample first = generator.next("heatpump001", 230.0, 10.0, Duration.ofSeconds(60));

        assertThat(first.getPower()).isEqualTo(2300.0);
        assertThat(first.getKwh()).isCloseTo(2.3 / 60.0, within(1e-6));
    }

    @Test
    void energyBuildsOnPreviousStoredSampleOfSameDeviceOnly() {
        sink.insert(new MeasurementSample("pv001", clock.instant(), 220, 10, 2200, 5.0));
        sink.insert(new MeasurementSample("pv002", clock.instant(), 220, 10, 2200, 99.0));
        clock.advance(Duration.ofHours(1));

        MeasurementSample next = generator.next("pv001", 200.0, 5.0, Duration.ofSeconds(5));

        assertThat(next.getKwh()).isCloseTo(6.0, within(1e-9));
    }

    @Test
    void generatedValuesStayWithinProfileRanges() {
        DeviceProfile profile = DeviceTypeRegistry.profileOf(DeviceType.MAIN_GRID);

        for (int i = 0; i < 50; i++) {
            MeasurementSample sample = generator.generate("maingrid001", DeviceType.MAIN_GRID, Duration.ofSeconds(5));
            assertThat(profile.getVoltageRange().contains(sample.getVoltage())).isTrue();
            assertThat(profile.getCurrentRange().contains(sample.getCurrent())).isTrue();
            assertThat(sample.getPower()).isCloseTo(sample.getVoltage() * sample.getCurrent(), within(0.01));
            sink.insert(sample);
            clock.advance(Duration.ofSeconds(5));
        }
    }
}
