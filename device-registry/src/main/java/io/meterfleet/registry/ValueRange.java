package io.meterfleet.registry;

import java.util.Random;

public final class ValueRange {

    private final double min;
    private final double max;

    public ValueRange(double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("Range minimum " + min + " exceeds maximum " + max);
        }
        this.min = min;
        this.max = max;
    }

    public double getMin() { return min; }

    public double getMax() { return max; }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    double sample(Random random) {
        return min + random.nextDouble() * (max - min);
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
