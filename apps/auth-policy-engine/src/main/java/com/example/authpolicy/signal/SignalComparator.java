package com.example.authpolicy.signal;

/**
 * Single threshold comparison for a signal value.
 *
 * <ul>
 *   <li>RISK: the value is an anomaly score, it breaches when {@code value >= threshold}</li>
 *   <li>QUALITY: the value is a confidence score, it breaches when {@code value < threshold}</li>
 * </ul>
 */
public record SignalComparator(Direction direction, double threshold) {

    public enum Direction {
        RISK,
        QUALITY
    }

    public static SignalComparator risk(double threshold) {
        return new SignalComparator(Direction.RISK, threshold);
    }

    public static SignalComparator quality(double threshold) {
        return new SignalComparator(Direction.QUALITY, threshold);
    }

    public boolean breaches(double value) {
        return direction == Direction.RISK ? value >= threshold : value < threshold;
    }

    public String describe() {
        return direction == Direction.RISK
                ? String.format("%s >= %.2f", direction, threshold)
                : String.format("%s < %.2f", direction, threshold);
    }
}
