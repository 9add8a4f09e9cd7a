package com.entity.network.exploration;

/**
 * Thrown when a depth, size, distance or probability bound is out of range.
 */
public class InvalidBoundException extends GraphExplorationException {

    private final String boundName;
    private final Number value;

    public InvalidBoundException(String boundName, Number value, String requirement) {
        super(boundName + " " + requirement + ", got " + value);
        this.boundName = boundName;
        this.value = value;
    }

    public String getBoundName() {
        return boundName;
    }

    public Number getValue() {
        return value;
    }

    public static int requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new InvalidBoundException(name, value, "must be >= 0");
        }
        return value;
    }

    public static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new InvalidBoundException(name, value, "must be > 0");
        }
        return value;
    }

    public static double requireProbability(String name, double value) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new InvalidBoundException(name, value, "must be between 0.0 and 1.0");
        }
        return value;
    }
}
