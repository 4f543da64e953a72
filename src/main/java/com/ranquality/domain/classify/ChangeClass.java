package com.ranquality.domain.classify;

public enum ChangeClass {
    INCREASE('I'),
    STABLE('S'),
    DECREASE('D');

    private final char code;

    ChangeClass(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    /** Both bounds inclusive: {@code +t} is an increase, {@code -t} a decrease. */
    public static ChangeClass of(double ratio, double threshold) {
        return of(ratio, threshold, threshold);
    }

    /** Same as {@link #of(double, double)} with a separate bound for each direction. */
    public static ChangeClass of(double ratio, double decreaseThreshold, double increaseThreshold) {
        if (ratio >= increaseThreshold) {
            return INCREASE;
        }
        if (ratio <= -decreaseThreshold) {
            return DECREASE;
        }
        return STABLE;
    }

    public static ChangeClass of(Delta delta, double threshold) {
        return of(delta, threshold, threshold);
    }

    public static ChangeClass of(Delta delta, double decreaseThreshold, double increaseThreshold) {
        if (!delta.isDefined()) {
            throw new IllegalArgumentException("cannot classify an undefined delta "
                + delta.fromWindow() + "->" + delta.toWindow());
        }
        return of(delta.ratio(), decreaseThreshold, increaseThreshold);
    }
}
