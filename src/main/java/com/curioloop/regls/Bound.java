/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Closed interval [lower, upper] used by {@link IndicatorBox}.
 * <p>
 * A missing limit is stored as {@link #UNBOUNDED}.
 * </p>
 */
public final class Bound {

    /** Constant representing a missing limit */
    public static final double UNBOUNDED = Double.NaN;

    private final double lower;
    private final double upper;

    /**
     * Creates an interval.
     * @param lower Lower limit (use UNBOUNDED for none)
     * @param upper Upper limit (use UNBOUNDED for none)
     */
    public Bound(double lower, double upper) {
        if (!Double.isNaN(lower) && !Double.isNaN(upper) && lower > upper) {
            throw new IllegalArgumentException("Lower bound must not exceed upper bound");
        }
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Creates the whole real line.
     * @return Unbounded interval
     */
    public static Bound unbounded() {
        return new Bound(UNBOUNDED, UNBOUNDED);
    }

    /**
     * Creates [lower, upper].
     * @param lower Lower limit
     * @param upper Upper limit
     * @return Interval
     */
    public static Bound between(double lower, double upper) {
        return new Bound(lower, upper);
    }

    /**
     * Creates [value, +∞).
     * @param value Lower limit
     * @return Interval
     */
    public static Bound atLeast(double value) {
        return new Bound(value, UNBOUNDED);
    }

    /**
     * Creates (-∞, value].
     * @param value Upper limit
     * @return Interval
     */
    public static Bound atMost(double value) {
        return new Bound(UNBOUNDED, value);
    }

    /**
     * Gets the lower limit.
     * @return Lower limit (NaN if unbounded below)
     */
    public double getLower() {
        return lower;
    }

    /**
     * Gets the upper limit.
     * @return Upper limit (NaN if unbounded above)
     */
    public double getUpper() {
        return upper;
    }

    /**
     * Checks if this interval has a lower limit.
     * @return true if lower limit exists
     */
    public boolean hasLower() {
        return !Double.isNaN(lower);
    }

    /**
     * Checks if this interval has an upper limit.
     * @return true if upper limit exists
     */
    public boolean hasUpper() {
        return !Double.isNaN(upper);
    }

    /**
     * Checks if this interval is the whole real line.
     * @return true if no limits
     */
    public boolean isUnbounded() {
        return !hasLower() && !hasUpper();
    }

    /**
     * Checks whether a value lies in the interval.
     * @param value Value to test
     * @return true if lower &lt;= value &lt;= upper
     */
    public boolean contains(double value) {
        return (!hasLower() || value >= lower) && (!hasUpper() || value <= upper);
    }

    /**
     * Projects a value onto the interval.
     * @param value Value to project
     * @return Closest point of the interval
     */
    public double project(double value) {
        if (hasLower() && value < lower) return lower;
        if (hasUpper() && value > upper) return upper;
        return value;
    }

    @Override
    public String toString() {
        if (isUnbounded()) return "(-∞, +∞)";
        String l = hasLower() ? "[" + lower : "(-∞";
        String u = hasUpper() ? upper + "]" : "+∞)";
        return l + ", " + u;
    }
}
