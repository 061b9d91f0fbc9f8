/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp;

/**
 * Bounds on a single QP variable.
 * <p>
 * An open side is stored as {@link #OPEN} and becomes an infinite entry
 * in the problem's bound vectors.
 * </p>
 */
public final class Bound {

    /** Marker for an open side */
    public static final double OPEN = Double.NaN;

    private static final Bound FREE = new Bound(OPEN, OPEN);

    private final double lower;
    private final double upper;

    private Bound(double lower, double upper) {
        if (!Double.isNaN(lower) && !Double.isNaN(upper) && lower > upper) {
            throw new IllegalArgumentException("Lower bound must not exceed upper bound: " + lower + " > " + upper);
        }
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Free variable.
     * @return Bound open on both sides
     */
    public static Bound free() {
        return FREE;
    }

    /**
     * Creates a box bound.
     * @param lower Lower bound
     * @param upper Upper bound
     * @return Bound with both limits
     */
    public static Bound between(double lower, double upper) {
        return new Bound(lower, upper);
    }

    /**
     * Creates a bound with only a lower limit (x &gt;= value).
     * @param value Minimum value
     * @return Bound with lower limit only
     */
    public static Bound atLeast(double value) {
        return new Bound(value, OPEN);
    }

    /**
     * Creates a bound with only an upper limit (x &lt;= value).
     * @param value Maximum value
     * @return Bound with upper limit only
     */
    public static Bound atMost(double value) {
        return new Bound(OPEN, value);
    }

    /**
     * Creates a fixed bound where the variable must equal the given value.
     * @param value Exact value
     * @return Fixed bound
     */
    public static Bound exactly(double value) {
        return new Bound(value, value);
    }

    /**
     * Checks if this bound has a lower limit.
     * @return true if lower bound exists
     */
    public boolean hasLower() {
        return !Double.isNaN(lower) && lower != Double.NEGATIVE_INFINITY;
    }

    /**
     * Checks if this bound has an upper limit.
     * @return true if upper bound exists
     */
    public boolean hasUpper() {
        return !Double.isNaN(upper) && upper != Double.POSITIVE_INFINITY;
    }

    /**
     * Gets the lower bound as a bound-vector entry.
     * @return Lower bound, or negative infinity if open
     */
    public double lowerValue() {
        return hasLower() ? lower : Double.NEGATIVE_INFINITY;
    }

    /**
     * Gets the upper bound as a bound-vector entry.
     * @return Upper bound, or positive infinity if open
     */
    public double upperValue() {
        return hasUpper() ? upper : Double.POSITIVE_INFINITY;
    }

    /**
     * Checks if this is a fixed bound (lower == upper).
     * @return true if fixed
     */
    public boolean isFixed() {
        return hasLower() && hasUpper() && lower == upper;
    }

    @Override
    public String toString() {
        if (isFixed()) return "[" + lower + "]";
        String l = hasLower() ? "[" + lower : "(-∞";
        String u = hasUpper() ? upper + "]" : "+∞)";
        return l + ", " + u;
    }
}
