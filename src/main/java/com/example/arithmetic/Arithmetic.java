package com.example.arithmetic;

import com.example.arithmetic.util.LazyLogger;

/**
 * Elementary arithmetic on two operands.
 *
 * <p>Each operation comes in a {@code long} flavour, following Java's integral rules, and a
 * {@code double} flavour, following IEEE-754. Mixed calls widen to {@code double}.
 */
public final class Arithmetic {
    private static final LazyLogger LOGGER = new LazyLogger(Arithmetic.class);

    private Arithmetic() {
        // Utility class
    }

    public static long add(long a, long b) {
        return a + b;
    }

    public static double add(double a, double b) {
        return a + b;
    }

    public static long subtract(long a, long b) {
        return a - b;
    }

    public static double subtract(double a, double b) {
        return a - b;
    }

    public static long multiply(long a, long b) {
        return a * b;
    }

    public static double multiply(double a, double b) {
        return a * b;
    }

    /**
     * Performs integer division, truncating toward zero.
     *
     * @param dividend value to be divided
     * @param divisor value to divide by
     * @return quotient of the integer division
     * @throws DivisionByZeroException when divisor is zero
     */
    public static long divide(long dividend, long divisor) {
        if (divisor == 0L) {
            LOGGER.debug(() -> "Rejected division of " + dividend + " by zero");
            throw new DivisionByZeroException();
        }
        return dividend / divisor;
    }

    /**
     * Performs floating-point division.
     *
     * @param dividend value to be divided
     * @param divisor value to divide by, either signed zero is rejected
     * @return quotient of the division
     * @throws DivisionByZeroException when divisor is zero
     */
    public static double divide(double dividend, double divisor) {
        if (divisor == 0.0) {
            LOGGER.debug(() -> "Rejected division of " + dividend + " by zero");
            throw new DivisionByZeroException();
        }
        return dividend / divisor;
    }
}
