package com.example.arithmetic;

/**
 * A numeric operand parsed from text, either integral or floating-point.
 */
public final class Operand {
    private final long integral;
    private final double floating;
    private final boolean isIntegral;

    private Operand(long integral, double floating, boolean isIntegral) {
        this.integral = integral;
        this.floating = floating;
        this.isIntegral = isIntegral;
    }

    public static Operand of(long value) {
        return new Operand(value, value, true);
    }

    public static Operand of(double value) {
        return new Operand(0L, value, false);
    }

    /**
     * Parses an operand, preferring the integral reading.
     *
     * @param text decimal text such as {@code "42"} or {@code "-1.5e3"}
     * @return the parsed operand
     * @throws IllegalArgumentException when the text is not a number
     */
    public static Operand parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Operand must not be null");
        }
        String trimmed = text.trim();
        try {
            return of(Long.parseLong(trimmed));
        } catch (NumberFormatException notIntegral) {
            try {
                return of(Double.parseDouble(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: " + text, e);
            }
        }
    }

    public boolean isIntegral() {
        return isIntegral;
    }

    public long longValue() {
        if (!isIntegral) {
            throw new IllegalStateException("Operand is not integral: " + floating);
        }
        return integral;
    }

    public double doubleValue() {
        return isIntegral ? (double) integral : floating;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Operand)) {
            return false;
        }
        Operand other = (Operand) o;
        return isIntegral == other.isIntegral
                && integral == other.integral
                && Double.compare(floating, other.floating) == 0;
    }

    @Override
    public int hashCode() {
        return isIntegral ? Long.hashCode(integral) : Double.hashCode(floating);
    }

    @Override
    public String toString() {
        return isIntegral ? Long.toString(integral) : Double.toString(floating);
    }
}
