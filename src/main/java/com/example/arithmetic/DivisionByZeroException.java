package com.example.arithmetic;

/**
 * Thrown when the divisor of a division is zero.
 */
public class DivisionByZeroException extends ArithmeticException {
    public static final String MESSAGE = "Cannot divide by zero";

    private static final long serialVersionUID = 1L;

    public DivisionByZeroException() {
        super(MESSAGE);
    }
}
