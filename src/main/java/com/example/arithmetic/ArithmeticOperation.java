package com.example.arithmetic;

import java.util.Locale;

/**
 * The binary operations offered by {@link Arithmetic}, addressable by name or symbol.
 */
public enum ArithmeticOperation {
    ADD("add", "+") {
        @Override
        public long apply(long a, long b) {
            return Arithmetic.add(a, b);
        }

        @Override
        public double apply(double a, double b) {
            return Arithmetic.add(a, b);
        }
    },
    SUBTRACT("subtract", "-") {
        @Override
        public long apply(long a, long b) {
            return Arithmetic.subtract(a, b);
        }

        @Override
        public double apply(double a, double b) {
            return Arithmetic.subtract(a, b);
        }
    },
    MULTIPLY("multiply", "*") {
        @Override
        public long apply(long a, long b) {
            return Arithmetic.multiply(a, b);
        }

        @Override
        public double apply(double a, double b) {
            return Arithmetic.multiply(a, b);
        }
    },
    DIVIDE("divide", "/") {
        @Override
        public long apply(long a, long b) {
            return Arithmetic.divide(a, b);
        }

        @Override
        public double apply(double a, double b) {
            return Arithmetic.divide(a, b);
        }
    };

    private final String operationName;
    private final String symbol;

    ArithmeticOperation(String operationName, String symbol) {
        this.operationName = operationName;
        this.symbol = symbol;
    }

    public String operationName() {
        return operationName;
    }

    public String symbol() {
        return symbol;
    }

    public abstract long apply(long a, long b);

    public abstract double apply(double a, double b);

    /**
     * Applies the operation with integral semantics when both operands are integral, and
     * floating-point semantics otherwise.
     */
    public Operand apply(Operand a, Operand b) {
        if (a.isIntegral() && b.isIntegral()) {
            return Operand.of(apply(a.longValue(), b.longValue()));
        }
        return Operand.of(apply(a.doubleValue(), b.doubleValue()));
    }

    /**
     * Resolves an operation from its name (any case) or its symbol.
     *
     * @throws IllegalArgumentException when no operation matches
     */
    public static ArithmeticOperation fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Operation must not be null");
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (ArithmeticOperation operation : values()) {
            if (operation.operationName.equals(normalized) || operation.symbol.equals(normalized)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + token);
    }
}
