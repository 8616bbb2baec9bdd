package com.example.arithmetic;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ArithmeticOperationTest {

    @ParameterizedTest
    @CsvSource({
        "add, ADD",
        "ADD, ADD",
        "+, ADD",
        "subtract, SUBTRACT",
        "-, SUBTRACT",
        "Multiply, MULTIPLY",
        "*, MULTIPLY",
        "divide, DIVIDE",
        "/, DIVIDE"
    })
    void fromToken_shouldResolveNamesAndSymbols(String token, ArithmeticOperation expected) {
        assertEquals(expected, ArithmeticOperation.fromToken(token));
    }

    @Test
    void fromToken_shouldRejectUnknownToken() {
        IllegalArgumentException e =
                assertThrows(
                        IllegalArgumentException.class, () -> ArithmeticOperation.fromToken("mod"));

        assertEquals("Unknown operation: mod", e.getMessage());
    }

    @Test
    void apply_shouldUseIntegralSemantics_whenBothOperandsAreIntegral() {
        Operand result = ArithmeticOperation.DIVIDE.apply(Operand.of(7L), Operand.of(2L));

        assertTrue(result.isIntegral());
        assertEquals(3L, result.longValue());
    }

    @Test
    void apply_shouldUseFloatingSemantics_whenAnyOperandIsFloating() {
        Operand result = ArithmeticOperation.DIVIDE.apply(Operand.of(7L), Operand.of(2.0));

        assertFalse(result.isIntegral());
        assertEquals(3.5, result.doubleValue());
    }

    @Test
    void apply_shouldDelegateToArithmetic() {
        assertEquals(5L, ArithmeticOperation.ADD.apply(2L, 3L));
        assertEquals(2L, ArithmeticOperation.SUBTRACT.apply(5L, 3L));
        assertEquals(12L, ArithmeticOperation.MULTIPLY.apply(4L, 3L));
        assertEquals(5L, ArithmeticOperation.DIVIDE.apply(10L, 2L));
        assertEquals(1.5, ArithmeticOperation.ADD.apply(1.0, 0.5));
    }

    @Test
    void apply_shouldPropagateDivisionByZero() {
        assertThrows(
                DivisionByZeroException.class,
                () -> ArithmeticOperation.DIVIDE.apply(Operand.of(7L), Operand.of(0L)));
    }
}
