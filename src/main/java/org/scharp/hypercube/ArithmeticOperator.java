///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * The element-wise operators that can combine two cubes of the same size.
 */
enum ArithmeticOperator {
    ADD("+", "Added with another Cube", Operation.ADD) {
        @Override
        double apply(double left, double right) {
            return left + right;
        }

        @Override
        BigDecimal applyExact(BigDecimal left, BigDecimal right) {
            return left.add(right);
        }
    },

    SUBTRACT("-", "Subtracted by another Cube", Operation.SUBTRACT) {
        @Override
        double apply(double left, double right) {
            return left - right;
        }

        @Override
        BigDecimal applyExact(BigDecimal left, BigDecimal right) {
            return left.subtract(right);
        }
    },

    MULTIPLY("*", "Multiplied elementwise by another Cube", Operation.MULTIPLY) {
        @Override
        double apply(double left, double right) {
            return left * right;
        }

        @Override
        BigDecimal applyExact(BigDecimal left, BigDecimal right) {
            return left.multiply(right);
        }
    },

    DIVIDE("/", "Divided elementwise by another Cube", Operation.DIVIDE) {
        @Override
        double apply(double left, double right) {
            return left / right;
        }

        @Override
        BigDecimal applyExact(BigDecimal left, BigDecimal right) {
            if (right.signum() == 0) {
                // Integer division by zero saturates in the direction of the dividend (0/0 is 0).
                return new BigDecimal(BigInteger.ONE.shiftLeft(65).multiply(BigInteger.valueOf(left.signum())));
            }
            return left.divide(right, 0, RoundingMode.HALF_UP);
        }
    };

    private final String symbol;
    private final String description;
    private final Operation operation;

    ArithmeticOperator(String symbol, String description, Operation operation) {
        this.symbol = symbol;
        this.description = description;
        this.operation = operation;
    }

    /**
     * Applies this operator to two floating point values.
     *
     * @param left
     *     the left operand
     * @param right
     *     the right operand
     *
     * @return the result
     */
    abstract double apply(double left, double right);

    /**
     * Applies this operator exactly, for the 64-bit integer types.  The caller saturates the result.
     *
     * @param left
     *     the left operand
     * @param right
     *     the right operand
     *
     * @return the result, which may be outside the range of any element type.
     */
    abstract BigDecimal applyExact(BigDecimal left, BigDecimal right);

    /**
     * @return The operator's symbol, used when synthesizing a quantity like "(Radiance / Irradiance)".
     */
    String symbol() {
        return symbol;
    }

    /**
     * @return The description that is recorded in the provenance log.
     */
    String description() {
        return description;
    }

    /**
     * @return The operation that is recorded in the provenance log.
     */
    Operation operation() {
        return operation;
    }
}
