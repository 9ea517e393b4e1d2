/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.vmware.optmodel.OperandTypeException;

/**
 * Mathematical functions over expressions. Each returns a new expression that wraps a copy of its argument,
 * so {@code min(x, 2, sqrt(x))} renders as written.
 */
public final class MathFunctions {

    private MathFunctions() {
    }

    public static Expression abs(final Object e) {
        return apply(MathFunction.ABS, e);
    }

    public static Expression log(final Object e) {
        return apply(MathFunction.LOG, e);
    }

    public static Expression log2(final Object e) {
        return apply(MathFunction.LOG2, e);
    }

    public static Expression log10(final Object e) {
        return apply(MathFunction.LOG10, e);
    }

    public static Expression exp(final Object e) {
        return apply(MathFunction.EXP, e);
    }

    public static Expression sqrt(final Object e) {
        return apply(MathFunction.SQRT, e);
    }

    public static Expression mod(final Object e, final Object divisor) {
        return apply(MathFunction.MOD, e, divisor);
    }

    /**
     * Integer part, rendered as {@code int(e)}
     */
    public static Expression intPart(final Object e) {
        return apply(MathFunction.INT, e);
    }

    public static Expression sign(final Object e) {
        return apply(MathFunction.SIGN, e);
    }

    public static Expression max(final Object e, final Object... args) {
        return apply(MathFunction.MAX, e, args);
    }

    public static Expression min(final Object e, final Object... args) {
        return apply(MathFunction.MIN, e, args);
    }

    public static Expression sin(final Object e) {
        return apply(MathFunction.SIN, e);
    }

    public static Expression cos(final Object e) {
        return apply(MathFunction.COS, e);
    }

    public static Expression tan(final Object e) {
        return apply(MathFunction.TAN, e);
    }

    public static Expression sinh(final Object e) {
        return apply(MathFunction.SINH, e);
    }

    public static Expression cosh(final Object e) {
        return apply(MathFunction.COSH, e);
    }

    public static Expression tanh(final Object e) {
        return apply(MathFunction.TANH, e);
    }

    private static Expression apply(final MathFunction function, final Object e, final Object... args) {
        final Expression base = Expression.operand(e, function.token());
        final Expression inner = base.getOperator() == null ? base.copy() : Expression.wrap(base);
        inner.operator = function;
        for (final Object arg : args) {
            if (!(arg instanceof Number) && !(arg instanceof Expression)) {
                throw new OperandTypeException(function.token(), arg);
            }
            inner.arguments.add(arg);
            if (arg instanceof Expression && ((Expression) arg).isAbstract()) {
                inner.isAbstract = true;
            }
        }
        return Expression.wrap(inner);
    }
}
