/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.vmware.optmodel.EvaluationException;

/**
 * Functions that wrap a whole expression, rendered as {@code token(body, args...)}
 */
public enum MathFunction {
    ABS("abs"),
    LOG("log"),
    LOG2("log2"),
    LOG10("log10"),
    EXP("exp"),
    SQRT("sqrt"),
    MOD("mod"),
    INT("int"),
    SIGN("sign"),
    MAX("max"),
    MIN("min"),
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    SINH("sinh"),
    COSH("cosh"),
    TANH("tanh"),
    SUM("sum");

    private final String token;

    MathFunction(final String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * @param body value of the wrapped expression
     * @param args values of the extra arguments
     * @return the function value
     * @throws EvaluationException when the function is undefined at the given point
     */
    double apply(final double body, final double... args) {
        final double result;
        switch (this) {
            case ABS:
                result = Math.abs(body);
                break;
            case LOG:
                result = Math.log(body);
                break;
            case LOG2:
                result = Math.log(body) / Math.log(2);
                break;
            case LOG10:
                result = Math.log10(body);
                break;
            case EXP:
                result = Math.exp(body);
                break;
            case SQRT:
                result = Math.sqrt(body);
                break;
            case MOD:
                if (args.length != 1 || args[0] == 0) {
                    throw new EvaluationException("mod requires a non-zero divisor");
                }
                result = body - args[0] * Math.floor(body / args[0]);
                break;
            case INT:
                result = body < 0 ? Math.ceil(body) : Math.floor(body);
                break;
            case SIGN:
                result = Math.signum(body);
                break;
            case MAX:
                double max = body;
                for (final double arg : args) {
                    max = Math.max(max, arg);
                }
                result = max;
                break;
            case MIN:
                double min = body;
                for (final double arg : args) {
                    min = Math.min(min, arg);
                }
                result = min;
                break;
            case SIN:
                result = Math.sin(body);
                break;
            case COS:
                result = Math.cos(body);
                break;
            case TAN:
                result = Math.tan(body);
                break;
            case SINH:
                result = Math.sinh(body);
                break;
            case COSH:
                result = Math.cosh(body);
                break;
            case TANH:
                result = Math.tanh(body);
                break;
            case SUM:
                result = body;
                break;
            default:
                throw new EvaluationException("Unknown operator: " + this);
        }
        if (Double.isNaN(result) && !Double.isNaN(body)) {
            throw new EvaluationException(String.format("%s is not defined at %s", token, body));
        }
        return result;
    }
}
