/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.vmware.optmodel.EvaluationException;

/**
 * Binary operators that cannot be expanded into sums of products
 */
public enum TermOperator {
    POWER("^"),
    DIVISION("/");

    private final String token;

    TermOperator(final String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    double apply(final double left, final double right) {
        switch (this) {
            case POWER:
                return Math.pow(left, right);
            case DIVISION:
                if (right == 0) {
                    throw new EvaluationException("Division by zero");
                }
                return left / right;
            default:
                throw new EvaluationException("Unknown operator: " + this);
        }
    }
}
