/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

/**
 * Thrown when an expression cannot be evaluated to a number: division by zero, an operator without a
 * numeric equivalent, or a symbolic value that was never bound.
 */
public class EvaluationException extends ModelException {
    public EvaluationException(final String message) {
        super(message);
    }

    public EvaluationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
