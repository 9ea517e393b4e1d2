/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

/**
 * Thrown when an arithmetic or relational operation receives an operand it cannot represent.
 */
public class OperandTypeException extends ModelException {
    public OperandTypeException(final String operation, final Object operand) {
        super(String.format("Unsupported operand type for %s: %s", operation, operand.getClass().getName()));
    }
}
