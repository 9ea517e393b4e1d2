/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

/**
 * {@code restore c d[1];}, the inverse of {@link DropStatement}
 */
public class RestoreStatement extends DropStatement {

    public RestoreStatement(final Object... targets) {
        super("restore", targets);
    }
}
