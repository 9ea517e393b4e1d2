/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.container;

import com.vmware.optmodel.statement.Statement;

import java.util.List;

/**
 * Builds the statements that stand for an operation when it is called inside a container
 */
@FunctionalInterface
public interface StatementFactory {

    List<? extends Statement> create();
}
