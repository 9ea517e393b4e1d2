/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Program text passed through as written, for constructs that have no statement of their own
 */
public class LiteralStatement extends Statement {

    public LiteralStatement(final String... lines) {
        operands.addAll(Arrays.asList(lines));
    }

    public void append(final String line) {
        operands.add(line);
    }

    @Override
    public String definition() {
        return operands.stream().map(Object::toString).collect(Collectors.joining("\n"));
    }
}
