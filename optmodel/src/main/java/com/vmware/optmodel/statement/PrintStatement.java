/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.google.common.base.Preconditions;
import com.vmware.optmodel.codegen.OptmodelString;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * {@code print a b;}
 */
public class PrintStatement extends Statement {

    public PrintStatement(final Object... items) {
        Preconditions.checkArgument(items.length > 0, "Nothing to print");
        operands.addAll(Arrays.asList(items));
    }

    @Override
    public String definition() {
        return "print " + operands.stream().map(OptmodelString::render).collect(Collectors.joining(" ")) + ";";
    }
}
