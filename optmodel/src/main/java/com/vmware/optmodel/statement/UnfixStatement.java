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
 * {@code unfix x y;}
 */
public class UnfixStatement extends Statement {

    public UnfixStatement(final Object... targets) {
        Preconditions.checkArgument(targets.length > 0, "Nothing to unfix");
        operands.addAll(Arrays.asList(targets));
    }

    @Override
    public String definition() {
        return "unfix " + operands.stream().map(OptmodelString::render).collect(Collectors.joining(" ")) + ";";
    }
}
