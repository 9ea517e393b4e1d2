/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.vmware.optmodel.core.Renderable;

/**
 * {@code use problem m;}
 */
public class UseProblemStatement extends Statement {
    private final Renderable problem;

    public UseProblemStatement(final Renderable problem) {
        this.problem = problem;
        operands.add(problem);
    }

    @Override
    public String definition() {
        return "use problem " + problem.expr() + ";";
    }
}
