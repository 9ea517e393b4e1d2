/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.symbolic;

import com.vmware.optmodel.EvaluationException;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.core.Expression;

import java.util.List;

/**
 * A reference {@code name[key]} to one element of an indexed symbol that only the solver evaluates
 */
public class IndexedReference extends Expression {
    private final boolean linear;

    IndexedReference(final String base, final List<Object> key, final boolean linear) {
        this.name = OptmodelString.bracketName(base, key);
        this.isAbstract = true;
        this.linear = linear;
        referenceSelf();
    }

    @Override
    public String expr() {
        return name;
    }

    @Override
    protected boolean isAtomic() {
        return true;
    }

    @Override
    public boolean isLinear() {
        return linear;
    }

    @Override
    public double getValue() {
        throw new EvaluationException("Cannot evaluate " + name + " on the client");
    }
}
