/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.core.Expressions;
import com.vmware.optmodel.core.Sense;

import java.util.Locale;

/**
 * Declares an objective from inside a program: {@code MIN total = x + y;}
 */
public class ObjectiveStatement extends Statement {
    private final Expression expression;
    private final String name;
    private final Sense sense;

    public ObjectiveStatement(final Object expression, final String name, final Sense sense) {
        this.expression = Expressions.of(expression);
        this.name = name;
        this.sense = sense;
        operands.add(this.expression);
    }

    public String getName() {
        return name;
    }

    public Sense getSense() {
        return sense;
    }

    @Override
    public String definition() {
        return sense.keyword().toUpperCase(Locale.US) + " " + name + " = " + expression.expr() + ";";
    }
}
