/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.symbolic;

import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.core.Renderable;

/**
 * A logical condition such as {@code i ne 'a'} or {@code (r < 5) or (r > 10)}, used in loop filters and
 * conditional statements
 */
public class Condition implements Renderable {
    private static final String AND = "and";
    private static final String OR = "or";

    private final Object left;
    private final String type;
    private final Object right;

    /**
     * @param left the left operand
     * @param type the operator, for instance {@code <}, {@code ne} or {@code in}
     * @param right the right operand
     */
    public Condition(final Object left, final String type, final Object right) {
        this.left = left;
        this.type = type;
        this.right = right;
    }

    public Condition and(final Object other) {
        return new Condition(this, AND, other);
    }

    public Condition or(final Object other) {
        return new Condition(this, OR, other);
    }

    public String getType() {
        return type;
    }

    @Override
    public String expr() {
        final String l = OptmodelString.toSasString(left);
        final String r = OptmodelString.toSasString(right);
        if (AND.equals(type) || OR.equals(type)) {
            return "(" + l + ") " + type + " (" + r + ")";
        }
        return l + " " + type + " " + r;
    }

    @Override
    public String toString() {
        return expr();
    }
}
