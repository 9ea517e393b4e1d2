/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.core.Renderable;
import com.vmware.optmodel.core.Variable;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code [keyword ]identifier = expression;}
 */
public class Assignment extends Statement {
    private static final String FIX = "fix";

    @Nullable private final String keyword;
    private final Object identifier;
    private final Object expression;

    /**
     * @param keyword optional leading keyword such as {@code fix}
     * @param identifier the target, a Renderable or the verbatim identifier text
     * @param expression the assigned value
     */
    public Assignment(@Nullable final String keyword, final Object identifier, final Object expression) {
        this.keyword = keyword;
        this.identifier = identifier;
        this.expression = expression;
        operands.add(identifier);
        operands.add(expression);
    }

    /**
     * Equal bounds fix the variable, otherwise each given bound is assigned on its own line
     *
     * @param variable the variable whose bounds change
     * @param lb the new lower bound, null to keep it
     * @param ub the new upper bound, null to keep it
     * @return zero, one or two assignments
     */
    public static List<Assignment> setBounds(final Variable variable, @Nullable final Object lb,
                                             @Nullable final Object ub) {
        if (lb != null && ub != null && sameValue(lb, ub)) {
            return ImmutableList.of(fix(variable, lb));
        }
        final List<Assignment> assignments = new ArrayList<>(2);
        if (lb != null) {
            assignments.add(new Assignment(null, variable.getName() + ".lb", lb));
        }
        if (ub != null) {
            assignments.add(new Assignment(null, variable.getName() + ".ub", ub));
        }
        return assignments;
    }

    public static Assignment setValue(final Renderable target, final Object value) {
        return new Assignment(null, target, value);
    }

    public static Assignment fix(final Renderable target, final Object value) {
        return new Assignment(FIX, target, value);
    }

    private static boolean sameValue(final Object left, final Object right) {
        if (left instanceof Number && right instanceof Number) {
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        return Objects.equals(left, right);
    }

    @Nullable
    public String getKeyword() {
        return keyword;
    }

    public Object getIdentifier() {
        return identifier;
    }

    public Object getExpression() {
        return expression;
    }

    @Override
    public String definition() {
        final String target = OptmodelString.render(identifier) + " = " + OptmodelString.render(expression) + ";";
        return keyword == null ? target : keyword + " " + target;
    }
}
