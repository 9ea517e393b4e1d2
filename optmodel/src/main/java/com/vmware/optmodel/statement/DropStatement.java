/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.google.common.base.Preconditions;
import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.core.ConstraintGroup;
import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.core.Variable;
import com.vmware.optmodel.core.VariableGroup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@code drop c d[1];}. Groups expand to the names of their members, symbolic members with their loop
 * header, as in {@code drop {TEMP1 in S} d[TEMP1];}.
 */
public class DropStatement extends Statement {
    private final String keyword;

    public DropStatement(final Object... targets) {
        this("drop", targets);
    }

    protected DropStatement(final String keyword, final Object... targets) {
        Preconditions.checkArgument(targets.length > 0, "Nothing to %s", keyword);
        this.keyword = keyword;
        operands.addAll(Arrays.asList(targets));
    }

    /**
     * @return the names that identify a target in a drop or restore list
     */
    static List<String> nameList(final Object target) {
        if (target instanceof ConstraintGroup) {
            return ((ConstraintGroup) target).getNameList();
        }
        if (target instanceof VariableGroup) {
            final VariableGroup group = (VariableGroup) target;
            if (group.isAbstract()) {
                return List.of(group.getName());
            }
            final List<String> names = new ArrayList<>();
            for (final Variable member : group.getMembers()) {
                names.add(member.getName());
            }
            return names;
        }
        if (target instanceof Expression && ((Expression) target).getName() != null) {
            return List.of(((Expression) target).getName());
        }
        if (target instanceof String) {
            return List.of((String) target);
        }
        throw new ModelException("Cannot drop or restore " + target);
    }

    @Override
    public String definition() {
        final List<String> names = new ArrayList<>();
        for (final Object target : operands) {
            names.addAll(nameList(target));
        }
        return keyword + " " + String.join(" ", names) + ";";
    }
}
