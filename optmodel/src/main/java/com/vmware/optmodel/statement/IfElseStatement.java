/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.core.Renderable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A conditional block made of an {@code if} case, any number of {@code else if} cases and an optional
 * {@code else} case. Each body runs once, while its case is the active container.
 */
public class IfElseStatement extends Statement {
    private final List<Case> cases;

    private IfElseStatement(final List<Case> cases) {
        this.cases = ImmutableList.copyOf(cases);
        operands.addAll(cases);
    }

    public List<Case> getCases() {
        return cases;
    }

    @Override
    public String definition() {
        return cases.stream().map(Case::definition).collect(Collectors.joining("\n"));
    }

    /**
     * Collects the cases in order. Conditions are {@code Condition}s or constraints used as logical tests.
     */
    public static class Builder {
        private final List<Renderable> conditions = new ArrayList<>();
        private final List<Runnable> bodies = new ArrayList<>();
        private boolean closed = false;

        public Builder when(final Renderable condition, final Runnable body) {
            Preconditions.checkState(!closed, "No case can follow the else case");
            conditions.add(condition);
            bodies.add(body);
            return this;
        }

        public Builder otherwise(final Runnable body) {
            Preconditions.checkState(!closed, "There is already an else case");
            Preconditions.checkState(!bodies.isEmpty(), "The else case needs a preceding condition");
            closed = true;
            bodies.add(body);
            return this;
        }

        /**
         * Runs every body into its case
         */
        public IfElseStatement build() {
            Preconditions.checkState(!bodies.isEmpty(), "A conditional needs at least one case");
            final List<Case> cases = new ArrayList<>();
            for (int i = 0; i < bodies.size(); i++) {
                final Case branch;
                if (i >= conditions.size()) {
                    branch = new Case("else", null);
                } else {
                    branch = new Case(i == 0 ? "if" : "else if", conditions.get(i));
                }
                branch.run(bodies.get(i));
                cases.add(branch);
            }
            return new IfElseStatement(cases);
        }
    }
}
