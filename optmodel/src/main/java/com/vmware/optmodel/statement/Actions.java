/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.container.Container;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.core.Renderable;
import com.vmware.optmodel.core.Sense;
import com.vmware.optmodel.symbolic.SetIterator;

import javax.annotation.Nullable;
import java.util.List;
import java.util.function.Consumer;

/**
 * Program statements that only exist inside a Workspace or a loop. Each method appends its statement to the
 * innermost active container and returns it.
 */
public final class Actions {

    private Actions() {
    }

    private static <T extends Statement> T append(final String operation, final T statement) {
        final Container container = Containers.requireActive(operation);
        container.append(statement);
        return statement;
    }

    public static SolveStatement solve(final SolveOptions options) {
        return append("solve", new SolveStatement(null, options));
    }

    /**
     * Switches to a problem and solves it
     */
    public static SolveStatement solve(final Renderable problem, final SolveOptions options) {
        return append("solve", new SolveStatement(problem, options));
    }

    public static DropStatement drop(final Object... targets) {
        return append("drop", new DropStatement(targets));
    }

    public static RestoreStatement restore(final Object... targets) {
        return append("restore", new RestoreStatement(targets));
    }

    public static Assignment fix(final Renderable target, final Object value) {
        return append("fix", Assignment.fix(target, value));
    }

    public static UnfixStatement unfix(final Object... targets) {
        return append("unfix", new UnfixStatement(targets));
    }

    public static Assignment setValue(final Renderable target, final Object value) {
        return append("setValue", Assignment.setValue(target, value));
    }

    public static ObjectiveStatement setObjective(final Object expression, final String name,
                                                  final Sense sense) {
        return append("setObjective", new ObjectiveStatement(expression, name, sense));
    }

    public static PrintStatement printItem(final Object... items) {
        return append("printItem", new PrintStatement(items));
    }

    /**
     * Records {@code for {TEMPn in domain} do; ... end;}
     *
     * @param domain a ModelSet, a range or a list of values
     * @param body receives the iterator
     */
    public static ForLoopStatement forLoop(final Object domain, final Consumer<SetIterator> body) {
        return loop(false, ImmutableList.of(domain), its -> body.accept(its.get(0)));
    }

    /**
     * Records a loop over the product of several domains, {@code for {TEMP1 in S, TEMP2 in T} do; ... end;}
     */
    public static ForLoopStatement forLoopOver(final List<?> domains, final Consumer<List<SetIterator>> body) {
        return loop(false, domains, body);
    }

    public static ForLoopStatement coforLoop(final Object domain, final Consumer<SetIterator> body) {
        return loop(true, ImmutableList.of(domain), its -> body.accept(its.get(0)));
    }

    public static ForLoopStatement coforLoopOver(final List<?> domains, final Consumer<List<SetIterator>> body) {
        return loop(true, domains, body);
    }

    private static ForLoopStatement loop(final boolean concurrent, final List<?> domains,
                                         final Consumer<List<SetIterator>> body) {
        final ForLoopStatement loop = append(concurrent ? "coforLoop" : "forLoop",
                                             new ForLoopStatement(concurrent, domains));
        return loop.run(body);
    }

    /**
     * Records {@code if cond then do; ... end; else do; ... end;}
     *
     * @param elseBody the else branch, null for none
     */
    public static IfElseStatement ifCondition(final Renderable condition, final Runnable ifBody,
                                              @Nullable final Runnable elseBody) {
        Containers.requireActive("ifCondition");
        final IfElseStatement.Builder builder = new IfElseStatement.Builder().when(condition, ifBody);
        if (elseBody != null) {
            builder.otherwise(elseBody);
        }
        return append("ifCondition", builder.build());
    }

    /**
     * Records an {@code if}, {@code else if}, {@code else} chain
     */
    public static IfElseStatement switchConditions(final IfElseStatement.Builder cases) {
        Containers.requireActive("switchConditions");
        return append("switchConditions", cases.build());
    }

    public static ReadDataStatement readData(final ReadDataStatement.Builder builder) {
        return append("readData", builder.build());
    }

    public static CreateDataStatement createData(final CreateDataStatement.Builder builder) {
        return append("createData", builder.build());
    }

    public static LiteralStatement literal(final String... lines) {
        return append("literal", new LiteralStatement(lines));
    }

    public static UseProblemStatement useProblem(final Renderable problem) {
        return append("useProblem", new UseProblemStatement(problem));
    }
}
