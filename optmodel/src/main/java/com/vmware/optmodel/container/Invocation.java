/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.container;

import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.statement.Statement;

import javax.annotation.Nullable;
import java.util.List;

/**
 * The outcome of a containable operation: either the value computed right away, or the statements that
 * were recorded into the active container instead.
 *
 * @param <T> type of the immediate result
 */
public final class Invocation<T> {
    @Nullable private final T result;
    private final List<Statement> statements;
    private final boolean recorded;

    private Invocation(@Nullable final T result, final List<Statement> statements, final boolean recorded) {
        this.result = result;
        this.statements = statements;
        this.recorded = recorded;
    }

    public static <T> Invocation<T> immediate(@Nullable final T result) {
        return new Invocation<>(result, ImmutableList.of(), false);
    }

    public static <T> Invocation<T> recorded(final List<? extends Statement> statements) {
        return new Invocation<>(null, ImmutableList.copyOf(statements), true);
    }

    public boolean isRecorded() {
        return recorded;
    }

    /**
     * @return the immediate result, which may be null for operations without one
     */
    @Nullable
    public T result() {
        if (recorded) {
            throw new ModelException("Operation was recorded as a statement and has no immediate result");
        }
        return result;
    }

    public List<Statement> statements() {
        return statements;
    }

    @Override
    public String toString() {
        return recorded ? "Invocation{statements=" + statements + '}' : "Invocation{result=" + result + '}';
    }
}
