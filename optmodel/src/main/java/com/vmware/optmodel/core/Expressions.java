/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.base.Preconditions;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.symbolic.SetIterator;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Static helpers to build expressions
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * @param value a Number or an Expression
     * @return the value as an expression, which is the argument itself for expressions
     */
    public static Expression of(final Object value) {
        return Expression.operand(value, "conversion");
    }

    /**
     * Adds up the items with a single in-place accumulator
     *
     * @param items Numbers and Expressions
     */
    public static Expression sum(final Iterable<?> items) {
        final Expression result = Expression.temporary();
        for (final Object item : items) {
            result.add(item);
        }
        result.temporary = false;
        return result;
    }

    /**
     * Builds the symbolic sum of a body over iterators, rendered as {@code sum {i in I} (body)}
     */
    public static Expression sum(final Expression body, final SetIterator... iterators) {
        return sum(body, Arrays.asList(iterators));
    }

    public static Expression sum(final Expression body, final List<SetIterator> iterators) {
        Preconditions.checkArgument(!iterators.isEmpty(), "A symbolic sum needs at least one iterator");
        final Expression inner = body.getOperator() == null ? body.copy() : Expression.wrap(body);
        inner.operator = MathFunction.SUM;
        inner.iterkey.addAll(iterators);
        inner.isAbstract = true;
        return Expression.wrap(inner);
    }

    /**
     * Sums a body over a domain through a fresh iterator
     *
     * @param domain a ModelSet, a range or a list of values
     * @param body builds the summand from the iterator
     */
    public static Expression sum(final Object domain, final Function<SetIterator, Object> body) {
        final SetIterator iterator = SetIterator.over(domain);
        return sum(of(body.apply(iterator)), iterator);
    }

    /**
     * @return the text of a Number, Renderable or verbatim string
     */
    public static String toExpression(@Nullable final Object value) {
        return OptmodelString.render(value);
    }
}
