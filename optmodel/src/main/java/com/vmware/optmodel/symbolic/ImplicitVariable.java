/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.symbolic;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.EvaluationException;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.core.Declarable;
import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.core.Expressions;
import com.vmware.optmodel.core.Keys;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * A named expression that the solver substitutes wherever it is referenced, declared as
 * {@code impvar total = x + y;} or, when indexed, {@code impvar total {TEMP1 in S} = ...;}
 */
public class ImplicitVariable extends Expression implements Declarable {
    private final Expression expression;
    private final List<SetIterator> iterators;
    private final Map<List<Object>, IndexedReference> references = new LinkedHashMap<>();

    public ImplicitVariable(final String name, final Object expression) {
        this.expression = Expressions.of(expression);
        this.iterators = ImmutableList.of();
        this.isAbstract = this.expression.isAbstract();
        register(name);
        referenceSelf();
        Containers.record(this);
    }

    /**
     * @param name requested name
     * @param generator builds the expression from one iterator per domain
     * @param domains the sets, ranges or lists indexing the variable
     */
    public ImplicitVariable(final String name, final Function<List<SetIterator>, Object> generator,
                            final Object... domains) {
        Preconditions.checkArgument(domains.length > 0, "An indexed implicit variable needs a domain");
        final List<SetIterator> its = new ArrayList<>();
        for (final Object domain : domains) {
            its.add(SetIterator.over(domain));
        }
        this.iterators = ImmutableList.copyOf(its);
        this.expression = Expressions.of(generator.apply(iterators));
        this.isAbstract = true;
        register(name);
        referenceSelf();
        Containers.record(this);
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean isIndexed() {
        return !iterators.isEmpty();
    }

    /**
     * @return the reference {@code name[key]} to one element of an indexed implicit variable
     */
    public Expression get(final Object... key) {
        Preconditions.checkState(isIndexed(), "%s is not indexed", name);
        final List<Object> normalized = ImmutableList.copyOf(Keys.of(key));
        Preconditions.checkArgument(normalized.size() == iterators.size(),
                                    "%s has %s dimensions", name, iterators.size());
        return references.computeIfAbsent(normalized,
                                          k -> new IndexedReference(name, k, expression.isLinear()));
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
        return expression.isLinear();
    }

    @Override
    public double getValue() {
        if (isIndexed()) {
            throw new EvaluationException("Cannot evaluate the indexed implicit variable " + name);
        }
        return expression.getValue();
    }

    @Override
    public String definition() {
        final StringBuilder sb = new StringBuilder("impvar ").append(name);
        if (isIndexed()) {
            sb.append(' ').append(OptmodelString.loopHeader(iterators));
        }
        return sb.append(" = ").append(expression.expr()).append(';').toString();
    }
}
