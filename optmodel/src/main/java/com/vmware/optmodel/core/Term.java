/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;

/**
 * One member of an {@link Expression}: a coefficient times a constant, a single reference, a product of
 * references or a binary {@link TermOperator} applied to two references.
 */
public final class Term {
    private final List<Expression> refs;
    private double coef;
    @Nullable private final TermOperator operator;

    Term(final List<Expression> refs, final double coef, @Nullable final TermOperator operator) {
        this.refs = ImmutableList.copyOf(refs);
        this.coef = coef;
        this.operator = operator;
    }

    static Term constant(final double value) {
        return new Term(ImmutableList.of(), value, null);
    }

    static Term single(final Expression ref, final double coef) {
        return new Term(ImmutableList.of(ref), coef, null);
    }

    public List<Expression> getRefs() {
        return refs;
    }

    public double getCoef() {
        return coef;
    }

    void setCoef(final double coef) {
        this.coef = coef;
    }

    @Nullable
    public TermOperator getOperator() {
        return operator;
    }

    public boolean isConstant() {
        return refs.isEmpty();
    }

    public boolean isProduct() {
        return operator == null && refs.size() > 1;
    }

    Term scaled(final double factor) {
        return new Term(refs, coef * factor, operator);
    }

    /**
     * @return the value of the term without its coefficient
     */
    double evaluate() {
        if (isConstant()) {
            return 1;
        }
        if (operator != null) {
            return operator.apply(refs.get(0).getValue(), refs.get(1).getValue());
        }
        double product = 1;
        for (final Expression ref : refs) {
            product *= ref.getValue();
        }
        return product;
    }

    @Override
    public String toString() {
        return "Term{" +
                "refs=" + refs +
                ", coef=" + coef +
                ", operator=" + operator +
                '}';
    }
}
