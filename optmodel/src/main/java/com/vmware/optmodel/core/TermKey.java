/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identifies one member of an {@link Expression}. Two terms with equal keys are merged by adding their
 * coefficients, so the key of a product is the sorted multiset of its factor names.
 */
public final class TermKey {
    public static final TermKey CONST = new TermKey(Kind.CONST, ImmutableList.of(), null);

    private enum Kind {
        CONST,
        SINGLE,
        PRODUCT,
        OPERATION
    }

    private final Kind kind;
    private final List<String> names;
    @Nullable private final TermOperator operator;

    private TermKey(final Kind kind, final List<String> names, @Nullable final TermOperator operator) {
        this.kind = kind;
        this.names = names;
        this.operator = operator;
    }

    public static TermKey of(final String name) {
        return new TermKey(Kind.SINGLE, ImmutableList.of(name), null);
    }

    public static TermKey product(final TermKey left, final TermKey right) {
        Preconditions.checkArgument(left.isFactor() && right.isFactor(),
                                    "Only named factors can form a product key: %s, %s", left, right);
        final List<String> factors = new ArrayList<>(left.names);
        factors.addAll(right.names);
        Collections.sort(factors);
        return new TermKey(Kind.PRODUCT, ImmutableList.copyOf(factors), null);
    }

    public static TermKey operation(final String left, final String right, final TermOperator operator) {
        return new TermKey(Kind.OPERATION, ImmutableList.of(left, right), operator);
    }

    public boolean isConstant() {
        return kind == Kind.CONST;
    }

    public List<String> names() {
        return names;
    }

    private boolean isFactor() {
        return kind == Kind.SINGLE || kind == Kind.PRODUCT;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TermKey termKey = (TermKey) o;
        return kind == termKey.kind && names.equals(termKey.names) && operator == termKey.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, names, operator);
    }

    @Override
    public String toString() {
        switch (kind) {
            case CONST:
                return "CONST";
            case OPERATION:
                return names.get(0) + operator.token() + names.get(1);
            default:
                return String.join("*", names);
        }
    }
}
