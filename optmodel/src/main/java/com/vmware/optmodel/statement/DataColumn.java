/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.core.Keys;
import com.vmware.optmodel.core.Renderable;
import com.vmware.optmodel.symbolic.SetIterator;

import javax.annotation.Nullable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A column binding of a {@code read data} or {@code create data} statement. A binding indexed by
 * iterators is wrapped as {@code {j in S} < target=col(j) >}.
 */
public final class DataColumn {
    @Nullable private final Object target;
    @Nullable private final Object source;
    private final List<Object> index;

    /**
     * @param target the left-hand side, rendered verbatim if it is a String
     * @param source the right-hand side, a column name or a Renderable rendered as {@code col(expr)}
     * @param index iterators the binding ranges over
     */
    public DataColumn(@Nullable final Object target, @Nullable final Object source, final Object... index) {
        this.target = target;
        this.source = source;
        this.index = ImmutableList.copyOf(index);
    }

    @Nullable
    public Object getTarget() {
        return target;
    }

    @Nullable
    public Object getSource() {
        return source;
    }

    public List<Object> getIndex() {
        return index;
    }

    String readBinding() {
        final StringBuilder sb = new StringBuilder();
        if (target != null) {
            sb.append(OptmodelString.render(target));
        }
        if (target != null && source != null) {
            sb.append('=');
        }
        if (source instanceof Renderable) {
            sb.append("col(").append(((Renderable) source).expr()).append(')');
        } else if (source != null) {
            sb.append(source);
        }
        return wrapIndexed(sb.toString());
    }

    /**
     * In a {@code create data} statement the target is the column and the source the written value
     */
    String createBinding() {
        final StringBuilder sb = new StringBuilder();
        final String column;
        if (target instanceof Renderable) {
            column = "col(" + ((Renderable) target).expr() + ")";
        } else {
            column = target == null ? "" : target.toString();
        }
        final String value = source == null ? "" : OptmodelString.render(source);
        sb.append(column);
        if (!column.isEmpty() && !value.isEmpty() && !column.equals(value)) {
            sb.append("=(").append(value).append(')');
        } else if (column.isEmpty()) {
            sb.append(value);
        }
        return wrapIndexed(sb.toString());
    }

    private String wrapIndexed(final String binding) {
        if (!Keys.isAbstract(index)) {
            return binding;
        }
        final String header = index.stream()
                .map(i -> i instanceof SetIterator ? ((SetIterator) i).definition() : OptmodelString.toSasString(i))
                .collect(Collectors.joining(", "));
        return "{" + header + "} < " + binding + " >";
    }
}
