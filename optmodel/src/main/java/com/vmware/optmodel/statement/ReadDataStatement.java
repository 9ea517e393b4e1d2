/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.codegen.OptmodelString;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code read data <table> into [target=][[key]] <bindings>;}
 */
public class ReadDataStatement extends Statement {
    private final Object table;
    @Nullable private final Object target;
    private final List<Object> key;
    private final List<DataColumn> columns;

    private ReadDataStatement(final Builder builder) {
        this.table = builder.table;
        this.target = builder.target;
        this.key = ImmutableList.copyOf(builder.key);
        this.columns = ImmutableList.copyOf(builder.columns);
        operands.add(table);
        operands.addAll(columns);
    }

    public List<DataColumn> getColumns() {
        return columns;
    }

    private String indexExpr() {
        final StringBuilder sb = new StringBuilder();
        if (target != null) {
            sb.append(OptmodelString.render(target));
        }
        if (target != null && !key.isEmpty()) {
            sb.append('=');
        }
        if (!key.isEmpty()) {
            sb.append('[')
              .append(key.stream().map(OptmodelString::render).collect(Collectors.joining(" ")))
              .append(']');
        }
        return sb.toString();
    }

    @Override
    public String definition() {
        final StringBuilder sb = new StringBuilder("read data ").append(OptmodelString.render(table))
                .append(" into");
        final String index = indexExpr();
        if (!index.isEmpty()) {
            sb.append(' ').append(index);
        }
        for (final DataColumn column : columns) {
            sb.append(' ').append(column.readBinding());
        }
        return sb.append(';').toString();
    }

    public static class Builder {
        private final Object table;
        @Nullable private Object target = null;
        private final List<Object> key = new ArrayList<>();
        private final List<DataColumn> columns = new ArrayList<>();

        /**
         * @param table the table name, or a Renderable naming it
         */
        public Builder(final Object table) {
            this.table = table;
        }

        /**
         * @param target the set that receives the key values
         */
        public Builder setTarget(@Nullable final Object target) {
            this.target = target;
            return this;
        }

        /**
         * @param key the key columns or iterators, written as {@code [a b]}
         */
        public Builder setKey(final Object... key) {
            this.key.clear();
            this.key.addAll(Arrays.asList(key));
            return this;
        }

        public Builder addColumn(final DataColumn column) {
            columns.add(column);
            return this;
        }

        public Builder addColumn(final Object target, @Nullable final Object source) {
            return addColumn(new DataColumn(target, source));
        }

        public ReadDataStatement build() {
            return new ReadDataStatement(this);
        }
    }
}
