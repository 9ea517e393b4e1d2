/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.core.Renderable;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code create data <table> from [[key]] [= {set}] <columns>;}
 */
public class CreateDataStatement extends Statement {
    private final Object table;
    private final List<Object> key;
    @Nullable private final Object set;
    private final List<DataColumn> columns;

    private CreateDataStatement(final Builder builder) {
        this.table = builder.table;
        this.key = ImmutableList.copyOf(builder.key);
        this.set = builder.set;
        this.columns = ImmutableList.copyOf(builder.columns);
        operands.add(table);
        operands.addAll(columns);
    }

    public List<DataColumn> getColumns() {
        return columns;
    }

    private String tableExpr() {
        if (table instanceof Renderable) {
            return "(" + ((Renderable) table).expr() + ")";
        }
        return table.toString();
    }

    private String indexExpr() {
        final StringBuilder sb = new StringBuilder();
        if (!key.isEmpty()) {
            sb.append('[')
              .append(key.stream().map(CreateDataStatement::keyName).collect(Collectors.joining(" ")))
              .append(']');
        }
        if (!key.isEmpty() && set != null) {
            sb.append(" = ");
        }
        if (set != null) {
            sb.append('{').append(OptmodelString.toSasString(set)).append('}');
        }
        return sb.toString();
    }

    private static String keyName(final Object key) {
        if (key instanceof Expression && ((Expression) key).getName() != null) {
            return ((Expression) key).getName();
        }
        return OptmodelString.render(key);
    }

    @Override
    public String definition() {
        final StringBuilder sb = new StringBuilder("create data ").append(tableExpr()).append(" from");
        final String index = indexExpr();
        if (!index.isEmpty()) {
            sb.append(' ').append(index);
        }
        for (final DataColumn column : columns) {
            sb.append(' ').append(column.createBinding());
        }
        return sb.append(';').toString();
    }

    public static class Builder {
        private final Object table;
        private final List<Object> key = new ArrayList<>();
        @Nullable private Object set = null;
        private final List<DataColumn> columns = new ArrayList<>();

        /**
         * @param table the output table name, or a Renderable naming it
         */
        public Builder(final Object table) {
            this.table = table;
        }

        /**
         * @param key names of the key columns, or the iterators that fill them
         */
        public Builder setKey(final Object... key) {
            this.key.clear();
            this.key.addAll(Arrays.asList(key));
            return this;
        }

        /**
         * @param set the set enumerated by the key columns
         */
        public Builder setSet(@Nullable final Object set) {
            this.set = set;
            return this;
        }

        public Builder addColumn(final DataColumn column) {
            columns.add(column);
            return this;
        }

        /**
         * @param name the column name, or a Renderable rendered as {@code col(expr)}
         * @param value the written value, null to write the column of the same name
         */
        public Builder addColumn(final Object name, @Nullable final Object value) {
            return addColumn(new DataColumn(name, value));
        }

        public CreateDataStatement build() {
            return new CreateDataStatement(this);
        }
    }
}
