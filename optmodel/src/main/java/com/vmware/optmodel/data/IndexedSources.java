/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.data;

import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.core.Keys;
import org.jooq.Record;
import org.jooq.Result;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapts the supported value containers to {@link IndexedSource}
 */
public final class IndexedSources {
    private static final IndexedSource EMPTY = key -> null;

    private IndexedSources() {
    }

    /**
     * @param values null, a Number or Expression shared by every key, a Map, a List or a jOOQ table
     * @return a source over the values
     * @throws ModelException for any other type
     */
    @SuppressWarnings("unchecked")
    public static IndexedSource of(@Nullable final Object values) {
        if (values == null) {
            return EMPTY;
        }
        if (values instanceof Number || values instanceof Expression) {
            return key -> values;
        }
        if (values instanceof Map) {
            return new MapSource((Map<Object, Object>) values);
        }
        // jOOQ tables are lists of records
        if (values instanceof Result) {
            return new TableSource((Result<Record>) values);
        }
        if (values instanceof List) {
            return new ListSource((List<Object>) values);
        }
        throw new ModelException("Cannot look up values by key in " + values.getClass().getSimpleName());
    }

    /**
     * Looks up the single component of one-dimensional keys, then the whole key. The map's own keys are
     * normalized like group keys, so {@code 1L} and {@code 1.0} both find member {@code [1]}.
     */
    static final class MapSource implements IndexedSource {
        private final Map<Object, Object> values = new HashMap<>();

        MapSource(final Map<Object, Object> values) {
            for (final Map.Entry<Object, Object> entry : values.entrySet()) {
                this.values.put(entry.getKey() == null ? null : Keys.normalize(entry.getKey()), entry.getValue());
            }
        }

        @Nullable
        @Override
        public Object get(final List<Object> key) {
            if (key.size() == 1) {
                final Object value = values.get(key.get(0));
                if (value != null) {
                    return value;
                }
            }
            return values.get(key);
        }
    }

    /**
     * Indexes nested lists by position, one level per key component
     */
    static final class ListSource implements IndexedSource {
        private final List<Object> values;

        ListSource(final List<Object> values) {
            this.values = values;
        }

        @Nullable
        @Override
        public Object get(final List<Object> key) {
            Object current = values;
            for (final Object component : key) {
                if (!(current instanceof List) || !(component instanceof Integer)) {
                    return null;
                }
                final List<?> level = (List<?>) current;
                final int position = (Integer) component;
                if (position < 0 || position >= level.size()) {
                    return null;
                }
                current = level.get(position);
            }
            return current;
        }
    }

    /**
     * Matches the leading fields of each row against the key and returns the field that follows them. Text
     * cells, as read from CSV, are parsed like member names.
     */
    static final class TableSource implements IndexedSource {
        private final Result<Record> table;

        TableSource(final Result<Record> table) {
            this.table = table;
        }

        @Nullable
        @Override
        public Object get(final List<Object> key) {
            if (table.fields().length <= key.size()) {
                return null;
            }
            for (final Record row : table) {
                if (matches(row, key)) {
                    final Object value = row.get(key.size());
                    return value instanceof String ? Keys.parse((String) value).get(0) : value;
                }
            }
            return null;
        }

        private static boolean matches(final Record row, final List<Object> key) {
            for (int i = 0; i < key.size(); i++) {
                final Object cell = row.get(i);
                if (cell == null) {
                    return false;
                }
                final Object normalized = cell instanceof String ? Keys.parse((String) cell).get(0)
                                                                 : Keys.normalize(cell);
                if (!key.get(i).equals(normalized) && !key.get(i).toString().equals(cell.toString())) {
                    return false;
                }
            }
            return true;
        }
    }
}
