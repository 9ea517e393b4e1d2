/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.symbolic;

import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.Registry;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.core.Declarable;
import com.vmware.optmodel.core.Keys;
import com.vmware.optmodel.core.Renderable;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An indexed family of parameters, declared as {@code num A {RN, RN} = 0;}. Members are references such as
 * {@code A[TEMP1,TEMP2]} created on demand.
 */
public class ParameterGroup implements Declarable, Renderable {
    private final String name;
    private final int order;
    private final List<Object> indexSets;
    private final DataType type;
    private final Map<List<Object>, Parameter> members = new LinkedHashMap<>();
    @Nullable private final Object init;
    @Nullable private final Object value;

    public ParameterGroup(final String name, final Object... indexSets) {
        this(name, Arrays.asList(indexSets), DataType.NUM, null, null);
    }

    /**
     * @param name requested name
     * @param indexSets the sets indexing the group
     * @param type numeric or string
     * @param init initial value of every member
     * @param value fixed value of every member
     */
    public ParameterGroup(final String name, final List<?> indexSets, final DataType type,
                          @Nullable final Object init, @Nullable final Object value) {
        final Registry registry = Registry.current();
        this.name = registry.assignName(name);
        this.order = registry.register(this.name, this);
        this.indexSets = ImmutableList.copyOf(indexSets);
        this.type = type;
        this.init = init;
        this.value = value;
        Containers.record(this);
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    /**
     * @return the member reference at a key, usually made of iterators
     */
    public Parameter get(final Object... key) {
        return members.computeIfAbsent(ImmutableList.copyOf(Keys.of(key)), k -> new Parameter(this, k));
    }

    @Override
    public int order() {
        return order;
    }

    @Override
    public String expr() {
        return name;
    }

    @Override
    public String definition() {
        final StringBuilder sb = new StringBuilder(type.keyword()).append(' ').append(name).append(" {")
                .append(indexSets.stream().map(OptmodelString::toSasString).collect(Collectors.joining(", ")))
                .append('}');
        if (init != null) {
            sb.append(" init ").append(Parameter.renderValue(type, init));
        } else if (value != null) {
            sb.append(" = ").append(Parameter.renderValue(type, value));
        }
        return sb.append(';').toString();
    }

    @Override
    public String toString() {
        return name;
    }
}
