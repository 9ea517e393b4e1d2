/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.symbolic;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.Registry;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.core.Declarable;
import com.vmware.optmodel.core.Renderable;

import javax.annotation.Nullable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A set whose members are known to the solver, declared as {@code set S = {1,2,3};} or read from data
 */
public class ModelSet implements Declarable, Renderable {
    private final String name;
    private final int order;
    private final List<DataType> types;
    @Nullable private final Object init;
    @Nullable private Object value;
    private final boolean declared;

    public ModelSet(final String name) {
        this(name, ImmutableList.of(DataType.NUM), null, null);
    }

    /**
     * @param name requested name
     * @param types element types, more than one for sets of tuples
     * @param init initial members, may be changed by the program
     * @param value fixed members
     */
    public ModelSet(final String name, final List<DataType> types, @Nullable final Object init,
                    @Nullable final Object value) {
        Preconditions.checkArgument(!types.isEmpty(), "A set needs at least one element type");
        final Registry registry = Registry.current();
        this.name = registry.assignName(name);
        this.order = registry.register(this.name, this);
        this.types = ImmutableList.copyOf(types);
        this.init = init;
        this.value = value;
        this.declared = true;
        Containers.record(this);
    }

    private ModelSet(final String expression, final List<DataType> types) {
        this.name = expression;
        this.order = 0;
        this.types = ImmutableList.copyOf(types);
        this.init = null;
        this.value = null;
        this.declared = false;
    }

    /**
     * @return the symbolic range {@code start..stop}, which has no declaration
     */
    public static ModelSet range(final Object start, final Object stop) {
        return new ModelSet(OptmodelString.toSasString(start) + ".." + OptmodelString.toSasString(stop),
                            ImmutableList.of(DataType.NUM));
    }

    public String getName() {
        return name;
    }

    public List<DataType> getTypes() {
        return types;
    }

    @Nullable
    public Object getInit() {
        return init;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    public void setValue(@Nullable final Object value) {
        this.value = value;
    }

    /**
     * @return a new iterator over this set named {@code TEMPn}
     */
    public SetIterator iterator() {
        return new SetIterator(this, null);
    }

    public SetIterator iterator(final String iteratorName) {
        return new SetIterator(this, iteratorName);
    }

    @Override
    public int order() {
        return order;
    }

    @Override
    public String expr() {
        return name;
    }

    @Nullable
    @Override
    public String definition() {
        if (!declared) {
            return null;
        }
        final StringBuilder sb = new StringBuilder("set ");
        if (types.size() != 1 || types.get(0) != DataType.NUM) {
            sb.append('<').append(types.stream().map(DataType::keyword).collect(Collectors.joining(", ")))
              .append("> ");
        }
        sb.append(name);
        if (init != null) {
            sb.append(" init ").append(OptmodelString.toSasString(init));
        } else if (value != null) {
            sb.append(" = ").append(OptmodelString.toSasString(value));
        }
        return sb.append(';').toString();
    }

    @Override
    public String toString() {
        return name;
    }
}
