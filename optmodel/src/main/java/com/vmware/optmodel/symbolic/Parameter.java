/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.symbolic;

import com.vmware.optmodel.EvaluationException;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.container.Containable;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.container.Invocation;
import com.vmware.optmodel.core.Declarable;
import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.statement.Assignment;

import javax.annotation.Nullable;
import java.util.List;

/**
 * A named numeric or string parameter, declared as {@code num p = 4;} or {@code num p init 2;}. Its value
 * belongs to the solver, so a parameter is always abstract.
 */
public class Parameter extends Expression implements Declarable {
    private final DataType type;
    @Nullable private final ParameterGroup parent;
    @Nullable private final List<Object> key;
    @Nullable private Object init;
    @Nullable private Object value;

    public Parameter(final String name) {
        this(name, DataType.NUM, null, null);
    }

    /**
     * @param name requested name
     * @param type numeric or string
     * @param init initial value, which the program may change
     * @param value fixed value
     */
    public Parameter(final String name, final DataType type, @Nullable final Object init,
                     @Nullable final Object value) {
        this.type = type;
        this.parent = null;
        this.key = null;
        this.init = init;
        this.value = value;
        this.isAbstract = true;
        register(name);
        referenceSelf();
        Containers.record(this);
    }

    Parameter(final ParameterGroup parent, final List<Object> key) {
        this.type = parent.getType();
        this.parent = parent;
        this.key = key;
        this.isAbstract = true;
        this.name = OptmodelString.bracketName(parent.getName(), key);
        referenceSelf();
    }

    public DataType getType() {
        return type;
    }

    @Nullable
    public ParameterGroup getParent() {
        return parent;
    }

    @Nullable
    public List<Object> getKey() {
        return key;
    }

    @Nullable
    public Object getInit() {
        return init;
    }

    public void setInit(@Nullable final Object init) {
        this.init = init;
    }

    /**
     * Fixes the value of this parameter, or records the assignment when a container is active
     */
    public Invocation<Void> setValue(final Object newValue) {
        return Containable.invoke("setValue", () -> {
            this.value = newValue;
            return null;
        }, () -> List.of(Assignment.setValue(this, newValue)));
    }

    /**
     * @return the fixed or initial value known on the client
     * @throws EvaluationException if the value is not a number known on the client
     */
    @Override
    public double getValue() {
        final Object known = value != null ? value : init;
        if (known instanceof Number) {
            return ((Number) known).doubleValue();
        }
        throw new EvaluationException("Parameter " + name + " has no numeric value on the client");
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
        return true;
    }

    static String renderValue(final DataType type, final Object value) {
        if (type == DataType.STR && value instanceof String) {
            return OptmodelString.quoted(value);
        }
        return OptmodelString.render(value);
    }

    @Nullable
    @Override
    public String definition() {
        if (parent != null) {
            return null;
        }
        final StringBuilder sb = new StringBuilder(type.keyword()).append(' ').append(name);
        if (init != null) {
            sb.append(" init ").append(renderValue(type, init));
        } else if (value != null) {
            sb.append(" = ").append(renderValue(type, value));
        }
        return sb.append(';').toString();
    }
}
