/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.vmware.optmodel.Config;
import com.vmware.optmodel.EvaluationException;
import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.Registry;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.container.Containable;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.container.Invocation;
import com.vmware.optmodel.statement.Assignment;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A decision variable. Its only member is itself with coefficient 1, so it takes part in arithmetic like
 * any other {@link Expression}.
 */
public class Variable extends Expression implements Declarable {
    private final VariableType type;
    private final Set<Constraint> constraints = new LinkedHashSet<>();
    @Nullable private final VariableGroup parent;
    @Nullable private final List<Object> key;
    private Object lb;
    private Object ub;
    @Nullable private Object init;
    @Nullable private Double value;

    public Variable(@Nullable final String name) {
        this(name, VariableType.CONT, null, null, null);
    }

    public Variable(@Nullable final String name, final VariableType type, @Nullable final Object lb,
                    @Nullable final Object ub, @Nullable final Object init) {
        this(name, type, lb, ub, init, false);
        Containers.record(this);
    }

    private Variable(@Nullable final String name, final VariableType type, @Nullable final Object lb,
                     @Nullable final Object ub, @Nullable final Object init, final boolean isAbstract) {
        this.type = type;
        this.parent = null;
        this.key = null;
        this.isAbstract = isAbstract;
        register(name);
        referenceSelf();
        this.lb = lowerBound(type, lb);
        this.ub = upperBound(type, ub);
        setInit(init);
    }

    /**
     * Member of a variable group. The member is registered under its indexed name but is declared by its
     * group.
     */
    Variable(final VariableGroup parent, final List<Object> key, final VariableType type,
             @Nullable final Object lb, @Nullable final Object ub, @Nullable final Object init) {
        this.type = type;
        this.parent = parent;
        this.key = key;
        register(OptmodelString.bracketName(parent.getName(), key));
        referenceSelf();
        this.lb = lowerBound(type, lb);
        this.ub = upperBound(type, ub);
        setInit(init);
    }

    /**
     * Unregistered reference to a group member, see {@link ShadowVariable}
     */
    Variable(final VariableGroup parent, final List<Object> key, final boolean isAbstract) {
        this.type = parent.getType();
        this.parent = parent;
        this.key = key;
        this.isAbstract = isAbstract;
        this.name = OptmodelString.bracketName(parent.getName(), key);
        referenceSelf();
        this.lb = lowerBound(type, null);
        this.ub = upperBound(type, null);
    }

    public VariableType getType() {
        return type;
    }

    public Object getLb() {
        return lb;
    }

    public Object getUb() {
        return ub;
    }

    @Nullable
    public Object getInit() {
        return init;
    }

    @Nullable
    public VariableGroup getParent() {
        return parent;
    }

    @Nullable
    public List<Object> getKey() {
        return key;
    }

    /**
     * Changes the bounds of this variable. Inside a container the change is recorded as assignments
     * instead. Constraints that reference the variable are not revalidated.
     *
     * @param newLb new lower bound, null to keep the current one
     * @param newUb new upper bound, null to keep the current one
     */
    public Invocation<Void> setBounds(@Nullable final Object newLb, @Nullable final Object newUb) {
        return Containable.invoke("setBounds", () -> {
            if (newLb != null) {
                this.lb = lowerBound(type, newLb);
            }
            if (newUb != null) {
                this.ub = upperBound(type, newUb);
            }
            return null;
        }, () -> Assignment.setBounds(this, newLb, newUb));
    }

    public final void setInit(@Nullable final Object init) {
        this.init = init;
        if (init instanceof Number) {
            this.value = ((Number) init).doubleValue();
        }
    }

    /**
     * Sets the value of this variable, or records the assignment when a container is active
     */
    public Invocation<Void> setValue(final Object newValue) {
        return Containable.invoke("setValue", () -> {
            if (!(newValue instanceof Number)) {
                throw new ModelException("Value of " + name + " must be a number: " + newValue);
            }
            this.value = ((Number) newValue).doubleValue();
            return null;
        }, () -> List.of(Assignment.setValue(this, newValue)));
    }

    /**
     * @return true if a solution or an initial value has been stored
     */
    public boolean hasValue() {
        return value != null;
    }

    @Override
    public double getValue() {
        if (isAbstract) {
            throw new EvaluationException("Cannot evaluate the abstract variable " + name);
        }
        if (value == null) {
            throw new EvaluationException("Variable " + name + " has no value");
        }
        return value;
    }

    public void clearValue() {
        value = null;
        dual = null;
    }

    void tagConstraint(final Constraint constraint) {
        constraints.add(constraint);
    }

    /**
     * @return the named constraints that referenced this variable when they were created
     */
    public Set<Constraint> getConstraints() {
        return Collections.unmodifiableSet(constraints);
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

    @Nullable
    @Override
    public String definition() {
        if (parent != null) {
            return null;
        }
        final StringBuilder sb = new StringBuilder("var ").append(name);
        if (type != VariableType.CONT) {
            sb.append(' ').append(type.keyword());
        }
        sb.append(boundClauses(type, lb, ub));
        if (init != null) {
            sb.append(" init ").append(OptmodelString.toSasString(init));
        }
        return sb.append(';').toString();
    }

    /**
     * Renders the {@code >= lb} and {@code <= ub} clauses, leaving out the bounds the solver assumes anyway
     */
    static String boundClauses(final VariableType type, @Nullable final Object lb, @Nullable final Object ub) {
        final StringBuilder sb = new StringBuilder();
        if (lb != null && !isImplicitBound(type, lb, Double.NEGATIVE_INFINITY, 0)) {
            sb.append(" >= ").append(OptmodelString.toSasString(lb));
        }
        if (ub != null && !isImplicitBound(type, ub, Double.POSITIVE_INFINITY, 1)) {
            sb.append(" <= ").append(OptmodelString.toSasString(ub));
        }
        return sb.toString();
    }

    private static boolean isImplicitBound(final VariableType type, final Object bound, final double infinite,
                                           final double binary) {
        if (!(bound instanceof Number)) {
            return false;
        }
        final double value = ((Number) bound).doubleValue();
        return value == infinite || (type == VariableType.BIN && value == binary);
    }

    static Object lowerBound(final VariableType type, @Nullable final Object lb) {
        final Config config = Registry.current().config();
        if (lb == null) {
            return config.defaultLowerBound(type);
        }
        if (type == VariableType.BIN && lb instanceof Number) {
            return Math.max(((Number) lb).doubleValue(), 0);
        }
        return lb;
    }

    static Object upperBound(final VariableType type, @Nullable final Object ub) {
        final Config config = Registry.current().config();
        if (ub == null) {
            return config.defaultUpperBound(type);
        }
        if (type == VariableType.BIN && ub instanceof Number) {
            return Math.min(((Number) ub).doubleValue(), 1);
        }
        return ub;
    }

    /**
     * Builder for variables with non-default type, bounds or initial value
     */
    public static class Builder {
        @Nullable private final String name;
        private VariableType type = VariableType.CONT;
        @Nullable private Object lb = null;
        @Nullable private Object ub = null;
        @Nullable private Object init = null;
        private boolean isAbstract = false;

        public Builder(@Nullable final String name) {
            this.name = name;
        }

        public Builder setType(final VariableType type) {
            this.type = type;
            return this;
        }

        public Builder setLb(@Nullable final Object lb) {
            this.lb = lb;
            return this;
        }

        public Builder setUb(@Nullable final Object ub) {
            this.ub = ub;
            return this;
        }

        public Builder setInit(@Nullable final Object init) {
            this.init = init;
            return this;
        }

        /**
         * Marks the variable as symbolic. Abstract variables cannot be evaluated.
         */
        public Builder setAbstract(final boolean isAbstract) {
            this.isAbstract = isAbstract;
            return this;
        }

        public Variable build() {
            final Variable variable = new Variable(name, type, lb, ub, init, isAbstract);
            Containers.record(variable);
            return variable;
        }
    }
}
