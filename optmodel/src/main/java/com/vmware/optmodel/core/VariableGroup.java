/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.vmware.optmodel.ReferenceException;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.container.Containable;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.container.Invocation;
import com.vmware.optmodel.data.IndexedSource;
import com.vmware.optmodel.data.IndexedSources;
import com.vmware.optmodel.symbolic.ModelSet;
import com.vmware.optmodel.symbolic.SetIterator;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An indexed family of variables sharing a name, such as {@code x[i,j]}
 */
public class VariableGroup extends Group<Variable> {
    private final VariableType type;
    @Nullable private Object lb;
    @Nullable private Object ub;
    @Nullable private Object init;

    /**
     * Creates a continuous, unbounded group
     *
     * @param name requested name
     * @param indexArgs one index argument per dimension
     */
    public VariableGroup(final String name, final Object... indexArgs) {
        this(new Builder(name).setIndex(indexArgs));
    }

    private VariableGroup(final Builder builder) {
        super(builder.name, builder.indexArgs);
        this.type = builder.type;
        this.lb = scalar(builder.lb);
        this.ub = scalar(builder.ub);
        this.init = scalar(builder.init);
        if (!isAbstract) {
            final IndexedSource lbs = IndexedSources.of(builder.lb);
            final IndexedSource ubs = IndexedSources.of(builder.ub);
            final IndexedSource inits = IndexedSources.of(builder.init);
            for (final List<Object> key : concreteKeys()) {
                final List<Object> memberKey = ImmutableList.copyOf(key);
                members.put(memberKey, new Variable(this, memberKey, type, lbs.get(memberKey),
                                                    ubs.get(memberKey), inits.get(memberKey)));
            }
        }
        Containers.record(this);
    }

    @Nullable
    private static Object scalar(@Nullable final Object value) {
        return value instanceof Number || value instanceof Expression ? value : null;
    }

    public VariableType getType() {
        return type;
    }

    @Nullable
    public Object getLb() {
        return lb;
    }

    @Nullable
    public Object getUb() {
        return ub;
    }

    @Nullable
    public Object getInit() {
        return init;
    }

    @Override
    protected Variable createShadow(final List<Object> key) {
        return new ShadowVariable(this, key);
    }

    /**
     * Changes the bounds of the group and of every member. This has no statement form.
     */
    public Invocation<Void> setBounds(@Nullable final Object newLb, @Nullable final Object newUb) {
        return Containable.invoke("VariableGroup.setBounds", () -> {
            if (newLb != null) {
                this.lb = scalar(newLb);
            }
            if (newUb != null) {
                this.ub = scalar(newUb);
            }
            final IndexedSource lbs = IndexedSources.of(newLb);
            final IndexedSource ubs = IndexedSources.of(newUb);
            for (final Map.Entry<List<Object>, Variable> entry : members.entrySet()) {
                entry.getValue().setBounds(lbs.get(entry.getKey()), ubs.get(entry.getKey()));
            }
            return null;
        }, null);
    }

    public void setInit(@Nullable final Object newInit) {
        this.init = scalar(newInit);
        final IndexedSource inits = IndexedSources.of(newInit);
        for (final Map.Entry<List<Object>, Variable> entry : members.entrySet()) {
            entry.getValue().setInit(inits.get(entry.getKey()));
        }
    }

    /**
     * Sums the members selected by a filter. Wildcards over symbolic dimensions become iterators of a
     * symbolic {@code sum {..} (..)}, every other component is expanded into concrete terms.
     *
     * @param filter one component per dimension: a value, {@code "*"} or a collection of values
     */
    public Expression sum(final Object... filter) {
        Preconditions.checkArgument(filter.length == dimensions.size(),
                                    "Group %s has %s dimensions but the filter has %s components",
                                    name, dimensions.size(), filter.length);
        final List<Object> normalized = Keys.normalizeAll(Arrays.asList(filter));
        if (!isAbstract && !Keys.isAbstract(normalized)) {
            final Expression result = Expression.temporary();
            for (final Map.Entry<List<Object>, Variable> entry : members.entrySet()) {
                if (matches(entry.getKey(), normalized)) {
                    result.add(entry.getValue());
                }
            }
            result.temporary = false;
            return result;
        }
        final List<SetIterator> iterators = new ArrayList<>();
        final List<List<Object>> choices = new ArrayList<>();
        for (int i = 0; i < dimensions.size(); i++) {
            final Object dim = dimensions.get(i);
            final Object component = normalized.get(i);
            if (Keys.WILDCARD.equals(component) && dim instanceof ModelSet) {
                final SetIterator iterator = ((ModelSet) dim).iterator();
                iterators.add(iterator);
                choices.add(ImmutableList.of(iterator));
            } else if (Keys.WILDCARD.equals(component)) {
                choices.add(valuesOf(dim));
            } else if (component instanceof Collection) {
                choices.add(ImmutableList.copyOf((Collection<?>) component));
            } else {
                choices.add(ImmutableList.of(component));
            }
        }
        final Expression body = Expression.temporary();
        for (final List<Object> key : Lists.cartesianProduct(choices)) {
            body.add(get(key.toArray()));
        }
        body.temporary = false;
        return iterators.isEmpty() ? body : Expressions.sum(body, iterators);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> valuesOf(final Object dim) {
        return (List<Object>) dim;
    }

    /**
     * Multiplies every member by the matching value of a source and sums the products
     *
     * @param source a Map, List or jOOQ table keyed like this group
     * @throws ReferenceException if the source has no value for a member
     */
    public Expression mult(final Object source) {
        final IndexedSource values = IndexedSources.of(source);
        final Expression result = Expression.temporary();
        for (final Map.Entry<List<Object>, Variable> entry : members.entrySet()) {
            final Object value = values.get(entry.getKey());
            if (value == null) {
                throw new ReferenceException(
                        String.format("No value for %s in %s", entry.getValue().getName(), source));
            }
            result.add(entry.getValue().mult(value));
        }
        result.temporary = false;
        return result;
    }

    @Override
    public String definition() {
        final StringBuilder sb = new StringBuilder("var ").append(name).append(' ').append(indexSets());
        if (type != VariableType.CONT) {
            sb.append(' ').append(type.keyword());
        }
        sb.append(Variable.boundClauses(type, lb, ub));
        if (init != null) {
            sb.append(" init ").append(OptmodelString.toSasString(init));
        }
        sb.append(';');
        final Object groupLb = Variable.lowerBound(type, lb);
        final Object groupUb = Variable.upperBound(type, ub);
        for (final Variable member : members.values()) {
            if (!sameValue(member.getLb(), groupLb)) {
                sb.append('\n').append(member.getName()).append(".lb = ")
                  .append(OptmodelString.toSasString(member.getLb())).append(';');
            }
            if (!sameValue(member.getUb(), groupUb)) {
                sb.append('\n').append(member.getName()).append(".ub = ")
                  .append(OptmodelString.toSasString(member.getUb())).append(';');
            }
            if (member.getInit() != null && !sameValue(member.getInit(), init)) {
                sb.append('\n').append(member.getName()).append(" = ")
                  .append(OptmodelString.toSasString(member.getInit())).append(';');
            }
        }
        return sb.toString();
    }

    private static boolean sameValue(@Nullable final Object left, @Nullable final Object right) {
        if (left instanceof Number && right instanceof Number) {
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        return Objects.equals(left, right);
    }

    /**
     * Builder for groups with a non-default type, bounds or initial values. Bounds and initial values are
     * a Number or Expression shared by every member, or a Map, List or jOOQ table giving one value per key.
     */
    public static class Builder {
        private final String name;
        private final List<Object> indexArgs = new ArrayList<>();
        private VariableType type = VariableType.CONT;
        @Nullable private Object lb = null;
        @Nullable private Object ub = null;
        @Nullable private Object init = null;

        public Builder(final String name) {
            this.name = name;
        }

        public Builder setIndex(final Object... args) {
            indexArgs.addAll(Arrays.asList(args));
            return this;
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

        public VariableGroup build() {
            return new VariableGroup(this);
        }
    }
}
