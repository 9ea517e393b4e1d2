/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.symbolic.ModelSet;
import com.vmware.optmodel.symbolic.SetIterator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * An indexed family of constraints.
 *
 * Concrete members are declared one by one under the names {@code c_k1_k2}. When a dimension is a
 * {@link ModelSet} the generator is called with iterators instead, and each combination of the concrete
 * dimensions yields a single indexed declaration such as {@code con c {TEMP1 in S} : ...}.
 */
public class ConstraintGroup extends Group<Constraint> {

    /**
     * @param name requested name
     * @param generator builds the relation for one key
     * @param indexArgs one index argument per dimension
     */
    public ConstraintGroup(final String name, final Function<List<Object>, Constraint> generator,
                           final Object... indexArgs) {
        super(name, Arrays.asList(indexArgs));
        if (isAbstract) {
            addSymbolicMembers(generator);
        } else {
            for (final List<Object> key : concreteKeys()) {
                addMember(ImmutableList.copyOf(key), generator.apply(key), ImmutableList.of());
            }
        }
        Containers.record(this);
    }

    /**
     * Creates a one-dimensional group whose keys are the positions in the list
     */
    public ConstraintGroup(final String name, final List<Constraint> relations) {
        super(name, List.of(relations.size()));
        for (int i = 0; i < relations.size(); i++) {
            addMember(ImmutableList.of(i), relations.get(i), ImmutableList.of());
        }
        Containers.record(this);
    }

    public ConstraintGroup(final String name, final Map<List<Object>, Constraint> relations) {
        super(name, dimensionsOf(normalizedKeys(relations)));
        for (final Map.Entry<List<Object>, Constraint> entry : relations.entrySet()) {
            addMember(ImmutableList.copyOf(Keys.normalizeAll(entry.getKey())), entry.getValue(),
                      ImmutableList.of());
        }
        Containers.record(this);
    }

    private static List<List<Object>> normalizedKeys(final Map<List<Object>, Constraint> relations) {
        return relations.keySet().stream().map(Keys::normalizeAll).collect(Collectors.toList());
    }

    private void addSymbolicMembers(final Function<List<Object>, Constraint> generator) {
        final List<List<Object>> choices = new ArrayList<>();
        final List<SetIterator> iterators = new ArrayList<>();
        for (final Object dim : dimensions) {
            if (dim instanceof ModelSet) {
                final SetIterator iterator = ((ModelSet) dim).iterator();
                iterators.add(iterator);
                choices.add(ImmutableList.of(iterator));
            } else {
                @SuppressWarnings("unchecked") final List<Object> values = (List<Object>) dim;
                choices.add(values);
            }
        }
        for (final List<Object> key : Lists.cartesianProduct(choices)) {
            addMember(ImmutableList.copyOf(key), generator.apply(key), iterators);
        }
    }

    private void addMember(final List<Object> key, final Constraint relation, final List<SetIterator> loop) {
        final Constraint member = new Constraint(relation, this, key, memberName(key), loop);
        members.put(key, member);
    }

    /**
     * @return the declared name of the member at a key: the group name followed by the concrete key
     *         components
     */
    private String memberName(final List<Object> key) {
        final StringBuilder sb = new StringBuilder(name);
        for (final Object component : key) {
            if (!Keys.isSymbolic(component)) {
                sb.append('_').append(OptmodelString.safeString(String.valueOf(component)));
            }
        }
        return sb.toString();
    }

    /**
     * @return the canonical indexed name of a key, for instance {@code c[1,'a']}
     */
    public String getIndexedName(final List<Object> key) {
        return OptmodelString.bracketName(name, key);
    }

    @Override
    protected Constraint createShadow(final List<Object> key) {
        final List<Object> concrete = new ArrayList<>();
        final List<Object> symbolic = new ArrayList<>();
        for (int i = 0; i < key.size(); i++) {
            if (dimensions.get(i) instanceof ModelSet) {
                symbolic.add(key.get(i));
            } else {
                concrete.add(key.get(i));
            }
        }
        final StringBuilder base = new StringBuilder(name);
        for (final Object component : concrete) {
            base.append('_').append(OptmodelString.safeString(String.valueOf(component)));
        }
        final String reference = symbolic.isEmpty()
                ? base.toString()
                : OptmodelString.bracketName(base.toString(), symbolic);
        return new ShadowConstraint(this, key, reference);
    }

    /**
     * @param rhs whether the constant of each body is kept
     * @return a copy of the body of each member
     */
    public Map<List<Object>, Expression> getExpressions(final boolean rhs) {
        final Map<List<Object>, Expression> expressions = new LinkedHashMap<>();
        for (final Map.Entry<List<Object>, Constraint> entry : members.entrySet()) {
            final Expression body = entry.getValue().copy();
            if (!rhs) {
                body.members.get(TermKey.CONST).setCoef(0);
            }
            expressions.put(entry.getKey(), body);
        }
        return expressions;
    }

    /**
     * @return the names used to drop or restore every member, symbolic members with their loop prefix
     */
    public List<String> getNameList() {
        final List<String> names = new ArrayList<>();
        for (final Constraint member : members.values()) {
            if (member.getLoopIterators().isEmpty()) {
                names.add(member.getName());
            } else {
                names.add(OptmodelString.loopHeader(member.getLoopIterators()) + " "
                          + OptmodelString.bracketName(member.getName(), member.getLoopIterators()));
            }
        }
        return names;
    }

    @Override
    public String definition() {
        return members.values().stream().map(Constraint::definition).collect(Collectors.joining("\n"));
    }
}
