/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.ReferenceException;
import com.vmware.optmodel.Registry;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.symbolic.ModelSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Common base of indexed families of expressions.
 *
 * Every index argument becomes one dimension. A dimension is either a list of concrete values or a
 * {@link ModelSet}, in which case the group is abstract and its members are only known to the solver.
 *
 * @param <T> type of the members
 */
public abstract class Group<T extends Expression> implements Declarable, Renderable {
    private static final Logger LOG = LoggerFactory.getLogger(Group.class);

    protected final String name;
    protected final int order;
    protected final List<Object> dimensions;
    protected final LinkedHashMap<List<Object>, T> members = new LinkedHashMap<>();
    protected final LinkedHashMap<List<Object>, T> shadows = new LinkedHashMap<>();
    protected final boolean isAbstract;

    protected Group(final String requestedName, final List<?> indexArgs) {
        Preconditions.checkArgument(!indexArgs.isEmpty(), "A group needs at least one index argument");
        final Registry registry = Registry.current();
        this.name = registry.assignName(requestedName);
        this.order = registry.register(name, this);
        final List<Object> dims = new ArrayList<>();
        for (final Object arg : indexArgs) {
            dims.add(dimension(arg));
        }
        this.dimensions = Collections.unmodifiableList(dims);
        this.isAbstract = dims.stream().anyMatch(d -> d instanceof ModelSet);
    }

    private static Object dimension(final Object arg) {
        if (arg instanceof ModelSet) {
            return arg;
        }
        if (arg instanceof Integer) {
            return ImmutableList.copyOf(IntRange.upTo((Integer) arg));
        }
        if (arg instanceof Map) {
            return ImmutableList.copyOf(Keys.normalizeAll(new ArrayList<>(((Map<?, ?>) arg).keySet())));
        }
        if (arg instanceof Collection) {
            return ImmutableList.copyOf(Keys.normalizeAll(new ArrayList<>((Collection<?>) arg)));
        }
        throw new ModelException("Invalid index argument for a group: " + arg);
    }

    /**
     * @return the index arguments that describe the given keys, one list of distinct values per position
     */
    protected static List<Object> dimensionsOf(final Collection<List<Object>> keys) {
        final List<LinkedHashSet<Object>> values = new ArrayList<>();
        for (final List<Object> key : keys) {
            for (int i = 0; i < key.size(); i++) {
                if (values.size() <= i) {
                    values.add(new LinkedHashSet<>());
                }
                values.get(i).add(key.get(i));
            }
        }
        return values.stream().map(ArrayList::new).collect(Collectors.toList());
    }

    /**
     * @return every concrete key, in the order of the Cartesian product of the dimensions
     */
    @SuppressWarnings("unchecked")
    protected List<List<Object>> concreteKeys() {
        Preconditions.checkState(!isAbstract, "Group %s has symbolic dimensions", name);
        final List<List<Object>> lists = new ArrayList<>();
        for (final Object dim : dimensions) {
            lists.add((List<Object>) dim);
        }
        return Lists.cartesianProduct(lists);
    }

    public String getName() {
        return name;
    }

    @Override
    public int order() {
        return order;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public List<Object> getDimensions() {
        return dimensions;
    }

    /**
     * @return the number of concrete members
     */
    public int size() {
        return members.size();
    }

    public List<T> getMembers() {
        return ImmutableList.copyOf(members.values());
    }

    public Map<List<Object>, T> getMemberMap() {
        return Collections.unmodifiableMap(members);
    }

    public List<T> getShadows() {
        return ImmutableList.copyOf(shadows.values());
    }

    /**
     * Looks up one member. Symbolic keys, and any key of an abstract group, resolve to a shadow reference.
     *
     * @param key one component per dimension, or a single list holding them
     * @return the member at that key
     */
    public T get(final Object... key) {
        final List<Object> normalized = Keys.of(key);
        Preconditions.checkArgument(normalized.size() == dimensions.size(),
                                    "Group %s has %s dimensions but key %s has %s components",
                                    name, dimensions.size(), normalized, normalized.size());
        final T member = members.get(normalized);
        if (member != null) {
            return member;
        }
        if (isAbstract || Keys.isAbstract(normalized)) {
            return shadows.computeIfAbsent(ImmutableList.copyOf(normalized), this::createShadow);
        }
        if (Keys.isFilter(normalized)) {
            throw new IllegalArgumentException("Key " + normalized + " is a filter, use getAll instead");
        }
        throw new ReferenceException(
                String.format("Group %s has no member %s", name, OptmodelString.bracketName(name, normalized)));
    }

    /**
     * Selects members. Each component is either a value, the wildcard {@code "*"} or a collection of
     * accepted values. An exact key returns its member alone.
     *
     * @return the matching members in insertion order, empty with a warning if nothing matches
     */
    public List<T> getAll(final Object... filter) {
        final List<Object> normalized = Keys.normalizeAll(List.of(filter));
        final T exact = members.get(normalized);
        if (exact != null) {
            return ImmutableList.of(exact);
        }
        final List<T> matches = new ArrayList<>();
        for (final Map.Entry<List<Object>, T> entry : members.entrySet()) {
            if (matches(entry.getKey(), normalized)) {
                matches.add(entry.getValue());
            }
        }
        if (matches.isEmpty()) {
            LOG.warn("No members of {} match the filter {}", name, normalized);
        }
        return matches;
    }

    protected static boolean matches(final List<Object> key, final List<Object> filter) {
        if (key.size() != filter.size()) {
            return false;
        }
        for (int i = 0; i < key.size(); i++) {
            final Object component = filter.get(i);
            if (Keys.WILDCARD.equals(component)) {
                continue;
            }
            if (component instanceof Collection) {
                if (!((Collection<?>) component).contains(key.get(i))) {
                    return false;
                }
            } else if (!component.equals(key.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Finds a member or shadow by its full name such as {@code x[1,'a']}
     *
     * @return the member, or null if the name does not belong to this group
     */
    @Nullable
    public T getByName(final String memberName) {
        for (final T member : members.values()) {
            if (memberName.equals(member.getName())) {
                return member;
            }
        }
        for (final T shadow : shadows.values()) {
            if (memberName.equals(shadow.getName())) {
                return shadow;
            }
        }
        final String prefix = name + "[";
        if (isAbstract && memberName.startsWith(prefix) && memberName.endsWith("]")) {
            final List<Object> key = Keys.parse(memberName.substring(prefix.length(), memberName.length() - 1));
            if (key.size() == dimensions.size()) {
                return get(key.toArray());
            }
        }
        return null;
    }

    protected abstract T createShadow(List<Object> key);

    /**
     * @return the index sets of a declaration, for instance {@code {{0,1,2}, S}}
     */
    protected String indexSets() {
        final List<String> sets = new ArrayList<>();
        for (final Object dim : dimensions) {
            sets.add(OptmodelString.toSasString(dim));
        }
        return "{" + String.join(", ", sets) + "}";
    }

    @Override
    public String expr() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
