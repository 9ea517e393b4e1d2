/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.base.Preconditions;
import com.vmware.optmodel.symbolic.SetIterator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stands for {@code group[key]} where the key is symbolic or the group itself is abstract. A shadow has
 * no declaration and is never registered. It is resolved explicitly with {@link #bind(Map)} or
 * {@link #bind(Object...)}.
 */
public class ShadowVariable extends Variable {

    ShadowVariable(final VariableGroup parent, final List<Object> key) {
        super(parent, key, Keys.isAbstract(key));
    }

    /**
     * Replaces the iterators of the key with concrete values
     *
     * @param values a value for each iterator of the key
     * @return the member of the group at the resolved key
     */
    public Variable bind(final Map<SetIterator, ?> values) {
        final List<Object> resolved = new ArrayList<>();
        for (final Object component : Objects.requireNonNull(getKey())) {
            if (component instanceof SetIterator) {
                final Object value = values.get(component);
                Preconditions.checkArgument(value != null, "No value given for iterator %s", component);
                resolved.add(value);
            } else {
                resolved.add(component);
            }
        }
        return Objects.requireNonNull(getParent()).get(resolved.toArray());
    }

    /**
     * Fills the symbolic positions of the key, in order, with the given values
     *
     * @param concreteKey one value per symbolic key component
     * @return the member of the group at the resolved key
     */
    public Variable bind(final Object... concreteKey) {
        final List<Object> resolved = new ArrayList<>();
        int next = 0;
        for (final Object component : Objects.requireNonNull(getKey())) {
            if (Keys.isSymbolic(component)) {
                Preconditions.checkArgument(next < concreteKey.length, "Too few values to bind %s", this);
                resolved.add(concreteKey[next++]);
            } else {
                resolved.add(component);
            }
        }
        Preconditions.checkArgument(next == concreteKey.length, "Too many values to bind %s", this);
        return Objects.requireNonNull(getParent()).get(resolved.toArray());
    }
}
