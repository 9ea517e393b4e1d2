/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.symbolic;

import com.vmware.optmodel.EvaluationException;
import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.Registry;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.core.Renderable;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A named iterator over a set, range or list of values. It is an abstract expression, so it can be used in
 * arithmetic and as a group key inside loops and symbolic sums.
 */
public class SetIterator extends Expression {
    private final Object domain;
    private final List<Condition> conditions = new ArrayList<>();

    /**
     * @param domain a ModelSet, a range, a collection of values or any other renderable set expression
     * @param name the iterator name, or null for the next {@code TEMPn}
     */
    public SetIterator(final Object domain, @Nullable final String name) {
        if (!(domain instanceof Renderable) && !(domain instanceof Collection)) {
            throw new ModelException("Cannot iterate over " + domain);
        }
        this.domain = domain;
        this.isAbstract = true;
        register(name != null ? name : Registry.current().nextTemporaryName());
        referenceSelf();
    }

    public static SetIterator over(final Object domain) {
        return new SetIterator(domain, null);
    }

    public Object getDomain() {
        return domain;
    }

    /**
     * Restricts the iteration to the elements satisfying a condition
     */
    public SetIterator addCondition(final Condition condition) {
        conditions.add(condition);
        return this;
    }

    public List<Condition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    /**
     * @return {@code i in S}
     */
    public String definition() {
        return name + " in " + OptmodelString.toSasString(domain);
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

    @Override
    public double getValue() {
        throw new EvaluationException("Cannot evaluate the iterator " + name);
    }
}
