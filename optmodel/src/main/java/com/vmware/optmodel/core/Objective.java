/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.vmware.optmodel.Registry;
import com.vmware.optmodel.container.Containers;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * A named objective function together with its sense
 */
public class Objective extends Expression implements Declarable {
    private Sense sense;

    /**
     * @param expression a Number or an Expression
     * @param name requested name
     * @param sense the sense, or null for the configured default
     */
    public Objective(final Object expression, final String name, @Nullable final Sense sense) {
        this(expression, name, sense, true);
    }

    Objective(final Object expression, final String name, @Nullable final Sense sense, final boolean record) {
        final Expression body = operand(expression, "objective");
        final Expression source = body.getOperator() != null ? wrap(body) : body;
        members.clear();
        for (final Map.Entry<TermKey, Term> entry : source.members.entrySet()) {
            members.put(entry.getKey(), entry.getValue().scaled(1));
        }
        this.isAbstract = source.isAbstract;
        this.sense = sense != null ? sense : Registry.current().config().defaultSense();
        register(name);
        if (record) {
            Containers.record(this);
        }
    }

    /**
     * The objective a model uses until another one is set: minimize the constant 0
     */
    public static Objective defaultFor(final String modelName) {
        return new Objective(0, modelName + "_obj", Sense.MIN, false);
    }

    public Sense getSense() {
        return sense;
    }

    public void setSense(final Sense sense) {
        this.sense = sense;
    }

    /**
     * @return the objective function without the declaration
     */
    public String body() {
        return renderBody();
    }

    /**
     * Objectives are referenced by name, for instance in {@code solve obj (a b)}
     */
    @Override
    public String expr() {
        return name;
    }

    @Override
    protected boolean isAtomic() {
        return true;
    }

    @Override
    public String definition() {
        return sense.keyword() + " " + name + " = " + renderBody() + ";";
    }
}
