/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.vmware.optmodel.backend.ISolverSession;
import com.vmware.optmodel.backend.SolutionReader;
import com.vmware.optmodel.backend.SolverResponse;
import com.vmware.optmodel.codegen.ProgramWriter;
import com.vmware.optmodel.container.Container;
import com.vmware.optmodel.container.ContainerScope;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.core.Constraint;
import com.vmware.optmodel.core.ConstraintGroup;
import com.vmware.optmodel.core.Declarable;
import com.vmware.optmodel.core.Variable;
import com.vmware.optmodel.core.VariableGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Records everything created or invoked while it is entered, and renders the recording as one
 * {@code proc optmodel} program:
 *
 * <pre>
 * final Workspace workspace = new Workspace("w");
 * try (ContainerScope scope = workspace.enter()) {
 *     final Variable x = new Variable("x");
 *     ...
 * }
 * workspace.toOptmodel();
 * </pre>
 */
public class Workspace implements Container {
    private static final Logger LOG = LoggerFactory.getLogger(Workspace.class);

    private final String name;
    private final int id;
    private final List<Declarable> elements = new ArrayList<>();
    private final ProgramWriter writer = new ProgramWriter();
    @Nullable private ISolverSession session;
    @Nullable private SolverResponse response;

    public Workspace(final String name) {
        this(name, null);
    }

    public Workspace(final String name, @Nullable final ISolverSession session) {
        this.name = name;
        this.id = Registry.current().nextOrder();
        this.session = session;
    }

    /**
     * Makes this workspace the innermost active container until the returned scope is closed
     */
    public ContainerScope enter() {
        return Containers.enter(this);
    }

    public String getName() {
        return name;
    }

    @Override
    public void append(final Declarable element) {
        elements.add(element);
    }

    @Override
    public List<Declarable> getElements() {
        return ImmutableList.copyOf(elements);
    }

    @Nullable
    public ISolverSession getSession() {
        return session;
    }

    public void setSession(@Nullable final ISolverSession session) {
        this.session = session;
    }

    /**
     * @return the response of the last {@link #submit()}, null before the first one
     */
    @Nullable
    public SolverResponse getResponse() {
        return response;
    }

    /**
     * @param variableName a variable name or the full name of a group member such as {@code x[1]}
     * @return the first matching variable, or null
     */
    @Nullable
    public Variable getVariable(final String variableName) {
        final List<Variable> matches = new ArrayList<>();
        for (final Declarable element : elements) {
            if (element instanceof Variable && variableName.equals(((Variable) element).getName())) {
                matches.add((Variable) element);
            } else if (element instanceof VariableGroup) {
                final Variable member = ((VariableGroup) element).getByName(variableName);
                if (member != null) {
                    matches.add(member);
                }
            }
        }
        if (matches.size() > 1) {
            LOG.warn("Workspace {} has {} variables named {}, using the first one", name, matches.size(),
                     variableName);
        }
        return matches.isEmpty() ? null : matches.get(0);
    }

    @Nullable
    Constraint getConstraint(final String constraintName) {
        for (final Declarable element : elements) {
            if (element instanceof Constraint && constraintName.equals(((Constraint) element).getName())) {
                return (Constraint) element;
            }
            if (element instanceof ConstraintGroup) {
                final Constraint member = ((ConstraintGroup) element).getByName(constraintName);
                if (member != null) {
                    return member;
                }
            }
        }
        return null;
    }

    /**
     * @throws ReferenceException if the workspace has no such variable
     */
    public void setVariableValue(final String variableName, final double value) {
        final Variable variable = getVariable(variableName);
        if (variable == null) {
            throw new ReferenceException(String.format("No variable %s in workspace %s", variableName, name));
        }
        variable.setValue(value);
    }

    public String toOptmodel() {
        final List<String> lines = new ArrayList<>();
        for (final Declarable element : elements) {
            final String definition = element.definition();
            if (definition != null) {
                lines.add(definition);
            }
        }
        return writer.write(lines, true);
    }

    /**
     * Sends the program to the session and copies the values and duals it reports back
     *
     * @throws SolverException if the workspace has no session
     */
    @CanIgnoreReturnValue
    public SolverResponse submit() {
        if (session == null) {
            throw new SolverException("Workspace " + name + " has no session to submit to");
        }
        final String program = toOptmodel();
        final long start = System.nanoTime();
        final SolverResponse submitted = session.submit(program);
        LOG.info("Workspace {} was submitted in {}ns", name, System.nanoTime() - start);
        final SolutionReader reader = new SolutionReader(this::getVariable, this::getConstraint);
        reader.applyPrimal(submitted.getPrimal());
        reader.applyDual(submitted.getDual());
        this.response = submitted;
        return submitted;
    }

    @Override
    public String toString() {
        return "Workspace[ID=" + id + "]";
    }
}
