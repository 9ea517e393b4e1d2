/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.container.Container;
import com.vmware.optmodel.container.ContainerScope;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.core.Declarable;
import com.vmware.optmodel.symbolic.SetIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * A {@code for} or {@code cofor} loop over one or more domains. The body is recorded by running it once with
 * symbolic iterators while the loop is the active container:
 *
 * <pre>
 * for {TEMP1 in S, TEMP2 in 1..2} do;
 *    ...
 * end;
 * </pre>
 */
public class ForLoopStatement extends Statement implements Container {
    private static final Logger LOG = LoggerFactory.getLogger(ForLoopStatement.class);

    public enum State {
        NOT_ENTERED,
        ENTERED,
        EXITED
    }

    private final boolean concurrent;
    private final List<SetIterator> iterators;
    private final List<Declarable> children = new ArrayList<>();
    private State state = State.NOT_ENTERED;

    /**
     * @param concurrent renders {@code cofor} instead of {@code for}
     * @param domains the sets, ranges or lists iterated over, outermost first
     */
    public ForLoopStatement(final boolean concurrent, final List<?> domains) {
        Preconditions.checkArgument(!domains.isEmpty(), "A loop needs at least one domain");
        this.concurrent = concurrent;
        final List<SetIterator> its = new ArrayList<>();
        for (final Object domain : domains) {
            its.add(SetIterator.over(domain));
        }
        this.iterators = ImmutableList.copyOf(its);
        operands.addAll(domains);
    }

    public List<SetIterator> getIterators() {
        return iterators;
    }

    public State getState() {
        return state;
    }

    public boolean isConcurrent() {
        return concurrent;
    }

    /**
     * Records the body of the loop. The previously active container is restored even if the body throws.
     *
     * @param body receives one iterator per domain
     * @return this loop
     */
    public ForLoopStatement run(final Consumer<List<SetIterator>> body) {
        Preconditions.checkState(state == State.NOT_ENTERED, "Loop is %s", state);
        state = State.ENTERED;
        try (ContainerScope ignored = Containers.enter(this)) {
            body.accept(iterators);
        } finally {
            state = State.EXITED;
        }
        LOG.debug("Recorded {} statement(s) over {}", children.size(), iterators);
        return this;
    }

    @Override
    public void append(final Declarable element) {
        Preconditions.checkState(state == State.ENTERED, "Loop is %s", state);
        children.add(element);
    }

    @Override
    public List<Declarable> getElements() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String definition() {
        final String body = children.stream()
                                    .map(Declarable::definition)
                                    .filter(Objects::nonNull)
                                    .collect(Collectors.joining("\n"));
        final StringBuilder sb = new StringBuilder(concurrent ? "cofor " : "for ")
                .append(OptmodelString.loopHeader(iterators)).append(" do;\n");
        if (!body.isEmpty()) {
            sb.append(OptmodelString.indent(body, OptmodelString.INDENT)).append('\n');
        }
        return sb.append("end;").toString();
    }
}
