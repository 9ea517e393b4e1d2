/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.container;

import com.vmware.optmodel.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Dispatches an operation either to its immediate implementation or, while a container is active, to
 * its statement form.
 */
public final class Containable {
    private static final Logger LOG = LoggerFactory.getLogger(Containable.class);

    private Containable() {
    }

    /**
     * @param operation name of the operation, used in errors
     * @param immediate runs the operation directly
     * @param factory builds the statements recorded inside a container, null if the operation has none
     * @param <T> type of the immediate result
     * @return the immediate result or the recorded statements
     * @throws UnsupportedContextException if a container is active and there is no factory
     */
    public static <T> Invocation<T> invoke(final String operation, final Supplier<T> immediate,
                                           @Nullable final StatementFactory factory) {
        final Optional<Container> active = Containers.active();
        if (active.isEmpty()) {
            return Invocation.immediate(immediate.get());
        }
        if (factory == null) {
            throw new UnsupportedContextException(operation, active.get());
        }
        final List<? extends Statement> statements = factory.create();
        LOG.debug("Recording {} as {} statement(s) in {}", operation, statements.size(), active.get());
        for (final Statement statement : statements) {
            active.get().append(statement);
        }
        return Invocation.recorded(statements);
    }
}
