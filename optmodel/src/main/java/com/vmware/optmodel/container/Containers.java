/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.container;

import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.Registry;
import com.vmware.optmodel.core.Declarable;

import java.util.Optional;

/**
 * Static access to the stack of active containers of the current {@link Registry}.
 */
public final class Containers {

    private Containers() {
    }

    /**
     * Makes a container the innermost active one
     *
     * @param container the container to enter
     * @return a scope that leaves the container when closed
     */
    public static ContainerScope enter(final Container container) {
        final Registry registry = Registry.current();
        registry.pushContainer(container);
        return new ContainerScope(registry, container);
    }

    public static Optional<Container> active() {
        return Registry.current().activeContainer();
    }

    /**
     * Appends a freshly built object to the innermost active container, if any
     */
    public static void record(final Declarable element) {
        active().ifPresent(container -> container.append(element));
    }

    /**
     * @param operation the name of the operation, used in the error message
     * @return the innermost active container
     */
    public static Container requireActive(final String operation) {
        return active().orElseThrow(() ->
                new ModelException(operation + " can only be used inside a Workspace or a loop"));
    }
}
