/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.container;

import com.vmware.optmodel.Registry;

/**
 * Keeps a container active until closed. Intended for try-with-resources blocks.
 */
public final class ContainerScope implements AutoCloseable {
    private final Registry registry;
    private final Container container;

    ContainerScope(final Registry registry, final Container container) {
        this.registry = registry;
        this.container = container;
    }

    public Container container() {
        return container;
    }

    @Override
    public void close() {
        registry.popContainer(container);
    }
}
