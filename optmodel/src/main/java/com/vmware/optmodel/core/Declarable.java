/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import javax.annotation.Nullable;

/**
 * An element that a container can hold and render as one or more program lines.
 */
public interface Declarable {

    /**
     * @return the declaration of this element, or null if it is declared by its owner
     */
    @Nullable
    String definition();

    /**
     * @return the creation order of this element, 0 if it was never registered
     */
    int order();
}
