/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.container;

import com.vmware.optmodel.ModelException;

/**
 * Thrown when an operation that has no statement form is called while a container is active
 */
public class UnsupportedContextException extends ModelException {
    private static final long serialVersionUID = 1L;

    public UnsupportedContextException(final String operation, final Container container) {
        super(String.format("Operation %s cannot be used inside %s", operation, container));
    }
}
