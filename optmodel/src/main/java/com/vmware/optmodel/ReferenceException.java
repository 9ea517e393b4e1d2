/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

/**
 * Thrown when a name or an object cannot be resolved, or is referenced before it is defined in the
 * generated program.
 */
public class ReferenceException extends ModelException {
    public ReferenceException(final String message) {
        super(message);
    }
}
