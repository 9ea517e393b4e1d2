/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

/**
 * Base class of every failure raised while building or rendering a model.
 *
 * Value errors (an invalid constraint direction, an unusable bound, a dropped or unknown name) are
 * reported with this class directly. More specific failures use one of its subclasses.
 */
public class ModelException extends RuntimeException {
    public ModelException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ModelException(final Exception e) {
        super(e);
    }

    public ModelException(final String message) {
        super(message);
    }
}
