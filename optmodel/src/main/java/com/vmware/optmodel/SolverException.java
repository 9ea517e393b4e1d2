/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

import javax.annotation.Nullable;

/**
 * An exception thrown when handing a program to the solver. Typically used to convey a failed submission
 * or a solution status that is not accepted as solved.
 *
 * Optionally carries the status string reported by the solver.
 */
public class SolverException extends ModelException {
    private final String reason;
    @Nullable private final String status;

    public SolverException(final String reason) {
        super(reason);
        this.reason = reason;
        this.status = null;
    }

    public SolverException(final String reason, final Throwable cause) {
        super(reason, cause);
        this.reason = reason;
        this.status = null;
    }

    public SolverException(final String reason, @Nullable final String status) {
        super(status == null ? reason : reason + " (status: " + status + ")");
        this.reason = reason;
        this.status = status;
    }

    public String reason() {
        return reason;
    }

    @Nullable
    public String status() {
        return status;
    }
}
