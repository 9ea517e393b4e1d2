/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Stands for one member of a symbolic constraint group, for instance {@code d[TEMP1]} or {@code d_0[2]}.
 * It can be dropped or restored but has no declaration of its own.
 */
public class ShadowConstraint extends Constraint {

    ShadowConstraint(final ConstraintGroup parent, final List<Object> key, final String referenceName) {
        super(parent, key, referenceName);
    }

    @Override
    public String expr() {
        return name;
    }

    @Nullable
    @Override
    public String definition() {
        return null;
    }
}
