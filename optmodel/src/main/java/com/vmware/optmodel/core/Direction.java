/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.vmware.optmodel.ModelException;

/**
 * Relation between a constraint body and its right-hand side
 */
public enum Direction {
    E("="),
    L("<="),
    G(">=");

    private final String relation;

    Direction(final String relation) {
        this.relation = relation;
    }

    public String relation() {
        return relation;
    }

    public static Direction of(final String token) {
        switch (token) {
            case "E":
            case "=":
                return E;
            case "L":
            case "<=":
                return L;
            case "G":
            case ">=":
                return G;
            default:
                throw new ModelException("Invalid direction for constraint: " + token);
        }
    }
}
