/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.vmware.optmodel.ModelException;

import java.util.Locale;

/**
 * Direction of an objective
 */
public enum Sense {
    MIN("min"),
    MAX("max");

    private final String keyword;

    Sense(final String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Accepts {@code min}, {@code minimize}, {@code max} and {@code maximize} in any case
     */
    public static Sense of(final String sense) {
        switch (sense.toLowerCase(Locale.US)) {
            case "min":
            case "minimize":
                return MIN;
            case "max":
            case "maximize":
                return MAX;
            default:
                throw new ModelException("Unknown objective sense: " + sense);
        }
    }
}
