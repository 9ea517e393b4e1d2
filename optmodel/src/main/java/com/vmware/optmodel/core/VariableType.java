/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.vmware.optmodel.ModelException;

import java.util.Locale;

public enum VariableType {
    CONT(""),
    INT("integer"),
    BIN("binary");

    private final String keyword;

    VariableType(final String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return the keyword used in a declaration, empty for continuous variables
     */
    public String keyword() {
        return keyword;
    }

    public static VariableType of(final String type) {
        switch (type.toLowerCase(Locale.US)) {
            case "cont":
            case "continuous":
                return CONT;
            case "int":
            case "integer":
                return INT;
            case "bin":
            case "binary":
                return BIN;
            default:
                throw new ModelException("Unknown variable type: " + type);
        }
    }
}
