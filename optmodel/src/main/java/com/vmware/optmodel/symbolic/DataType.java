/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.symbolic;

/**
 * Element types of sets and parameters
 */
public enum DataType {
    NUM("num"),
    STR("str");

    private final String keyword;

    DataType(final String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
