/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.data;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Values looked up by group key, used for per-member bounds, initial values and coefficients
 */
public interface IndexedSource {

    /**
     * @param key a normalised group key
     * @return the value at that key, or null if the source has none
     */
    @Nullable
    Object get(List<Object> key);
}
