/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

/**
 * Anything that can appear inside a generated OPTMODEL expression
 */
public interface Renderable {

    /**
     * @return the text used when this object is referenced from another statement
     */
    String expr();
}
