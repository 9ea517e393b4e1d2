/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.container;

import com.vmware.optmodel.core.Declarable;

import java.util.List;

/**
 * A scope that collects declarations and statements while it is active. Workspaces, loops and the
 * branches of conditionals are containers.
 */
public interface Container {

    void append(Declarable element);

    List<Declarable> getElements();
}
