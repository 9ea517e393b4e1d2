/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

/**
 * This informs FindBugs to mark parameters and return values as NonNull.
 */

@ParametersAreNonnullByDefault
@ReturnValuesAreNonnullByDefault

package com.vmware.optmodel.backend;

import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;

import javax.annotation.ParametersAreNonnullByDefault;
