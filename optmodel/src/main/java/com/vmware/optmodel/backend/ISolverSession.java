/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.backend;

/**
 * The collaborator that runs a generated program. Calls block until the solver returns.
 */
public interface ISolverSession {

    /**
     * @param program the complete program, including {@code proc optmodel;} and {@code quit;}
     * @return the tables and summary produced by the program
     * @throws com.vmware.optmodel.SolverException if the program could not be run
     */
    SolverResponse submit(String program);
}
