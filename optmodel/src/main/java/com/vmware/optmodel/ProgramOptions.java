/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

import com.vmware.optmodel.statement.SolveOptions;

/**
 * Controls how {@link Model#toOptmodel(ProgramOptions)} assembles a program
 */
public final class ProgramOptions {
    private boolean header = true;
    private boolean solve = true;
    private SolveOptions solveOptions = SolveOptions.defaults();
    private boolean creationOrder = true;
    private boolean parseResults = false;

    public boolean isHeader() {
        return header;
    }

    /**
     * Wraps the program in {@code proc optmodel;} and {@code quit;}
     */
    public ProgramOptions setHeader(final boolean header) {
        this.header = header;
        return this;
    }

    public boolean isSolve() {
        return solve;
    }

    public ProgramOptions setSolve(final boolean solve) {
        this.solve = solve;
        return this;
    }

    public SolveOptions getSolveOptions() {
        return solveOptions;
    }

    public ProgramOptions setSolveOptions(final SolveOptions solveOptions) {
        this.solveOptions = solveOptions;
        return this;
    }

    public boolean isCreationOrder() {
        return creationOrder;
    }

    /**
     * Orders declarations by creation instead of by kind
     */
    public ProgramOptions setCreationOrder(final boolean creationOrder) {
        this.creationOrder = creationOrder;
        return this;
    }

    public boolean isParseResults() {
        return parseResults;
    }

    /**
     * Appends the statements that write the primal and dual solution tables
     */
    public ProgramOptions setParseResults(final boolean parseResults) {
        this.parseResults = parseResults;
        return this;
    }

    @Override
    public String toString() {
        return "ProgramOptions{" +
                "header=" + header +
                ", solve=" + solve +
                ", solveOptions=" + solveOptions +
                ", creationOrder=" + creationOrder +
                ", parseResults=" + parseResults +
                '}';
    }
}
