/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.backend;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.core.Variable;
import org.jooq.Record;
import org.jooq.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Copies the values and duals of a solver response onto the variables and constraints they name. Names
 * without a match are reported, never thrown.
 */
public class SolutionReader {
    private static final Logger LOG = LoggerFactory.getLogger(SolutionReader.class);

    private final Function<String, Variable> variables;
    private final Function<String, Expression> constraints;

    /**
     * @param variables resolves a variable by name, returning null when there is none
     * @param constraints resolves a constraint by name, returning null when there is none
     */
    public SolutionReader(final Function<String, Variable> variables,
                          final Function<String, Expression> constraints) {
        this.variables = variables;
        this.constraints = constraints;
    }

    /**
     * @return the variable names that did not resolve
     */
    @CanIgnoreReturnValue
    public List<String> applyPrimal(final Result<Record> primal) {
        final List<String> unmatched = new ArrayList<>();
        final boolean hasRc = primal.field(SolverResponse.RC.getName()) != null;
        for (final Record row : primal) {
            final String name = String.valueOf(row.get(SolverResponse.VAR.getName()));
            final Variable variable = variables.apply(name);
            if (variable == null) {
                unmatched.add(name);
                continue;
            }
            final Double value = toDouble(row.get(SolverResponse.VALUE.getName()));
            if (value != null) {
                variable.setValue(value);
            }
            if (hasRc) {
                variable.setDual(toDouble(row.get(SolverResponse.RC.getName())));
            }
        }
        if (!unmatched.isEmpty()) {
            LOG.warn("No variables match the solution rows {}", unmatched);
        }
        return unmatched;
    }

    /**
     * @return the constraint names that did not resolve
     */
    @CanIgnoreReturnValue
    public List<String> applyDual(final Result<Record> dual) {
        final List<String> unmatched = new ArrayList<>();
        for (final Record row : dual) {
            final String name = String.valueOf(row.get(SolverResponse.CON.getName()));
            final Expression constraint = constraints.apply(name);
            if (constraint == null) {
                unmatched.add(name);
                continue;
            }
            constraint.setDual(toDouble(row.get(SolverResponse.DUAL.getName())));
        }
        if (!unmatched.isEmpty()) {
            LOG.warn("No constraints match the dual rows {}", unmatched);
        }
        return unmatched;
    }

    @Nullable
    private static Double toDouble(@Nullable final Object cell) {
        if (cell == null) {
            return null;
        }
        if (cell instanceof Number) {
            return ((Number) cell).doubleValue();
        }
        final String text = cell.toString().trim();
        if (text.isEmpty() || text.equals(".")) {
            return null;
        }
        return Double.valueOf(text);
    }
}
