/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.backend;

import com.vmware.optmodel.Registry;
import com.vmware.optmodel.core.Constraint;
import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.core.Variable;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SolutionReaderTest {

    @BeforeEach
    public void resetRegistry() {
        Registry.current().reset();
    }

    @Test
    public void testApplyBuiltResponse() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        final Constraint c = new Constraint(x.add(y).le(4), "c");
        final Map<String, Variable> variables = Map.of("x", x, "y", y);
        final Map<String, Expression> constraints = Map.of("c", c);
        final SolutionReader reader = new SolutionReader(variables::get, constraints::get);

        final SolverResponse response = new SolverResponse.Builder()
                .addPrimal("x", 1, 0.0)
                .addPrimal("y", 3, null)
                .addPrimal("z", 9, null)
                .addDual("c", 4, 2.5)
                .addDual("d", 0, 0)
                .build();
        assertEquals(List.of("z"), reader.applyPrimal(response.getPrimal()));
        assertEquals(List.of("d"), reader.applyDual(response.getDual()));
        assertEquals(1, x.getValue());
        assertEquals(3, y.getValue());
        assertEquals(0.0, x.getDual());
        assertNull(y.getDual());
        assertEquals(2.5, c.getDual());
        assertEquals(4, c.getValue());
    }

    @Test
    public void testApplyParsedTable() {
        final Variable x = new Variable("x");
        final Result<Record> primal = DSL.using(SQLDialect.DEFAULT)
                .fetchFromCSV("var,value,rc\nx,2.5,.", true, ',');
        final SolutionReader reader = new SolutionReader(name -> "x".equals(name) ? x : null, name -> null);
        assertTrue(reader.applyPrimal(primal).isEmpty());
        assertEquals(2.5, x.getValue());
        assertNull(x.getDual());
    }

    @Test
    public void testMissingValueKeepsCurrent() {
        final Variable x = new Variable("x");
        x.setValue(7);
        final Result<Record> primal = DSL.using(SQLDialect.DEFAULT).fetchFromCSV("var,value\nx,.", true, ',');
        final SolutionReader reader = new SolutionReader(name -> x, name -> null);
        reader.applyPrimal(primal);
        assertTrue(x.hasValue());
        assertEquals(7, x.getValue());
        assertFalse(primal.isEmpty());
    }
}
