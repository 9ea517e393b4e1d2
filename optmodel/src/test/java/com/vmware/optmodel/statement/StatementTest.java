/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.Registry;
import com.vmware.optmodel.core.ConstraintGroup;
import com.vmware.optmodel.core.Objective;
import com.vmware.optmodel.core.Sense;
import com.vmware.optmodel.core.Variable;
import com.vmware.optmodel.core.VariableGroup;
import com.vmware.optmodel.symbolic.DataType;
import com.vmware.optmodel.symbolic.ModelSet;
import com.vmware.optmodel.symbolic.ParameterGroup;
import com.vmware.optmodel.symbolic.SetIterator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StatementTest {

    @BeforeEach
    public void resetRegistry() {
        Registry.current().reset();
    }

    @Test
    public void testAssignments() {
        final Variable x = new Variable("x");
        final List<Assignment> fixed = Assignment.setBounds(x, 1, 1.0);
        assertEquals(1, fixed.size());
        assertEquals("fix x = 1;", fixed.get(0).definition());
        final List<Assignment> bounds = Assignment.setBounds(x, 0, 5);
        assertEquals("x.lb = 0;", bounds.get(0).definition());
        assertEquals("x.ub = 5;", bounds.get(1).definition());
        assertTrue(Assignment.setBounds(x, null, null).isEmpty());
        assertEquals("x = 2.5;", Assignment.setValue(x, 2.5).definition());
        assertEquals("unfix x y;", new UnfixStatement(x, "y").definition());
    }

    @Test
    public void testSolveRendering() {
        assertEquals("solve;", SolveStatement.render(null, SolveOptions.defaults()));
        final SolveOptions options = new SolveOptions.Builder()
                .setSolver("milp")
                .setRelaxint(true)
                .setOption("maxtime", 60)
                .setOption("decomp", Map.of("method", "set"))
                .setPrimalin(true)
                .build();
        assertEquals("solve with milp relaxint / maxtime=60 decomp=(method=set) primalin;",
                     new SolveStatement(null, options).definition());
    }

    @Test
    public void testSolveWithObjectives() {
        final Variable x = new Variable("x");
        final Objective cost = new Objective(x, "cost", Sense.MIN);
        final Objective time = new Objective(x.mult(2), "time", Sense.MIN);
        final SolveOptions options = new SolveOptions.Builder().setSolver("lso").setObjectives(cost, time).build();
        assertEquals("solve with lso obj (cost time);", SolveStatement.render(null, options));
        assertEquals("use problem m;\nsolve with lso obj (cost time);",
                     SolveStatement.render(() -> "m", options));
    }

    @Test
    public void testDropAndRestore() {
        final VariableGroup x = new VariableGroup("x", 2);
        final ConstraintGroup c = new ConstraintGroup("c", key -> x.get(key.get(0)).le(1), 2);
        assertEquals("drop c_0 c_1;", new DropStatement(c).definition());
        assertEquals("restore c_1 other;", new RestoreStatement(c.get(1), "other").definition());
        assertEquals("drop x[0] x[1];", new DropStatement(x).definition());
        assertThrows(ModelException.class, () -> new DropStatement(42).definition());
        assertThrows(IllegalArgumentException.class, () -> new DropStatement());
    }

    @Test
    public void testSimpleStatements() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        assertEquals("print x y.sol;", new PrintStatement(x, "y.sol").definition());
        assertEquals("MAX total = x + y;", new ObjectiveStatement(x.add(y), "total", Sense.MAX).definition());
        assertEquals("a;\nb;", new LiteralStatement("a;", "b;").definition());
        assertEquals("use problem m;", new UseProblemStatement(() -> "m").definition());
    }

    @Test
    public void testReadData() {
        final ModelSet products = new ModelSet("PRODUCTS", List.of(DataType.STR), null, null);
        final ReadDataStatement read = new ReadDataStatement.Builder("prices")
                .setTarget(products)
                .setKey("product")
                .addColumn("price", null)
                .build();
        assertEquals("read data prices into PRODUCTS=[product] price;", read.definition());

        final ParameterGroup p = new ParameterGroup("p", products);
        final SetIterator i = products.iterator();
        final ReadDataStatement indexed = new ReadDataStatement.Builder("prices")
                .addColumn(new DataColumn(p.get(i), "val", i))
                .build();
        assertEquals("read data prices into {TEMP1 in PRODUCTS} < p[TEMP1]=val >;", indexed.definition());
    }

    @Test
    public void testCreateData() {
        final ModelSet s = new ModelSet("S");
        final Variable x = new Variable("x");
        final CreateDataStatement create = new CreateDataStatement.Builder("out")
                .setKey("i")
                .setSet(s)
                .addColumn("value", x)
                .addColumn("name", null)
                .build();
        assertEquals("create data out from [i] = {S} value=(x) name;", create.definition());
    }
}
