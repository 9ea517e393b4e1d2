/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.symbolic;

import com.vmware.optmodel.EvaluationException;
import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.Registry;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.core.IntRange;
import com.vmware.optmodel.core.Variable;
import com.vmware.optmodel.core.VariableGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SymbolicTest {

    @BeforeEach
    public void resetRegistry() {
        Registry.current().reset();
    }

    @Test
    public void testSetDefinitions() {
        assertEquals("set S;", new ModelSet("S").definition());
        assertEquals("set T init {1,2,3};",
                     new ModelSet("T", List.of(DataType.NUM), List.of(1, 2, 3), null).definition());
        assertEquals("set <str> U = {'a','b'};",
                     new ModelSet("U", List.of(DataType.STR), null, List.of("a", "b")).definition());
        assertEquals("set <num, str> V;",
                     new ModelSet("V", List.of(DataType.NUM, DataType.STR), null, null).definition());
    }

    @Test
    public void testSymbolicRange() {
        final Parameter n = new Parameter("n");
        final ModelSet range = ModelSet.range(1, n);
        assertEquals("1..n", range.expr());
        assertNull(range.definition());
        assertEquals("TEMP1 in 1..n", range.iterator().definition());
    }

    @Test
    public void testParameters() {
        assertEquals("num p;", new Parameter("p").definition());
        final Parameter q = new Parameter("q", DataType.NUM, 5, null);
        assertEquals("num q init 5;", q.definition());
        assertEquals(5.0, q.getValue());
        assertEquals("str s = 'abc';", new Parameter("s", DataType.STR, null, "abc").definition());
        assertThrows(EvaluationException.class, () -> new Parameter("r").getValue());
        q.setValue(7);
        assertEquals(7.0, q.getValue());
        assertTrue(q.isAbstract());
        assertEquals("3 * q + 1", q.mult(3).add(1).expr());
    }

    @Test
    public void testParameterGroup() {
        final ModelSet s = new ModelSet("S");
        final ParameterGroup a = new ParameterGroup("A", s);
        assertEquals("num A {S};", a.definition());
        final SetIterator i = s.iterator();
        final Parameter member = a.get(i);
        assertEquals("A[TEMP1]", member.getName());
        assertSame(member, a.get(i));
        assertNull(member.definition());
        final ModelSet t = new ModelSet("T");
        final ParameterGroup c = new ParameterGroup("C", s, t);
        assertEquals("C[TEMP1,TEMP2]", c.get(i, t.iterator()).getName());
        assertEquals("num B {0..2, S} init 0;",
                     new ParameterGroup("B", List.of(IntRange.of(0, 3), s), DataType.NUM, 0, null).definition());
    }

    @Test
    public void testImplicitVariables() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        final ImplicitVariable z = new ImplicitVariable("z", x.add(y));
        assertEquals("impvar z = x + y;", z.definition());
        assertFalse(z.isIndexed());
        assertTrue(z.isLinear());
        x.setValue(1);
        y.setValue(2);
        assertEquals(3.0, z.getValue());
        assertEquals("2 * z", z.mult(2).expr());
    }

    @Test
    public void testIndexedImplicitVariable() {
        final VariableGroup x = new VariableGroup("x", 3);
        final ImplicitVariable w = new ImplicitVariable("w", its -> x.get(its.get(0)).mult(2), IntRange.of(0, 3));
        assertEquals("impvar w {TEMP1 in 0..2} = 2 * x[TEMP1];", w.definition());
        assertTrue(w.isIndexed());
        final Expression reference = w.get(1);
        assertEquals("w[1]", reference.expr());
        assertSame(reference, w.get(1));
        assertThrows(EvaluationException.class, w::getValue);
    }

    @Test
    public void testConditions() {
        final ModelSet s = new ModelSet("S");
        final SetIterator i = s.iterator();
        assertEquals("TEMP1 > 2", i.gt(2).expr());
        assertEquals("(TEMP1 > 2) and (TEMP1 < 5)", i.gt(2).and(i.lt(5)).expr());
        assertEquals("(TEMP1 ne 1) or (TEMP1 in {3,4})", i.ne(1).or(i.in(List.of(3, 4))).expr());
        i.addCondition(i.ne(3));
        assertEquals("{TEMP1 in S: TEMP1 ne 3}", OptmodelString.loopHeader(List.of(i)));
        assertThrows(EvaluationException.class, i::getValue);
    }

    @Test
    public void testIteratorDomains() {
        final SetIterator named = new SetIterator(List.of("a", "b"), "k");
        assertEquals("k in {'a','b'}", named.definition());
        assertThrows(ModelException.class, () -> SetIterator.over(3));
    }
}
