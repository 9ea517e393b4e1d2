/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.vmware.optmodel.EvaluationException;
import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.Registry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VariableTest {

    @BeforeEach
    public void resetRegistry() {
        Registry.current().reset();
    }

    @Test
    public void testDefinitions() {
        assertEquals("var x;", new Variable("x").definition());
        assertEquals("var z integer >= 0 <= 10;",
                     new Variable.Builder("z").setType(VariableType.INT).setLb(0).setUb(10).build().definition());
        assertEquals("var b binary;", new Variable.Builder("b").setType(VariableType.BIN).build().definition());
        assertEquals("var w init 3;", new Variable.Builder("w").setInit(3).build().definition());
    }

    @Test
    public void testBinaryBoundsAreClamped() {
        final Variable b = new Variable.Builder("b").setType(VariableType.BIN).setLb(-2).setUb(5).build();
        assertEquals(0.0, b.getLb());
        assertEquals(1.0, b.getUb());
        assertEquals("var b binary;", b.definition());
    }

    @Test
    public void testSetBounds() {
        final Variable x = new Variable("x");
        x.setBounds(2, null);
        assertEquals("var x >= 2;", x.definition());
        x.setBounds(null, 4.5);
        assertEquals("var x >= 2 <= 4.5;", x.definition());
    }

    @Test
    public void testValues() {
        final Variable x = new Variable("x");
        assertFalse(x.hasValue());
        assertThrows(EvaluationException.class, x::getValue);
        x.setValue(7);
        assertTrue(x.hasValue());
        assertEquals(7.0, x.getValue());
        x.clearValue();
        assertFalse(x.hasValue());
        assertThrows(ModelException.class, () -> x.setValue("seven"));

        final Variable initialized = new Variable.Builder("y").setInit(1.5).build();
        assertEquals(1.5, initialized.getValue());
    }

    @Test
    public void testAbstractVariableCannotBeEvaluated() {
        final Variable x = new Variable.Builder("x").setAbstract(true).build();
        assertTrue(x.isAbstract());
        assertThrows(EvaluationException.class, x::getValue);
    }

    @Test
    public void testTypeNames() {
        assertEquals(VariableType.INT, VariableType.of("integer"));
        assertEquals(VariableType.BIN, VariableType.of("BIN"));
        assertEquals(VariableType.CONT, VariableType.of("cont"));
        assertThrows(ModelException.class, () -> VariableType.of("real"));
        assertEquals(Sense.MAX, Sense.of("Maximize"));
        assertEquals(Direction.G, Direction.of(">="));
        assertThrows(ModelException.class, () -> Direction.of("<"));
    }
}
