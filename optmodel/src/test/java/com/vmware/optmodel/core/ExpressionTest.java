/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.vmware.optmodel.EvaluationException;
import com.vmware.optmodel.OperandTypeException;
import com.vmware.optmodel.Registry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExpressionTest {

    @BeforeEach
    public void resetRegistry() {
        Registry.current().reset();
    }

    @Test
    public void testLinearRendering() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        final Expression e = x.add(y.mult(2)).sub(3);
        assertEquals("x + 2 * y - 3", e.expr());
        assertTrue(e.isLinear());
        assertEquals(1.0, e.getCoef(x));
        assertEquals(2.0, e.getCoef("y"));
        assertEquals(-3.0, e.getConstant());
    }

    @Test
    public void testOperandsAreNotModified() {
        final Variable x = new Variable("x");
        final Expression scaled = x.mult(3);
        final Expression shifted = scaled.add(5);
        assertEquals("3 * x", scaled.expr());
        assertEquals("3 * x + 5", shifted.expr());
        assertEquals("x", x.expr());
        assertEquals(0.0, x.getConstant());
        assertEquals(0.0, scaled.getConstant());
    }

    @Test
    public void testNegativeTerms() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        assertEquals("y - x", y.sub(x).expr());
        assertEquals("- x", x.neg().expr());
        assertEquals("x - 2 * y", x.sub(y.mult(2)).expr());
        assertEquals("0", x.sub(x).expr());
    }

    @Test
    public void testSumOfItems() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        final Expression total = Expressions.sum(List.of(x, y, 2, x));
        assertEquals("2 * x + y + 2", total.expr());
        assertFalse(total.isTemporary());
    }

    @Test
    public void testAddThenSubtractRestoresCoefficients() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        final Variable z = new Variable("z");
        final Expression a = x.mult(2).add(y.mult(3)).add(1);
        final Expression b = z.mult(4).sub(2);
        final Expression roundTrip = a.add(b).sub(b);
        assertEquals(coefficients(a), coefficients(roundTrip));
        assertEquals(a.expr(), roundTrip.expr());
        assertEquals("2 * x + 3 * y + 1", roundTrip.expr());
    }

    @Test
    public void testMultiplyThenDivideRestoresCoefficients() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        final Expression a = x.mult(2).sub(y).add(5);
        final Expression roundTrip = a.mult(4).div(4);
        assertEquals(coefficients(a), coefficients(roundTrip));
        assertEquals("2 * x - y + 5", roundTrip.expr());
    }

    @Test
    public void testEvaluation() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        x.setValue(2);
        y.setValue(3);
        assertEquals(5.0, x.add(y.mult(2)).sub(3).getValue());
        assertEquals(6.0, x.mult(y).getValue());
        assertEquals(1.5, y.div(x).getValue());
    }

    @Test
    public void testProducts() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        final Expression product = x.mult(y);
        assertEquals("x * y", product.expr());
        assertFalse(product.isLinear());
        assertTrue(x.mult(4).isLinear());
    }

    @Test
    public void testMathFunctions() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        assertEquals("abs(x)", MathFunctions.abs(x).expr());
        assertEquals("max(x, y, 3)", MathFunctions.max(x, y, 3).expr());
        x.setValue(-2);
        y.setValue(1);
        assertEquals(2.0, MathFunctions.abs(x).getValue());
        assertEquals(3.0, MathFunctions.max(x, y, 3).getValue());
        assertEquals(-2.0, MathFunctions.min(x, y).getValue());
        assertFalse(MathFunctions.abs(x).isLinear());
        assertThrows(EvaluationException.class, () -> MathFunctions.sqrt(x).getValue());
    }

    @Test
    public void testInvalidOperands() {
        final Variable x = new Variable("x");
        assertThrows(OperandTypeException.class, () -> x.add("y"));
        assertThrows(OperandTypeException.class, () -> x.mult(List.of(1)));
        assertThrows(OperandTypeException.class, () -> x.le("z"));
        assertThrows(EvaluationException.class, () -> x.div(0));
    }

    @Test
    public void testRelations() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        final Constraint le = x.add(y.mult(2)).le(5);
        assertEquals("x + 2 * y <= 5", le.expr());
        assertEquals(Direction.L, le.getDirection());
        assertEquals(5.0, le.getRhs());
        assertEquals("x - y = 0", x.eq(y).expr());
        assertEquals("x >= 1", x.ge(1).expr());
        assertEquals("1 <= x <= 3", x.between(1, 3).expr());
    }

    @Test
    public void testNamedConstraint() {
        final Variable x = new Variable("x");
        final Variable y = new Variable("y");
        final Constraint c = new Constraint(x.add(y).ge(1), "c1");
        assertEquals("con c1 : x + y >= 1;", c.definition());
        assertTrue(x.getConstraints().contains(c));
        x.setValue(2);
        y.setValue(4);
        assertEquals(6.0, c.getValue());
        assertEquals(5.0, c.getValue(true));
        c.setRhs(3);
        assertEquals("con c1 : x + y >= 3;", c.definition());
        c.updateVarCoef(y, 4);
        assertEquals("con c1 : x + 4 * y >= 3;", c.definition());
    }

    @Test
    public void testBoundedVariableConstraints() {
        final Variable x = new Variable.Builder("x").setLb(0).setUb(10).build();
        assertEquals("var x >= 0 <= 10;", x.definition());
        assertEquals("con c : 2 * x <= 5;", new Constraint(x.mult(2).le(5), "c").definition());
        assertEquals("con c1 : 5 <= 3 * x <= 10;", new Constraint(x.mult(3).between(5, 10), "c1").definition());
    }

    @Test
    public void testLikeTermsCombine() {
        final Variable x = new Variable("x");
        final Expression e = x.mult(3).sub(x.mult(2)).add(5);
        assertEquals("x + 5", e.expr());
        assertEquals(1.0, e.getCoef(x));
    }

    @Test
    public void testSymbolicSum() {
        final Variable x = new Variable("x");
        final Expression sum = Expressions.sum(IntRange.of(0, 3), i -> x.mult(i));
        assertEquals("sum {TEMP1 in 0..2} (x * TEMP1)", sum.expr());
        assertTrue(sum.isAbstract());
    }

    @Test
    public void testNames() {
        final Variable first = new Variable("x");
        final Variable second = new Variable("x");
        final Variable unnamed = new Variable(null);
        assertEquals("x", first.getName());
        assertEquals("x_1", second.getName());
        assertTrue(unnamed.getName().startsWith("o"));
        assertTrue(first.order() < second.order());
        assertTrue(second.order() < unnamed.order());

        final Expression expression = first.mult(2);
        assertNull(expression.getName());
        assertEquals("e", expression.setName("e"));
        assertEquals("e", expression.setName(null));
    }

    private static Map<TermKey, Double> coefficients(final Expression expression) {
        expression.clean();
        final Map<TermKey, Double> coefs = new HashMap<>();
        for (final Map.Entry<TermKey, Term> member : expression.getMembers().entrySet()) {
            coefs.put(member.getKey(), member.getValue().getCoef());
        }
        return coefs;
    }
}
