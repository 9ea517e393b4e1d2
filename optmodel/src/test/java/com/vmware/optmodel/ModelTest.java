/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

import com.vmware.optmodel.backend.ISolverSession;
import com.vmware.optmodel.backend.SolverResponse;
import com.vmware.optmodel.container.ContainerScope;
import com.vmware.optmodel.core.Constraint;
import com.vmware.optmodel.core.ConstraintGroup;
import com.vmware.optmodel.core.Sense;
import com.vmware.optmodel.core.Variable;
import com.vmware.optmodel.core.VariableGroup;
import com.vmware.optmodel.core.VariableType;
import com.vmware.optmodel.statement.SolveOptions;
import com.vmware.optmodel.symbolic.ModelSet;
import org.jooq.Record;
import org.jooq.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModelTest {
    private static final String PRODUCTION_PROGRAM = "proc optmodel;\n" +
                                                     "   var x >= 0;\n" +
                                                     "   var y >= 0;\n" +
                                                     "   con c1 : x + y <= 10;\n" +
                                                     "   max profit = 3 * x + 2 * y;\n" +
                                                     "   solve;\n" +
                                                     "quit;";

    @BeforeEach
    public void resetRegistry() {
        Registry.current().reset();
    }

    /**
     * Two products sharing one capacity constraint
     */
    private static Model productionModel(final ISolverSession session) {
        final Model model = new Model("m", session);
        final Variable x = model.addVariable(new Variable.Builder("x").setLb(0));
        final Variable y = model.addVariable(new Variable.Builder("y").setLb(0));
        model.addConstraint(x.add(y).le(10), "c1");
        model.setObjective(x.mult(3).add(y.mult(2)), "profit", Sense.MAX);
        return model;
    }

    private static SolverResponse optimalResponse() {
        return new SolverResponse.Builder()
                .addPrimal("x", 10, 0.0)
                .addPrimal("y", 0, -1.0)
                .addDual("c1", 10, 3)
                .setStatus("OPTIMAL")
                .setObjectiveValue(30.0)
                .setSolutionTime(0.01)
                .build();
    }

    @Test
    public void testProgram() {
        final Model model = productionModel(program -> optimalResponse());
        assertEquals(PRODUCTION_PROGRAM, model.toOptmodel());
        assertEquals("problem m include x y c1 profit;", model.definition());
        assertTrue(model.isLinear());
        assertFalse(model.hasIntegerVariables());
    }

    @Test
    public void testSolve() {
        final List<String> submitted = new ArrayList<>();
        final Model model = productionModel(program -> {
            submitted.add(program);
            return optimalResponse();
        });
        final Result<Record> solution = model.solve(SolveOptions.defaults()).result();
        assertNotNull(solution);
        assertEquals(2, solution.size());
        assertEquals(1, submitted.size());
        assertTrue(submitted.get(0).contains("   solve;\n   " + Model.PRIMAL_TABLE_STATEMENT));
        assertTrue(submitted.get(0).endsWith(Model.DUAL_TABLE_STATEMENT + "\nquit;"));

        final Variable x = model.getVariable("x");
        assertNotNull(x);
        assertEquals(10, x.getValue());
        assertEquals(0.0, x.getDual());
        assertEquals(-1.0, model.getVariable("y").getDual());
        assertEquals(3.0, model.getConstraint("c1").getDual());
        assertEquals(30, model.getObjectiveValue());
        assertEquals("OPTIMAL", model.getSolutionStatus());
        assertEquals(0.01, model.getSolutionTime());
        assertEquals(1, model.getDualSolution().size());

        model.clearSolution();
        assertFalse(x.hasValue());
        assertNull(model.getSolution());
        assertNull(model.getSolutionStatus());
    }

    @Test
    public void testSummaries() {
        final Model model = productionModel(program -> optimalResponse());
        model.addVariable(new Variable.Builder("z").setType(VariableType.INT));
        final Result<Record> problem = model.getProblemSummary();
        assertEquals(6, problem.size());
        assertEquals("Problem Name", problem.get(0).get(Model.SUMMARY_LABEL));
        assertEquals("m", problem.get(0).get(Model.SUMMARY_VALUE));
        assertEquals("Maximization", problem.get(1).get(Model.SUMMARY_VALUE));
        assertEquals("profit", problem.get(2).get(Model.SUMMARY_VALUE));
        assertEquals("3", problem.get(3).get(Model.SUMMARY_VALUE));
        assertEquals("1", problem.get(4).get(Model.SUMMARY_VALUE));
        assertEquals("1", problem.get(5).get(Model.SUMMARY_VALUE));
        assertThrows(ModelException.class, model::getSolutionSummary);

        model.solve(SolveOptions.defaults());
        final Result<Record> solution = model.getSolutionSummary();
        assertEquals(4, solution.size());
        assertEquals("profit", solution.get(0).get(Model.SUMMARY_VALUE));
        assertEquals("OPTIMAL", solution.get(1).get(Model.SUMMARY_VALUE));
        assertEquals("30", solution.get(2).get(Model.SUMMARY_VALUE));
        assertEquals("0.01", solution.get(3).get(Model.SUMMARY_VALUE));
    }

    @Test
    public void testVariableValueByName() {
        final Model model = productionModel(program -> optimalResponse());
        model.solve(SolveOptions.defaults());
        assertEquals(10, model.getVariableValue("x"));
        assertEquals(0, model.getVariableValue(model.getVariable("y")));
        assertThrows(ReferenceException.class, () -> model.getVariableValue("z"));
    }

    @Test
    public void testSetVariableCoef() {
        final Model model = productionModel(program -> optimalResponse());
        final Variable x = model.getVariable("x");
        final Constraint c1 = model.getConstraint("c1");
        model.setVariableCoef(x, 5);
        model.setVariableCoef(x, c1, 2);
        assertEquals("max profit = 5 * x + 2 * y;", model.getObjective().definition());
        assertEquals("con c1 : 2 * x + y <= 10;", c1.definition());

        final Variable w = new Variable("w");
        model.setVariableCoef(w, c1, 1);
        assertEquals("con c1 : 2 * x + y + w <= 10;", c1.definition());
        assertTrue(w.getConstraints().contains(c1));
        assertThrows(ReferenceException.class,
                     () -> model.setVariableCoef(x, new Constraint(x.le(1), "other"), 1));
    }

    @Test
    public void testObjectiveValueWithoutSolve() {
        final Model model = productionModel(program -> optimalResponse());
        model.setVariableValue("x", 2);
        model.setVariableValue("y", 1);
        assertEquals(8, model.getObjectiveValue());
        assertThrows(ReferenceException.class, () -> model.setVariableValue("z", 1));
    }

    @Test
    public void testRejectedStatus() {
        final Model model = productionModel(program -> new SolverResponse.Builder().setStatus("INFEASIBLE")
                                                                                   .build());
        final SolverException e = assertThrows(SolverException.class,
                                               () -> model.solve(SolveOptions.defaults()));
        assertEquals("INFEASIBLE", e.status());
        assertEquals("INFEASIBLE", model.getSolutionStatus());
        assertNull(model.getSolution());
    }

    @Test
    public void testAcceptedStatusesAreConfigurable() {
        Registry.current().config().setProperty(Config.VALID_OUTCOMES, "OPTIMAL,INFEASIBLE");
        final Model model = productionModel(program -> new SolverResponse.Builder().setStatus("INFEASIBLE")
                                                                                   .build());
        model.solve(SolveOptions.defaults());
        assertEquals("INFEASIBLE", model.getSolutionStatus());
    }

    @Test
    public void testSolveWithoutSession() {
        final Model model = new Model("m");
        model.addVariable("x");
        assertThrows(SolverException.class, () -> model.solve(SolveOptions.defaults()));
    }

    @Test
    public void testSolveWithExplicitSession() {
        final Model model = new Model("m");
        model.addVariable("x");
        model.solve(program -> new SolverResponse.Builder().addPrimal("x", 4, null).setStatus("OPTIMAL")
                                                          .build(), SolveOptions.defaults());
        assertEquals(4, model.getVariable("x").getValue());
    }

    @Test
    public void testInfiniteConstants() {
        final Model model = new Model("m");
        final Variable x = model.addVariable("x");
        assertThrows(ModelException.class, () -> model.addConstraint(x.le(Double.POSITIVE_INFINITY), "c"));
        assertThrows(ModelException.class, () -> model.addConstraint(x.ge(Double.NEGATIVE_INFINITY), "c"));
        assertTrue(model.getConstraints().isEmpty());
    }

    @Test
    public void testDropAndRestore() {
        final Model model = productionModel(program -> optimalResponse());
        final Constraint c1 = model.getConstraint("c1");
        assertNotNull(c1);
        model.dropConstraint(c1);
        assertTrue(model.isDropped(c1));
        assertNull(model.getConstraint("c1"));
        assertTrue(model.getConstraints().isEmpty());
        assertFalse(model.toOptmodel().contains("con c1"));
        assertEquals("problem m include x y profit;", model.definition());

        model.restoreConstraint(c1);
        assertFalse(model.isDropped(c1));
        assertEquals(PRODUCTION_PROGRAM, model.toOptmodel());

        final Variable y = model.getVariable("y");
        model.dropVariable(y);
        assertNull(model.getVariable("y"));
        assertEquals(1, model.getVariables().size());
        model.restoreVariable(y);
        assertEquals(2, model.getVariables().size());
    }

    @Test
    public void testDropGroupMember() {
        final Model model = new Model("m");
        final Variable x = model.addVariable("x");
        final ConstraintGroup d = model.addConstraints("d", key -> x.le((Integer) key.get(0) + 1), 2);
        model.drop(d.get(1));
        final ProgramOptions options = new ProgramOptions().setHeader(false).setSolve(false).setCreationOrder(false);
        assertEquals("var x;\n" +
                     "con d_0 : x <= 1;\n" +
                     "con d_1 : x <= 2;\n" +
                     "min m_obj = 0;\n" +
                     "drop d_1;",
                     model.toOptmodel(options));
        assertEquals(1, model.getConstraints().size());
        assertNotNull(model.getConstraint("d_0"));
        assertNotNull(model.getConstraint("d[0]"));
        assertNull(model.getConstraint("d[1]"));
        model.restore(d.get(1));
        assertEquals(2, model.getConstraints().size());
    }

    @Test
    public void testDropUnknownObject() {
        final Model model = new Model("m");
        final Variable z = new Variable("z");
        final ModelException e = assertThrows(ModelException.class, () -> model.drop(z));
        assertEquals("z is not part of model m", e.getMessage());
        model.restore(z);
        assertEquals(z, model.getVariable("z"));
    }

    @Test
    public void testVariableCoefficients() {
        final Model model = productionModel(program -> optimalResponse());
        final Map<String, Double> coefs = model.getVariableCoef(model.getVariable("x"));
        assertEquals(Map.of("profit", 3.0, "c1", 1.0), coefs);
    }

    @Test
    public void testGroupedVariables() {
        final Model model = new Model("m");
        final VariableGroup x = model.addVariables(new VariableGroup.Builder("x").setIndex(2)
                                                                                .setType(VariableType.BIN));
        model.addVariable("y");
        assertEquals(List.of("x", "y"), new ArrayList<>(model.getGroupedVariables().keySet()));
        assertEquals(3, model.getVariables().size());
        assertEquals(x.get(1), model.getVariable("x[1]"));
        assertTrue(model.hasIntegerVariables());
    }

    @Test
    public void testCanonicalOrder() {
        final Model model = new Model("m");
        final Variable x = new Variable("x");
        final ModelSet s = new ModelSet("S");
        model.include(x, s);
        final ProgramOptions options = new ProgramOptions().setHeader(false).setSolve(false);
        assertEquals("min m_obj = 0;\nvar x;\nset S;", model.toOptmodel(options));
        assertEquals("set S;\nvar x;\nmin m_obj = 0;", model.toOptmodel(options.setCreationOrder(false)));
    }

    @Test
    public void testIncludeModel() {
        final Model base = productionModel(program -> optimalResponse());
        final Model copy = new Model("copy");
        copy.include(base);
        assertEquals("problem copy include x y c1 profit;", copy.definition());
        assertEquals(2, copy.getVariables().size());
        assertEquals("problem empty;", new Model("empty").definition());
        assertThrows(ModelException.class, () -> copy.include("text"));
    }

    @Test
    public void testMultipleObjectives() {
        final Model model = productionModel(program -> optimalResponse());
        final Variable x = model.getVariable("x");
        model.appendObjective(x, "second", Sense.MIN);
        assertEquals(2, model.getAllObjectives().size());
        assertTrue(model.toOptmodel().contains("   max profit = 3 * x + 2 * y;\n   min second = x;\n"));
        model.setObjective(x, "only", null);
        assertEquals(1, model.getAllObjectives().size());
        assertEquals("min only = x;", model.getObjective().definition());
    }

    @Test
    public void testIncludeAfterModelInWorkspace() {
        final Workspace workspace = new Workspace("w");
        try (ContainerScope scope = workspace.enter()) {
            final Variable before = new Variable("before");
            final Model model = new Model("m");
            final Variable after = new Variable("after");
            model.include(before);
            final ReferenceException e = assertThrows(ReferenceException.class, () -> model.include(after));
            assertEquals("Object after should be defined before Model m inside a Workspace", e.getMessage());
        }
    }

    @Test
    public void testDeterministicNames() {
        final String first = unnamedModel().toOptmodel();
        Registry.current().reset();
        final String second = unnamedModel().toOptmodel();
        assertEquals(first, second);
        assertTrue(first.contains("var o3;"));
    }

    private static Model unnamedModel() {
        final Model model = new Model("m");
        final Variable v = model.addVariable(new Variable.Builder(null));
        model.addConstraint(v.ge(1), null);
        return model;
    }
}
