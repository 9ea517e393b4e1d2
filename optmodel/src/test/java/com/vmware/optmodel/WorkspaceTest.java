/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

import com.vmware.optmodel.backend.SolverResponse;
import com.vmware.optmodel.container.ContainerScope;
import com.vmware.optmodel.core.Constraint;
import com.vmware.optmodel.core.Variable;
import com.vmware.optmodel.core.VariableGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class WorkspaceTest {
    private static final String PROGRAM = "proc optmodel;\n" +
                                          "   var x >= 0;\n" +
                                          "   var y {{0,1}};\n" +
                                          "   con c : x + y[0] <= 4;\n" +
                                          "quit;";

    @BeforeEach
    public void resetRegistry() {
        Registry.current().reset();
    }

    @Test
    public void testSubmit() {
        final List<String> submitted = new ArrayList<>();
        final Workspace workspace = new Workspace("w", program -> {
            submitted.add(program);
            return new SolverResponse.Builder()
                    .addPrimal("x", 1, null)
                    .addPrimal("y[0]", 2, null)
                    .addPrimal("y[1]", 5, null)
                    .addPrimal("unknown", 3, null)
                    .addDual("c", 1, 0.5)
                    .setStatus("OPTIMAL")
                    .build();
        });
        final Variable x;
        final VariableGroup y;
        final Constraint c;
        try (ContainerScope scope = workspace.enter()) {
            x = new Variable.Builder("x").setLb(0).build();
            y = new VariableGroup("y", 2);
            c = new Constraint(x.add(y.get(0)).le(4), "c");
        }
        assertEquals(3, workspace.getElements().size());
        assertEquals(PROGRAM, workspace.toOptmodel());

        final SolverResponse response = workspace.submit();
        assertEquals(List.of(PROGRAM), submitted);
        assertSame(response, workspace.getResponse());
        assertEquals(1, x.getValue());
        assertEquals(5, y.get(1).getValue());
        assertEquals(0.5, c.getDual());
        assertEquals(3, c.getValue());
    }

    @Test
    public void testSubmitWithoutSession() {
        final Workspace workspace = new Workspace("w");
        assertNull(workspace.getResponse());
        assertThrows(SolverException.class, workspace::submit);
    }

    @Test
    public void testVariableLookup() {
        final Workspace workspace = new Workspace("w");
        try (ContainerScope scope = workspace.enter()) {
            new Variable("x");
            new VariableGroup("y", List.of("a", "b"));
        }
        assertNotNull(workspace.getVariable("x"));
        assertEquals("y['b']", workspace.getVariable("y['b']").getName());
        assertNull(workspace.getVariable("z"));
        workspace.setVariableValue("y['a']", 5);
        assertEquals(5, workspace.getVariable("y['a']").getValue());
        assertThrows(ReferenceException.class, () -> workspace.setVariableValue("z", 1));
    }

    @Test
    public void testIdentity() {
        final Workspace workspace = new Workspace("w");
        assertEquals("Workspace[ID=1]", workspace.toString());
        assertEquals("w", workspace.getName());
    }
}
