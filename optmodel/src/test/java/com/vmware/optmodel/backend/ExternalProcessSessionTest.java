/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.backend;

import com.vmware.optmodel.SolverException;
import org.jooq.Record;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExternalProcessSessionTest {
    private static final String OUTPUT = "\n!!PRIMAL\nvar,value,lb,ub,rc\nx,1.5,0,10,0\ny[1],2,0,.,.\n" +
                                         "!!DUAL\ncon,value,dual\nc,3.5,1\n" +
                                         "!!SUMMARY\nkey,value\nstatus,OPTIMAL\nobjective,7.5\ntime,0.25";

    @Test
    public void testParseOutput() {
        final ExternalProcessSession session = new ExternalProcessSession(List.of("solver"));
        final SolverResponse response = session.parseOutput(OUTPUT);
        assertEquals(2, response.getPrimal().size());
        assertEquals(1, response.getDual().size());
        final Record second = response.getPrimal().get(1);
        assertEquals("y[1]", second.get("var"));
        assertEquals(".", second.get("rc"));
        assertEquals("c", response.getDual().get(0).get("con"));
        assertEquals("OPTIMAL", response.getStatus());
        assertEquals(7.5, response.getObjectiveValue());
        assertEquals(0.25, response.getSolutionTime());
    }

    @Test
    public void testUnknownTablesAreIgnored() {
        final ExternalProcessSession session = new ExternalProcessSession(List.of("solver"));
        final SolverResponse response = session.parseOutput("\n!!LOG\nline\nsolver started\n" +
                                                            "!!SUMMARY\nkey,value\nstatus,INFEASIBLE");
        assertEquals("INFEASIBLE", response.getStatus());
        assertNull(response.getObjectiveValue());
        assertTrue(response.getPrimal().isEmpty());
    }

    @Test
    public void testTableWithoutRows() {
        final ExternalProcessSession session = new ExternalProcessSession(List.of("solver"));
        assertThrows(SolverException.class, () -> session.parseOutput("\n!!PRIMAL"));
    }

    @Test
    public void testNoCommand() {
        assertThrows(IllegalArgumentException.class, () -> new ExternalProcessSession(List.of()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testSubmitRunsCommand() {
        final ExternalProcessSession session = new ExternalProcessSession(
                List.of("sh", "-c", "test -s \"$0\" && printf '!!PRIMAL\\nvar,value\\nx,4\\n\\n" +
                                    "!!SUMMARY\\nkey,value\\nstatus,OPTIMAL\\n'"));
        final SolverResponse response = session.submit("proc optmodel;\nquit;");
        assertEquals("OPTIMAL", response.getStatus());
        assertEquals(1, response.getPrimal().size());
        assertEquals("x", response.getPrimal().get(0).get("var"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testFailingCommand() {
        final ExternalProcessSession session = new ExternalProcessSession(
                List.of("sh", "-c", "echo 'license expired' >&2; exit 3"));
        final SolverException e = assertThrows(SolverException.class, () -> session.submit("proc optmodel;"));
        assertTrue(e.getMessage().contains("exited with error code 3"));
        assertTrue(e.getMessage().contains("license expired"));
    }
}
