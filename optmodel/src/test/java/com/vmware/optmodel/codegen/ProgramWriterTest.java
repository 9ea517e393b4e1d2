/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.codegen;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ProgramWriterTest {
    private final ProgramWriter writer = new ProgramWriter();

    @Test
    public void testWithHeader() {
        assertEquals("proc optmodel;\n   var x;\n   con c : x <= 1;\nquit;",
                     writer.write(List.of("var x;", "con c : x <= 1;"), true));
    }

    @Test
    public void testMultiLineDefinitions() {
        assertEquals("proc optmodel;\n   for {i in S} do;\n      x[i] = 1;\n   end;\nquit;",
                     writer.write(List.of("for {i in S} do;\n   x[i] = 1;\nend;"), true));
    }

    @Test
    public void testWithoutHeader() {
        assertEquals("var x;\nsolve;", writer.write(List.of("var x;", "solve;"), false));
        assertEquals("proc optmodel;\nquit;", writer.write(List.of(), true));
        assertEquals("", writer.write(List.of(), false));
    }
}
