/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

import com.vmware.optmodel.core.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RegistryTest {

    @BeforeEach
    public void resetRegistry() {
        Registry.current().reset();
    }

    @Test
    public void testAssignName() {
        final Registry registry = Registry.current();
        assertEquals("o1", registry.assignName(null));
        assertEquals("o2", registry.assignName(""));
        assertEquals("a", registry.assignName("a"));
        registry.register("a", "first");
        assertEquals("a_1", registry.assignName("a"));
        registry.register("a_1", "second");
        assertEquals("a_2", registry.assignName("a"));
        assertEquals("unit_cost", registry.assignName("unit cost"));
        assertEquals("first", registry.lookup("a"));
    }

    @Test
    public void testGeneratedNamesSkipTakenOnes() {
        final Registry registry = Registry.current();
        registry.register("o2", "taken");
        assertEquals("o3", registry.assignName(null));
        assertEquals("TEMP1", registry.nextTemporaryName());
        assertEquals("TEMP2", registry.nextTemporaryName());
    }

    @Test
    public void testRenamedOnCollision() {
        final Variable first = new Variable("x");
        final Variable second = new Variable("x");
        assertEquals("x", first.getName());
        assertEquals("x_1", second.getName());
        assertSame(second, Registry.current().lookup("x_1"));
    }

    @Test
    public void testScopedRegistry() {
        final Registry outer = Registry.current();
        final Registry inner = new Registry();
        try (Registry.Scope scope = Registry.use(inner)) {
            assertSame(inner, Registry.current());
            new Variable("x");
            assertTrue(inner.contains("x"));
        }
        assertSame(outer, Registry.current());
        assertNotSame(outer, inner);
        assertFalse(outer.contains("x"));
        assertEquals(0, outer.size());
    }

    @Test
    public void testReset() {
        final Registry registry = Registry.current();
        new Variable("x");
        registry.config().setProperty(Config.MAX_DIGITS, "4");
        assertEquals(1, registry.size());
        registry.reset();
        assertEquals(0, registry.size());
        assertFalse(registry.contains("x"));
        assertEquals(12, registry.config().maxDigits());
        assertEquals(1, registry.nextOrder());
        assertTrue(registry.activeContainer().isEmpty());
    }
}
