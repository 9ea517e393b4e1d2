/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class KeysTest {

    @Test
    public void testNormalize() {
        assertEquals(2, Keys.normalize(2.0));
        assertEquals(2, Keys.normalize(2L));
        assertEquals(2.5, Keys.normalize(2.5));
        assertEquals(List.of(1, "a"), Keys.normalize(List.of(1.0, "a")));
        assertEquals(List.of(1, "a"), Keys.of(List.of(1, "a")));
        assertEquals(List.of(1, "a"), Keys.of(1, "a"));
    }

    @Test
    public void testParse() {
        assertEquals(List.of(1, "a"), Keys.parse("1,'a'"));
        assertEquals(List.of(2.5, "it's"), Keys.parse("2.5, 'it''s'"));
        assertEquals(List.of("TEMP1"), Keys.parse("TEMP1"));
    }

    @Test
    public void testFilters() {
        assertTrue(Keys.isFilter(List.of(1, Keys.WILDCARD)));
        assertTrue(Keys.isFilter(List.of(List.of(1, 2), 3)));
        assertFalse(Keys.isFilter(List.of(1, "a")));
    }

    @Test
    public void testRanges() {
        assertEquals(List.of(0, 3, 6, 9), IntRange.of(0, 10, 3));
        assertEquals(List.of(3, 2, 1), IntRange.of(3, 0, -1));
        assertEquals(9, IntRange.of(0, 10, 3).last());
        assertTrue(IntRange.upTo(0).isEmpty());
        assertEquals(List.of(0, 1, 2), IntRange.upTo(3));
        assertThrows(IllegalArgumentException.class, () -> IntRange.of(0, 3, 0));
    }
}
