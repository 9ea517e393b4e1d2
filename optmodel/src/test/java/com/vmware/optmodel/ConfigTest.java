/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

import com.vmware.optmodel.core.Objective;
import com.vmware.optmodel.core.Sense;
import com.vmware.optmodel.core.Variable;
import com.vmware.optmodel.core.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConfigTest {

    @BeforeEach
    public void resetRegistry() {
        Registry.current().reset();
    }

    @Test
    public void testDefaults() {
        final Config config = new Config();
        assertEquals(3, config.verbosity());
        assertEquals(12, config.maxDigits());
        assertEquals(6, config.printDigits());
        assertEquals(List.of("OPTIMAL", "ABSFCONV", "BEST_FEASIBLE"), config.validOutcomes());
        assertEquals(Sense.MIN, config.defaultSense());
        assertEquals(Double.NEGATIVE_INFINITY, config.defaultLowerBound(VariableType.CONT));
        assertEquals(Double.POSITIVE_INFINITY, config.defaultUpperBound(VariableType.INT));
        assertEquals(0, config.defaultLowerBound(VariableType.BIN));
        assertEquals(1, config.defaultUpperBound(VariableType.BIN));
        assertTrue(config.keys().contains(Config.VALID_OUTCOMES));
    }

    @Test
    public void testOverrides() {
        final Config config = new Config();
        config.setProperty(Config.VALID_OUTCOMES, " OPTIMAL , INFEASIBLE ");
        assertEquals(List.of("OPTIMAL", "INFEASIBLE"), config.validOutcomes());
        config.remove(Config.VALID_OUTCOMES);
        assertEquals(3, config.validOutcomes().size());
        assertThrows(ModelException.class, () -> config.remove(Config.VALID_OUTCOMES));
        assertThrows(ModelException.class, () -> config.remove("no_such_option"));
    }

    @Test
    public void testInvalidValues() {
        final Config config = new Config();
        config.setProperty(Config.MAX_DIGITS, "many");
        assertThrows(ModelException.class, config::maxDigits);
        config.setProperty(Config.DEFAULT_BOUNDS_PREFIX + VariableType.CONT.name(), "0");
        assertThrows(ModelException.class, () -> config.defaultLowerBound(VariableType.CONT));
    }

    @Test
    public void testDefaultBoundsApplyToNewVariables() {
        Registry.current().config().setProperty(Config.DEFAULT_BOUNDS_PREFIX + VariableType.CONT.name(), "0:inf");
        final Variable x = new Variable("x");
        assertEquals(0.0, x.getLb());
        assertEquals("var x >= 0;", x.definition());
    }

    @ParameterizedTest
    @CsvSource({"min,MIN", "Minimize,MIN", "MAX,MAX", "maximize,MAX"})
    public void testDefaultSense(final String option, final Sense expected) {
        Registry.current().config().setProperty(Config.DEFAULT_SENSE, option);
        assertEquals(expected, new Objective(1, "obj", null).getSense());
    }

    @Test
    public void testUnknownSense() {
        Registry.current().config().setProperty(Config.DEFAULT_SENSE, "sideways");
        assertThrows(ModelException.class, () -> Registry.current().config().defaultSense());
    }
}
