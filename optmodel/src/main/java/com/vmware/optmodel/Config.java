/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.vmware.optmodel.core.Sense;
import com.vmware.optmodel.core.VariableType;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named options consulted while rendering. Values are kept as strings, overrides shadow the built-in
 * defaults and {@link #reset()} drops every override.
 */
public class Config {
    public static final String VERBOSITY = "verbosity";
    public static final String MAX_DIGITS = "max_digits";
    public static final String PRINT_DIGITS = "print_digits";
    public static final String VALID_OUTCOMES = "valid_outcomes";
    public static final String DEFAULT_SENSE = "default_sense";
    public static final String DEFAULT_BOUNDS_PREFIX = "default_bounds.";
    private static final String INFINITY = "inf";
    private static final Map<String, String> DEFAULTS = ImmutableMap.<String, String>builder()
            .put(VERBOSITY, "3")
            .put(MAX_DIGITS, "12")
            .put(PRINT_DIGITS, "6")
            .put(VALID_OUTCOMES, "OPTIMAL,ABSFCONV,BEST_FEASIBLE")
            .put(DEFAULT_SENSE, Sense.MIN.name())
            .put(DEFAULT_BOUNDS_PREFIX + VariableType.CONT.name(), "-inf:inf")
            .put(DEFAULT_BOUNDS_PREFIX + VariableType.INT.name(), "-inf:inf")
            .put(DEFAULT_BOUNDS_PREFIX + VariableType.BIN.name(), "0:1")
            .build();

    private final Map<String, String> overrides = new HashMap<>();

    @Nullable
    public String getProperty(final String key) {
        final String value = overrides.get(key);
        return value != null ? value : DEFAULTS.get(key);
    }

    public void setProperty(final String key, final String value) {
        overrides.put(key, value);
    }

    /**
     * Removes an override, falling back to the default value of the option
     *
     * @param key option name
     */
    public void remove(final String key) {
        if (overrides.remove(key) == null) {
            throw new ModelException("Invalid config key: " + key);
        }
    }

    public Set<String> keys() {
        final Set<String> keys = new TreeSet<>(DEFAULTS.keySet());
        keys.addAll(overrides.keySet());
        return keys;
    }

    public void reset() {
        overrides.clear();
    }

    public int verbosity() {
        return getInt(VERBOSITY);
    }

    public int maxDigits() {
        return getInt(MAX_DIGITS);
    }

    public int printDigits() {
        return getInt(PRINT_DIGITS);
    }

    public List<String> validOutcomes() {
        return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(getRequired(VALID_OUTCOMES));
    }

    public Sense defaultSense() {
        return Sense.of(getRequired(DEFAULT_SENSE));
    }

    public double defaultLowerBound(final VariableType type) {
        return parseBound(bounds(type).get(0));
    }

    public double defaultUpperBound(final VariableType type) {
        return parseBound(bounds(type).get(1));
    }

    private List<String> bounds(final VariableType type) {
        final List<String> bounds = Splitter.on(':').trimResults()
                                            .splitToList(getRequired(DEFAULT_BOUNDS_PREFIX + type.name()));
        if (bounds.size() != 2) {
            throw new ModelException("Default bounds for " + type + " must be written as lb:ub");
        }
        return bounds;
    }

    private int getInt(final String key) {
        final String value = getRequired(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new ModelException("Option " + key + " is not an integer: " + value, e);
        }
    }

    private String getRequired(final String key) {
        final String value = getProperty(key);
        if (value == null) {
            throw new ModelException("Invalid config key: " + key);
        }
        return value;
    }

    private static double parseBound(final String bound) {
        final String lower = bound.toLowerCase(Locale.US);
        if (lower.equals(INFINITY) || lower.equals("+" + INFINITY)) {
            return Double.POSITIVE_INFINITY;
        }
        if (lower.equals("-" + INFINITY)) {
            return Double.NEGATIVE_INFINITY;
        }
        return Double.parseDouble(lower);
    }

    @Override
    public String toString() {
        return "Config{" +
                "overrides=" + overrides +
                '}';
    }
}
