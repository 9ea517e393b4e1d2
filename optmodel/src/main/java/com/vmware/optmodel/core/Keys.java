/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Normalisation of group keys. Keys are always lists, even for one dimension, and integral numbers are
 * stored as {@link Integer} so that {@code 1}, {@code 1L} and {@code 1.0} find the same member.
 */
public final class Keys {
    public static final String WILDCARD = "*";

    private Keys() {
    }

    /**
     * @param components the key components, or a single list holding them
     * @return the normalised key
     */
    public static List<Object> of(final Object... components) {
        if (components.length == 1 && components[0] instanceof List) {
            return normalizeAll((List<?>) components[0]);
        }
        return normalizeAll(Arrays.asList(components));
    }

    public static List<Object> normalizeAll(final List<?> components) {
        final List<Object> key = new ArrayList<>(components.size());
        for (final Object component : components) {
            key.add(normalize(component));
        }
        return key;
    }

    public static Object normalize(final Object component) {
        if (component instanceof Integer) {
            return component;
        }
        if (component instanceof Long || component instanceof Short || component instanceof Byte) {
            final long value = ((Number) component).longValue();
            return value == (int) value ? Integer.valueOf((int) value) : component;
        }
        if (component instanceof Double || component instanceof Float) {
            final double value = ((Number) component).doubleValue();
            return value == Math.rint(value) && Math.abs(value) <= Integer.MAX_VALUE
                    ? Integer.valueOf((int) value) : component;
        }
        if (component instanceof List) {
            return ImmutableList.copyOf(normalizeAll((List<?>) component));
        }
        return component;
    }

    public static boolean isSymbolic(final Object component) {
        return component instanceof Expression && ((Expression) component).isAbstract();
    }

    public static boolean isAbstract(final List<Object> key) {
        return key.stream().anyMatch(Keys::isSymbolic);
    }

    /**
     * @return true if a component is a wildcard or a list of accepted values
     */
    public static boolean isFilter(final List<Object> key) {
        return key.stream().anyMatch(c -> WILDCARD.equals(c) || c instanceof Collection);
    }

    /**
     * Parses the text between the brackets of a member name such as {@code 1,'a'}
     */
    public static List<Object> parse(final String text) {
        final List<Object> key = new ArrayList<>();
        for (final String part : Splitter.on(',').trimResults().split(text)) {
            if (part.length() >= 2 && part.startsWith("'") && part.endsWith("'")) {
                key.add(part.substring(1, part.length() - 1).replace("''", "'"));
                continue;
            }
            try {
                key.add(Integer.valueOf(part));
            } catch (final NumberFormatException e) {
                try {
                    key.add(normalize(Double.valueOf(part)));
                } catch (final NumberFormatException notANumber) {
                    key.add(part);
                }
            }
        }
        return key;
    }
}
