/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.codegen;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.vmware.optmodel.ModelException;
import com.vmware.optmodel.Registry;
import com.vmware.optmodel.core.IntRange;
import com.vmware.optmodel.core.Renderable;
import com.vmware.optmodel.symbolic.Condition;
import com.vmware.optmodel.symbolic.SetIterator;
import org.apache.commons.text.translate.CharSequenceTranslator;
import org.apache.commons.text.translate.LookupTranslator;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Utility class that converts names, keys, literals and collections into the strings used in OPTMODEL
 * programs
 */
public final class OptmodelString {
    public static final int INDENT = 3;
    static final String BIG = "constant('BIG')";
    private static final String MISSING = ".";
    private static final CharSequenceTranslator ESCAPE_QUOTES = new LookupTranslator(
            Map.<CharSequence, CharSequence>of("'", "''"));

    private OptmodelString() {
    }

    /**
     * Replaces every character that cannot appear in an identifier with an underscore
     */
    public static String safeString(final String text) {
        return text.replaceAll("[^A-Za-z0-9_]", "_");
    }

    /**
     * Renders a number rounded to the configured number of decimal places. Integral values have no
     * fraction, NaN is the missing value and infinities use the solver's BIG constant.
     */
    public static String formatNumber(final double value) {
        if (Double.isNaN(value)) {
            return MISSING;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? BIG : "-" + BIG;
        }
        final int digits = Registry.current().config().maxDigits();
        BigDecimal decimal = BigDecimal.valueOf(value);
        if (digits > 0) {
            decimal = decimal.setScale(digits, RoundingMode.HALF_EVEN);
        }
        decimal = decimal.stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }

    public static String formatNumber(final Number value) {
        if (isIntegral(value)) {
            return value.toString();
        }
        return formatNumber(value.doubleValue());
    }

    /**
     * Renders a key component: numbers as digits, strings single-quoted, tuples as {@code <a,b>} and
     * symbolic components by their expression.
     */
    public static String quoted(@Nullable final Object key) {
        if (key == null) {
            return MISSING;
        }
        if (key instanceof Renderable) {
            return ((Renderable) key).expr();
        }
        if (key instanceof Number) {
            return formatNumber((Number) key);
        }
        if (key instanceof String) {
            return "'" + ESCAPE_QUOTES.translate((String) key) + "'";
        }
        if (key instanceof List) {
            return "<" + joinQuoted((List<?>) key, ",") + ">";
        }
        return key.toString();
    }

    /**
     * Renders a value the way it appears on the right-hand side of a declaration or inside a loop header
     */
    public static String toSasString(@Nullable final Object value) {
        if (value == null) {
            return MISSING;
        }
        if (value instanceof Renderable) {
            return ((Renderable) value).expr();
        }
        if (value instanceof IntRange) {
            final IntRange range = (IntRange) value;
            if (range.isEmpty()) {
                return "{}";
            }
            final String bounds = range.start() + ".." + range.last();
            return range.step() == 1 ? bounds : bounds + " by " + range.step();
        }
        if (value instanceof Collection) {
            return "{" + joinQuoted((Collection<?>) value, ",") + "}";
        }
        return quoted(value);
    }

    /**
     * Renders an operand of an assignment or an option value. Strings are taken verbatim.
     */
    public static String render(@Nullable final Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        return quoted(value);
    }

    public static String relation(final String token) {
        switch (token.toUpperCase(Locale.US)) {
            case "E":
            case "EQ":
                return "=";
            case "NE":
                return "ne";
            case "LT":
                return "<";
            case "L":
            case "LE":
                return "<=";
            case "GT":
                return ">";
            case "G":
            case "GE":
                return ">=";
            case "IN":
                return "in";
            default:
                throw new ModelException("Unknown relation: " + token);
        }
    }

    /**
     * @return {@code prefix[k1,k2]}
     */
    public static String bracketName(final String prefix, final List<?> keys) {
        return prefix + "[" + joinQuoted(keys, ",") + "]";
    }

    /**
     * Prefixes every line of a block with {@code spaces} blanks
     */
    public static String indent(final String text, final int spaces) {
        final String padding = " ".repeat(spaces);
        return Splitter.on('\n').splitToStream(text)
                       .map(line -> line.isEmpty() ? line : padding + line)
                       .collect(Collectors.joining("\n"));
    }

    /**
     * @return {@code {i in S, j in T: cond1 and cond2}}
     */
    public static String loopHeader(final List<SetIterator> iterators) {
        final List<String> conditions = new ArrayList<>();
        for (final SetIterator iterator : iterators) {
            for (final Condition condition : iterator.getConditions()) {
                conditions.add(condition.expr());
            }
        }
        final String domains = iterators.stream().map(SetIterator::definition).collect(Collectors.joining(", "));
        return conditions.isEmpty()
                ? "{" + domains + "}"
                : "{" + domains + ": " + Joiner.on(" and ").join(conditions) + "}";
    }

    static boolean isIntegral(final Number value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    private static String joinQuoted(final Collection<?> values, final String separator) {
        return values.stream().map(OptmodelString::quoted).collect(Collectors.joining(separator));
    }
}
