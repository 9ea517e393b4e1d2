/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.base.Preconditions;

import java.util.AbstractList;

/**
 * An immutable arithmetic progression of integers, {@code start} inclusive and {@code stop} exclusive.
 * Used as a concrete index argument and rendered as {@code a..b} in generated code.
 */
public final class IntRange extends AbstractList<Integer> {
    private final int start;
    private final int stop;
    private final int step;

    private IntRange(final int start, final int stop, final int step) {
        Preconditions.checkArgument(step != 0, "Range step cannot be zero");
        this.start = start;
        this.stop = stop;
        this.step = step;
    }

    public static IntRange of(final int start, final int stop) {
        return new IntRange(start, stop, 1);
    }

    public static IntRange of(final int start, final int stop, final int step) {
        return new IntRange(start, stop, step);
    }

    /**
     * @return the range {@code 0..n-1}
     */
    public static IntRange upTo(final int n) {
        return new IntRange(0, n, 1);
    }

    @Override
    public Integer get(final int index) {
        Preconditions.checkElementIndex(index, size());
        return start + index * step;
    }

    @Override
    public int size() {
        if (step > 0) {
            return stop > start ? (stop - start + step - 1) / step : 0;
        }
        return start > stop ? (start - stop - step - 1) / -step : 0;
    }

    public int start() {
        return start;
    }

    public int step() {
        return step;
    }

    /**
     * @return the last element of the range
     */
    public int last() {
        Preconditions.checkState(!isEmpty(), "Range is empty");
        return get(size() - 1);
    }
}
