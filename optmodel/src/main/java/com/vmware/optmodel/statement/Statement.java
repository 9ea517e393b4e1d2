/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.vmware.optmodel.Registry;
import com.vmware.optmodel.core.Declarable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A program statement that is rendered as text instead of being executed. Statements are created in the
 * order they appear in the generated program.
 */
public abstract class Statement implements Declarable {
    protected final List<Object> operands = new ArrayList<>();
    private final int order;

    protected Statement() {
        this.order = Registry.current().nextOrder();
    }

    /**
     * @return the objects this statement refers to
     */
    public List<Object> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    @Override
    public int order() {
        return order;
    }

    @Override
    public abstract String definition();

    @Override
    public String toString() {
        return definition();
    }
}
