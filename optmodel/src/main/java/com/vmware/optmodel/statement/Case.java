/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.container.Container;
import com.vmware.optmodel.container.ContainerScope;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.core.Declarable;
import com.vmware.optmodel.core.Renderable;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One branch of an {@link IfElseStatement}: {@code if}, {@code else if} or {@code else}
 */
public class Case extends Statement implements Container {
    private final String keyword;
    @Nullable private final Renderable condition;
    private final List<Declarable> children = new ArrayList<>();

    Case(final String keyword, @Nullable final Renderable condition) {
        this.keyword = keyword;
        this.condition = condition;
        if (condition != null) {
            operands.add(condition);
        }
    }

    /**
     * Records the branch body with this case as the active container
     */
    void run(final Runnable body) {
        try (ContainerScope ignored = Containers.enter(this)) {
            body.run();
        }
    }

    public String getKeyword() {
        return keyword;
    }

    @Nullable
    public Renderable getCondition() {
        return condition;
    }

    @Override
    public void append(final Declarable element) {
        children.add(element);
    }

    @Override
    public List<Declarable> getElements() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String definition() {
        final StringBuilder sb = new StringBuilder(keyword).append(' ');
        if (condition != null) {
            sb.append(condition.expr()).append(" then do;\n");
        } else {
            sb.append("do;\n");
        }
        final String body = children.stream()
                                    .map(Declarable::definition)
                                    .filter(Objects::nonNull)
                                    .collect(Collectors.joining("\n"));
        if (!body.isEmpty()) {
            sb.append(OptmodelString.indent(body, OptmodelString.INDENT)).append('\n');
        }
        return sb.append("end;").toString();
    }
}
