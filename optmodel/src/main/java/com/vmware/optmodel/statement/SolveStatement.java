/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.core.Renderable;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@code [use problem m;\n]solve[ with s][ relaxint][ obj (a b)][ / k=v ... primalin];}
 */
public class SolveStatement extends Statement {
    @Nullable private final Renderable problem;
    private final SolveOptions options;

    /**
     * @param problem the problem to switch to before solving, null to solve the current one
     * @param options solve options
     */
    public SolveStatement(@Nullable final Renderable problem, final SolveOptions options) {
        this.problem = problem;
        this.options = options;
        if (problem != null) {
            operands.add(problem);
        }
    }

    @Nullable
    public Renderable getProblem() {
        return problem;
    }

    public SolveOptions getOptions() {
        return options;
    }

    @Override
    public String definition() {
        return render(problem, options);
    }

    /**
     * Renders a solve statement without creating one, for programs assembled outside a container
     */
    public static String render(@Nullable final Renderable problem, final SolveOptions options) {
        final StringBuilder sb = new StringBuilder();
        if (problem != null) {
            sb.append("use problem ").append(problem.expr()).append(";\n");
        }
        sb.append("solve");
        if (options.getSolver() != null) {
            sb.append(" with ").append(options.getSolver());
        }
        if (options.isRelaxint()) {
            sb.append(" relaxint");
        }
        if (!options.getObjectives().isEmpty()) {
            sb.append(" obj (")
              .append(options.getObjectives().stream().map(Renderable::expr).collect(Collectors.joining(" ")))
              .append(')');
        }
        final List<String> trailing = new ArrayList<>();
        for (final Map.Entry<String, Object> option : options.getOptions().entrySet()) {
            trailing.add(option.getKey() + "=" + renderOption(option.getValue()));
        }
        if (options.isPrimalin()) {
            trailing.add("primalin");
        }
        if (!trailing.isEmpty()) {
            sb.append(" / ").append(String.join(" ", trailing));
        }
        return sb.append(';').toString();
    }

    private static String renderOption(final Object value) {
        if (value instanceof Map) {
            return "(" + ((Map<?, ?>) value).entrySet().stream()
                    .map(e -> e.getKey() + "=" + renderOption(e.getValue()))
                    .collect(Collectors.joining(",")) + ")";
        }
        return OptmodelString.render(value);
    }
}
