/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.statement;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.vmware.optmodel.core.Renderable;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options of a {@code solve} statement. Built with {@link SolveOptions.Builder}.
 */
public final class SolveOptions {
    private static final SolveOptions DEFAULT = new Builder().build();

    @Nullable private final String solver;
    private final boolean relaxint;
    private final boolean primalin;
    private final List<Renderable> objectives;
    private final Map<String, Object> options;

    private SolveOptions(final Builder builder) {
        this.solver = builder.solver;
        this.relaxint = builder.relaxint;
        this.primalin = builder.primalin;
        this.objectives = ImmutableList.copyOf(builder.objectives);
        this.options = ImmutableMap.copyOf(builder.options);
    }

    public static SolveOptions defaults() {
        return DEFAULT;
    }

    @Nullable
    public String getSolver() {
        return solver;
    }

    public boolean isRelaxint() {
        return relaxint;
    }

    public boolean isPrimalin() {
        return primalin;
    }

    public List<Renderable> getObjectives() {
        return objectives;
    }

    /**
     * @return the solver options written after the slash, in insertion order
     */
    public Map<String, Object> getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "SolveOptions{" +
                "solver=" + solver +
                ", relaxint=" + relaxint +
                ", primalin=" + primalin +
                ", objectives=" + objectives +
                ", options=" + options +
                '}';
    }

    public static class Builder {
        @Nullable private String solver = null;
        private boolean relaxint = false;
        private boolean primalin = false;
        private final List<Renderable> objectives = new ArrayList<>();
        private final Map<String, Object> options = new LinkedHashMap<>();

        /**
         * @param solver the solver named by {@code with}, for instance {@code milp} or {@code nlp}
         */
        public Builder setSolver(@Nullable final String solver) {
            this.solver = solver;
            return this;
        }

        public Builder setRelaxint(final boolean relaxint) {
            this.relaxint = relaxint;
            return this;
        }

        /**
         * Starts from the current values of the variables
         */
        public Builder setPrimalin(final boolean primalin) {
            this.primalin = primalin;
            return this;
        }

        public Builder setObjectives(final Renderable... objectives) {
            this.objectives.clear();
            this.objectives.addAll(Arrays.asList(objectives));
            return this;
        }

        /**
         * @param key option name
         * @param value a Number, the verbatim option text, or a Map rendered as {@code key=(a=b,c=d)}
         */
        public Builder setOption(final String key, final Object value) {
            options.put(key, value);
            return this;
        }

        public SolveOptions build() {
            return new SolveOptions(this);
        }
    }
}
