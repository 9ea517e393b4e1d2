/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.backend;

import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;

import javax.annotation.Nullable;

/**
 * The outcome of a submitted program: the primal table ({@code var}, {@code value} and optionally
 * {@code lb}, {@code ub}, {@code rc}), the dual table ({@code con}, {@code value}, {@code dual}), the
 * solution status, the objective value and the solution time.
 */
public final class SolverResponse {
    public static final Field<String> VAR = DSL.field(DSL.name("var"), String.class);
    public static final Field<String> CON = DSL.field(DSL.name("con"), String.class);
    public static final Field<Double> VALUE = DSL.field(DSL.name("value"), Double.class);
    public static final Field<Double> RC = DSL.field(DSL.name("rc"), Double.class);
    public static final Field<Double> DUAL = DSL.field(DSL.name("dual"), Double.class);

    private final Result<Record> primal;
    private final Result<Record> dual;
    @Nullable private final String status;
    @Nullable private final Double objectiveValue;
    private final double solutionTime;

    private SolverResponse(final Builder builder) {
        this.primal = builder.primal;
        this.dual = builder.dual;
        this.status = builder.status;
        this.objectiveValue = builder.objectiveValue;
        this.solutionTime = builder.solutionTime;
    }

    public Result<Record> getPrimal() {
        return primal;
    }

    public Result<Record> getDual() {
        return dual;
    }

    @Nullable
    public String getStatus() {
        return status;
    }

    @Nullable
    public Double getObjectiveValue() {
        return objectiveValue;
    }

    public double getSolutionTime() {
        return solutionTime;
    }

    @Override
    public String toString() {
        return "SolverResponse{" +
                "status=" + status +
                ", objectiveValue=" + objectiveValue +
                ", solutionTime=" + solutionTime +
                ", primal=" + primal.size() + " rows" +
                ", dual=" + dual.size() + " rows" +
                '}';
    }

    public static class Builder {
        private final DSLContext dslContext = DSL.using(SQLDialect.DEFAULT);
        private Result<Record> primal = dslContext.newResult(new Field<?>[] {VAR, VALUE, RC});
        private Result<Record> dual = dslContext.newResult(new Field<?>[] {CON, VALUE, DUAL});
        @Nullable private String status = null;
        @Nullable private Double objectiveValue = null;
        private double solutionTime = 0;

        public Builder setPrimal(final Result<Record> primal) {
            this.primal = primal;
            return this;
        }

        public Builder setDual(final Result<Record> dual) {
            this.dual = dual;
            return this;
        }

        /**
         * Appends a row to the primal table built by this builder
         */
        public Builder addPrimal(final String name, final double value, @Nullable final Double rc) {
            final Record record = dslContext.newRecord(VAR, VALUE, RC);
            record.set(VAR, name);
            record.set(VALUE, value);
            record.set(RC, rc);
            primal.add(record);
            return this;
        }

        /**
         * Appends a row to the dual table built by this builder
         */
        public Builder addDual(final String name, final double value, final double dualValue) {
            final Record record = dslContext.newRecord(CON, VALUE, DUAL);
            record.set(CON, name);
            record.set(VALUE, value);
            record.set(DUAL, dualValue);
            dual.add(record);
            return this;
        }

        public Builder setStatus(@Nullable final String status) {
            this.status = status;
            return this;
        }

        public Builder setObjectiveValue(@Nullable final Double objectiveValue) {
            this.objectiveValue = objectiveValue;
            return this;
        }

        public Builder setSolutionTime(final double solutionTime) {
            this.solutionTime = solutionTime;
            return this;
        }

        public SolverResponse build() {
            return new SolverResponse(this);
        }
    }
}
