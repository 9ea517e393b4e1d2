/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.OperandTypeException;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.symbolic.SetIterator;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * A relation {@code body direction rhs}, stored as {@code body - rhs} compared against zero. The right-hand
 * side is therefore the negated constant of the expression.
 */
public class Constraint extends Expression implements Declarable {
    private Direction direction;
    private double range;
    @Nullable private Integer block;
    @Nullable private final ConstraintGroup parent;
    @Nullable private final List<Object> key;
    private final List<SetIterator> loopIterators;

    /**
     * Unnamed relation produced by comparing expressions
     */
    Constraint(final Expression body, final Direction direction, final double range) {
        this.direction = direction;
        this.range = range;
        this.parent = null;
        this.key = null;
        this.loopIterators = ImmutableList.of();
        copyMembers(body);
    }

    /**
     * Creates a named constraint from a relation such as {@code x.mult(2).le(5)}
     *
     * @param relation the relation
     * @param name requested name, generated if null
     */
    public Constraint(final Constraint relation, @Nullable final String name) {
        this(relation, relation.direction, relation.range, name);
    }

    public Constraint(final Expression body, final Direction direction, @Nullable final String name) {
        this(body, direction, 0, name);
    }

    public Constraint(final Expression body, final Direction direction, final double range,
                      @Nullable final String name) {
        this.direction = direction;
        this.range = range;
        this.parent = null;
        this.key = null;
        this.loopIterators = ImmutableList.of();
        copyMembers(body);
        register(name);
        tagVariables();
        Containers.record(this);
    }

    /**
     * Member of a constraint group. Symbolic members carry the iterators of their loop and share the
     * name of their group, so they are not registered.
     */
    Constraint(final Constraint relation, final ConstraintGroup parent, final List<Object> key,
               final String memberName, final List<SetIterator> loopIterators) {
        this.direction = relation.direction;
        this.range = relation.range;
        this.parent = parent;
        this.key = key;
        this.loopIterators = ImmutableList.copyOf(loopIterators);
        copyMembers(relation);
        if (loopIterators.isEmpty()) {
            register(memberName);
        } else {
            this.name = memberName;
        }
        tagVariables();
    }

    /**
     * Reference to a member of a symbolic group, see {@link ShadowConstraint}
     */
    Constraint(final ConstraintGroup parent, final List<Object> key, final String referenceName) {
        this.direction = Direction.E;
        this.parent = parent;
        this.key = key;
        this.loopIterators = ImmutableList.of();
        this.name = referenceName;
        this.isAbstract = true;
    }

    static Constraint fromRelation(final Expression left, final Direction direction, final Object right) {
        if (!(right instanceof Number) && !(right instanceof Expression)) {
            throw new OperandTypeException("comparison", right);
        }
        final Expression body = left.getOperator() != null ? wrap(left) : left.copy();
        body.temporary = true;
        final Expression difference = body.sub(right);
        difference.temporary = false;
        return new Constraint(difference, direction, 0);
    }

    static Constraint fromRange(final Expression body, final double lo, final double hi) {
        final Expression shifted = body.getOperator() != null ? wrap(body) : body.copy();
        final Expression difference = shifted.sub(Math.min(lo, hi));
        return new Constraint(difference, Direction.E, Math.abs(hi - lo));
    }

    private void copyMembers(final Expression body) {
        members.clear();
        for (final Map.Entry<TermKey, Term> entry : body.members.entrySet()) {
            members.put(entry.getKey(), entry.getValue().scaled(1));
        }
        isAbstract = body.isAbstract;
    }

    private void tagVariables() {
        for (final Term term : members.values()) {
            for (final Expression ref : term.getRefs()) {
                if (ref instanceof Variable) {
                    ((Variable) ref).tagConstraint(this);
                }
            }
        }
    }

    public Direction getDirection() {
        return direction;
    }

    public void setDirection(final Direction direction) {
        this.direction = direction;
    }

    /**
     * @param token one of {@code E}, {@code L} or {@code G}
     */
    public void setDirection(final String token) {
        this.direction = Direction.of(token);
    }

    public double getRange() {
        return range;
    }

    public double getRhs() {
        return -getConstant();
    }

    public void setRhs(final double rhs) {
        members.get(TermKey.CONST).setCoef(-rhs);
    }

    @Nullable
    public Integer getBlock() {
        return block;
    }

    public void setBlock(final int block) {
        this.block = block;
    }

    @Nullable
    public ConstraintGroup getParent() {
        return parent;
    }

    @Nullable
    public List<Object> getKey() {
        return key;
    }

    public List<SetIterator> getLoopIterators() {
        return loopIterators;
    }

    @Override
    public void updateVarCoef(final Variable variable, final double coef) {
        super.updateVarCoef(variable, coef);
        variable.tagConstraint(this);
    }

    /**
     * @param rhs if true the value is {@code body - rhs}, otherwise the value of the body alone
     */
    public double getValue(final boolean rhs) {
        final double value = super.getValue();
        return rhs ? value : value - getConstant();
    }

    @Override
    public double getValue() {
        return getValue(false);
    }

    @Override
    protected boolean renderConstant() {
        return false;
    }

    private String renderLeft() {
        for (final Term term : members.values()) {
            if (!term.isConstant() && term.getCoef() != 0) {
                return renderBody();
            }
        }
        return "0";
    }

    /**
     * @return the relation as it appears after the {@code con name :} prefix
     */
    @Override
    public String expr() {
        final double rhs = -getConstant();
        if (range != 0) {
            return OptmodelString.formatNumber(rhs) + " <= " + renderLeft() + " <= "
                    + OptmodelString.formatNumber(rhs + range);
        }
        return renderLeft() + " " + direction.relation() + " " + OptmodelString.formatNumber(rhs);
    }

    @Override
    protected boolean isAtomic() {
        return false;
    }

    @Nullable
    @Override
    public String definition() {
        final StringBuilder sb = new StringBuilder("con ").append(name);
        if (!loopIterators.isEmpty()) {
            sb.append(' ').append(OptmodelString.loopHeader(loopIterators));
        }
        return sb.append(" : ").append(expr()).append(';').toString();
    }
}
