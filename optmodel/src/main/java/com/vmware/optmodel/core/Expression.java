/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.core;

import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.EvaluationException;
import com.vmware.optmodel.OperandTypeException;
import com.vmware.optmodel.Registry;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.symbolic.Condition;
import com.vmware.optmodel.symbolic.SetIterator;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A linear or nonlinear algebraic expression over variables, parameters and iterators.
 *
 * The members of an expression are kept in insertion order and keyed by {@link TermKey}. The
 * {@link TermKey#CONST} member is always present. Arithmetic returns a new expression unless the receiver
 * is a temporary accumulator, in which case it is updated in place. A non-temporary operand is never
 * modified.
 */
public class Expression implements Renderable {
    protected final LinkedHashMap<TermKey, Term> members = new LinkedHashMap<>();
    protected final List<Object> arguments = new ArrayList<>();
    protected final List<SetIterator> iterkey = new ArrayList<>();
    @Nullable protected String name;
    @Nullable protected MathFunction operator;
    @Nullable protected Double dual;
    protected int order = 0;
    protected boolean temporary = false;
    protected boolean isAbstract = false;

    public Expression() {
        members.put(TermKey.CONST, Term.constant(0));
    }

    public Expression(final double constant) {
        this();
        members.get(TermKey.CONST).setCoef(constant);
    }

    /**
     * Creates an empty expression registered under a name
     *
     * @param name requested name, renamed on a collision
     */
    public Expression(final String name) {
        this();
        register(name);
    }

    protected final void register(@Nullable final String requested) {
        final Registry registry = Registry.current();
        this.name = registry.assignName(requested);
        this.order = registry.register(this.name, this);
    }

    /**
     * Makes this expression its own single member, for named symbols such as variables and parameters
     */
    protected final void referenceSelf() {
        members.put(TermKey.of(name), Term.single(this, 1));
    }

    /**
     * @return a temporary accumulator that is updated in place by {@link #add(Object)} and
     *         {@link #mult(Object)}
     */
    public static Expression temporary() {
        final Expression expression = new Expression();
        expression.temporary = true;
        return expression;
    }

    // Arithmetic

    public Expression add(final Object other) {
        return add(other, 1);
    }

    public Expression sub(final Object other) {
        return add(other, -1);
    }

    /**
     * Adds {@code sign * other} to this expression
     *
     * @param other a Number or an Expression
     * @param sign factor applied to the operand
     * @return the sum, which is this expression if it is a temporary accumulator
     */
    public Expression add(final Object other, final double sign) {
        if (!(other instanceof Expression) && !(other instanceof Number)) {
            throw new OperandTypeException("addition", other);
        }
        final Expression result;
        if (isInPlace()) {
            result = this;
        } else if (operator != null) {
            result = wrap(this);
        } else {
            result = copy();
        }
        if (other instanceof Number) {
            final Term constant = result.members.get(TermKey.CONST);
            constant.setCoef(constant.getCoef() + sign * ((Number) other).doubleValue());
            return result;
        }
        final Expression operand = (Expression) other;
        if (operand.isAbstract) {
            result.isAbstract = true;
        }
        if (operand.operator != null) {
            result.accumulate(TermKey.of(operand.setPermanent()), Term.single(operand, 1), sign);
        } else {
            for (final Map.Entry<TermKey, Term> entry : operand.members.entrySet()) {
                result.accumulate(entry.getKey(), entry.getValue(), sign);
            }
        }
        return result;
    }

    /**
     * Multiplies this expression by a Number or by another Expression
     */
    public Expression mult(final Object other) {
        if (other instanceof Number) {
            return scale(((Number) other).doubleValue());
        }
        if (!(other instanceof Expression)) {
            throw new OperandTypeException("multiplication", other);
        }
        final Expression left = operator != null ? wrap(this) : this;
        final Expression operand = (Expression) other;
        final Expression right = operand.operator != null ? wrap(operand) : operand;
        final Expression result = new Expression();
        result.isAbstract = isAbstract || operand.isAbstract;
        for (final Map.Entry<TermKey, Term> x : left.members.entrySet()) {
            for (final Map.Entry<TermKey, Term> y : right.members.entrySet()) {
                final Term xt = x.getValue();
                final Term yt = y.getValue();
                final double coef = xt.getCoef() * yt.getCoef();
                if (xt.isConstant() && yt.isConstant()) {
                    result.accumulate(TermKey.CONST, Term.constant(coef), 1);
                } else if (coef == 0) {
                    continue;
                } else if (xt.isConstant()) {
                    result.accumulate(y.getKey(), yt, xt.getCoef());
                } else if (yt.isConstant()) {
                    result.accumulate(x.getKey(), xt, yt.getCoef());
                } else {
                    final Map.Entry<TermKey, List<Expression>> xf = factors(x.getKey(), xt);
                    final Map.Entry<TermKey, List<Expression>> yf = factors(y.getKey(), yt);
                    final List<Expression> refs = new ArrayList<>(xf.getValue());
                    refs.addAll(yf.getValue());
                    result.accumulate(TermKey.product(xf.getKey(), yf.getKey()), new Term(refs, coef, null), 1);
                }
            }
        }
        return result;
    }

    /**
     * Divides by a non-zero Number, or builds a division term when dividing by an Expression
     */
    public Expression div(final Object other) {
        if (other instanceof Number) {
            final double divisor = ((Number) other).doubleValue();
            if (divisor == 0) {
                throw new EvaluationException("Division by zero");
            }
            return scale(1 / divisor);
        }
        if (other instanceof Expression) {
            return operation(this, (Expression) other, TermOperator.DIVISION);
        }
        throw new OperandTypeException("division", other);
    }

    public Expression pow(final Object other) {
        return operation(this, operand(other, "exponentiation"), TermOperator.POWER);
    }

    public Expression neg() {
        return mult(-1);
    }

    /**
     * @return {@code other - this}
     */
    public Expression rsub(final Number other) {
        final Expression result = neg();
        return result.add(other);
    }

    /**
     * @return {@code other / this}
     */
    public Expression rdiv(final Number other) {
        return operation(new Expression(other.doubleValue()), this, TermOperator.DIVISION);
    }

    /**
     * @return {@code other ^ this}
     */
    public Expression rpow(final Number other) {
        return operation(new Expression(other.doubleValue()), this, TermOperator.POWER);
    }

    // Relations

    public Constraint le(final Object other) {
        return Constraint.fromRelation(this, Direction.L, other);
    }

    public Constraint ge(final Object other) {
        return Constraint.fromRelation(this, Direction.G, other);
    }

    public Constraint eq(final Object other) {
        return Constraint.fromRelation(this, Direction.E, other);
    }

    /**
     * @return the ranged constraint {@code lo <= this <= hi}
     */
    public Constraint between(final Number lo, final Number hi) {
        return Constraint.fromRange(this, lo.doubleValue(), hi.doubleValue());
    }

    public Condition lt(final Object other) {
        return new Condition(this, "<", other);
    }

    public Condition gt(final Object other) {
        return new Condition(this, ">", other);
    }

    public Condition ne(final Object other) {
        return new Condition(this, "ne", other);
    }

    public Condition in(final Object set) {
        return new Condition(this, "in", set);
    }

    // Accessors

    @Nullable
    public String getName() {
        return name;
    }

    /**
     * Registers this expression under a new name. Without a requested name an expression that already has
     * one keeps it.
     *
     * @param requested the name to use, renamed on a collision
     * @return the name that was assigned
     */
    public String setName(@Nullable final String requested) {
        if (name != null && requested == null) {
            return name;
        }
        final Registry registry = Registry.current();
        if (name != null) {
            registry.unregister(name);
        }
        name = registry.assignName(requested);
        final int assigned = registry.register(name, this);
        if (order == 0) {
            order = assigned;
        }
        return name;
    }

    /**
     * Makes this expression permanent, generating a name if it does not have one yet
     *
     * @return the name of the expression
     */
    public String setPermanent() {
        temporary = false;
        if (name == null) {
            register(null);
        }
        return name;
    }

    public boolean isTemporary() {
        return temporary;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public int order() {
        return order;
    }

    @Nullable
    public MathFunction getOperator() {
        return operator;
    }

    public List<Object> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public List<SetIterator> getIterators() {
        return Collections.unmodifiableList(iterkey);
    }

    public Map<TermKey, Term> getMembers() {
        return Collections.unmodifiableMap(members);
    }

    public double getConstant() {
        return members.get(TermKey.CONST).getCoef();
    }

    /**
     * @param ref an expression with a name, or the name itself
     * @return the coefficient of the linear member referencing {@code ref}, 0 if there is none
     */
    public double getCoef(final Object ref) {
        final String refName = ref instanceof Expression ? ((Expression) ref).getName() : ref.toString();
        if (refName == null) {
            return 0;
        }
        final Term term = members.get(TermKey.of(refName));
        return term == null ? 0 : term.getCoef();
    }

    /**
     * Sets the coefficient of a variable, adding the variable if it is not referenced yet
     */
    public void updateVarCoef(final Variable variable, final double coef) {
        final TermKey termKey = TermKey.of(Objects.requireNonNull(variable.getName()));
        final Term existing = members.get(termKey);
        if (existing != null) {
            existing.setCoef(coef);
        } else {
            members.put(termKey, Term.single(variable, coef));
        }
    }

    @Nullable
    public Double getDual() {
        return dual;
    }

    public void setDual(@Nullable final Double dual) {
        this.dual = dual;
    }

    /**
     * Removes every non-constant member whose coefficient is zero
     */
    public void clean() {
        final Iterator<Map.Entry<TermKey, Term>> it = members.entrySet().iterator();
        while (it.hasNext()) {
            final Map.Entry<TermKey, Term> entry = it.next();
            if (!entry.getKey().isConstant() && entry.getValue().getCoef() == 0) {
                it.remove();
            }
        }
    }

    public boolean isLinear() {
        clean();
        if (operator != null) {
            return false;
        }
        for (final Term term : members.values()) {
            if (term.isConstant()) {
                continue;
            }
            if (term.getOperator() != null || term.getRefs().size() > 1) {
                return false;
            }
            final Expression ref = term.getRefs().get(0);
            if (ref != this && !ref.isLinear()) {
                return false;
            }
        }
        return true;
    }

    public Expression copy() {
        final Expression copy = new Expression();
        copy.members.clear();
        for (final Map.Entry<TermKey, Term> entry : members.entrySet()) {
            copy.members.put(entry.getKey(), entry.getValue().scaled(1));
        }
        copy.operator = operator;
        copy.arguments.addAll(arguments);
        copy.iterkey.addAll(iterkey);
        copy.isAbstract = isAbstract;
        return copy;
    }

    public Expression copy(final String newName) {
        final Expression copy = copy();
        copy.register(newName);
        return copy;
    }

    /**
     * @return the value of the expression under the current values of its references
     * @throws EvaluationException if a reference has no value or an operation is undefined
     */
    public double getValue() {
        double value = 0;
        for (final Term term : members.values()) {
            if (term.isConstant()) {
                value += term.getCoef();
            } else if (term.getCoef() != 0) {
                value += term.getCoef() * term.evaluate();
            }
        }
        if (operator == null) {
            return value;
        }
        if (!iterkey.isEmpty()) {
            throw new EvaluationException("Cannot evaluate an expression indexed by " + iterkey);
        }
        final double[] args = new double[arguments.size()];
        for (int i = 0; i < args.length; i++) {
            final Object arg = arguments.get(i);
            if (arg instanceof Number) {
                args[i] = ((Number) arg).doubleValue();
            } else if (arg instanceof Expression) {
                args[i] = ((Expression) arg).getValue();
            } else {
                throw new EvaluationException("Cannot evaluate argument " + arg);
            }
        }
        return operator.apply(value, args);
    }

    // Rendering

    @Override
    public String expr() {
        final String body = renderBody();
        if (operator == null) {
            return body;
        }
        final StringBuilder sb = new StringBuilder(operator.token());
        if (operator == MathFunction.SUM && !iterkey.isEmpty()) {
            sb.append(' ').append(OptmodelString.loopHeader(iterkey)).append(' ');
        }
        sb.append('(').append(body);
        for (final Object arg : arguments) {
            sb.append(", ").append(OptmodelString.toSasString(arg));
        }
        return sb.append(')').toString();
    }

    /**
     * @return true if the constant member is written out when other members are present
     */
    protected boolean renderConstant() {
        return true;
    }

    final String renderBody() {
        final List<String> parts = new ArrayList<>();
        for (final Term term : members.values()) {
            if (term.isConstant() || term.getCoef() == 0) {
                continue;
            }
            final double coef = term.getCoef();
            final String sign = coef < 0 ? "- " : parts.isEmpty() ? "" : "+ ";
            final double magnitude = Math.abs(coef);
            final String refs = renderRefs(term);
            if (magnitude == 1) {
                parts.add(sign + refs);
            } else if (term.getOperator() != null || !isAtomicTerm(term)) {
                parts.add(sign + OptmodelString.formatNumber(magnitude) + " * (" + refs + ")");
            } else {
                parts.add(sign + OptmodelString.formatNumber(magnitude) + " * " + refs);
            }
        }
        final double constant = getConstant();
        if (parts.isEmpty() || (constant != 0 && renderConstant())) {
            final String sign = constant < 0 ? "- " : parts.isEmpty() ? "" : "+ ";
            parts.add(sign + OptmodelString.formatNumber(Math.abs(constant)));
        }
        return String.join(" ", parts);
    }

    /**
     * @return true if this expression can be used as a factor of a product without parentheses
     */
    protected boolean isAtomic() {
        if (operator != null) {
            return operator != MathFunction.SUM || iterkey.isEmpty();
        }
        Term only = null;
        for (final Term term : members.values()) {
            if (term.getCoef() == 0) {
                continue;
            }
            if (term.isConstant() || only != null) {
                return false;
            }
            only = term;
        }
        return only != null && only.getCoef() == 1 && only.getOperator() != TermOperator.DIVISION
                && isAtomicTerm(only);
    }

    private static boolean isAtomicTerm(final Term term) {
        if (term.getOperator() != null) {
            return term.getOperator() == TermOperator.POWER;
        }
        return term.isProduct() || term.getRefs().get(0).isAtomic();
    }

    private static String renderRefs(final Term term) {
        final List<String> rendered = new ArrayList<>();
        for (final Expression ref : term.getRefs()) {
            if (term.getOperator() != null) {
                rendered.add("(" + ref.expr() + ")");
            } else if (term.isProduct() && !ref.isAtomic()) {
                rendered.add("(" + ref.expr() + ")");
            } else {
                rendered.add(ref.expr());
            }
        }
        final String separator = term.getOperator() != null ? " " + term.getOperator().token() + " " : " * ";
        return String.join(separator, rendered);
    }

    @Override
    public String toString() {
        return expr();
    }

    // Helpers

    private boolean isInPlace() {
        return temporary && getClass() == Expression.class;
    }

    private Expression scale(final double factor) {
        if (operator != null) {
            return wrap(this).scale(factor);
        }
        final Expression result = isInPlace() ? this : copy();
        if (factor == 0) {
            result.members.clear();
            result.members.put(TermKey.CONST, Term.constant(0));
            return result;
        }
        for (final Term term : result.members.values()) {
            term.setCoef(term.getCoef() * factor);
        }
        return result;
    }

    void accumulate(final TermKey key, final Term term, final double factor) {
        final Term existing = members.get(key);
        if (existing != null) {
            existing.setCoef(existing.getCoef() + factor * term.getCoef());
        } else {
            members.put(key, term.scaled(factor));
        }
    }

    /**
     * Splits a product member into the key and references of its factors. An operator member becomes a
     * single factor wrapping it.
     */
    private static Map.Entry<TermKey, List<Expression>> factors(final TermKey key, final Term term) {
        if (term.getOperator() == null) {
            return Map.entry(key, term.getRefs());
        }
        final Expression factor = new Expression();
        factor.members.put(key, term.scaled(1 / term.getCoef()));
        factor.isAbstract = term.getRefs().stream().anyMatch(Expression::isAbstract);
        return Map.entry(TermKey.of(factor.setPermanent()), ImmutableList.of(factor));
    }

    /**
     * @return a new expression whose only member references {@code inner} with coefficient 1
     */
    static Expression wrap(final Expression inner) {
        final Expression wrapper = new Expression();
        wrapper.members.put(TermKey.of(inner.setPermanent()), Term.single(inner, 1));
        wrapper.isAbstract = inner.isAbstract;
        return wrapper;
    }

    static Expression operation(final Expression left, final Expression right, final TermOperator op) {
        final Expression result = new Expression();
        result.members.put(TermKey.operation(left.setPermanent(), right.setPermanent(), op),
                           new Term(ImmutableList.of(left, right), 1, op));
        result.isAbstract = left.isAbstract || right.isAbstract;
        return result;
    }

    static Expression operand(final Object other, final String operation) {
        if (other instanceof Expression) {
            return (Expression) other;
        }
        if (other instanceof Number) {
            return new Expression(((Number) other).doubleValue());
        }
        throw new OperandTypeException(operation, other);
    }
}
