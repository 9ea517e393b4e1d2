/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.vmware.optmodel.backend.ISolverSession;
import com.vmware.optmodel.backend.SolutionReader;
import com.vmware.optmodel.backend.SolverResponse;
import com.vmware.optmodel.codegen.OptmodelString;
import com.vmware.optmodel.codegen.ProgramWriter;
import com.vmware.optmodel.container.Containable;
import com.vmware.optmodel.container.Containers;
import com.vmware.optmodel.container.Invocation;
import com.vmware.optmodel.core.Constraint;
import com.vmware.optmodel.core.ConstraintGroup;
import com.vmware.optmodel.core.Declarable;
import com.vmware.optmodel.core.Direction;
import com.vmware.optmodel.core.Expression;
import com.vmware.optmodel.core.Objective;
import com.vmware.optmodel.core.Renderable;
import com.vmware.optmodel.core.Sense;
import com.vmware.optmodel.core.Variable;
import com.vmware.optmodel.core.VariableGroup;
import com.vmware.optmodel.core.VariableType;
import com.vmware.optmodel.statement.DropStatement;
import com.vmware.optmodel.statement.RestoreStatement;
import com.vmware.optmodel.statement.SolveOptions;
import com.vmware.optmodel.statement.SolveStatement;
import com.vmware.optmodel.statement.Statement;
import com.vmware.optmodel.symbolic.ImplicitVariable;
import com.vmware.optmodel.symbolic.ModelSet;
import com.vmware.optmodel.symbolic.Parameter;
import com.vmware.optmodel.symbolic.ParameterGroup;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * An optimization problem: the variables, constraints, objectives, data and statements that make up one
 * program. Objects enter a model through {@link #include(Object...)} or the {@code add*} methods and keep
 * their creation order, which decides where they appear in the generated program.
 *
 * Dropped variables and constraints stay in their bucket but are skipped by the getters and by rendering,
 * so restoring them puts the same objects back at their original position.
 */
public class Model implements Declarable, Renderable {
    private static final Logger LOG = LoggerFactory.getLogger(Model.class);
    static final String PRIMAL_TABLE_STATEMENT = "create data solution from [i]= {1.._NVAR_} var=_VAR_.name "
            + "value=_VAR_ lb=_VAR_.lb ub=_VAR_.ub rc=_VAR_.rc;";
    static final String DUAL_TABLE_STATEMENT = "create data dual from [j] = {1.._NCON_} con=_CON_.name "
            + "value=_CON_.body dual=_CON_.dual;";
    public static final Field<String> SUMMARY_LABEL = DSL.field(DSL.name("label"), String.class);
    public static final Field<String> SUMMARY_VALUE = DSL.field(DSL.name("value"), String.class);

    private final String name;
    private final int order;
    private final Map<String, Declarable> variables = new LinkedHashMap<>();
    private final Map<String, Declarable> constraints = new LinkedHashMap<>();
    private final List<ModelSet> sets = new ArrayList<>();
    private final Map<String, Declarable> parameters = new LinkedHashMap<>();
    private final Map<String, ImplicitVariable> implicitVariables = new LinkedHashMap<>();
    private final List<Statement> statements = new ArrayList<>();
    private final List<Statement> postSolveStatements = new ArrayList<>();
    private final Set<Object> dropped = Sets.newIdentityHashSet();
    private final List<Objective> extraObjectives = new ArrayList<>();
    private final ProgramWriter writer = new ProgramWriter();
    private Objective objective;
    private boolean defaultObjective = true;
    @Nullable private ISolverSession session;
    @Nullable private Result<Record> primalSolution;
    @Nullable private Result<Record> dualSolution;
    @Nullable private String status;
    @Nullable private Double objectiveValue;
    private double solutionTime = 0;

    public Model(final String name) {
        this(name, null);
    }

    /**
     * @param name requested name
     * @param session the session used by {@link #solve(SolveOptions)}, may be null
     */
    public Model(final String name, @Nullable final ISolverSession session) {
        final Registry registry = Registry.current();
        this.name = registry.assignName(name);
        this.order = registry.register(this.name, this);
        this.session = session;
        this.objective = Objective.defaultFor(this.name);
        LOG.info("Model {} is created", this.name);
        Containers.record(this);
    }

    public String getName() {
        return name;
    }

    @Override
    public int order() {
        return order;
    }

    @Nullable
    public ISolverSession getSession() {
        return session;
    }

    public void setSession(@Nullable final ISolverSession session) {
        this.session = session;
    }

    // Including objects

    /**
     * Adds existing objects to the model: variables, constraints, their groups, objectives, sets,
     * parameters, implicit variables, statements, collections of these, or other models whose content is
     * merged.
     *
     * @throws ReferenceException inside a container, if an object was created after this model
     */
    public void include(final Object... objects) {
        for (final Object object : objects) {
            if (object instanceof Collection) {
                include(((Collection<?>) object).toArray());
                continue;
            }
            checkOrder(object);
            if (object instanceof Model) {
                includeModel((Model) object);
            } else if (object instanceof Variable) {
                includeVariable((Variable) object);
            } else if (object instanceof VariableGroup) {
                variables.put(((VariableGroup) object).getName(), (VariableGroup) object);
            } else if (object instanceof Constraint) {
                includeConstraint((Constraint) object);
            } else if (object instanceof ConstraintGroup) {
                constraints.put(((ConstraintGroup) object).getName(), (ConstraintGroup) object);
            } else if (object instanceof Objective) {
                objective = (Objective) object;
                defaultObjective = false;
            } else if (object instanceof ModelSet) {
                if (!sets.contains(object)) {
                    sets.add((ModelSet) object);
                }
            } else if (object instanceof Parameter) {
                parameters.put(Objects.requireNonNull(((Parameter) object).getName()), (Parameter) object);
            } else if (object instanceof ParameterGroup) {
                parameters.put(((ParameterGroup) object).getName(), (ParameterGroup) object);
            } else if (object instanceof ImplicitVariable) {
                final ImplicitVariable implicit = (ImplicitVariable) object;
                implicitVariables.put(Objects.requireNonNull(implicit.getName()), implicit);
            } else if (object instanceof Statement) {
                statements.add((Statement) object);
            } else {
                throw new ModelException(String.format("Cannot include %s in model %s", object, name));
            }
        }
    }

    private void checkOrder(final Object object) {
        if (Containers.active().isEmpty()) {
            return;
        }
        final boolean checked = object instanceof Variable || object instanceof VariableGroup
                || object instanceof Constraint || object instanceof ConstraintGroup || object instanceof Objective;
        if (checked && ((Declarable) object).order() > order) {
            throw new ReferenceException(String.format(
                    "Object %s should be defined before Model %s inside a Workspace", nameOf(object), name));
        }
    }

    private static String nameOf(final Object object) {
        if (object instanceof Expression && ((Expression) object).getName() != null) {
            return ((Expression) object).getName();
        }
        if (object instanceof Renderable) {
            return ((Renderable) object).expr();
        }
        return String.valueOf(object);
    }

    private void includeVariable(final Variable variable) {
        final String variableName = Objects.requireNonNull(variable.getName());
        final Declarable existing = variables.get(variableName);
        if (existing != null && existing != variable) {
            LOG.warn("Variable name {} exists in model {}, the new declaration replaces it", variableName, name);
        }
        variables.put(variableName, variable);
    }

    private void includeConstraint(final Constraint constraint) {
        if (constraint.getParent() != null) {
            return;
        }
        final String constraintName = Objects.requireNonNull(constraint.getName());
        final Declarable existing = constraints.get(constraintName);
        if (existing != null && existing != constraint) {
            LOG.warn("Constraint name {} exists in model {}, the new declaration replaces it", constraintName, name);
        }
        constraints.put(constraintName, constraint);
    }

    private void includeModel(final Model other) {
        for (final ModelSet set : other.sets) {
            if (!sets.contains(set)) {
                sets.add(set);
            }
        }
        parameters.putAll(other.parameters);
        statements.addAll(other.statements);
        variables.putAll(other.variables);
        implicitVariables.putAll(other.implicitVariables);
        constraints.putAll(other.constraints);
        dropped.addAll(other.dropped);
        if (!other.defaultObjective) {
            objective = other.objective;
            defaultObjective = false;
        }
    }

    // Adders

    @CanIgnoreReturnValue
    public Variable addVariable(final String variableName) {
        return addVariable(new Variable.Builder(variableName));
    }

    @CanIgnoreReturnValue
    public Variable addVariable(final Variable.Builder builder) {
        final Variable variable = builder.build();
        include(variable);
        return variable;
    }

    @CanIgnoreReturnValue
    public VariableGroup addVariables(final String groupName, final Object... indexArgs) {
        return addVariables(new VariableGroup.Builder(groupName).setIndex(indexArgs));
    }

    @CanIgnoreReturnValue
    public VariableGroup addVariables(final VariableGroup.Builder builder) {
        final VariableGroup group = builder.build();
        include(group);
        return group;
    }

    /**
     * Names an unnamed relation and adds it. This operation has no statement form.
     *
     * @param relation a relation such as {@code x.add(y).le(5)}, or a named constraint
     * @param constraintName the name given to an unnamed relation
     * @throws ModelException if the right-hand side is infinite in the direction the relation tests
     */
    @CanIgnoreReturnValue
    public Constraint addConstraint(final Constraint relation, @Nullable final String constraintName) {
        final Invocation<Constraint> invocation = Containable.invoke("Model.addConstraint", () -> {
            final double constant = relation.getConstant();
            if ((relation.getDirection() == Direction.L && constant == Double.NEGATIVE_INFINITY)
                    || (relation.getDirection() == Direction.G && constant == Double.POSITIVE_INFINITY)) {
                throw new ModelException("Invalid constant value for the constraint type");
            }
            final Constraint constraint = relation.getName() == null ? new Constraint(relation, constraintName)
                                                                     : relation;
            include(constraint);
            return constraint;
        }, null);
        return Objects.requireNonNull(invocation.result());
    }

    /**
     * Adds a constraint group built by a generator. This operation has no statement form.
     */
    @CanIgnoreReturnValue
    public ConstraintGroup addConstraints(final String groupName,
                                          final Function<List<Object>, Constraint> generator,
                                          final Object... indexArgs) {
        final Invocation<ConstraintGroup> invocation = Containable.invoke("Model.addConstraints", () -> {
            final ConstraintGroup group = new ConstraintGroup(groupName, generator, indexArgs);
            include(group);
            return group;
        }, null);
        return Objects.requireNonNull(invocation.result());
    }

    @CanIgnoreReturnValue
    public ConstraintGroup addConstraints(final String groupName, final List<Constraint> relations) {
        final Invocation<ConstraintGroup> invocation = Containable.invoke("Model.addConstraints", () -> {
            final ConstraintGroup group = new ConstraintGroup(groupName, relations);
            include(group);
            return group;
        }, null);
        return Objects.requireNonNull(invocation.result());
    }

    @CanIgnoreReturnValue
    public ModelSet addSet(final ModelSet set) {
        include(set);
        return set;
    }

    @CanIgnoreReturnValue
    public Parameter addParameter(final Parameter parameter) {
        include(parameter);
        return parameter;
    }

    @CanIgnoreReturnValue
    public ParameterGroup addParameter(final ParameterGroup group) {
        include(group);
        return group;
    }

    @CanIgnoreReturnValue
    public ImplicitVariable addImplicitVariable(final ImplicitVariable implicitVariable) {
        include(implicitVariable);
        return implicitVariable;
    }

    /**
     * @param afterSolve whether the statement follows the solve statement in the program
     */
    public void addStatement(final Statement statement, final boolean afterSolve) {
        if (afterSolve) {
            postSolveStatements.add(statement);
        } else {
            statements.add(statement);
        }
    }

    // Objectives

    /**
     * Replaces every objective of the model
     *
     * @param sense the sense, null for the configured default
     */
    @CanIgnoreReturnValue
    public Objective setObjective(final Object expression, final String objectiveName,
                                  @Nullable final Sense sense) {
        Registry.current().unregister(Objects.requireNonNull(objective.getName()));
        objective = new Objective(expression, objectiveName, sense);
        defaultObjective = false;
        extraObjectives.clear();
        return objective;
    }

    /**
     * Adds another objective, for multi-objective solves
     */
    @CanIgnoreReturnValue
    public Objective appendObjective(final Object expression, final String objectiveName,
                                     @Nullable final Sense sense) {
        final Objective appended = new Objective(expression, objectiveName, sense);
        extraObjectives.add(appended);
        return appended;
    }

    public Objective getObjective() {
        return objective;
    }

    public List<Objective> getAllObjectives() {
        return ImmutableList.<Objective>builder().add(objective).addAll(extraObjectives).build();
    }

    /**
     * @return the objective value reported by the solver, or the value of the objective under the current
     *         variable values. This operation has no statement form.
     */
    public double getObjectiveValue() {
        final Invocation<Double> invocation = Containable.invoke("Model.getObjectiveValue",
                () -> objectiveValue != null ? objectiveValue : objective.getValue(), null);
        return Objects.requireNonNull(invocation.result());
    }

    // Getters

    /**
     * @param variableName a variable name or an indexed member name such as {@code x[1,'a']}
     * @return the variable, or null if the model has no such variable or it was dropped
     */
    @Nullable
    public Variable getVariable(final String variableName) {
        final Declarable direct = variables.get(variableName);
        if (direct instanceof Variable && !dropped.contains(direct)) {
            return (Variable) direct;
        }
        for (final Declarable entry : variables.values()) {
            if (entry instanceof VariableGroup && !dropped.contains(entry)) {
                final Variable member = ((VariableGroup) entry).getByName(variableName);
                if (member != null && !dropped.contains(member)) {
                    return member;
                }
            }
        }
        return null;
    }

    /**
     * @return every variable that is not dropped, group members expanded
     */
    public List<Variable> getVariables() {
        final List<Variable> result = new ArrayList<>();
        for (final Declarable entry : variables.values()) {
            if (dropped.contains(entry)) {
                continue;
            }
            if (entry instanceof VariableGroup) {
                for (final Variable member : ((VariableGroup) entry).getMembers()) {
                    if (!dropped.contains(member)) {
                        result.add(member);
                    }
                }
            } else {
                result.add((Variable) entry);
            }
        }
        return result;
    }

    /**
     * @return variables and variable groups by name, in the order they were included
     */
    public Map<String, Declarable> getGroupedVariables() {
        return withoutDropped(variables);
    }

    /**
     * @param constraintName a constraint name, a group member name such as {@code c_1} or an indexed name
     *                       such as {@code c[1]}
     * @return the constraint, or null if the model has no such constraint or it was dropped
     */
    @Nullable
    public Constraint getConstraint(final String constraintName) {
        final Declarable direct = constraints.get(constraintName);
        if (direct instanceof Constraint && !dropped.contains(direct)) {
            return (Constraint) direct;
        }
        for (final Declarable entry : constraints.values()) {
            if (!(entry instanceof ConstraintGroup) || dropped.contains(entry)) {
                continue;
            }
            final ConstraintGroup group = (ConstraintGroup) entry;
            for (final Map.Entry<List<Object>, Constraint> member : group.getMemberMap().entrySet()) {
                final boolean matches = constraintName.equals(member.getValue().getName())
                        || constraintName.equals(group.getIndexedName(member.getKey()));
                if (matches && !dropped.contains(member.getValue())) {
                    return member.getValue();
                }
            }
        }
        return null;
    }

    /**
     * @return every constraint that is not dropped, group members expanded
     */
    public List<Constraint> getConstraints() {
        final List<Constraint> result = new ArrayList<>();
        for (final Declarable entry : constraints.values()) {
            if (dropped.contains(entry)) {
                continue;
            }
            if (entry instanceof ConstraintGroup) {
                for (final Constraint member : ((ConstraintGroup) entry).getMembers()) {
                    if (!dropped.contains(member)) {
                        result.add(member);
                    }
                }
            } else {
                result.add((Constraint) entry);
            }
        }
        return result;
    }

    public Map<String, Declarable> getGroupedConstraints() {
        return withoutDropped(constraints);
    }

    private Map<String, Declarable> withoutDropped(final Map<String, Declarable> bucket) {
        final Map<String, Declarable> result = new LinkedHashMap<>();
        for (final Map.Entry<String, Declarable> entry : bucket.entrySet()) {
            if (!dropped.contains(entry.getValue())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /**
     * @return the non-zero coefficients of a variable in the objective and in every constraint, by name
     */
    public Map<String, Double> getVariableCoef(final Variable variable) {
        final Map<String, Double> coefs = new LinkedHashMap<>();
        for (final Objective each : getAllObjectives()) {
            final double coef = each.getCoef(variable);
            if (coef != 0) {
                coefs.put(Objects.requireNonNull(each.getName()), coef);
            }
        }
        for (final Constraint constraint : getConstraints()) {
            final double coef = constraint.getCoef(variable);
            if (coef != 0) {
                coefs.put(Objects.requireNonNull(constraint.getName()), coef);
            }
        }
        return coefs;
    }

    public List<ModelSet> getSets() {
        return ImmutableList.copyOf(sets);
    }

    public List<Declarable> getParameters() {
        return ImmutableList.copyOf(parameters.values());
    }

    public List<ImplicitVariable> getImplicitVariables() {
        return ImmutableList.copyOf(implicitVariables.values());
    }

    public List<Statement> getStatements() {
        return ImmutableList.copyOf(statements);
    }

    public List<Statement> getPostSolveStatements() {
        return ImmutableList.copyOf(postSolveStatements);
    }

    // Drop and restore

    /**
     * Removes a constraint from the model, or records {@code drop c;} inside a container
     */
    public Invocation<Void> dropConstraint(final Constraint constraint) {
        return dropConstraints(constraint);
    }

    /**
     * @param targets constraints and constraint groups
     */
    public Invocation<Void> dropConstraints(final Object... targets) {
        return Containable.invoke("Model.dropConstraints", () -> {
            for (final Object target : targets) {
                drop(target);
            }
            return null;
        }, () -> List.of(new DropStatement(targets)));
    }

    public Invocation<Void> restoreConstraint(final Constraint constraint) {
        return restoreConstraints(constraint);
    }

    public Invocation<Void> restoreConstraints(final Object... targets) {
        return Containable.invoke("Model.restoreConstraints", () -> {
            for (final Object target : targets) {
                restore(target);
            }
            return null;
        }, () -> List.of(new RestoreStatement(targets)));
    }

    public void dropVariable(final Variable variable) {
        drop(variable);
    }

    public void restoreVariable(final Variable variable) {
        restore(variable);
    }

    /**
     * Hides a variable, constraint or group of the model until it is restored
     *
     * @throws ModelException if the object is not part of the model
     */
    public void drop(final Object target) {
        if (!contains(target)) {
            throw new ModelException(String.format("%s is not part of model %s", nameOf(target), name));
        }
        dropped.add(target);
    }

    /**
     * Reinstates a dropped object at its original position. An object that is not part of the model is
     * included.
     */
    public void restore(final Object target) {
        if (!dropped.remove(target) && !contains(target)) {
            include(target);
        }
    }

    public boolean isDropped(final Object target) {
        return dropped.contains(target);
    }

    private boolean contains(final Object target) {
        if (target instanceof Variable) {
            final Variable variable = (Variable) target;
            final VariableGroup parent = variable.getParent();
            return parent != null ? variables.get(parent.getName()) == parent
                                  : variables.get(variable.getName()) == variable;
        }
        if (target instanceof Constraint) {
            final Constraint constraint = (Constraint) target;
            final ConstraintGroup parent = constraint.getParent();
            return parent != null ? constraints.get(parent.getName()) == parent
                                  : constraints.get(constraint.getName()) == constraint;
        }
        if (target instanceof VariableGroup) {
            return variables.get(((VariableGroup) target).getName()) == target;
        }
        if (target instanceof ConstraintGroup) {
            return constraints.get(((ConstraintGroup) target).getName()) == target;
        }
        return false;
    }

    // Solution

    /**
     * Sets the value of a variable found by name
     *
     * @throws ReferenceException if the model has no such variable
     */
    public void setVariableValue(final String variableName, final double value) {
        final Variable variable = getVariable(variableName);
        if (variable == null) {
            throw new ReferenceException(String.format("No variable %s in model %s", variableName, name));
        }
        variable.setValue(value);
    }

    /**
     * @return the current value of a variable found by name
     * @throws ReferenceException if the model has no such variable
     */
    public double getVariableValue(final String variableName) {
        final Variable variable = getVariable(variableName);
        if (variable == null) {
            throw new ReferenceException(String.format("No variable %s in model %s", variableName, name));
        }
        return variable.getValue();
    }

    public double getVariableValue(final Variable variable) {
        return getVariableValue(Objects.requireNonNull(variable.getName()));
    }

    /**
     * Sets the coefficient of a variable in the objective
     */
    public void setVariableCoef(final Variable variable, final double coef) {
        objective.updateVarCoef(variable, coef);
    }

    /**
     * Sets the coefficient of a variable in one of the constraints of this model
     *
     * @throws ReferenceException if the constraint is not part of the model
     */
    public void setVariableCoef(final Variable variable, final Constraint constraint, final double coef) {
        if (!contains(constraint) || dropped.contains(constraint)) {
            throw new ReferenceException(String.format("%s is not part of model %s", constraint.getName(), name));
        }
        constraint.updateVarCoef(variable, coef);
    }

    /**
     * Forgets the values, duals and tables of the last solve. This operation has no statement form.
     */
    public void clearSolution() {
        Containable.invoke("Model.clearSolution", () -> {
            resetSolution();
            return null;
        }, null);
    }

    private void resetSolution() {
        for (final Variable variable : getVariables()) {
            variable.clearValue();
        }
        for (final Constraint constraint : getConstraints()) {
            constraint.setDual(null);
        }
        primalSolution = null;
        dualSolution = null;
        status = null;
        objectiveValue = null;
        solutionTime = 0;
    }

    public boolean isLinear() {
        for (final Constraint constraint : getConstraints()) {
            if (!constraint.isLinear()) {
                return false;
            }
        }
        for (final Objective each : getAllObjectives()) {
            if (!each.isLinear()) {
                return false;
            }
        }
        return true;
    }

    public boolean hasIntegerVariables() {
        for (final Declarable entry : getGroupedVariables().values()) {
            final VariableType type = entry instanceof VariableGroup ? ((VariableGroup) entry).getType()
                                                                     : ((Variable) entry).getType();
            if (type != VariableType.CONT) {
                return true;
            }
        }
        return false;
    }

    public Invocation<Result<Record>> solve(final SolveOptions options) {
        return solve(null, options);
    }

    /**
     * Submits the program of this model and reads the solution back, or records a solve statement inside
     * a container
     *
     * @param solverSession the session to use, null for the session of the model
     * @param options solve options
     * @return the primal solution table
     * @throws SolverException if there is no session or the solution status is not an accepted outcome
     */
    public Invocation<Result<Record>> solve(@Nullable final ISolverSession solverSession,
                                            final SolveOptions options) {
        return Containable.invoke("Model.solve", () -> solveNow(solverSession, options),
                                  () -> List.of(new SolveStatement(this, options)));
    }

    private Result<Record> solveNow(@Nullable final ISolverSession solverSession, final SolveOptions options) {
        final ISolverSession target = solverSession != null ? solverSession : session;
        if (target == null) {
            throw new SolverException("Model " + name + " has no session to solve with");
        }
        final String program = toOptmodel(new ProgramOptions().setSolveOptions(options).setParseResults(true));
        LOG.info("Running the solver");
        final long start = System.nanoTime();
        final SolverResponse response = target.submit(program);
        LOG.info("Solver has run successfully in {}ns. Processing records.", System.nanoTime() - start);
        resetSolution();
        status = response.getStatus();
        solutionTime = response.getSolutionTime();
        if (status == null || !Registry.current().config().validOutcomes().contains(status)) {
            throw new SolverException("Solver did not return an accepted solution", status);
        }
        primalSolution = response.getPrimal();
        dualSolution = response.getDual();
        final SolutionReader reader = new SolutionReader(this::getVariable, this::getConstraint);
        reader.applyPrimal(primalSolution);
        reader.applyDual(dualSolution);
        objectiveValue = response.getObjectiveValue();
        return primalSolution;
    }

    @Nullable
    @SuppressFBWarnings("EI_EXPOSE_REP") // callers read the solver's table directly
    public Result<Record> getSolution() {
        return primalSolution;
    }

    @Nullable
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public Result<Record> getDualSolution() {
        return dualSolution;
    }

    @Nullable
    public String getSolutionStatus() {
        return status;
    }

    public double getSolutionTime() {
        return solutionTime;
    }

    /**
     * @return a {@code label}, {@code value} table describing the size and objective of this model
     */
    public Result<Record> getProblemSummary() {
        final List<Variable> modelVariables = getVariables();
        final long integers = modelVariables.stream().filter(v -> v.getType() != VariableType.CONT).count();
        final Result<Record> summary = newSummary();
        addSummaryRow(summary, "Problem Name", name);
        addSummaryRow(summary, "Objective Sense",
                      objective.getSense() == Sense.MAX ? "Maximization" : "Minimization");
        addSummaryRow(summary, "Objective Function", objective.getName());
        addSummaryRow(summary, "Number of Variables", String.valueOf(modelVariables.size()));
        addSummaryRow(summary, "Number of Integer Variables", String.valueOf(integers));
        addSummaryRow(summary, "Number of Constraints", String.valueOf(getConstraints().size()));
        return summary;
    }

    /**
     * @return a {@code label}, {@code value} table with the status, objective value and time of the last solve
     * @throws ModelException if the model has not been solved
     */
    public Result<Record> getSolutionSummary() {
        if (status == null) {
            throw new ModelException(String.format("Model %s has not been solved", name));
        }
        final Result<Record> summary = newSummary();
        addSummaryRow(summary, "Objective Function", objective.getName());
        addSummaryRow(summary, "Solution Status", status);
        addSummaryRow(summary, "Objective Value",
                      objectiveValue == null ? null : OptmodelString.formatNumber(objectiveValue));
        addSummaryRow(summary, "Solution Time", OptmodelString.formatNumber(solutionTime));
        return summary;
    }

    private static Result<Record> newSummary() {
        return DSL.using(SQLDialect.DEFAULT).newResult(new Field<?>[] {SUMMARY_LABEL, SUMMARY_VALUE});
    }

    private static void addSummaryRow(final Result<Record> summary, final String label,
                                      @Nullable final String value) {
        final Record record = DSL.using(SQLDialect.DEFAULT).newRecord(SUMMARY_LABEL, SUMMARY_VALUE);
        record.set(SUMMARY_LABEL, label);
        record.set(SUMMARY_VALUE, value);
        summary.add(record);
    }

    // Rendering

    public String toOptmodel() {
        return toOptmodel(new ProgramOptions());
    }

    public String toOptmodel(final ProgramOptions options) {
        final List<String> lines = new ArrayList<>();
        for (final Declarable component : components(options.isCreationOrder())) {
            final String definition = component.definition();
            if (definition != null) {
                lines.add(definition);
            }
        }
        for (final Constraint constraint : droppedMembers()) {
            lines.add("drop " + constraint.getName() + ";");
        }
        if (options.isSolve()) {
            lines.add(SolveStatement.render(null, options.getSolveOptions()));
        }
        if (options.isParseResults()) {
            lines.add(PRIMAL_TABLE_STATEMENT);
            lines.add(DUAL_TABLE_STATEMENT);
        }
        for (final Statement statement : postSolveStatements) {
            lines.add(statement.definition());
        }
        return writer.write(lines, options.isHeader());
    }

    /**
     * @return the declarations of the model, by creation order or in the order sets, parameters,
     *         statements, variables, implicit variables, constraints and objectives
     */
    private List<Declarable> components(final boolean creationOrder) {
        final List<Declarable> all = new ArrayList<>(sets);
        all.addAll(parameters.values());
        all.addAll(statements);
        all.addAll(getGroupedVariables().values());
        all.addAll(implicitVariables.values());
        all.addAll(getGroupedConstraints().values());
        all.addAll(getAllObjectives());
        if (creationOrder) {
            all.sort(Comparator.comparingInt(Declarable::order));
        }
        return all;
    }

    private List<Constraint> droppedMembers() {
        final List<Constraint> members = new ArrayList<>();
        for (final Declarable entry : getGroupedConstraints().values()) {
            if (entry instanceof ConstraintGroup) {
                for (final Constraint member : ((ConstraintGroup) entry).getMembers()) {
                    if (dropped.contains(member) && member.getLoopIterators().isEmpty()) {
                        members.add(member);
                    }
                }
            }
        }
        return members;
    }

    /**
     * @return {@code problem m include x c obj;}
     */
    @Override
    public String definition() {
        final List<String> names = new ArrayList<>(getGroupedVariables().keySet());
        names.addAll(getGroupedConstraints().keySet());
        if (!defaultObjective) {
            names.add(Objects.requireNonNull(objective.getName()));
        }
        return names.isEmpty() ? "problem " + name + ";"
                               : "problem " + name + " include " + String.join(" ", names) + ";";
    }

    @Override
    public String expr() {
        return name;
    }

    @Override
    public String toString() {
        return "Model{" +
                "name='" + name + '\'' +
                ", variables=" + getVariables().size() +
                ", constraints=" + getConstraints().size() +
                ", objective=" + objective.definition() +
                '}';
    }
}
