/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.linear.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.linear.expr.LinearBuilder.linear;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.linear.expr.Bounded;
import net.hydromatic.linear.expr.Linear;
import net.hydromatic.linear.flatten.Flattener;
import net.hydromatic.linear.flatten.LinearForm;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Model that holds variables, linear constraints and an objective.
 *
 * <p>Variables are appended, and are never removed. Constraints are
 * flattened when they are added, and stored as {@link LinearConstraint}.
 *
 * <p>Not thread-safe; callers that share a model must synchronize.
 */
public class CpModel implements VariableRegistry {
  private final List<VariableDef> variables = new ArrayList<>();
  private final List<LinearConstraint> constraints = new ArrayList<>();
  private final Flattener flattener;
  private @Nullable Objective objective;

  /** Creates an empty model that flattens with the default settings. */
  public CpModel() {
    this(Flattener.DEFAULT);
  }

  /** Creates an empty model that flattens with a given flattener. */
  public CpModel(Flattener flattener) {
    this.flattener = requireNonNull(flattener, "flattener");
  }

  // variables

  /** Creates a variable whose values are between {@code lb} and {@code ub}. */
  public Linear.IntVar newIntVar(long lb, long ub, @Nullable String name) {
    checkArgument(lb <= ub, "empty domain [%s, %s]", lb, ub);
    return newIntVar(ImmutableList.of(lb, ub), name);
  }

  /**
   * Creates a variable whose domain is a flattened list of closed intervals.
   *
   * <p>Each interval must be non-empty, and the intervals must be in
   * ascending order and must not overlap; for example, {@code [0, 3, 5, 5]}
   * is the set {0, 1, 2, 3, 5}.
   */
  public Linear.IntVar newIntVar(List<Long> domain, @Nullable String name) {
    checkArgument(
        !domain.isEmpty() && domain.size() % 2 == 0,
        "domain must have an even, non-zero number of bounds: %s",
        domain);
    for (int i = 0; i < domain.size(); i += 2) {
      checkArgument(domain.get(i) <= domain.get(i + 1),
          "empty interval in domain %s", domain);
      checkArgument(i == 0 || domain.get(i - 1) < domain.get(i),
          "intervals in domain %s overlap or are out of order", domain);
    }
    variables.add(new VariableDef(name, ImmutableList.copyOf(domain)));
    return var(variables.size() - 1);
  }

  /** Creates a variable whose values are 0 and 1. */
  public Linear.IntVar newBoolVar(@Nullable String name) {
    return newIntVar(0L, 1L, name);
  }

  /** Creates a variable that has a single value. */
  public Linear.IntVar newConstant(long value) {
    return newIntVar(value, value, null);
  }

  /** Returns a reference to an existing variable. */
  public Linear.IntVar var(int index) {
    return linear.var(this, index);
  }

  @Override
  public int variableCount() {
    return variables.size();
  }

  @Override
  public ImmutableList<Long> domain(int index) {
    checkElementIndex(index, variables.size(), "variable index");
    return variables.get(index).domain;
  }

  @Override
  public @Nullable String name(int index) {
    checkElementIndex(index, variables.size(), "variable index");
    return variables.get(index).name;
  }

  /** Rebuilds an expression from a serialized linear expression. */
  public Linear.Exp rebuild(LinearProto proto) {
    return LinearProtos.rebuild(proto, this);
  }

  // constraints

  /** Adds a constraint, and returns it. */
  public LinearConstraint add(Bounded bounded) {
    switch (bounded.kind) {
      case RANGE:
        final Bounded.Range range = (Bounded.Range) bounded;
        return addLinear(range.exp, ImmutableList.of(range.lb, range.ub));

      case VAR_EQ_VAR:
        final Bounded.Comparison eq = (Bounded.Comparison) bounded;
        return addLinear(
            linear.minus(eq.left, eq.right), ImmutableList.of(0L, 0L));

      case VAR_NE_VAR:
        final Bounded.Comparison ne = (Bounded.Comparison) bounded;
        return addLinear(linear.minus(ne.left, ne.right), allBut(0L));

      case VAR_EQ_CONST:
        final Bounded.ConstantComparison eqConst =
            (Bounded.ConstantComparison) bounded;
        return addLinear(
            eqConst.exp, ImmutableList.of(eqConst.value, eqConst.value));

      case VAR_NE_CONST:
        final Bounded.ConstantComparison neConst =
            (Bounded.ConstantComparison) bounded;
        return addLinear(neConst.exp, allBut(neConst.value));

      default:
        throw new AssertionError("unexpected " + bounded.kind);
    }
  }

  /** Adds a constraint that an expression has a value in a domain. */
  public LinearConstraint addLinear(Linear.Exp exp, List<Long> domain) {
    final LinearForm form = flattener.flatten(exp);
    final LinearConstraint constraint =
        new LinearConstraint(
            LinearProtos.of(form), ImmutableList.copyOf(domain));
    constraints.add(constraint);
    return constraint;
  }

  /** Returns the domain that contains every value except {@code v}. */
  static ImmutableList<Long> allBut(long v) {
    final ImmutableList.Builder<Long> b = ImmutableList.builder();
    if (v > Long.MIN_VALUE) {
      b.add(Long.MIN_VALUE, v - 1);
    }
    if (v < Long.MAX_VALUE) {
      b.add(v + 1, Long.MAX_VALUE);
    }
    return b.build();
  }

  /** Returns the constraints, in the order they were added. */
  public ImmutableList<LinearConstraint> constraints() {
    return ImmutableList.copyOf(constraints);
  }

  // objective

  /** Sets the objective to minimize an expression. */
  public void minimize(Linear.Exp exp) {
    objective = new Objective(LinearProtos.of(flattener.flatten(exp)), false);
  }

  /**
   * Sets the objective to maximize an expression.
   *
   * <p>The objective is stored as the negated expression, to be minimized,
   * with {@link Objective#maximize} set.
   */
  public void maximize(Linear.Exp exp) {
    final LinearForm form = flattener.flatten(exp, -1L);
    objective = new Objective(LinearProtos.of(form), true);
  }

  /** Returns the objective, or null if none has been set. */
  public @Nullable Objective objective() {
    return objective;
  }

  /** Name and domain of a variable. */
  private static class VariableDef {
    final @Nullable String name;
    final ImmutableList<Long> domain;

    VariableDef(@Nullable String name, ImmutableList<Long> domain) {
      this.name = name;
      this.domain = requireNonNull(domain, "domain");
    }
  }

  /** Objective of a model. The expression is always to be minimized. */
  public static class Objective {
    public final LinearProto proto;
    /** Whether the original expression was to be maximized. */
    public final boolean maximize;

    Objective(LinearProto proto, boolean maximize) {
      this.proto = requireNonNull(proto, "proto");
      this.maximize = maximize;
    }

    @Override
    public String toString() {
      return (maximize ? "maximize -" : "minimize ") + proto;
    }
  }
}

// End CpModel.java
