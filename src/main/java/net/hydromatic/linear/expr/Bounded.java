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
package net.hydromatic.linear.expr;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.linear.util.Static.add;
import static net.hydromatic.linear.util.Static.subtract;

/**
 * Linear expression with bounds, or a comparison between expressions; the
 * template of a constraint that has not yet been added to a model.
 *
 * <p>Created by the comparison methods of {@link LinearBuilder}, such as
 * {@link LinearBuilder#le(Linear.Exp, long)}. A {@link Range} that is
 * unbounded on one side can be narrowed on that side by {@link #le}, {@link
 * #lt}, {@link #ge} and {@link #gt}; for example, {@code 0 <= x - y <= 10} is
 * {@code linear.ge(linear.minus(x, y), 0).le(10)}.
 */
public abstract class Bounded {
  /** Lower bound of a {@link Range} that has no lower bound. */
  public static final long UNBOUNDED_BELOW = Long.MIN_VALUE;

  /** Upper bound of a {@link Range} that has no upper bound. */
  public static final long UNBOUNDED_ABOVE = Long.MAX_VALUE;

  public final Kind kind;

  Bounded(Kind kind) {
    this.kind = requireNonNull(kind, "kind");
  }

  @Override
  public abstract String toString();

  /**
   * Returns whether this comparison is trivially true.
   *
   * <p>Only a comparison between two expressions is resolved here, by
   * comparing the identity of the expression objects: {@code x == x} is
   * true, {@code x != y} is true. Ranges and comparisons with constants
   * always return false; it is the solver's job to decide them.
   */
  public boolean isTrue() {
    return false;
  }

  /** Sets the upper bound of a range that has none. */
  public Bounded le(long v) {
    throw badTightening("<=");
  }

  /** Sets the upper bound of a range that has none, to {@code v - 1}. */
  public Bounded lt(long v) {
    throw badTightening("<");
  }

  /** Sets the lower bound of a range that has none. */
  public Bounded ge(long v) {
    throw badTightening(">=");
  }

  /** Sets the lower bound of a range that has none, to {@code v + 1}. */
  public Bounded gt(long v) {
    throw badTightening(">");
  }

  ExpressionException badTightening(String operator) {
    return new ExpressionException(
        ExpressionException.Reason.BAD_TIGHTENING,
        "Operator " + operator + " not supported for '" + this + "'");
  }

  static String bound(long v) {
    return v == UNBOUNDED_BELOW
        ? "-inf"
        : v == UNBOUNDED_ABOVE ? "+inf" : Long.toString(v);
  }

  /** Kind of bounded expression. */
  public enum Kind {
    /** {@code lb <= e <= ub}. */
    RANGE,
    /** {@code a == b}, where {@code a} and {@code b} are expressions. */
    VAR_EQ_VAR,
    /** {@code a != b}, where {@code a} and {@code b} are expressions. */
    VAR_NE_VAR,
    /** {@code e == k}, where {@code k} is a constant. */
    VAR_EQ_CONST,
    /** {@code e != k}, where {@code k} is a constant. */
    VAR_NE_CONST
  }

  /**
   * Expression between a lower and an upper bound, inclusive.
   *
   * <p>A bound equal to {@link #UNBOUNDED_BELOW} or {@link #UNBOUNDED_ABOVE}
   * is missing, and may be set once by a chained comparison.
   */
  public static class Range extends Bounded {
    public final long lb;
    public final Linear.Exp exp;
    public final long ub;

    Range(long lb, Linear.Exp exp, long ub) {
      super(Kind.RANGE);
      this.lb = lb;
      this.exp = requireNonNull(exp, "exp");
      this.ub = ub;
    }

    @Override
    public String toString() {
      return bound(lb) + " <= " + exp + " <= " + bound(ub);
    }

    @Override
    public Range le(long v) {
      if (ub != UNBOUNDED_ABOVE) {
        throw badTightening("<=");
      }
      return new Range(lb, exp, v);
    }

    @Override
    public Range lt(long v) {
      if (ub != UNBOUNDED_ABOVE) {
        throw badTightening("<");
      }
      return new Range(lb, exp, subtract(v, 1));
    }

    @Override
    public Range ge(long v) {
      if (lb != UNBOUNDED_BELOW) {
        throw badTightening(">=");
      }
      return new Range(v, exp, ub);
    }

    @Override
    public Range gt(long v) {
      if (lb != UNBOUNDED_BELOW) {
        throw badTightening(">");
      }
      return new Range(add(v, 1), exp, ub);
    }
  }

  /**
   * Comparison between two expressions, {@code a == b} or {@code a != b}.
   *
   * <p>The expressions are kept as they are; neither is flattened.
   */
  public static class Comparison extends Bounded {
    public final Linear.Exp left;
    public final Linear.Exp right;

    Comparison(Kind kind, Linear.Exp left, Linear.Exp right) {
      super(kind);
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return left + (kind == Kind.VAR_EQ_VAR ? " == " : " != ") + right;
    }

    @Override
    public boolean isTrue() {
      switch (kind) {
        case VAR_EQ_VAR:
          return left == right;
        case VAR_NE_VAR:
          return left != right;
        default:
          throw new AssertionError("unexpected " + kind);
      }
    }
  }

  /** Comparison between an expression and a constant. */
  public static class ConstantComparison extends Bounded {
    public final Linear.Exp exp;
    public final long value;

    ConstantComparison(Kind kind, Linear.Exp exp, long value) {
      super(kind);
      this.exp = requireNonNull(exp, "exp");
      this.value = value;
    }

    @Override
    public String toString() {
      return exp + (kind == Kind.VAR_EQ_CONST ? " == " : " != ") + value;
    }
  }
}

// End Bounded.java
