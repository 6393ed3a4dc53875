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

import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.linear.util.Static.add;
import static net.hydromatic.linear.util.Static.multiply;
import static net.hydromatic.linear.util.Static.subtract;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.linear.model.VariableRegistry;
import net.hydromatic.linear.util.Static;

/**
 * Builds linear expressions and bounded expressions.
 *
 * <p>The methods apply local simplifications (multiplying by 1 and adding 0
 * are no-ops, and nested products are collapsed) but they do not merge sums;
 * a sum of sums is flattened only when it is converted into coefficients by
 * {@link net.hydromatic.linear.flatten.Flattener}.
 *
 * <p>The comparison methods ({@link #eq}, {@link #le}, etc.) build constraint
 * templates; they do not compare values.
 */
public enum LinearBuilder {
  /**
   * The singleton instance of the linear expression builder. The short name
   * is convenient for use via 'import static', but checkstyle does not
   * approve.
   */
  // CHECKSTYLE: IGNORE 1
  linear;

  /** Creates a reference to a variable that is registered in a registry. */
  public Linear.IntVar var(VariableRegistry registry, int index) {
    checkElementIndex(index, registry.variableCount(), "variable index");
    return new Linear.IntVar(registry, index);
  }

  /** Creates a constant. */
  public Linear.Constant constant(long value) {
    return new Linear.Constant(value);
  }

  /** Creates {@code a + b}. */
  public Linear.Exp plus(Linear.Exp a, Linear.Exp b) {
    return new Linear.Sum(ImmutableList.of(a, b), 0L);
  }

  /** Creates {@code a + v}; returns {@code a} if {@code v} is 0. */
  public Linear.Exp plus(Linear.Exp a, long v) {
    requireNonNull(a, "a");
    if (v == 0) {
      return a;
    }
    return new Linear.Sum(ImmutableList.of(a), v);
  }

  /** Creates {@code v + a}; returns {@code a} if {@code v} is 0. */
  public Linear.Exp plus(long v, Linear.Exp a) {
    return plus(a, v);
  }

  /** Creates {@code a - b}. */
  public Linear.Exp minus(Linear.Exp a, Linear.Exp b) {
    return new Linear.Sum(ImmutableList.of(a, times(b, -1)), 0L);
  }

  /** Creates {@code a - v}; returns {@code a} if {@code v} is 0. */
  public Linear.Exp minus(Linear.Exp a, long v) {
    requireNonNull(a, "a");
    if (v == 0) {
      return a;
    }
    return new Linear.Sum(ImmutableList.of(a), Static.negate(v));
  }

  /** Creates {@code v - a}. */
  public Linear.Exp minus(long v, Linear.Exp a) {
    if (v == 0) {
      return negate(a);
    }
    return new Linear.Sum(ImmutableList.of(times(a, -1)), v);
  }

  /**
   * Creates {@code e * v}.
   *
   * <p>Returns {@code e} if {@code v} is 1. If {@code e} is already a product,
   * multiplies its coefficient rather than creating a product of a product.
   *
   * @throws ExpressionException if the combined coefficient overflows
   */
  public Linear.Exp times(Linear.Exp e, long v) {
    requireNonNull(e, "e");
    if (v == 1) {
      return e;
    }
    if (e instanceof Linear.Product) {
      final Linear.Product product = (Linear.Product) e;
      final long coeff = multiply(product.coeff, v);
      return coeff == 1 ? product.exp : new Linear.Product(product.exp, coeff);
    }
    return new Linear.Product(e, v);
  }

  /** Creates {@code v * e}. */
  public Linear.Exp times(long v, Linear.Exp e) {
    return times(e, v);
  }

  /** Creates {@code -e}. */
  public Linear.Exp negate(Linear.Exp e) {
    return times(e, -1);
  }

  /** Creates {@code var * coeff}. */
  public Linear.Exp term(Linear.IntVar var, long coeff) {
    return times(var, coeff);
  }

  /** Creates {@code var * coeff + offset}. */
  public Linear.Exp affine(Linear.IntVar var, long coeff, long offset) {
    final Linear.Exp term = times(var, coeff);
    if (offset == 0) {
      return term;
    }
    return new Linear.Sum(ImmutableList.of(term), offset);
  }

  /** Creates the sum of a list of expressions. */
  public Linear.Sum sum(Iterable<? extends Linear.Exp> exps) {
    return new Linear.Sum(ImmutableList.copyOf(exps), 0L);
  }

  /** Creates the sum of a list of expressions plus a constant. */
  public Linear.Sum sum(Iterable<? extends Linear.Exp> exps, long offset) {
    return new Linear.Sum(ImmutableList.copyOf(exps), offset);
  }

  /** Creates the sum of an array of expressions. */
  public Linear.Sum sum(Linear.Exp... exps) {
    return new Linear.Sum(ImmutableList.copyOf(exps), 0L);
  }

  /**
   * Creates the sum of expressions, each multiplied by a coefficient.
   *
   * @throws ExpressionException if the lists have different lengths
   */
  public Linear.Sum weightedSum(
      List<? extends Linear.Exp> exps, List<Long> coeffs) {
    if (exps.size() != coeffs.size()) {
      throw ExpressionException.mismatch(
          "weightedSum", exps.size(), coeffs.size());
    }
    final ImmutableList.Builder<Linear.Exp> b = ImmutableList.builder();
    for (int i = 0; i < exps.size(); i++) {
      b.add(times(exps.get(i), coeffs.get(i)));
    }
    return new Linear.Sum(b.build(), 0L);
  }

  /**
   * Creates the sum of expressions, each multiplied by a coefficient.
   *
   * @throws ExpressionException if the arrays have different lengths
   */
  public Linear.Sum weightedSum(Linear.Exp[] exps, long[] coeffs) {
    if (exps.length != coeffs.length) {
      throw ExpressionException.mismatch(
          "weightedSum", exps.length, coeffs.length);
    }
    final ImmutableList.Builder<Linear.Exp> b = ImmutableList.builder();
    for (int i = 0; i < exps.length; i++) {
      b.add(times(exps[i], coeffs[i]));
    }
    return new Linear.Sum(b.build(), 0L);
  }

  // comparisons

  /** Creates {@code lb <= e <= ub}. */
  public Bounded.Range range(long lb, Linear.Exp e, long ub) {
    return new Bounded.Range(lb, e, ub);
  }

  /**
   * Creates a range with no lower or upper bound, to be narrowed by chained
   * comparisons.
   */
  public Bounded.Range unbounded(Linear.Exp e) {
    return range(Bounded.UNBOUNDED_BELOW, e, Bounded.UNBOUNDED_ABOVE);
  }

  /** Creates {@code a <= b}, as {@code a - b <= 0}. */
  public Bounded.Range le(Linear.Exp a, Linear.Exp b) {
    return range(Bounded.UNBOUNDED_BELOW, minus(a, b), 0L);
  }

  /** Creates {@code a < b}, as {@code a - b <= -1}. */
  public Bounded.Range lt(Linear.Exp a, Linear.Exp b) {
    return range(Bounded.UNBOUNDED_BELOW, minus(a, b), -1L);
  }

  /** Creates {@code a >= b}, as {@code a - b >= 0}. */
  public Bounded.Range ge(Linear.Exp a, Linear.Exp b) {
    return range(0L, minus(a, b), Bounded.UNBOUNDED_ABOVE);
  }

  /** Creates {@code a > b}, as {@code a - b >= 1}. */
  public Bounded.Range gt(Linear.Exp a, Linear.Exp b) {
    return range(1L, minus(a, b), Bounded.UNBOUNDED_ABOVE);
  }

  /** Creates {@code e <= v}. */
  public Bounded.Range le(Linear.Exp e, long v) {
    return range(Bounded.UNBOUNDED_BELOW, e, v);
  }

  /** Creates {@code e < v}, as {@code e <= v - 1}. */
  public Bounded.Range lt(Linear.Exp e, long v) {
    return range(Bounded.UNBOUNDED_BELOW, e, subtract(v, 1));
  }

  /** Creates {@code e >= v}. */
  public Bounded.Range ge(Linear.Exp e, long v) {
    return range(v, e, Bounded.UNBOUNDED_ABOVE);
  }

  /** Creates {@code e > v}, as {@code e >= v + 1}. */
  public Bounded.Range gt(Linear.Exp e, long v) {
    return range(add(v, 1), e, Bounded.UNBOUNDED_ABOVE);
  }

  /** Creates {@code v <= e}. */
  public Bounded.Range le(long v, Linear.Exp e) {
    return ge(e, v);
  }

  /** Creates {@code v < e}. */
  public Bounded.Range lt(long v, Linear.Exp e) {
    return gt(e, v);
  }

  /** Creates {@code v >= e}. */
  public Bounded.Range ge(long v, Linear.Exp e) {
    return le(e, v);
  }

  /** Creates {@code v > e}. */
  public Bounded.Range gt(long v, Linear.Exp e) {
    return lt(e, v);
  }

  /**
   * Creates {@code a == b}.
   *
   * <p>The result is a constraint template. To find out whether {@code a} and
   * {@code b} are the same object, call {@link Bounded#isTrue()} on it.
   */
  public Bounded.Comparison eq(Linear.Exp a, Linear.Exp b) {
    return new Bounded.Comparison(Bounded.Kind.VAR_EQ_VAR, a, b);
  }

  /** Creates {@code a != b}. */
  public Bounded.Comparison ne(Linear.Exp a, Linear.Exp b) {
    return new Bounded.Comparison(Bounded.Kind.VAR_NE_VAR, a, b);
  }

  /** Creates {@code e == v}. */
  public Bounded.ConstantComparison eq(Linear.Exp e, long v) {
    return new Bounded.ConstantComparison(Bounded.Kind.VAR_EQ_CONST, e, v);
  }

  /** Creates {@code e != v}. */
  public Bounded.ConstantComparison ne(Linear.Exp e, long v) {
    return new Bounded.ConstantComparison(Bounded.Kind.VAR_NE_CONST, e, v);
  }
}

// End LinearBuilder.java
