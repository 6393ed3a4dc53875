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

import static net.hydromatic.linear.expr.LinearBuilder.linear;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.linear.flatten.Flattener;
import net.hydromatic.linear.model.CpModel;
import org.junit.jupiter.api.Test;

/** Tests for {@link LinearBuilder} and the nodes it creates. */
class LinearBuilderTest {
  private final CpModel model = new CpModel();
  private final Linear.IntVar x = model.newIntVar(0, 10, "x");
  private final Linear.IntVar y = model.newIntVar(0, 10, "y");
  private final Linear.IntVar z = model.newIntVar(-5, 5, "z");
  private final Linear.IntVar b = model.newBoolVar("b");

  @Test void testPlus() {
    final Linear.Exp e = linear.plus(x, y);
    assertThat(e, instanceOf(Linear.Sum.class));
    assertThat(((Linear.Sum) e).exps, is(ImmutableList.<Linear.Exp>of(x, y)));
    assertThat(((Linear.Sum) e).offset, is(0L));
    assertThat(e, hasToString("x + y"));

    // Sums are not merged at construction time
    final Linear.Exp e2 = linear.plus(e, z);
    assertThat(((Linear.Sum) e2).exps, hasSize(2));
    assertThat(e2, hasToString("x + y + z"));
    assertThat(linear.plus(x, linear.plus(y, z)), hasToString("x + (y + z)"));
  }

  @Test void testPlusConstant() {
    assertThat(linear.plus(x, 0), sameInstance(x));
    assertThat(linear.plus(0, x), sameInstance(x));
    assertThat(linear.minus(x, 0), sameInstance(x));

    final Linear.Exp e = linear.plus(x, 5);
    assertThat(((Linear.Sum) e).exps, is(ImmutableList.<Linear.Exp>of(x)));
    assertThat(((Linear.Sum) e).offset, is(5L));
    assertThat(e, hasToString("x + 5"));
    assertThat(linear.plus(5, x), hasToString("x + 5"));
    assertThat(linear.minus(x, 3), hasToString("x - 3"));
    assertThat(linear.minus(3, x), hasToString("-1 * x + 3"));
    assertThat(linear.minus(0, x), hasToString("-1 * x"));
  }

  @Test void testTimes() {
    assertThat(linear.times(x, 1), sameInstance(x));

    final Linear.Exp e = linear.times(x, 3);
    assertThat(e, instanceOf(Linear.Product.class));
    assertThat(e, hasToString("3 * x"));
    assertThat(linear.times(3, x), hasToString("3 * x"));

    // Product of a product is collapsed
    final Linear.Exp e2 = linear.times(e, -2);
    assertThat(((Linear.Product) e2).exp, sameInstance(x));
    assertThat(((Linear.Product) e2).coeff, is(-6L));

    // ... and if the coefficients cancel, the product disappears
    assertThat(linear.times(linear.negate(x), -1), sameInstance(x));

    assertThat(linear.times(linear.plus(x, y), 2), hasToString("2 * (x + y)"));
    assertThat(linear.plus(x, linear.times(y, 2)), hasToString("x + 2 * y"));
  }

  @Test void testTimesOverflow() {
    final Linear.Exp e = linear.times(x, Long.MAX_VALUE);
    final ExpressionException ex =
        assertThrows(ExpressionException.class, () -> linear.times(e, 2));
    assertThat(ex.reason, is(ExpressionException.Reason.OVERFLOW));
    assertThat(ex.getCause(), instanceOf(ArithmeticException.class));
  }

  @Test void testMinus() {
    final Linear.Exp e = linear.minus(x, y);
    assertThat(e, hasToString("x + -1 * y"));
    final Linear.Exp second = ((Linear.Sum) e).exps.get(1);
    assertThat(((Linear.Product) second).exp, sameInstance(y));
    assertThat(((Linear.Product) second).coeff, is(-1L));

    // Negating the most negative long overflows
    final ExpressionException ex =
        assertThrows(ExpressionException.class,
            () -> linear.minus(x, Long.MIN_VALUE));
    assertThat(ex.reason, is(ExpressionException.Reason.OVERFLOW));
  }

  @Test void testAffine() {
    assertThat(linear.affine(x, 2, 7), hasToString("2 * x + 7"));
    assertThat(linear.affine(x, 2, 0), hasToString("2 * x"));
    assertThat(linear.affine(x, 1, 0), sameInstance(x));
    assertThat(linear.affine(x, 1, -1), hasToString("x - 1"));
    assertThat(linear.term(y, 4), hasToString("4 * y"));
  }

  @Test void testSum() {
    assertThat(linear.sum(x, y, z), hasToString("x + y + z"));
    assertThat(linear.sum(ImmutableList.of(x, y)), hasToString("x + y"));
    assertThat(linear.sum(ImmutableList.of(x, y), -2),
        hasToString("x + y - 2"));
    assertThat(linear.sum(), hasToString("0"));
    assertThat(linear.sum(x), hasToString("x"));
    assertThat(linear.constant(-4), hasToString("-4"));
  }

  @Test void testWeightedSum() {
    final Linear.Sum e =
        linear.weightedSum(ImmutableList.of(x, y), ImmutableList.of(3L, 5L));
    assertThat(e, hasToString("3 * x + 5 * y"));
    assertThat(e.offset, is(0L));

    final Linear.Sum e2 =
        linear.weightedSum(new Linear.Exp[] {x, y}, new long[] {1, -1});
    assertThat(e2, hasToString("x + -1 * y"));
  }

  @Test void testWeightedSumMismatch() {
    final ExpressionException e =
        assertThrows(ExpressionException.class,
            () -> linear.weightedSum(ImmutableList.of(x),
                ImmutableList.of(1L, 2L)));
    assertThat(e.reason, is(ExpressionException.Reason.STRUCTURAL_MISMATCH));
    assertThat(e.getMessage(),
        is("in weightedSum, the two lists do not have the same length "
            + "(1 vs 2)"));

    final ExpressionException e2 =
        assertThrows(ExpressionException.class,
            () -> linear.weightedSum(new Linear.Exp[] {x, y}, new long[] {1}));
    assertThat(e2.reason, is(ExpressionException.Reason.STRUCTURAL_MISMATCH));
  }

  @Test void testNot() {
    final Linear.NotVar notB = b.not();
    assertThat(notB, hasToString("not(b)"));
    assertThat(notB.index(), is(-b.index() - 1));
    assertThat(notB.not(), sameInstance(b));

    // The negation is created once
    assertThat(b.not(), sameInstance(notB));
    assertThat(b.not().not().not(), sameInstance(notB));

    assertThat(linear.times(notB, 2), hasToString("2 * not(b)"));
  }

  @Test void testNotNonBoolean() {
    final ExpressionException e =
        assertThrows(ExpressionException.class, x::not);
    assertThat(e.reason, is(ExpressionException.Reason.NOT_BOOLEAN));

    // A variable fixed to 1 is not boolean; its domain is not {0, 1}
    final Linear.IntVar one = model.newConstant(1);
    assertThrows(ExpressionException.class, one::not);

    // Domain {0, 1} written as two intervals is boolean
    final Linear.IntVar c =
        model.newIntVar(ImmutableList.of(0L, 0L, 1L, 1L), "c");
    assertThat(c.not(), hasToString("not(c)"));
  }

  @Test void testIndex() {
    assertThat(x.index(), is(0));
    assertThat(b.index(), is(3));
    assertThrows(UnsupportedOperationException.class,
        () -> linear.plus(x, y).index());
  }

  @Test void testVar() {
    final Linear.IntVar x2 = model.var(0);
    assertThat(x2, not(sameInstance(x)));
    assertThat(x2, is(x));
    assertThat(x2.hashCode(), is(x.hashCode()));
    assertThat(x2, not(is(y)));

    final Linear.IntVar unnamed = model.newIntVar(0, 3, null);
    assertThat(unnamed, hasToString("v" + unnamed.index()));
    assertThrows(IndexOutOfBoundsException.class, () -> model.var(99));
  }

  @Test void testEvaluate() {
    final Linear.Exp e =
        linear.plus(linear.times(linear.minus(x, y), 3),
            linear.plus(b.not(), 4));
    // 3 * (x - y) + (1 - b) + 4 where x = 7, y = 2, b = 1
    final long[] values = {7, 2, 0, 1};
    assertThat(e.evaluate(i -> values[i]), is(19L));
  }

  /** A kind of node that does not override {@code accept} cannot be
   * flattened or evaluated. */
  @Test void testCannotInterpret() {
    final Linear.Exp odd =
        new Linear.Exp(Op.CONSTANT) {
          @Override StringBuilder unparse(StringBuilder buf, int left,
              int right) {
            return buf.append("odd");
          }
        };
    final Linear.Exp e = linear.plus(x, linear.times(odd, 2));
    final ExpressionException ex =
        assertThrows(ExpressionException.class,
            () -> Flattener.DEFAULT.flatten(e));
    assertThat(ex.reason, is(ExpressionException.Reason.CANNOT_INTERPRET));
    assertThat(ex.getMessage(),
        is("Cannot interpret 'odd' in an integer expression"));

    assertThrows(ExpressionException.class, () -> e.evaluate(i -> 0L));
  }
}

// End LinearBuilderTest.java
