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

import static net.hydromatic.linear.expr.LinearBuilder.linear;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import net.hydromatic.linear.expr.ExpressionException;
import net.hydromatic.linear.expr.Linear;
import net.hydromatic.linear.flatten.Flattener;
import org.junit.jupiter.api.Test;

/** Tests for {@link CpModel}, {@link LinearProto} and {@link LinearProtos}. */
class CpModelTest {
  private final CpModel model = new CpModel();
  private final Linear.IntVar x = model.newIntVar(0, 10, "x");
  private final Linear.IntVar y = model.newIntVar(-10, 10, "y");
  private final Linear.IntVar z = model.newIntVar(0, 100, "z");

  @Test void testVariables() {
    assertThat(model.variableCount(), is(3));
    assertThat(model.name(1), is("y"));
    assertThat(model.domain(1), is(ImmutableList.of(-10L, 10L)));
    final Linear.IntVar c = model.newConstant(42);
    assertThat(model.name(c.index()), nullValue());
    assertThat(c.domain(), is(ImmutableList.of(42L, 42L)));

    assertThrows(IllegalArgumentException.class,
        () -> model.newIntVar(5, 4, "bad"));
    assertThrows(IllegalArgumentException.class,
        () -> model.newIntVar(ImmutableList.of(1L, 2L, 3L), "odd"));
    assertThrows(IndexOutOfBoundsException.class, () -> model.domain(99));
  }

  @Test void testDomainValidation() {
    final Linear.IntVar v =
        model.newIntVar(ImmutableList.of(0L, 3L, 5L, 5L), "v");
    assertThat(v.domain(), is(ImmutableList.of(0L, 3L, 5L, 5L)));

    // Each interval must be non-empty
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> model.newIntVar(ImmutableList.of(5L, 1L), "inverted"));
    assertThat(e.getMessage(), is("empty interval in domain [5, 1]"));

    // Intervals must be ascending and must not overlap or touch
    assertThrows(IllegalArgumentException.class,
        () -> model.newIntVar(ImmutableList.of(0L, 1L, 0L, 1L), "overlap"));
    assertThrows(IllegalArgumentException.class,
        () -> model.newIntVar(ImmutableList.of(0L, 2L, 2L, 4L), "touch"));
    assertThrows(IllegalArgumentException.class,
        () -> model.newIntVar(ImmutableList.of(5L, 6L, 0L, 1L), "order"));

    // Rejected variables are not registered
    assertThat(model.variableCount(), is(4));
  }

  @Test void testRebuild() {
    assertThat(model.rebuild(LinearProto.constant(7)), hasToString("7"));
    assertThat(
        model.rebuild(
            LinearProto.of(ImmutableList.of(0), ImmutableList.of(2L), 7)),
        hasToString("2 * x + 7"));
    assertThat(
        model.rebuild(
            LinearProto.of(ImmutableList.of(0, 1, 2),
                ImmutableList.of(1L, 2L, 3L), -4)),
        hasToString("x + 2 * y + 3 * z - 4"));
  }

  /** Rebuilding a proto, then flattening the result, gives the original
   * proto. */
  @Test void testRebuildFlatten() {
    final ImmutableList<LinearProto> protos =
        ImmutableList.of(LinearProto.constant(-3),
            LinearProto.of(ImmutableList.of(1), ImmutableList.of(-5L), 0),
            LinearProto.of(ImmutableList.of(0, 2),
                ImmutableList.of(4L, 1L), 9),
            LinearProto.of(ImmutableList.of(0, 1, 2),
                ImmutableList.of(1L, -1L, 6L), -11));
    for (LinearProto proto : protos) {
      final Linear.Exp e = model.rebuild(proto);
      assertThat(LinearProtos.of(Flattener.DEFAULT.flatten(e)), is(proto));
    }
  }

  @Test void testProtoMismatch() {
    final ExpressionException e =
        assertThrows(ExpressionException.class,
            () -> LinearProto.of(ImmutableList.of(0, 1),
                ImmutableList.of(1L), 0));
    assertThat(e.reason, is(ExpressionException.Reason.STRUCTURAL_MISMATCH));
    assertThat(e.getMessage(),
        is("in LinearProto, the two lists do not have the same length "
            + "(2 vs 1)"));
  }

  @Test void testAddRange() {
    final LinearConstraint c = model.add(linear.le(x, 5));
    assertThat(c.proto,
        is(LinearProto.of(ImmutableList.of(0), ImmutableList.of(1L), 0)));
    assertThat(c.domain, is(ImmutableList.of(Long.MIN_VALUE, 5L)));

    final LinearConstraint c2 =
        model.add(linear.range(2, linear.plus(x, linear.times(z, 3)), 8));
    assertThat(c2,
        hasToString("{vars: [0, 2], coeffs: [1, 3], offset: 0} in [2, 8]"));
    assertThat(model.constraints(), is(ImmutableList.of(c, c2)));
  }

  @Test void testAddEquality() {
    final LinearConstraint eq = model.add(linear.eq(x, y));
    assertThat(eq.proto.vars, is(ImmutableList.of(0, 1)));
    assertThat(eq.proto.coeffs, is(ImmutableList.of(1L, -1L)));
    assertThat(eq.domain, is(ImmutableList.of(0L, 0L)));

    final LinearConstraint ne = model.add(linear.ne(x, y));
    assertThat(ne.domain,
        is(ImmutableList.of(Long.MIN_VALUE, -1L, 1L, Long.MAX_VALUE)));

    final LinearConstraint eqConst = model.add(linear.eq(linear.plus(x, 2), 5));
    assertThat(eqConst.proto.offset, is(2L));
    assertThat(eqConst.domain, is(ImmutableList.of(5L, 5L)));

    final LinearConstraint neConst = model.add(linear.ne(x, 3));
    assertThat(neConst.domain,
        is(ImmutableList.of(Long.MIN_VALUE, 2L, 4L, Long.MAX_VALUE)));

    // No hole at the extremes
    assertThat(model.add(linear.ne(x, Long.MIN_VALUE)).domain,
        is(ImmutableList.of(Long.MIN_VALUE + 1, Long.MAX_VALUE)));
    assertThat(model.add(linear.ne(x, Long.MAX_VALUE)).domain,
        is(ImmutableList.of(Long.MIN_VALUE, Long.MAX_VALUE - 1)));

    assertThat(model.constraints(), hasSize(6));
  }

  @Test void testObjective() {
    assertThat(model.objective(), nullValue());
    model.minimize(linear.minus(x, y));
    final CpModel.Objective minimize =
        Objects.requireNonNull(model.objective());
    assertThat(minimize.maximize, is(false));
    assertThat(minimize,
        hasToString("minimize {vars: [0, 1], coeffs: [1, -1], offset: 0}"));

    // Maximizing stores the negated expression
    model.maximize(linear.plus(x, 2));
    final CpModel.Objective maximize =
        Objects.requireNonNull(model.objective());
    assertThat(maximize.maximize, is(true));
    assertThat(maximize.proto,
        is(LinearProto.of(ImmutableList.of(0), ImmutableList.of(-1L), -2)));
    assertThat(maximize,
        hasToString("maximize -{vars: [0], coeffs: [-1], offset: -2}"));
  }
}

// End CpModelTest.java
