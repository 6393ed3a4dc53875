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
package net.hydromatic.linear.flatten;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.linear.util.Static.add;
import static net.hydromatic.linear.util.Static.multiply;
import static net.hydromatic.linear.util.Static.negate;

import com.google.common.collect.Maps;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.linear.expr.ExpVisitor;
import net.hydromatic.linear.expr.ExpressionException;
import net.hydromatic.linear.expr.Linear;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a linear expression into its canonical form, a {@link LinearForm}.
 *
 * <p>Uses a work list rather than recursion, so that a long chain of nested
 * sums does not overflow the stack. A node that is reachable along several
 * paths (as in {@code x + x}) contributes once per path.
 *
 * <p>A flattener holds no state between calls, and is immutable; use {@link
 * #withKeepZeros} and {@link #withTracer} to create a flattener with
 * different settings.
 */
public class Flattener {
  /** Flattener with the default value of each {@link Prop}. */
  public static final Flattener DEFAULT = of(new HashMap<>());

  private final boolean keepZeros;
  private final Tracer tracer;

  private Flattener(boolean keepZeros, Tracer tracer) {
    this.keepZeros = keepZeros;
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Creates a flattener whose settings are given by a property map. */
  public static Flattener of(Map<Prop, Object> map) {
    final Tracer tracer =
        Prop.TRACE.booleanValue(map)
            ? Tracers.printTracer(System.out)
            : Tracers.nullTracer();
    return new Flattener(Prop.KEEP_ZEROS.booleanValue(map), tracer);
  }

  /**
   * Returns a flattener that is the same as this but which keeps, or does
   * not keep, variables whose coefficient is zero.
   */
  public Flattener withKeepZeros(boolean keepZeros) {
    return keepZeros == this.keepZeros
        ? this
        : new Flattener(keepZeros, tracer);
  }

  /** Returns a flattener that is the same as this but with a given tracer. */
  public Flattener withTracer(Tracer tracer) {
    return tracer == this.tracer ? this : new Flattener(keepZeros, tracer);
  }

  /** Flattens an expression. A null expression has form "0". */
  public LinearForm flatten(Linear.@Nullable Exp exp) {
    return flatten(exp, 1L);
  }

  /**
   * Flattens an expression multiplied by a coefficient.
   *
   * @throws ExpressionException if a coefficient or the offset overflows, or
   *     if the expression contains a node that cannot be interpreted
   */
  public LinearForm flatten(Linear.@Nullable Exp exp, long initialCoeff) {
    final Reducer reducer = new Reducer();
    if (exp != null) {
      reducer.queue.add(exp, initialCoeff);
    }
    while (!reducer.queue.isEmpty()) {
      final Linear.Exp e = reducer.queue.headExp();
      final long coeff = reducer.queue.headCoeff();
      reducer.queue.removeHead();
      if (coeff == 0) {
        continue;
      }
      tracer.onExp(e, coeff);
      reducer.coeff = coeff;
      e.accept(reducer);
    }

    if (!keepZeros) {
      return LinearForm.of(
          Maps.filterValues(reducer.terms, v -> v != 0), reducer.offset);
    }
    return LinearForm.of(reducer.terms, reducer.offset);
  }

  /**
   * State of one call to {@link #flatten(Linear.Exp, long)}. Each visit
   * method reduces one node, multiplied by {@link #coeff}, and adds to the
   * terms, the offset or the queue.
   */
  private class Reducer implements ExpVisitor<Void> {
    final Map<Integer, Long> terms = new HashMap<>();
    final WorkList queue = new WorkList();
    long offset = 0L;
    long coeff;

    @Override
    public Void visit(Linear.Constant constant) {
      addOffset(constant.value);
      return null;
    }

    @Override
    public Void visit(Linear.IntVar intVar) {
      addTerm(intVar.index(), coeff);
      return null;
    }

    @Override
    public Void visit(Linear.NotVar notVar) {
      // not(b) is 1 - b
      addTerm(notVar.var.index(), negate(coeff));
      addOffset(1L);
      return null;
    }

    @Override
    public Void visit(Linear.Product product) {
      if (product.coeff != 0) {
        queue.add(product.exp, multiply(product.coeff, coeff));
      }
      return null;
    }

    @Override
    public Void visit(Linear.Sum sum) {
      addOffset(sum.offset);
      for (Linear.Exp child : sum.exps) {
        if (child instanceof Linear.IntVar) {
          addTerm(child.index(), coeff);
        } else if (child instanceof Linear.Product
            && ((Linear.Product) child).exp instanceof Linear.IntVar) {
          final Linear.Product product = (Linear.Product) child;
          addTerm(product.exp.index(), multiply(coeff, product.coeff));
        } else {
          queue.add(child, coeff);
        }
      }
      return null;
    }

    private void addOffset(long value) {
      if (value == 0) {
        return;
      }
      final long delta = multiply(coeff, value);
      tracer.onOffset(delta);
      offset = add(offset, delta);
    }

    private void addTerm(int index, long delta) {
      tracer.onTerm(index, delta);
      terms.merge(index, delta, (v0, v1) -> add(v0, v1));
    }
  }
}

// End Flattener.java
