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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.IntToLongFunction;
import net.hydromatic.linear.model.VariableRegistry;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Nodes of a linear expression.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Nodes are immutable, and are created by {@link LinearBuilder}.
 *
 * <p>Nodes form a directed acyclic graph: the same node may be a child of
 * several parents, as in {@code x + x}.
 */
public class Linear {
  private Linear() {}

  /** Base class of linear expressions. */
  public abstract static class Exp {
    public final Op op;

    Exp(Op op) {
      this.op = requireNonNull(op, "op");
    }

    /**
     * Returns the index of this expression, if it is a literal.
     *
     * @throws UnsupportedOperationException if this is not a variable or a
     *     negated variable
     */
    public int index() {
      throw new UnsupportedOperationException(
          "expression '" + this + "' has no index");
    }

    /**
     * Converts this node into a string.
     *
     * <p>Marked final because you should override unparse, not toString.
     */
    @Override
    public final String toString() {
      return unparse(new StringBuilder(), 0, 0).toString();
    }

    abstract StringBuilder unparse(StringBuilder buf, int left, int right);

    /**
     * Accepts a visitor, calling the {@link ExpVisitor#visit} method
     * appropriate to the type of this node, and returning the result.
     *
     * <p>Each kind of node overrides this method; a node that does not is
     * passed to {@link ExpVisitor#visitOther}.
     */
    public <R> R accept(ExpVisitor<R> visitor) {
      return visitor.visitOther(this);
    }

    /**
     * Evaluates this expression, given the value of each variable.
     *
     * @param values Maps a variable's index to its value
     */
    public long evaluate(IntToLongFunction values) {
      return accept(new Evaluator(values));
    }
  }

  /** Integer constant. */
  public static class Constant extends Exp {
    public final long value;

    Constant(long value) {
      super(Op.CONSTANT);
      this.value = value;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(value);
    }

    @Override
    public <R> R accept(ExpVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Reference to a decision variable that is registered in a {@link
   * VariableRegistry}.
   *
   * <p>Two references with the same registry and index are equal.
   */
  public static class IntVar extends Exp implements Literal {
    public final VariableRegistry registry;
    private final int index;

    /** Negation of this variable; created on first call to {@link #not}. */
    private @Nullable NotVar negation;

    IntVar(VariableRegistry registry, int index) {
      super(Op.VARIABLE);
      this.registry = requireNonNull(registry, "registry");
      this.index = index;
    }

    @Override
    public int index() {
      return index;
    }

    /** Returns the name of this variable, or null if it has no name. */
    public @Nullable String name() {
      return registry.name(index);
    }

    /** Returns the domain of this variable, as a flattened interval list. */
    public ImmutableList<Long> domain() {
      return registry.domain(index);
    }

    /**
     * Returns the negation of this boolean variable.
     *
     * <p>Calling this method twice returns the same object.
     *
     * @throws ExpressionException if the domain of this variable is not {0, 1}
     */
    @Override
    public NotVar not() {
      if (negation == null) {
        if (!isBoolean(domain())) {
          throw new ExpressionException(
              ExpressionException.Reason.NOT_BOOLEAN,
              "Cannot call not() on non-boolean variable '"
                  + this
                  + "' with domain "
                  + domain());
        }
        negation = new NotVar(this);
      }
      return negation;
    }

    @Override
    public int hashCode() {
      return index;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IntVar
              && index == ((IntVar) o).index
              && registry == ((IntVar) o).registry;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      final String name = name();
      return name != null ? buf.append(name) : buf.append('v').append(index);
    }

    @Override
    public <R> R accept(ExpVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Returns whether a flattened interval list contains exactly the values 0
   * and 1.
   */
  static boolean isBoolean(List<Long> domain) {
    if (domain.size() % 2 != 0) {
      return false;
    }
    boolean zero = false;
    boolean one = false;
    for (int i = 0; i < domain.size(); i += 2) {
      final long lo = domain.get(i);
      final long hi = domain.get(i + 1);
      if (lo < 0 || hi > 1) {
        return false;
      }
      zero |= lo == 0;
      one |= hi == 1;
    }
    return zero && one;
  }

  /**
   * Negation of a boolean variable; as an integer expression, {@code not(b)}
   * is equivalent to {@code 1 - b}.
   */
  public static class NotVar extends Exp implements Literal {
    public final IntVar var;

    NotVar(IntVar var) {
      super(Op.NOT);
      this.var = requireNonNull(var, "var");
    }

    @Override
    public int index() {
      return -var.index() - 1;
    }

    /** Returns the variable that this literal negates. */
    @Override
    public IntVar not() {
      return var;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return var.unparse(buf.append("not("), 0, 0).append(')');
    }

    @Override
    public <R> R accept(ExpVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Expression multiplied by a constant. */
  public static class Product extends Exp {
    public final Exp exp;
    public final long coeff;

    Product(Exp exp, long coeff) {
      super(Op.PRODUCT);
      this.exp = requireNonNull(exp, "exp");
      this.coeff = coeff;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (left > op.left || right > op.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      buf.append(coeff).append(op.padded);
      return exp.unparse(buf, op.right, right);
    }

    @Override
    public <R> R accept(ExpVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Sum of zero or more expressions, plus a constant offset. */
  public static class Sum extends Exp {
    public final ImmutableList<Exp> exps;
    public final long offset;

    Sum(ImmutableList<Exp> exps, long offset) {
      super(Op.SUM);
      this.exps = requireNonNull(exps, "exps");
      this.offset = offset;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (exps.isEmpty()) {
        return buf.append(offset);
      }
      if (exps.size() == 1 && offset == 0) {
        // singleton sum prints as the sole term
        return exps.get(0).unparse(buf, left, right);
      }
      if (left > op.left || right > op.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      for (int i = 0; i < exps.size(); i++) {
        final Exp exp = exps.get(i);
        if (i > 0) {
          buf.append(op.padded);
        }
        final boolean last = i == exps.size() - 1 && offset == 0;
        exp.unparse(buf, i == 0 ? left : op.right, last ? right : op.left);
      }
      if (offset > 0) {
        buf.append(" + ").append(offset);
      } else if (offset < 0) {
        // "x - 3" rather than "x + -3"; substring handles Long.MIN_VALUE
        buf.append(" - ").append(Long.toString(offset).substring(1));
      }
      return buf;
    }

    @Override
    public <R> R accept(ExpVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}

// End Linear.java
