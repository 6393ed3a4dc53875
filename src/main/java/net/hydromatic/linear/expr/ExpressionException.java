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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when an expression cannot be built or flattened.
 *
 * <p>These are violations of the calling contract, not transient conditions;
 * the node that was being built is never returned.
 */
public class ExpressionException extends RuntimeException {
  public final Reason reason;

  public ExpressionException(
      Reason reason, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.reason = requireNonNull(reason, "reason");
  }

  public ExpressionException(Reason reason, String message) {
    this(reason, message, null);
  }

  @Override
  public String toString() {
    return super.toString() + " [" + reason + "]";
  }

  /** Creates an exception for paired lists of different lengths. */
  public static ExpressionException mismatch(
      String what, int leftSize, int rightSize) {
    return new ExpressionException(
        Reason.STRUCTURAL_MISMATCH,
        "in "
            + what
            + ", the two lists do not have the same length ("
            + leftSize
            + " vs "
            + rightSize
            + ")");
  }

  /** Creates an exception for a node the flattener does not understand. */
  public static ExpressionException cannotInterpret(Object node) {
    return new ExpressionException(
        Reason.CANNOT_INTERPRET,
        "Cannot interpret '" + node + "' in an integer expression");
  }

  /** Creates an exception for an arithmetic result out of range. */
  public static ExpressionException overflow(
      String operation, ArithmeticException cause) {
    return new ExpressionException(
        Reason.OVERFLOW, "integer overflow in " + operation, cause);
  }

  /** Kind of failure. */
  public enum Reason {
    /** Paired lists (variables and coefficients) have different lengths. */
    STRUCTURAL_MISMATCH,
    /** Attempt to negate a variable whose domain is not {0, 1}. */
    NOT_BOOLEAN,
    /** The flattener met a node it cannot interpret. */
    CANNOT_INTERPRET,
    /**
     * A chained comparison tried to narrow a side that is already bounded, or
     * was applied to something other than a range.
     */
    BAD_TIGHTENING,
    /** A coefficient or offset does not fit in a {@code long}. */
    OVERFLOW
  }
}

// End ExpressionException.java
