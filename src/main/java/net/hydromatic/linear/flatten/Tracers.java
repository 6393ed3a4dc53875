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

import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.function.LongConsumer;
import java.util.function.ObjLongConsumer;
import net.hydromatic.linear.expr.Linear;

/** Implementations of {@link Tracer}. */
public class Tracers {

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static ConfigurableTracer nullTracer() {
    return ConfigurableTracerImpl.INITIAL;
  }

  /** Returns a tracer that writes debugging messages to a writer. */
  public static ConfigurableTracer printTracer(PrintWriter w) {
    final PrintTracer p = new PrintTracer(w);
    return ConfigurableTracerImpl.INITIAL
        .withExpHandler(p::onExp)
        .withTermHandler(p::onTerm)
        .withOffsetHandler(p::onOffset);
  }

  /** Returns a tracer that writes debugging messages to a stream. */
  public static ConfigurableTracer printTracer(OutputStream stream) {
    return printTracer(new PrintWriter(stream, false, StandardCharsets.UTF_8));
  }

  /**
   * Implementation of {@link Tracer} that writes to a given {@link
   * PrintWriter}.
   */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    public void onExp(Linear.Exp exp, long coeff) {
      w.println("exp " + coeff + " * [" + exp + "]");
      w.flush();
    }

    public void onTerm(int index, long delta) {
      w.println("term v" + index + " += " + delta);
      w.flush();
    }

    public void onOffset(long delta) {
      w.println("offset += " + delta);
      w.flush();
    }
  }

  /** Tracer that allows each of its methods to be modified using a handler. */
  public interface ConfigurableTracer extends Tracer {
    /** Sets handler for {@link #onExp(Linear.Exp, long)}. */
    ConfigurableTracer withExpHandler(ObjLongConsumer<Linear.Exp> handler);
    /** Sets handler for {@link #onTerm(int, long)}. */
    ConfigurableTracer withTermHandler(IntLongConsumer handler);
    /** Sets handler for {@link #onOffset(long)}. */
    ConfigurableTracer withOffsetHandler(LongConsumer handler);
  }

  /** Consumer that accepts an {@code int} and a {@code long}. */
  @FunctionalInterface
  public interface IntLongConsumer {
    void accept(int i, long v);
  }

  /**
   * Implementation of {@link ConfigurableTracer} that has a field for each
   * handler.
   */
  private static class ConfigurableTracerImpl implements ConfigurableTracer {
    static final ConfigurableTracerImpl INITIAL =
        new ConfigurableTracerImpl((exp, coeff) -> {}, (i, v) -> {}, v -> {});

    private final ObjLongConsumer<Linear.Exp> expHandler;
    private final IntLongConsumer termHandler;
    private final LongConsumer offsetHandler;

    private ConfigurableTracerImpl(
        ObjLongConsumer<Linear.Exp> expHandler,
        IntLongConsumer termHandler,
        LongConsumer offsetHandler) {
      this.expHandler = requireNonNull(expHandler);
      this.termHandler = requireNonNull(termHandler);
      this.offsetHandler = requireNonNull(offsetHandler);
    }

    @Override
    public ConfigurableTracer withExpHandler(
        ObjLongConsumer<Linear.Exp> expHandler) {
      return new ConfigurableTracerImpl(expHandler, termHandler, offsetHandler);
    }

    @Override
    public ConfigurableTracer withTermHandler(IntLongConsumer termHandler) {
      return new ConfigurableTracerImpl(expHandler, termHandler, offsetHandler);
    }

    @Override
    public ConfigurableTracer withOffsetHandler(LongConsumer offsetHandler) {
      return new ConfigurableTracerImpl(expHandler, termHandler, offsetHandler);
    }

    @Override
    public void onExp(Linear.Exp exp, long coeff) {
      expHandler.accept(exp, coeff);
    }

    @Override
    public void onTerm(int index, long delta) {
      termHandler.accept(index, delta);
    }

    @Override
    public void onOffset(long delta) {
      offsetHandler.accept(delta);
    }
  }
}

// End Tracers.java
