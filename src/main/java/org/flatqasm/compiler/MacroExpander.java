/*
 * Copyright 2025 The FlatQasm Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.flatqasm.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.flatqasm.compiler.ConversionError.Kind;
import org.flatqasm.expr.Expr;
import org.jspecify.annotations.Nullable;

/**
 * Replaces each call to a user-defined gate by the gate's body, recursively, leaving only calls to
 * primitive, composite and opaque gates.
 *
 * <p>Expansion uses an explicit work list rather than Java recursion, so deeply nested definitions
 * can't overflow the stack. Each entry on the work list records the chain of user-defined gates
 * being expanded when it was created; a call to a gate already on its own chain is a cycle.
 */
final class MacroExpander {

  private final DefinitionTable definitions;

  MacroExpander(DefinitionTable definitions) {
    this.definitions = definitions;
  }

  /**
   * The user-defined gates whose expansion produced a call, innermost first. Immutable, so that
   * siblings in a body can share their parent's chain.
   */
  record ExpansionChain(String gate, @Nullable ExpansionChain parent) {

    static boolean contains(@Nullable ExpansionChain chain, String gate) {
      for (ExpansionChain c = chain; c != null; c = c.parent) {
        if (c.gate.equals(gate)) {
          return true;
        }
      }
      return false;
    }

    /** Returns e.g. {@code "a -> b -> c"}, outermost first. */
    @Override
    public String toString() {
      List<String> names = new ArrayList<>();
      for (ExpansionChain c = this; c != null; c = c.parent) {
        names.add(0, c.gate);
      }
      return String.join(" -> ", names);
    }
  }

  /** An entry in the work list. */
  private record Frame(GateCall call, @Nullable ExpansionChain chain) {}

  /**
   * Returns the sequence of non-user-defined calls that {@code call} expands to. {@code call} must
   * have concrete qubit operands (see {@link RegisterTable#resolve}), and so will each returned
   * call.
   */
  ImmutableList<GateCall> expand(GateCall call) {
    ImmutableList.Builder<GateCall> result = ImmutableList.builder();
    Deque<Frame> work = new ArrayDeque<>();
    work.push(new Frame(call, null));
    while (!work.isEmpty()) {
      Frame frame = work.pop();
      GateCall next = frame.call;
      GateDefinition definition = lookup(next);
      switch (definition.kind) {
        case PRIMITIVE, COMPOSITE, OPAQUE -> {
          checkResolved(next);
          result.add(next);
        }
        case USER_DEFINED -> {
          if (ExpansionChain.contains(frame.chain, definition.name)) {
            throw Flattener.error(
                Kind.CYCLIC_DEFINITION,
                next.position(),
                "Gate '%s' is used in its own definition (%s -> %s)",
                definition.name,
                frame.chain,
                definition.name);
          }
          ExpansionChain chain = new ExpansionChain(definition.name, frame.chain);
          Bindings bindings = new Bindings(definition, next);
          // Push in reverse so that the body is popped (and emitted) in order.
          for (GateCall bodyCall : definition.body.reverse()) {
            work.push(new Frame(bindings.apply(bodyCall), chain));
          }
        }
      }
    }
    return result.build();
  }

  /** Returns the definition of the called gate, after checking the number of arguments. */
  private GateDefinition lookup(GateCall call) {
    GateDefinition definition = definitions.get(call.name());
    if (definition == null) {
      throw Flattener.error(
          Kind.UNDEFINED_GATE, call.position(), "Undefined gate '%s'", call.name());
    }
    checkArity(definition, call);
    return definition;
  }

  static void checkArity(GateDefinition definition, GateCall call) {
    if (call.angles().size() != definition.numAngles()
        || call.qubits().size() != definition.numQubits()) {
      throw Flattener.error(
          Kind.ARITY_MISMATCH,
          call.position(),
          "'%s' called with %s angles and %s qubits, expected %s and %s",
          call.name(),
          call.angles().size(),
          call.qubits().size(),
          definition.numAngles(),
          definition.numQubits());
    }
  }

  private static void checkResolved(GateCall call) {
    for (Expr angle : call.angles()) {
      ImmutableSet<String> params = angle.parameters();
      if (!params.isEmpty()) {
        throw Flattener.error(
            Kind.ARITY_MISMATCH,
            call.position(),
            "Unbound parameter '%s' in '%s'",
            params.iterator().next(),
            call);
      }
    }
  }

  /**
   * Maps a user-defined gate's formal parameters to the arguments of one call. Each call gets its
   * own Bindings, so expansions of different calls never see each other's arguments.
   */
  private static final class Bindings {
    private final ImmutableMap<String, Expr> angles;
    private final ImmutableMap<String, QubitRef> qubits;

    Bindings(GateDefinition definition, GateCall call) {
      ImmutableMap.Builder<String, Expr> angleBuilder = ImmutableMap.builder();
      for (int i = 0; i < definition.numAngles(); i++) {
        angleBuilder.put(definition.angleParams.get(i), call.angles().get(i));
      }
      ImmutableMap.Builder<String, QubitRef> qubitBuilder = ImmutableMap.builder();
      for (int i = 0; i < definition.numQubits(); i++) {
        qubitBuilder.put(definition.qubitParams.get(i), call.qubits().get(i));
      }
      this.angles = angleBuilder.buildOrThrow();
      this.qubits = qubitBuilder.buildOrThrow();
    }

    /** Returns a copy of {@code bodyCall} with all formal parameters replaced by arguments. */
    GateCall apply(GateCall bodyCall) {
      ImmutableList<Expr> newAngles =
          bodyCall.angles().stream()
              .map(angle -> angle.substitute(angles))
              .collect(ImmutableList.toImmutableList());
      ImmutableList<QubitRef> newQubits =
          bodyCall.qubits().stream().map(this::bind).collect(ImmutableList.toImmutableList());
      return bodyCall.withArguments(newAngles, newQubits);
    }

    private QubitRef bind(QubitRef formal) {
      QubitRef actual = qubits.get(formal.name());
      // ProgramReader only accepts bodies whose qubit operands are formal parameters.
      assert actual != null && !formal.isConcrete();
      return actual;
    }
  }
}
