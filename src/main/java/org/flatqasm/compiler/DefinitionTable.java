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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.flatqasm.compiler.ConversionError.Kind;
import org.jspecify.annotations.Nullable;

/**
 * Maps each gate name to its definition. A DefinitionTable is created by a {@link Builder} while
 * the program is read, and is immutable from then on; expansion and decomposition only read it.
 */
public final class DefinitionTable {

  private final ImmutableMap<String, GateDefinition> definitions;

  private DefinitionTable(ImmutableMap<String, GateDefinition> definitions) {
    this.definitions = definitions;
  }

  /** Returns the definition of the named gate, or null if there is none. */
  public @Nullable GateDefinition get(String name) {
    return definitions.get(name);
  }

  /** Returns all definitions, in the order they were first added. */
  public ImmutableCollection<GateDefinition> definitions() {
    return definitions.values();
  }

  public int size() {
    return definitions.size();
  }

  /**
   * Returns a new Builder, already containing the target primitives {@code u} and {@code cx}, the
   * OpenQASM built-ins {@code U} and {@code CX}, and any additional target primitives.
   *
   * @param targetPrimitives the names of library gates that the target accepts directly. These are
   *     defined (as primitives) whether or not their library is included, since flattened output
   *     uses them without an include.
   */
  static Builder builder(ImmutableSet<String> targetPrimitives) {
    return new Builder(targetPrimitives);
  }

  /** Accumulates definitions while a program is being read. */
  static final class Builder {
    private final Map<String, GateDefinition> definitions = new LinkedHashMap<>();

    private Builder(ImmutableSet<String> targetPrimitives) {
      put(GateDefinition.primitive(Instruction.U, 3, 1, false));
      put(GateDefinition.primitive(Instruction.CX, 0, 2, false));
      put(GateDefinition.composite(DecompositionRule.U_BUILTIN));
      put(GateDefinition.composite(DecompositionRule.CX_BUILTIN));
      for (String name : targetPrimitives) {
        DecompositionRule rule = DecompositionRule.forGate(name);
        checkArgument(rule != null, "No library gate named '%s'", name);
        put(GateDefinition.primitive(name, rule.numAngles, rule.numQubits, true));
      }
    }

    private void put(GateDefinition definition) {
      definitions.put(definition.name, definition);
    }

    /**
     * Adds the gates of the given library. Including the same library twice is harmless. A gate
     * that is already defined keeps its definition, whether it is a target primitive or was
     * defined by the program (with the library's arity).
     */
    @CanIgnoreReturnValue
    Builder include(GateLibrary library, SourcePosition position) {
      for (DecompositionRule rule : library.rules()) {
        GateDefinition definition = GateDefinition.composite(rule);
        GateDefinition prev = definitions.get(rule.gateName);
        if (prev == null) {
          put(definition);
        } else if (!prev.fromLibrary && !prev.sameArity(definition)) {
          throw Flattener.error(
              Kind.DUPLICATE_DEFINITION,
              position,
              "%s conflicts with '%s' from %s",
              describe(prev),
              definition.signature(),
              library.fileName);
        }
      }
      return this;
    }

    /**
     * Adds a gate defined by the program.
     *
     * <p>A definition identical to an earlier one is ignored. A definition may replace one added
     * by an {@code include} if both have the same number of angles and qubits. Any other
     * redefinition is an error.
     */
    @CanIgnoreReturnValue
    Builder define(GateDefinition definition) {
      GateDefinition prev = definitions.get(definition.name);
      if (prev == null || (prev.fromLibrary && prev.sameArity(definition))) {
        put(definition);
      } else if (!prev.sameAs(definition)) {
        throw Flattener.error(
            Kind.DUPLICATE_DEFINITION,
            definition.position,
            "%s conflicts with '%s'",
            describe(prev),
            definition.signature());
      }
      return this;
    }

    private static String describe(GateDefinition prev) {
      if (prev.position.equals(SourcePosition.NONE)) {
        return String.format("Built-in gate '%s'", prev.signature());
      }
      return String.format("Gate '%s' (defined at %s)", prev.signature(), prev.position);
    }

    DefinitionTable build() {
      return new DefinitionTable(ImmutableMap.copyOf(definitions));
    }
  }
}
