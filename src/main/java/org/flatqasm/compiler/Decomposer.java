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
import java.util.List;
import org.flatqasm.compiler.ConversionError.Kind;

/**
 * Rewrites the output of {@link MacroExpander} into primitive instructions, applying the {@link
 * DecompositionRule} of each composite gate.
 */
final class Decomposer {

  private final DefinitionTable definitions;

  Decomposer(DefinitionTable definitions) {
    this.definitions = definitions;
  }

  /** Returns the primitive instructions for the given calls, in order. */
  ImmutableList<Instruction> rewrite(List<GateCall> calls) {
    ImmutableList.Builder<Instruction> result = ImmutableList.builder();
    for (GateCall call : calls) {
      GateDefinition definition = definitions.get(call.name());
      if (definition == null) {
        throw Flattener.error(
            Kind.UNDEFINED_GATE, call.position(), "Undefined gate '%s'", call.name());
      }
      MacroExpander.checkArity(definition, call);
      switch (definition.kind) {
        case PRIMITIVE -> result.add(Instruction.of(call));
        case COMPOSITE -> result.addAll(definition.rule.apply(call.angles(), call.qubits()));
        case OPAQUE ->
            throw Flattener.error(
                Kind.UNSUPPORTED_GATE,
                call.position(),
                "Opaque gate '%s' has no decomposition into primitives",
                call.name());
        case USER_DEFINED ->
            // MacroExpander should have replaced these.
            throw new AssertionError("Unexpanded call to " + call.name());
      }
    }
    return result.build();
  }
}
