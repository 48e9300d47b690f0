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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.flatqasm.compiler.ConversionError.Kind;

/**
 * The registers declared by a program. Checks the qubit operands of top-level gate calls and
 * expands calls that name whole registers.
 */
final class RegisterTable {

  private final ImmutableMap<String, QuantumRegister> quantum;
  private final ImmutableSet<String> classical;

  private RegisterTable(
      ImmutableMap<String, QuantumRegister> quantum, ImmutableSet<String> classical) {
    this.quantum = quantum;
    this.classical = classical;
  }

  /** Returns the quantum registers in declaration order. */
  ImmutableList<QuantumRegister> quantumRegisters() {
    return quantum.values().asList();
  }

  /**
   * Returns the calls that a top-level call stands for, with every qubit operand concrete.
   *
   * <p>If no operand is an entire register, that's just the given call. Otherwise all the entire
   * registers must have the same size {@code n}, and the call is repeated {@code n} times, with
   * each register operand replaced by its {@code i}th qubit.
   */
  ImmutableList<GateCall> resolve(GateCall call) {
    int broadcastSize = -1;
    for (QubitRef ref : call.qubits()) {
      QuantumRegister register = lookup(ref, call);
      if (ref.isConcrete()) {
        if (!register.contains(ref.index())) {
          throw Flattener.error(
              Kind.INVALID_QUBIT,
              call.position(),
              "Index %s out of range for register '%s' of size %s",
              ref.index(),
              register.name(),
              register.size());
        }
      } else if (broadcastSize < 0) {
        broadcastSize = register.size();
      } else if (broadcastSize != register.size()) {
        throw Flattener.error(
            Kind.INVALID_QUBIT, call.position(), "Registers of different sizes in '%s'", call);
      }
    }
    ImmutableList<GateCall> result;
    if (broadcastSize < 0) {
      result = ImmutableList.of(call);
    } else {
      ImmutableList.Builder<GateCall> builder = ImmutableList.builder();
      for (int i = 0; i < broadcastSize; i++) {
        int index = i;
        builder.add(
            call.withArguments(
                call.angles(),
                call.qubits().stream()
                    .map(ref -> ref.isConcrete() ? ref : QubitRef.of(ref.name(), index))
                    .collect(ImmutableList.toImmutableList())));
      }
      result = builder.build();
    }
    result.forEach(RegisterTable::checkDistinct);
    return result;
  }

  private QuantumRegister lookup(QubitRef ref, GateCall call) {
    QuantumRegister register = quantum.get(ref.name());
    if (register == null) {
      String problem = classical.contains(ref.name()) ? "is not a quantum register" : "undefined";
      throw Flattener.error(Kind.INVALID_QUBIT, call.position(), "'%s' %s", ref.name(), problem);
    }
    return register;
  }

  private static void checkDistinct(GateCall call) {
    Set<QubitRef> seen = new HashSet<>();
    for (QubitRef ref : call.qubits()) {
      if (!seen.add(ref)) {
        throw Flattener.error(
            Kind.INVALID_QUBIT, call.position(), "Qubit %s used more than once in '%s'", ref, call);
      }
    }
  }

  static Builder builder() {
    return new Builder();
  }

  /** Accumulates register declarations while a program is being read. */
  static final class Builder {
    private final Map<String, QuantumRegister> quantum = new LinkedHashMap<>();
    private final Map<String, SourcePosition> declared = new LinkedHashMap<>();
    private final Set<String> classical = new HashSet<>();

    /** Adds a {@code qreg} or (if {@code isQuantum} is false) {@code creg} declaration. */
    @CanIgnoreReturnValue
    Builder declare(String name, int size, boolean isQuantum, SourcePosition position) {
      SourcePosition prev = declared.putIfAbsent(name, position);
      if (prev != null) {
        throw Flattener.error(
            Kind.DUPLICATE_DEFINITION,
            position,
            "Register '%s' already declared at %s",
            name,
            prev);
      }
      if (size <= 0) {
        throw Flattener.error(
            Kind.SYNTAX, position, "Register '%s' must have positive size", name);
      }
      if (isQuantum) {
        quantum.put(name, new QuantumRegister(name, size));
      } else {
        classical.add(name);
      }
      return this;
    }

    RegisterTable build() {
      return new RegisterTable(ImmutableMap.copyOf(quantum), ImmutableSet.copyOf(classical));
    }
  }
}
