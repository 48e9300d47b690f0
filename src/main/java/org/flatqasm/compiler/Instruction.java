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

import com.google.common.collect.ImmutableList;
import org.flatqasm.expr.Expr;

/**
 * One line of flattened output: a call to a primitive gate with resolved angles and concrete
 * qubits.
 */
public record Instruction(
    String gate, ImmutableList<Expr> angles, ImmutableList<QubitRef> qubits) {

  /** The universal single-qubit rotation {@code u(theta,phi,lambda)}. */
  public static final String U = "u";

  /** Controlled-NOT. */
  public static final String CX = "cx";

  public Instruction {
    checkArgument(
        angles.stream().allMatch(Expr::isResolved), "Unresolved angle in %s", angles);
    checkArgument(
        qubits.stream().allMatch(QubitRef::isConcrete), "Unresolved qubit in %s", qubits);
  }

  public static Instruction u(Expr theta, Expr phi, Expr lambda, QubitRef qubit) {
    return new Instruction(U, ImmutableList.of(theta, phi, lambda), ImmutableList.of(qubit));
  }

  public static Instruction cx(QubitRef control, QubitRef target) {
    return new Instruction(CX, ImmutableList.of(), ImmutableList.of(control, target));
  }

  /** Returns an instruction that calls a primitive gate exactly as {@code call} does. */
  static Instruction of(GateCall call) {
    return new Instruction(call.name(), call.angles(), call.qubits());
  }

  @Override
  public String toString() {
    return Emitter.format(gate, angles, qubits);
  }
}
