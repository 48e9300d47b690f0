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
import org.flatqasm.expr.Expr;

/**
 * A call to a named gate with angle and qubit arguments. Appears both in gate definition bodies
 * (where its arguments refer to the definition's formal parameters) and at top level (where they
 * refer to registers).
 */
public record GateCall(
    String name,
    ImmutableList<Expr> angles,
    ImmutableList<QubitRef> qubits,
    SourcePosition position) {

  /** Returns a copy of this call with different arguments but the same name and position. */
  GateCall withArguments(ImmutableList<Expr> newAngles, ImmutableList<QubitRef> newQubits) {
    return new GateCall(name, newAngles, newQubits, position);
  }

  /** True if {@code other} calls the same gate with the same arguments, wherever it appears. */
  boolean sameOperation(GateCall other) {
    return name.equals(other.name) && angles.equals(other.angles) && qubits.equals(other.qubits);
  }

  @Override
  public String toString() {
    return Emitter.format(name, angles, qubits);
  }
}
