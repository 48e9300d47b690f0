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

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.flatqasm.expr.Expr;

/**
 * Serializes a {@link FlatProgram}: the quantum register declarations in declaration order,
 * then one line per instruction, e.g.
 *
 * <pre>
 * qreg q[2];
 * u(0,0,(pi/4)/2) q[1];
 * cx q[0],q[1];
 * </pre>
 *
 * No includes, gate definitions, or classical registers are ever written.
 */
public final class Emitter {

  /** The version header written if {@link FlattenOptions#emitHeader} is set. */
  static final String HEADER = "OPENQASM 2.0;";

  private final FlattenOptions options;

  public Emitter(FlattenOptions options) {
    this.options = options;
  }

  /** Returns the text of the given program. Every line, including the last, ends with a newline. */
  public String emit(FlatProgram program) {
    StringBuilder sb = new StringBuilder();
    if (options.emitHeader()) {
      sb.append(HEADER).append('\n');
    }
    program.registers().forEach(r -> sb.append(r).append('\n'));
    Function<Expr, String> angleFormat =
        options.numericAngles() ? angle -> formatNumber(angle.evaluate()) : Expr::toString;
    for (Instruction inst : program.instructions()) {
      sb.append(format(inst.gate(), inst.angles(), inst.qubits(), angleFormat)).append('\n');
    }
    return sb.toString();
  }

  /** Returns e.g. {@code "u(0,0,pi) q[1];"} or {@code "cx q[0],q[1];"}. */
  static String format(String gate, List<Expr> angles, List<QubitRef> qubits) {
    return format(gate, angles, qubits, Expr::toString);
  }

  private static String format(
      String gate, List<Expr> angles, List<QubitRef> qubits, Function<Expr, String> angleFormat) {
    StringBuilder sb = new StringBuilder(gate);
    if (!angles.isEmpty()) {
      sb.append(angles.stream().map(angleFormat).collect(Collectors.joining(",", "(", ")")));
    }
    sb.append(' ');
    sb.append(qubits.stream().map(QubitRef::toString).collect(Collectors.joining(",")));
    return sb.append(';').toString();
  }

  /**
   * Formats an evaluated angle: integral values without a fraction (so {@code 0} rather than
   * {@code 0.0}), anything else as {@link Double#toString} does.
   */
  static String formatNumber(double value) {
    checkArgument(Double.isFinite(value), "Can't write %s as an angle", value);
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }
}
