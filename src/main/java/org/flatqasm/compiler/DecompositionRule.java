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
import static org.flatqasm.expr.Expr.PI;
import static org.flatqasm.expr.Expr.ZERO;
import static org.flatqasm.expr.Expr.half;
import static org.flatqasm.expr.Expr.negate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import org.flatqasm.expr.Expr;
import org.jspecify.annotations.Nullable;

/**
 * The fixed rewrite rules that turn each composite gate into a sequence of {@code u} and {@code
 * cx} instructions.
 *
 * <p>Except for {@code cp}, each rule reproduces the gate's definition in {@code qelib1.inc}, with
 * the library's single-qubit gates replaced by their {@code u} equivalents, so a rewritten circuit
 * has exactly the semantics (including relative phases) that the library gives it. {@code cp} is
 * rewritten to the four-instruction sequence {@code u(0,0,θ/2) b; cx a,b; u(0,0,-(θ/2)) b; cx a,b}.
 *
 * <p>Every right hand side is written in terms of primitives (library gates used inside another
 * gate's definition, such as {@code ccx} in {@code cswap}, are expanded by shared helpers), so a
 * single application of a rule always yields a primitive-only sequence.
 */
public enum DecompositionRule {
  /** The OpenQASM built-in {@code U}. */
  U_BUILTIN("U", 3, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u(a.get(0), a.get(1), a.get(2), q.get(0));
    }
  },
  /** The OpenQASM built-in {@code CX}. */
  CX_BUILTIN("CX", 0, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.cx(q.get(0), q.get(1));
    }
  },
  U3("u3", 3, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u(a.get(0), a.get(1), a.get(2), q.get(0));
    }
  },
  U2("u2", 2, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u2(a.get(0), a.get(1), q.get(0));
    }
  },
  U1("u1", 1, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u1(a.get(0), q.get(0));
    }
  },
  P("p", 1, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u1(a.get(0), q.get(0));
    }
  },
  ID("id", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u(ZERO, ZERO, ZERO, q.get(0));
    }
  },
  /** An idle gate; qelib1 ignores its duration argument. */
  U0("u0", 1, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u(ZERO, ZERO, ZERO, q.get(0));
    }
  },
  X("x", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.x(q.get(0));
    }
  },
  Y("y", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u(PI, half(PI), half(PI), q.get(0));
    }
  },
  Z("z", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u1(PI, q.get(0));
    }
  },
  H("h", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.h(q.get(0));
    }
  },
  S("s", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.s(q.get(0));
    }
  },
  SDG("sdg", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.sdg(q.get(0));
    }
  },
  T("t", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.t(q.get(0));
    }
  },
  TDG("tdg", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.tdg(q.get(0));
    }
  },
  /** sqrt(X), equal to {@code rx(pi/2)} up to a global phase of {@code pi/4}. */
  SX("sx", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u(half(PI), negate(half(PI)), half(PI), q.get(0));
    }
  },
  SXDG("sxdg", 0, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u(half(PI), half(PI), negate(half(PI)), q.get(0));
    }
  },
  RX("rx", 1, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u(a.get(0), negate(half(PI)), half(PI), q.get(0));
    }
  },
  RY("ry", 1, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u(a.get(0), ZERO, ZERO, q.get(0));
    }
  },
  RZ("rz", 1, 1) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u1(a.get(0), q.get(0));
    }
  },
  CZ("cz", 0, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.h(q.get(1)).cx(q.get(0), q.get(1)).h(q.get(1));
    }
  },
  CY("cy", 0, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.sdg(q.get(1)).cx(q.get(0), q.get(1)).s(q.get(1));
    }
  },
  CH("ch", 0, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      QubitRef c = q.get(0);
      QubitRef t = q.get(1);
      out.h(t).sdg(t).cx(c, t);
      out.h(t).t(t).cx(c, t);
      out.t(t).h(t).s(t).x(t).s(c);
    }
  },
  SWAP("swap", 0, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.cx(q.get(0), q.get(1)).cx(q.get(1), q.get(0)).cx(q.get(0), q.get(1));
    }
  },
  /** The Toffoli gate, as the standard 15-gate sequence (6 {@code cx}). */
  CCX("ccx", 0, 3) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.ccx(q.get(0), q.get(1), q.get(2));
    }
  },
  /** Fredkin gate: swaps its second and third qubits if the first is set. */
  CSWAP("cswap", 0, 3) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.cx(q.get(2), q.get(1));
      out.ccx(q.get(0), q.get(1), q.get(2));
      out.cx(q.get(2), q.get(1));
    }
  },
  /**
   * Controlled phase. The halved angle is an explicit division and its inverse an explicit
   * negation, so the output shows the exact relationship to the source angle.
   */
  CP("cp", 1, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      Expr halfTheta = half(a.get(0));
      QubitRef control = q.get(0);
      QubitRef target = q.get(1);
      out.u1(halfTheta, target).cx(control, target);
      out.u1(negate(halfTheta), target).cx(control, target);
    }
  },
  CU1("cu1", 1, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.cu1(a.get(0), q.get(0), q.get(1));
    }
  },
  CSX("csx", 0, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.controlledXRoot(half(PI), q.get(0), q.get(1));
    }
  },
  CRX("crx", 1, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      Expr lambda = a.get(0);
      QubitRef control = q.get(0);
      QubitRef target = q.get(1);
      out.u1(half(PI), target).cx(control, target);
      out.u(negate(half(lambda)), ZERO, ZERO, target).cx(control, target);
      out.u(half(lambda), negate(half(PI)), ZERO, target);
    }
  },
  CRY("cry", 1, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      Expr lambda = a.get(0);
      QubitRef control = q.get(0);
      QubitRef target = q.get(1);
      out.u(half(lambda), ZERO, ZERO, target).cx(control, target);
      out.u(negate(half(lambda)), ZERO, ZERO, target).cx(control, target);
    }
  },
  CRZ("crz", 1, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      Expr halfLambda = half(a.get(0));
      QubitRef control = q.get(0);
      QubitRef target = q.get(1);
      out.u1(halfLambda, target).cx(control, target);
      out.u1(negate(halfLambda), target).cx(control, target);
    }
  },
  CU3("cu3", 3, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.cu3(a.get(0), a.get(1), a.get(2), q.get(0), q.get(1));
    }
  },
  /** Controlled {@code u3} with an additional phase {@code gamma} on the control. */
  CU("cu", 4, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.u1(a.get(3), q.get(0));
      out.cu3(a.get(0), a.get(1), a.get(2), q.get(0), q.get(1));
    }
  },
  /** ZZ rotation. */
  RZZ("rzz", 1, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.cx(q.get(0), q.get(1)).u1(a.get(0), q.get(1)).cx(q.get(0), q.get(1));
    }
  },
  /** XX rotation. */
  RXX("rxx", 1, 2) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      Expr theta = a.get(0);
      QubitRef x = q.get(0);
      QubitRef y = q.get(1);
      out.u(half(PI), theta, ZERO, x).h(y);
      out.cx(x, y).u1(negate(theta), y).cx(x, y);
      out.h(y).u2(negate(PI), Expr.subtract(PI, theta), x);
    }
  },
  /**
   * Toffoli up to relative phases on some basis states (the Margolus gate). It needs only 3
   * {@code cx}, so it's useful when the phases are undone later.
   */
  RCCX("rccx", 0, 3) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      QubitRef x = q.get(0);
      QubitRef y = q.get(1);
      QubitRef z = q.get(2);
      out.h(z).t(z);
      out.cx(y, z).tdg(z);
      out.cx(x, z).t(z);
      out.cx(y, z).tdg(z).h(z);
    }
  },
  /** Three-control Toffoli up to relative phases. */
  RC3X("rc3x", 0, 4) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      QubitRef w = q.get(0);
      QubitRef x = q.get(1);
      QubitRef y = q.get(2);
      QubitRef z = q.get(3);
      out.h(z).t(z);
      out.cx(y, z).tdg(z).h(z);
      out.cx(w, z).t(z);
      out.cx(x, z).tdg(z);
      out.cx(w, z).t(z);
      out.cx(x, z).tdg(z).h(z).t(z);
      out.cx(y, z).tdg(z).h(z);
    }
  },
  C3X("c3x", 0, 4) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.c3x(q.get(0), q.get(1), q.get(2), q.get(3));
    }
  },
  /** Three-control {@code sx}. */
  C3SQRTX("c3sqrtx", 0, 4) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      out.c3sqrtx(q.get(0), q.get(1), q.get(2), q.get(3));
    }
  },
  C4X("c4x", 0, 5) {
    @Override
    void expand(Sequence out, List<Expr> a, List<QubitRef> q) {
      QubitRef d = q.get(3);
      QubitRef e = q.get(4);
      out.controlledXRoot(half(PI), d, e);
      out.c3x(q.get(0), q.get(1), q.get(2), d);
      out.controlledXRoot(negate(half(PI)), d, e);
      out.c3x(q.get(0), q.get(1), q.get(2), d);
      out.c3sqrtx(q.get(0), q.get(1), q.get(2), e);
    }
  };

  /** The gate name as it appears in source. */
  public final String gateName;

  public final int numAngles;
  public final int numQubits;

  DecompositionRule(String gateName, int numAngles, int numQubits) {
    this.gateName = gateName;
    this.numAngles = numAngles;
    this.numQubits = numQubits;
  }

  private static final ImmutableMap<String, DecompositionRule> BY_NAME =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(rule -> rule.gateName, rule -> rule));

  /** Returns the rule for the given gate name, or null if there is none. */
  public static @Nullable DecompositionRule forGate(String gateName) {
    return BY_NAME.get(gateName);
  }

  /**
   * True for the gates built into the OpenQASM language ({@code U} and {@code CX}), which are
   * always defined; the others are only defined after {@code include "qelib1.inc"}.
   */
  public boolean isLanguageBuiltin() {
    return this == U_BUILTIN || this == CX_BUILTIN;
  }

  /**
   * Returns the primitive instructions that implement this gate applied to the given arguments.
   * The caller is responsible for checking the number of arguments.
   */
  public ImmutableList<Instruction> apply(List<Expr> angles, List<QubitRef> qubits) {
    checkArgument(angles.size() == numAngles && qubits.size() == numQubits);
    Sequence out = new Sequence();
    expand(out, angles, qubits);
    return out.builder.build();
  }

  /** Appends the instructions for this gate to {@code out}. */
  abstract void expand(Sequence out, List<Expr> a, List<QubitRef> q);

  /**
   * Collects the instructions produced by a rule. The helpers are named after the {@code
   * qelib1.inc} gates they stand for; the single-qubit ones each append a single {@code u}.
   */
  static final class Sequence {
    private final ImmutableList.Builder<Instruction> builder = ImmutableList.builder();

    Sequence u(Expr theta, Expr phi, Expr lambda, QubitRef qubit) {
      builder.add(Instruction.u(theta, phi, lambda, qubit));
      return this;
    }

    Sequence cx(QubitRef control, QubitRef target) {
      builder.add(Instruction.cx(control, target));
      return this;
    }

    Sequence u2(Expr phi, Expr lambda, QubitRef qubit) {
      return u(half(PI), phi, lambda, qubit);
    }

    Sequence u1(Expr lambda, QubitRef qubit) {
      return u(ZERO, ZERO, lambda, qubit);
    }

    Sequence x(QubitRef qubit) {
      return u(PI, ZERO, PI, qubit);
    }

    Sequence h(QubitRef qubit) {
      return u2(ZERO, PI, qubit);
    }

    Sequence s(QubitRef qubit) {
      return u1(half(PI), qubit);
    }

    Sequence sdg(QubitRef qubit) {
      return u1(negate(half(PI)), qubit);
    }

    Sequence t(QubitRef qubit) {
      return u1(piOver(4), qubit);
    }

    Sequence tdg(QubitRef qubit) {
      return u1(negate(piOver(4)), qubit);
    }

    Sequence cu1(Expr lambda, QubitRef control, QubitRef target) {
      Expr halfLambda = half(lambda);
      u1(halfLambda, control).cx(control, target);
      u1(negate(halfLambda), target).cx(control, target);
      return u1(halfLambda, target);
    }

    /** {@code h t; cu1(lambda) c,t; h t}, a controlled power of X. */
    Sequence controlledXRoot(Expr lambda, QubitRef control, QubitRef target) {
      return h(target).cu1(lambda, control, target).h(target);
    }

    Sequence cu3(Expr theta, Expr phi, Expr lambda, QubitRef control, QubitRef target) {
      u1(half(Expr.add(lambda, phi)), control);
      u1(half(Expr.subtract(lambda, phi)), target);
      cx(control, target);
      u(negate(half(theta)), ZERO, negate(half(Expr.add(phi, lambda))), target);
      cx(control, target);
      return u(half(theta), phi, ZERO, target);
    }

    /** The standard 15-gate Toffoli (6 {@code cx}). */
    Sequence ccx(QubitRef x, QubitRef y, QubitRef z) {
      h(z);
      cx(y, z).tdg(z);
      cx(x, z).t(z);
      cx(y, z).tdg(z);
      cx(x, z).t(y).t(z).h(z);
      cx(x, y).t(x).tdg(y);
      return cx(x, y);
    }

    Sequence c3x(QubitRef a, QubitRef b, QubitRef c, QubitRef d) {
      Expr eighth = piOver(8);
      Expr minusEighth = negate(eighth);
      h(d).u1(eighth, a).u1(eighth, b).u1(eighth, c).u1(eighth, d);
      cx(a, b).u1(minusEighth, b).cx(a, b);
      cx(b, c).u1(minusEighth, c);
      cx(a, c).u1(eighth, c);
      cx(b, c).u1(minusEighth, c);
      cx(a, c);
      cx(c, d).u1(minusEighth, d);
      cx(b, d).u1(eighth, d);
      cx(c, d).u1(minusEighth, d);
      cx(a, d).u1(eighth, d);
      cx(c, d).u1(minusEighth, d);
      cx(b, d).u1(eighth, d);
      cx(c, d).u1(minusEighth, d);
      return cx(a, d).h(d);
    }

    Sequence c3sqrtx(QubitRef a, QubitRef b, QubitRef c, QubitRef d) {
      Expr eighth = piOver(8);
      Expr minusEighth = negate(eighth);
      controlledXRoot(eighth, a, d);
      cx(a, b);
      controlledXRoot(minusEighth, b, d);
      cx(a, b);
      controlledXRoot(eighth, b, d);
      cx(b, c);
      controlledXRoot(minusEighth, c, d);
      cx(a, c);
      controlledXRoot(eighth, c, d);
      cx(b, c);
      controlledXRoot(minusEighth, c, d);
      cx(a, c);
      return controlledXRoot(eighth, c, d);
    }

    private static Expr piOver(int n) {
      return Expr.divide(PI, Expr.literal(n));
    }
  }
}
