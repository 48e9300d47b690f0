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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.flatqasm.expr.Expr.PI;
import static org.flatqasm.expr.Expr.divide;
import static org.flatqasm.expr.Expr.literal;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntUnaryOperator;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.flatqasm.expr.Expr;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class DecompositionRuleTest {

  private static final QubitRef Q0 = QubitRef.of("q", 0);
  private static final QubitRef Q1 = QubitRef.of("q", 1);
  private static final QubitRef Q2 = QubitRef.of("q", 2);
  private static final ImmutableList<QubitRef> QUBITS =
      ImmutableList.of(Q0, Q1, Q2, QubitRef.of("q", 3), QubitRef.of("q", 4));

  private static final double A = 0.3;
  private static final double B = 0.5;
  private static final double C = 0.7;
  private static final double D = 1.1;
  private static final ImmutableList<Expr> ANGLES =
      ImmutableList.of(literal("0.3"), literal("0.5"), literal("0.7"), literal("1.1"));

  private static String lines(List<Instruction> instructions) {
    return instructions.stream().map(i -> i + "\n").reduce("", String::concat);
  }

  @Test
  public void controlledPhaseIsExactlyFourInstructions() {
    QubitRef a = QubitRef.of("a", 0);
    QubitRef b = QubitRef.of("b", 3);
    ImmutableList<Instruction> result =
        DecompositionRule.CP.apply(ImmutableList.of(divide(PI, literal(4))), List.of(a, b));
    assertThat(lines(result))
        .isEqualTo(
            "u(0,0,(pi/4)/2) b[3];\n"
                + "cx a[0],b[3];\n"
                + "u(0,0,-(pi/4)/2) b[3];\n"
                + "cx a[0],b[3];\n");
  }

  @Test
  public void phaseIsSingleInstruction() {
    ImmutableList<Instruction> result =
        DecompositionRule.P.apply(ImmutableList.of(Expr.negate(literal("0.25"))), List.of(Q1));
    assertThat(lines(result)).isEqualTo("u(0,0,-0.25) q[1];\n");
  }

  @Test
  public void everyRuleProducesOnlyPrimitives() {
    for (DecompositionRule rule : DecompositionRule.values()) {
      ImmutableList<Instruction> result =
          rule.apply(ANGLES.subList(0, rule.numAngles), QUBITS.subList(0, rule.numQubits));
      assertWithMessage("%s", rule).that(result).isNotEmpty();
      for (Instruction inst : result) {
        assertWithMessage("%s", rule).that(inst.gate()).isAnyOf(Instruction.U, Instruction.CX);
        assertWithMessage("%s", rule)
            .that(QUBITS.subList(0, rule.numQubits))
            .containsAtLeastElementsIn(inst.qubits());
      }
    }
  }

  @Test
  public void wrongArityIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> DecompositionRule.CX_BUILTIN.apply(ImmutableList.of(), List.of(Q0)));
    assertThrows(
        IllegalArgumentException.class,
        () -> DecompositionRule.RZ.apply(ImmutableList.of(), List.of(Q0)));
  }

  @Test
  public void lookupByName() {
    assertThat(DecompositionRule.forGate("cu3")).isEqualTo(DecompositionRule.CU3);
    assertThat(DecompositionRule.forGate("U")).isEqualTo(DecompositionRule.U_BUILTIN);
    assertThat(DecompositionRule.forGate("u")).isNull();
    assertThat(DecompositionRule.forGate("CU3")).isNull();
    assertThat(DecompositionRule.U_BUILTIN.isLanguageBuiltin()).isTrue();
    assertThat(DecompositionRule.H.isLanguageBuiltin()).isFalse();
    assertThat(DecompositionRule.forGate("cswap")).isEqualTo(DecompositionRule.CSWAP);
    assertThat(DecompositionRule.C4X.numQubits).isEqualTo(5);
    assertThat(DecompositionRule.CU.numAngles).isEqualTo(4);
  }

  @Test
  public void libraryHasEveryNonBuiltinRule() {
    assertThat(GateLibrary.named("qelib1.inc")).isEqualTo(GateLibrary.QELIB1);
    assertThat(GateLibrary.named("stdgates.inc")).isNull();
    assertThat(GateLibrary.QELIB1.rules())
        .containsNoneOf(DecompositionRule.U_BUILTIN, DecompositionRule.CX_BUILTIN);
    assertThat(GateLibrary.QELIB1.rules()).hasSize(DecompositionRule.values().length - 2);
  }

  /** A rule and the unitary it should implement, up to a global phase. */
  record Case(DecompositionRule rule, Unitary expected) {
    @Override
    public String toString() {
      return rule.gateName;
    }
  }

  private static Object[] unitaries() {
    Unitary h = Unitary.of(new double[][] {{1, 0, 1, 0}, {1, 0, -1, 0}}).scale(1 / Math.sqrt(2));
    Unitary x = Unitary.of(new double[][] {{0, 0, 1, 0}, {1, 0, 0, 0}});
    Unitary y = Unitary.of(new double[][] {{0, 0, 0, -1}, {0, 1, 0, 0}});
    Unitary z = Unitary.diagonal(Complex.ONE, new Complex(-1, 0));
    Unitary s = Unitary.diagonal(Complex.ONE, new Complex(0, 1));
    Unitary sdg = Unitary.diagonal(Complex.ONE, new Complex(0, -1));
    double cosA = Math.cos(A / 2);
    double sinA = Math.sin(A / 2);
    Unitary rx = Unitary.of(new double[][] {{cosA, 0, 0, -sinA}, {0, -sinA, cosA, 0}});
    Unitary ry = Unitary.of(new double[][] {{cosA, 0, -sinA, 0}, {sinA, 0, cosA, 0}});
    Unitary rz = Unitary.diagonal(Complex.polar(-A / 2), Complex.polar(A / 2));
    Unitary phase = Unitary.diagonal(Complex.ONE, Complex.polar(A));
    Unitary sx = Unitary.of(new double[][] {{0.5, 0.5, 0.5, -0.5}, {0.5, -0.5, 0.5, 0.5}});
    Unitary sxdg = Unitary.of(new double[][] {{0.5, -0.5, 0.5, 0.5}, {0.5, 0.5, 0.5, -0.5}});
    Unitary rxx =
        Unitary.build(
            4,
            (r, c) ->
                (r == c)
                    ? new Complex(cosA, 0)
                    : (r == (c ^ 3)) ? new Complex(0, -sinA) : Complex.ZERO);
    Unitary rzz =
        Unitary.diagonal(
            Complex.polar(-A / 2),
            Complex.polar(A / 2),
            Complex.polar(A / 2),
            Complex.polar(-A / 2));
    return new Object[] {
      new Case(DecompositionRule.U_BUILTIN, Unitary.u(A, B, C)),
      new Case(
          DecompositionRule.CX_BUILTIN, Unitary.permutation(4, i -> (i & 1) != 0 ? i ^ 2 : i)),
      new Case(DecompositionRule.U3, Unitary.u(A, B, C)),
      new Case(DecompositionRule.U2, Unitary.u(Math.PI / 2, A, B)),
      new Case(DecompositionRule.U1, phase),
      new Case(DecompositionRule.P, phase),
      new Case(DecompositionRule.ID, Unitary.diagonal(Complex.ONE, Complex.ONE)),
      new Case(DecompositionRule.U0, Unitary.diagonal(Complex.ONE, Complex.ONE)),
      new Case(DecompositionRule.X, x),
      new Case(DecompositionRule.Y, y),
      new Case(DecompositionRule.Z, z),
      new Case(DecompositionRule.H, h),
      new Case(DecompositionRule.S, s),
      new Case(DecompositionRule.SDG, sdg),
      new Case(DecompositionRule.T, Unitary.diagonal(Complex.ONE, Complex.polar(Math.PI / 4))),
      new Case(DecompositionRule.TDG, Unitary.diagonal(Complex.ONE, Complex.polar(-Math.PI / 4))),
      new Case(DecompositionRule.SX, sx),
      new Case(DecompositionRule.SXDG, sxdg),
      new Case(DecompositionRule.RX, rx),
      new Case(DecompositionRule.RY, ry),
      new Case(DecompositionRule.RZ, rz),
      new Case(DecompositionRule.CZ, z.controlled()),
      new Case(DecompositionRule.CY, y.controlled()),
      new Case(DecompositionRule.CH, h.controlled()),
      new Case(
          DecompositionRule.SWAP,
          Unitary.permutation(4, i -> ((i & 1) << 1) | ((i >> 1) & 1))),
      new Case(
          DecompositionRule.CCX,
          Unitary.permutation(8, i -> ((i & 1) != 0 && (i & 2) != 0) ? i ^ 4 : i)),
      // Swaps bits 1 and 2 if bit 0 is set.
      new Case(
          DecompositionRule.CSWAP,
          Unitary.permutation(
              8, i -> ((i & 1) != 0) ? 1 | ((i & 2) << 1) | ((i & 4) >> 1) : i)),
      // The relative-phase Toffolis are Toffolis followed by a phase on some basis states.
      new Case(
          DecompositionRule.RCCX,
          x.controlled(2)
              .withRowPhases(
                  Complex.ONE,
                  Complex.ONE,
                  Complex.ONE,
                  new Complex(0, -1),
                  Complex.ONE,
                  new Complex(-1, 0),
                  Complex.ONE,
                  new Complex(0, 1))),
      new Case(DecompositionRule.RC3X, x.controlled(3).withRowPhases(rc3xPhases())),
      new Case(DecompositionRule.C3X, x.controlled(3)),
      new Case(DecompositionRule.C3SQRTX, sx.controlled(3)),
      new Case(DecompositionRule.C4X, x.controlled(4)),
      // The four-instruction cp differs from controlled-p by a phase on the control, so it is
      // compared with controlled-rz instead.
      new Case(DecompositionRule.CP, rz.controlled()),
      new Case(DecompositionRule.CU1, phase.controlled()),
      new Case(DecompositionRule.CRZ, rz.controlled()),
      new Case(DecompositionRule.CU3, Unitary.u(A, B, C).controlled()),
      new Case(DecompositionRule.CU, Unitary.u(A, B, C).phased(D).controlled()),
      new Case(DecompositionRule.CRX, rx.controlled()),
      new Case(DecompositionRule.CRY, ry.controlled()),
      new Case(DecompositionRule.CSX, sx.controlled()),
      new Case(DecompositionRule.RZZ, rzz),
      new Case(DecompositionRule.RXX, rxx),
    };
  }

  /** rc3x differs from c3x by a phase of i on |0011>, -i on |1011>, and -1 on |1111>. */
  private static Complex[] rc3xPhases() {
    Complex[] phases = new Complex[16];
    Arrays.fill(phases, Complex.ONE);
    phases[0b0011] = new Complex(0, 1);
    phases[0b1011] = new Complex(0, -1);
    phases[0b1111] = new Complex(-1, 0);
    return phases;
  }

  @Test
  @Parameters(method = "unitaries")
  public void implementsUnitary(Case testCase) {
    DecompositionRule rule = testCase.rule();
    ImmutableList<Instruction> result =
        rule.apply(ANGLES.subList(0, rule.numAngles), QUBITS.subList(0, rule.numQubits));
    Unitary actual = Unitary.simulate(result, rule.numQubits);
    assertWithMessage("%s expands to\n%s", rule.gateName, lines(result))
        .that(actual.equalsUpToPhase(testCase.expected()))
        .isTrue();
  }

  @Test
  public void everyRuleHasAUnitaryCase() {
    ImmutableList<DecompositionRule> covered =
        Arrays.stream(unitaries())
            .map(c -> ((Case) c).rule())
            .collect(ImmutableList.toImmutableList());
    assertThat(covered).containsExactlyElementsIn(DecompositionRule.values());
  }

  record Complex(double re, double im) {
    static final Complex ZERO = new Complex(0, 0);
    static final Complex ONE = new Complex(1, 0);

    /** Returns e^(i*theta). */
    static Complex polar(double theta) {
      return new Complex(Math.cos(theta), Math.sin(theta));
    }

    Complex plus(Complex other) {
      return new Complex(re + other.re, im + other.im);
    }

    Complex times(Complex other) {
      return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
    }

    Complex dividedBy(Complex other) {
      double d = other.re * other.re + other.im * other.im;
      return new Complex((re * other.re + im * other.im) / d, (im * other.re - re * other.im) / d);
    }

    double abs() {
      return Math.hypot(re, im);
    }
  }

  /**
   * A square matrix over a register of qubits. Basis state {@code i} has qubit {@code k} set iff
   * bit {@code k} of {@code i} is set.
   */
  static final class Unitary {
    private static final double EPSILON = 1e-9;

    final Complex[][] m;

    private Unitary(Complex[][] m) {
      this.m = m;
    }

    interface Entry {
      Complex at(int row, int col);
    }

    static Unitary build(int dim, Entry entry) {
      Complex[][] m = new Complex[dim][dim];
      for (int r = 0; r < dim; r++) {
        for (int c = 0; c < dim; c++) {
          m[r][c] = entry.at(r, c);
        }
      }
      return new Unitary(m);
    }

    /** Each row gives the real and imaginary parts of its entries, alternating. */
    static Unitary of(double[][] rows) {
      return build(rows.length, (r, c) -> new Complex(rows[r][2 * c], rows[r][2 * c + 1]));
    }

    static Unitary diagonal(Complex... entries) {
      return build(entries.length, (r, c) -> (r == c) ? entries[r] : Complex.ZERO);
    }

    static Unitary permutation(int dim, IntUnaryOperator perm) {
      return build(dim, (r, c) -> (perm.applyAsInt(c) == r) ? Complex.ONE : Complex.ZERO);
    }

    /** The textbook u(theta,phi,lambda). */
    static Unitary u(double theta, double phi, double lambda) {
      Complex cos = new Complex(Math.cos(theta / 2), 0);
      Complex sin = new Complex(Math.sin(theta / 2), 0);
      return new Unitary(
          new Complex[][] {
            {cos, new Complex(-1, 0).times(Complex.polar(lambda)).times(sin)},
            {Complex.polar(phi).times(sin), Complex.polar(phi + lambda).times(cos)}
          });
    }

    Unitary scale(double factor) {
      Complex f = new Complex(factor, 0);
      return build(m.length, (r, c) -> m[r][c].times(f));
    }

    /** Returns this gate multiplied by e^(i*alpha). */
    Unitary phased(double alpha) {
      Complex f = Complex.polar(alpha);
      return build(m.length, (r, c) -> m[r][c].times(f));
    }

    /** Returns this unitary with row {@code r} multiplied by {@code phases[r]}. */
    Unitary withRowPhases(Complex... phases) {
      return build(m.length, (r, c) -> m[r][c].times(phases[r]));
    }

    /** Returns this single-qubit gate controlled by qubit 0 and applied to qubit 1. */
    Unitary controlled() {
      return controlled(1);
    }

    /**
     * Returns this single-qubit gate applied to qubit {@code numControls} if qubits 0 through
     * {@code numControls - 1} are all set.
     */
    Unitary controlled(int numControls) {
      int controls = (1 << numControls) - 1;
      return build(
          2 << numControls,
          (r, c) -> {
            if ((r & controls) != (c & controls)) {
              return Complex.ZERO;
            } else if ((r & controls) != controls) {
              return (r == c) ? Complex.ONE : Complex.ZERO;
            }
            return m[r >> numControls][c >> numControls];
          });
    }

    /** Returns the unitary implemented by a sequence of u and cx instructions. */
    static Unitary simulate(List<Instruction> instructions, int numQubits) {
      int dim = 1 << numQubits;
      Complex[][] result = new Complex[dim][dim];
      for (int col = 0; col < dim; col++) {
        Complex[] state = new Complex[dim];
        Arrays.fill(state, Complex.ZERO);
        state[col] = Complex.ONE;
        for (Instruction inst : instructions) {
          apply(inst, state);
        }
        for (int row = 0; row < dim; row++) {
          result[row][col] = state[row];
        }
      }
      return new Unitary(result);
    }

    private static void apply(Instruction inst, Complex[] state) {
      if (inst.gate().equals(Instruction.CX)) {
        int control = 1 << inst.qubits().get(0).index();
        int target = 1 << inst.qubits().get(1).index();
        for (int i = 0; i < state.length; i++) {
          if ((i & control) != 0 && (i & target) == 0) {
            Complex tmp = state[i];
            state[i] = state[i | target];
            state[i | target] = tmp;
          }
        }
        return;
      }
      assertThat(inst.gate()).isEqualTo(Instruction.U);
      Complex[][] u =
          u(
                  inst.angles().get(0).evaluate(),
                  inst.angles().get(1).evaluate(),
                  inst.angles().get(2).evaluate())
              .m;
      int bit = 1 << inst.qubits().get(0).index();
      for (int i = 0; i < state.length; i++) {
        if ((i & bit) == 0) {
          Complex a = state[i];
          Complex b = state[i | bit];
          state[i] = u[0][0].times(a).plus(u[0][1].times(b));
          state[i | bit] = u[1][0].times(a).plus(u[1][1].times(b));
        }
      }
    }

    /** True if this equals {@code other} multiplied by some e^(i*alpha). */
    boolean equalsUpToPhase(Unitary other) {
      int dim = m.length;
      if (other.m.length != dim) {
        return false;
      }
      Complex phase = null;
      for (int r = 0; r < dim && phase == null; r++) {
        for (int c = 0; c < dim && phase == null; c++) {
          if (other.m[r][c].abs() > EPSILON) {
            phase = m[r][c].dividedBy(other.m[r][c]);
          }
        }
      }
      if (phase == null || Math.abs(phase.abs() - 1) > EPSILON) {
        return false;
      }
      for (int r = 0; r < dim; r++) {
        for (int c = 0; c < dim; c++) {
          Complex expected = other.m[r][c].times(phase);
          if (Math.abs(m[r][c].re - expected.re) > EPSILON
              || Math.abs(m[r][c].im - expected.im) > EPSILON) {
            return false;
          }
        }
      }
      return true;
    }
  }
}
