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

package org.flatqasm.expr;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A symbolic angle expression. Expressions are immutable trees; operations that would change one
 * (e.g. {@link #substitute}) return a new tree, sharing any unchanged subtrees.
 *
 * <p>No arithmetic simplification is ever done: {@code pi} stays {@code pi}, and {@code
 * theta/2} stays a division, so that the rendered form shows its exact relationship to the source
 * angle. {@link #evaluate} is available for callers that do want a number.
 *
 * <p>{@link #toString} renders an expression in OpenQASM syntax. The rendering is deterministic
 * and re-parses to an expression with the same value; see {@link Binary#toString} and {@link
 * Negate#toString} for where parentheses are added.
 */
public interface Expr {

  /** The literal {@code 0}. */
  Literal ZERO = new Literal("0");

  /** The literal {@code 2}. */
  Literal TWO = new Literal("2");

  /** The constant {@code pi}. */
  Pi PI = new Pi();

  /**
   * Returns a copy of this expression with each {@link ParameterRef} whose name is a key of {@code
   * bindings} replaced by the bound expression. Unbound references are left as they are.
   */
  Expr substitute(Map<String, ? extends Expr> bindings);

  /**
   * Returns the numeric value of this expression.
   *
   * @throws IllegalStateException if the expression contains a {@link ParameterRef}
   */
  double evaluate();

  /** Calls {@code visitor} with the name of each {@link ParameterRef} in this expression. */
  void forEachParameter(Consumer<String> visitor);

  /** Returns the names of all the {@link ParameterRef}s in this expression. */
  default ImmutableSet<String> parameters() {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    forEachParameter(builder::add);
    return builder.build();
  }

  /** Returns true if this expression contains no {@link ParameterRef}. */
  default boolean isResolved() {
    return parameters().isEmpty();
  }

  /** Returns a numeric literal with the given source text (e.g. {@code "3"} or {@code "0.5"}). */
  static Literal literal(String text) {
    return new Literal(text);
  }

  /** Returns a numeric literal for a non-negative integer. */
  static Literal literal(long value) {
    checkArgument(value >= 0, "Negative literal %s", value);
    return new Literal(Long.toString(value));
  }

  static ParameterRef parameter(String name) {
    return new ParameterRef(name);
  }

  static Expr negate(Expr operand) {
    return new Negate(operand);
  }

  static Expr add(Expr left, Expr right) {
    return new Binary(Op.ADD, left, right);
  }

  static Expr subtract(Expr left, Expr right) {
    return new Binary(Op.SUBTRACT, left, right);
  }

  static Expr multiply(Expr left, Expr right) {
    return new Binary(Op.MULTIPLY, left, right);
  }

  static Expr divide(Expr left, Expr right) {
    return new Binary(Op.DIVIDE, left, right);
  }

  static Expr power(Expr left, Expr right) {
    return new Binary(Op.POWER, left, right);
  }

  /** Returns {@code operand/2} as an explicit division. */
  static Expr half(Expr operand) {
    return divide(operand, TWO);
  }

  static Expr call(Fn fn, Expr argument) {
    return new Call(fn, argument);
  }

  /** The binary operators, with their binding strength (higher binds tighter). */
  enum Op {
    ADD("+", 1),
    SUBTRACT("-", 1),
    MULTIPLY("*", 2),
    DIVIDE("/", 2),
    POWER("^", 3);

    public final String symbol;
    final int precedence;

    Op(String symbol, int precedence) {
      this.symbol = symbol;
      this.precedence = precedence;
    }

    double apply(double x, double y) {
      return switch (this) {
        case ADD -> x + y;
        case SUBTRACT -> x - y;
        case MULTIPLY -> x * y;
        case DIVIDE -> x / y;
        case POWER -> Math.pow(x, y);
      };
    }
  }

  /** The unary functions of OpenQASM 2.0. */
  enum Fn {
    SIN,
    COS,
    TAN,
    EXP,
    LN,
    SQRT;

    /** The name used in source text, e.g. {@code "sin"}. */
    public String symbol() {
      return name().toLowerCase(Locale.ROOT);
    }

    /** Returns the Fn with the given source name. */
    public static Fn of(String symbol) {
      return valueOf(symbol.toUpperCase(Locale.ROOT));
    }

    double apply(double x) {
      return switch (this) {
        case SIN -> Math.sin(x);
        case COS -> Math.cos(x);
        case TAN -> Math.tan(x);
        case EXP -> Math.exp(x);
        case LN -> Math.log(x);
        case SQRT -> Math.sqrt(x);
      };
    }
  }

  /** A numeric literal, kept as its source text so that rendering reproduces it exactly. */
  record Literal(String text) implements Expr {
    @Override
    public Expr substitute(Map<String, ? extends Expr> bindings) {
      return this;
    }

    @Override
    public double evaluate() {
      return Double.parseDouble(text);
    }

    @Override
    public void forEachParameter(Consumer<String> visitor) {}

    @Override
    public String toString() {
      return text;
    }
  }

  /** The constant pi. */
  record Pi() implements Expr {
    @Override
    public Expr substitute(Map<String, ? extends Expr> bindings) {
      return this;
    }

    @Override
    public double evaluate() {
      return Math.PI;
    }

    @Override
    public void forEachParameter(Consumer<String> visitor) {}

    @Override
    public String toString() {
      return "pi";
    }
  }

  /** A reference to a formal angle parameter of a gate definition. */
  record ParameterRef(String name) implements Expr {
    @Override
    public Expr substitute(Map<String, ? extends Expr> bindings) {
      Expr bound = bindings.get(name);
      return (bound == null) ? this : bound;
    }

    @Override
    public double evaluate() {
      throw new IllegalStateException("Unbound parameter '" + name + "'");
    }

    @Override
    public void forEachParameter(Consumer<String> visitor) {
      visitor.accept(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Unary minus. */
  record Negate(Expr operand) implements Expr {
    @Override
    public Expr substitute(Map<String, ? extends Expr> bindings) {
      Expr newOperand = operand.substitute(bindings);
      return (newOperand == operand) ? this : new Negate(newOperand);
    }

    @Override
    public double evaluate() {
      return -operand.evaluate();
    }

    @Override
    public void forEachParameter(Consumer<String> visitor) {
      operand.forEachParameter(visitor);
    }

    /**
     * Negation of a sum or difference parenthesizes its operand ({@code -(a+b)}); negation of a
     * product, quotient or power does not ({@code -(pi/4)/2} re-parses as {@code (-(pi/4))/2},
     * which has the same value). An operand that would otherwise start with a second minus sign is
     * always parenthesized.
     */
    @Override
    public String toString() {
      String inner = operand.toString();
      boolean parens =
          (operand instanceof Binary binary && binary.op().precedence < Op.MULTIPLY.precedence)
              || inner.startsWith("-");
      return parens ? "-(" + inner + ")" : "-" + inner;
    }
  }

  /** A binary arithmetic operation. */
  record Binary(Op op, Expr left, Expr right) implements Expr {
    @Override
    public Expr substitute(Map<String, ? extends Expr> bindings) {
      Expr newLeft = left.substitute(bindings);
      Expr newRight = right.substitute(bindings);
      return (newLeft == left && newRight == right) ? this : new Binary(op, newLeft, newRight);
    }

    @Override
    public double evaluate() {
      return op.apply(left.evaluate(), right.evaluate());
    }

    @Override
    public void forEachParameter(Consumer<String> visitor) {
      left.forEachParameter(visitor);
      right.forEachParameter(visitor);
    }

    /**
     * A binary operand is parenthesized unless it binds strictly tighter than this operator, so
     * chains of equal precedence are always explicit ({@code (pi/4)/2}). A negated operand is
     * parenthesized on the right of any operator and on either side of {@code ^}; on the left, the
     * operand of the negation follows the binary rule, so {@code -(pi/4)/2} renders as itself
     * whichever way it was parsed.
     */
    @Override
    public String toString() {
      return operand(left, false) + op.symbol + operand(right, true);
    }

    private String operand(Expr operand, boolean isRight) {
      boolean parens;
      if (operand instanceof Binary binary) {
        parens = binary.op().precedence <= op.precedence;
      } else if (operand instanceof Negate negate) {
        if (isRight || op == Op.POWER) {
          parens = true;
        } else if (negate.operand() instanceof Binary binary
            && binary.op().precedence <= op.precedence) {
          return "-(" + binary + ")";
        } else {
          parens = false;
        }
      } else {
        parens = false;
      }
      return parens ? "(" + operand + ")" : operand.toString();
    }
  }

  /** One of the OpenQASM unary functions applied to an argument. */
  record Call(Fn fn, Expr argument) implements Expr {
    @Override
    public Expr substitute(Map<String, ? extends Expr> bindings) {
      Expr newArgument = argument.substitute(bindings);
      return (newArgument == argument) ? this : new Call(fn, newArgument);
    }

    @Override
    public double evaluate() {
      return fn.apply(argument.evaluate());
    }

    @Override
    public void forEachParameter(Consumer<String> visitor) {
      argument.forEachParameter(visitor);
    }

    @Override
    public String toString() {
      return fn.symbol() + "(" + argument + ")";
    }
  }
}
