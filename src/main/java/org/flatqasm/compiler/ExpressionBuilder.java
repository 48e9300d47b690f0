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
import com.google.common.collect.ImmutableSet;
import org.flatqasm.compiler.ConversionError.Kind;
import org.flatqasm.compiler.QasmParser.AdditiveExpressionContext;
import org.flatqasm.compiler.QasmParser.ExpListContext;
import org.flatqasm.compiler.QasmParser.FunctionExpressionContext;
import org.flatqasm.compiler.QasmParser.LiteralExpressionContext;
import org.flatqasm.compiler.QasmParser.MultiplicativeExpressionContext;
import org.flatqasm.compiler.QasmParser.NegateExpressionContext;
import org.flatqasm.compiler.QasmParser.ParameterExpressionContext;
import org.flatqasm.compiler.QasmParser.PiExpressionContext;
import org.flatqasm.compiler.QasmParser.PowerExpressionContext;
import org.flatqasm.expr.Expr;

/** Converts {@code exp} parse trees into {@link Expr}s. */
class ExpressionBuilder extends VisitorBase<Expr> {

  /** The angle parameters that expressions may refer to. */
  private final ImmutableSet<String> parameters;

  /**
   * @param parameters the angle parameters in scope; empty for top-level statements
   */
  ExpressionBuilder(ImmutableSet<String> parameters) {
    this.parameters = parameters;
  }

  /** Returns the expressions in an optional {@code expList}. */
  ImmutableList<Expr> build(ExpListContext ctx) {
    if (ctx == null) {
      return ImmutableList.of();
    }
    return ctx.exp().stream().map(this::visit).collect(ImmutableList.toImmutableList());
  }

  @Override
  public Expr visitFunctionExpression(FunctionExpressionContext ctx) {
    return Expr.call(Expr.Fn.of(ctx.fn.getText()), visit(ctx.exp()));
  }

  @Override
  public Expr visitPowerExpression(PowerExpressionContext ctx) {
    return Expr.power(visit(ctx.exp(0)), visit(ctx.exp(1)));
  }

  @Override
  public Expr visitNegateExpression(NegateExpressionContext ctx) {
    return Expr.negate(visit(ctx.exp()));
  }

  @Override
  public Expr visitMultiplicativeExpression(MultiplicativeExpressionContext ctx) {
    Expr left = visit(ctx.exp(0));
    Expr right = visit(ctx.exp(1));
    return (ctx.op.getType() == TokenType.ASTERISK)
        ? Expr.multiply(left, right)
        : Expr.divide(left, right);
  }

  @Override
  public Expr visitAdditiveExpression(AdditiveExpressionContext ctx) {
    Expr left = visit(ctx.exp(0));
    Expr right = visit(ctx.exp(1));
    return (ctx.op.getType() == TokenType.PLUS)
        ? Expr.add(left, right)
        : Expr.subtract(left, right);
  }

  @Override
  public Expr visitPiExpression(PiExpressionContext ctx) {
    return Expr.PI;
  }

  @Override
  public Expr visitLiteralExpression(LiteralExpressionContext ctx) {
    return Expr.literal(ctx.getText());
  }

  @Override
  public Expr visitParameterExpression(ParameterExpressionContext ctx) {
    String name = ctx.ID().getText();
    if (!parameters.contains(name)) {
      throw error(Kind.ARITY_MISMATCH, "Unbound parameter '%s'", name);
    }
    return Expr.parameter(name);
  }
}
