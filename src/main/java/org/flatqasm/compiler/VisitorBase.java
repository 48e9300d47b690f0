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

import com.google.errorprone.annotations.FormatMethod;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.flatqasm.compiler.ConversionError.Kind;
import org.flatqasm.compiler.QasmParser.ParenExpressionContext;

/**
 * The common base of our parse tree visitors.
 *
 * <p>Any node type that a subclass doesn't handle explicitly is a bug in the subclass, so the
 * default result throws an AssertionError instead of silently returning null.
 *
 * <p>While a node is being visited it is the "current node"; {@link #error}, {@link #syntaxError}
 * and {@link #currentPosition} report the position of its first token. Errors that belong to a
 * token inside the current node (a repeated parameter name, a bad qubit operand) use the {@code
 * errorAt} variants.
 */
class VisitorBase<T> extends QasmBaseVisitor<T> {

  private ParserRuleContext currentNode;

  @Override
  protected final T defaultResult() {
    throw new AssertionError("Unexpected node " + currentNode.getClass().getSimpleName());
  }

  @Override
  public final T visit(ParseTree tree) {
    ParserRuleContext saved = currentNode;
    currentNode = (ParserRuleContext) tree;
    // No finally: a visitor that has thrown a ConversionError is discarded.
    T result = super.visit(tree);
    currentNode = saved;
    return result;
  }

  @Override
  public final T visitParenExpression(ParenExpressionContext ctx) {
    return visit(ctx.exp());
  }

  /** Returns the position of the node being visited. */
  SourcePosition currentPosition() {
    return SourcePosition.of(currentNode.start);
  }

  @FormatMethod
  ConversionError error(Kind kind, String fmt, Object... fmtArgs) {
    return Flattener.error(kind, currentNode.start, fmt, fmtArgs);
  }

  @FormatMethod
  ConversionError syntaxError(String fmt, Object... fmtArgs) {
    return error(Kind.SYNTAX, fmt, fmtArgs);
  }

  /** Returns a ConversionError at the start of {@code node}, usually a child of the current one. */
  @FormatMethod
  static ConversionError errorAt(
      Kind kind, ParserRuleContext node, String fmt, Object... fmtArgs) {
    return errorAt(kind, node.start, fmt, fmtArgs);
  }

  @FormatMethod
  static ConversionError errorAt(Kind kind, TerminalNode node, String fmt, Object... fmtArgs) {
    return errorAt(kind, node.getSymbol(), fmt, fmtArgs);
  }

  @FormatMethod
  private static ConversionError errorAt(Kind kind, Token token, String fmt, Object... fmtArgs) {
    return Flattener.error(kind, token, fmt, fmtArgs);
  }
}
