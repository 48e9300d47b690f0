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
import java.util.HashSet;
import java.util.Set;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.flatqasm.compiler.ConversionError.Kind;
import org.flatqasm.compiler.QasmParser.ArgumentContext;
import org.flatqasm.compiler.QasmParser.BarrierStatementContext;
import org.flatqasm.compiler.QasmParser.GateCallContext;
import org.flatqasm.compiler.QasmParser.GateCallStatementContext;
import org.flatqasm.compiler.QasmParser.GateDefinitionContext;
import org.flatqasm.compiler.QasmParser.IdListContext;
import org.flatqasm.compiler.QasmParser.IfStatementContext;
import org.flatqasm.compiler.QasmParser.IncludeStatementContext;
import org.flatqasm.compiler.QasmParser.MeasureStatementContext;
import org.flatqasm.compiler.QasmParser.OpaqueDeclarationContext;
import org.flatqasm.compiler.QasmParser.ProgramContext;
import org.flatqasm.compiler.QasmParser.RegisterDeclarationContext;
import org.flatqasm.compiler.QasmParser.ResetStatementContext;
import org.flatqasm.compiler.QasmParser.VersionContext;
import org.flatqasm.expr.Expr;
import org.jspecify.annotations.Nullable;

/**
 * Reads the statements of a parsed program in order, building its {@link DefinitionTable}, its
 * {@link RegisterTable}, and the list of top-level gate calls.
 *
 * <p>Gate bodies are checked here (each qubit operand must be one of the gate's qubit parameters,
 * and each identifier in an angle expression one of its angle parameters) so that expansion can
 * assume they're well formed. Whether the gates they call exist is only checked when they are
 * expanded.
 */
class ProgramReader extends VisitorBase<Void> {

  /** Everything we learned from reading a program. */
  record ParsedProgram(
      DefinitionTable definitions, RegisterTable registers, ImmutableList<GateCall> calls) {}

  /** Reads the given program. */
  static ParsedProgram read(ProgramContext ctx, FlattenOptions options) {
    ProgramReader reader = new ProgramReader(options);
    reader.visit(ctx);
    return new ParsedProgram(
        reader.definitions.build(), reader.registers.build(), reader.calls.build());
  }

  private final DefinitionTable.Builder definitions;
  private final RegisterTable.Builder registers = RegisterTable.builder();
  private final ImmutableList.Builder<GateCall> calls = ImmutableList.builder();
  private final ExpressionBuilder topLevelExpressions = new ExpressionBuilder(ImmutableSet.of());

  private ProgramReader(FlattenOptions options) {
    this.definitions = DefinitionTable.builder(options.targetPrimitives());
  }

  @Override
  public Void visitProgram(ProgramContext ctx) {
    if (ctx.version() != null) {
      visit(ctx.version());
    }
    ctx.statement().forEach(this::visit);
    return null;
  }

  @Override
  public Void visitVersion(VersionContext ctx) {
    String version = ctx.REAL().getText();
    if (!version.startsWith("2.")) {
      throw syntaxError("Unsupported OpenQASM version %s", version);
    }
    return null;
  }

  @Override
  public Void visitIncludeStatement(IncludeStatementContext ctx) {
    String quoted = ctx.STRING().getText();
    String fileName = quoted.substring(1, quoted.length() - 1);
    GateLibrary library = GateLibrary.named(fileName);
    if (library == null) {
      throw syntaxError("Unrecognized library \"%s\"", fileName);
    }
    definitions.include(library, currentPosition());
    return null;
  }

  @Override
  public Void visitRegisterDeclaration(RegisterDeclarationContext ctx) {
    registers.declare(
        ctx.ID().getText(),
        parseIndex(ctx.INT()),
        ctx.kind.getType() == TokenType.KEYWORD_QREG,
        currentPosition());
    return null;
  }

  @Override
  public Void visitGateDefinition(GateDefinitionContext ctx) {
    ImmutableList<String> angleParams = formals(ctx.params, ImmutableList.of());
    ImmutableList<String> qubitParams = formals(ctx.qubits, angleParams);
    ExpressionBuilder expressions = new ExpressionBuilder(ImmutableSet.copyOf(angleParams));
    ImmutableSet<String> qubitSet = ImmutableSet.copyOf(qubitParams);
    ImmutableList<GateCall> body =
        ctx.gateCall().stream()
            .map(call -> readCall(call, expressions, qubitSet))
            .collect(ImmutableList.toImmutableList());
    definitions.define(
        GateDefinition.userDefined(
            ctx.ID().getText(), angleParams, qubitParams, body, currentPosition()));
    return null;
  }

  @Override
  public Void visitOpaqueDeclaration(OpaqueDeclarationContext ctx) {
    ImmutableList<String> angleParams = formals(ctx.params, ImmutableList.of());
    ImmutableList<String> qubitParams = formals(ctx.qubits, angleParams);
    definitions.define(
        GateDefinition.opaque(
            ctx.ID().getText(), angleParams, qubitParams, currentPosition()));
    return null;
  }

  @Override
  public Void visitGateCallStatement(GateCallStatementContext ctx) {
    calls.add(readCall(ctx.gateCall(), topLevelExpressions, null));
    return null;
  }

  @Override
  public Void visitMeasureStatement(MeasureStatementContext ctx) {
    throw unsupported("measure");
  }

  @Override
  public Void visitResetStatement(ResetStatementContext ctx) {
    throw unsupported("reset");
  }

  @Override
  public Void visitBarrierStatement(BarrierStatementContext ctx) {
    throw unsupported("barrier");
  }

  @Override
  public Void visitIfStatement(IfStatementContext ctx) {
    throw unsupported("if");
  }

  private ConversionError unsupported(String keyword) {
    return syntaxError("'%s' is not supported; only unitary gate statements are", keyword);
  }

  /**
   * Returns the names in an optional idList, after checking that none is repeated or already in
   * {@code previous}.
   */
  private static ImmutableList<String> formals(
      @Nullable IdListContext ctx, ImmutableList<String> previous) {
    if (ctx == null) {
      return ImmutableList.of();
    }
    Set<String> seen = new HashSet<>(previous);
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (TerminalNode id : ctx.ID()) {
      String name = id.getText();
      if (!seen.add(name)) {
        throw errorAt(Kind.DUPLICATE_DEFINITION, id, "Duplicate parameter '%s'", name);
      }
      result.add(name);
    }
    return result.build();
  }

  /**
   * Returns the GateCall for a gateCall node.
   *
   * @param expressions converts the call's angle expressions
   * @param formalQubits if the call is in a gate body, the gate's qubit parameters; null for a
   *     top-level call
   */
  private GateCall readCall(
      GateCallContext ctx,
      ExpressionBuilder expressions,
      @Nullable ImmutableSet<String> formalQubits) {
    ImmutableList<Expr> angles = expressions.build(ctx.expList());
    ImmutableList.Builder<QubitRef> qubits = ImmutableList.builder();
    Set<String> seen = new HashSet<>();
    for (ArgumentContext arg : ctx.argument()) {
      String name = arg.ID().getText();
      if (formalQubits == null) {
        qubits.add(
            (arg.INT() == null) ? QubitRef.named(name) : QubitRef.of(name, parseIndex(arg.INT())));
        continue;
      }
      if (arg.INT() != null) {
        throw errorAt(
            Kind.SYNTAX, arg, "Gate body can't refer to register qubit '%s'", arg.getText());
      } else if (!formalQubits.contains(name)) {
        throw errorAt(Kind.SYNTAX, arg, "'%s' is not a qubit parameter", name);
      } else if (!seen.add(name)) {
        throw errorAt(Kind.INVALID_QUBIT, arg, "Qubit '%s' used more than once", name);
      }
      qubits.add(QubitRef.named(name));
    }
    return new GateCall(ctx.ID().getText(), angles, qubits.build(), SourcePosition.of(ctx.start));
  }

  private static int parseIndex(TerminalNode node) {
    try {
      return Integer.parseInt(node.getText());
    } catch (NumberFormatException e) {
      throw errorAt(Kind.SYNTAX, node, "Index %s too large", node.getText());
    }
  }
}
