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
import com.google.errorprone.annotations.FormatMethod;
import java.util.logging.Logger;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.flatqasm.compiler.ConversionError.Kind;
import org.flatqasm.compiler.QasmParser.ProgramContext;
import org.flatqasm.expr.Expr;

/**
 * A statics-only class with the entry points for flattening an OpenQASM 2.0 program into a
 * sequence of {@code u} and {@code cx} instructions.
 *
 * <p>Each conversion builds its own tables and shares no mutable state with any other, so
 * conversions may run concurrently on different threads.
 */
public class Flattener {

  private static final Logger LOG = Logger.getLogger(Flattener.class.getName());

  // Statics only
  private Flattener() {}

  /**
   * Flattens an OpenQASM 2.0 program.
   *
   * @param input the program text
   * @param source an optional identifier for the source of the program, e.g. a filename; only used
   *     in log messages
   * @param options controls which library gates are kept as primitives
   * @throws ConversionError if the program is malformed or uses a gate that can't be flattened
   */
  public static FlatProgram flatten(CharStream input, Object source, FlattenOptions options) {
    ProgramReader.ParsedProgram program = ProgramReader.read(parse(input), options);
    LOG.fine(
        () ->
            String.format(
                "%s: %s definitions, %s top-level calls",
                source, program.definitions().size(), program.calls().size()));
    MacroExpander expander = new MacroExpander(program.definitions());
    Decomposer decomposer = new Decomposer(program.definitions());
    ImmutableList.Builder<Instruction> instructions = ImmutableList.builder();
    for (GateCall call : program.calls()) {
      for (GateCall resolved : program.registers().resolve(call)) {
        ImmutableList<Instruction> rewritten = decomposer.rewrite(expander.expand(resolved));
        if (options.numericAngles()) {
          checkFinite(rewritten, resolved);
        }
        instructions.addAll(rewritten);
      }
    }
    FlatProgram result =
        new FlatProgram(program.registers().quantumRegisters(), instructions.build());
    LOG.fine(() -> String.format("%s: %s instructions", source, result.instructions().size()));
    return result;
  }

  /**
   * Numeric output can only represent finite angles, so reject e.g. {@code ln(0)} at the call
   * that led to it.
   */
  private static void checkFinite(ImmutableList<Instruction> instructions, GateCall call) {
    for (Instruction inst : instructions) {
      for (Expr angle : inst.angles()) {
        double value = angle.evaluate();
        if (!Double.isFinite(value)) {
          throw error(
              Kind.SYNTAX,
              call.position(),
              "Angle %s evaluates to %s in '%s'",
              angle,
              value,
              inst);
        }
      }
    }
  }

  /** Flattens an OpenQASM 2.0 program and returns the result as OpenQASM text. */
  public static String convert(CharStream input, Object source, FlattenOptions options) {
    return new Emitter(options).emit(flatten(input, source, options));
  }

  /** Flattens an OpenQASM 2.0 program with the default options. */
  public static String convert(String input) {
    return convert(CharStreams.fromString(input), "(input)", FlattenOptions.DEFAULT);
  }

  /** Parses an OpenQASM 2.0 program. */
  public static ProgramContext parse(CharStream input) {
    // Throw ConversionErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new ConversionError(Kind.SYNTAX, msg, lineNum, charPositionInLine);
          }
        };
    QasmLexer lexer = new QasmLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    QasmParser parser = new QasmParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser.program();
  }

  /** Returns a new ConversionError referring to the given token. */
  static ConversionError error(Kind kind, Token token, String msg) {
    return new ConversionError(kind, msg, SourcePosition.of(token));
  }

  /** Returns a new ConversionError referring to the given token. */
  @FormatMethod
  static ConversionError error(Kind kind, Token token, String fmt, Object... fmtArgs) {
    return error(kind, token, String.format(fmt, fmtArgs));
  }

  /** Returns a new ConversionError at the given position. */
  static ConversionError error(Kind kind, SourcePosition position, String msg) {
    return new ConversionError(kind, msg, position);
  }

  /** Returns a new ConversionError at the given position. */
  @FormatMethod
  static ConversionError error(Kind kind, SourcePosition position, String fmt, Object... fmtArgs) {
    return error(kind, position, String.format(fmt, fmtArgs));
  }
}
