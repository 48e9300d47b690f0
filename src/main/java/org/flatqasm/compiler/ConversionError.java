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

/**
 * All errors in the input program throw a ConversionError. A conversion that throws produces no
 * output.
 */
public class ConversionError extends RuntimeException {

  /** What went wrong. */
  public enum Kind {
    /** Malformed or unsupported input text. */
    SYNTAX("SyntaxError"),
    /** A call to a gate name with no definition. */
    UNDEFINED_GATE("UndefinedGateError"),
    /** A gate or register declared twice in conflicting ways. */
    DUPLICATE_DEFINITION("DuplicateDefinitionError"),
    /** Wrong number of angles or qubits, or an angle parameter with no binding. */
    ARITY_MISMATCH("ArityMismatchError"),
    /** A gate whose expansion reaches a call to itself. */
    CYCLIC_DEFINITION("CyclicDefinitionError"),
    /** A gate that is neither primitive, user-defined, nor covered by a decomposition rule. */
    UNSUPPORTED_GATE("UnsupportedGateError"),
    /** A qubit operand that doesn't name a distinct qubit of a declared quantum register. */
    INVALID_QUBIT("InvalidQubitError");

    /** The name used in error messages. */
    public final String displayName;

    Kind(String displayName) {
      this.displayName = displayName;
    }
  }

  public final Kind kind;
  public final String msg;
  public final int lineNum;
  public final int charPositionInLine;

  public ConversionError(Kind kind, String msg, int lineNum, int charPositionInLine) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  public ConversionError(Kind kind, String msg, SourcePosition position) {
    this(kind, msg, position.lineNum(), position.charPositionInLine());
  }

  @Override
  public String getMessage() {
    return String.format("%s: %s (%s:%s)", kind.displayName, msg, lineNum, charPositionInLine);
  }
}
