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

import org.antlr.v4.runtime.Token;

/** A line and column in the program text, used to locate errors. */
public record SourcePosition(int lineNum, int charPositionInLine) {

  /** Used for built-in definitions, which have no source text. */
  public static final SourcePosition NONE = new SourcePosition(0, 0);

  static SourcePosition of(Token token) {
    // Shouldn't be null, but 0:0 is less useless than a NullPointerException.
    if (token == null) {
      return NONE;
    }
    return new SourcePosition(token.getLine(), token.getCharPositionInLine());
  }

  @Override
  public String toString() {
    return lineNum + ":" + charPositionInLine;
  }
}
