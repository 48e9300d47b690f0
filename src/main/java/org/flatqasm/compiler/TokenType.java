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

import com.google.common.collect.ImmutableMap;
import org.antlr.v4.runtime.Vocabulary;

/**
 * A statics-only class providing convenient access to ANTLR token types (which are just ints).
 *
 * <p>The grammar only declares its punctuation and keywords implicitly (as quoted literals in
 * parser rules), so ANTLR gives them no symbolic names; we build a map from each token's literal
 * or symbolic name and look up the ones we need once.
 */
class TokenType {

  // Statics only
  private TokenType() {}

  /**
   * A Map from token name to token type. Token names are either literals enclosed in single quotes
   * (e.g. "{@code '+'}") or symbolic names (e.g. "{@code ID}").
   */
  static final ImmutableMap<String, Integer> MAP;

  static {
    // Token types are densely allocated starting from 1, so we stop at the first one with neither
    // a literal nor a symbolic name.
    Vocabulary vocab = QasmLexer.VOCABULARY;
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 1; ; i++) {
      String s = vocab.getLiteralName(i);
      if (s == null) {
        s = vocab.getSymbolicName(i);
        if (s == null) {
          break;
        }
      }
      builder.put(s, i);
    }
    MAP = builder.buildOrThrow();
  }

  /**
   * Returns the token type for the given name. Throws an exception if there is no such token name.
   */
  static int of(String name) {
    Integer result = MAP.get(name);
    if (result == null) {
      throw new IllegalArgumentException("No token named " + name);
    }
    return result;
  }

  static final int PLUS = of("'+'");
  static final int ASTERISK = of("'*'");
  static final int KEYWORD_QREG = of("'qreg'");
}
