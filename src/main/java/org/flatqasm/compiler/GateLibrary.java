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
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * The gate libraries that an {@code include} statement may name. We never read a library's
 * source; including it just makes its gates (all implemented by decomposition rules) available.
 */
public enum GateLibrary {
  QELIB1("qelib1.inc");

  /** The name as it appears in an include statement, without quotes. */
  public final String fileName;

  GateLibrary(String fileName) {
    this.fileName = fileName;
  }

  /** Returns the library with the given file name, or null if it isn't one we recognize. */
  public static @Nullable GateLibrary named(String fileName) {
    return Arrays.stream(values())
        .filter(lib -> lib.fileName.equals(fileName))
        .findFirst()
        .orElse(null);
  }

  /** Returns the rules for the gates this library defines. */
  public ImmutableList<DecompositionRule> rules() {
    // There's only one library, and it has everything that isn't built into the language.
    return Arrays.stream(DecompositionRule.values())
        .filter(rule -> !rule.isLanguageBuiltin())
        .collect(ImmutableList.toImmutableList());
  }
}
