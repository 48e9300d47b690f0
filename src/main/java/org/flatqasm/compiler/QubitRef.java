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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A qubit operand of a gate call.
 *
 * <p>If {@code index} is {@link #UNINDEXED}, {@code name} is either a formal qubit parameter (in a
 * gate definition body) or a whole register (at top level, before broadcast). Otherwise it refers
 * to qubit {@code index} of register {@code name}.
 */
public record QubitRef(String name, int index) {

  public static final int UNINDEXED = -1;

  public QubitRef {
    checkArgument(index >= UNINDEXED, "Bad qubit index %s", index);
  }

  /** Returns a reference to the given qubit of a register. */
  public static QubitRef of(String register, int index) {
    checkArgument(index >= 0);
    return new QubitRef(register, index);
  }

  /** Returns a reference to a formal qubit parameter or an entire register. */
  public static QubitRef named(String name) {
    return new QubitRef(name, UNINDEXED);
  }

  /** True if this refers to a single qubit of a register. */
  public boolean isConcrete() {
    return index != UNINDEXED;
  }

  @Override
  public String toString() {
    return isConcrete() ? String.format("%s[%s]", name, index) : name;
  }
}
