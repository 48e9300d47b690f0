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

/** A {@code qreg} declaration. */
public record QuantumRegister(String name, int size) {

  public QuantumRegister {
    checkArgument(size > 0, "Register %s has size %s", name, size);
  }

  /** Returns true if {@code index} is a valid qubit index for this register. */
  public boolean contains(int index) {
    return index >= 0 && index < size;
  }

  @Override
  public String toString() {
    return String.format("qreg %s[%s];", name, size);
  }
}
