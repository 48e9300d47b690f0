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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import java.util.Properties;

/**
 * Settings for a conversion.
 *
 * @param numericAngles if true, angles are evaluated and written as numbers rather than as
 *     symbolic expressions
 * @param emitHeader if true, the output starts with {@code OPENQASM 2.0;}
 * @param targetPrimitives names of {@code qelib1.inc} gates that the target accepts directly; calls
 *     to these are written as is instead of being decomposed
 */
public record FlattenOptions(
    boolean numericAngles, boolean emitHeader, ImmutableSet<String> targetPrimitives) {

  public static final FlattenOptions DEFAULT = new FlattenOptions(false, false, ImmutableSet.of());

  /** System property names read by {@link #fromProperties}. */
  public static final String NUMERIC_ANGLES_PROPERTY = "flatqasm.numericAngles";

  public static final String HEADER_PROPERTY = "flatqasm.header";
  public static final String PRIMITIVES_PROPERTY = "flatqasm.primitives";

  private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

  public FlattenOptions {
    for (String name : targetPrimitives) {
      DecompositionRule rule = DecompositionRule.forGate(name);
      checkArgument(
          rule != null && !rule.isLanguageBuiltin(),
          "'%s' is not a library gate, so it can't be a target primitive",
          name);
    }
  }

  /** Returns options read from the given properties (usually {@link System#getProperties}). */
  public static FlattenOptions fromProperties(Properties properties) {
    return new FlattenOptions(
        Boolean.parseBoolean(properties.getProperty(NUMERIC_ANGLES_PROPERTY, "false")),
        Boolean.parseBoolean(properties.getProperty(HEADER_PROPERTY, "false")),
        ImmutableSet.copyOf(COMMA.split(properties.getProperty(PRIMITIVES_PROPERTY, ""))));
  }

  public FlattenOptions withNumericAngles(boolean numericAngles) {
    return new FlattenOptions(numericAngles, emitHeader, targetPrimitives);
  }

  public FlattenOptions withHeader(boolean emitHeader) {
    return new FlattenOptions(numericAngles, emitHeader, targetPrimitives);
  }

  public FlattenOptions withTargetPrimitives(String... names) {
    return new FlattenOptions(numericAngles, emitHeader, ImmutableSet.copyOf(names));
  }
}
