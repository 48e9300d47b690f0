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

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;

/**
 * Everything we know about a gate name. A GateDefinition is created once (either as a built-in or
 * while reading the program) and never modified.
 */
public final class GateDefinition {

  /**
   * The four ways a gate can be implemented. Each GateDefinition's kind is fixed when it is
   * created, so dispatch on it is an exhaustive switch rather than a lookup by name.
   */
  public enum Kind {
    /** Understood directly by the target; emitted as is. */
    PRIMITIVE,
    /** Rewritten into primitives by a {@link DecompositionRule}. */
    COMPOSITE,
    /** Replaced by its body, with formal parameters bound to the call's arguments. */
    USER_DEFINED,
    /** Declared with {@code opaque}: a name and arity with no implementation we can use. */
    OPAQUE
  }

  public final String name;
  public final Kind kind;
  public final ImmutableList<String> angleParams;
  public final ImmutableList<String> qubitParams;

  /** The body of a USER_DEFINED gate; empty for all other kinds. */
  public final ImmutableList<GateCall> body;

  /** Non-null iff {@code kind} is COMPOSITE. */
  public final @Nullable DecompositionRule rule;

  /**
   * True if this definition was added by an {@code include} (or is a target primitive standing in
   * for one); a program may replace such a definition with its own as long as the arity matches.
   */
  public final boolean fromLibrary;

  /** Where the definition appeared, or {@link SourcePosition#NONE} for built-ins. */
  public final SourcePosition position;

  private GateDefinition(
      String name,
      Kind kind,
      ImmutableList<String> angleParams,
      ImmutableList<String> qubitParams,
      ImmutableList<GateCall> body,
      @Nullable DecompositionRule rule,
      boolean fromLibrary,
      SourcePosition position) {
    checkArgument((kind == Kind.COMPOSITE) == (rule != null));
    checkArgument(kind == Kind.USER_DEFINED || body.isEmpty());
    checkArgument(!qubitParams.isEmpty(), "Gate %s has no qubits", name);
    this.name = name;
    this.kind = kind;
    this.angleParams = angleParams;
    this.qubitParams = qubitParams;
    this.body = body;
    this.rule = rule;
    this.fromLibrary = fromLibrary;
    this.position = position;
  }

  /** Returns a primitive gate with the given arity. */
  static GateDefinition primitive(
      String name, int numAngles, int numQubits, boolean fromLibrary) {
    return new GateDefinition(
        name,
        Kind.PRIMITIVE,
        formals("p", numAngles),
        formals("q", numQubits),
        ImmutableList.of(),
        null,
        fromLibrary,
        SourcePosition.NONE);
  }

  /** Returns the definition of a gate implemented by a decomposition rule. */
  static GateDefinition composite(DecompositionRule rule) {
    return new GateDefinition(
        rule.gateName,
        Kind.COMPOSITE,
        formals("p", rule.numAngles),
        formals("q", rule.numQubits),
        ImmutableList.of(),
        rule,
        !rule.isLanguageBuiltin(),
        SourcePosition.NONE);
  }

  /** Returns the definition of a {@code gate} declared in the program. */
  static GateDefinition userDefined(
      String name,
      ImmutableList<String> angleParams,
      ImmutableList<String> qubitParams,
      ImmutableList<GateCall> body,
      SourcePosition position) {
    return new GateDefinition(
        name, Kind.USER_DEFINED, angleParams, qubitParams, body, null, false, position);
  }

  /** Returns the definition of an {@code opaque} gate declared in the program. */
  static GateDefinition opaque(
      String name,
      ImmutableList<String> angleParams,
      ImmutableList<String> qubitParams,
      SourcePosition position) {
    return new GateDefinition(
        name, Kind.OPAQUE, angleParams, qubitParams, ImmutableList.of(), null, false, position);
  }

  private static ImmutableList<String> formals(String prefix, int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> prefix + i)
        .collect(ImmutableList.toImmutableList());
  }

  public int numAngles() {
    return angleParams.size();
  }

  public int numQubits() {
    return qubitParams.size();
  }

  /** True if {@code other} has the same name, kind, arity, formals, and body. */
  boolean sameAs(GateDefinition other) {
    if (!(name.equals(other.name)
        && kind == other.kind
        && rule == other.rule
        && angleParams.equals(other.angleParams)
        && qubitParams.equals(other.qubitParams)
        && body.size() == other.body.size())) {
      return false;
    }
    for (int i = 0; i < body.size(); i++) {
      if (!body.get(i).sameOperation(other.body.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** True if {@code other} takes the same number of angles and qubits. */
  boolean sameArity(GateDefinition other) {
    return numAngles() == other.numAngles() && numQubits() == other.numQubits();
  }

  /** Returns e.g. {@code "cp(p0) q0,q1"}. */
  String signature() {
    String angles =
        angleParams.isEmpty() ? "" : "(" + String.join(",", angleParams) + ")";
    return name + angles + " " + String.join(",", qubitParams);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case PRIMITIVE -> "primitive " + signature();
      case COMPOSITE -> "composite " + signature();
      case OPAQUE -> "opaque " + signature() + ";";
      case USER_DEFINED ->
          body.stream()
              .map(call -> " " + call)
              .collect(Collectors.joining("", "gate " + signature() + " {", " }"));
    };
  }
}
