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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.CharStreams;
import org.flatqasm.testing.TestdataScanner;
import org.flatqasm.testing.TestdataScanner.TestProgram;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Flattens OpenQASM source from each of the .qasm files in the testdata directory, based on
 * comments in the files.
 */
@RunWith(TestParameterInjector.class)
public class FlattenerTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/flatqasm/compiler/testdata");

  /**
   * Each .qasm file is expected to have source code followed by a comment that begins "{@code /*
   * FLATTEN (...)}". The parentheses enclose options (if any) for the conversion: {@code header},
   * {@code numeric}, and {@code primitive=<gate>} (which may be repeated).
   *
   * <p>There are three variants for the FLATTEN comment:
   *
   * <ul>
   *   <li>With no additional information before the end of the comment: the test passes if the file
   *       is flattened successfully.
   *   <li>With an error message (e.g. "{@code FLATTEN (): UndefinedGateError: Undefined gate
   *       'foo'}"): the test passes if the conversion fails with an error whose message starts with
   *       the given text.
   *   <li>With expected output (e.g. "{@code FLATTEN ():}" followed by the flattened program up to
   *       the end of the comment): the test passes if the output matches.
   * </ul>
   *
   * <p>A single file may contain multiple source programs, each followed by a FLATTEN comment; each
   * is flattened independently.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n/\\* FLATTEN (.*?)\\*/\\n*", Pattern.DOTALL);

  /**
   * A pattern to parse the first line of a FLATTEN comment (beginning immediately after the "/*
   * FLATTEN ").
   */
  private static final Pattern FIRST_LINE_PATTERN =
      Pattern.compile("\\(([, a-z0-9_=]*)\\) *(:.*\n?)?");

  @Test
  public void flattenTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    checkNotNull(testProgram.comment(), "No FLATTEN comment found");
    Matcher partsMatcher = FIRST_LINE_PATTERN.matcher(testProgram.comment());
    assertWithMessage("Bad FLATTEN comment").that(partsMatcher.lookingAt()).isTrue();
    FlattenOptions options = parseOptions(partsMatcher.group(1));
    String errMsg = partsMatcher.group(2);
    String expected = null;
    if (errMsg != null) {
      errMsg = errMsg.trim();
      if (errMsg.length() == 1) {
        errMsg = null;
        expected = testProgram.comment().substring(partsMatcher.end());
      } else {
        // Drop the colon
        errMsg = errMsg.substring(1);
        assertWithMessage("Noise after error message in FLATTEN comment")
            .that(partsMatcher.end())
            .isEqualTo(testProgram.comment().length());
      }
    }
    try {
      String result =
          Flattener.convert(
              CharStreams.fromString(testProgram.code()), testProgram.name(), options);
      assertWithMessage("Expected error, flattened OK").that(errMsg).isNull();
      System.out.format("** %s:\n%s\n", testProgram.name(), result);
      if (expected != null) {
        assertWithMessage("Flattened output doesn't match")
            .that(cleanLines(result))
            .isEqualTo(cleanLines(expected));
      }
    } catch (ConversionError e) {
      errMsg = (errMsg == null) ? "(no error expected)" : errMsg.trim();
      assertWithMessage("Unexpected error %s", e).that(e.getMessage()).startsWith(errMsg);
    }
  }

  /** Returns a TestProgram for each chunk of a ".qasm" file in our testdata directory. */
  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, COMMENT_PATTERN);
    }
  }

  private static final Pattern COMMA = Pattern.compile(" *, *");

  private static FlattenOptions parseOptions(String s) {
    s = s.trim();
    FlattenOptions options = FlattenOptions.DEFAULT;
    if (s.isEmpty()) {
      return options;
    }
    List<String> primitives = new ArrayList<>();
    for (String option : COMMA.split(s)) {
      if (option.equals("header")) {
        options = options.withHeader(true);
      } else if (option.equals("numeric")) {
        options = options.withNumericAngles(true);
      } else if (option.startsWith("primitive=")) {
        primitives.add(option.substring("primitive=".length()));
      } else {
        throw new AssertionError("Unknown option " + option);
      }
    }
    return options.withTargetPrimitives(primitives.toArray(new String[0]));
  }

  /**
   * Removes all whitespace at the beginning and end of lines in the given output, and removes all
   * completely blank lines.
   */
  private static String cleanLines(String output) {
    return output.replaceAll(" *\n[ \n]*", "\n").trim();
  }
}
