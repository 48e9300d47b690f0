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

package org.flatqasm.tools;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.antlr.v4.runtime.CharStreams;
import org.flatqasm.compiler.ConversionError;
import org.flatqasm.compiler.FlattenOptions;
import org.flatqasm.compiler.Flattener;

/**
 * A command-line tool that flattens one or more OpenQASM 2.0 files.
 *
 * <p>Arguments are pairs of input and output file names; the pairs are converted in parallel.
 * Options are read from system properties (see {@link FlattenOptions#fromProperties}). The exit
 * status is 0 if every conversion succeeded, 1 for bad usage, and otherwise the largest of 2 (some
 * input couldn't be converted) and 3 (some file couldn't be read or written).
 */
public class Flatten {
  private static final Logger LOG = Logger.getLogger(Flatten.class.getName());

  static final int OK = 0;
  static final int USAGE = 1;
  static final int CONVERSION_FAILED = 2;
  static final int IO_FAILED = 3;

  private Flatten() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: flatten <input.qasm> <output.qasm> [ <input> <output> ...]");
      System.exit(USAGE);
    }
  }

  public static void main(String[] args) {
    checkUsage(args.length != 0 && args.length % 2 == 0);
    FlattenOptions options;
    try {
      options = FlattenOptions.fromProperties(System.getProperties());
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.exit(USAGE);
      return;
    }
    int status =
        IntStream.range(0, args.length / 2)
            .parallel()
            .map(i -> convertFile(Path.of(args[2 * i]), Path.of(args[2 * i + 1]), options))
            .max()
            .orElse(OK);
    System.exit(status);
  }

  /** Converts a single file, reporting any failure to System.err, and returns an exit status. */
  static int convertFile(Path input, Path output, FlattenOptions options) {
    String fileName = input.getFileName().toString();
    try {
      String result =
          Flattener.convert(CharStreams.fromPath(input, StandardCharsets.UTF_8), fileName, options);
      Files.writeString(output, result, StandardCharsets.UTF_8);
      LOG.info(() -> String.format("Flattened %s to %s", input, output));
      return OK;
    } catch (ConversionError e) {
      System.err.printf("%s: %s\n", fileName, e.getMessage());
      return CONVERSION_FAILED;
    } catch (IOException e) {
      LOG.log(Level.SEVERE, "Unable to convert " + input, e);
      System.err.printf("%s: %s\n", fileName, e);
      return IO_FAILED;
    }
  }
}
