/*
 * Copyright 2025 The Cellcount Authors
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

package org.cellcount.tools;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSortedMap;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.cellcount.design.CountOverflowError;
import org.cellcount.design.CyclicHierarchyError;
import org.cellcount.design.Design;
import org.cellcount.design.UnknownModuleError;
import org.cellcount.parser.ParseError;
import org.cellcount.parser.Parser;

/**
 * A simple command-line tool that counts the cells placed under one module of a netlist.
 *
 * <p>Set the system property {@code printDesign=true} to also print the parsed design.
 */
public class Count {
  private Count() {}

  private static final String USAGE = "Use: count <fileName> <topModule>";

  public static void main(String[] args) throws IOException {
    boolean printDesign = Boolean.parseBoolean(System.getProperty("printDesign", "false"));
    int status = run(args, printDesign, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the tool and returns its exit status. */
  @VisibleForTesting
  static int run(String[] args, boolean printDesign, PrintStream out, PrintStream err)
      throws IOException {
    if (args.length != 2) {
      err.println(USAGE);
      return 1;
    }
    Path file = Path.of(args[0]);
    String topModule = args[1];
    String text = Files.readString(file, UTF_8);
    ImmutableSortedMap<String, Long> counts;
    try {
      Design design = Parser.parse(text);
      if (printDesign) {
        out.println(design);
        out.println();
      }
      counts = design.countInstances(topModule);
    } catch (ParseError | UnknownModuleError | CyclicHierarchyError | CountOverflowError e) {
      err.printf("%s: %s\n", file.getFileName(), e.getMessage());
      return 1;
    }
    CountReport.lines(counts).forEach(out::println);
    return 0;
  }
}
