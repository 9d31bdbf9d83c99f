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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CountTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
  private PrintStream out;
  private PrintStream err;

  @Before
  public void setUp() {
    out = new PrintStream(outBytes, true, UTF_8);
    err = new PrintStream(errBytes, true, UTF_8);
  }

  private String writeNetlist(String text) throws IOException {
    File file = tmp.newFile("TopCell.v");
    Files.writeString(file.toPath(), text, UTF_8);
    return file.getPath();
  }

  private int run(boolean printDesign, String... args) throws IOException {
    return Count.run(args, printDesign, out, err);
  }

  private static final String TOP_CELL =
      String.join(
          "\n",
          "module cellB(a);",
          "  wire a;",
          "  INV u3(.A(a), .Y(a));",
          "  INV u4(.A(a), .Y(a));",
          "endmodule",
          "module TopCell(x);",
          "  wire x;",
          "  AND2 u1(.A(x), .B(x));",
          "  cellB u2(.a(x));",
          "endmodule",
          "");

  @Test
  public void printsReport() throws IOException {
    String file = writeNetlist(TOP_CELL);
    assertThat(run(false, file, "TopCell")).isEqualTo(0);
    assertThat(outBytes.toString(UTF_8))
        .isEqualTo(
            "AND2            : 1 placements\n"
                + "INV             : 2 placements\n"
                + "cellB           : 1 placements\n");
    assertThat(errBytes.toString(UTF_8)).isEmpty();
  }

  @Test
  public void printsDesignFirst() throws IOException {
    String file = writeNetlist(TOP_CELL);
    assertThat(run(true, file, "cellB")).isEqualTo(0);
    String output = outBytes.toString(UTF_8);
    assertThat(output).startsWith("Module(\n  name=cellB,");
    assertThat(output).endsWith(")\n\nINV             : 2 placements\n");
  }

  @Test
  public void usage() throws IOException {
    assertThat(run(false, "TopCell.v")).isEqualTo(1);
    assertThat(errBytes.toString(UTF_8)).startsWith("Use: count");
    assertThat(outBytes.toString(UTF_8)).isEmpty();
  }

  @Test
  public void syntaxErrorIsReported() throws IOException {
    String file = writeNetlist("module m(a);\n  wire a\nendmodule\n");
    assertThat(run(false, file, "m")).isEqualTo(1);
    assertThat(errBytes.toString(UTF_8)).isEqualTo("TopCell.v: Expected ';' (2:8)\n");
    assertThat(outBytes.toString(UTF_8)).isEmpty();
  }

  @Test
  public void unknownTopIsReported() throws IOException {
    String file = writeNetlist(TOP_CELL);
    assertThat(run(false, file, "Top")).isEqualTo(1);
    assertThat(errBytes.toString(UTF_8)).isEqualTo("TopCell.v: Unknown module 'Top'\n");
  }

  /**
   * Returns a netlist of modules level0 (one BUF) to level{@code depth}, each holding two copies
   * of the one below.
   */
  private static String doublingLevels(int depth) {
    StringBuilder sb = new StringBuilder("module level0(a);\n  BUF u0(.A(a));\nendmodule\n");
    for (int i = 1; i <= depth; i++) {
      String below = "level" + (i - 1);
      sb.append(String.format("module level%s(a);\n", i))
          .append(String.format("  %s u0(.a(a));\n  %s u1(.a(a));\n", below, below))
          .append("endmodule\n");
    }
    return sb.toString();
  }

  @Test
  public void reportsCountsBeyondIntRange() throws IOException {
    String file = writeNetlist(doublingLevels(31));
    assertThat(run(false, file, "level31")).isEqualTo(0);
    String output = outBytes.toString(UTF_8);
    assertThat(output).startsWith("BUF             : 2147483648 placements\n");
    assertThat(output).contains("level0          : 2147483648 placements\n");
    assertThat(output).contains("level30         : 2 placements\n");
    assertThat(errBytes.toString(UTF_8)).isEmpty();
  }

  @Test
  public void countOverflowIsReported() throws IOException {
    String file = writeNetlist(doublingLevels(63));
    assertThat(run(false, file, "level63")).isEqualTo(1);
    assertThat(errBytes.toString(UTF_8))
        .isEqualTo("TopCell.v: Too many instances of 'BUF' in module 'level63'\n");
    assertThat(outBytes.toString(UTF_8)).isEmpty();
  }

  @Test
  public void missingFile() {
    String missing = new File(tmp.getRoot(), "nope.v").getPath();
    assertThrows(NoSuchFileException.class, () -> run(false, missing, "TopCell"));
  }
}
