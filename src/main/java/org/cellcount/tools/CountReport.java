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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;

/** A statics-only class that formats instance counts for printing. */
public final class CountReport {

  // Statics only
  private CountReport() {}

  /** Type names are left-justified in a 15-character column. */
  private static final String LINE_FORMAT = "%-15s : %s placements";

  /**
   * Returns one line for each distinct type in {@code counts}, sorted by type name, e.g.
   * "{@code AND2            : 3 placements}".
   */
  public static ImmutableList<String> lines(Map<String, Long> counts) {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (Map.Entry<String, Long> entry : ImmutableSortedMap.copyOf(counts).entrySet()) {
      lines.add(String.format(LINE_FORMAT, entry.getKey(), entry.getValue()));
    }
    return lines.build();
  }
}
