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

package org.cellcount.design;

/**
 * A named port connection such as {@code .A(x[3:1])}: {@code param} is the port ("A") and {@code
 * arg} is the connected net ("x").
 *
 * <p>{@code msb} and {@code lsb} are the bit-select, if any. A single bit ({@code x[3]}) has both
 * equal to that bit; no bit-select at all has both zero.
 */
public record Argument(String param, String arg, int msb, int lsb) {

  @Override
  public String toString() {
    return String.format("Argument(param=%s, arg=%s, msb=%s, lsb=%s)", param, arg, msb, lsb);
  }
}
