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
 * A declared input, output or wire. A net declared without a range has {@code msb} and {@code lsb}
 * both zero.
 */
public record Net(NetKind kind, String name, int msb, int lsb) {

  @Override
  public String toString() {
    return String.format("Net(type=%s, name=%s, msb=%s, lsb=%s)", kind, name, msb, lsb);
  }
}
