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

import com.google.common.collect.ImmutableList;

/**
 * A use of a module or primitive inside another module, e.g. {@code AND2 u1(.A(x), .B(y));} has
 * type "AND2" and name "u1". The type need not name a module of the Design; if it doesn't, the
 * instance is a primitive.
 */
public record Instance(String type, String name, ImmutableList<Argument> args) {

  @Override
  public String toString() {
    return String.format(
        "Instance(\n  type=%s,\n  name=%s,\n  args=[\n%s])",
        type, name, Module.indentedList(args));
  }
}
