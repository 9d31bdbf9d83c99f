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

/** Thrown when asked to count the instances of a module that the Design doesn't define. */
public class UnknownModuleError extends RuntimeException {
  public final String moduleName;

  public UnknownModuleError(String moduleName) {
    super(String.format("Unknown module '%s'", moduleName));
    this.moduleName = moduleName;
  }
}
