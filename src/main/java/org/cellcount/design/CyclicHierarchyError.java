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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Thrown when counting reaches a module that (directly or indirectly) instantiates itself, since
 * its hierarchy can't be flattened.
 */
public class CyclicHierarchyError extends RuntimeException {

  /**
   * The module names along the cycle; the first and last elements are the same module, e.g. {@code
   * [a, b, a]}.
   */
  public final ImmutableList<String> cycle;

  public CyclicHierarchyError(ImmutableList<String> cycle) {
    super("Cyclic module hierarchy: " + Joiner.on(" -> ").join(cycle));
    this.cycle = cycle;
  }
}
