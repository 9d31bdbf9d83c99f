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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import org.jspecify.annotations.Nullable;

/** All the modules defined by one netlist source, indexed by name. */
public final class Design {
  private final ImmutableMap<String, Module> modules;

  /**
   * Creates a Design from the given modules, which must have distinct names; iteration order of
   * {@link #modules} will match.
   */
  public Design(Iterable<Module> modules) {
    ImmutableMap.Builder<String, Module> builder = ImmutableMap.builder();
    for (Module module : modules) {
      builder.put(module.name(), module);
    }
    this.modules = builder.buildOrThrow();
  }

  public ImmutableMap<String, Module> modules() {
    return modules;
  }

  /** Returns the module with the given name, or null if there is none. */
  public @Nullable Module module(String name) {
    return modules.get(name);
  }

  /**
   * Returns the number of instances of each type in the named module, counting through every level
   * of the hierarchy below it. Each instance of a module defined in this Design counts once for
   * itself and then contributes that module's own counts; an instance of any other type is a
   * primitive and counts once.
   *
   * <p>The result is sorted by type name. Results are memoized, so asking again for the same
   * module returns the same map.
   *
   * @throws UnknownModuleError if this Design has no module named {@code moduleName}
   * @throws CyclicHierarchyError if the module's hierarchy includes a module that instantiates
   *     itself, directly or indirectly
   * @throws CountOverflowError if a count doesn't fit in a {@code long}
   */
  public ImmutableSortedMap<String, Long> countInstances(String moduleName) {
    Module top = modules.get(moduleName);
    if (top == null) {
      throw new UnknownModuleError(moduleName);
    }
    return new InstanceCounter(this).count(top);
  }

  @Override
  public String toString() {
    return Joiner.on("\n\n").join(modules.values());
  }
}
