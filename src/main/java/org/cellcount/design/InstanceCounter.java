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
import com.google.common.collect.ImmutableSortedMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Flattens the module hierarchy of a Design to count instances by type.
 *
 * <p>The counts for a module are its own instances plus, for each instance of another module of
 * the Design, that module's counts. Counts are memoized on each Module, so a module that is
 * instantiated many times (or reached from several tops) is only expanded once per Design.
 *
 * <p>An InstanceCounter is used for a single traversal and is not thread-safe, but separate
 * InstanceCounters may run concurrently on the same Design.
 */
final class InstanceCounter {
  private final Design design;

  /** The modules whose counts are being computed, outermost first. */
  private final LinkedHashSet<Module> expanding = new LinkedHashSet<>();

  InstanceCounter(Design design) {
    this.design = design;
  }

  /** Returns the counts for {@code module}, computing and caching them if necessary. */
  ImmutableSortedMap<String, Long> count(Module module) {
    ImmutableSortedMap<String, Long> cached = module.cachedInstanceCounts();
    if (cached != null) {
      return cached;
    }
    if (!expanding.add(module)) {
      throw cycleThrough(module);
    }
    try {
      Map<String, Long> counts = new HashMap<>();
      for (Instance instance : module.instances()) {
        add(counts, module, instance.type(), 1);
        Module child = design.module(instance.type());
        if (child != null) {
          for (Map.Entry<String, Long> entry : count(child).entrySet()) {
            add(counts, module, entry.getKey(), entry.getValue());
          }
        }
      }
      return module.cacheInstanceCounts(ImmutableSortedMap.copyOf(counts));
    } finally {
      expanding.remove(module);
    }
  }

  private static void add(Map<String, Long> counts, Module module, String type, long n) {
    try {
      counts.merge(type, n, Math::addExact);
    } catch (ArithmeticException e) {
      throw new CountOverflowError(module.name(), type, e);
    }
  }

  /**
   * Returns the error for reaching {@code module} while it is already being expanded. The cycle
   * runs from that earlier expansion through the innermost module and back.
   */
  private CyclicHierarchyError cycleThrough(Module module) {
    ImmutableList.Builder<String> cycle = ImmutableList.builder();
    expanding.stream().dropWhile(m -> m != module).forEach(m -> cycle.add(m.name()));
    cycle.add(module.name());
    return new CyclicHierarchyError(cycle.build());
  }
}
