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
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A module definition. Everything but the cached instance counts is fixed when the Module is
 * created.
 */
public final class Module {
  private final String name;
  private final ImmutableList<String> params;
  private final ImmutableList<Net> nets;
  private final ImmutableList<Instance> instances;

  /**
   * Null until {@link InstanceCounter} first counts this module; never changes after that. Reads
   * don't lock; the first write wins (see {@link #cacheInstanceCounts}).
   */
  private volatile @Nullable ImmutableSortedMap<String, Long> instanceCounts;

  public Module(String name, List<String> params, List<Net> nets, List<Instance> instances) {
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.nets = ImmutableList.copyOf(nets);
    this.instances = ImmutableList.copyOf(instances);
  }

  public String name() {
    return name;
  }

  /** The names in the module's port list, in source order. */
  public ImmutableList<String> params() {
    return params;
  }

  public ImmutableList<Net> nets() {
    return nets;
  }

  /** This module's instances, in source order. */
  public ImmutableList<Instance> instances() {
    return instances;
  }

  /** Returns the memoized result of counting this module, or null if it hasn't been counted. */
  @Nullable ImmutableSortedMap<String, Long> cachedInstanceCounts() {
    return instanceCounts;
  }

  /**
   * Saves {@code counts} as this module's instance counts, unless another thread got there first;
   * returns whichever value was saved. Since counts are a function of the (immutable) Design, both
   * values will be equal.
   */
  synchronized ImmutableSortedMap<String, Long> cacheInstanceCounts(
      ImmutableSortedMap<String, Long> counts) {
    ImmutableSortedMap<String, Long> result = instanceCounts;
    if (result == null) {
      result = counts;
      instanceCounts = result;
    }
    return result;
  }

  @Override
  public String toString() {
    return String.format(
        "Module(\n  name=%s,\n  params=[%s],\n  nets=[\n%s],\n  instances=[\n%s]\n)",
        name, Joiner.on(", ").join(params), indentedList(nets), indentedList(instances));
  }

  private static final String INDENT = "    ";

  /**
   * Returns the elements' toString()s separated by ",\n", with each non-empty line indented.
   * Elements that print on several lines (Instances) keep their own relative indentation.
   */
  static String indentedList(List<?> elements) {
    String joined = Joiner.on(",\n").join(elements);
    return joined
        .lines()
        .map(line -> line.isEmpty() ? line : INDENT + line)
        .collect(Collectors.joining("\n"));
  }
}
