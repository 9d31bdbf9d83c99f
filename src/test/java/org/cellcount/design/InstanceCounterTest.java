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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InstanceCounterTest {

  /** Returns a module with no params or nets and one instance of each of the given types. */
  private static Module module(String name, String... instanceTypes) {
    ImmutableList.Builder<Instance> instances = ImmutableList.builder();
    for (int i = 0; i < instanceTypes.length; i++) {
      instances.add(new Instance(instanceTypes[i], "u" + i, ImmutableList.of()));
    }
    return new Module(name, ImmutableList.of(), ImmutableList.of(), instances.build());
  }

  private static Design design(Module... modules) {
    return new Design(ImmutableList.copyOf(modules));
  }

  @Test
  public void topCell() {
    Design design = design(module("cellB"), module("TopCell", "AND2", "cellB"));
    assertThat(design.countInstances("TopCell")).containsExactly("AND2", 1L, "cellB", 1L);
  }

  @Test
  public void nestedTopCell() {
    Design design = design(module("cellB", "INV", "INV"), module("TopCell", "AND2", "cellB"));
    assertThat(design.countInstances("TopCell"))
        .containsExactly("AND2", 1L, "INV", 2L, "cellB", 1L)
        .inOrder();
  }

  @Test
  public void moduleWithoutInstances() {
    Design design = design(module("empty"));
    assertThat(design.countInstances("empty")).isEmpty();
  }

  @Test
  public void instanceOrderDoesNotMatter() {
    Design d1 = design(module("sub", "X"), module("top", "A", "sub", "B", "sub"));
    Design d2 = design(module("sub", "X"), module("top", "sub", "sub", "B", "A"));
    assertThat(d1.countInstances("top")).isEqualTo(d2.countInstances("top"));
  }

  @Test
  public void sharedModulesAreMultiplied() {
    // top -> 2 mid -> 3 leaf -> 1 DFF each, reached through two different parents.
    Design design =
        design(
            module("leaf", "DFF"),
            module("mid", "leaf", "leaf", "leaf"),
            module("other", "leaf"),
            module("top", "mid", "mid", "other"));
    ImmutableSortedMap<String, Long> counts = design.countInstances("top");
    assertThat(counts).containsEntry("mid", 2L);
    assertThat(counts).containsEntry("other", 1L);
    assertThat(counts).containsEntry("leaf", 7L);
    assertThat(counts).containsEntry("DFF", 7L);
  }

  @Test
  public void countsAreMemoized() {
    Design design = design(module("sub", "INV"), module("top", "sub", "sub"));
    Module sub = design.module("sub");
    assertThat(sub.cachedInstanceCounts()).isNull();

    ImmutableSortedMap<String, Long> first = design.countInstances("top");
    // Counting top also counted (and cached) sub.
    ImmutableSortedMap<String, Long> subCounts = sub.cachedInstanceCounts();
    assertThat(subCounts).containsExactly("INV", 1L);

    assertThat(design.countInstances("top")).isSameInstanceAs(first);
    assertThat(design.countInstances("sub")).isSameInstanceAs(subCounts);
  }

  @Test
  public void countingInvariant() {
    Design design =
        design(
            module("a", "P", "Q"),
            module("b", "a", "P", "a"),
            module("c", "b", "a", "R"),
            module("d", "c", "b", "c", "S"),
            module("e"));
    for (Module m : design.modules().values()) {
      // Recompute one level by hand, relying on the (already tested) counts of submodules.
      Map<String, Long> expected = new HashMap<>();
      for (Instance instance : m.instances()) {
        expected.merge(instance.type(), 1L, Long::sum);
        if (design.module(instance.type()) != null) {
          design.countInstances(instance.type()).forEach((t, n) -> expected.merge(t, n, Long::sum));
        }
      }
      assertThat(design.countInstances(m.name())).isEqualTo(expected);
    }
  }

  /** Returns modules level0 (one BUF) to level{@code depth}, each holding two of the one below. */
  private static Design doublingLevels(int depth) {
    List<Module> modules = new ArrayList<>();
    modules.add(module("level0", "BUF"));
    for (int i = 1; i <= depth; i++) {
      String below = "level" + (i - 1);
      modules.add(module("level" + i, below, below));
    }
    return new Design(modules);
  }

  @Test
  public void countsBeyondIntRange() {
    ImmutableSortedMap<String, Long> counts = doublingLevels(31).countInstances("level31");
    assertThat(counts).containsEntry("BUF", 1L << 31);
    assertThat(counts).containsEntry("level0", 1L << 31);
    assertThat(counts).containsEntry("level30", 2L);

    assertThat(doublingLevels(62).countInstances("level62")).containsEntry("BUF", 1L << 62);
  }

  @Test
  public void countOverflow() {
    Design design = doublingLevels(63);
    CountOverflowError e =
        assertThrows(CountOverflowError.class, () -> design.countInstances("level63"));
    assertThat(e.moduleName).isEqualTo("level63");
    assertThat(e.type).isEqualTo("BUF");
    assertThat(e).hasMessageThat().isEqualTo("Too many instances of 'BUF' in module 'level63'");
    assertThat(e).hasCauseThat().isInstanceOf(ArithmeticException.class);
    // The module that overflowed caches nothing; the ones below it keep their counts.
    assertThat(design.module("level63").cachedInstanceCounts()).isNull();
    assertThat(design.module("level62").cachedInstanceCounts()).containsEntry("BUF", 1L << 62);
  }

  @Test
  public void unknownModule() {
    Design design = design(module("top", "INV"));
    UnknownModuleError e =
        assertThrows(UnknownModuleError.class, () -> design.countInstances("INV"));
    assertThat(e.moduleName).isEqualTo("INV");
    assertThat(e).hasMessageThat().isEqualTo("Unknown module 'INV'");
  }

  @Test
  public void selfInstantiation() {
    Design design = design(module("loop", "INV", "loop"));
    CyclicHierarchyError e =
        assertThrows(CyclicHierarchyError.class, () -> design.countInstances("loop"));
    assertThat(e.cycle).containsExactly("loop", "loop");
    assertThat(e).hasMessageThat().isEqualTo("Cyclic module hierarchy: loop -> loop");
  }

  @Test
  public void indirectCycleBelowTop() {
    Design design = design(module("top", "b"), module("b", "c"), module("c", "INV", "b"));
    CyclicHierarchyError e =
        assertThrows(CyclicHierarchyError.class, () -> design.countInstances("top"));
    assertThat(e.cycle).containsExactly("b", "c", "b").inOrder();
    // Nothing on the failed path was cached.
    assertThat(design.module("top").cachedInstanceCounts()).isNull();
    assertThat(design.module("c").cachedInstanceCounts()).isNull();
  }

  @Test
  public void acyclicPartsStillCount() {
    Design design =
        design(module("ok", "INV"), module("a", "ok", "b"), module("b", "a"), module("top", "ok"));
    assertThrows(CyclicHierarchyError.class, () -> design.countInstances("a"));
    assertThat(design.countInstances("top")).containsExactly("INV", 1L, "ok", 1L);
    // The failed traversal doesn't leave "a" marked as in progress.
    assertThrows(CyclicHierarchyError.class, () -> design.countInstances("b"));
  }

  @Test
  public void concurrentCountsAgree() throws Exception {
    List<Module> modules = new ArrayList<>();
    modules.add(module("level0", "BUF", "INV"));
    for (int i = 1; i <= 10; i++) {
      String below = "level" + (i - 1);
      modules.add(module("level" + i, below, "DFF", below));
    }
    Design design = new Design(modules);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Callable<ImmutableSortedMap<String, Long>>> tasks = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        String top = "level" + (10 - (i % 3));
        tasks.add(() -> design.countInstances(top));
      }
      for (Future<ImmutableSortedMap<String, Long>> f : executor.invokeAll(tasks)) {
        f.get();
      }
    } finally {
      executor.shutdown();
    }
    // Whichever thread won, every later request sees the same cached value.
    ImmutableSortedMap<String, Long> counts = design.countInstances("level10");
    assertThat(design.countInstances("level10")).isSameInstanceAs(counts);
    assertThat(counts).containsEntry("BUF", 1L << 10);
    assertThat(counts).containsEntry("DFF", (1L << 10) - 1);
  }
}
