/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Keeps track of the words that could still go in each slot of a structure.
 * Starts with the whole vocabulary in every slot; the sets only shrink, except
 * when a {@link Snapshot} is restored.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Domains {

  private final Structure structure;
  private final Map<Slot, Set<String>> domains;

  public static Domains of(Structure structure, Collection<String> vocabulary) {
    ImmutableSet<String> words = ImmutableSet.copyOf(vocabulary);
    Map<Slot, Set<String>> domains = Maps.newLinkedHashMap();
    for (Slot slot : structure.variables())
      domains.put(slot, Sets.newLinkedHashSet(words));
    return new Domains(structure, domains);
  }

  private Domains(Structure structure, Map<Slot, Set<String>> domains) {
    this.structure = structure;
    this.domains = domains;
  }

  public Structure getStructure() {
    return structure;
  }

  /** Returns a read-only view of the given slot's remaining words. */
  public Set<String> get(Slot slot) {
    return Collections.unmodifiableSet(live(slot));
  }

  public int size(Slot slot) {
    return live(slot).size();
  }

  public boolean isEmpty(Slot slot) {
    return live(slot).isEmpty();
  }

  /**
   * Removes from every slot the words whose length doesn't match the slot.
   * Returns true if anything was removed.
   */
  public boolean enforceNodeConsistency() {
    boolean changed = false;
    for (Map.Entry<Slot, Set<String>> entry : domains.entrySet()) {
      int length = entry.getKey().length;
      for (Iterator<String> it = entry.getValue().iterator(); it.hasNext(); ) {
        if (it.next().length() != length) {
          it.remove();
          changed = true;
        }
      }
    }
    return changed;
  }

  /** Removes the given words from the slot's domain, returns true if any were there. */
  public boolean removeAll(Slot slot, Collection<String> words) {
    Set<String> set = live(slot);
    boolean changed = false;
    for (String word : words)
      changed |= set.remove(word);
    return changed;
  }

  /** Narrows the slot's domain to the single given word. */
  public void restrictTo(Slot slot, String word) {
    Set<String> set = live(slot);
    set.clear();
    set.add(checkNotNull(word));
  }

  /** Takes an independent copy of all the domains. */
  public Snapshot snapshot() {
    ImmutableMap.Builder<Slot, ImmutableSet<String>> builder = ImmutableMap.builder();
    for (Map.Entry<Slot, Set<String>> entry : domains.entrySet())
      builder.put(entry.getKey(), ImmutableSet.copyOf(entry.getValue()));
    return new Snapshot(builder.build());
  }

  /**
   * Puts all the domains back the way they were when the snapshot was taken.
   * The snapshot is unaffected, and may be restored again.
   */
  public void restore(Snapshot snapshot) {
    checkArgument(snapshot.domains.keySet().equals(domains.keySet()),
        "snapshot is from a different structure");
    for (Map.Entry<Slot, ImmutableSet<String>> entry : snapshot.domains.entrySet())
      domains.put(entry.getKey(), Sets.newLinkedHashSet(entry.getValue()));
  }

  private Set<String> live(Slot slot) {
    Set<String> set = domains.get(checkNotNull(slot));
    checkArgument(set != null, "not a slot of this structure: %s", slot);
    return set;
  }

  @Override public String toString() {
    return domains.toString();
  }

  /**
   * A frozen copy of a {@link Domains}.
   */
  @Immutable
  public static final class Snapshot {
    private final ImmutableMap<Slot, ImmutableSet<String>> domains;

    private Snapshot(ImmutableMap<Slot, ImmutableSet<String>> domains) {
      this.domains = domains;
    }

    public ImmutableSet<String> get(Slot slot) {
      return domains.get(slot);
    }
  }
}
