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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A partial or complete choice of one word per slot.  Accepts any word for any
 * slot: it does not enforce the rules of the puzzle, but can tell you whether
 * they are broken.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Assignment {

  private final Map<Slot, String> words = Maps.newLinkedHashMap();

  public Assignment() {}

  public Assignment(Map<Slot, String> words) {
    for (Map.Entry<Slot, String> entry : words.entrySet())
      put(entry.getKey(), entry.getValue());
  }

  /** Binds the slot to the word, returns the word it was bound to before if any. */
  @Nullable public String put(Slot slot, String word) {
    return words.put(checkNotNull(slot), checkNotNull(word));
  }

  /** Unbinds the slot, returns the word it was bound to if any. */
  @Nullable public String remove(Slot slot) {
    return words.remove(slot);
  }

  @Nullable public String get(Slot slot) {
    return words.get(slot);
  }

  public boolean isAssigned(Slot slot) {
    return words.containsKey(slot);
  }

  public int size() {
    return words.size();
  }

  /** The bound slots, in the order they were bound. */
  public Set<Slot> slots() {
    return Collections.unmodifiableSet(words.keySet());
  }

  /** Tells whether every slot of the structure is bound to a non-empty word. */
  public boolean isComplete(Structure structure) {
    for (Slot slot : structure.variables()) {
      String word = words.get(slot);
      if (word == null || word.isEmpty())
        return false;
    }
    return true;
  }

  /**
   * Tells whether the bound words obey the rules: each word fits its slot,
   * crossing slots agree on their shared letter, and no word appears twice.
   * Looks at every bound slot, not just the most recent.
   */
  public boolean isConsistent(Structure structure) {
    Set<String> seen = Sets.newHashSet();
    for (Map.Entry<Slot, String> entry : words.entrySet()) {
      Slot slot = entry.getKey();
      String word = entry.getValue();
      if (word.length() != slot.length)
        return false;
      if (!seen.add(word))
        return false;
      for (Slot neighbor : structure.neighbors(slot)) {
        String other = words.get(neighbor);
        if (other != null && other.length() == neighbor.length
            && !structure.overlap(slot, neighbor).agrees(word, other))
          return false;
      }
    }
    return true;
  }

  /** Returns an immutable copy in slot order. */
  public ImmutableSortedMap<Slot, String> asMap() {
    return ImmutableSortedMap.copyOf(words);
  }

  @Override public String toString() {
    return words.toString();
  }
}
