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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static us.blanshard.crossword.core.TestHelper.*;

import org.junit.Before;
import org.junit.Test;

public class DomainsTest {
  private final Structure structure = st(
      "____",
      "_###",
      "_###");
  private final Slot x = across(0, 0, 4);
  private final Slot y = down(0, 0, 3);
  private Domains domains;

  @Before public void setUp() {
    domains = Domains.of(structure, words("FISH", "FOX", "FROG", "FLY", "EEL", "FOX"));
  }

  @Test public void startsWithWholeVocabulary() {
    assertThat(domains.get(x)).containsExactly("FISH", "FOX", "FROG", "FLY", "EEL").inOrder();
    assertThat(domains.get(y)).containsExactly("FISH", "FOX", "FROG", "FLY", "EEL").inOrder();
  }

  @Test public void enforceNodeConsistency() {
    assertEquals(true, domains.enforceNodeConsistency());
    assertThat(domains.get(x)).containsExactly("FISH", "FROG").inOrder();
    assertThat(domains.get(y)).containsExactly("FOX", "FLY", "EEL").inOrder();
    for (Slot slot : structure.variables())
      for (String word : domains.get(slot))
        assertEquals(slot.length, word.length());
  }

  @Test public void enforceNodeConsistency_idempotent() {
    domains.enforceNodeConsistency();
    String once = domains.toString();
    assertEquals(false, domains.enforceNodeConsistency());
    assertEquals(once, domains.toString());
  }

  @Test public void viewsAreReadOnly() {
    try {
      domains.get(x).clear();
      fail();
    } catch (UnsupportedOperationException expected) {}
  }

  @Test public void restrictTo() {
    domains.restrictTo(y, "FLY");
    assertThat(domains.get(y)).containsExactly("FLY");
    assertEquals(1, domains.size(y));
    assertEquals(5, domains.size(x));
  }

  @Test public void removeAll() {
    assertEquals(true, domains.removeAll(x, words("FOX", "EEL", "CAT")));
    assertEquals(false, domains.removeAll(x, words("CAT")));
    assertThat(domains.get(x)).containsExactly("FISH", "FROG", "FLY").inOrder();
    domains.removeAll(x, domains.snapshot().get(x));
    assertEquals(true, domains.isEmpty(x));
  }

  @Test public void snapshotAndRestore() {
    domains.enforceNodeConsistency();
    Domains.Snapshot snapshot = domains.snapshot();

    domains.restrictTo(x, "FROG");
    domains.removeAll(y, words("FOX"));
    assertThat(snapshot.get(x)).containsExactly("FISH", "FROG");
    assertThat(snapshot.get(y)).containsExactly("FOX", "FLY", "EEL");

    domains.restore(snapshot);
    assertThat(domains.get(x)).containsExactly("FISH", "FROG").inOrder();
    assertThat(domains.get(y)).containsExactly("FOX", "FLY", "EEL").inOrder();

    // Mutating after a restore leaves the snapshot alone, so it can be restored again.
    domains.removeAll(y, words("FLY", "EEL"));
    domains.restore(snapshot);
    assertThat(domains.get(y)).containsExactly("FOX", "FLY", "EEL").inOrder();
  }

  @Test public void nestedSnapshots() {
    Domains.Snapshot outer = domains.snapshot();
    domains.enforceNodeConsistency();
    Domains.Snapshot inner = domains.snapshot();
    domains.restrictTo(x, "FISH");
    domains.restore(inner);
    assertThat(domains.get(x)).containsExactly("FISH", "FROG");
    domains.restore(outer);
    assertEquals(5, domains.size(x));
    assertThat(inner.get(x)).containsExactly("FISH", "FROG");
  }

  @Test public void foreignSnapshot() {
    Domains other = Domains.of(st("___"), words("CAT"));
    try {
      domains.restore(other.snapshot());
      fail();
    } catch (IllegalArgumentException expected) {}
  }

  @Test public void foreignSlot() {
    try {
      domains.size(across(2, 0, 4));
      fail();
    } catch (IllegalArgumentException expected) {}
  }
}
