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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;
import static us.blanshard.crossword.core.TestHelper.*;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

public class LetterGridTest {
  private final Structure structure = st(
      "___",
      "#_#",
      "#_#");
  private final Slot x = across(0, 0, 3);
  private final Slot y = down(0, 1, 3);

  @Test public void complete() {
    LetterGrid grid = LetterGrid.of(structure, ImmutableMap.of(x, "CAT", y, "ARE"));
    assertEquals(3, grid.height());
    assertEquals(3, grid.width());
    assertEquals(Character.valueOf('C'), grid.get(0, 0));
    assertEquals(Character.valueOf('A'), grid.get(0, 1));
    assertEquals(Character.valueOf('E'), grid.get(2, 1));
    assertNull(grid.get(1, 0));
    assertEquals(false, grid.isOpen(1, 0));
    assertThat(grid.rows()).containsExactly("CAT", "#R#", "#E#").inOrder();
  }

  @Test public void partial() {
    Assignment assignment = new Assignment();
    assignment.put(y, "ARE");
    LetterGrid grid = LetterGrid.of(structure, assignment);
    assertNull(grid.get(0, 0));
    assertEquals(true, grid.isOpen(0, 0));
    assertThat(grid.rows()).containsExactly(" A ", "#R#", "#E#").inOrder();
  }

  @Test public void empty() {
    assertThat(LetterGrid.of(structure, new Assignment()).rows())
        .containsExactly("   ", "# #", "# #").inOrder();
  }

  @Test public void laterSlotWins() {
    LetterGrid grid = LetterGrid.of(structure, ImmutableMap.of(y, "DOG", x, "CAT"));
    assertEquals(Character.valueOf('D'), grid.get(0, 1));
  }

  @Test public void wordMustFit() {
    try {
      LetterGrid.of(structure, ImmutableMap.of(x, "CATS"));
      fail();
    } catch (IllegalArgumentException expected) {}
  }
}
