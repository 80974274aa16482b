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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The letters of an assignment laid out on its structure's cells.  This is
 * what a presentation layer draws from.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class LetterGrid {

  /** Marks a blocked cell in {@link #rows}. */
  public static final char BLOCKED = '#';

  /** Marks an open cell with no letter yet in {@link #rows}. */
  public static final char BLANK = ' ';

  private final Structure structure;
  private final char[][] letters;  // 0 where unresolved

  /**
   * Projects the given words, which may cover only some of the slots, onto the
   * structure's cells.  Where two words disagree on a cell, the one whose slot
   * comes later in slot order wins.
   */
  public static LetterGrid of(Structure structure, Map<Slot, String> words) {
    char[][] letters = new char[structure.height][structure.width];
    for (Map.Entry<Slot, String> entry : ImmutableSortedMap.copyOf(words).entrySet()) {
      Slot slot = entry.getKey();
      String word = entry.getValue();
      checkArgument(structure.contains(slot), "not a slot of this structure: %s", slot);
      checkArgument(word.length() == slot.length, "%s doesn't fit %s", word, slot);
      for (int k = 0; k < word.length(); ++k)
        letters[slot.rowAt(k)][slot.columnAt(k)] = word.charAt(k);
    }
    return new LetterGrid(structure, letters);
  }

  public static LetterGrid of(Structure structure, Assignment assignment) {
    return of(structure, assignment.asMap());
  }

  private LetterGrid(Structure structure, char[][] letters) {
    this.structure = structure;
    this.letters = letters;
  }

  public int height() {
    return structure.height;
  }

  public int width() {
    return structure.width;
  }

  public boolean isOpen(int row, int column) {
    return structure.isOpen(row, column);
  }

  /** Returns the letter in the given cell, or null if blocked or unresolved. */
  @Nullable public Character get(int row, int column) {
    char c = letters[row][column];
    return c == 0 ? null : c;
  }

  /**
   * Returns each row as a string, using {@link #BLOCKED} and {@link #BLANK}
   * for cells without letters.
   */
  public ImmutableList<String> rows() {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (int row = 0; row < height(); ++row) {
      StringBuilder sb = new StringBuilder(width());
      for (int col = 0; col < width(); ++col) {
        if (!isOpen(row, col)) sb.append(BLOCKED);
        else if (letters[row][col] == 0) sb.append(BLANK);
        else sb.append(letters[row][col]);
      }
      builder.add(sb.toString());
    }
    return builder.build();
  }

  @Override public String toString() {
    return rows().toString();
  }
}
