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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Splitter;
import com.google.common.collect.ComparisonChain;

import java.util.Iterator;

import javax.annotation.concurrent.Immutable;

/**
 * A maximal run of open cells in one direction: the unit a word is assigned
 * to.  Rows and columns are 0-based.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Slot implements Comparable<Slot> {

  public final int row;
  public final int column;
  public final Direction direction;

  /** The number of cells, and so the length of any word that fits. */
  public final int length;

  public static Slot of(int row, int column, Direction direction, int length) {
    return new Slot(row, column, direction, length);
  }

  private Slot(int row, int column, Direction direction, int length) {
    checkArgument(row >= 0 && column >= 0, "negative position (%s, %s)", row, column);
    checkArgument(length >= 1, "length must be positive: %s", length);
    this.row = row;
    this.column = column;
    this.direction = checkNotNull(direction);
    this.length = length;
  }

  /** Returns the row of the cell holding the given character position. */
  public int rowAt(int index) {
    checkElementIndex(index, length);
    return row + index * direction.rowStep;
  }

  /** Returns the column of the cell holding the given character position. */
  public int columnAt(int index) {
    checkElementIndex(index, length);
    return column + index * direction.columnStep;
  }

  /**
   * Returns the character position within this slot of the given cell, or -1
   * if the cell isn't part of the slot.
   */
  public int indexOf(int row, int column) {
    int index = direction == Direction.ACROSS ? column - this.column : row - this.row;
    int fixed = direction == Direction.ACROSS ? row - this.row : column - this.column;
    return fixed == 0 && index >= 0 && index < length ? index : -1;
  }

  /** Orders slots as the structure scan finds them: row-major, across first. */
  @Override public int compareTo(Slot that) {
    return ComparisonChain.start()
        .compare(this.row, that.row)
        .compare(this.column, that.column)
        .compare(this.direction, that.direction)
        .compare(this.length, that.length)
        .result();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Slot)) return false;
    Slot that = (Slot) o;
    return this.row == that.row
        && this.column == that.column
        && this.direction == that.direction
        && this.length == that.length;
  }

  @Override public int hashCode() {
    return Objects.hashCode(row, column, direction, length);
  }

  @Override public String toString() {
    return String.format("(%d, %d) %s %d", row, column, direction, length);
  }

  private static final Joiner JOINER = Joiner.on(',');
  private static final Splitter SPLITTER = Splitter.on(',').trimResults();

  /** Returns the compact form read by {@link #fromJsonValue}. */
  public String toJsonValue() {
    return JOINER.join(row, column, direction, length);
  }

  public static Slot fromJsonValue(String value) {
    Iterator<String> values = SPLITTER.split(value).iterator();
    try {
      int row = Integer.parseInt(values.next());
      int column = Integer.parseInt(values.next());
      Direction direction = Direction.valueOf(values.next());
      int length = Integer.parseInt(values.next());
      checkArgument(!values.hasNext(), "trailing values in slot %s", value);
      return new Slot(row, column, direction, length);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Unrecognized slot " + value, e);
    }
  }
}
