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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The geometry of a crossword: which cells are open and which are blocked,
 * the slots the open cells form, and where the slots cross.  Never changes
 * once built.
 *
 * <p> Only runs of two or more open cells are slots.  Two slots share at most
 * one cell, since crossing slots always run in different directions.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Structure {

  public final int height;
  public final int width;

  private final boolean[][] open;
  private final ImmutableList<Slot> slots;
  private final ImmutableMap<Slot, ImmutableMap<Slot, Overlap>> overlaps;

  /**
   * Builds a structure from the given occupancy rows, where true means an
   * open cell.  Throws IllegalArgumentException if the rows are missing or
   * ragged.
   */
  public static Structure of(boolean[][] open) {
    checkNotNull(open);
    checkArgument(open.length > 0, "no rows");
    int width = checkNotNull(open[0], "row 0").length;
    checkArgument(width > 0, "empty rows");
    boolean[][] copy = new boolean[open.length][];
    for (int i = 0; i < open.length; ++i) {
      checkNotNull(open[i], "row %s", i);
      checkArgument(open[i].length == width,
          "row %s has %s cells, expected %s", i, open[i].length, width);
      copy[i] = open[i].clone();
    }
    return new Structure(copy);
  }

  private Structure(boolean[][] open) {
    this.height = open.length;
    this.width = open[0].length;
    this.open = open;

    // For each cell, the across and down slots running through it.
    Slot[][] across = new Slot[height][width];
    Slot[][] down = new Slot[height][width];
    ImmutableList.Builder<Slot> slots = ImmutableList.builder();
    for (int row = 0; row < height; ++row) {
      for (int col = 0; col < width; ++col) {
        if (!open[row][col]) continue;
        if (col == 0 || !open[row][col - 1]) {
          int end = col;
          while (end < width && open[row][end]) ++end;
          if (end - col > 1) {
            Slot slot = Slot.of(row, col, Direction.ACROSS, end - col);
            slots.add(slot);
            for (int k = col; k < end; ++k) across[row][k] = slot;
          }
        }
        if (row == 0 || !open[row - 1][col]) {
          int end = row;
          while (end < height && open[end][col]) ++end;
          if (end - row > 1) {
            Slot slot = Slot.of(row, col, Direction.DOWN, end - row);
            slots.add(slot);
            for (int k = row; k < end; ++k) down[k][col] = slot;
          }
        }
      }
    }
    this.slots = slots.build();

    Map<Slot, ImmutableMap.Builder<Slot, Overlap>> builders = Maps.newHashMap();
    for (Slot slot : this.slots)
      builders.put(slot, ImmutableMap.<Slot, Overlap>builder());
    for (Slot slot : this.slots) {
      Slot[][] crossing = slot.direction == Direction.ACROSS ? down : across;
      for (int i = 0; i < slot.length; ++i) {
        Slot other = crossing[slot.rowAt(i)][slot.columnAt(i)];
        if (other != null)
          builders.get(slot).put(other, new Overlap(i, other.indexOf(slot.rowAt(i), slot.columnAt(i))));
      }
    }
    ImmutableMap.Builder<Slot, ImmutableMap<Slot, Overlap>> overlaps = ImmutableMap.builder();
    for (Slot slot : this.slots)
      overlaps.put(slot, sortedBySlot(builders.get(slot).build()));
    this.overlaps = overlaps.build();
  }

  private ImmutableMap<Slot, Overlap> sortedBySlot(ImmutableMap<Slot, Overlap> map) {
    ImmutableMap.Builder<Slot, Overlap> builder = ImmutableMap.builder();
    for (Slot slot : slots)
      if (map.containsKey(slot))
        builder.put(slot, map.get(slot));
    return builder.build();
  }

  /** All the slots, in row-major order of their first cells, across first. */
  public ImmutableList<Slot> variables() {
    return slots;
  }

  /** Tells whether the given slot belongs to this structure. */
  public boolean contains(Slot slot) {
    return overlaps.containsKey(slot);
  }

  /** The slots that cross the given one, in slot order. */
  public ImmutableList<Slot> neighbors(Slot slot) {
    return overlapsOf(slot).keySet().asList();
  }

  /**
   * Returns where the two slots cross, or null if they don't.  The slots must
   * be distinct members of this structure.
   */
  @Nullable public Overlap overlap(Slot a, Slot b) {
    checkArgument(!a.equals(b), "a slot has no overlap with itself: %s", a);
    checkArgument(contains(b), "not a slot of this structure: %s", b);
    return overlapsOf(a).get(b);
  }

  /** Tells whether the given cell is open. */
  public boolean isOpen(int row, int column) {
    return open[row][column];
  }

  private ImmutableMap<Slot, Overlap> overlapsOf(Slot slot) {
    ImmutableMap<Slot, Overlap> answer = overlaps.get(checkNotNull(slot));
    checkArgument(answer != null, "not a slot of this structure: %s", slot);
    return answer;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (boolean[] row : open) {
      for (boolean cell : row)
        sb.append(cell ? '_' : '#');
      sb.append('\n');
    }
    return sb.toString();
  }
}
