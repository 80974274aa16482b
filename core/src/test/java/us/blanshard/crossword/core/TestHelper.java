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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Terse factories for test fixtures.  Structures are drawn one string per
 * row, with '_' for an open cell and '#' for a blocked one.
 */
public class TestHelper {
  public static Structure st(String... rows) {
    boolean[][] open = new boolean[rows.length][];
    for (int i = 0; i < rows.length; ++i) {
      open[i] = new boolean[rows[i].length()];
      for (int j = 0; j < rows[i].length(); ++j)
        open[i][j] = rows[i].charAt(j) == '_';
    }
    return Structure.of(open);
  }
  public static Slot across(int row, int col, int length) { return Slot.of(row, col, Direction.ACROSS, length); }
  public static Slot down(int row, int col, int length) { return Slot.of(row, col, Direction.DOWN, length); }
  public static List<String> words(String... words) { return ImmutableList.copyOf(words); }
}
