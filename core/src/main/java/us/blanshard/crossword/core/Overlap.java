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

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * Where two crossing slots share their one cell: the character positions
 * within each slot that must hold the same letter.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Overlap {

  /** The position within the first slot of the pair. */
  public final int first;

  /** The position within the second slot of the pair. */
  public final int second;

  public Overlap(int first, int second) {
    this.first = first;
    this.second = second;
  }

  /** Returns the same overlap seen from the other slot. */
  public Overlap reversed() {
    return new Overlap(second, first);
  }

  /** Tells whether the two words agree on the shared cell. */
  public boolean agrees(String firstWord, String secondWord) {
    return firstWord.charAt(first) == secondWord.charAt(second);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Overlap)) return false;
    Overlap that = (Overlap) o;
    return this.first == that.first && this.second == that.second;
  }

  @Override public int hashCode() {
    return Objects.hashCode(first, second);
  }

  @Override public String toString() {
    return "[" + first + " \u2229 " + second + "]";  // That's an intersection sign
  }
}
