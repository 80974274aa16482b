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

/**
 * The two orientations a slot can have.
 *
 * @author Luke Blanshard
 */
public enum Direction {
  ACROSS(0, 1),
  DOWN(1, 0);

  /** How far the row advances from one cell of a slot to the next. */
  public final int rowStep;

  /** How far the column advances from one cell of a slot to the next. */
  public final int columnStep;

  private Direction(int rowStep, int columnStep) {
    this.rowStep = rowStep;
    this.columnStep = columnStep;
  }
}
