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
package us.blanshard.crossword.solve;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static java.util.logging.Level.FINE;

import us.blanshard.crossword.core.Assignment;
import us.blanshard.crossword.core.Domains;
import us.blanshard.crossword.core.Overlap;
import us.blanshard.crossword.core.Slot;
import us.blanshard.crossword.core.Structure;

import com.google.common.base.Functions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A depth-first crossword filler: finds one word per slot so that crossing
 * slots agree and no word is used twice.  Prunes with arc consistency after
 * every tentative assignment, chooses the slot with the fewest remaining
 * words (then the most unassigned neighbors), and tries the words that rule
 * out the fewest neighboring words first.
 *
 * <p> Slots that tie on both counts are chosen among at random, so different
 * random sources may produce different solutions for the same puzzle.
 *
 * <p> Each solver does a single search.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /**
   * Fills the given structure from the given vocabulary, returns a summary of
   * the result.
   */
  public static Result solve(Structure structure, Collection<String> vocabulary) {
    return solve(structure, vocabulary, new Random());
  }

  /**
   * Fills the given structure from the given vocabulary, using the given
   * random source to break ties; returns a summary of the result.
   */
  public static Result solve(Structure structure, Collection<String> vocabulary, Random random) {
    return solve(structure, vocabulary, random, Integer.MAX_VALUE);
  }

  /**
   * Like {@link #solve(Structure, Collection, Random)}, but gives up after
   * trying the given number of words.
   */
  public static Result solve(
      Structure structure, Collection<String> vocabulary, Random random, int maxSteps) {
    return new Solver(structure, vocabulary, random).result(maxSteps);
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public static final class Result {
    /** The word for every slot, or null if none was found. */
    @Nullable public final ImmutableSortedMap<Slot, String> solution;
    public final int numSteps;  // Words tried
    public final int numBacktracks;  // Tried words taken back
    public final int numRevisions;
    private final boolean exhausted;

    private Result(@Nullable ImmutableSortedMap<Slot, String> solution, boolean exhausted,
                   int numSteps, int numBacktracks, int numRevisions) {
      this.solution = solution;
      this.exhausted = exhausted;
      this.numSteps = numSteps;
      this.numBacktracks = numBacktracks;
      this.numRevisions = numRevisions;
    }

    public boolean hasSolution() {
      return solution != null;
    }

    /**
     * Tells whether the search proved there is no solution, as opposed to
     * running out of steps.
     */
    public boolean isExhausted() {
      return exhausted;
    }

    @Override public String toString() {
      return (hasSolution() ? "solved" : exhausted ? "no solution" : "stopped")
          + " after " + numSteps + " steps, " + numBacktracks + " backtracks";
    }
  }

  private final Structure structure;
  private final Domains domains;
  private final ArcConsistency consistency;
  private final Random random;
  private final Assignment assignment = new Assignment();
  private final ArrayDeque<Frame> stack = new ArrayDeque<Frame>();
  private int numSteps;
  private int numBacktracks;
  private boolean started;

  public Solver(Structure structure, Collection<String> vocabulary, Random random) {
    this.structure = checkNotNull(structure);
    this.domains = Domains.of(structure, vocabulary);
    this.consistency = new ArcConsistency(domains);
    this.random = checkNotNull(random);
  }

  /**
   * Runs the search, trying at most the given number of words.
   */
  public Result result(int maxSteps) {
    checkArgument(maxSteps >= 0, "negative step budget: %s", maxSteps);
    checkState(!started, "solver already used");
    started = true;

    domains.enforceNodeConsistency();
    Result result = consistency.ac3() ? search(maxSteps) : finish(null, true);
    if (logger.isLoggable(FINE))
      logger.fine(result + " for " + structure.variables().size() + " slots");
    return result;
  }

  /**
   * Chooses the unassigned slot with the smallest domain, preferring the one
   * with the most unassigned neighbors, and picking at random among any that
   * are still tied.  Returns null if every slot is assigned.
   */
  @Nullable public Slot selectUnassignedSlot(Assignment assignment) {
    Slot current = null;
    int size = 0;
    int degree = 0;
    int count = 0;
    for (Slot slot : structure.variables()) {
      if (assignment.isAssigned(slot)) continue;
      int slotSize = domains.size(slot);
      int slotDegree = unassignedNeighborCount(slot, assignment);
      if (current == null || slotSize < size || (slotSize == size && slotDegree > degree)) {
        current = slot;
        size = slotSize;
        degree = slotDegree;
        count = 1;
      } else if (slotSize == size && slotDegree == degree) {
        // Maintain a random choice of the best seen so far.
        if (random.nextInt(++count) == 0)
          current = slot;
      }
    }
    return current;
  }

  /**
   * Returns the words in the given slot's domain, ordered by how many words
   * each would rule out of the unassigned neighbors' domains, fewest first.
   * Ties keep domain order.
   */
  public ImmutableList<String> orderDomainValues(Slot slot, Assignment assignment) {
    Map<String, Integer> ruledOut = Maps.newHashMap();
    for (String word : domains.get(slot)) {
      int count = 0;
      for (Slot neighbor : structure.neighbors(slot)) {
        if (assignment.isAssigned(neighbor)) continue;
        Overlap overlap = structure.overlap(slot, neighbor);
        for (String other : domains.get(neighbor))
          if (other.equals(word) || !overlap.agrees(word, other))
            ++count;
      }
      ruledOut.put(word, count);
    }
    return Ordering.<Integer>natural().onResultOf(Functions.forMap(ruledOut))
        .immutableSortedCopy(domains.get(slot));
  }

  // For testing
  Domains getDomains() {
    return domains;
  }

  private int unassignedNeighborCount(Slot slot, Assignment assignment) {
    int count = 0;
    for (Slot neighbor : structure.neighbors(slot))
      if (!assignment.isAssigned(neighbor))
        ++count;
    return count;
  }

  /**
   * Backtracking search over the assignment.  Each frame on the stack is a
   * chosen slot with the words still to try in it; a frame's slot is bound
   * while the search is below it, and unbound again before its next word.
   */
  private Result search(int maxSteps) {
    if (assignment.isComplete(structure))
      return finish(assignment.asMap(), false);

    stack.push(newFrame());
    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (assignment.isAssigned(frame.slot)) {
        assignment.remove(frame.slot);
        domains.restore(frame.snapshot);
        ++numBacktracks;
      }
      if (!frame.values.hasNext()) {
        stack.pop();
        continue;
      }
      if (numSteps >= maxSteps)
        return finish(null, false);

      ++numSteps;
      assignment.put(frame.slot, frame.values.next());
      if (!assignment.isConsistent(structure))
        continue;
      if (!consistency.ac3(narrowToAssignment()))
        continue;
      if (assignment.isComplete(structure))
        return finish(assignment.asMap(), false);
      stack.push(newFrame());
    }
    return finish(null, true);
  }

  private Frame newFrame() {
    Slot slot = selectUnassignedSlot(assignment);
    checkState(slot != null, "no slot left to choose");
    if (logger.isLoggable(FINE))
      logger.fine("Choosing " + slot + " with " + domains.size(slot) + " words, depth "
                  + assignment.size());
    return new Frame(slot, orderDomainValues(slot, assignment).iterator(), domains.snapshot());
  }

  /**
   * Cuts every assigned slot's domain down to its word, returns the arcs from
   * each unassigned neighbor to the assigned slots.
   */
  private List<Arc> narrowToAssignment() {
    List<Arc> arcs = Lists.newArrayList();
    for (Slot slot : assignment.slots()) {
      domains.restrictTo(slot, assignment.get(slot));
      for (Slot neighbor : structure.neighbors(slot))
        if (!assignment.isAssigned(neighbor))
          arcs.add(Arc.of(neighbor, slot));
    }
    return arcs;
  }

  private Result finish(@Nullable ImmutableSortedMap<Slot, String> solution, boolean exhausted) {
    return new Result(solution, exhausted, numSteps, numBacktracks,
                      consistency.getRevisionCount());
  }

  private static class Frame {
    final Slot slot;
    final Iterator<String> values;
    final Domains.Snapshot snapshot;

    Frame(Slot slot, Iterator<String> values, Domains.Snapshot snapshot) {
      this.slot = slot;
      this.values = values;
      this.snapshot = snapshot;
    }
  }
}
