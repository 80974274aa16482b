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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.logging.Level.FINER;

import us.blanshard.crossword.core.Domains;
import us.blanshard.crossword.core.Overlap;
import us.blanshard.crossword.core.Slot;
import us.blanshard.crossword.core.Structure;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Propagates the crossing-letter constraints between slots through a
 * {@link Domains}, using Mackworth's AC-3 algorithm.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class ArcConsistency {
  private static final Logger logger = Logger.getLogger(ArcConsistency.class.getName());

  private final Structure structure;
  private final Domains domains;
  private int revisionCount;

  public ArcConsistency(Domains domains) {
    this.domains = checkNotNull(domains);
    this.structure = domains.getStructure();
  }

  /** The number of times {@link #revise} has been called. */
  public int getRevisionCount() {
    return revisionCount;
  }

  /**
   * Removes from the domain of x every word that has no partner in the domain
   * of y agreeing on their shared cell.  Returns true if anything was removed;
   * slots that don't cross are left alone.
   */
  public boolean revise(Slot x, Slot y) {
    ++revisionCount;
    Overlap overlap = structure.overlap(x, y);
    if (overlap == null)
      return false;

    Set<Character> supported = Sets.newHashSet();
    for (String word : domains.get(y))
      supported.add(word.charAt(overlap.second));

    Set<String> unsupported = Sets.newHashSet();
    for (String word : domains.get(x))
      if (!supported.contains(word.charAt(overlap.first)))
        unsupported.add(word);

    return !unsupported.isEmpty() && domains.removeAll(x, unsupported);
  }

  /**
   * Makes every slot arc consistent with all its neighbors.  Returns false if
   * some slot's domain ends up empty.
   */
  public boolean ac3() {
    List<Arc> arcs = Lists.newArrayList();
    for (Slot x : structure.variables())
      for (Slot y : structure.neighbors(x))
        arcs.add(Arc.of(x, y));
    return ac3(arcs);
  }

  /**
   * Like {@link #ac3()}, but starts from just the given arcs; arcs are added
   * to the work queue as domains shrink.  An empty collection does nothing.
   */
  public boolean ac3(Collection<Arc> arcs) {
    ArrayDeque<Arc> queue = new ArrayDeque<Arc>(arcs);
    while (!queue.isEmpty()) {
      Arc arc = queue.removeFirst();
      if (revise(arc.x, arc.y)) {
        if (domains.isEmpty(arc.x)) {
          if (logger.isLoggable(FINER))
            logger.finer("No words left for " + arc.x + " after revising against " + arc.y);
          return false;
        }
        for (Slot z : structure.neighbors(arc.x))
          if (!z.equals(arc.y))
            queue.addLast(Arc.of(z, arc.x));
      }
    }
    return true;
  }
}
