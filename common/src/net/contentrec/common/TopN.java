/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.contentrec.common;

import java.io.Serializable;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Queue;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Utility methods for finding the top N things from a stream. Selection is stable: among equal values,
 * the element that appeared earlier in the stream ranks higher.
 *
 * @author Sean Owen, Mahout
 */
public final class TopN {

  private TopN() {
  }

  /**
   * @param values stream of values from which to choose; {@code null} elements are skipped
   * @param n how many top values to choose
   * @return the top N values (at most), ordered by value descending, then by stream order
   */
  public static List<RankedItem> selectTopN(Iterator<RankedItem> values, int n) {
    Preconditions.checkArgument(n > 0, "n must be positive");
    Queue<Candidate> topN = new PriorityQueue<Candidate>(n + 1, LeastFirstComparator.INSTANCE);
    long ordinal = 0;
    while (values.hasNext()) {
      RankedItem value = values.next();
      if (value != null) {
        Candidate candidate = new Candidate(value, ordinal++);
        if (topN.size() < n) {
          topN.add(candidate);
        } else if (value.getValue() > topN.peek().item.getValue()) {
          // Equal values never displace: the earlier one already holds its place
          topN.poll();
          topN.add(candidate);
        }
      }
    }
    return selectTopNFromQueue(topN);
  }

  /**
   * @see #selectTopN(Iterator, int)
   */
  public static List<RankedItem> selectTopN(Iterable<RankedItem> values, int n) {
    return selectTopN(values.iterator(), n);
  }

  private static List<RankedItem> selectTopNFromQueue(Queue<Candidate> topN) {
    if (topN.isEmpty()) {
      return Collections.emptyList();
    }
    List<Candidate> sorted = Lists.newArrayList(topN);
    Collections.sort(sorted, Collections.reverseOrder(LeastFirstComparator.INSTANCE));
    List<RankedItem> result = Lists.newArrayListWithCapacity(sorted.size());
    for (Candidate candidate : sorted) {
      result.add(candidate.item);
    }
    return result;
  }

  private static final class Candidate {
    private final RankedItem item;
    private final long ordinal;
    private Candidate(RankedItem item, long ordinal) {
      this.item = item;
      this.ordinal = ordinal;
    }
  }

  /**
   * Orders the weakest candidate first: lowest value, and among equal values, latest in the stream.
   */
  private static final class LeastFirstComparator implements Comparator<Candidate>, Serializable {

    private static final Comparator<Candidate> INSTANCE = new LeastFirstComparator();

    @Override
    public int compare(Candidate a, Candidate b) {
      int byValue = Double.compare(a.item.getValue(), b.item.getValue());
      if (byValue != 0) {
        return byValue;
      }
      return a.ordinal > b.ordinal ? -1 : a.ordinal < b.ordinal ? 1 : 0;
    }
  }

}
