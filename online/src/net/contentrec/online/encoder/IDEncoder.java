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

package net.contentrec.online.encoder;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * <p>Maps opaque string IDs (of users, or of content) to dense indices 0..n-1 and back. Indices follow
 * the sorted order of the distinct IDs seen by {@link #fit(Iterable)}.</p>
 *
 * <p>An encoder belongs to exactly one model version. It is not incremental: each training run fits a
 * new one. Unknown IDs encode to {@link #UNKNOWN} instead of failing, so that a request about a
 * cold-start user or item still gets an answer, from the model's global bias.</p>
 *
 * @author Sean Owen
 */
public final class IDEncoder {

  /** Index returned by {@link #encode(String)} for an ID that was not seen when fitting. */
  public static final int UNKNOWN = -1;

  private final String[] ids;
  private final Map<String,Integer> indices;

  private IDEncoder(String[] ids) {
    this.ids = ids;
    indices = Maps.newHashMapWithExpectedSize(ids.length);
    for (int i = 0; i < ids.length; i++) {
      Integer previous = indices.put(ids[i], i);
      Preconditions.checkArgument(previous == null, "Duplicate ID: %s", ids[i]);
    }
  }

  /**
   * @param ids IDs to index, possibly with repeats
   * @return encoder over the distinct IDs, sorted
   */
  public static IDEncoder fit(Iterable<String> ids) {
    SortedSet<String> distinct = Sets.newTreeSet();
    for (String id : ids) {
      distinct.add(Preconditions.checkNotNull(id));
    }
    return new IDEncoder(distinct.toArray(new String[distinct.size()]));
  }

  /**
   * Recreates an encoder whose index assignment is already known, as when reading a saved model.
   *
   * @param orderedIDs IDs in index order
   * @throws IllegalArgumentException if an ID repeats
   */
  public static IDEncoder fromOrderedIDs(List<String> orderedIDs) {
    String[] ids = orderedIDs.toArray(new String[orderedIDs.size()]);
    for (String id : ids) {
      Preconditions.checkNotNull(id);
    }
    return new IDEncoder(ids);
  }

  /**
   * @return index of the ID, or {@link #UNKNOWN} if it was not seen when fitting
   */
  public int encode(String id) {
    Integer index = indices.get(id);
    return index == null ? UNKNOWN : index;
  }

  /**
   * @return the ID at the given index
   * @throws IllegalArgumentException if the index is not in [0,size)
   */
  public String inverse(int index) {
    Preconditions.checkArgument(index >= 0 && index < ids.length, "Bad index: %s", index);
    return ids[index];
  }

  public boolean contains(String id) {
    return indices.containsKey(id);
  }

  /**
   * @return number of distinct IDs, which is also the number of rows the model keeps for this entity
   */
  public int size() {
    return ids.length;
  }

  /**
   * @return all IDs, in index order
   */
  public List<String> getIDs() {
    return Collections.unmodifiableList(Arrays.asList(ids));
  }

}
