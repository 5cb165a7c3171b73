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

package net.contentrec.online.interaction;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;

/**
 * Keeps interactions in memory, and counts each one recorded in an {@link InteractionCounter} so that
 * retraining can tell how much new data has arrived.
 *
 * @author Sean Owen
 */
public final class InMemoryInteractionStore implements InteractionSource {

  private final List<Interaction> interactions;
  private final ListMultimap<String,Interaction> byUser;
  private final InteractionCounter counter;

  /**
   * @param counter counts recorded interactions; may be {@code null}
   */
  public InMemoryInteractionStore(InteractionCounter counter) {
    this.interactions = Lists.newArrayList();
    this.byUser = ArrayListMultimap.create();
    this.counter = counter;
  }

  public void record(Interaction interaction) {
    Preconditions.checkNotNull(interaction);
    synchronized (this) {
      interactions.add(interaction);
      byUser.put(interaction.getUserID(), interaction);
    }
    if (counter != null) {
      counter.increment();
    }
  }

  public synchronized int size() {
    return interactions.size();
  }

  /**
   * Among interactions with equal timestamps, the one recorded later is considered more recent.
   */
  @Override
  public List<Interaction> queryRecent(int limit) {
    Preconditions.checkArgument(limit > 0, "limit must be positive: %s", limit);
    List<Interaction> recent;
    synchronized (this) {
      recent = Lists.newArrayList(Lists.reverse(interactions));
    }
    Collections.sort(recent, new Comparator<Interaction>() {
      @Override
      public int compare(Interaction a, Interaction b) {
        long aTime = a.getTimestamp();
        long bTime = b.getTimestamp();
        return aTime > bTime ? -1 : aTime < bTime ? 1 : 0;
      }
    });
    return recent.size() > limit ? Lists.newArrayList(recent.subList(0, limit)) : recent;
  }

  @Override
  public synchronized List<Interaction> queryByUser(String userID) {
    return Lists.newArrayList(byUser.get(userID));
  }

}
