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

package net.contentrec.online.catalog;

import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.contentrec.common.LangUtils;

/**
 * A {@link ContentCatalog} held in memory. Items keep the order in which they were first added.
 *
 * @author Sean Owen
 */
public final class InMemoryContentCatalog implements ContentCatalog {

  private final Map<String,Double> popularity;

  public InMemoryContentCatalog() {
    popularity = Maps.newLinkedHashMap();
  }

  /**
   * Adds an item, or sets the popularity of an existing one without changing its position.
   */
  public synchronized void put(String contentID, double itemPopularity) {
    Preconditions.checkNotNull(contentID);
    Preconditions.checkArgument(LangUtils.isFinite(itemPopularity), "Bad popularity: %s", itemPopularity);
    popularity.put(contentID, itemPopularity);
  }

  /**
   * Adds to an item's popularity, adding the item if new.
   */
  public synchronized void addPopularity(String contentID, double delta) {
    Double current = popularity.get(contentID);
    put(contentID, current == null ? delta : current + delta);
  }

  public synchronized void remove(String contentID) {
    popularity.remove(contentID);
  }

  @Override
  public synchronized List<ContentItem> getItems() {
    List<ContentItem> items = Lists.newArrayListWithCapacity(popularity.size());
    for (Map.Entry<String,Double> entry : popularity.entrySet()) {
      items.add(new ContentItem(entry.getKey(), entry.getValue()));
    }
    return items;
  }

}
