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

package net.contentrec.online;

import java.util.Iterator;

import net.contentrec.common.RankedItem;
import net.contentrec.online.candidate.CandidateFilter;
import net.contentrec.online.catalog.ContentItem;

/**
 * Used by {@link RecommendationServer#mostPopularItems(int, CandidateFilter)}.
 *
 * @author Sean Owen
 */
final class PopularItemsIterator implements Iterator<RankedItem> {

  private final Iterator<ContentItem> items;
  private final CandidateFilter filter;

  PopularItemsIterator(Iterator<ContentItem> items, CandidateFilter filter) {
    this.items = items;
    this.filter = filter;
  }

  @Override
  public boolean hasNext() {
    return items.hasNext();
  }

  @Override
  public RankedItem next() {
    ContentItem item = items.next();
    String contentID = item.getContentID();
    if (filter != null && filter.isFiltered(contentID)) {
      return null;
    }
    return new RankedItem(contentID, item.getPopularity());
  }

  /**
   * @throws UnsupportedOperationException
   */
  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }

}
