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

import java.util.Collection;
import java.util.Iterator;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;

import net.contentrec.common.RankedItem;
import net.contentrec.online.candidate.CandidateFilter;
import net.contentrec.online.encoder.IDEncoder;
import net.contentrec.online.factorizer.FactorizationModel;

/**
 * An {@link Iterator} over every content item in a model, scored for one user. Known or filtered items
 * produce {@code null}. The items with top values are taken as recommendations.
 *
 * @author Sean Owen
 * @see PopularItemsIterator
 */
final class RecommendIterator implements Iterator<RankedItem> {

  private final FactorizationModel model;
  private final int userIndex;
  private final IDEncoder contentEncoder;
  private final Collection<String> knownContentIDs;
  private final CandidateFilter filter;
  private int contentIndex;

  /**
   * @param model trained model
   * @param userIndex encoded user to score for
   * @param knownContentIDs content to skip; may be {@code null}
   * @param filter further content to skip; may be {@code null}
   */
  RecommendIterator(FactorizationModel model,
                    int userIndex,
                    Collection<String> knownContentIDs,
                    CandidateFilter filter) {
    Preconditions.checkArgument(model.isTrained(), "Model is not trained");
    Preconditions.checkArgument(userIndex >= 0, "Bad user index: %s", userIndex);
    this.model = model;
    this.userIndex = userIndex;
    this.contentEncoder = model.getContentEncoder();
    this.knownContentIDs = knownContentIDs;
    this.filter = filter;
  }

  @Override
  public boolean hasNext() {
    return contentIndex < contentEncoder.size();
  }

  @Override
  public RankedItem next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    int index = contentIndex++;
    String contentID = contentEncoder.inverse(index);
    if (knownContentIDs != null && knownContentIDs.contains(contentID)) {
      return null;
    }
    if (filter != null && filter.isFiltered(contentID)) {
      return null;
    }
    return new RankedItem(contentID, model.predict(userIndex, index));
  }

  /**
   * @throws UnsupportedOperationException
   */
  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }

}
