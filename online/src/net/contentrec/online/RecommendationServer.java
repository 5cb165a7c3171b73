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

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.contentrec.common.NotReadyException;
import net.contentrec.common.RankedItem;
import net.contentrec.common.TopN;
import net.contentrec.online.candidate.CandidateFilter;
import net.contentrec.online.catalog.ContentCatalog;
import net.contentrec.online.encoder.IDEncoder;
import net.contentrec.online.factorizer.FactorizationModel;
import net.contentrec.online.generation.ModelRepository;
import net.contentrec.online.interaction.Interaction;
import net.contentrec.online.interaction.InteractionSource;

/**
 * <p>Serves recommendations from the current model in a {@link ModelRepository}. A newly promoted version is
 * picked up on the first request after the next version check.</p>
 *
 * <p>When there is no usable model, or the user is not known to it, recommendations fall back to the most
 * popular content in the {@link ContentCatalog}.</p>
 *
 * @author Sean Owen
 */
public final class RecommendationServer {

  private static final Logger log = LoggerFactory.getLogger(RecommendationServer.class);

  public static final long DEFAULT_VERSION_CHECK_MS = 1000L;

  private final CurrentModelHolder modelHolder;
  private final InteractionSource interactions;
  private final ContentCatalog catalog;

  /**
   * Checks for a new current version at most every {@link #DEFAULT_VERSION_CHECK_MS} milliseconds.
   *
   * @see #RecommendationServer(ModelRepository, InteractionSource, ContentCatalog, long, TimeUnit)
   */
  public RecommendationServer(ModelRepository repository, InteractionSource interactions, ContentCatalog catalog) {
    this(repository, interactions, catalog, DEFAULT_VERSION_CHECK_MS, TimeUnit.MILLISECONDS);
  }

  /**
   * @param repository source of the current model
   * @param interactions source of users' past interactions, which are not recommended again
   * @param catalog source of content popularity, for fallback recommendations
   * @param versionCheckInterval minimum time between checks for a new current version; 0 checks on every request
   * @param unit unit of {@code versionCheckInterval}
   */
  public RecommendationServer(ModelRepository repository,
                              InteractionSource interactions,
                              ContentCatalog catalog,
                              long versionCheckInterval,
                              TimeUnit unit) {
    Preconditions.checkNotNull(interactions);
    Preconditions.checkNotNull(catalog);
    this.modelHolder = new CurrentModelHolder(repository, versionCheckInterval, unit);
    this.interactions = interactions;
    this.catalog = catalog;
  }

  /**
   * @see #getRecommendations(String, int, boolean, CandidateFilter)
   */
  public List<RankedItem> getRecommendations(String userID, int limit) throws IOException {
    return getRecommendations(userID, limit, null);
  }

  /**
   * @see #getRecommendations(String, int, boolean, CandidateFilter)
   */
  public List<RankedItem> getRecommendations(String userID, int limit, CandidateFilter filter) throws IOException {
    return getRecommendations(userID, limit, false, filter);
  }

  /**
   * @param userID user to recommend to
   * @param limit maximum number of recommendations
   * @param considerKnownItems if true, content that the user already interacted with may be recommended
   * @param filter excludes content from the results; may be {@code null}
   * @return content ranked by estimated value, descending, with ties in candidate order; or the most
   *  popular content if there is no model or the user is unknown to it
   * @throws IOException if the user's interactions or the catalog can't be read
   */
  public List<RankedItem> getRecommendations(String userID,
                                             int limit,
                                             boolean considerKnownItems,
                                             CandidateFilter filter) throws IOException {
    Preconditions.checkNotNull(userID);
    Preconditions.checkArgument(limit > 0, "limit must be positive: %s", limit);

    FactorizationModel model = modelHolder.get();
    if (model == null) {
      log.debug("No model; recommending popular content to {}", userID);
      return mostPopularItems(limit, filter);
    }
    int userIndex = model.getUserEncoder().encode(userID);
    if (userIndex == IDEncoder.UNKNOWN) {
      log.debug("Unknown user {}; recommending popular content", userID);
      return mostPopularItems(limit, filter);
    }

    Set<String> knownContentIDs = considerKnownItems ? null : getKnownContentIDs(userID);
    return TopN.selectTopN(new RecommendIterator(model, userIndex, knownContentIDs, filter), limit);
  }

  private Set<String> getKnownContentIDs(String userID) throws IOException {
    Set<String> known = Sets.newHashSet();
    for (Interaction interaction : interactions.queryByUser(userID)) {
      known.add(interaction.getContentID());
    }
    return known;
  }

  /**
   * @param limit maximum number of items
   * @param filter excludes content from the results; may be {@code null}
   * @return catalog content by popularity, descending, with ties in catalog order
   * @throws IOException if the catalog can't be read
   */
  public List<RankedItem> mostPopularItems(int limit, CandidateFilter filter) throws IOException {
    Preconditions.checkArgument(limit > 0, "limit must be positive: %s", limit);
    return TopN.selectTopN(new PopularItemsIterator(catalog.getItems().iterator(), filter), limit);
  }

  /**
   * @return the model's estimate of the user's interaction with the content, or the global bias if either
   *  is unknown to the model
   * @throws NotReadyException if there is no usable model
   */
  public double estimatePreference(String userID, String contentID) throws NotReadyException {
    FactorizationModel model = modelHolder.get();
    if (model == null) {
      throw new NotReadyException("No current model");
    }
    return model.predict(userID, contentID);
  }

  /**
   * @return true if a usable model is currently loaded
   */
  public boolean isReady() {
    return modelHolder.get() != null;
  }

}
