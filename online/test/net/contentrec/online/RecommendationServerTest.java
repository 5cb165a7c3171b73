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

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.Lists;
import org.junit.Test;

import net.contentrec.common.ContentRecTest;
import net.contentrec.common.NotReadyException;
import net.contentrec.common.RankedItem;
import net.contentrec.online.candidate.CandidateFilter;
import net.contentrec.online.catalog.ContentCatalog;
import net.contentrec.online.catalog.ContentItem;
import net.contentrec.online.encoder.IDEncoder;
import net.contentrec.online.factorizer.FactorizationModel;
import net.contentrec.online.factorizer.TrainingParameters;
import net.contentrec.online.interaction.Interaction;

import static net.contentrec.online.ListInteractionSource.interaction;

public final class RecommendationServerTest extends ContentRecTest {

  private static final ContentCatalog CATALOG = new ContentCatalog() {
    @Override
    public List<ContentItem> getItems() {
      return Arrays.asList(
          new ContentItem("c1", 10.0),
          new ContentItem("c2", 50.0),
          new ContentItem("c3", 10.0),
          new ContentItem("c4", 30.0));
    }
  };

  private static final CandidateFilter NOT_C2 = new CandidateFilter() {
    @Override
    public boolean isFiltered(String contentID) {
      return "c2".equals(contentID);
    }
  };

  private static List<String> ids(List<RankedItem> items) {
    List<String> ids = Lists.newArrayList();
    for (RankedItem item : items) {
      ids.add(item.getContentID());
    }
    return ids;
  }

  private static FactorizationModel train(List<Interaction> interactions) throws InterruptedException {
    FactorizationModel model = new FactorizationModel(4);
    model.train(interactions, new TrainingParameters(0.05, 0.02, 50, 64), null);
    return model;
  }

  @Test
  public void testPopularityWithoutModel() throws Exception {
    RecommendationServer server =
        new RecommendationServer(new MemoryModelRepository(), new ListInteractionSource(), CATALOG);
    assertFalse(server.isReady());
    List<RankedItem> recommendations = server.getRecommendations("newUser", 10);
    assertEquals(Arrays.asList("c2", "c4", "c1", "c3"), ids(recommendations));
    assertEquals(50.0, recommendations.get(0).getValue());
  }

  @Test
  public void testPopularityLimitAndFilter() throws Exception {
    RecommendationServer server =
        new RecommendationServer(new MemoryModelRepository(), new ListInteractionSource(), CATALOG);
    assertEquals(Arrays.asList("c4", "c1"), ids(server.getRecommendations("newUser", 2, NOT_C2)));
    assertEquals(Arrays.asList("c2"), ids(server.mostPopularItems(1, null)));
  }

  @Test
  public void testLearnsPreferenceSplit() throws Exception {
    List<Interaction> interactions = Arrays.asList(
        interaction("u1", "i1", 5.0f),
        interaction("u1", "i2", 1.0f),
        interaction("u2", "i1", 1.0f),
        interaction("u2", "i2", 5.0f));
    MemoryModelRepository repository = new MemoryModelRepository();
    repository.install(train(interactions));
    RecommendationServer server =
        new RecommendationServer(repository, new ListInteractionSource(interactions), CATALOG);

    assertTrue(server.isReady());
    assertEquals(Arrays.asList("i1"), ids(server.getRecommendations("u1", 1, true, null)));
    assertEquals(Arrays.asList("i2"), ids(server.getRecommendations("u2", 1, true, null)));
    assertTrue(server.estimatePreference("u1", "i1") > server.estimatePreference("u1", "i2"));
  }

  @Test
  public void testKnownItemsExcluded() throws Exception {
    List<Interaction> interactions = Arrays.asList(
        interaction("u1", "i1", 5.0f),
        interaction("u1", "i2", 1.0f),
        interaction("u2", "i1", 4.0f),
        interaction("u2", "i3", 2.0f),
        interaction("u3", "i4", 3.0f));
    MemoryModelRepository repository = new MemoryModelRepository();
    repository.install(train(interactions));
    RecommendationServer server =
        new RecommendationServer(repository, new ListInteractionSource(interactions), CATALOG);

    List<RankedItem> recommendations = server.getRecommendations("u1", 10);
    assertEquals(2, recommendations.size());
    for (RankedItem item : recommendations) {
      assertFalse("i1".equals(item.getContentID()) || "i2".equals(item.getContentID()));
      assertTrue(item.getValue() >= 1.0 && item.getValue() <= 5.0);
    }
    assertTrue(recommendations.get(0).getValue() >= recommendations.get(1).getValue());
    assertEquals(4, server.getRecommendations("u1", 10, true, null).size());
  }

  @Test
  public void testFilterApplied() throws Exception {
    List<Interaction> interactions = Arrays.asList(
        interaction("u1", "c1", 5.0f),
        interaction("u2", "c2", 3.0f),
        interaction("u2", "c3", 2.0f));
    MemoryModelRepository repository = new MemoryModelRepository();
    repository.install(train(interactions));
    RecommendationServer server =
        new RecommendationServer(repository, new ListInteractionSource(interactions), CATALOG);
    assertEquals(Arrays.asList("c3"), ids(server.getRecommendations("u1", 5, NOT_C2)));
  }

  @Test
  public void testUnknownUserFallsBack() throws Exception {
    List<Interaction> interactions = Arrays.asList(
        interaction("u1", "i1", 5.0f),
        interaction("u2", "i2", 3.0f));
    MemoryModelRepository repository = new MemoryModelRepository();
    repository.install(train(interactions));
    RecommendationServer server =
        new RecommendationServer(repository, new ListInteractionSource(interactions), CATALOG);
    assertEquals(Arrays.asList("c2", "c4"), ids(server.getRecommendations("stranger", 2)));
  }

  @Test
  public void testCorruptModelFallsBack() throws Exception {
    List<Interaction> interactions = Arrays.asList(
        interaction("u1", "i1", 5.0f),
        interaction("u1", "i2", 3.0f));
    MemoryModelRepository repository = new MemoryModelRepository();
    repository.install(train(interactions));
    repository.setCorrupt(true);
    RecommendationServer server =
        new RecommendationServer(repository, new ListInteractionSource(interactions), CATALOG);
    assertEquals(Arrays.asList("c2"), ids(server.getRecommendations("u1", 1)));
    assertFalse(server.isReady());
    try {
      server.estimatePreference("u1", "i1");
      fail();
    } catch (NotReadyException nre) {
      // good
    }
  }

  @Test
  public void testReloadsOnlyOnNewVersion() throws Exception {
    List<Interaction> interactions = Arrays.asList(
        interaction("u1", "i1", 5.0f),
        interaction("u1", "i2", 3.0f));
    MemoryModelRepository repository = new MemoryModelRepository();
    repository.install(train(interactions));
    RecommendationServer server = new RecommendationServer(
        repository, new ListInteractionSource(interactions), CATALOG, 0L, TimeUnit.MILLISECONDS);
    server.getRecommendations("u1", 1, true, null);
    server.getRecommendations("u1", 1, true, null);
    assertEquals(1, repository.getLoads());

    List<Interaction> newInteractions = Arrays.asList(
        interaction("u1", "i1", 5.0f),
        interaction("u1", "i9", 4.0f));
    repository.install(train(newInteractions));
    List<RankedItem> recommendations = server.getRecommendations("u1", 2, true, null);
    assertEquals(2, repository.getLoads());
    assertTrue(ids(recommendations).contains("i9"));
  }

  @Test
  public void testVersionChecksAreThrottled() throws Exception {
    List<Interaction> interactions = Arrays.asList(
        interaction("u1", "i1", 5.0f),
        interaction("u1", "i2", 3.0f));
    MemoryModelRepository repository = new MemoryModelRepository();
    repository.install(train(interactions));
    RecommendationServer server = new RecommendationServer(
        repository, new ListInteractionSource(interactions), CATALOG, 1L, TimeUnit.HOURS);
    server.getRecommendations("u1", 2, true, null);

    repository.install(train(Arrays.asList(
        interaction("u1", "i1", 5.0f),
        interaction("u1", "i9", 4.0f))));
    List<RankedItem> recommendations = server.getRecommendations("u1", 2, true, null);
    assertEquals(1, repository.getLoads());
    assertFalse(ids(recommendations).contains("i9"));
  }

  @Test
  public void testPopularityKeepsFullPrecision() throws Exception {
    ContentCatalog catalog = new ContentCatalog() {
      @Override
      public List<ContentItem> getItems() {
        return Arrays.asList(
            new ContentItem("a", 16777216.0),
            new ContentItem("b", 16777217.0),
            new ContentItem("big", 1.0e39),
            new ContentItem("small", 1.0));
      }
    };
    RecommendationServer server =
        new RecommendationServer(new MemoryModelRepository(), new ListInteractionSource(), catalog);
    assertEquals(Arrays.asList("big", "b", "a", "small"), ids(server.getRecommendations("nobody", 10)));
    assertEquals(1.0e39, server.mostPopularItems(1, null).get(0).getValue());
  }

  @Test
  public void testCloseScoresKeepOrder() throws Exception {
    IDEncoder users = IDEncoder.fit(Arrays.asList("u1"));
    IDEncoder contents = IDEncoder.fit(Arrays.asList("i1", "i2"));
    FactorizationModel model = FactorizationModel.restore("close", 1L, 4.0, users, contents,
                                                          new double[][] {{0.0}},
                                                          new double[][] {{0.0}, {0.0}},
                                                          new double[] {0.0},
                                                          new double[] {0.0, 1.0e-8});
    MemoryModelRepository repository = new MemoryModelRepository();
    repository.install(model);
    RecommendationServer server = new RecommendationServer(repository, new ListInteractionSource(), CATALOG);
    List<RankedItem> recommendations = server.getRecommendations("u1", 2);
    assertEquals(Arrays.asList("i2", "i1"), ids(recommendations));
    assertTrue(recommendations.get(0).getValue() > recommendations.get(1).getValue());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadLimit() throws Exception {
    new RecommendationServer(new MemoryModelRepository(), new ListInteractionSource(), CATALOG)
        .getRecommendations("u1", 0);
  }

}
