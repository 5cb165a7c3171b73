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

import java.io.File;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import net.contentrec.common.ContentRecTest;
import net.contentrec.common.RankedItem;
import net.contentrec.online.catalog.InMemoryContentCatalog;
import net.contentrec.online.generation.LocalModelRepository;
import net.contentrec.online.generation.ModelVersion;
import net.contentrec.online.interaction.AtomicInteractionCounter;
import net.contentrec.online.interaction.InMemoryInteractionStore;
import net.contentrec.online.interaction.Interaction;
import net.contentrec.online.scheduler.RetrainRequest;
import net.contentrec.online.scheduler.RetrainResponse;
import net.contentrec.online.scheduler.RetrainingConfiguration;
import net.contentrec.online.scheduler.RetrainingScheduler;
import net.contentrec.online.training.FileJobStatusStore;
import net.contentrec.online.training.JobState;
import net.contentrec.online.training.JobStatus;
import net.contentrec.online.training.Trainer;
import net.contentrec.online.training.TrainingConfiguration;

public final class LocalRetrainingTest extends ContentRecTest {

  @Test
  public void testRetrainAndServe() throws Exception {
    File rootDir = getTestTempDir();
    AtomicInteractionCounter counter = new AtomicInteractionCounter();
    InMemoryInteractionStore store = new InMemoryInteractionStore(counter);
    InMemoryContentCatalog catalog = new InMemoryContentCatalog();
    long now = System.currentTimeMillis();
    String[] contentIDs = {"a", "b", "c", "d"};
    for (int u = 0; u < 6; u++) {
      for (int c = 0; c < contentIDs.length; c++) {
        if ((u + c) % 4 != 0) {
          store.record(new Interaction("u" + u, contentIDs[c], (u + c) % 2 == 0 ? 5.0f : 1.0f, now - u * 1000L));
        }
      }
    }
    for (String contentID : contentIDs) {
      catalog.put(contentID, contentID.charAt(0));
    }
    assertEquals(18L, counter.get());

    LocalModelRepository repository = new LocalModelRepository(new File(rootDir, "models"));
    FileJobStatusStore statusStore = new FileJobStatusStore(new File(rootDir, "jobs"));
    TrainingConfiguration trainingConfig = new TrainingConfiguration();
    trainingConfig.setFeatures(3);
    trainingConfig.setEpochs(5);
    trainingConfig.setBatchSize(8);
    Trainer trainer = new Trainer(store, counter, repository, statusStore, trainingConfig);
    RecommendationServer server = new RecommendationServer(repository, store, catalog, 0L, TimeUnit.MILLISECONDS);

    List<RankedItem> popular = server.getRecommendations("u0", 2);
    assertEquals("d", popular.get(0).getContentID());
    assertEquals("c", popular.get(1).getContentID());

    RetrainingScheduler scheduler = new RetrainingScheduler(trainer, counter, new RetrainingConfiguration());
    try {
      assertTrue(scheduler.shouldRetrain());
      RetrainResponse response = scheduler.triggerRetraining(new RetrainRequest(true));
      assertTrue(response.isSuccess());
      JobStatus status = awaitFinished(scheduler, response.getJobID());
      assertSame(JobState.COMPLETED, status.getState());
      assertEquals(1.0, status.getProgress());
    } finally {
      scheduler.close();
    }

    ModelVersion current = repository.currentVersion();
    assertNotNull(current);
    assertEquals(1, repository.listVersions().size());
    assertEquals(6, current.getNumUsers());
    assertEquals(4, current.getNumItems());
    assertEquals(0L, counter.get());

    List<RankedItem> recommended = server.getRecommendations("u1", 4);
    assertEquals(1, recommended.size());
    assertEquals("d", recommended.get(0).getContentID());
    double estimate = server.estimatePreference("u1", "d");
    assertTrue(estimate >= 1.0 && estimate <= 5.0);
  }

  private static JobStatus awaitFinished(RetrainingScheduler scheduler, String jobID) throws Exception {
    for (int i = 0; i < 400; i++) {
      JobStatus status = scheduler.getJobStatus(jobID);
      if (status != null && status.getState().isFinished()) {
        return status;
      }
      Thread.sleep(25L);
    }
    fail("Job did not finish: " + jobID);
    return null;
  }

}
