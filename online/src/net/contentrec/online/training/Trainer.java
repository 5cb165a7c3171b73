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

package net.contentrec.online.training;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.contentrec.online.factorizer.FactorizationModel;
import net.contentrec.online.factorizer.TrainingListener;
import net.contentrec.online.factorizer.TrainingParameters;
import net.contentrec.online.generation.ModelRepository;
import net.contentrec.online.generation.ModelVersion;
import net.contentrec.online.interaction.Interaction;
import net.contentrec.online.interaction.InteractionCounter;
import net.contentrec.online.interaction.InteractionSource;

/**
 * <p>Runs one end-to-end training job: loads recent interactions, trains a new {@link FactorizationModel},
 * saves it to the {@link ModelRepository} and promotes it. Each step is reported to a {@link JobStatusStore}.</p>
 *
 * <p>{@link #runTraining(String, boolean, TrainingOverrides)} never throws on a failed run. The failure is
 * logged and described in the returned {@link TrainingResult}, and the current model is left as it was.</p>
 *
 * @author Sean Owen
 */
public final class Trainer {

  private static final Logger log = LoggerFactory.getLogger(Trainer.class);

  public static final String NO_INTERACTIONS_ERROR = "no interactions found for training";
  public static final String INTERRUPTED_ERROR = "training interrupted";

  private final InteractionSource defaultSource;
  private final Map<String,InteractionSource> datasets;
  private final InteractionCounter counter;
  private final ModelRepository repository;
  private final JobStatusStore statusStore;
  private final TrainingConfiguration config;
  private final Clock clock;
  private volatile long lastRetrainingTime;

  public Trainer(InteractionSource defaultSource,
                 InteractionCounter counter,
                 ModelRepository repository,
                 JobStatusStore statusStore,
                 TrainingConfiguration config) {
    this(defaultSource,
         Collections.<String,InteractionSource>emptyMap(),
         counter,
         repository,
         statusStore,
         config,
         Clock.systemUTC());
  }

  /**
   * @param defaultSource interactions to train on when no dataset is named
   * @param datasets other named interaction sources that a run may select instead
   * @param counter count of new interactions, reset after each successful run
   * @param repository where trained models are saved and promoted
   * @param statusStore where job progress is recorded
   * @param config training configuration
   * @param clock source of the current time
   */
  public Trainer(InteractionSource defaultSource,
                 Map<String,InteractionSource> datasets,
                 InteractionCounter counter,
                 ModelRepository repository,
                 JobStatusStore statusStore,
                 TrainingConfiguration config,
                 Clock clock) {
    Preconditions.checkNotNull(defaultSource);
    Preconditions.checkNotNull(counter);
    Preconditions.checkNotNull(repository);
    Preconditions.checkNotNull(statusStore);
    Preconditions.checkNotNull(config);
    Preconditions.checkNotNull(clock);
    this.defaultSource = defaultSource;
    this.datasets = ImmutableMap.copyOf(datasets);
    this.counter = counter;
    this.repository = repository;
    this.statusStore = statusStore;
    this.config = config;
    this.clock = clock;
  }

  /**
   * @return time of the last successful run in this process, in milliseconds since the epoch, or 0 if none
   */
  public long getLastRetrainingTime() {
    return lastRetrainingTime;
  }

  public ModelRepository getRepository() {
    return repository;
  }

  public JobStatusStore getStatusStore() {
    return statusStore;
  }

  Clock getClock() {
    return clock;
  }

  /**
   * @param jobID ID under which progress is reported
   * @param force if true, train even if the current model is still fresh
   * @param overrides per-run settings
   * @return outcome of the run
   */
  public TrainingResult runTraining(String jobID, boolean force, TrainingOverrides overrides) {
    Preconditions.checkNotNull(jobID);
    if (overrides == null) {
      overrides = TrainingOverrides.NONE;
    }

    try {

      if (!force && isRecentlyTrained()) {
        String message = "Model was recently trained, skipping training";
        log.info("Job {}: {}", jobID, message);
        updateStatus(jobID, JobState.COMPLETED, "skipped", 1.0, message, null);
        return TrainingResult.skipped(jobID, message);
      }

      updateStatus(jobID, JobState.RUNNING, "loading", 0.1, "Loading interaction data", null);
      InteractionSource source = selectSource(overrides.getDataset());
      List<Interaction> interactions = source.queryRecent(config.getMaxInteractions());
      if (interactions.isEmpty()) {
        log.warn("Job {}: {}", jobID, NO_INTERACTIONS_ERROR);
        updateStatus(jobID, JobState.FAILED, "failed", 0.1, "Training failed", NO_INTERACTIONS_ERROR);
        return TrainingResult.failed(jobID, "Training failed", NO_INTERACTIONS_ERROR);
      }
      log.info("Job {}: loaded {} interactions", jobID, interactions.size());

      TrainingParameters parameters = config.toParameters(overrides);
      updateStatus(jobID, JobState.RUNNING, "training", 0.2, "Starting model training", null);
      FactorizationModel model = new FactorizationModel(config.getFeatures());
      double[] lossHistory = model.train(interactions, parameters, new StatusReportingListener(jobID));

      updateStatus(jobID, JobState.RUNNING, "saving", 0.9, "Saving model", null);
      ModelVersion version = repository.save(model);
      repository.promote(version);

      lastRetrainingTime = clock.millis();
      counter.reset();

      String message = "Model training complete";
      log.info("Job {}: promoted {}", jobID, version);
      updateStatus(jobID, JobState.COMPLETED, "complete", 1.0, message, null);
      return TrainingResult.completed(jobID, message, version, lossHistory);

    } catch (InterruptedException ie) {
      log.warn("Job {}: {}", jobID, INTERRUPTED_ERROR);
      updateStatus(jobID, JobState.FAILED, "failed", 0.0, "Training pipeline failed", INTERRUPTED_ERROR);
      Thread.currentThread().interrupt();
      return TrainingResult.failed(jobID, "Training pipeline failed", INTERRUPTED_ERROR);
    } catch (IOException ioe) {
      return failed(jobID, ioe);
    } catch (RuntimeException re) {
      return failed(jobID, re);
    }
  }

  private TrainingResult failed(String jobID, Exception e) {
    String error = "Error in training pipeline: " + e.getMessage();
    log.warn("Job {}: {}", jobID, error, e);
    updateStatus(jobID, JobState.FAILED, "failed", 0.0, "Training pipeline failed", error);
    return TrainingResult.failed(jobID, "Training pipeline failed", error);
  }

  private InteractionSource selectSource(String dataset) {
    if (dataset == null) {
      return defaultSource;
    }
    InteractionSource source = datasets.get(dataset);
    Preconditions.checkArgument(source != null, "Unknown dataset: %s", dataset);
    return source;
  }

  /**
   * @return true if a run succeeded, or the current version was trained, within the freshness window
   */
  boolean isRecentlyTrained() {
    long freshnessMS = TimeUnit.MILLISECONDS.convert(config.getFreshnessHours(), TimeUnit.HOURS);
    if (freshnessMS <= 0) {
      return false;
    }
    long lastTrained = lastRetrainingTime;
    if (lastTrained <= 0) {
      try {
        ModelVersion current = repository.currentVersion();
        if (current == null) {
          return false;
        }
        lastTrained = current.getTrainedAt();
      } catch (IOException ioe) {
        log.warn("Unable to read current version; assuming model is not fresh", ioe);
        return false;
      }
    }
    return clock.millis() - lastTrained < freshnessMS;
  }

  private void updateStatus(String jobID, JobState state, String phase, double progress, String message, String error) {
    JobStatus status = new JobStatus(jobID, state, phase, progress, message, error, clock.millis());
    try {
      statusStore.put(status);
    } catch (IOException ioe) {
      log.warn("Unable to record status {}", status, ioe);
    }
  }

  private final class StatusReportingListener implements TrainingListener {

    private final String jobID;

    StatusReportingListener(String jobID) {
      this.jobID = jobID;
    }

    @Override
    public void epochFinished(int epoch, int epochs, double loss) {
      String message = String.format(Locale.ENGLISH, "Epoch %d/%d, loss %.4f", epoch + 1, epochs, loss);
      double progress = 0.2 + 0.7 * (epoch + 1) / epochs;
      updateStatus(jobID, JobState.RUNNING, "training", progress, message, null);
    }

  }

}
