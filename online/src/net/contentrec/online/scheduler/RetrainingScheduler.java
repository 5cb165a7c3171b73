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

package net.contentrec.online.scheduler;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.contentrec.common.parallel.ExecutorUtils;
import net.contentrec.online.generation.ModelVersion;
import net.contentrec.online.interaction.InteractionCounter;
import net.contentrec.online.training.JobState;
import net.contentrec.online.training.JobStatus;
import net.contentrec.online.training.Trainer;
import net.contentrec.online.training.TrainingOverrides;
import net.contentrec.online.training.TrainingResult;

/**
 * <p>Decides when to retrain the model, and runs retraining in the background so that serving is never
 * blocked. A check runs every {@link RetrainingConfiguration#getCheckIntervalSec()} seconds; it starts a run
 * when automatic retraining is enabled, the current hour is inside the configured window, and
 * {@link #shouldRetrain()} says so. Runs may also be requested with {@link #triggerRetraining(RetrainRequest)}.</p>
 *
 * <p>At most one run is in progress at a time. A request made while one is running is rejected, not queued.</p>
 *
 * @author Sean Owen
 */
public final class RetrainingScheduler implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(RetrainingScheduler.class);

  public static final String ALREADY_RUNNING_MESSAGE = "Another retraining job is already in progress";

  private final Trainer trainer;
  private final InteractionCounter counter;
  private final RetrainingConfiguration config;
  private final Clock clock;
  private final AtomicBoolean retraining;
  private final ScheduledExecutorService checkExecutor;
  private final ExecutorService trainingExecutor;
  private volatile boolean started;
  private volatile boolean closed;

  public RetrainingScheduler(Trainer trainer, InteractionCounter counter, RetrainingConfiguration config) {
    this(trainer, counter, config, Clock.systemDefaultZone());
  }

  /**
   * @param trainer runs the training jobs
   * @param counter count of interactions since the last successful run
   * @param config scheduling configuration
   * @param clock source of the current time, and of the time zone of the retraining window
   */
  public RetrainingScheduler(Trainer trainer,
                             InteractionCounter counter,
                             RetrainingConfiguration config,
                             Clock clock) {
    Preconditions.checkNotNull(trainer);
    Preconditions.checkNotNull(counter);
    Preconditions.checkNotNull(config);
    Preconditions.checkNotNull(clock);
    this.trainer = trainer;
    this.counter = counter;
    this.config = config;
    this.clock = clock;
    this.retraining = new AtomicBoolean(false);
    this.checkExecutor = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setDaemon(true).setNameFormat("RetrainingCheck-%d").build());
    this.trainingExecutor = Executors.newSingleThreadExecutor(
        new ThreadFactoryBuilder().setDaemon(true).setNameFormat("Retraining-%d").build());
  }

  /**
   * Starts periodic checks. The first check happens immediately.
   */
  public synchronized void start() {
    Preconditions.checkState(!closed, "Scheduler is closed");
    if (started) {
      return;
    }
    started = true;
    log.info("Starting retraining checks with {}", config);
    scheduleCheck(0L);
  }

  private void scheduleCheck(long delaySec) {
    if (closed) {
      return;
    }
    try {
      checkExecutor.schedule(new Runnable() {
        @Override
        public void run() {
          long nextDelaySec = config.getCheckIntervalSec();
          try {
            maybeStartAutomaticRetraining();
          } catch (Exception e) {
            log.warn("Error while checking whether to retrain; backing off", e);
            nextDelaySec = config.getErrorBackoffSec();
          } finally {
            scheduleCheck(nextDelaySec);
          }
        }
      }, delaySec, TimeUnit.SECONDS);
    } catch (RejectedExecutionException ree) {
      log.info("Not scheduling another check; scheduler is shutting down");
    }
  }

  /**
   * Runs one automatic check.
   *
   * @return ID of the job that was started, or {@code null} if none was
   * @throws IOException if the current model version can't be read
   */
  String maybeStartAutomaticRetraining() throws IOException {
    if (!config.isAutoRetrainingEnabled()) {
      log.debug("Automatic retraining is disabled");
      return null;
    }
    if (!isInsideWindow()) {
      log.debug("Outside retraining window {}", config.getWindow());
      return null;
    }
    if (retraining.get()) {
      log.debug("Retraining already in progress");
      return null;
    }
    if (!shouldRetrain()) {
      return null;
    }
    log.info("Starting automatic retraining");
    // Freshness was already judged by shouldRetrain()
    RetrainResponse response = startRun(true, new TrainingOverrides(config.getDataset(), null, null));
    return response.getJobID();
  }

  boolean isInsideWindow() {
    TimeWindow window = config.getWindow();
    return window == null || window.contains(ZonedDateTime.now(clock).getHour());
  }

  /**
   * Decides whether retraining is due:
   *
   * <ol>
   *   <li>if no model version is current, it is</li>
   *   <li>else if less than the configured interval has passed since the last retraining, it is not</li>
   *   <li>else it is if at least the threshold number of new interactions have arrived</li>
   * </ol>
   *
   * <p>The last retraining time is that of the last successful run in this process, or else the current
   * version's training time.</p>
   *
   * @throws IOException if the current model version can't be read
   */
  public boolean shouldRetrain() throws IOException {
    ModelVersion current = trainer.getRepository().currentVersion();
    if (current == null) {
      log.info("No current model; retraining needed");
      return true;
    }
    long lastRetrainingTime = getLastRetrainingTime(current);
    long elapsedMS = clock.millis() - lastRetrainingTime;
    long intervalMS = TimeUnit.MILLISECONDS.convert(config.getIntervalHours(), TimeUnit.HOURS);
    if (elapsedMS < intervalMS) {
      log.info("Only {}ms since last retraining; waiting for {}ms", elapsedMS, intervalMS);
      return false;
    }
    long newInteractions = counter.get();
    boolean thresholdReached = newInteractions >= config.getInteractionThreshold();
    log.info("{} new interactions since last retraining; threshold {} {}",
             newInteractions, config.getInteractionThreshold(), thresholdReached ? "reached" : "not reached");
    return thresholdReached;
  }

  private long getLastRetrainingTime(ModelVersion current) {
    long lastRetrainingTime = trainer.getLastRetrainingTime();
    return lastRetrainingTime > 0 ? lastRetrainingTime : current.getTrainedAt();
  }

  /**
   * Requests a retraining run. It is rejected immediately if a run is already in progress.
   *
   * @param request run settings
   * @return whether the run was started, and if so its job ID, which can be passed to {@link #getJobStatus(String)}
   */
  public RetrainResponse triggerRetraining(RetrainRequest request) {
    Preconditions.checkNotNull(request);
    log.info("Received {}", request);
    TrainingOverrides overrides;
    try {
      overrides = request.toOverrides();
    } catch (IllegalArgumentException iae) {
      return RetrainResponse.rejected(iae.getMessage());
    }
    return startRun(request.isForce(), overrides);
  }

  private RetrainResponse startRun(final boolean force, final TrainingOverrides overrides) {
    if (closed) {
      return RetrainResponse.rejected("Scheduler is closed");
    }
    if (!retraining.compareAndSet(false, true)) {
      log.info(ALREADY_RUNNING_MESSAGE);
      return RetrainResponse.rejected(ALREADY_RUNNING_MESSAGE);
    }

    final String jobID = UUID.randomUUID().toString();
    JobStatus pending = new JobStatus(jobID, JobState.PENDING, "pending", 0.0, "Retraining job queued", null,
                                      clock.millis());
    try {
      trainer.getStatusStore().put(pending);
    } catch (IOException ioe) {
      log.warn("Unable to record status {}", pending, ioe);
    }

    Future<TrainingResult> future;
    try {
      future = trainingExecutor.submit(new Callable<TrainingResult>() {
        @Override
        public TrainingResult call() {
          try {
            TrainingResult result = trainer.runTraining(jobID, force, overrides);
            log.info("Finished {}", result);
            return result;
          } finally {
            retraining.set(false);
          }
        }
      });
    } catch (RejectedExecutionException ree) {
      retraining.set(false);
      return RetrainResponse.rejected("Scheduler is closed");
    }

    scheduleTimeout(jobID, future);
    return RetrainResponse.accepted(jobID, "Retraining job started");
  }

  private void scheduleTimeout(final String jobID, final Future<TrainingResult> future) {
    final long timeoutMS = config.getTimeoutMS();
    if (timeoutMS <= 0) {
      return;
    }
    try {
      checkExecutor.schedule(new Runnable() {
        @Override
        public void run() {
          if (!future.isDone()) {
            log.warn("Job {} exceeded {}ms; interrupting", jobID, timeoutMS);
            future.cancel(true);
          }
        }
      }, timeoutMS, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ree) {
      log.info("Not scheduling timeout for job {}; scheduler is shutting down", jobID);
    }
  }

  /**
   * @param jobID job returned by {@link #triggerRetraining(RetrainRequest)}
   * @return latest status of the job, or {@code null} if it is unknown
   * @throws IOException if the status can't be read
   */
  public JobStatus getJobStatus(String jobID) throws IOException {
    return trainer.getStatusStore().get(jobID);
  }

  /**
   * @return true while a retraining run is in progress
   */
  public boolean isRetraining() {
    return retraining.get();
  }

  public boolean isStarted() {
    return started;
  }

  /**
   * Stops checks, then waits up to {@link RetrainingConfiguration#getShutdownGraceSec()} seconds for a run in
   * progress before interrupting it.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    log.info("Stopping retraining scheduler");
    ExecutorUtils.shutdownNowAndAwait(checkExecutor);
    if (!ExecutorUtils.shutdownAndAwait(trainingExecutor, config.getShutdownGraceSec(), TimeUnit.SECONDS)) {
      log.warn("Retraining run was interrupted by shutdown");
    }
  }

}
