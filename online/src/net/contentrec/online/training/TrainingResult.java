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

import net.contentrec.online.generation.ModelVersion;

/**
 * Outcome of one {@link Trainer#runTraining(String, boolean, TrainingOverrides)} call.
 *
 * @author Sean Owen
 */
public final class TrainingResult {

  public enum Outcome {
    COMPLETED,
    SKIPPED,
    FAILED,
  }

  private final String jobID;
  private final Outcome outcome;
  private final String message;
  private final String error;
  private final ModelVersion version;
  private final double[] lossHistory;

  private TrainingResult(String jobID,
                         Outcome outcome,
                         String message,
                         String error,
                         ModelVersion version,
                         double[] lossHistory) {
    this.jobID = jobID;
    this.outcome = outcome;
    this.message = message;
    this.error = error;
    this.version = version;
    this.lossHistory = lossHistory;
  }

  static TrainingResult completed(String jobID, String message, ModelVersion version, double[] lossHistory) {
    return new TrainingResult(jobID, Outcome.COMPLETED, message, null, version, lossHistory);
  }

  static TrainingResult skipped(String jobID, String message) {
    return new TrainingResult(jobID, Outcome.SKIPPED, message, null, null, null);
  }

  static TrainingResult failed(String jobID, String message, String error) {
    return new TrainingResult(jobID, Outcome.FAILED, message, error, null, null);
  }

  public String getJobID() {
    return jobID;
  }

  public Outcome getOutcome() {
    return outcome;
  }

  /**
   * @return true unless the run failed; a skipped run is successful
   */
  public boolean isSuccess() {
    return outcome != Outcome.FAILED;
  }

  public String getMessage() {
    return message;
  }

  /**
   * @return description of the failure, or {@code null} if the run did not fail
   */
  public String getError() {
    return error;
  }

  /**
   * @return version saved and promoted by the run, or {@code null} if it did not complete
   */
  public ModelVersion getVersion() {
    return version;
  }

  /**
   * @return per-epoch loss of a completed run, or {@code null}
   */
  public double[] getLossHistory() {
    return lossHistory;
  }

  @Override
  public String toString() {
    return "TrainingResult[" + jobID + ", " + outcome + ", " + message + (error == null ? "" : ", error:" + error) + ']';
  }

}
