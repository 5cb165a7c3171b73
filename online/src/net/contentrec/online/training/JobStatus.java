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

import java.io.Serializable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Snapshot of a training job's progress, as recorded in a {@link JobStatusStore}.
 *
 * @author Sean Owen
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class JobStatus implements Serializable {

  private final String jobID;
  private final JobState state;
  private final String phase;
  private final double progress;
  private final String message;
  private final String error;
  private final long updatedAt;

  /**
   * @param jobID job this describes
   * @param state overall state
   * @param phase finer-grained step, like "loading" or "training"
   * @param progress fraction complete, in [0,1]
   * @param message human-readable description of the step
   * @param error description of the failure, or {@code null}
   * @param updatedAt when this status was recorded, in milliseconds since the epoch
   */
  @JsonCreator
  public JobStatus(@JsonProperty("jobID") String jobID,
                   @JsonProperty("state") JobState state,
                   @JsonProperty("phase") String phase,
                   @JsonProperty("progress") double progress,
                   @JsonProperty("message") String message,
                   @JsonProperty("error") String error,
                   @JsonProperty("updatedAt") long updatedAt) {
    Preconditions.checkNotNull(jobID);
    Preconditions.checkNotNull(state);
    Preconditions.checkArgument(progress >= 0.0 && progress <= 1.0, "Bad progress: %s", progress);
    this.jobID = jobID;
    this.state = state;
    this.phase = phase;
    this.progress = progress;
    this.message = message;
    this.error = error;
    this.updatedAt = updatedAt;
  }

  @JsonProperty("jobID")
  public String getJobID() {
    return jobID;
  }

  @JsonProperty("state")
  public JobState getState() {
    return state;
  }

  @JsonProperty("phase")
  public String getPhase() {
    return phase;
  }

  @JsonProperty("progress")
  public double getProgress() {
    return progress;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }

  @JsonProperty("error")
  public String getError() {
    return error;
  }

  @JsonProperty("updatedAt")
  public long getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    return "JobStatus[" + jobID + ", " + state + ", " + phase + ", " + progress + ", " + message +
        (error == null ? "" : ", error:" + error) + ']';
  }

}
