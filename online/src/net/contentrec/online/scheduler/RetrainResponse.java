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

/**
 * Answer to a {@link RetrainRequest}. An accepted request carries the ID of the job it started.
 *
 * @author Sean Owen
 */
public final class RetrainResponse {

  private final boolean success;
  private final String message;
  private final String jobID;

  private RetrainResponse(boolean success, String message, String jobID) {
    this.success = success;
    this.message = message;
    this.jobID = jobID;
  }

  static RetrainResponse accepted(String jobID, String message) {
    return new RetrainResponse(true, message, jobID);
  }

  static RetrainResponse rejected(String message) {
    return new RetrainResponse(false, message, null);
  }

  public boolean isSuccess() {
    return success;
  }

  public String getMessage() {
    return message;
  }

  /**
   * @return ID of the started job, or {@code null} if the request was rejected
   */
  public String getJobID() {
    return jobID;
  }

  @Override
  public String toString() {
    return "RetrainResponse[" + success + ", " + message + (jobID == null ? "" : ", " + jobID) + ']';
  }

}
