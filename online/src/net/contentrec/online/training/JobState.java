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

/**
 * Lifecycle of a training job. A job moves forward only: {@link #PENDING} to {@link #RUNNING} to
 * {@link #COMPLETED} or {@link #FAILED}. A skipped job goes directly to {@link #COMPLETED}.
 *
 * @author Sean Owen
 */
public enum JobState {

  PENDING,
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isFinished() {
    return this == COMPLETED || this == FAILED;
  }

}
