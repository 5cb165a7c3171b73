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

/**
 * Durable record of training jobs' latest status, so that they can be polled after the fact.
 *
 * @author Sean Owen
 */
public interface JobStatusStore {

  /**
   * Records a job's status, replacing any earlier status for the same job.
   *
   * @throws IOException if the status can't be stored
   */
  void put(JobStatus status) throws IOException;

  /**
   * @param jobID job to look up
   * @return latest status of the job, or {@code null} if unknown or expired
   * @throws IOException if the store can't be read
   */
  JobStatus get(String jobID) throws IOException;

}
