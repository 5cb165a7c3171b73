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

import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.contentrec.online.training.JobStatus;
import net.contentrec.online.training.JobStatusStore;

/**
 * A {@link JobStatusStore} that also remembers every status it was given, in order.
 */
public final class RecordingJobStatusStore implements JobStatusStore {

  private final Map<String,JobStatus> latest = Maps.newHashMap();
  private final List<JobStatus> history = Lists.newArrayList();

  @Override
  public synchronized void put(JobStatus status) {
    latest.put(status.getJobID(), status);
    history.add(status);
  }

  @Override
  public synchronized JobStatus get(String jobID) {
    return latest.get(jobID);
  }

  public synchronized List<JobStatus> getHistory(String jobID) {
    List<JobStatus> result = Lists.newArrayList();
    for (JobStatus status : history) {
      if (status.getJobID().equals(jobID)) {
        result.add(status);
      }
    }
    return result;
  }

}
