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

import net.contentrec.online.training.TrainingOverrides;

/**
 * A manual request to retrain. Optional settings are {@code null} when not given.
 *
 * @author Sean Owen
 */
public final class RetrainRequest {

  private final boolean force;
  private final String dataset;
  private final Integer epochs;
  private final Integer batchSize;

  public RetrainRequest(boolean force) {
    this(force, null, null, null);
  }

  /**
   * @param force train even if the current model is still fresh
   * @param dataset named dataset to train from
   * @param epochs epochs for this run
   * @param batchSize batch size for this run
   */
  public RetrainRequest(boolean force, String dataset, Integer epochs, Integer batchSize) {
    this.force = force;
    this.dataset = dataset;
    this.epochs = epochs;
    this.batchSize = batchSize;
  }

  public boolean isForce() {
    return force;
  }

  public String getDataset() {
    return dataset;
  }

  public Integer getEpochs() {
    return epochs;
  }

  public Integer getBatchSize() {
    return batchSize;
  }

  TrainingOverrides toOverrides() {
    return new TrainingOverrides(dataset, epochs, batchSize);
  }

  @Override
  public String toString() {
    return "RetrainRequest[force:" + force + ", dataset:" + dataset + ", epochs:" + epochs +
        ", batchSize:" + batchSize + ']';
  }

}
