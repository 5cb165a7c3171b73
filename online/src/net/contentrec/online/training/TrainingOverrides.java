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

import com.google.common.base.Preconditions;

/**
 * Settings that replace the configured ones for a single training run. Any of them may be {@code null},
 * meaning "use the configured value".
 *
 * @author Sean Owen
 */
public final class TrainingOverrides {

  public static final TrainingOverrides NONE = new TrainingOverrides(null, null, null);

  private final String dataset;
  private final Integer epochs;
  private final Integer batchSize;

  /**
   * @param dataset name of the interaction source to train from
   * @param epochs number of passes over the data
   * @param batchSize samples per SGD batch
   */
  public TrainingOverrides(String dataset, Integer epochs, Integer batchSize) {
    Preconditions.checkArgument(epochs == null || epochs > 0, "Bad epochs: %s", epochs);
    Preconditions.checkArgument(batchSize == null || batchSize > 0, "Bad batch size: %s", batchSize);
    this.dataset = dataset;
    this.epochs = epochs;
    this.batchSize = batchSize;
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

  @Override
  public String toString() {
    return "TrainingOverrides[dataset:" + dataset + ", epochs:" + epochs + ", batchSize:" + batchSize + ']';
  }

}
