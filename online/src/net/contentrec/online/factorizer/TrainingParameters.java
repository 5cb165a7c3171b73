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

package net.contentrec.online.factorizer;

import com.google.common.base.Preconditions;

/**
 * Hyperparameters for one run of {@link FactorizationModel#train(java.util.List, TrainingParameters, TrainingListener)}.
 *
 * @author Sean Owen
 */
public final class TrainingParameters {

  private final double learningRate;
  private final double regularization;
  private final int epochs;
  private final int batchSize;

  /**
   * @param learningRate SGD step size; must be positive
   * @param regularization L2 regularization weight; must be nonnegative
   * @param epochs passes over the data; must be positive
   * @param batchSize samples per batch; must be positive
   */
  public TrainingParameters(double learningRate, double regularization, int epochs, int batchSize) {
    Preconditions.checkArgument(learningRate > 0.0, "Bad learning rate: %s", learningRate);
    Preconditions.checkArgument(regularization >= 0.0, "Bad regularization: %s", regularization);
    Preconditions.checkArgument(epochs > 0, "Bad epochs: %s", epochs);
    Preconditions.checkArgument(batchSize > 0, "Bad batch size: %s", batchSize);
    this.learningRate = learningRate;
    this.regularization = regularization;
    this.epochs = epochs;
    this.batchSize = batchSize;
  }

  public double getLearningRate() {
    return learningRate;
  }

  public double getRegularization() {
    return regularization;
  }

  public int getEpochs() {
    return epochs;
  }

  public int getBatchSize() {
    return batchSize;
  }

  @Override
  public String toString() {
    return "TrainingParameters[learningRate:" + learningRate + ", regularization:" + regularization +
        ", epochs:" + epochs + ", batchSize:" + batchSize + ']';
  }

}
