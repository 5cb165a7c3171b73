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

import net.contentrec.common.LangUtils;
import net.contentrec.online.factorizer.TrainingParameters;

/**
 * Configuration of model training. Defaults are read from system properties when the object is created:
 *
 * <ul>
 *   <li>{@code model.sgd.learningRate}: SGD step size (default 0.005)</li>
 *   <li>{@code model.sgd.regularization}: L2 regularization weight (default 0.02)</li>
 *   <li>{@code model.sgd.epochs}: passes over the data (default 20)</li>
 *   <li>{@code model.sgd.batchSize}: samples per batch (default 1000)</li>
 *   <li>{@code model.features}: embedding dimension (default 50)</li>
 *   <li>{@code model.maxInteractions}: most recent interactions loaded for one run (default 50000)</li>
 *   <li>{@code model.freshnessHours}: an unforced run is skipped if the model is younger than this (default 24)</li>
 * </ul>
 *
 * @author Sean Owen
 */
public final class TrainingConfiguration {

  public static final double DEFAULT_LEARNING_RATE = 0.005;
  public static final double DEFAULT_REGULARIZATION = 0.02;
  public static final int DEFAULT_EPOCHS = 20;
  public static final int DEFAULT_BATCH_SIZE = 1000;
  public static final int DEFAULT_FEATURES = 50;
  public static final int DEFAULT_MAX_INTERACTIONS = 50000;
  public static final int DEFAULT_FRESHNESS_HOURS = 24;

  private double learningRate;
  private double regularization;
  private int epochs;
  private int batchSize;
  private int features;
  private int maxInteractions;
  private int freshnessHours;

  public TrainingConfiguration() {
    setLearningRate(LangUtils.getDoubleProperty("model.sgd.learningRate", DEFAULT_LEARNING_RATE));
    setRegularization(LangUtils.getDoubleProperty("model.sgd.regularization", DEFAULT_REGULARIZATION));
    setEpochs(LangUtils.getIntProperty("model.sgd.epochs", DEFAULT_EPOCHS));
    setBatchSize(LangUtils.getIntProperty("model.sgd.batchSize", DEFAULT_BATCH_SIZE));
    setFeatures(LangUtils.getIntProperty("model.features", DEFAULT_FEATURES));
    setMaxInteractions(LangUtils.getIntProperty("model.maxInteractions", DEFAULT_MAX_INTERACTIONS));
    setFreshnessHours(LangUtils.getIntProperty("model.freshnessHours", DEFAULT_FRESHNESS_HOURS));
  }

  public double getLearningRate() {
    return learningRate;
  }

  public void setLearningRate(double learningRate) {
    Preconditions.checkArgument(learningRate > 0.0, "Bad model.sgd.learningRate: %s", learningRate);
    this.learningRate = learningRate;
  }

  public double getRegularization() {
    return regularization;
  }

  public void setRegularization(double regularization) {
    Preconditions.checkArgument(regularization >= 0.0, "Bad model.sgd.regularization: %s", regularization);
    this.regularization = regularization;
  }

  public int getEpochs() {
    return epochs;
  }

  public void setEpochs(int epochs) {
    Preconditions.checkArgument(epochs > 0, "Bad model.sgd.epochs: %s", epochs);
    this.epochs = epochs;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    Preconditions.checkArgument(batchSize > 0, "Bad model.sgd.batchSize: %s", batchSize);
    this.batchSize = batchSize;
  }

  public int getFeatures() {
    return features;
  }

  public void setFeatures(int features) {
    Preconditions.checkArgument(features > 0, "Bad model.features: %s", features);
    this.features = features;
  }

  public int getMaxInteractions() {
    return maxInteractions;
  }

  public void setMaxInteractions(int maxInteractions) {
    Preconditions.checkArgument(maxInteractions > 0, "Bad model.maxInteractions: %s", maxInteractions);
    this.maxInteractions = maxInteractions;
  }

  public int getFreshnessHours() {
    return freshnessHours;
  }

  /**
   * @param freshnessHours hours during which a trained model is considered fresh; 0 disables the check
   */
  public void setFreshnessHours(int freshnessHours) {
    Preconditions.checkArgument(freshnessHours >= 0, "Bad model.freshnessHours: %s", freshnessHours);
    this.freshnessHours = freshnessHours;
  }

  /**
   * @param overrides per-run settings; its epochs and batch size replace the configured ones where set
   * @return hyperparameters for one run
   */
  public TrainingParameters toParameters(TrainingOverrides overrides) {
    int runEpochs = overrides.getEpochs() == null ? epochs : overrides.getEpochs();
    int runBatchSize = overrides.getBatchSize() == null ? batchSize : overrides.getBatchSize();
    return new TrainingParameters(learningRate, regularization, runEpochs, runBatchSize);
  }

  @Override
  public String toString() {
    return "TrainingConfiguration[learningRate:" + learningRate + ", regularization:" + regularization +
        ", epochs:" + epochs + ", batchSize:" + batchSize + ", features:" + features +
        ", maxInteractions:" + maxInteractions + ", freshnessHours:" + freshnessHours + ']';
  }

}
