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

import java.util.List;
import java.util.UUID;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.contentrec.common.LangUtils;
import net.contentrec.common.random.RandomManager;
import net.contentrec.online.encoder.IDEncoder;
import net.contentrec.online.interaction.Interaction;

/**
 * <p>A biased matrix factorization model of user / content interactions. It contains:</p>
 *
 * <ul>
 *   <li>user and content {@link IDEncoder}s, mapping IDs to rows</li>
 *   <li>the user-feature and content-feature matrices, one row per encoded ID</li>
 *   <li>a bias per user and per content item</li>
 *   <li>a global bias, the mean interaction value</li>
 * </ul>
 *
 * <p>An instance starts untrained, and becomes trained either by {@link #train(List, TrainingParameters, TrainingListener)}
 * or by being restored from saved parameters. It is never trained twice; each training run builds a new
 * instance. Once trained, it is only read, and may be shared across threads.</p>
 *
 * <p>Estimates are {@code dot(user, content) + userBias + contentBias + globalBias}, clipped to
 * [{@link #MIN_RATING}, {@link #MAX_RATING}]. Unknown users or content get the global bias.</p>
 *
 * @author Sean Owen
 */
public final class FactorizationModel {

  private static final Logger log = LoggerFactory.getLogger(FactorizationModel.class);

  public static final double MIN_RATING = 1.0;
  public static final double MAX_RATING = 5.0;
  static final double INIT_STANDARD_DEVIATION = 0.1;

  private final int embeddingDim;
  private final String versionID;
  private long trainedAt;
  private IDEncoder userEncoder;
  private IDEncoder contentEncoder;
  private double[][] userEmbeddings;
  private double[][] contentEmbeddings;
  private double[] userBiases;
  private double[] contentBiases;
  private double globalBias;
  private volatile boolean trained;

  /**
   * Creates a new, untrained model with a fresh version ID.
   *
   * @param embeddingDim number of latent features per user and per item
   */
  public FactorizationModel(int embeddingDim) {
    Preconditions.checkArgument(embeddingDim > 0, "Bad embedding dimension: %s", embeddingDim);
    this.embeddingDim = embeddingDim;
    this.versionID = UUID.randomUUID().toString();
  }

  private FactorizationModel(String versionID,
                             long trainedAt,
                             double globalBias,
                             IDEncoder userEncoder,
                             IDEncoder contentEncoder,
                             double[][] userEmbeddings,
                             double[][] contentEmbeddings,
                             double[] userBiases,
                             double[] contentBiases) {
    Preconditions.checkNotNull(versionID);
    Preconditions.checkArgument(LangUtils.isFinite(globalBias), "Bad global bias: %s", globalBias);
    Preconditions.checkArgument(userEmbeddings.length == userEncoder.size(),
                                "User embeddings have %s rows but encoder has %s users",
                                userEmbeddings.length, userEncoder.size());
    Preconditions.checkArgument(contentEmbeddings.length == contentEncoder.size(),
                                "Content embeddings have %s rows but encoder has %s items",
                                contentEmbeddings.length, contentEncoder.size());
    Preconditions.checkArgument(userBiases.length == userEncoder.size(),
                                "User biases have %s entries but encoder has %s users",
                                userBiases.length, userEncoder.size());
    Preconditions.checkArgument(contentBiases.length == contentEncoder.size(),
                                "Content biases have %s entries but encoder has %s items",
                                contentBiases.length, contentEncoder.size());
    Preconditions.checkArgument(userEmbeddings.length > 0 && contentEmbeddings.length > 0, "Empty model");
    int dim = userEmbeddings[0].length;
    Preconditions.checkArgument(dim > 0, "Bad embedding dimension: %s", dim);
    checkRowLengths(userEmbeddings, dim);
    checkRowLengths(contentEmbeddings, dim);
    this.embeddingDim = dim;
    this.versionID = versionID;
    this.trainedAt = trainedAt;
    this.globalBias = globalBias;
    this.userEncoder = userEncoder;
    this.contentEncoder = contentEncoder;
    this.userEmbeddings = userEmbeddings;
    this.contentEmbeddings = contentEmbeddings;
    this.userBiases = userBiases;
    this.contentBiases = contentBiases;
    this.trained = true;
  }

  /**
   * Rebuilds a trained model from saved parameters.
   *
   * @throws IllegalArgumentException if the parameters' dimensions disagree with each other or
   *  with the encoders
   */
  public static FactorizationModel restore(String versionID,
                                           long trainedAt,
                                           double globalBias,
                                           IDEncoder userEncoder,
                                           IDEncoder contentEncoder,
                                           double[][] userEmbeddings,
                                           double[][] contentEmbeddings,
                                           double[] userBiases,
                                           double[] contentBiases) {
    return new FactorizationModel(versionID, trainedAt, globalBias, userEncoder, contentEncoder,
                                  userEmbeddings, contentEmbeddings, userBiases, contentBiases);
  }

  private static void checkRowLengths(double[][] matrix, int dim) {
    for (double[] row : matrix) {
      Preconditions.checkArgument(row.length == dim, "Row of length %s, expected %s", row.length, dim);
    }
  }

  /**
   * Fits the model to the interactions by mini-batch stochastic gradient descent.
   *
   * <p>Within a batch, residuals are computed for all samples first, from the parameters as they were at the
   * start of the batch. The updates are then applied sample by sample, so that a later sample in the batch
   * updates rows that an earlier one may already have changed.</p>
   *
   * @param interactions data to fit
   * @param parameters hyperparameters for this run
   * @param listener notified after each epoch; may be {@code null}
   * @return mean squared error of each epoch, in order
   * @throws InterruptedException if the thread is interrupted between batches
   * @throws IllegalStateException if already trained, or if the loss stops being finite
   */
  public double[] train(List<Interaction> interactions,
                        TrainingParameters parameters,
                        TrainingListener listener) throws InterruptedException {
    Preconditions.checkState(!trained, "Model %s is already trained", versionID);
    Preconditions.checkArgument(!interactions.isEmpty(), "No interactions to train on");

    int n = interactions.size();
    log.info("Training {} features on {} interactions with {}", embeddingDim, n, parameters);

    List<String> userIDs = Lists.newArrayListWithCapacity(n);
    List<String> contentIDs = Lists.newArrayListWithCapacity(n);
    for (Interaction interaction : interactions) {
      userIDs.add(interaction.getUserID());
      contentIDs.add(interaction.getContentID());
    }
    userEncoder = IDEncoder.fit(userIDs);
    contentEncoder = IDEncoder.fit(contentIDs);

    int[] userIndices = new int[n];
    int[] contentIndices = new int[n];
    double[] values = new double[n];
    double sum = 0.0;
    for (int i = 0; i < n; i++) {
      Interaction interaction = interactions.get(i);
      userIndices[i] = userEncoder.encode(interaction.getUserID());
      contentIndices[i] = contentEncoder.encode(interaction.getContentID());
      values[i] = interaction.getValue();
      sum += values[i];
    }

    RandomGenerator random = RandomManager.getRandom();
    userEmbeddings = randomMatrix(userEncoder.size(), embeddingDim, random);
    contentEmbeddings = randomMatrix(contentEncoder.size(), embeddingDim, random);
    userBiases = new double[userEncoder.size()];
    contentBiases = new double[contentEncoder.size()];
    globalBias = sum / n;

    double learningRate = parameters.getLearningRate();
    double regularization = parameters.getRegularization();
    int epochs = parameters.getEpochs();
    int batchSize = parameters.getBatchSize();

    int[] order = new int[n];
    for (int i = 0; i < n; i++) {
      order[i] = i;
    }
    double[] residuals = new double[Math.min(batchSize, n)];
    double[] lossHistory = new double[epochs];

    for (int epoch = 0; epoch < epochs; epoch++) {
      RandomManager.shuffle(order, random);
      double epochLoss = 0.0;

      for (int start = 0; start < n; start += batchSize) {
        if (Thread.interrupted()) {
          throw new InterruptedException("Interrupted in epoch " + (epoch + 1));
        }
        int size = Math.min(batchSize, n - start);

        double squaredError = 0.0;
        for (int j = 0; j < size; j++) {
          int sample = order[start + j];
          double residual = values[sample] - estimate(userIndices[sample], contentIndices[sample]);
          residuals[j] = residual;
          squaredError += residual * residual;
        }
        epochLoss += (squaredError / size) * size / n;

        for (int j = 0; j < size; j++) {
          int sample = order[start + j];
          update(userIndices[sample], contentIndices[sample], residuals[j], learningRate, regularization);
        }
      }

      Preconditions.checkState(LangUtils.isFinite(epochLoss),
                               "Loss diverged in epoch %s; lower the learning rate", epoch + 1);
      lossHistory[epoch] = epochLoss;
      log.info("Epoch {}/{}, loss {}", epoch + 1, epochs, epochLoss);
      if (listener != null) {
        listener.epochFinished(epoch, epochs, epochLoss);
      }
    }

    trainedAt = System.currentTimeMillis();
    trained = true;
    return lossHistory;
  }

  private static double[][] randomMatrix(int rows, int columns, RandomGenerator random) {
    double[][] matrix = new double[rows][columns];
    for (double[] row : matrix) {
      for (int i = 0; i < columns; i++) {
        row[i] = INIT_STANDARD_DEVIATION * random.nextGaussian();
      }
    }
    return matrix;
  }

  private void update(int userIndex, int contentIndex, double residual, double learningRate, double regularization) {
    double[] userRow = userEmbeddings[userIndex];
    double[] contentRow = contentEmbeddings[contentIndex];
    for (int k = 0; k < embeddingDim; k++) {
      double userValue = userRow[k];
      double contentValue = contentRow[k];
      userRow[k] -= learningRate * (-residual * contentValue + regularization * userValue);
      contentRow[k] -= learningRate * (-residual * userValue + regularization * contentValue);
    }
    userBiases[userIndex] -= learningRate * (-residual + regularization * userBiases[userIndex]);
    contentBiases[contentIndex] -= learningRate * (-residual + regularization * contentBiases[contentIndex]);
  }

  /**
   * @return unclipped estimate for known indices
   */
  private double estimate(int userIndex, int contentIndex) {
    double[] userRow = userEmbeddings[userIndex];
    double[] contentRow = contentEmbeddings[contentIndex];
    double dot = 0.0;
    for (int k = 0; k < embeddingDim; k++) {
      dot += userRow[k] * contentRow[k];
    }
    return dot + userBiases[userIndex] + contentBiases[contentIndex] + globalBias;
  }

  /**
   * @param userIndex encoded user, or {@link IDEncoder#UNKNOWN}
   * @param contentIndex encoded content, or {@link IDEncoder#UNKNOWN}
   * @return estimated interaction value, clipped to [{@link #MIN_RATING}, {@link #MAX_RATING}]; the global bias
   *  if the model is untrained or either index is unknown
   */
  public double predict(int userIndex, int contentIndex) {
    if (!trained || userIndex < 0 || contentIndex < 0) {
      return globalBias;
    }
    Preconditions.checkArgument(userIndex < userEmbeddings.length, "Bad user index: %s", userIndex);
    Preconditions.checkArgument(contentIndex < contentEmbeddings.length, "Bad content index: %s", contentIndex);
    return LangUtils.clamp(estimate(userIndex, contentIndex), MIN_RATING, MAX_RATING);
  }

  /**
   * @see #predict(int, int)
   */
  public double predict(String userID, String contentID) {
    if (!trained) {
      return globalBias;
    }
    return predict(userEncoder.encode(userID), contentEncoder.encode(contentID));
  }

  public boolean isTrained() {
    return trained;
  }

  public String getVersionID() {
    return versionID;
  }

  /**
   * @return time training finished, in milliseconds since the epoch, or 0 if untrained
   */
  public long getTrainedAt() {
    return trainedAt;
  }

  public int getEmbeddingDim() {
    return embeddingDim;
  }

  public double getGlobalBias() {
    return globalBias;
  }

  /**
   * @return user encoder, or {@code null} if untrained
   */
  public IDEncoder getUserEncoder() {
    return userEncoder;
  }

  /**
   * @return content encoder, or {@code null} if untrained
   */
  public IDEncoder getContentEncoder() {
    return contentEncoder;
  }

  public int getNumUsers() {
    return userEncoder == null ? 0 : userEncoder.size();
  }

  public int getNumItems() {
    return contentEncoder == null ? 0 : contentEncoder.size();
  }

  /**
   * Access to the underlying parameters, for serialization. Callers must not modify these arrays.
   */
  public double[][] getUserEmbeddings() {
    return userEmbeddings;
  }

  public double[][] getContentEmbeddings() {
    return contentEmbeddings;
  }

  public double[] getUserBiases() {
    return userBiases;
  }

  public double[] getContentBiases() {
    return contentBiases;
  }

  @Override
  public String toString() {
    return "FactorizationModel[" + versionID + ", users:" + getNumUsers() + ", items:" + getNumItems() +
        ", features:" + embeddingDim + ", trained:" + trained + ']';
  }

}
