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

package net.contentrec.online.generation;

import java.io.Serializable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Describes one saved, immutable model version. This is also the content of the version's metadata document.
 *
 * @author Sean Owen
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ModelVersion implements Serializable {

  private final String versionID;
  private final int embeddingDim;
  private final int numUsers;
  private final int numItems;
  private final long trainedAt;
  private final double globalBias;
  private final String path;

  @JsonCreator
  public ModelVersion(@JsonProperty("versionID") String versionID,
                      @JsonProperty("embeddingDim") int embeddingDim,
                      @JsonProperty("nUsers") int numUsers,
                      @JsonProperty("nItems") int numItems,
                      @JsonProperty("trainedAt") long trainedAt,
                      @JsonProperty("globalBias") double globalBias,
                      @JsonProperty("path") String path) {
    Preconditions.checkArgument(versionID != null && !versionID.isEmpty(), "No version ID");
    Preconditions.checkArgument(embeddingDim > 0, "Bad embedding dimension: %s", embeddingDim);
    Preconditions.checkArgument(numUsers >= 0 && numItems >= 0, "Bad dimensions: %s x %s", numUsers, numItems);
    this.versionID = versionID;
    this.embeddingDim = embeddingDim;
    this.numUsers = numUsers;
    this.numItems = numItems;
    this.trainedAt = trainedAt;
    this.globalBias = globalBias;
    this.path = path;
  }

  /**
   * @return copy of this version with a different location
   */
  public ModelVersion withPath(String newPath) {
    return new ModelVersion(versionID, embeddingDim, numUsers, numItems, trainedAt, globalBias, newPath);
  }

  @JsonProperty("versionID")
  public String getVersionID() {
    return versionID;
  }

  @JsonProperty("embeddingDim")
  public int getEmbeddingDim() {
    return embeddingDim;
  }

  @JsonProperty("nUsers")
  public int getNumUsers() {
    return numUsers;
  }

  @JsonProperty("nItems")
  public int getNumItems() {
    return numItems;
  }

  /**
   * @return when the model was trained, in milliseconds since the epoch
   */
  @JsonProperty("trainedAt")
  public long getTrainedAt() {
    return trainedAt;
  }

  @JsonProperty("globalBias")
  public double getGlobalBias() {
    return globalBias;
  }

  /**
   * @return where the version's artifacts are stored, in terms the repository understands
   */
  @JsonProperty("path")
  public String getPath() {
    return path;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ModelVersion)) {
      return false;
    }
    ModelVersion other = (ModelVersion) o;
    return versionID.equals(other.versionID) && trainedAt == other.trainedAt;
  }

  @Override
  public int hashCode() {
    return versionID.hashCode() ^ (int) (trainedAt ^ (trainedAt >>> 32));
  }

  @Override
  public String toString() {
    return "ModelVersion[" + versionID + ", users:" + numUsers + ", items:" + numItems +
        ", features:" + embeddingDim + ", trainedAt:" + trainedAt + ']';
  }

}
