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

import java.io.IOException;
import java.util.List;

import net.contentrec.online.factorizer.FactorizationModel;

/**
 * <p>Stores successive versions of the trained model and tracks which one is current. Versions are immutable
 * once saved, and many may coexist. Exactly one, or none, is current at any time.</p>
 *
 * <p>Implementations must make {@link #promote(ModelVersion)} atomic with respect to {@link #current()}
 * and {@link #currentVersion()}: a reader sees either the previous current version or the new one.</p>
 *
 * @author Sean Owen
 */
public interface ModelRepository {

  /**
   * Persists all of a trained model's artifacts. The version is complete when this returns, and is never
   * visible in a partially written state.
   *
   * @param model trained model to save
   * @return description of the saved version
   * @throws IOException if the artifacts can't be written
   * @throws IllegalStateException if the model is not trained
   */
  ModelVersion save(FactorizationModel model) throws IOException;

  /**
   * Makes the given version the current one.
   *
   * @param version a version previously returned by {@link #save(FactorizationModel)} or {@link #listVersions()}
   * @throws IOException if the version does not exist or the pointer can't be updated; the previous
   *  current version then remains current
   */
  void promote(ModelVersion version) throws IOException;

  /**
   * @param version version to load
   * @return fully loaded, trained model
   * @throws ModelArtifactException if any artifact is missing, unreadable or inconsistent
   * @throws IOException if the artifacts can't otherwise be read
   */
  FactorizationModel load(ModelVersion version) throws IOException;

  /**
   * @return the current model, loaded, or {@code null} if no version has been promoted
   * @throws ModelArtifactException if the current version's artifacts are invalid
   * @throws IOException if the artifacts can't otherwise be read
   */
  FactorizationModel current() throws IOException;

  /**
   * Like {@link #current()} but reads only the version's description, not its parameters.
   *
   * @return current version or {@code null} if none has been promoted
   * @throws IOException if the pointer or the version's metadata can't be read
   */
  ModelVersion currentVersion() throws IOException;

  /**
   * @return all valid saved versions, by training time ascending
   * @throws IOException if the repository can't be read
   */
  List<ModelVersion> listVersions() throws IOException;

}
