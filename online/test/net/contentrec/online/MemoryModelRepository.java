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

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.contentrec.online.factorizer.FactorizationModel;
import net.contentrec.online.generation.ModelArtifactException;
import net.contentrec.online.generation.ModelRepository;
import net.contentrec.online.generation.ModelVersion;

/**
 * A {@link ModelRepository} that keeps models in memory, and can be told to fail.
 */
public final class MemoryModelRepository implements ModelRepository {

  private final Map<String,FactorizationModel> models = Maps.newLinkedHashMap();
  private final Map<String,ModelVersion> versions = Maps.newLinkedHashMap();
  private ModelVersion current;
  private boolean corrupt;
  private boolean failSave;
  private int loads;
  private int currentVersionFailures;

  @Override
  public synchronized ModelVersion save(FactorizationModel model) throws IOException {
    if (failSave) {
      throw new IOException("Disk full");
    }
    if (!model.isTrained()) {
      throw new IllegalStateException();
    }
    ModelVersion version = describe(model);
    models.put(version.getVersionID(), model);
    versions.put(version.getVersionID(), version);
    return version;
  }

  /**
   * Saves and promotes an already trained model.
   */
  public synchronized ModelVersion install(FactorizationModel model) throws IOException {
    ModelVersion version = save(model);
    promote(version);
    return version;
  }

  /**
   * Makes a version with the given training time current, without a loadable model behind it.
   */
  public synchronized ModelVersion installVersionOnly(String versionID, long trainedAt) {
    ModelVersion version = new ModelVersion(versionID, 2, 1, 1, trainedAt, 3.0, versionID);
    versions.put(versionID, version);
    current = version;
    return version;
  }

  private static ModelVersion describe(FactorizationModel model) {
    return new ModelVersion(model.getVersionID(),
                            model.getEmbeddingDim(),
                            model.getNumUsers(),
                            model.getNumItems(),
                            model.getTrainedAt(),
                            model.getGlobalBias(),
                            model.getVersionID());
  }

  @Override
  public synchronized void promote(ModelVersion version) throws IOException {
    if (!versions.containsKey(version.getVersionID())) {
      throw new IOException("No such version " + version);
    }
    current = version;
  }

  @Override
  public synchronized FactorizationModel load(ModelVersion version) throws IOException {
    loads++;
    FactorizationModel model = models.get(version.getVersionID());
    if (corrupt || model == null) {
      throw new ModelArtifactException("Bad version " + version);
    }
    return model;
  }

  @Override
  public synchronized FactorizationModel current() throws IOException {
    return current == null ? null : load(current);
  }

  @Override
  public synchronized ModelVersion currentVersion() throws IOException {
    if (currentVersionFailures > 0) {
      currentVersionFailures--;
      throw new IOException("Pointer unreadable");
    }
    return current;
  }

  @Override
  public synchronized List<ModelVersion> listVersions() {
    return Collections.unmodifiableList(Lists.newArrayList(versions.values()));
  }

  public synchronized void setCorrupt(boolean corrupt) {
    this.corrupt = corrupt;
  }

  public synchronized void setFailSave(boolean failSave) {
    this.failSave = failSave;
  }

  /**
   * Makes the next {@code failures} calls to {@link #currentVersion()} throw.
   */
  public synchronized void failCurrentVersion(int failures) {
    this.currentVersionFailures = failures;
  }

  public synchronized int getLoads() {
    return loads;
  }

}
