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
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.contentrec.online.factorizer.FactorizationModel;
import net.contentrec.online.generation.ModelArtifactException;
import net.contentrec.online.generation.ModelRepository;
import net.contentrec.online.generation.ModelVersion;

/**
 * Caches the loaded current model, and loads a new one only when the repository's current version changes.
 * The repository is asked for its current version at most once per check interval. While one caller checks or
 * loads, others keep getting the cached model instead of waiting.
 *
 * @author Sean Owen
 */
final class CurrentModelHolder {

  private static final Logger log = LoggerFactory.getLogger(CurrentModelHolder.class);

  private final ModelRepository repository;
  private final long checkIntervalMS;
  private final Lock lock;
  private volatile FactorizationModel model;
  private volatile long lastCheck;
  private volatile boolean checked;
  private String loadedVersionID;

  /**
   * @param repository source of the current model
   * @param checkInterval minimum time between checks of the current version; 0 checks on every call
   * @param unit unit of {@code checkInterval}
   */
  CurrentModelHolder(ModelRepository repository, long checkInterval, TimeUnit unit) {
    Preconditions.checkNotNull(repository);
    Preconditions.checkArgument(checkInterval >= 0, "Bad check interval: %s", checkInterval);
    this.repository = repository;
    this.checkIntervalMS = TimeUnit.MILLISECONDS.convert(checkInterval, unit);
    this.lock = new ReentrantLock();
  }

  /**
   * @return current model, or {@code null} if there is none or it can't be loaded
   */
  FactorizationModel get() {
    if (!isCheckDue()) {
      return model;
    }
    if (checked) {
      if (lock.tryLock()) {
        try {
          if (isCheckDue()) {
            check();
          }
        } finally {
          lock.unlock();
        }
      }
    } else {
      lock.lock();
      try {
        if (!checked) {
          check();
        }
      } finally {
        lock.unlock();
      }
    }
    return model;
  }

  private boolean isCheckDue() {
    return !checked || System.currentTimeMillis() - lastCheck >= checkIntervalMS;
  }

  private void check() {
    try {
      refresh();
    } finally {
      lastCheck = System.currentTimeMillis();
      checked = true;
    }
  }

  private void refresh() {
    ModelVersion version;
    try {
      version = repository.currentVersion();
    } catch (IOException ioe) {
      log.warn("Unable to read current model version; still using {}", loadedVersionID, ioe);
      return;
    }

    if (version == null) {
      if (loadedVersionID != null) {
        log.info("No current model version anymore");
      }
      loadedVersionID = null;
      model = null;
      return;
    }

    String versionID = version.getVersionID();
    if (versionID.equals(loadedVersionID)) {
      return;
    }

    try {
      FactorizationModel newModel = repository.load(version);
      log.info("Loaded {}", newModel);
      model = newModel;
    } catch (ModelArtifactException mae) {
      // Not retried until the current version changes
      log.warn("Current model version {} is invalid; serving without a model", versionID, mae);
      model = null;
    } catch (IOException ioe) {
      log.warn("Unable to load model version {}; still using {}", versionID, loadedVersionID, ioe);
      return;
    }
    loadedVersionID = versionID;
  }

}
