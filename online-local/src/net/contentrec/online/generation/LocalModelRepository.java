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

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.contentrec.common.io.IOUtils;
import net.contentrec.online.factorizer.FactorizationModel;

/**
 * <p>A {@link ModelRepository} on the local file system. Each version lives in its own subdirectory of the root,
 * named by version ID, written by {@link ModelSerializer}. The file {@code CURRENT} in the root names the
 * current version's directory.</p>
 *
 * <p>A version is written to a {@code .staging-} directory and renamed into place only when complete. The pointer
 * is written to {@code CURRENT.tmp} and renamed over {@code CURRENT}. Both renames are atomic where the file system
 * allows, so readers never see a partial version or a missing pointer.</p>
 *
 * @author Sean Owen
 */
public final class LocalModelRepository implements ModelRepository {

  private static final Logger log = LoggerFactory.getLogger(LocalModelRepository.class);

  static final String CURRENT_FILE = "CURRENT";
  private static final String CURRENT_TEMP_FILE = "CURRENT.tmp";
  private static final String STAGING_PREFIX = ".staging-";
  private static final Pattern VERSION_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

  private final File rootDir;

  /**
   * @param rootDir directory holding all versions; created if needed
   * @throws IOException if it can't be created
   */
  public LocalModelRepository(File rootDir) throws IOException {
    Preconditions.checkNotNull(rootDir);
    if (!rootDir.isDirectory() && !rootDir.mkdirs()) {
      throw new IOException("Could not create " + rootDir);
    }
    this.rootDir = rootDir;
    log.info("Storing models under {}", rootDir);
  }

  public File getRootDir() {
    return rootDir;
  }

  @Override
  public ModelVersion save(FactorizationModel model) throws IOException {
    Preconditions.checkState(model.isTrained(), "Model is not trained");
    String versionID = model.getVersionID();
    checkVersionID(versionID);
    File versionDir = new File(rootDir, versionID);
    Preconditions.checkState(!versionDir.exists(), "Version already saved: %s", versionID);

    File stagingDir = new File(rootDir, STAGING_PREFIX + versionID);
    if (stagingDir.exists()) {
      log.warn("Removing leftover {}", stagingDir);
      IOUtils.deleteRecursively(stagingDir);
    }
    if (!stagingDir.mkdirs()) {
      throw new IOException("Could not create " + stagingDir);
    }

    ModelVersion version;
    boolean moved = false;
    try {
      log.info("Writing {} to {}", model, stagingDir);
      version = ModelSerializer.write(model, stagingDir);
      IOUtils.moveAtomically(stagingDir, versionDir);
      moved = true;
    } finally {
      if (!moved && stagingDir.exists() && !IOUtils.deleteRecursively(stagingDir)) {
        log.warn("Could not delete {}", stagingDir);
      }
    }
    log.info("Saved version {}", versionID);
    return version;
  }

  @Override
  public void promote(ModelVersion version) throws IOException {
    String versionID = version.getVersionID();
    File versionDir = getVersionDir(versionID);
    if (!new File(versionDir, ModelSerializer.METADATA_FILE).isFile()) {
      throw new FileNotFoundException("No saved version " + versionID + " in " + rootDir);
    }
    File tempFile = new File(rootDir, CURRENT_TEMP_FILE);
    Files.asCharSink(tempFile, Charsets.UTF_8).write(versionID);
    IOUtils.moveAtomically(tempFile, new File(rootDir, CURRENT_FILE));
    log.info("Promoted version {}", versionID);
  }

  @Override
  public FactorizationModel load(ModelVersion version) throws IOException {
    return ModelSerializer.read(getVersionDir(version.getVersionID()));
  }

  @Override
  public FactorizationModel current() throws IOException {
    String versionID = readCurrentVersionID();
    return versionID == null ? null : ModelSerializer.read(getVersionDir(versionID));
  }

  @Override
  public ModelVersion currentVersion() throws IOException {
    String versionID = readCurrentVersionID();
    return versionID == null ? null : ModelSerializer.readMetadata(getVersionDir(versionID));
  }

  private String readCurrentVersionID() throws IOException {
    File currentFile = new File(rootDir, CURRENT_FILE);
    if (!currentFile.exists()) {
      return null;
    }
    String versionID = Files.asCharSource(currentFile, Charsets.UTF_8).read().trim();
    if (!VERSION_ID_PATTERN.matcher(versionID).matches()) {
      throw new ModelArtifactException("Bad version ID in " + currentFile + ": " + versionID);
    }
    return versionID;
  }

  @Override
  public List<ModelVersion> listVersions() throws IOException {
    File[] dirs = rootDir.listFiles();
    if (dirs == null) {
      throw new IOException("Could not list " + rootDir);
    }
    List<ModelVersion> versions = Lists.newArrayList();
    for (File dir : dirs) {
      if (!dir.isDirectory() || dir.getName().startsWith(".")) {
        continue;
      }
      try {
        versions.add(ModelSerializer.readMetadata(dir));
      } catch (IOException ioe) {
        log.warn("Skipping invalid version directory {} ({})", dir, ioe.toString());
      }
    }
    Collections.sort(versions, new ByTrainedAtComparator());
    return versions;
  }

  private File getVersionDir(String versionID) {
    checkVersionID(versionID);
    return new File(rootDir, versionID);
  }

  private static void checkVersionID(String versionID) {
    Preconditions.checkArgument(VERSION_ID_PATTERN.matcher(versionID).matches(), "Bad version ID: %s", versionID);
  }

}
