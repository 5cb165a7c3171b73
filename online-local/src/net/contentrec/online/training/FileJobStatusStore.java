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

import java.io.File;
import java.io.FileFilter;
import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.contentrec.common.io.IOUtils;

/**
 * A {@link JobStatusStore} keeping one JSON document per job in a local directory. Statuses expire a fixed time
 * after their last update; expired statuses are deleted when read, and by {@link #purgeExpired()}.
 *
 * @author Sean Owen
 */
public final class FileJobStatusStore implements JobStatusStore {

  private static final Logger log = LoggerFactory.getLogger(FileJobStatusStore.class);

  public static final long DEFAULT_TTL_MS = TimeUnit.MILLISECONDS.convert(24, TimeUnit.HOURS);

  private static final String SUFFIX = ".json";
  private static final Pattern JOB_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

  private final File dir;
  private final long ttlMS;
  private final Clock clock;
  private final ObjectMapper mapper;

  public FileJobStatusStore(File dir) throws IOException {
    this(dir, DEFAULT_TTL_MS, Clock.systemUTC());
  }

  /**
   * @param dir directory holding status files; created if needed
   * @param ttlMS milliseconds after its last update that a status expires
   * @param clock source of the current time
   * @throws IOException if the directory can't be created
   */
  public FileJobStatusStore(File dir, long ttlMS, Clock clock) throws IOException {
    Preconditions.checkNotNull(dir);
    Preconditions.checkArgument(ttlMS > 0, "Bad TTL: %s", ttlMS);
    Preconditions.checkNotNull(clock);
    if (!dir.isDirectory() && !dir.mkdirs()) {
      throw new IOException("Could not create " + dir);
    }
    this.dir = dir;
    this.ttlMS = ttlMS;
    this.clock = clock;
    this.mapper = new ObjectMapper();
  }

  @Override
  public void put(JobStatus status) throws IOException {
    File file = fileFor(status.getJobID());
    File tempFile = new File(dir, '.' + file.getName() + ".tmp");
    mapper.writeValue(tempFile, status);
    IOUtils.moveAtomically(tempFile, file);
    log.debug("Recorded {}", status);
  }

  @Override
  public JobStatus get(String jobID) throws IOException {
    File file = fileFor(jobID);
    if (!file.isFile()) {
      return null;
    }
    JobStatus status = read(file);
    if (status == null || isExpired(status)) {
      delete(file);
      return null;
    }
    return status;
  }

  /**
   * Deletes all expired or unreadable statuses.
   *
   * @return number of statuses deleted
   */
  public int purgeExpired() throws IOException {
    File[] files = dir.listFiles(new FileFilter() {
      @Override
      public boolean accept(File file) {
        return file.isFile() && file.getName().endsWith(SUFFIX) && !file.getName().startsWith(".");
      }
    });
    if (files == null) {
      throw new IOException("Could not list " + dir);
    }
    int purged = 0;
    for (File file : files) {
      JobStatus status = read(file);
      if (status == null || isExpired(status)) {
        delete(file);
        purged++;
      }
    }
    if (purged > 0) {
      log.info("Purged {} expired job statuses", purged);
    }
    return purged;
  }

  private JobStatus read(File file) throws IOException {
    try {
      return mapper.readValue(file, JobStatus.class);
    } catch (JsonProcessingException jpe) {
      log.warn("Discarding unreadable job status {} ({})", file, jpe.toString());
      return null;
    }
  }

  private boolean isExpired(JobStatus status) {
    return clock.millis() - status.getUpdatedAt() > ttlMS;
  }

  private static void delete(File file) {
    if (file.exists() && !file.delete()) {
      log.warn("Could not delete {}", file);
    }
  }

  private File fileFor(String jobID) {
    Preconditions.checkArgument(JOB_ID_PATTERN.matcher(jobID).matches(), "Bad job ID: %s", jobID);
    return new File(dir, jobID + SUFFIX);
  }

}
