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

package net.contentrec.common.io;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple utility methods related to I/O.
 *
 * @author Sean Owen
 * @since 1.0
 */
public final class IOUtils {

  private static final Logger log = LoggerFactory.getLogger(IOUtils.class);

  private IOUtils() {
  }

  /**
   * Attempts to recursively delete a directory. This may not work across symlinks.
   *
   * @param dir directory to delete along with contents
   * @return {@code true} if all files and dirs were deleted successfully
   */
  public static boolean deleteRecursively(File dir) {
    if (dir == null) {
      return false;
    }
    Deque<File> stack = new ArrayDeque<File>();
    stack.push(dir);
    boolean result = true;
    while (!stack.isEmpty()) {
      File topElement = stack.peek();
      if (topElement.isDirectory()) {
        File[] directoryContents = topElement.listFiles();
        if (directoryContents != null && directoryContents.length > 0) {
          for (File fileOrSubDirectory : directoryContents) {
            stack.push(fileOrSubDirectory);
          }
        } else {
          result = stack.pop().delete() && result;
        }
      } else {
        result = stack.pop().delete() && result;
      }
    }
    return result;
  }

  /**
   * Opens an {@link InputStream} to the file. If its name ends in ".gz", it is decompressed.
   *
   * @param file file, possibly compressed, to open
   * @return {@link InputStream} on uncompressed contents
   * @throws IOException if the stream can't be opened or is invalid or can't be read
   */
  public static InputStream openMaybeDecompressing(File file) throws IOException {
    InputStream in = new FileInputStream(file);
    if (file.getName().endsWith(".gz")) {
      try {
        return new GZIPInputStream(in);
      } catch (IOException ioe) {
        in.close();
        throw ioe;
      }
    }
    return new BufferedInputStream(in);
  }

  /**
   * @return a {@link GZIPOutputStream} on the file, whose {@link OutputStream#flush()} flushes through
   */
  public static GZIPOutputStream buildGZIPOutputStream(File file) throws IOException {
    Preconditions.checkArgument(file.getName().endsWith(".gz"), "File should end in .gz: %s", file);
    return new GZIPOutputStream(new FileOutputStream(file), true);
  }

  /**
   * @return a buffered {@link OutputStream} on the file, replacing any existing contents
   */
  public static OutputStream buildBufferedOutputStream(File file) throws IOException {
    return new BufferedOutputStream(new FileOutputStream(file, false));
  }

  /**
   * Moves a file or directory so that the destination appears in one step, replacing any existing
   * file at the destination. Falls back to a non-atomic replace, with a warning, only where the file
   * system cannot do an atomic move.
   *
   * @param from file or directory to move
   * @param to destination
   * @throws IOException if the move fails
   */
  public static void moveAtomically(File from, File to) throws IOException {
    try {
      Files.move(from.toPath(), to.toPath(),
                 StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException amnse) {
      log.warn("Atomic move not supported from {} to {}; replacing non-atomically", from, to);
      Files.move(from.toPath(), to.toPath(), StandardCopyOption.REPLACE_EXISTING);
    }
  }

}
