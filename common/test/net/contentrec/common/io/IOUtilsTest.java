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

import java.io.File;
import java.io.IOException;

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import org.junit.Test;

import net.contentrec.common.ContentRecTest;

public final class IOUtilsTest extends ContentRecTest {

  @Test
  public void testDeleteRecursively() throws IOException {
    File root = new File(getTestTempDir(), "root");
    File child = new File(root, "child");
    assertTrue(child.mkdirs());
    Files.asCharSink(new File(child, "a.txt"), Charsets.UTF_8).write("a");
    Files.asCharSink(new File(root, "b.txt"), Charsets.UTF_8).write("b");
    assertTrue(IOUtils.deleteRecursively(root));
    assertFalse(root.exists());
  }

  @Test
  public void testMoveAtomicallyReplaces() throws IOException {
    File from = new File(getTestTempDir(), "from.txt");
    File to = new File(getTestTempDir(), "to.txt");
    Files.asCharSink(from, Charsets.UTF_8).write("new");
    Files.asCharSink(to, Charsets.UTF_8).write("old");
    IOUtils.moveAtomically(from, to);
    assertFalse(from.exists());
    assertEquals("new", Files.asCharSource(to, Charsets.UTF_8).read());
  }

}
