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

package net.contentrec.online.encoder;

import java.util.Arrays;

import org.junit.Test;

import net.contentrec.common.ContentRecTest;

public final class IDEncoderTest extends ContentRecTest {

  @Test
  public void testSortedIndices() {
    IDEncoder encoder = IDEncoder.fit(Arrays.asList("c", "a", "b", "a", "c"));
    assertEquals(3, encoder.size());
    assertEquals(0, encoder.encode("a"));
    assertEquals(1, encoder.encode("b"));
    assertEquals(2, encoder.encode("c"));
    assertEquals(Arrays.asList("a", "b", "c"), encoder.getIDs());
  }

  @Test
  public void testInverse() {
    IDEncoder encoder = IDEncoder.fit(Arrays.asList("user9", "user10", "user1"));
    for (String id : Arrays.asList("user9", "user10", "user1")) {
      assertEquals(id, encoder.inverse(encoder.encode(id)));
    }
  }

  @Test
  public void testUnknown() {
    IDEncoder encoder = IDEncoder.fit(Arrays.asList("a", "b"));
    assertEquals(IDEncoder.UNKNOWN, encoder.encode("z"));
    assertFalse(encoder.contains("z"));
    assertTrue(encoder.contains("a"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadInverse() {
    IDEncoder.fit(Arrays.asList("a", "b")).inverse(2);
  }

  @Test
  public void testFromOrderedIDs() {
    IDEncoder encoder = IDEncoder.fromOrderedIDs(Arrays.asList("z", "a"));
    assertEquals(0, encoder.encode("z"));
    assertEquals(1, encoder.encode("a"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateOrderedIDs() {
    IDEncoder.fromOrderedIDs(Arrays.asList("a", "b", "a"));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testIDsUnmodifiable() {
    IDEncoder.fit(Arrays.asList("a")).getIDs().set(0, "b");
  }

}
