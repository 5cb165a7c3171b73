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

package net.contentrec.online.interaction;

import java.util.List;

import org.junit.Test;

import net.contentrec.common.ContentRecTest;

public final class InMemoryInteractionStoreTest extends ContentRecTest {

  @Test
  public void testRecordCounts() {
    AtomicInteractionCounter counter = new AtomicInteractionCounter();
    InMemoryInteractionStore store = new InMemoryInteractionStore(counter);
    store.record(new Interaction("u1", "c1", 1.0f, 10L));
    store.record(new Interaction("u2", "c1", 1.0f, 20L));
    assertEquals(2, store.size());
    assertEquals(2L, counter.get());
    counter.reset();
    assertEquals(0L, counter.get());
  }

  @Test
  public void testQueryRecent() {
    InMemoryInteractionStore store = new InMemoryInteractionStore(null);
    store.record(new Interaction("u1", "c1", 1.0f, 30L));
    store.record(new Interaction("u1", "c2", 1.0f, 10L));
    store.record(new Interaction("u2", "c3", 1.0f, 20L));
    store.record(new Interaction("u2", "c4", 1.0f, 30L));

    List<Interaction> recent = store.queryRecent(3);
    assertEquals(3, recent.size());
    assertEquals("c4", recent.get(0).getContentID());
    assertEquals("c1", recent.get(1).getContentID());
    assertEquals("c3", recent.get(2).getContentID());
    assertEquals(4, store.queryRecent(100).size());
  }

  @Test
  public void testQueryByUser() {
    InMemoryInteractionStore store = new InMemoryInteractionStore(null);
    store.record(new Interaction("u1", "c1", 5.0f, 1L));
    store.record(new Interaction("u2", "c2", 3.0f, 2L));
    store.record(new Interaction("u1", "c3", 2.0f, 3L));
    List<Interaction> byUser = store.queryByUser("u1");
    assertEquals(2, byUser.size());
    assertEquals("c1", byUser.get(0).getContentID());
    assertEquals("c3", byUser.get(1).getContentID());
    assertTrue(store.queryByUser("nobody").isEmpty());
    byUser.clear();
    store.record(new Interaction("u1", "c4", 1.0f, 4L));
    assertEquals(3, store.queryByUser("u1").size());
  }

}
