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

package net.contentrec.common;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;
import org.junit.Test;

public final class TopNTest extends ContentRecTest {

  @Test
  public void testEmpty() {
    List<RankedItem> empty = Collections.emptyList();
    List<RankedItem> top2 = TopN.selectTopN(empty, 2);
    assertNotNull(top2);
    assertEquals(0, top2.size());
  }

  @Test
  public void testTopExactly() {
    List<RankedItem> top3 = TopN.selectTopN(makeNCandidates(3), 3);
    assertEquals(3, top3.size());
    assertEquals("3", top3.get(0).getContentID());
    assertEquals(3.0, top3.get(0).getValue());
    assertEquals("1", top3.get(2).getContentID());
  }

  @Test
  public void testTopOfMany() {
    List<RankedItem> top3 = TopN.selectTopN(makeNCandidates(20), 3);
    assertEquals(3, top3.size());
    assertEquals("20", top3.get(0).getContentID());
    assertEquals("18", top3.get(2).getContentID());
    assertEquals(18.0, top3.get(2).getValue());
  }

  @Test
  public void testNullsSkipped() {
    List<RankedItem> candidates = Arrays.asList(null, new RankedItem("a", 1.0), null);
    List<RankedItem> top = TopN.selectTopN(candidates, 5);
    assertEquals(1, top.size());
    assertEquals("a", top.get(0).getContentID());
  }

  @Test
  public void testTiesKeepStreamOrder() {
    List<RankedItem> candidates = Arrays.asList(
        new RankedItem("a", 2.0),
        new RankedItem("b", 3.0),
        new RankedItem("c", 2.0),
        new RankedItem("d", 3.0),
        new RankedItem("e", 2.0));
    List<RankedItem> top = TopN.selectTopN(candidates, 4);
    List<String> ids = Lists.newArrayList();
    for (RankedItem item : top) {
      ids.add(item.getContentID());
    }
    assertEquals(Arrays.asList("b", "d", "a", "c"), ids);
  }

  @Test
  public void testCloseValuesDistinguished() {
    List<RankedItem> candidates = Arrays.asList(
        new RankedItem("a", 5.0 - 1.0e-8),
        new RankedItem("b", 5.0),
        new RankedItem("c", 1.0e39));
    List<RankedItem> top = TopN.selectTopN(candidates, 2);
    assertEquals("c", top.get(0).getContentID());
    assertEquals("b", top.get(1).getContentID());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadN() {
    TopN.selectTopN(makeNCandidates(2), 0);
  }

  private static List<RankedItem> makeNCandidates(int n) {
    List<RankedItem> candidates = Lists.newArrayListWithCapacity(n);
    for (int i = 1; i <= n; i++) {
      candidates.add(new RankedItem(Integer.toString(i), i));
    }
    return candidates;
  }

}
