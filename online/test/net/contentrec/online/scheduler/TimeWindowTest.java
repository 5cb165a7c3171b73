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

package net.contentrec.online.scheduler;

import org.junit.Test;

import net.contentrec.common.ContentRecTest;

public final class TimeWindowTest extends ContentRecTest {

  @Test
  public void testSameDay() {
    TimeWindow window = new TimeWindow(2, 5);
    assertFalse(window.contains(1));
    assertTrue(window.contains(2));
    assertTrue(window.contains(4));
    assertFalse(window.contains(5));
    assertFalse(window.contains(23));
  }

  @Test
  public void testAcrossMidnight() {
    TimeWindow window = new TimeWindow(22, 6);
    assertTrue(window.contains(23));
    assertTrue(window.contains(22));
    assertTrue(window.contains(0));
    assertTrue(window.contains(5));
    assertFalse(window.contains(6));
    assertFalse(window.contains(21));
    assertFalse(window.contains(12));
  }

  @Test
  public void testWholeDay() {
    TimeWindow window = new TimeWindow(3, 3);
    for (int hour = 0; hour < 24; hour++) {
      assertTrue(window.contains(hour));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadHour() {
    new TimeWindow(0, 24);
  }

}
