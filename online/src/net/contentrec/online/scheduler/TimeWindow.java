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

import com.google.common.base.Preconditions;

/**
 * A daily window of hours, {@code [startHour, endHour)}. When the start is after the end the window crosses
 * midnight, so that 22 to 6 contains 23:00 and 05:00 but not 06:00. Equal bounds mean the whole day.
 *
 * @author Sean Owen
 */
public final class TimeWindow {

  private final int startHour;
  private final int endHour;

  public TimeWindow(int startHour, int endHour) {
    Preconditions.checkArgument(startHour >= 0 && startHour < 24, "Bad start hour: %s", startHour);
    Preconditions.checkArgument(endHour >= 0 && endHour < 24, "Bad end hour: %s", endHour);
    this.startHour = startHour;
    this.endHour = endHour;
  }

  public int getStartHour() {
    return startHour;
  }

  public int getEndHour() {
    return endHour;
  }

  /**
   * @param hour hour of day, 0-23
   * @return true iff the hour falls in this window
   */
  public boolean contains(int hour) {
    Preconditions.checkArgument(hour >= 0 && hour < 24, "Bad hour: %s", hour);
    if (startHour == endHour) {
      return true;
    }
    if (startHour < endHour) {
      return hour >= startHour && hour < endHour;
    }
    return hour >= startHour || hour < endHour;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TimeWindow)) {
      return false;
    }
    TimeWindow other = (TimeWindow) o;
    return startHour == other.startHour && endHour == other.endHour;
  }

  @Override
  public int hashCode() {
    return 31 * startHour + endHour;
  }

  @Override
  public String toString() {
    return "[" + startHour + ":00," + endHour + ":00)";
  }

}
