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

import java.io.Serializable;

import com.google.common.base.Preconditions;

/**
 * A content ID together with the score that ranked it, as returned from recommendation requests.
 *
 * @author Sean Owen
 */
public final class RankedItem implements Serializable {

  private final String contentID;
  private final double value;

  /**
   * @throws IllegalArgumentException if value is NaN or infinite
   */
  public RankedItem(String contentID, double value) {
    Preconditions.checkNotNull(contentID);
    Preconditions.checkArgument(LangUtils.isFinite(value), "Bad value: %s", value);
    this.contentID = contentID;
    this.value = value;
  }

  public String getContentID() {
    return contentID;
  }

  public double getValue() {
    return value;
  }

  @Override
  public String toString() {
    return "RankedItem[content:" + contentID + ", value:" + value + ']';
  }

  @Override
  public int hashCode() {
    long bits = Double.doubleToLongBits(value);
    return contentID.hashCode() ^ (int) (bits ^ (bits >>> 32));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof RankedItem)) {
      return false;
    }
    RankedItem other = (RankedItem) o;
    return contentID.equals(other.getContentID()) && value == other.getValue();
  }

}
