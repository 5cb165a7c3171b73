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

import java.io.Serializable;

import com.google.common.base.Preconditions;

import net.contentrec.common.LangUtils;

/**
 * One recorded user / content interaction: a rating, like or view, with the strength of the signal
 * and the time it was recorded. Instances are immutable.
 *
 * @author Sean Owen
 */
public final class Interaction implements Serializable {

  private final String userID;
  private final String contentID;
  private final float value;
  private final long timestamp;

  /**
   * @param userID user who interacted
   * @param contentID content interacted with
   * @param value strength of the interaction, usually a 1-5 rating or a binarized implicit signal
   * @param timestamp when the interaction was recorded, in milliseconds since the epoch
   * @throws IllegalArgumentException if value is NaN or infinite
   */
  public Interaction(String userID, String contentID, float value, long timestamp) {
    Preconditions.checkNotNull(userID);
    Preconditions.checkNotNull(contentID);
    Preconditions.checkArgument(LangUtils.isFinite(value), "Bad value: %s", value);
    this.userID = userID;
    this.contentID = contentID;
    this.value = value;
    this.timestamp = timestamp;
  }

  public String getUserID() {
    return userID;
  }

  public String getContentID() {
    return contentID;
  }

  public float getValue() {
    return value;
  }

  public long getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return userID + ',' + contentID + ',' + value + ',' + timestamp;
  }

}
