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

package net.contentrec.online.catalog;

import java.io.Serializable;

import com.google.common.base.Preconditions;

import net.contentrec.common.LangUtils;

/**
 * A recommendable piece of content, with the popularity score used when no personalized ranking
 * is possible.
 *
 * @author Sean Owen
 */
public final class ContentItem implements Serializable {

  private final String contentID;
  private final double popularity;

  public ContentItem(String contentID, double popularity) {
    Preconditions.checkNotNull(contentID);
    Preconditions.checkArgument(LangUtils.isFinite(popularity), "Bad popularity: %s", popularity);
    this.contentID = contentID;
    this.popularity = popularity;
  }

  public String getContentID() {
    return contentID;
  }

  public double getPopularity() {
    return popularity;
  }

  @Override
  public String toString() {
    return "ContentItem[" + contentID + ", popularity:" + popularity + ']';
  }

}
