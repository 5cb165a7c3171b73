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

package net.contentrec.online.candidate;

/**
 * Excludes content from recommendation results, for example content that is unavailable in a region.
 * Implementations must be thread-safe.
 *
 * @author Sean Owen
 */
public interface CandidateFilter {

  /**
   * @param contentID candidate content
   * @return true if the content must not be recommended
   */
  boolean isFiltered(String contentID);

}
