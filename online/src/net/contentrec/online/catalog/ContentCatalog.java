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

import java.io.IOException;
import java.util.List;

/**
 * Supplies all known {@link ContentItem}s.
 *
 * @author Sean Owen
 */
public interface ContentCatalog {

  /**
   * @return all known items, in the order in which the catalog encountered them
   * @throws IOException if the catalog can't be read
   */
  List<ContentItem> getItems() throws IOException;

}
