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

import java.io.IOException;
import java.util.List;

/**
 * Read side of the store that records {@link Interaction}s. How interactions are stored is up to the
 * implementation; only these queries are needed for training and serving.
 *
 * @author Sean Owen
 */
public interface InteractionSource {

  /**
   * @param limit maximum number of interactions to return
   * @return up to {@code limit} interactions, most recent first
   * @throws IOException if the store can't be read
   */
  List<Interaction> queryRecent(int limit) throws IOException;

  /**
   * @param userID user whose history is requested
   * @return all interactions recorded for the user, in any order; empty if none
   * @throws IOException if the store can't be read
   */
  List<Interaction> queryByUser(String userID) throws IOException;

}
