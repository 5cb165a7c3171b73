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

/**
 * Counts interactions recorded since the last successful retraining. Increments are at-least-once;
 * the count is not guaranteed to agree exactly with the {@link InteractionSource}.
 *
 * @author Sean Owen
 */
public interface InteractionCounter {

  void increment();

  /**
   * @return interactions counted since the last {@link #reset()}
   */
  long get();

  void reset();

}
