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

import java.util.concurrent.atomic.AtomicLong;

/**
 * An {@link InteractionCounter} held in memory.
 *
 * @author Sean Owen
 */
public final class AtomicInteractionCounter implements InteractionCounter {

  private final AtomicLong count = new AtomicLong();

  @Override
  public void increment() {
    count.incrementAndGet();
  }

  @Override
  public long get() {
    return count.get();
  }

  @Override
  public void reset() {
    count.set(0L);
  }

  @Override
  public String toString() {
    return String.valueOf(count.get());
  }

}
