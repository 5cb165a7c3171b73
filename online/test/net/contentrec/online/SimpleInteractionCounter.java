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

package net.contentrec.online;

import java.util.concurrent.atomic.AtomicLong;

import net.contentrec.online.interaction.InteractionCounter;

public final class SimpleInteractionCounter implements InteractionCounter {

  private final AtomicLong count;

  public SimpleInteractionCounter(long initial) {
    count = new AtomicLong(initial);
  }

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

}
