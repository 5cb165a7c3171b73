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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import net.contentrec.online.interaction.Interaction;
import net.contentrec.online.interaction.InteractionSource;

/**
 * Wraps another {@link InteractionSource}, holding {@link #queryRecent(int)} calls until {@link #release()}.
 */
public final class BlockingInteractionSource implements InteractionSource {

  private final InteractionSource delegate;
  private final CountDownLatch entered;
  private final CountDownLatch released;

  public BlockingInteractionSource(InteractionSource delegate) {
    this.delegate = delegate;
    this.entered = new CountDownLatch(1);
    this.released = new CountDownLatch(1);
  }

  @Override
  public List<Interaction> queryRecent(int limit) throws IOException {
    entered.countDown();
    try {
      released.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while blocked");
    }
    return delegate.queryRecent(limit);
  }

  @Override
  public List<Interaction> queryByUser(String userID) throws IOException {
    return delegate.queryByUser(userID);
  }

  public void awaitEntered() throws InterruptedException {
    entered.await();
  }

  public void release() {
    released.countDown();
  }

}
