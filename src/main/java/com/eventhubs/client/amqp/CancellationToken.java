// Copyright (c) 2024 The Event Hubs AMQP Java Client Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package com.eventhubs.client.amqp;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation signal.
 *
 * <p>A token is cancelled at most once. Callbacks registered with {@link #onCancel(Runnable)} run
 * once, on the thread calling {@link #cancel()}, or immediately if the token is already
 * cancelled.
 *
 * <p>Instances are thread-safe.
 */
public final class CancellationToken {

  private static final Logger LOGGER = LoggerFactory.getLogger(CancellationToken.class);

  private static final CancellationToken NONE = new CancellationToken(false);

  private final boolean cancellable;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final Map<Long, Runnable> callbacks = new ConcurrentHashMap<>();
  private final AtomicLong callbackSequence = new AtomicLong(0);

  public CancellationToken() {
    this(true);
  }

  private CancellationToken(boolean cancellable) {
    this.cancellable = cancellable;
  }

  /**
   * A token that is never cancelled.
   *
   * @return the token
   */
  public static CancellationToken none() {
    return NONE;
  }

  /**
   * Request cancellation.
   *
   * @return true if this call cancelled the token, false if it was already cancelled
   */
  public boolean cancel() {
    if (!this.cancellable) {
      throw new UnsupportedOperationException("This token cannot be cancelled");
    }
    if (this.cancelled.compareAndSet(false, true)) {
      for (Long id : this.callbacks.keySet()) {
        Runnable callback = this.callbacks.remove(id);
        if (callback != null) {
          run(callback);
        }
      }
      return true;
    } else {
      return false;
    }
  }

  public boolean isCancelled() {
    return this.cancelled.get();
  }

  /**
   * Throw a {@link CancellationException} if the token is cancelled.
   *
   * @throws CancellationException if the token is cancelled
   */
  public void throwIfCancelled() {
    if (this.isCancelled()) {
      throw new CancellationException("The operation has been cancelled");
    }
  }

  /**
   * Register a callback to run on cancellation.
   *
   * @param callback the callback
   * @return the registration, to close once the callback is not needed anymore
   */
  public Registration onCancel(Runnable callback) {
    if (!this.cancellable) {
      return Registration.NO_OP;
    }
    long id = this.callbackSequence.getAndIncrement();
    this.callbacks.put(id, callback);
    // cancel() may have run between the put and now
    if (this.cancelled.get()) {
      Runnable registered = this.callbacks.remove(id);
      if (registered != null) {
        run(registered);
      }
      return Registration.NO_OP;
    }
    return () -> this.callbacks.remove(id);
  }

  private static void run(Runnable callback) {
    try {
      callback.run();
    } catch (Exception e) {
      LOGGER.warn("Error in cancellation callback", e);
    }
  }

  @Override
  public String toString() {
    return "CancellationToken{cancelled=" + this.cancelled.get() + "}";
  }

  /** A callback registration. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {

    Registration NO_OP = () -> {};

    /** Remove the callback, does nothing if it already ran. */
    @Override
    void close();
  }
}
