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
package com.eventhubs.client.amqp.impl;

import com.eventhubs.client.amqp.AmqpException;
import com.eventhubs.client.amqp.TransportConnection;
import com.eventhubs.client.amqp.metrics.MetricsCollector;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of the shared connection of a scope.
 *
 * <p>The connection is created on first demand. Concurrent callers during the creation share it.
 * A connection found closed, or a creation that failed, is replaced on the next call. Creation
 * failures are not retried.
 */
final class FaultTolerantConnection implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(FaultTolerantConnection.class);

  private final Function<Duration, CompletableFuture<TransportConnection>> connectionFactory;
  private final MetricsCollector metricsCollector;
  private final AtomicReference<CompletableFuture<TransportConnection>> connection =
      new AtomicReference<>();
  private final Lock instanceLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  FaultTolerantConnection(
      Function<Duration, CompletableFuture<TransportConnection>> connectionFactory,
      MetricsCollector metricsCollector) {
    this.connectionFactory = connectionFactory;
    this.metricsCollector = metricsCollector;
  }

  /**
   * Return the current connection, create it if it does not exist or if it is closed.
   *
   * <p>The returned future is a copy of the shared one, completing it does not affect the other
   * callers.
   *
   * @param timeout timeout to open the connection, if it has to be created
   * @return the connection
   */
  CompletableFuture<TransportConnection> getOrCreate(Duration timeout) {
    if (this.closed.get()) {
      return closedFailure();
    }
    CompletableFuture<TransportConnection> result = this.connection.get();
    if (usable(result)) {
      return result.copy();
    }

    this.instanceLock.lock();
    try {
      if (this.closed.get()) {
        return closedFailure();
      }
      result = this.connection.get();
      if (!usable(result)) {
        if (result != null) {
          this.release(result);
        }
        result = this.create(timeout);
      }
      return result.copy();
    } finally {
      this.instanceLock.unlock();
    }
  }

  private CompletableFuture<TransportConnection> create(Duration timeout) {
    LOGGER.debug("Creating connection");
    CompletableFuture<TransportConnection> created;
    try {
      created = this.connectionFactory.apply(timeout);
    } catch (Exception e) {
      created = CompletableFuture.failedFuture(e);
    }
    this.connection.set(created);
    CompletableFuture<TransportConnection> creation = created;
    created.whenComplete(
        (c, ex) -> {
          if (ex == null) {
            LOGGER.debug("Connection {} created", c.id());
            this.metricsCollector.openConnection();
          } else {
            LOGGER.debug("Connection creation failed: {}", ex.getMessage());
            this.connection.compareAndSet(creation, null);
          }
        });
    return created;
  }

  private static boolean usable(CompletableFuture<TransportConnection> future) {
    if (future == null) {
      return false;
    } else if (!future.isDone()) {
      // creation in progress
      return true;
    } else if (future.isCompletedExceptionally()) {
      return false;
    } else {
      return !future.join().isClosed();
    }
  }

  private void release(CompletableFuture<TransportConnection> future) {
    if (future.isDone() && !future.isCompletedExceptionally()) {
      TransportConnection c = future.join();
      LOGGER.debug("Connection {} is closed, replacing it", c.id());
      this.metricsCollector.closeConnection();
    }
  }

  /**
   * The current connection, if created and open.
   *
   * @return the connection, <code>null</code> otherwise
   */
  TransportConnection current() {
    CompletableFuture<TransportConnection> future = this.connection.get();
    if (future != null && future.isDone() && !future.isCompletedExceptionally()) {
      TransportConnection c = future.join();
      return c.isClosed() ? null : c;
    } else {
      return null;
    }
  }

  /**
   * Close the connection, if created. Subsequent calls to {@link #getOrCreate(Duration)} fail.
   *
   * <p>A connection still being created is closed once its creation completes.
   */
  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      CompletableFuture<TransportConnection> future;
      this.instanceLock.lock();
      try {
        future = this.connection.getAndSet(null);
      } finally {
        this.instanceLock.unlock();
      }
      if (future != null) {
        future.whenComplete(
            (c, ex) -> {
              if (c != null) {
                LOGGER.debug("Closing connection {}", c.id());
                try {
                  c.close();
                } catch (Exception e) {
                  LOGGER.warn("Error while closing connection {}", c.id(), e);
                }
                this.metricsCollector.closeConnection();
              }
            });
      }
    }
  }

  boolean isClosed() {
    return this.closed.get();
  }

  private static CompletableFuture<TransportConnection> closedFailure() {
    return CompletableFuture.failedFuture(
        new AmqpException.AmqpResourceClosedException("The connection scope is closed"));
  }
}
