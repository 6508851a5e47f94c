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

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Lifecycle manager of the AMQP connection and links of a client.
 *
 * <p>A scope lazily opens one shared connection and multiplexes the links it opens over it. The
 * connection is re-created transparently if it is found closed. Links that need claims-based
 * authorization get it renewed before it expires, for as long as they stay open.
 *
 * <p>Argument validation, closed-scope, and already-cancelled checks fail synchronously. Failures
 * that happen once the operation is in flight complete the returned future exceptionally: with a
 * {@link java.util.concurrent.CancellationException} if a token is cancelled, with an {@link
 * AmqpException.AmqpResourceClosedException} if the scope is closed concurrently, with the error
 * of the transport otherwise.
 *
 * <p>Instances are thread-safe.
 *
 * @see com.eventhubs.client.amqp.impl.AmqpConnectionScopeBuilder
 */
public interface ConnectionScope extends AutoCloseable {

  /**
   * Open a management link.
   *
   * <p>Each call opens a new link. Management links get no authorization renewal.
   *
   * @param timeout maximum time for the whole operation
   * @param cancellationToken cancellation signal
   * @return the opened link
   * @throws AmqpException.AmqpResourceClosedException if the scope is closed
   * @throws java.util.concurrent.CancellationException if the token is cancelled
   */
  CompletableFuture<AmqpLink> openManagementLink(
      Duration timeout, CancellationToken cancellationToken);

  /**
   * Open a link to receive events from a partition.
   *
   * @param consumerGroup the consumer group, cannot be blank
   * @param partitionId the partition, cannot be blank
   * @param position the position to start reading from
   * @param options consumer options
   * @param timeout maximum time for the whole operation
   * @param cancellationToken cancellation signal
   * @return the opened link
   * @throws IllegalArgumentException if an argument is invalid
   * @throws AmqpException.AmqpResourceClosedException if the scope is closed
   * @throws java.util.concurrent.CancellationException if the token is cancelled
   */
  CompletableFuture<AmqpLink> openConsumerLink(
      String consumerGroup,
      String partitionId,
      EventPosition position,
      ConsumerOptions options,
      Duration timeout,
      CancellationToken cancellationToken);

  /**
   * Close the scope.
   *
   * <p>Cancel the pending operations, close all the links, then the connection. Does nothing if
   * the scope is already closed.
   */
  @Override
  void close();

  boolean isClosed();

  String identifier();

  URI serviceEndpoint();

  String entityName();

  TransportType transportType();
}
