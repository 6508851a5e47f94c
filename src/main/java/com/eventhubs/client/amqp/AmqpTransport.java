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

import com.eventhubs.client.amqp.auth.Token;
import java.net.Proxy;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * The protocol engine used by a {@link ConnectionScope}.
 *
 * <p>Implementations deal with framing, sessions, and flow control. The scope only orchestrates
 * the lifecycle of the objects the transport creates. All the operations are asynchronous and
 * must complete the returned future exceptionally instead of throwing.
 */
public interface AmqpTransport extends AutoCloseable {

  /**
   * Open a connection.
   *
   * @param endpoint the service endpoint
   * @param transportType the transport type
   * @param proxy the proxy to use, can be <code>null</code>
   * @param identifier client identifier, sent as the container ID
   * @param timeout maximum time to open the connection
   * @return the opened connection
   */
  CompletableFuture<TransportConnection> openConnection(
      URI endpoint, TransportType transportType, Proxy proxy, String identifier, Duration timeout);

  /**
   * Put an authorization token on the claims-based-security node of the connection.
   *
   * @param connection the connection
   * @param audience the resource the token applies to
   * @param token the token
   * @param timeout maximum time to wait for the response of the broker
   * @return a future completed once the broker accepted the token
   */
  CompletableFuture<Void> putToken(
      TransportConnection connection, String audience, Token token, Duration timeout);

  /**
   * Open a management link on the connection.
   *
   * @param connection the connection
   * @param settings the link settings
   * @param timeout maximum time for the attach handshake
   * @param cancellationToken cancellation signal
   * @return the opened link
   */
  CompletableFuture<AmqpLink> openManagementLink(
      TransportConnection connection,
      LinkSettings settings,
      Duration timeout,
      CancellationToken cancellationToken);

  /**
   * Open a receiving link on the connection.
   *
   * @param connection the connection
   * @param settings the link settings (source address, filters, credit window, properties)
   * @param timeout maximum time for the attach handshake
   * @param cancellationToken cancellation signal
   * @return the opened link
   */
  CompletableFuture<AmqpLink> openReceivingLink(
      TransportConnection connection,
      LinkSettings settings,
      Duration timeout,
      CancellationToken cancellationToken);

  /** Release the resources of the transport. */
  @Override
  void close();
}
