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

/** A transport connection opened by an {@link AmqpTransport}. */
public interface TransportConnection extends AutoCloseable {

  /**
   * Identifier of the connection, for logging.
   *
   * @return the identifier
   */
  String id();

  /**
   * Whether the connection is closed, locally or by the peer.
   *
   * <p>A closed connection is never reused, the next link request creates a new one.
   *
   * @return true if the connection is closed
   */
  boolean isClosed();

  @Override
  void close();
}
