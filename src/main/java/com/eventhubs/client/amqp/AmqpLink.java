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

import java.util.concurrent.CompletableFuture;

/**
 * An opened protocol link (management or consumer) multiplexed over the shared connection of a
 * {@link ConnectionScope}.
 *
 * <p>The link is unregistered from its scope as soon as it is closed, whether by the application,
 * by the broker, or by the scope closing.
 */
public interface AmqpLink extends AutoCloseable {

  /**
   * The name of the link.
   *
   * @return link name
   */
  String name();

  /**
   * The settings the link was opened with.
   *
   * @return link settings
   */
  LinkSettings settings();

  boolean isClosed();

  /**
   * Future completed once the link is closed.
   *
   * <p>The future completes exactly once, normally on a local close, exceptionally with the
   * cause of a remote close.
   *
   * @return the close notification
   */
  CompletableFuture<Void> closeFuture();

  /** Close the link. Does nothing if the link is already closed. */
  @Override
  void close();
}
