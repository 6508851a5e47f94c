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

import com.eventhubs.client.amqp.AmqpLink;
import com.eventhubs.client.amqp.LinkSettings;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.qpid.protonj2.client.Link;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AmqpLink} backed by protonj2 links: a receiver for consumer links, a sender/receiver
 * pair for management links.
 */
final class ProtonLink implements AmqpLink {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProtonLink.class);

  private final String name;
  private final LinkSettings settings;
  private final List<Link<?>> nativeLinks;
  private final ProtonConnection connection;
  private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  ProtonLink(LinkSettings settings, List<Link<?>> nativeLinks, ProtonConnection connection) {
    this.name = settings.name();
    this.settings = settings;
    this.nativeLinks = List.copyOf(nativeLinks);
    this.connection = connection;
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public LinkSettings settings() {
    return this.settings;
  }

  @Override
  public boolean isClosed() {
    return this.closed.get();
  }

  @Override
  public CompletableFuture<Void> closeFuture() {
    return this.closeFuture;
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing link '{}'", this.name);
      this.closeNativeLinks();
      this.connection.remove(this);
      this.closeFuture.complete(null);
    }
  }

  /**
   * Mark the link as closed after its connection is lost.
   *
   * @param cause the cause
   */
  void closed(Throwable cause) {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Link '{}' closed: {}", this.name, cause.getMessage());
      this.connection.remove(this);
      this.closeFuture.completeExceptionally(cause);
    }
  }

  private void closeNativeLinks() {
    for (Link<?> link : this.nativeLinks) {
      try {
        link.close();
      } catch (Exception e) {
        LOGGER.info("Error while closing native link of '{}': {}", this.name, e.getMessage());
      }
    }
  }

  @Override
  public String toString() {
    return this.name;
  }
}
