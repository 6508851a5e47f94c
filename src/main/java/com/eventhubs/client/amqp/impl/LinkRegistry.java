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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Active links of a connection scope, with their authorization refresh timer.
 *
 * <p>Links that need no renewal are registered with {@link AuthorizationRefreshTimer#NONE}. An
 * entry is removed when its link reports it is closed, or when the registry closes all its links.
 * Removal is atomic, so the timer of a link is disposed and the unregistration callback runs
 * exactly once, even if the two paths race.
 */
final class LinkRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(LinkRegistry.class);

  private final Map<AmqpLink, Entry> links = new ConcurrentHashMap<>();

  /**
   * Track a link.
   *
   * <p>The link is unregistered as soon as its close future completes, immediately if the link is
   * already closed.
   *
   * @param link the link
   * @param timer the refresh timer of the link
   * @param onUnregistered called once the link is unregistered
   * @return false if the link was already registered, the given timer is then disposed
   */
  boolean register(AmqpLink link, AuthorizationRefreshTimer timer, Runnable onUnregistered) {
    Entry entry = new Entry(timer, onUnregistered);
    if (this.links.putIfAbsent(link, entry) != null) {
      timer.dispose();
      return false;
    }
    LOGGER.debug("Link '{}' registered ({})", link.name(), timer);
    link.closeFuture().whenComplete((ignored, ex) -> this.unregister(link));
    return true;
  }

  /**
   * Stop tracking a link and dispose its timer. Does nothing if the link is not registered.
   *
   * @param link the link
   * @return true if this call removed the link
   */
  boolean unregister(AmqpLink link) {
    Entry entry = this.links.remove(link);
    if (entry == null) {
      return false;
    }
    entry.timer.dispose();
    try {
      entry.onUnregistered.run();
    } catch (Exception e) {
      LOGGER.info("Error in unregistration callback of link '{}': {}", link.name(), e.getMessage());
    }
    LOGGER.debug("Link '{}' unregistered", link.name());
    return true;
  }

  /** Close all the registered links and dispose their timer. */
  void closeAll() {
    List<AmqpLink> snapshot = new ArrayList<>(this.links.keySet());
    for (AmqpLink link : snapshot) {
      try {
        link.close();
      } catch (Exception e) {
        LOGGER.info("Error while closing link '{}': {}", link.name(), e.getMessage());
      }
      this.unregister(link);
    }
  }

  boolean contains(AmqpLink link) {
    return this.links.containsKey(link);
  }

  /**
   * The timer of a link.
   *
   * @param link the link
   * @return the timer, <code>null</code> if the link is not registered
   */
  AuthorizationRefreshTimer timer(AmqpLink link) {
    Entry entry = this.links.get(link);
    return entry == null ? null : entry.timer;
  }

  int size() {
    return this.links.size();
  }

  boolean isEmpty() {
    return this.links.isEmpty();
  }

  private static final class Entry {

    private final AuthorizationRefreshTimer timer;
    private final Runnable onUnregistered;

    private Entry(AuthorizationRefreshTimer timer, Runnable onUnregistered) {
      this.timer = timer;
      this.onUnregistered = onUnregistered;
    }
  }
}
