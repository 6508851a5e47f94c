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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.qpid.protonj2.client.Client;
import org.apache.qpid.protonj2.client.Connection;
import org.apache.qpid.protonj2.client.Session;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link TransportConnection} backed by a protonj2 connection. */
final class ProtonConnection implements TransportConnection {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProtonConnection.class);

  private final String id;
  private final Client client;
  private volatile Connection nativeConnection;
  private volatile Session nativeSession;
  private volatile ProtonCbsLink cbsLink;
  private final Set<ProtonLink> links = ConcurrentHashMap.newKeySet();
  private final Lock instanceLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  ProtonConnection(String id, Client client) {
    this.id = id;
    this.client = client;
  }

  void nativeConnection(Connection connection) {
    this.nativeConnection = connection;
  }

  @Override
  public String id() {
    return this.id;
  }

  @Override
  public boolean isClosed() {
    return this.closed.get();
  }

  Session nativeSession() {
    checkOpen();
    Session result = this.nativeSession;
    if (result != null) {
      return result;
    }

    this.instanceLock.lock();
    try {
      if (this.nativeSession == null) {
        this.nativeSession = this.nativeConnection.openSession();
      }
      return this.nativeSession;
    } catch (ClientException e) {
      throw ExceptionUtils.convert(e, "Error while opening session on connection %s", this.id);
    } finally {
      this.instanceLock.unlock();
    }
  }

  ProtonCbsLink cbsLink(Duration timeout) {
    checkOpen();
    ProtonCbsLink result = this.cbsLink;
    if (result != null) {
      return result;
    }

    Session session = this.nativeSession();
    this.instanceLock.lock();
    try {
      if (this.cbsLink == null) {
        this.cbsLink = ProtonCbsLink.open(session, timeout);
      }
      return this.cbsLink;
    } catch (ClientException e) {
      throw ExceptionUtils.convert(e, "Error while opening CBS link on connection %s", this.id);
    } finally {
      this.instanceLock.unlock();
    }
  }

  void add(ProtonLink link) {
    this.links.add(link);
    if (this.closed.get()) {
      link.closed(new AmqpException.AmqpConnectionException("Connection " + id + " closed", null));
    }
  }

  void remove(ProtonLink link) {
    this.links.remove(link);
  }

  /**
   * Called by protonj2 when the connection is lost.
   *
   * @param cause the cause
   */
  void disconnected(Throwable cause) {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Connection {} lost: {}", this.id, cause == null ? "" : cause.getMessage());
      AmqpException failure =
          new AmqpException.AmqpConnectionException("Connection " + this.id + " lost", cause);
      for (ProtonLink link : new ArrayList<>(this.links)) {
        link.closed(failure);
      }
      this.releaseNativeResources();
    }
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing connection {}", this.id);
      List<ProtonLink> snapshot = new ArrayList<>(this.links);
      for (ProtonLink link : snapshot) {
        link.close();
      }
      this.releaseNativeResources();
      LOGGER.debug("Connection {} has been closed", this.id);
    }
  }

  private void releaseNativeResources() {
    Utils.maybeClose(
        this.cbsLink, e -> LOGGER.info("Error while closing CBS link: {}", e.getMessage()));
    Utils.maybeClose(
        this.nativeConnection,
        e -> LOGGER.warn("Error while closing native connection {}", this.id, e));
    Utils.maybeClose(
        this.client, e -> LOGGER.info("Error while closing client of {}: {}", id, e.getMessage()));
  }

  private void checkOpen() {
    if (this.closed.get()) {
      throw new AmqpException.AmqpResourceClosedException("Connection " + this.id + " is closed");
    }
  }

  @Override
  public String toString() {
    return this.id;
  }
}
