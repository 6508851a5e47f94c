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
import com.eventhubs.client.amqp.AmqpLink;
import com.eventhubs.client.amqp.AmqpTransport;
import com.eventhubs.client.amqp.CancellationToken;
import com.eventhubs.client.amqp.LinkSettings;
import com.eventhubs.client.amqp.TransportConnection;
import com.eventhubs.client.amqp.TransportType;
import com.eventhubs.client.amqp.auth.Token;
import java.net.Proxy;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/** In-memory {@link AmqpTransport}, records what the scope asks for. */
class FakeTransport implements AmqpTransport {

  final AtomicInteger connectionCount = new AtomicInteger(0);
  final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
  final List<String> audiences = new CopyOnWriteArrayList<>();
  final List<FakeLink> links = new CopyOnWriteArrayList<>();
  final AtomicBoolean closed = new AtomicBoolean(false);

  volatile Duration connectionDelay = Duration.ZERO;
  volatile Supplier<RuntimeException> connectionFailure = () -> null;
  volatile Function<String, CompletableFuture<Void>> putTokenBehavior =
      audience -> CompletableFuture.completedFuture(null);
  volatile Supplier<CompletableFuture<Void>> linkAttach =
      () -> CompletableFuture.completedFuture(null);

  @Override
  public CompletableFuture<TransportConnection> openConnection(
      URI endpoint, TransportType transportType, Proxy proxy, String identifier, Duration timeout) {
    int index = this.connectionCount.getAndIncrement();
    RuntimeException failure = this.connectionFailure.get();
    if (failure != null) {
      return CompletableFuture.failedFuture(failure);
    }
    Supplier<TransportConnection> creation =
        () -> {
          FakeConnection c = new FakeConnection(identifier + "-" + index);
          this.connections.add(c);
          return c;
        };
    if (this.connectionDelay.isZero()) {
      return CompletableFuture.completedFuture(creation.get());
    } else {
      return CompletableFuture.supplyAsync(
          creation,
          CompletableFuture.delayedExecutor(
              this.connectionDelay.toMillis(), TimeUnit.MILLISECONDS));
    }
  }

  @Override
  public CompletableFuture<Void> putToken(
      TransportConnection connection, String audience, Token token, Duration timeout) {
    this.audiences.add(audience);
    return this.putTokenBehavior.apply(audience);
  }

  @Override
  public CompletableFuture<AmqpLink> openManagementLink(
      TransportConnection connection,
      LinkSettings settings,
      Duration timeout,
      CancellationToken cancellationToken) {
    return this.attach((FakeConnection) connection, settings, cancellationToken);
  }

  @Override
  public CompletableFuture<AmqpLink> openReceivingLink(
      TransportConnection connection,
      LinkSettings settings,
      Duration timeout,
      CancellationToken cancellationToken) {
    return this.attach((FakeConnection) connection, settings, cancellationToken);
  }

  private CompletableFuture<AmqpLink> attach(
      FakeConnection connection, LinkSettings settings, CancellationToken cancellationToken) {
    if (connection.isClosed()) {
      return CompletableFuture.failedFuture(
          new AmqpException.AmqpLinkException("Connection is closed", null));
    }
    CompletableFuture<AmqpLink> result = new CompletableFuture<>();
    CancellationToken.Registration registration =
        cancellationToken.onCancel(
            () -> result.completeExceptionally(new CancellationException("Attach cancelled")));
    this.linkAttach
        .get()
        .whenComplete(
            (ignored, ex) -> {
              registration.close();
              if (ex != null) {
                result.completeExceptionally(ex);
              } else {
                FakeLink link = new FakeLink(settings);
                this.links.add(link);
                if (!result.complete(link)) {
                  this.links.remove(link);
                }
              }
            });
    return result;
  }

  FakeLink link(int index) {
    return this.links.get(index);
  }

  @Override
  public void close() {
    this.closed.set(true);
  }

  static final class FakeConnection implements TransportConnection {

    private final String id;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    FakeConnection(String id) {
      this.id = id;
    }

    @Override
    public String id() {
      return this.id;
    }

    @Override
    public boolean isClosed() {
      return this.closed.get();
    }

    @Override
    public void close() {
      this.closed.set(true);
    }
  }

  static final class FakeLink implements AmqpLink {

    private final LinkSettings settings;
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private final AtomicInteger closeCount = new AtomicInteger(0);

    FakeLink(LinkSettings settings) {
      this.settings = settings;
    }

    @Override
    public String name() {
      return this.settings.name();
    }

    @Override
    public LinkSettings settings() {
      return this.settings;
    }

    @Override
    public boolean isClosed() {
      return this.closeFuture.isDone();
    }

    @Override
    public CompletableFuture<Void> closeFuture() {
      return this.closeFuture;
    }

    @Override
    public void close() {
      this.closeCount.incrementAndGet();
      this.closeFuture.complete(null);
    }

    /** Simulate a detach from the peer. */
    void remoteClose() {
      this.closeFuture.completeExceptionally(
          new AmqpException.AmqpLinkException("Link detached by peer", null));
    }

    int closeCount() {
      return this.closeCount.get();
    }
  }
}
