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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.apache.qpid.protonj2.client.Client;
import org.apache.qpid.protonj2.client.ClientOptions;
import org.apache.qpid.protonj2.client.Connection;
import org.apache.qpid.protonj2.client.ConnectionOptions;
import org.apache.qpid.protonj2.client.DeliveryMode;
import org.apache.qpid.protonj2.client.Link;
import org.apache.qpid.protonj2.client.Receiver;
import org.apache.qpid.protonj2.client.ReceiverOptions;
import org.apache.qpid.protonj2.client.Sender;
import org.apache.qpid.protonj2.client.SenderOptions;
import org.apache.qpid.protonj2.client.Session;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.apache.qpid.protonj2.types.Symbol;
import org.apache.qpid.protonj2.types.UnknownDescribedType;
import org.apache.qpid.protonj2.types.UnsignedInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AmqpTransport} implementation based on <a
 * href="https://qpid.apache.org/proton/">Apache Qpid protonj2</a>.
 *
 * <p>TLS is used for the <code>amqps</code> and <code>sb</code> schemes, and for WebSockets.
 * Authorization is claims-based, connections use SASL ANONYMOUS. protonj2 calls block, they run
 * on an executor service.
 *
 * <p>Proxies are not supported.
 */
public class ProtonTransport implements AmqpTransport {

  static final String WEB_SOCKET_PATH = "/$servicebus/websocket";
  static final int AMQP_PORT = 5672;
  static final int AMQPS_PORT = 5671;
  static final int WEB_SOCKET_PORT = 443;

  private static final Logger LOGGER = LoggerFactory.getLogger(ProtonTransport.class);
  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);
  private static final int DEFAULT_MANAGEMENT_CREDIT_WINDOW = 100;

  private final ExecutorService executorService;
  private final boolean internalExecutor;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public ProtonTransport() {
    this(null);
  }

  /**
   * Create a transport using the given executor service for blocking protonj2 calls.
   *
   * <p>It is the developer's responsibility to shut down the executor when it is no longer needed.
   *
   * @param executorService the executor service, an internal one is used if <code>null</code>
   */
  public ProtonTransport(ExecutorService executorService) {
    if (executorService == null) {
      this.executorService =
          Executors.newCachedThreadPool(Utils.threadFactory("eventhubs-amqp-transport-"));
      this.internalExecutor = true;
    } else {
      this.executorService = executorService;
      this.internalExecutor = false;
    }
  }

  @Override
  public CompletableFuture<TransportConnection> openConnection(
      URI endpoint, TransportType transportType, Proxy proxy, String identifier, Duration timeout) {
    return this.execute(() -> this.connect(endpoint, transportType, proxy, identifier, timeout));
  }

  private TransportConnection connect(
      URI endpoint, TransportType transportType, Proxy proxy, String identifier, Duration timeout) {
    if (proxy != null && proxy.type() != Proxy.Type.DIRECT) {
      throw new AmqpException.AmqpConnectionException(
          "Proxies are not supported by " + this.getClass().getSimpleName(), null);
    }
    boolean webSockets = transportType == TransportType.AMQP_WEB_SOCKETS;
    String scheme = endpoint.getScheme();
    boolean tls = webSockets || "amqps".equals(scheme) || "sb".equals(scheme);
    int port = endpoint.getPort();
    if (port == -1) {
      port = webSockets ? WEB_SOCKET_PORT : (tls ? AMQPS_PORT : AMQP_PORT);
    }

    String id = identifier + "-" + ID_SEQUENCE.getAndIncrement();
    Client client = Client.create(new ClientOptions().id(identifier));
    ProtonConnection connection = new ProtonConnection(id, client);

    ConnectionOptions connectionOptions = new ConnectionOptions();
    connectionOptions.saslOptions().addAllowedMechanism("ANONYMOUS");
    connectionOptions.properties(ClientProperties.DEFAULT_CLIENT_PROPERTIES);
    connectionOptions.openTimeout(timeout.toMillis(), MILLISECONDS);
    connectionOptions.disconnectedHandler(
        (c, event) -> connection.disconnected(event.failureCause()));
    if (tls) {
      connectionOptions.sslEnabled(true);
    }
    if (webSockets) {
      connectionOptions.transportOptions().useWebSockets(true).webSocketPath(WEB_SOCKET_PATH);
    }

    Utils.StopWatch stopWatch = new Utils.StopWatch();
    try {
      LOGGER.trace("Connecting '{}' to {}:{}...", id, endpoint.getHost(), port);
      Connection nativeConnection = client.connect(endpoint.getHost(), port, connectionOptions);
      connection.nativeConnection(nativeConnection);
      ExceptionUtils.wrapGet(nativeConnection.openFuture());
      LOGGER.debug("Connection attempt '{}' succeeded", id);
      return connection;
    } catch (ClientException e) {
      connection.close();
      AmqpException ex = ExceptionUtils.convert(e, "Error while opening connection %s", id);
      if (ex.getClass() == AmqpException.class) {
        ex = new AmqpException.AmqpConnectionException(ex.getMessage(), e);
      }
      throw ex;
    } catch (RuntimeException e) {
      connection.close();
      throw e;
    } finally {
      LOGGER.debug("Connection attempt for '{}' took {}", id, stopWatch.stop());
    }
  }

  @Override
  public CompletableFuture<Void> putToken(
      TransportConnection connection, String audience, Token token, Duration timeout) {
    ProtonConnection c = protonConnection(connection);
    return this.execute(
        () -> {
          c.cbsLink(timeout).putToken(audience, token, timeout);
          return null;
        });
  }

  @Override
  public CompletableFuture<AmqpLink> openManagementLink(
      TransportConnection connection,
      LinkSettings settings,
      Duration timeout,
      CancellationToken cancellationToken) {
    ProtonConnection c = protonConnection(connection);
    return this.execute(
        () -> {
          Session session = c.nativeSession();
          Map<String, Object> properties = new LinkedHashMap<>(nativeProperties(settings));
          properties.put("paired", Boolean.TRUE);
          int creditWindow =
              settings.creditWindow() > 0
                  ? settings.creditWindow()
                  : DEFAULT_MANAGEMENT_CREDIT_WINDOW;
          Sender sender = null;
          Receiver receiver = null;
          try {
            sender =
                session.openSender(
                    settings.address(),
                    new SenderOptions()
                        .deliveryMode(DeliveryMode.AT_MOST_ONCE)
                        .linkName(settings.name())
                        .properties(properties)
                        .openTimeout(timeout.toMillis(), MILLISECONDS));
            receiver =
                session.openReceiver(
                    settings.address(),
                    new ReceiverOptions()
                        .deliveryMode(DeliveryMode.AT_MOST_ONCE)
                        .linkName(settings.name())
                        .properties(properties)
                        .creditWindow(creditWindow)
                        .openTimeout(timeout.toMillis(), MILLISECONDS));
            List<Link<?>> links = List.of(sender, receiver);
            this.attach(settings, links, cancellationToken);
            return register(c, new ProtonLink(settings, links, c));
          } catch (ClientException e) {
            closeQuietly(sender, receiver);
            throw linkException(e, settings);
          } catch (RuntimeException e) {
            closeQuietly(sender, receiver);
            throw e;
          }
        });
  }

  @Override
  public CompletableFuture<AmqpLink> openReceivingLink(
      TransportConnection connection,
      LinkSettings settings,
      Duration timeout,
      CancellationToken cancellationToken) {
    ProtonConnection c = protonConnection(connection);
    return this.execute(
        () -> {
          Session session = c.nativeSession();
          ReceiverOptions receiverOptions =
              new ReceiverOptions()
                  .deliveryMode(DeliveryMode.AT_MOST_ONCE)
                  .linkName(settings.name())
                  .creditWindow(settings.creditWindow())
                  .properties(nativeProperties(settings))
                  .openTimeout(timeout.toMillis(), MILLISECONDS);
          if (!settings.desiredCapabilities().isEmpty()) {
            receiverOptions.desiredCapabilities(
                settings.desiredCapabilities().toArray(new String[0]));
          }
          if (!settings.filters().isEmpty()) {
            Map<String, Object> filters = new LinkedHashMap<>();
            settings
                .filters()
                .forEach(
                    (name, filter) ->
                        filters.put(
                            name,
                            new UnknownDescribedType(
                                Symbol.valueOf(filter.descriptor()), filter.value())));
            receiverOptions.sourceOptions().filters(filters);
          }
          Receiver receiver = null;
          try {
            receiver = session.openReceiver(settings.address(), receiverOptions);
            List<Link<?>> links = List.of(receiver);
            this.attach(settings, links, cancellationToken);
            return register(c, new ProtonLink(settings, links, c));
          } catch (ClientException e) {
            closeQuietly(receiver);
            throw linkException(e, settings);
          } catch (RuntimeException e) {
            closeQuietly(receiver);
            throw e;
          }
        });
  }

  private void attach(
      LinkSettings settings, List<Link<?>> links, CancellationToken cancellationToken)
      throws ClientException {
    try (CancellationToken.Registration ignored =
        cancellationToken.onCancel(() -> closeQuietly(links.toArray(new Link<?>[0])))) {
      for (Link<?> link : links) {
        ExceptionUtils.wrapGet(link.openFuture());
      }
    }
    cancellationToken.throwIfCancelled();
    LOGGER.debug("Link '{}' attached to '{}'", settings.name(), settings.address());
  }

  private static AmqpLink register(ProtonConnection connection, ProtonLink link) {
    connection.add(link);
    return link;
  }

  private static Map<String, Object> nativeProperties(LinkSettings settings) {
    Map<String, Object> properties = new LinkedHashMap<>();
    settings
        .properties()
        .forEach(
            (key, value) -> {
              if (AmqpProperties.TIMEOUT.equals(key) && value instanceof Number) {
                properties.put(key, UnsignedInteger.valueOf(((Number) value).longValue()));
              } else {
                properties.put(key, value);
              }
            });
    return properties;
  }

  private static AmqpException linkException(ClientException e, LinkSettings settings) {
    AmqpException ex =
        ExceptionUtils.convert(
            e, "Error while attaching link '%s' to '%s'", settings.name(), settings.address());
    if (ex.getClass() == AmqpException.class) {
      ex = new AmqpException.AmqpLinkException(ex.getMessage(), e);
    }
    return ex;
  }

  private static void closeQuietly(Link<?>... links) {
    for (Link<?> link : links) {
      Utils.maybeClose(link, e -> LOGGER.debug("Error while closing link: {}", e.getMessage()));
    }
  }

  private static ProtonConnection protonConnection(TransportConnection connection) {
    if (connection instanceof ProtonConnection) {
      return (ProtonConnection) connection;
    } else {
      throw new IllegalArgumentException(
          "Connection was not created by this transport: " + connection);
    }
  }

  private <T> CompletableFuture<T> execute(Supplier<T> task) {
    if (this.closed.get()) {
      return CompletableFuture.failedFuture(
          new AmqpException.AmqpResourceClosedException("The transport is closed"));
    }
    try {
      return CompletableFuture.supplyAsync(task, this.executorService);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new AmqpException.AmqpResourceClosedException("The transport is closed", e));
    }
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      if (this.internalExecutor) {
        this.executorService.shutdownNow();
      }
    }
  }
}
