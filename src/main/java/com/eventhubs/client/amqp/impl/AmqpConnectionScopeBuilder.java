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

import com.eventhubs.client.amqp.AmqpTransport;
import com.eventhubs.client.amqp.ConnectionScope;
import com.eventhubs.client.amqp.TransportType;
import com.eventhubs.client.amqp.auth.TokenRequester;
import com.eventhubs.client.amqp.metrics.MetricsCollector;
import com.eventhubs.client.amqp.metrics.NoOpMetricsCollector;
import java.net.Proxy;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.function.Function;

/** Builder to create a {@link ConnectionScope} instance. */
public class AmqpConnectionScopeBuilder {

  private URI endpoint;
  private String entityName;
  private TransportType transportType = TransportType.AMQP_TCP;
  private Proxy proxy;
  private String identifier;
  private AmqpTransport transport;
  private TokenRequester tokenRequester;
  private ExecutorService executorService;
  private ScheduledExecutorService scheduledExecutorService;
  private Function<Instant, Duration> refreshDelayStrategy =
      AuthorizationRefreshTimer.DEFAULT_REFRESH_DELAY_STRATEGY;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private Consumer<Throwable> authorizationFailureListener;

  public AmqpConnectionScopeBuilder() {}

  /**
   * The endpoint of the service, e.g. <code>amqps://my-namespace.servicebus.windows.net</code>.
   *
   * @param endpoint the endpoint
   * @return this builder instance
   */
  public AmqpConnectionScopeBuilder endpoint(URI endpoint) {
    this.endpoint = endpoint;
    return this;
  }

  /**
   * The endpoint of the service.
   *
   * @param endpoint the endpoint
   * @return this builder instance
   * @see #endpoint(URI)
   */
  public AmqpConnectionScopeBuilder endpoint(String endpoint) {
    Assert.notBlank(endpoint, "Endpoint cannot be null or blank");
    return this.endpoint(URI.create(endpoint));
  }

  /**
   * The name of the entity (event hub) the links of the scope target.
   *
   * @param entityName the entity name
   * @return this builder instance
   */
  public AmqpConnectionScopeBuilder entityName(String entityName) {
    this.entityName = entityName;
    return this;
  }

  /**
   * The transport type.
   *
   * <p>Default is {@link TransportType#AMQP_TCP}.
   *
   * @param transportType the transport type
   * @return this builder instance
   */
  public AmqpConnectionScopeBuilder transportType(TransportType transportType) {
    this.transportType = transportType;
    return this;
  }

  /**
   * The proxy to go through. Only supported with {@link TransportType#AMQP_WEB_SOCKETS}.
   *
   * @param proxy the proxy
   * @return this builder instance
   */
  public AmqpConnectionScopeBuilder proxy(Proxy proxy) {
    this.proxy = proxy;
    return this;
  }

  /**
   * Identifier of the client, used as the container ID of the connection.
   *
   * <p>A random identifier is generated if none is set.
   *
   * @param identifier the identifier
   * @return this builder instance
   */
  public AmqpConnectionScopeBuilder identifier(String identifier) {
    this.identifier = identifier;
    return this;
  }

  /**
   * The transport to use.
   *
   * <p>Default is a {@link ProtonTransport}, closed with the scope. A transport set with this
   * method is not closed by the scope.
   *
   * @param transport the transport
   * @return this builder instance
   */
  public AmqpConnectionScopeBuilder transport(AmqpTransport transport) {
    this.transport = transport;
    return this;
  }

  /**
   * The requester of authorization tokens.
   *
   * @param tokenRequester the token requester
   * @return this builder instance
   * @see SharedAccessSignatureTokenRequester
   */
  public AmqpConnectionScopeBuilder tokenRequester(TokenRequester tokenRequester) {
    this.tokenRequester = tokenRequester;
    return this;
  }

  /**
   * Set executor service used for internal tasks (e.g. token requests).
   *
   * <p>The library uses sensible defaults, override only in case of problems.
   *
   * <p>It is the developer's responsibility to shut down the executor when it is no longer needed.
   *
   * @param executorService the executor service
   * @return this builder instance
   */
  public AmqpConnectionScopeBuilder executorService(ExecutorService executorService) {
    this.executorService = executorService;
    return this;
  }

  /**
   * Set scheduled executor service used for authorization refresh and timeouts.
   *
   * <p>The library uses sensible defaults, override only in case of problems.
   *
   * <p>It is the developer's responsibility to shut down the executor when it is no longer needed.
   *
   * @param scheduledExecutorService the scheduled executor service
   * @return this builder instance
   */
  public AmqpConnectionScopeBuilder scheduledExecutorService(
      ScheduledExecutorService scheduledExecutorService) {
    this.scheduledExecutorService = scheduledExecutorService;
    return this;
  }

  /**
   * Strategy to compute the delay before refreshing an authorization, from its expiration time.
   *
   * <p>Default refreshes at 80% of the remaining validity, and no sooner than 1 second.
   *
   * @param refreshDelayStrategy the strategy
   * @return this builder instance
   * @see #refreshDelayRatio(float)
   */
  public AmqpConnectionScopeBuilder refreshDelayStrategy(
      Function<Instant, Duration> refreshDelayStrategy) {
    this.refreshDelayStrategy = refreshDelayStrategy;
    return this;
  }

  /**
   * Refresh authorizations when this fraction of their remaining validity has elapsed.
   *
   * @param ratio the ratio, greater than 0 and lower than or equal to 1
   * @return this builder instance
   */
  public AmqpConnectionScopeBuilder refreshDelayRatio(float ratio) {
    this.refreshDelayStrategy = AuthorizationRefreshTimer.ratioRefreshDelayStrategy(ratio);
    return this;
  }

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see com.eventhubs.client.amqp.metrics.MicrometerMetricsCollector
   */
  public AmqpConnectionScopeBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  /**
   * Callback notified when the refresh of a link authorization fails.
   *
   * <p>The link stays open, the broker closes it if its authorization expires.
   *
   * @param listener the listener
   * @return this builder instance
   */
  public AmqpConnectionScopeBuilder authorizationFailureListener(Consumer<Throwable> listener) {
    this.authorizationFailureListener = listener;
    return this;
  }

  /**
   * Create the connection scope instance.
   *
   * @return the configured connection scope
   */
  public ConnectionScope build() {
    Assert.notNull(this.endpoint, "Endpoint cannot be null");
    Assert.notBlank(this.entityName, "Entity name cannot be null or blank");
    Assert.notNull(this.transportType, "Transport type cannot be null");
    Assert.notNull(this.tokenRequester, "Token requester cannot be null");
    if (this.endpoint.getScheme() == null || this.endpoint.getHost() == null) {
      throw new IllegalArgumentException("Endpoint must be an absolute URI: " + this.endpoint);
    }
    if (this.proxy != null
        && this.proxy.type() != Proxy.Type.DIRECT
        && this.transportType != TransportType.AMQP_WEB_SOCKETS) {
      throw new IllegalArgumentException(
          "A proxy can only be used with " + TransportType.AMQP_WEB_SOCKETS);
    }
    String id =
        this.identifier == null || this.identifier.isBlank()
            ? this.entityName + "-" + UUID.randomUUID()
            : this.identifier;
    boolean internalTransport = this.transport == null;
    AmqpTransport t = internalTransport ? new ProtonTransport() : this.transport;
    return new AmqpConnectionScope(
        this.endpoint,
        this.entityName,
        this.transportType,
        this.proxy,
        id,
        t,
        internalTransport,
        this.tokenRequester,
        this.executorService,
        this.scheduledExecutorService,
        this.refreshDelayStrategy,
        this.metricsCollector,
        this.authorizationFailureListener);
  }
}
