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

import static com.eventhubs.client.amqp.impl.AmqpProperties.CLAIM_LISTEN;
import static com.eventhubs.client.amqp.impl.AmqpProperties.CLAIM_MANAGE;

import com.eventhubs.client.amqp.AmqpException;
import com.eventhubs.client.amqp.AmqpLink;
import com.eventhubs.client.amqp.AmqpTransport;
import com.eventhubs.client.amqp.CancellationToken;
import com.eventhubs.client.amqp.ConnectionScope;
import com.eventhubs.client.amqp.ConsumerOptions;
import com.eventhubs.client.amqp.EventPosition;
import com.eventhubs.client.amqp.LinkSettings;
import com.eventhubs.client.amqp.MessagingEntityType;
import com.eventhubs.client.amqp.TransportConnection;
import com.eventhubs.client.amqp.TransportType;
import com.eventhubs.client.amqp.auth.Token;
import com.eventhubs.client.amqp.auth.TokenRequester;
import com.eventhubs.client.amqp.metrics.MetricsCollector;
import com.eventhubs.client.amqp.metrics.NoOpMetricsCollector;
import java.net.Proxy;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpConnectionScope implements ConnectionScope {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConnectionScope.class);

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final List<String> CONSUMER_CLAIMS = List.of(CLAIM_LISTEN);
  private static final List<String> MANAGEMENT_CLAIMS = List.of(CLAIM_MANAGE, CLAIM_LISTEN);

  private final long id;
  private final URI serviceEndpoint;
  private final String entityName;
  private final TransportType transportType;
  private final Proxy proxy;
  private final String identifier;
  private final AmqpTransport transport;
  private final boolean internalTransport;
  private final ExecutorService executorService;
  private final boolean internalExecutor;
  private final ScheduledExecutorService scheduledExecutorService;
  private final boolean internalScheduledExecutor;
  private final Function<Instant, Duration> refreshDelayStrategy;
  private final MetricsCollector metricsCollector;
  private final Consumer<Throwable> authorizationFailureListener;
  private final CbsTokenProvider tokenProvider;
  private final FaultTolerantConnection connection;
  private final LinkRegistry linkRegistry = new LinkRegistry();
  private final CancellationToken operationCancellation = new CancellationToken();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  AmqpConnectionScope(
      URI serviceEndpoint,
      String entityName,
      TransportType transportType,
      Proxy proxy,
      String identifier,
      AmqpTransport transport,
      boolean internalTransport,
      TokenRequester tokenRequester,
      ExecutorService executorService,
      ScheduledExecutorService scheduledExecutorService,
      Function<Instant, Duration> refreshDelayStrategy,
      MetricsCollector metricsCollector,
      Consumer<Throwable> authorizationFailureListener) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.serviceEndpoint = serviceEndpoint;
    this.entityName = entityName;
    this.transportType = transportType;
    this.proxy = proxy;
    this.identifier = identifier;
    this.transport = transport;
    this.internalTransport = internalTransport;

    String threadPrefix = String.format("eventhubs-amqp-scope-%d-", this.id);
    if (executorService == null) {
      this.executorService = Executors.newCachedThreadPool(Utils.threadFactory(threadPrefix));
      this.internalExecutor = true;
    } else {
      this.executorService = executorService;
      this.internalExecutor = false;
    }
    if (scheduledExecutorService == null) {
      this.scheduledExecutorService =
          Executors.newScheduledThreadPool(1, Utils.threadFactory(threadPrefix + "scheduler-"));
      this.internalScheduledExecutor = true;
    } else {
      this.scheduledExecutorService = scheduledExecutorService;
      this.internalScheduledExecutor = false;
    }
    this.refreshDelayStrategy =
        refreshDelayStrategy == null
            ? AuthorizationRefreshTimer.DEFAULT_REFRESH_DELAY_STRATEGY
            : refreshDelayStrategy;
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    this.authorizationFailureListener =
        authorizationFailureListener == null ? e -> {} : authorizationFailureListener;
    this.tokenProvider = new CbsTokenProvider(tokenRequester, this.executorService);
    this.connection =
        new FaultTolerantConnection(
            timeout ->
                this.transport.openConnection(
                    this.serviceEndpoint,
                    this.transportType,
                    this.proxy,
                    this.identifier,
                    timeout),
            this.metricsCollector);
  }

  @Override
  public CompletableFuture<AmqpLink> openManagementLink(
      Duration timeout, CancellationToken cancellationToken) {
    checkTimeout(timeout);
    CancellationToken token =
        cancellationToken == null ? CancellationToken.none() : cancellationToken;
    this.checkOpen();
    token.throwIfCancelled();

    String address = AmqpProperties.MANAGEMENT_ADDRESS;
    String audience = this.audience(this.entityPath() + "/" + AmqpProperties.MANAGEMENT_ADDRESS);
    String linkName = Utils.NAME_SUPPLIER.get();
    LOGGER.debug("Opening management link '{}' (scope {})", linkName, this);

    Operation operation = new Operation("management link '" + linkName + "'", timeout, token);
    CompletableFuture<AmqpLink> opening =
        this.connection
            .getOrCreate(operation.remaining("opening connection"))
            .thenCompose(
                c -> {
                  operation.checkInFlight();
                  return this.authorize(
                      c, audience, MANAGEMENT_CLAIMS, operation.remaining("authorization"), false);
                })
            .thenCompose(
                authorization -> {
                  operation.checkInFlight();
                  LinkSettings settings =
                      LinkSettings.builder().name(linkName).address(address).build();
                  return this.transport
                      .openManagementLink(
                          authorization.connection,
                          settings,
                          operation.remaining("opening management link"),
                          operation.token)
                      .thenApply(
                          link ->
                              this.register(
                                  operation,
                                  link,
                                  AuthorizationRefreshTimer.NONE,
                                  null,
                                  this.metricsCollector::openManagementLink,
                                  this.metricsCollector::closeManagementLink));
                });
    return operation.complete(opening);
  }

  @Override
  public CompletableFuture<AmqpLink> openConsumerLink(
      String consumerGroup,
      String partitionId,
      EventPosition position,
      ConsumerOptions options,
      Duration timeout,
      CancellationToken cancellationToken) {
    Assert.notBlank(consumerGroup, "Consumer group cannot be null or blank");
    Assert.notBlank(partitionId, "Partition ID cannot be null or blank");
    Assert.notNull(position, "Event position cannot be null");
    Assert.notNull(options, "Consumer options cannot be null");
    checkTimeout(timeout);
    CancellationToken token =
        cancellationToken == null ? CancellationToken.none() : cancellationToken;
    this.checkOpen();
    token.throwIfCancelled();

    String address =
        this.entityPath() + "/ConsumerGroups/" + consumerGroup + "/Partitions/" + partitionId;
    String audience = this.audience(address);
    String linkName = Utils.NAME_SUPPLIER.get();
    String filter = AmqpFilter.expression(position);
    // options are mutable
    String consumerIdentifier = options.identifier();
    Long ownerLevel = options.ownerLevel();
    int prefetchCount = options.prefetchCount();
    boolean trackLastEnqueuedEvent = options.trackLastEnqueuedEventInformation();
    LOGGER.debug(
        "Opening consumer link '{}' on '{}' from {} (scope {})", linkName, address, position, this);

    Operation operation = new Operation("consumer link '" + linkName + "'", timeout, token);
    CompletableFuture<AmqpLink> opening =
        this.connection
            .getOrCreate(operation.remaining("opening connection"))
            .thenCompose(
                c -> {
                  operation.checkInFlight();
                  return this.authorize(
                      c, audience, CONSUMER_CLAIMS, operation.remaining("authorization"), false);
                })
            .thenCompose(
                authorization -> {
                  operation.checkInFlight();
                  Duration remaining = operation.remaining("opening consumer link");
                  LinkSettings.Builder settings =
                      LinkSettings.builder()
                          .name(linkName)
                          .address(address)
                          .creditWindow(prefetchCount)
                          .filter(
                              AmqpProperties.SELECTOR_FILTER,
                              AmqpProperties.SELECTOR_FILTER,
                              filter)
                          .property(
                              AmqpProperties.ENTITY_TYPE,
                              MessagingEntityType.CONSUMER_GROUP.code())
                          .property(AmqpProperties.TIMEOUT, remaining.toMillis());
                  if (consumerIdentifier != null && !consumerIdentifier.isBlank()) {
                    settings.property(AmqpProperties.RECEIVER_IDENTIFIER, consumerIdentifier);
                  }
                  if (ownerLevel != null) {
                    settings.property(AmqpProperties.OWNER_LEVEL, ownerLevel);
                  }
                  if (trackLastEnqueuedEvent) {
                    settings.desiredCapability(
                        AmqpProperties.TRACK_LAST_ENQUEUED_EVENT_INFORMATION);
                  }
                  TransportConnection c = authorization.connection;
                  AuthorizationRefreshTimer timer =
                      new AuthorizationRefreshTimer(
                          linkName,
                          this.scheduledExecutorService,
                          this.refreshDelayStrategy,
                          () ->
                              this.authorize(c, audience, CONSUMER_CLAIMS, timeout, true)
                                  .thenApply(a -> a.expirationTime),
                          e -> this.authorizationRefreshFailed(linkName, e));
                  return this.transport
                      .openReceivingLink(c, settings.build(), remaining, operation.token)
                      .thenApply(
                          link ->
                              this.register(
                                  operation,
                                  link,
                                  timer,
                                  authorization.expirationTime,
                                  this.metricsCollector::openConsumerLink,
                                  this.metricsCollector::closeConsumerLink));
                });
    return operation.complete(opening);
  }

  private CompletableFuture<Authorization> authorize(
      TransportConnection c,
      String audience,
      List<String> claims,
      Duration timeout,
      boolean refresh) {
    CompletableFuture<Token> token =
        refresh
            ? this.tokenProvider.refresh(audience, claims)
            : this.tokenProvider.token(audience, claims);
    return token.thenCompose(
        t ->
            this.transport
                .putToken(c, audience, t, timeout)
                .thenApply(
                    ignored -> {
                      this.metricsCollector.authorization();
                      return new Authorization(c, t.expirationTime());
                    }));
  }

  private AmqpLink register(
      Operation operation,
      AmqpLink link,
      AuthorizationRefreshTimer timer,
      Instant expirationTime,
      Runnable onRegistered,
      Runnable onUnregistered) {
    if (operation.token.isCancelled() || this.closed.get()) {
      timer.dispose();
      Utils.maybeClose(link, e -> LOGGER.info("Error while closing link: {}", e.getMessage()));
      throw operation.failure();
    }
    this.linkRegistry.register(link, timer, onUnregistered);
    onRegistered.run();
    if (timer.active()) {
      timer.start(expirationTime);
    }
    // close() may have taken its snapshot of the registry before the registration
    if (this.closed.get()) {
      this.linkRegistry.unregister(link);
      Utils.maybeClose(link, e -> LOGGER.info("Error while closing link: {}", e.getMessage()));
      throw operation.failure();
    }
    LOGGER.debug("Link '{}' opened (scope {})", link.name(), this);
    return link;
  }

  private void authorizationRefreshFailed(String linkName, Throwable cause) {
    this.metricsCollector.authorizationFailure();
    this.authorizationFailureListener.accept(
        new AmqpException.AmqpAuthorizationException(
            "Error while refreshing authorization of link '" + linkName + "'", cause));
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing connection scope {}", this);
      this.operationCancellation.cancel();
      this.linkRegistry.closeAll();
      this.connection.close();
      this.tokenProvider.clear();
      if (this.internalTransport) {
        Utils.maybeClose(
            this.transport,
            e ->
                LOGGER.info(
                    "Error while closing transport of scope {}: {}", this, e.getMessage()));
      }
      if (this.internalExecutor) {
        this.executorService.shutdownNow();
      }
      if (this.internalScheduledExecutor) {
        this.scheduledExecutorService.shutdownNow();
      }
      LOGGER.debug("Connection scope {} has been closed", this);
    }
  }

  @Override
  public boolean isClosed() {
    return this.closed.get();
  }

  @Override
  public String identifier() {
    return this.identifier;
  }

  @Override
  public URI serviceEndpoint() {
    return this.serviceEndpoint;
  }

  @Override
  public String entityName() {
    return this.entityName;
  }

  @Override
  public TransportType transportType() {
    return this.transportType;
  }

  Proxy proxy() {
    return this.proxy;
  }

  LinkRegistry linkRegistry() {
    return this.linkRegistry;
  }

  FaultTolerantConnection connection() {
    return this.connection;
  }

  private static void checkTimeout(Duration timeout) {
    Assert.notNull(timeout, "Timeout cannot be null");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("Timeout must be positive: " + timeout);
    }
  }

  private void checkOpen() {
    if (this.closed.get()) {
      throw new AmqpException.AmqpResourceClosedException("The connection scope is closed");
    }
  }

  private String entityPath() {
    return UriUtils.trimTrailingSlashes(this.serviceEndpoint.getPath()) + "/" + this.entityName;
  }

  private String audience(String path) {
    return this.serviceEndpoint.getScheme() + "://" + this.serviceEndpoint.getAuthority() + path;
  }

  @Override
  public String toString() {
    return this.identifier;
  }

  private static final class Authorization {

    private final TransportConnection connection;
    private final Instant expirationTime;

    private Authorization(TransportConnection connection, Instant expirationTime) {
      this.connection = connection;
      this.expirationTime = expirationTime;
    }
  }

  /**
   * An in-flight open operation.
   *
   * <p>Bound to the caller token, to the scope token, and to its timeout. Its own token is
   * cancelled as soon as one of them fires, and is passed to the transport.
   */
  private final class Operation {

    private final String description;
    private final Duration timeout;
    private final Utils.StopWatch stopWatch = new Utils.StopWatch();
    private final CancellationToken token = new CancellationToken();
    private final CompletableFuture<AmqpLink> result = new CompletableFuture<>();
    private final CancellationToken.Registration callerRegistration;
    private final CancellationToken.Registration scopeRegistration;
    private final ScheduledFuture<?> timeoutTask;

    private Operation(String description, Duration timeout, CancellationToken callerToken) {
      this.description = description;
      this.timeout = timeout;
      this.callerRegistration = callerToken.onCancel(this::cancel);
      this.scopeRegistration = operationCancellation.onCancel(this::cancel);
      this.timeoutTask = this.scheduleTimeout();
    }

    private ScheduledFuture<?> scheduleTimeout() {
      try {
        return scheduledExecutorService.schedule(
            () -> {
              if (this.result.completeExceptionally(
                  new AmqpException.AmqpTimeoutException(
                      "Opening %s timed out after %d ms",
                      this.description,
                      this.timeout.toMillis()))) {
                this.token.cancel();
              }
            },
            this.timeout.toMillis(),
            TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
        // the scheduler is shut down, the scope is closing
        this.cancel();
        return null;
      }
    }

    private void cancel() {
      // the transport fails the pending step on token cancellation, the result must win
      this.result.completeExceptionally(this.failure());
      this.token.cancel();
    }

    private RuntimeException failure() {
      if (closed.get() || operationCancellation.isCancelled()) {
        return new AmqpException.AmqpResourceClosedException(
            "The connection scope is closed, cannot open " + this.description);
      } else {
        return new CancellationException("Opening " + this.description + " has been cancelled");
      }
    }

    private void checkInFlight() {
      if (this.token.isCancelled() || closed.get()) {
        throw this.failure();
      }
    }

    private Duration remaining(String step) {
      return Utils.remaining(this.timeout, this.stopWatch, step);
    }

    private CompletableFuture<AmqpLink> complete(CompletableFuture<AmqpLink> opening) {
      opening.whenComplete(
          (link, ex) -> {
            this.callerRegistration.close();
            this.scopeRegistration.close();
            if (this.timeoutTask != null) {
              this.timeoutTask.cancel(false);
            }
            if (ex != null) {
              RuntimeException failure = ExceptionUtils.propagate(ex);
              if (!this.result.completeExceptionally(failure)) {
                LOGGER.debug(
                    "Opening {} failed after completion: {}",
                    this.description,
                    failure.getMessage());
              }
            } else if (!this.result.complete(link)) {
              // cancelled or timed out in the meantime, the caller will never get the link
              LOGGER.debug("Closing {}, its opening has been cancelled", this.description);
              Utils.maybeClose(
                  link, e -> LOGGER.info("Error while closing link: {}", e.getMessage()));
            }
          });
      return this.result;
    }
  }
}
