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

import static com.eventhubs.client.amqp.impl.Assertions.assertThat;
import static com.eventhubs.client.amqp.impl.TestUtils.sync;
import static com.eventhubs.client.amqp.impl.TestUtils.token;
import static com.eventhubs.client.amqp.impl.TestUtils.waitAtMost;
import static java.time.Duration.ofMillis;
import static java.time.Duration.ofSeconds;
import static java.util.stream.Collectors.toList;
import static java.util.stream.IntStream.range;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.eventhubs.client.amqp.AmqpException;
import com.eventhubs.client.amqp.AmqpLink;
import com.eventhubs.client.amqp.CancellationToken;
import com.eventhubs.client.amqp.ConsumerOptions;
import com.eventhubs.client.amqp.EventPosition;
import com.eventhubs.client.amqp.LinkSettings;
import com.eventhubs.client.amqp.MessagingEntityType;
import com.eventhubs.client.amqp.TransportConnection;
import com.eventhubs.client.amqp.auth.TokenRequester;
import com.eventhubs.client.amqp.impl.FakeTransport.FakeLink;
import com.eventhubs.client.amqp.impl.TestUtils.Sync;
import com.eventhubs.client.amqp.metrics.MetricsCollector;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class AmqpConnectionScopeTest {

  static final Duration TIMEOUT = ofSeconds(10);
  static final String CONSUMER_AUDIENCE =
      "amqp://test.service/myHub/ConsumerGroups/group/Partitions/0";

  AutoCloseable mocks;
  @Mock MetricsCollector metricsCollector;
  FakeTransport transport;
  AtomicInteger tokenRequestCount;
  TokenRequester tokenRequester;
  AmqpConnectionScope scope;

  @BeforeEach
  void init() {
    this.mocks = MockitoAnnotations.openMocks(this);
    this.transport = new FakeTransport();
    this.tokenRequestCount = new AtomicInteger(0);
    this.tokenRequester =
        (audience, claims) -> {
          this.tokenRequestCount.incrementAndGet();
          return token("token-" + audience, Instant.now().plus(Duration.ofHours(1)));
        };
  }

  @AfterEach
  void tearDown() throws Exception {
    if (this.scope != null) {
      this.scope.close();
    }
    this.mocks.close();
  }

  @Test
  void consumerLinkShouldUsePrefetchCountAndOwnerLevel() throws Exception {
    this.scope = scope();
    ConsumerOptions options = new ConsumerOptions().prefetchCount(697).ownerLevel(459L);

    AmqpLink link =
        this.scope
            .openConsumerLink(
                "group", "0", EventPosition.latest(), options, TIMEOUT, CancellationToken.none())
            .get(10, TimeUnit.SECONDS);

    assertThat(link.settings())
        .hasCreditWindow(697)
        .hasProperty(AmqpProperties.OWNER_LEVEL, 459L)
        .hasAddress("/myHub/ConsumerGroups/group/Partitions/0")
        .hasProperty(AmqpProperties.ENTITY_TYPE, MessagingEntityType.CONSUMER_GROUP.code())
        .hasFilter(AmqpProperties.SELECTOR_FILTER, "amqp.annotation.x-opt-offset > '@latest'")
        .doesNotHaveProperty(AmqpProperties.RECEIVER_IDENTIFIER)
        .hasNoCapabilities();
    assertThat(link.settings().property(AmqpProperties.TIMEOUT, 0L)).isPositive();
    assertThat(this.transport.audiences).containsExactly(CONSUMER_AUDIENCE);
    assertThat(this.transport.connectionCount).hasValue(1);
  }

  @Test
  void consumerLinkShouldRequestRuntimeMetricCapabilityOnlyWhenTracking() throws Exception {
    this.scope = scope();
    AmqpLink tracking =
        openConsumerLink(
            "0", new ConsumerOptions().trackLastEnqueuedEventInformation(true).identifier("c1"));
    AmqpLink notTracking =
        openConsumerLink("1", new ConsumerOptions().trackLastEnqueuedEventInformation(false));

    assertThat(tracking.settings())
        .hasCapability(AmqpProperties.TRACK_LAST_ENQUEUED_EVENT_INFORMATION)
        .hasProperty(AmqpProperties.RECEIVER_IDENTIFIER, "c1");
    assertThat(notTracking.settings()).hasNoCapabilities();
  }

  @Test
  void consumerLinkShouldBeRegisteredWithActiveTimerAndUnregisteredOnPeerClose()
      throws Exception {
    this.scope = scope();
    AmqpLink link = openConsumerLink("0", new ConsumerOptions());
    LinkRegistry registry = this.scope.linkRegistry();
    assertThat(registry.size()).isEqualTo(1);
    AuthorizationRefreshTimer timer = registry.timer(link);
    assertThat(timer).isNotNull();
    assertThat(timer.active()).isTrue();
    assertThat(timer.isDisposed()).isFalse();
    verify(this.metricsCollector, times(1)).openConsumerLink();

    ((FakeLink) link).remoteClose();

    assertThat(registry.isEmpty()).isTrue();
    assertThat(timer.isDisposed()).isTrue();
    verify(this.metricsCollector, times(1)).closeConsumerLink();
  }

  @Test
  void managementLinkShouldBeRegisteredWithoutRenewal() throws Exception {
    this.scope = scope();
    AmqpLink link =
        this.scope.openManagementLink(TIMEOUT, CancellationToken.none()).get(10, TimeUnit.SECONDS);

    assertThat(link.settings()).hasAddress(AmqpProperties.MANAGEMENT_ADDRESS).hasNoCapabilities();
    assertThat(this.transport.audiences).containsExactly("amqp://test.service/myHub/$management");
    assertThat(this.scope.linkRegistry().timer(link)).isSameAs(AuthorizationRefreshTimer.NONE);
    verify(this.metricsCollector, times(1)).openManagementLink();

    link.close();
    assertThat(this.scope.linkRegistry().isEmpty()).isTrue();
    verify(this.metricsCollector, times(1)).closeManagementLink();
  }

  @Test
  void eachCallShouldCreateNewLinkOnSharedConnection() throws Exception {
    this.scope = scope();
    AmqpLink link1 =
        this.scope.openManagementLink(TIMEOUT, CancellationToken.none()).get(10, TimeUnit.SECONDS);
    AmqpLink link2 =
        this.scope.openManagementLink(TIMEOUT, CancellationToken.none()).get(10, TimeUnit.SECONDS);
    assertThat(link1).isNotSameAs(link2);
    assertThat(link1.name()).isNotEqualTo(link2.name());
    assertThat(this.scope.linkRegistry().size()).isEqualTo(2);
    assertThat(this.transport.connectionCount).hasValue(1);
    // same audience and claims, the token is cached
    assertThat(this.tokenRequestCount).hasValue(1);
  }

  @Test
  void alreadyCancelledTokenShouldFailWithoutRegistration() {
    this.scope = scope();
    CancellationToken token = new CancellationToken();
    token.cancel();

    assertThatThrownBy(
            () ->
                this.scope.openConsumerLink(
                    "group", "0", EventPosition.earliest(), new ConsumerOptions(), TIMEOUT, token))
        .isInstanceOf(CancellationException.class);
    assertThat(this.scope.linkRegistry().size()).isZero();
    assertThat(this.transport.connectionCount).hasValue(0);
  }

  @Test
  void cancellationDuringAttachShouldFailAndLeaveNoRegistration() throws Exception {
    this.scope = scope();
    CompletableFuture<Void> attach = new CompletableFuture<>();
    this.transport.linkAttach = () -> attach;
    CancellationToken token = new CancellationToken();

    CompletableFuture<AmqpLink> opening =
        this.scope.openConsumerLink(
            "group", "0", EventPosition.earliest(), new ConsumerOptions(), TIMEOUT, token);
    waitAtMost(() -> this.transport.audiences.size() == 1);
    token.cancel();

    assertThat(failure(opening)).isInstanceOf(CancellationException.class);
    attach.complete(null);
    assertThat(this.scope.linkRegistry().isEmpty()).isTrue();
    assertThat(this.transport.links).isEmpty();
    verify(this.metricsCollector, never()).openConsumerLink();
  }

  @Test
  void linkAttachedAfterCancellationShouldBeClosed() throws Exception {
    CancellationToken token = new CancellationToken();
    CompletableFuture<Void> attach = new CompletableFuture<>();
    // the transport ignores the cancellation and attaches the link anyway
    FakeTransport ignoringCancellation =
        new FakeTransport() {
          @Override
          public CompletableFuture<AmqpLink> openReceivingLink(
              TransportConnection connection,
              LinkSettings settings,
              Duration timeout,
              CancellationToken cancellationToken) {
            return attach.thenApply(
                ignored -> {
                  FakeLink link = new FakeLink(settings);
                  this.links.add(link);
                  return link;
                });
          }
        };
    this.scope = scope(ignoringCancellation);

    CompletableFuture<AmqpLink> opening =
        this.scope.openConsumerLink(
            "group", "0", EventPosition.earliest(), new ConsumerOptions(), TIMEOUT, token);
    waitAtMost(() -> ignoringCancellation.audiences.size() == 1);
    token.cancel();
    assertThat(failure(opening)).isInstanceOf(CancellationException.class);

    attach.complete(null);
    waitAtMost(() -> ignoringCancellation.links.size() == 1);
    waitAtMost(() -> ignoringCancellation.link(0).isClosed());
    assertThat(this.scope.linkRegistry().isEmpty()).isTrue();
  }

  @Test
  void openShouldTimeOutWhenAttachDoesNotComplete() {
    this.scope = scope();
    this.transport.linkAttach = CompletableFuture::new;

    CompletableFuture<AmqpLink> opening =
        this.scope.openConsumerLink(
            "group",
            "0",
            EventPosition.earliest(),
            new ConsumerOptions(),
            ofMillis(200),
            CancellationToken.none());

    assertThat(failure(opening)).isInstanceOf(AmqpException.AmqpTimeoutException.class);
    assertThat(this.scope.linkRegistry().isEmpty()).isTrue();
  }

  @Test
  void closeDuringOpenShouldFailWithResourceClosed() {
    this.scope = scope();
    Sync attachPending = sync();
    this.transport.linkAttach =
        () -> {
          attachPending.down();
          return new CompletableFuture<>();
        };

    CompletableFuture<AmqpLink> opening =
        this.scope.openManagementLink(TIMEOUT, CancellationToken.none());
    assertThat(attachPending).completes();
    this.scope.close();

    assertThat(failure(opening)).isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThat(this.scope.linkRegistry().isEmpty()).isTrue();
  }

  @Test
  void openAfterCloseShouldFailWithResourceClosed() {
    this.scope = scope();
    this.scope.close();

    assertThat(this.scope.isClosed()).isTrue();
    assertThatThrownBy(() -> openConsumerLink("0", new ConsumerOptions()))
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThatThrownBy(() -> this.scope.openManagementLink(TIMEOUT, null))
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThat(this.transport.connectionCount).hasValue(0);
  }

  @Test
  void closeShouldCloseLinksDisposeTimersAndBeIdempotent() throws Exception {
    this.scope = scope();
    AmqpLink management =
        this.scope.openManagementLink(TIMEOUT, CancellationToken.none()).get(10, TimeUnit.SECONDS);
    AmqpLink consumer = openConsumerLink("0", new ConsumerOptions());
    AuthorizationRefreshTimer consumerTimer = this.scope.linkRegistry().timer(consumer);
    assertThat(this.scope.linkRegistry().size()).isEqualTo(2);

    this.scope.close();
    this.scope.close();

    assertThat(this.scope.linkRegistry().isEmpty()).isTrue();
    assertThat(consumerTimer.isDisposed()).isTrue();
    assertThat(management.isClosed()).isTrue();
    assertThat(consumer.isClosed()).isTrue();
    assertThat(((FakeLink) management).closeCount()).isEqualTo(1);
    assertThat(((FakeLink) consumer).closeCount()).isEqualTo(1);
    assertThat(this.transport.connections).hasSize(1);
    assertThat(this.transport.connections.get(0).isClosed()).isTrue();
    // the transport is not owned by the scope
    assertThat(this.transport.closed).isFalse();
    verify(this.metricsCollector, times(1)).closeManagementLink();
    verify(this.metricsCollector, times(1)).closeConsumerLink();
    verify(this.metricsCollector, times(1)).closeConnection();
  }

  @Test
  void concurrentFirstCallersShouldShareOneConnection() throws Exception {
    this.scope = scope();
    this.transport.connectionDelay = ofMillis(200);
    int callerCount = 10;
    ExecutorService executorService = Executors.newFixedThreadPool(callerCount);
    try {
      CountDownLatch start = new CountDownLatch(1);
      List<CompletableFuture<AmqpLink>> openings =
          range(0, callerCount)
              .mapToObj(
                  i ->
                      CompletableFuture.supplyAsync(
                              () -> {
                                try {
                                  start.await();
                                } catch (InterruptedException e) {
                                  Thread.currentThread().interrupt();
                                  throw new RuntimeException(e);
                                }
                                return this.scope.openConsumerLink(
                                    "group",
                                    String.valueOf(i),
                                    EventPosition.earliest(),
                                    new ConsumerOptions(),
                                    TIMEOUT,
                                    CancellationToken.none());
                              },
                              executorService)
                          .thenCompose(f -> f))
              .collect(toList());
      start.countDown();
      CompletableFuture.allOf(openings.toArray(new CompletableFuture<?>[0]))
          .get(10, TimeUnit.SECONDS);
    } finally {
      executorService.shutdownNow();
    }

    assertThat(this.transport.connectionCount).hasValue(1);
    assertThat(this.scope.linkRegistry().size()).isEqualTo(callerCount);
  }

  @Test
  void closedConnectionShouldBeReplacedOnNextOpen() throws Exception {
    this.scope = scope();
    openConsumerLink("0", new ConsumerOptions());
    this.transport.connections.get(0).close();

    openConsumerLink("1", new ConsumerOptions());

    assertThat(this.transport.connectionCount).hasValue(2);
    assertThat(this.transport.connections.get(1).isClosed()).isFalse();
    verify(this.metricsCollector, times(2)).openConnection();
    verify(this.metricsCollector, times(1)).closeConnection();
  }

  @Test
  void connectionFailureShouldPropagateAndNotBeRetried() throws Exception {
    this.scope = scope();
    AmqpException.AmqpConnectionException connectionFailure =
        new AmqpException.AmqpConnectionException("Connection refused", null);
    this.transport.connectionFailure = () -> connectionFailure;

    CompletableFuture<AmqpLink> opening =
        this.scope.openConsumerLink(
            "group", "0", EventPosition.earliest(), new ConsumerOptions(), TIMEOUT, null);

    assertThat(failure(opening)).isSameAs(connectionFailure);
    assertThat(this.transport.connectionCount).hasValue(1);

    this.transport.connectionFailure = () -> null;
    openConsumerLink("0", new ConsumerOptions());
    assertThat(this.transport.connectionCount).hasValue(2);
  }

  @Test
  void authorizationShouldBeRefreshedUntilLinkIsClosed() throws Exception {
    this.scope = scope(this.transport, expiration -> ofMillis(50), e -> {});
    AmqpLink link = openConsumerLink("0", new ConsumerOptions());

    int expectedRefreshCount = 3;
    waitAtMost(() -> audienceCount(CONSUMER_AUDIENCE) >= expectedRefreshCount + 1);
    verify(this.metricsCollector, atLeastOnce()).authorization();
    link.close();
    // a refresh may be in flight
    Thread.sleep(100);
    int snapshot = audienceCount(CONSUMER_AUDIENCE);
    Thread.sleep(200);
    assertThat(audienceCount(CONSUMER_AUDIENCE)).isEqualTo(snapshot);
  }

  @Test
  void authorizationRefreshFailureShouldBeReportedAndLinkKeptOpen() throws Exception {
    Sync failureSync = sync();
    AtomicReference<Throwable> failure = new AtomicReference<>();
    this.scope =
        scope(
            this.transport,
            expiration -> ofMillis(50),
            e -> {
              failure.set(e);
              failureSync.down();
            });
    AtomicInteger putTokenCount = new AtomicInteger(0);
    this.transport.putTokenBehavior =
        audience ->
            putTokenCount.incrementAndGet() == 1
                ? CompletableFuture.completedFuture(null)
                : CompletableFuture.failedFuture(
                    new AmqpException.AmqpSecurityException("Unauthorized", null));

    AmqpLink link = openConsumerLink("0", new ConsumerOptions());

    assertThat(failureSync).completes();
    assertThat(failure.get())
        .isInstanceOf(AmqpException.AmqpAuthorizationException.class)
        .hasCauseInstanceOf(AmqpException.AmqpSecurityException.class);
    assertThat(link.isClosed()).isFalse();
    assertThat(this.scope.linkRegistry().contains(link)).isTrue();
    verify(this.metricsCollector, atLeastOnce()).authorizationFailure();
    // the timer is armed again after a failure
    int snapshot = putTokenCount.get();
    waitAtMost(() -> putTokenCount.get() > snapshot);
  }

  @Test
  void invalidArgumentsShouldFailBeforeAnyNetworkOperation() {
    this.scope = scope();
    EventPosition position = EventPosition.earliest();
    ConsumerOptions options = new ConsumerOptions();
    assertThatThrownBy(
            () -> this.scope.openConsumerLink(" ", "0", position, options, TIMEOUT, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Consumer group");
    assertThatThrownBy(
            () -> this.scope.openConsumerLink("group", null, position, options, TIMEOUT, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Partition ID");
    assertThatThrownBy(
            () -> this.scope.openConsumerLink("group", "0", null, options, TIMEOUT, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Event position");
    assertThatThrownBy(
            () -> this.scope.openConsumerLink("group", "0", position, null, TIMEOUT, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Consumer options");
    assertThatThrownBy(
            () -> this.scope.openConsumerLink("group", "0", position, options, Duration.ZERO, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Timeout");
    assertThatThrownBy(() -> this.scope.openManagementLink(null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Timeout");
    assertThat(this.transport.connectionCount).hasValue(0);
  }

  private AmqpLink openConsumerLink(String partitionId, ConsumerOptions options)
      throws Exception {
    return this.scope
        .openConsumerLink(
            "group", partitionId, EventPosition.earliest(), options, TIMEOUT, null)
        .get(10, TimeUnit.SECONDS);
  }

  private int audienceCount(String audience) {
    return (int) this.transport.audiences.stream().filter(audience::equals).count();
  }

  private AmqpConnectionScope scope() {
    return scope(this.transport);
  }

  private AmqpConnectionScope scope(FakeTransport transport) {
    return scope(transport, null, null);
  }

  private AmqpConnectionScope scope(
      FakeTransport transport,
      Function<Instant, Duration> refreshDelayStrategy,
      Consumer<Throwable> authorizationFailureListener) {
    AmqpConnectionScopeBuilder builder =
        new AmqpConnectionScopeBuilder()
            .endpoint("amqp://test.service")
            .entityName("myHub")
            .transport(transport)
            .tokenRequester(this.tokenRequester)
            .metricsCollector(this.metricsCollector)
            .authorizationFailureListener(authorizationFailureListener);
    if (refreshDelayStrategy != null) {
      builder.refreshDelayStrategy(refreshDelayStrategy);
    }
    return (AmqpConnectionScope) builder.build();
  }

  private static Throwable failure(CompletableFuture<?> future) {
    try {
      Throwable ex = future.handle((v, t) -> t).get(10, TimeUnit.SECONDS);
      assertThat(ex).as("the future should have failed").isNotNull();
      return ExceptionUtils.unwrap(ex);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }
}
