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

import static com.eventhubs.client.amqp.impl.TestUtils.token;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.eventhubs.client.amqp.ConnectionScope;
import com.eventhubs.client.amqp.TransportType;
import com.eventhubs.client.amqp.auth.TokenRequester;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class AmqpConnectionScopeBuilderTest {

  static final TokenRequester TOKEN_REQUESTER =
      (audience, claims) -> token("ok", Instant.now().plusSeconds(3600));

  FakeTransport transport;

  @BeforeEach
  void init() {
    this.transport = new FakeTransport();
  }

  @Test
  void buildShouldApplyDefaults() {
    try (ConnectionScope scope =
        builder().endpoint("amqps://test.service.windows.net").entityName("myHub").build()) {
      assertThat(scope.serviceEndpoint()).isEqualTo(URI.create("amqps://test.service.windows.net"));
      assertThat(scope.entityName()).isEqualTo("myHub");
      assertThat(scope.transportType()).isEqualTo(TransportType.AMQP_TCP);
      assertThat(scope.identifier()).startsWith("myHub-");
      assertThat(scope.isClosed()).isFalse();
    }
  }

  @Test
  void identifierShouldBeUsedIfSet() {
    try (ConnectionScope scope =
        builder()
            .endpoint("amqp://test.service")
            .entityName("myHub")
            .identifier("my-client")
            .build()) {
      assertThat(scope.identifier()).isEqualTo("my-client");
      assertThat(scope).hasToString("my-client");
    }
  }

  @Test
  void nullEndpointShouldFailBeforeAnyNetworkOperation() {
    assertThatThrownBy(() -> builder().endpoint((URI) null).entityName("myHub").build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Endpoint");
    assertThatThrownBy(() -> builder().endpoint((String) null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(this.transport.connectionCount).hasValue(0);
  }

  @Test
  void invalidSettingsShouldBeRejected() {
    assertThatThrownBy(() -> builder().endpoint("/relative").entityName("myHub").build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder().endpoint("amqp://test.service").entityName(" ").build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () ->
                builder()
                    .endpoint("amqp://test.service")
                    .entityName("myHub")
                    .transportType(null)
                    .build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () ->
                new AmqpConnectionScopeBuilder()
                    .endpoint("amqp://test.service")
                    .entityName("myHub")
                    .transport(this.transport)
                    .build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Token requester");
    assertThatThrownBy(() -> builder().refreshDelayRatio(1.5f))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void proxyShouldRequireWebSockets() {
    Proxy proxy = new Proxy(Proxy.Type.HTTP, new InetSocketAddress("localhost", 3128));
    AmqpConnectionScopeBuilder tcpWithProxy =
        builder().endpoint("amqp://test.service").entityName("myHub").proxy(proxy);
    assertThatThrownBy(tcpWithProxy::build).isInstanceOf(IllegalArgumentException.class);

    try (ConnectionScope scope =
        builder()
            .endpoint("amqps://test.service")
            .entityName("myHub")
            .transportType(TransportType.AMQP_WEB_SOCKETS)
            .proxy(proxy)
            .build()) {
      assertThat(((AmqpConnectionScope) scope).proxy()).isSameAs(proxy);
    }
  }

  @Test
  void closeShouldNotCloseExternalTransport() {
    ConnectionScope scope =
        builder().endpoint("amqp://test.service").entityName("myHub").build();
    scope.close();
    assertThat(scope.isClosed()).isTrue();
    assertThat(this.transport.closed).isFalse();
  }

  private AmqpConnectionScopeBuilder builder() {
    return new AmqpConnectionScopeBuilder()
        .transport(this.transport)
        .tokenRequester(TOKEN_REQUESTER);
  }
}
