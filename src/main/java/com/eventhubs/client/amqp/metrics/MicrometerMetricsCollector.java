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
package com.eventhubs.client.amqp.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong connections;
  private final AtomicLong managementLinks;
  private final AtomicLong consumerLinks;
  private final Counter authorizations;
  private final Counter authorizationFailures;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "eventhubs.amqp");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.connections = registry.gauge(prefix + ".connections", tags, new AtomicLong(0));
    this.managementLinks = registry.gauge(prefix + ".management_links", tags, new AtomicLong(0));
    this.consumerLinks = registry.gauge(prefix + ".consumer_links", tags, new AtomicLong(0));
    this.authorizations = registry.counter(prefix + ".authorizations", tags);
    this.authorizationFailures = registry.counter(prefix + ".authorization_failures", tags);
  }

  @Override
  public void openConnection() {
    this.connections.incrementAndGet();
  }

  @Override
  public void closeConnection() {
    this.connections.decrementAndGet();
  }

  @Override
  public void openManagementLink() {
    this.managementLinks.incrementAndGet();
  }

  @Override
  public void closeManagementLink() {
    this.managementLinks.decrementAndGet();
  }

  @Override
  public void openConsumerLink() {
    this.consumerLinks.incrementAndGet();
  }

  @Override
  public void closeConsumerLink() {
    this.consumerLinks.decrementAndGet();
  }

  @Override
  public void authorization() {
    this.authorizations.increment();
  }

  @Override
  public void authorizationFailure() {
    this.authorizationFailures.increment();
  }
}
