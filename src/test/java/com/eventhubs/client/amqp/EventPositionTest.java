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
package com.eventhubs.client.amqp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

public class EventPositionTest {

  @Test
  void positions() {
    assertThat(EventPosition.earliest().offset()).isEqualTo("-1");
    assertThat(EventPosition.latest().offset()).isEqualTo("@latest");
    assertThat(EventPosition.fromOffset(10, true))
        .isEqualTo(EventPosition.fromOffset(10, true))
        .isNotEqualTo(EventPosition.fromOffset(10));
    EventPosition sequenceNumber = EventPosition.fromSequenceNumber(42);
    assertThat(sequenceNumber.offset()).isNull();
    assertThat(sequenceNumber.sequenceNumber()).isEqualTo(42L);
    assertThat(sequenceNumber.inclusive()).isFalse();
    Instant now = Instant.now();
    assertThat(EventPosition.fromEnqueuedTime(now).enqueuedTime()).isEqualTo(now);
    assertThatThrownBy(() -> EventPosition.fromEnqueuedTime(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void consumerOptions() {
    ConsumerOptions options = new ConsumerOptions();
    assertThat(options.prefetchCount()).isEqualTo(ConsumerOptions.DEFAULT_PREFETCH_COUNT);
    assertThat(options.ownerLevel()).isNull();
    assertThat(options.trackLastEnqueuedEventInformation()).isFalse();
    assertThat(options.prefetchCount(0).prefetchCount()).isZero();
    assertThatThrownBy(() -> options.prefetchCount(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
