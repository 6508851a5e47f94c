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

import com.eventhubs.client.amqp.EventPosition;

/** Maps an {@link EventPosition} to the selector filter expression of a receiving link. */
final class AmqpFilter {

  static final String OFFSET_ANNOTATION = "amqp.annotation.x-opt-offset";
  static final String SEQUENCE_NUMBER_ANNOTATION = "amqp.annotation.x-opt-sequence-number";
  static final String ENQUEUED_TIME_ANNOTATION = "amqp.annotation.x-opt-enqueued-time";

  private AmqpFilter() {}

  static String expression(EventPosition position) {
    Assert.notNull(position, "Event position cannot be null");
    if (position.offset() != null) {
      return comparison(OFFSET_ANNOTATION, position.inclusive(), position.offset());
    } else if (position.sequenceNumber() != null) {
      return comparison(
          SEQUENCE_NUMBER_ANNOTATION,
          position.inclusive(),
          String.valueOf(position.sequenceNumber()));
    } else if (position.enqueuedTime() != null) {
      return comparison(
          ENQUEUED_TIME_ANNOTATION,
          position.inclusive(),
          String.valueOf(position.enqueuedTime().toEpochMilli()));
    } else {
      throw new IllegalArgumentException("No filter can be built from " + position);
    }
  }

  private static String comparison(String annotation, boolean inclusive, String value) {
    return annotation + (inclusive ? " >= '" : " > '") + value + "'";
  }
}
