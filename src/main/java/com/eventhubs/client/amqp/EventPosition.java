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

import java.time.Instant;
import java.util.Objects;

/**
 * Position in a partition to start reading events from.
 *
 * <p>Exactly one of offset, sequence number, or enqueued time is set.
 */
public final class EventPosition {

  private static final String START_OF_STREAM_OFFSET = "-1";
  private static final String END_OF_STREAM_OFFSET = "@latest";

  private static final EventPosition EARLIEST =
      new EventPosition(START_OF_STREAM_OFFSET, null, null, false);
  private static final EventPosition LATEST =
      new EventPosition(END_OF_STREAM_OFFSET, null, null, false);

  private final String offset;
  private final Long sequenceNumber;
  private final Instant enqueuedTime;
  private final boolean inclusive;

  private EventPosition(
      String offset, Long sequenceNumber, Instant enqueuedTime, boolean inclusive) {
    this.offset = offset;
    this.sequenceNumber = sequenceNumber;
    this.enqueuedTime = enqueuedTime;
    this.inclusive = inclusive;
  }

  /**
   * The first event available in the partition.
   *
   * @return the position
   */
  public static EventPosition earliest() {
    return EARLIEST;
  }

  /**
   * Only events enqueued after the link is opened.
   *
   * @return the position
   */
  public static EventPosition latest() {
    return LATEST;
  }

  public static EventPosition fromOffset(long offset) {
    return fromOffset(offset, false);
  }

  public static EventPosition fromOffset(long offset, boolean inclusive) {
    return new EventPosition(String.valueOf(offset), null, null, inclusive);
  }

  public static EventPosition fromSequenceNumber(long sequenceNumber) {
    return fromSequenceNumber(sequenceNumber, false);
  }

  public static EventPosition fromSequenceNumber(long sequenceNumber, boolean inclusive) {
    return new EventPosition(null, sequenceNumber, null, inclusive);
  }

  public static EventPosition fromEnqueuedTime(Instant enqueuedTime) {
    if (enqueuedTime == null) {
      throw new IllegalArgumentException("Enqueued time cannot be null");
    }
    return new EventPosition(null, null, enqueuedTime, false);
  }

  public String offset() {
    return this.offset;
  }

  public Long sequenceNumber() {
    return this.sequenceNumber;
  }

  public Instant enqueuedTime() {
    return this.enqueuedTime;
  }

  public boolean inclusive() {
    return this.inclusive;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    EventPosition that = (EventPosition) o;
    return inclusive == that.inclusive
        && Objects.equals(offset, that.offset)
        && Objects.equals(sequenceNumber, that.sequenceNumber)
        && Objects.equals(enqueuedTime, that.enqueuedTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(offset, sequenceNumber, enqueuedTime, inclusive);
  }

  @Override
  public String toString() {
    if (this.offset != null) {
      return "EventPosition{offset=" + this.offset + ", inclusive=" + this.inclusive + "}";
    } else if (this.sequenceNumber != null) {
      return "EventPosition{sequenceNumber="
          + this.sequenceNumber
          + ", inclusive="
          + this.inclusive
          + "}";
    } else {
      return "EventPosition{enqueuedTime=" + this.enqueuedTime + "}";
    }
  }
}
