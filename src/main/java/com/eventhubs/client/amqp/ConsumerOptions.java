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

/**
 * Options of a consumer link.
 *
 * <p>This class is mutable, it is copied when a link is opened.
 */
public class ConsumerOptions {

  /** Default prefetch count, used as the credit window of the link. */
  public static final int DEFAULT_PREFETCH_COUNT = 300;

  private String identifier;
  private Long ownerLevel;
  private int prefetchCount = DEFAULT_PREFETCH_COUNT;
  private boolean trackLastEnqueuedEventInformation = false;

  /**
   * Identifier of the consumer, sent to the service as a link property.
   *
   * <p>Ignored if blank.
   *
   * @param identifier the identifier
   * @return this options instance
   */
  public ConsumerOptions identifier(String identifier) {
    this.identifier = identifier;
    return this;
  }

  /**
   * Owner level (epoch) of the consumer, for exclusive reading of a partition.
   *
   * <p>The link with the highest owner level wins, <code>null</code> means non-exclusive.
   *
   * @param ownerLevel the owner level
   * @return this options instance
   */
  public ConsumerOptions ownerLevel(Long ownerLevel) {
    this.ownerLevel = ownerLevel;
    return this;
  }

  /**
   * Number of events to ask the service to send in advance.
   *
   * <p>Default is {@link #DEFAULT_PREFETCH_COUNT}.
   *
   * @param prefetchCount the prefetch count
   * @return this options instance
   */
  public ConsumerOptions prefetchCount(int prefetchCount) {
    if (prefetchCount < 0) {
      throw new IllegalArgumentException("Prefetch count cannot be negative: " + prefetchCount);
    }
    this.prefetchCount = prefetchCount;
    return this;
  }

  /**
   * Ask the service to send information about the last enqueued event of the partition with
   * each delivery.
   *
   * @param track whether to track last enqueued event information
   * @return this options instance
   */
  public ConsumerOptions trackLastEnqueuedEventInformation(boolean track) {
    this.trackLastEnqueuedEventInformation = track;
    return this;
  }

  public String identifier() {
    return this.identifier;
  }

  public Long ownerLevel() {
    return this.ownerLevel;
  }

  public int prefetchCount() {
    return this.prefetchCount;
  }

  public boolean trackLastEnqueuedEventInformation() {
    return this.trackLastEnqueuedEventInformation;
  }
}
