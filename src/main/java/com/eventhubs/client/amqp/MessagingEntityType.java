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

/** Entity types known by the service, with their wire code. */
public enum MessagingEntityType {
  QUEUE(0),
  TOPIC(1),
  SUBSCRIBER(2),
  FILTER(3),
  NAMESPACE(4),
  VOLATILE_TOPIC(5),
  VOLATILE_TOPIC_SUBSCRIPTION(6),
  EVENT_HUB(7),
  CONSUMER_GROUP(8),
  PARTITION(9),
  CHECKPOINT(10),
  REVOKED_PUBLISHER(11),
  UNKNOWN(0x7FFFFFFE);

  private final int code;

  MessagingEntityType(int code) {
    this.code = code;
  }

  public int code() {
    return this.code;
  }
}
