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

/** Names of the link properties, capabilities, and filters the service understands. */
final class AmqpProperties {

  static final String ENTITY_TYPE = "com.microsoft:entity-type";
  static final String RECEIVER_IDENTIFIER = "com.microsoft:receiver-name";
  static final String OWNER_LEVEL = "com.microsoft:epoch";
  static final String TIMEOUT = "com.microsoft:timeout";
  static final String TRACK_LAST_ENQUEUED_EVENT_INFORMATION =
      "com.microsoft:enable-receiver-runtime-metric";

  static final String SELECTOR_FILTER = "apache.org:selector-filter:string";

  static final String MANAGEMENT_ADDRESS = "$management";
  static final String CBS_ADDRESS = "$cbs";

  static final String CLAIM_LISTEN = "Listen";
  static final String CLAIM_MANAGE = "Manage";

  private AmqpProperties() {}
}
