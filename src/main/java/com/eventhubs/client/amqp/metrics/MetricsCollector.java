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

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a new transport connection is opened. */
  void openConnection();

  /** Called when a transport connection is closed. */
  void closeConnection();

  /** Called when a new management link is opened. */
  void openManagementLink();

  /** Called when a management link is closed. */
  void closeManagementLink();

  /** Called when a new consumer link is opened. */
  void openConsumerLink();

  /** Called when a consumer link is closed. */
  void closeConsumerLink();

  /** Called when an authorization token is accepted by the broker, initially or on refresh. */
  void authorization();

  /** Called when the refresh of an authorization token fails. */
  void authorizationFailure();
}
