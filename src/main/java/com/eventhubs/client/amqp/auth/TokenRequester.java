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
package com.eventhubs.client.amqp.auth;

import java.util.List;

/**
 * Contract to request a token for a resource.
 *
 * <p>Implementations may block, they are called from a worker thread.
 */
public interface TokenRequester {

  /**
   * Request a token.
   *
   * @param audience the resource the token applies to
   * @param claims the required claims (e.g. <code>Listen</code>)
   * @return the token
   */
  Token request(String audience, List<String> claims);
}
