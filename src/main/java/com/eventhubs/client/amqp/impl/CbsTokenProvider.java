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

import com.eventhubs.client.amqp.auth.Token;
import com.eventhubs.client.amqp.auth.TokenRequester;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides the tokens used for claims-based-security authorization.
 *
 * <p>Tokens are cached per audience and claims, a cached token is reused as long as it does not
 * expire within the refresh margin. Requests run on the given executor, as {@link
 * TokenRequester}s can block.
 */
final class CbsTokenProvider {

  static final Duration DEFAULT_REFRESH_MARGIN = Duration.ofMinutes(5);

  private static final Logger LOGGER = LoggerFactory.getLogger(CbsTokenProvider.class);

  private final TokenRequester requester;
  private final Executor executor;
  private final Duration refreshMargin;
  private final Map<String, Token> tokens = new ConcurrentHashMap<>();

  CbsTokenProvider(TokenRequester requester, Executor executor) {
    this(requester, executor, DEFAULT_REFRESH_MARGIN);
  }

  CbsTokenProvider(TokenRequester requester, Executor executor, Duration refreshMargin) {
    this.requester = requester;
    this.executor = executor;
    this.refreshMargin = refreshMargin;
  }

  /**
   * Get a token, from the cache if possible.
   *
   * @param audience the resource
   * @param claims the claims
   * @return the token
   */
  CompletableFuture<Token> token(String audience, List<String> claims) {
    String key = key(audience, claims);
    Token cached = this.tokens.get(key);
    if (cached != null && !expiresSoon(cached)) {
      LOGGER.debug("Using cached token for '{}'", audience);
      return CompletableFuture.completedFuture(cached);
    }
    return this.request(audience, claims);
  }

  /**
   * Request a new token, bypassing the cache.
   *
   * @param audience the resource
   * @param claims the claims
   * @return the token
   */
  CompletableFuture<Token> refresh(String audience, List<String> claims) {
    return this.request(audience, claims);
  }

  private CompletableFuture<Token> request(String audience, List<String> claims) {
    String key = key(audience, claims);
    return CompletableFuture.supplyAsync(
        () -> {
          LOGGER.debug("Requesting token for '{}' (claims: {})", audience, claims);
          Utils.StopWatch stopWatch = new Utils.StopWatch();
          Token token = this.requester.request(audience, claims);
          if (token == null) {
            throw new IllegalStateException("Token requester returned no token for " + audience);
          }
          if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(
                "Got token for '{}' in {} ms, token expires on {}",
                audience,
                stopWatch.stop().toMillis(),
                DateTimeFormatter.ISO_INSTANT.format(token.expirationTime()));
          }
          this.tokens.put(key, token);
          return token;
        },
        this.executor);
  }

  private boolean expiresSoon(Token token) {
    return !token.expirationTime().isAfter(Instant.now().plus(this.refreshMargin));
  }

  void clear() {
    this.tokens.clear();
  }

  private static String key(String audience, List<String> claims) {
    return audience + "|" + String.join(",", claims);
  }
}
