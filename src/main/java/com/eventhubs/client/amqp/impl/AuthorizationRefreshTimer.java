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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renews the authorization of a link before it expires.
 *
 * <p>The timer is one-shot: each run re-authorizes the link and arms the timer again from the
 * new expiration time. A failed refresh is reported and the timer is armed again from the last
 * known expiration time, the link stays open. Once that expiration time has passed, failed
 * refreshes are retried with an exponential backoff, capped at {@link
 * #DEFAULT_FAILURE_RETRY_MAX_DELAY} by default.
 *
 * <p>{@link #NONE} stands for links that need no renewal.
 */
final class AuthorizationRefreshTimer {

  static final Function<Instant, Duration> DEFAULT_REFRESH_DELAY_STRATEGY =
      ratioRefreshDelayStrategy(0.8f);

  static final Duration DEFAULT_FAILURE_RETRY_INITIAL_DELAY = Duration.ofSeconds(1);
  static final Duration DEFAULT_FAILURE_RETRY_MAX_DELAY = Duration.ofMinutes(5);

  private static final Logger LOGGER = LoggerFactory.getLogger(AuthorizationRefreshTimer.class);

  static final AuthorizationRefreshTimer NONE = new AuthorizationRefreshTimer();

  private final String linkName;
  private final ScheduledExecutorService scheduledExecutorService;
  private final Function<Instant, Duration> refreshDelayStrategy;
  private final Supplier<CompletableFuture<Instant>> authorization;
  private final Consumer<Throwable> failureHandler;
  private final Duration failureRetryInitialDelay;
  private final Duration failureRetryMaxDelay;
  private final AtomicBoolean disposed = new AtomicBoolean(false);
  private final Lock lock = new ReentrantLock();
  private volatile Instant expirationTime;
  private volatile ScheduledFuture<?> refreshTask;
  private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

  private AuthorizationRefreshTimer() {
    this.linkName = "none";
    this.scheduledExecutorService = null;
    this.refreshDelayStrategy = null;
    this.authorization = null;
    this.failureHandler = null;
    this.failureRetryInitialDelay = null;
    this.failureRetryMaxDelay = null;
    this.disposed.set(true);
  }

  /**
   * @param linkName name of the link, for logging
   * @param scheduledExecutorService scheduler of the refresh task
   * @param refreshDelayStrategy computes the delay before the refresh from the expiration time
   * @param authorization re-authorizes the link, returns the new expiration time
   * @param failureHandler called when a refresh fails
   */
  AuthorizationRefreshTimer(
      String linkName,
      ScheduledExecutorService scheduledExecutorService,
      Function<Instant, Duration> refreshDelayStrategy,
      Supplier<CompletableFuture<Instant>> authorization,
      Consumer<Throwable> failureHandler) {
    this(
        linkName,
        scheduledExecutorService,
        refreshDelayStrategy,
        authorization,
        failureHandler,
        DEFAULT_FAILURE_RETRY_INITIAL_DELAY,
        DEFAULT_FAILURE_RETRY_MAX_DELAY);
  }

  AuthorizationRefreshTimer(
      String linkName,
      ScheduledExecutorService scheduledExecutorService,
      Function<Instant, Duration> refreshDelayStrategy,
      Supplier<CompletableFuture<Instant>> authorization,
      Consumer<Throwable> failureHandler,
      Duration failureRetryInitialDelay,
      Duration failureRetryMaxDelay) {
    this.linkName = linkName;
    this.scheduledExecutorService = scheduledExecutorService;
    this.refreshDelayStrategy = refreshDelayStrategy;
    this.authorization = authorization;
    this.failureHandler = failureHandler;
    this.failureRetryInitialDelay = failureRetryInitialDelay;
    this.failureRetryMaxDelay = failureRetryMaxDelay;
  }

  /**
   * Arm the timer for the first time.
   *
   * @param expirationTime expiration time of the current authorization
   */
  void start(Instant expirationTime) {
    this.schedule(expirationTime, this.refreshDelayStrategy.apply(expirationTime));
  }

  private void schedule(Instant expiration, Duration delay) {
    if (this.disposed.get()) {
      return;
    }
    this.expirationTime = expiration;
    this.lock.lock();
    try {
      if (this.disposed.get()) {
        return;
      }
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(
            "Scheduling authorization refresh of link '{}' in {} (expiration: {})",
            this.linkName,
            delay,
            DateTimeFormatter.ISO_INSTANT.format(expiration));
      }
      this.refreshTask =
          this.scheduledExecutorService.schedule(
              Utils.namedRunnable(this::refresh, "Authorization refresh of link '%s'", linkName),
              delay.toMillis(),
              TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      LOGGER.debug(
          "Could not schedule authorization refresh of link '{}': {}",
          this.linkName,
          e.getMessage());
    } finally {
      this.lock.unlock();
    }
  }

  private void refresh() {
    if (this.disposed.get()) {
      return;
    }
    LOGGER.debug("Refreshing authorization of link '{}'", this.linkName);
    CompletableFuture<Instant> refresh;
    try {
      refresh = this.authorization.get();
    } catch (Exception e) {
      refresh = CompletableFuture.failedFuture(e);
    }
    refresh.whenComplete(
        (newExpiration, ex) -> {
          if (ex == null) {
            LOGGER.debug("Authorization of link '{}' refreshed", this.linkName);
            this.consecutiveFailures.set(0);
            this.schedule(newExpiration, this.refreshDelayStrategy.apply(newExpiration));
          } else {
            Throwable cause = ExceptionUtils.unwrap(ex);
            if (!this.disposed.get()) {
              LOGGER.warn(
                  "Error while refreshing authorization of link '{}': {}",
                  this.linkName,
                  cause.getMessage());
              try {
                this.failureHandler.accept(cause);
              } catch (Exception e) {
                LOGGER.info("Error in authorization failure handler: {}", e.getMessage());
              }
            }
            this.consecutiveFailures.incrementAndGet();
            this.schedule(this.expirationTime, this.retryDelay());
          }
        });
  }

  private Duration retryDelay() {
    Instant expiration = this.expirationTime;
    Duration delay = this.refreshDelayStrategy.apply(expiration);
    if (Instant.now().isBefore(expiration)) {
      return delay;
    }
    // the authorization has expired, the service enforces it from now on
    int exponent = Math.min(this.consecutiveFailures.get() - 1, 20);
    Duration backoff = this.failureRetryInitialDelay.multipliedBy(1L << exponent);
    if (backoff.compareTo(this.failureRetryMaxDelay) > 0) {
      backoff = this.failureRetryMaxDelay;
    }
    return backoff.compareTo(delay) > 0 ? backoff : delay;
  }

  /**
   * Stop the timer. Only the first call has an effect.
   *
   * @return true if this call disposed the timer
   */
  boolean dispose() {
    if (this == NONE) {
      return false;
    }
    if (this.disposed.compareAndSet(false, true)) {
      this.lock.lock();
      try {
        ScheduledFuture<?> task = this.refreshTask;
        if (task != null) {
          task.cancel(false);
        }
        this.refreshTask = null;
      } finally {
        this.lock.unlock();
      }
      LOGGER.debug("Authorization refresh timer of link '{}' disposed", this.linkName);
      return true;
    } else {
      return false;
    }
  }

  boolean isDisposed() {
    return this.disposed.get();
  }

  /**
   * Whether this timer renews an authorization.
   *
   * @return false for {@link #NONE}
   */
  boolean active() {
    return this != NONE;
  }

  Instant expirationTime() {
    return this.expirationTime;
  }

  @Override
  public String toString() {
    return "AuthorizationRefreshTimer{" + (this == NONE ? "none" : this.linkName) + "}";
  }

  static Function<Instant, Duration> ratioRefreshDelayStrategy(float ratio) {
    return new RatioRefreshDelayStrategy(ratio);
  }

  private static class RatioRefreshDelayStrategy implements Function<Instant, Duration> {

    private static final Duration MINIMUM_DELAY = Duration.ofSeconds(1);

    private final float ratio;

    @SuppressFBWarnings("CT_CONSTRUCTOR_THROW")
    private RatioRefreshDelayStrategy(float ratio) {
      if (ratio <= 0 || ratio > 1) {
        throw new IllegalArgumentException("Ratio should be > 0 and <= 1: " + ratio);
      }
      this.ratio = ratio;
    }

    @Override
    public Duration apply(Instant expirationTime) {
      Duration expiresIn = Duration.between(Instant.now(), expirationTime);
      Duration delay;
      if (expiresIn.isZero() || expiresIn.isNegative()) {
        delay = MINIMUM_DELAY;
      } else {
        delay = Duration.ofMillis((long) (expiresIn.toMillis() * ratio));
        if (delay.compareTo(MINIMUM_DELAY) < 0) {
          delay = MINIMUM_DELAY;
        }
      }
      return delay;
    }
  }
}
