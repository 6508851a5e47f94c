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
 * Base exception of the client.
 *
 * <p>Argument validation failures are reported with {@link IllegalArgumentException} and
 * cancellations with {@link java.util.concurrent.CancellationException}, all the other failures
 * are subclasses of this class.
 *
 * <p>{@link #isTransient()} tells whether the same operation may succeed if retried later.
 */
public class AmqpException extends RuntimeException {

  public AmqpException(Throwable cause) {
    super(cause);
  }

  public AmqpException(String format, Object... args) {
    super(String.format(format, args));
  }

  public AmqpException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether the failure is transient, that is retrying the operation may succeed.
   *
   * @return true for connection, link and timeout failures
   */
  public boolean isTransient() {
    return false;
  }

  /** The transport connection could not be established or has been lost. */
  public static class AmqpConnectionException extends AmqpException {

    public AmqpConnectionException(String message, Throwable cause) {
      super(message, cause);
    }

    @Override
    public boolean isTransient() {
      return true;
    }
  }

  /** A link could not be attached. */
  public static class AmqpLinkException extends AmqpException {

    public AmqpLinkException(String message, Throwable cause) {
      super(message, cause);
    }

    @Override
    public boolean isTransient() {
      return true;
    }
  }

  /** The broker refused the credentials or a TLS failure occurred. */
  public static class AmqpSecurityException extends AmqpException {

    public AmqpSecurityException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpSecurityException(Throwable cause) {
      super(cause);
    }
  }

  /** A claims-based-security authorization (initial or refresh) failed. */
  public static class AmqpAuthorizationException extends AmqpException {

    public AmqpAuthorizationException(String format, Object... args) {
      super(format, args);
    }

    public AmqpAuthorizationException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The targeted entity does not exist. */
  public static class AmqpEntityDoesNotExistException extends AmqpException {

    public AmqpEntityDoesNotExistException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The timeout budget of an operation has been exhausted. */
  public static class AmqpTimeoutException extends AmqpException {

    public AmqpTimeoutException(String format, Object... args) {
      super(format, args);
    }

    @Override
    public boolean isTransient() {
      return true;
    }
  }

  public static class AmqpResourceInvalidStateException extends AmqpException {

    public AmqpResourceInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public AmqpResourceInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The resource has been closed and cannot be used anymore. */
  public static class AmqpResourceClosedException extends AmqpResourceInvalidStateException {

    public AmqpResourceClosedException(String message) {
      super(message);
    }

    public AmqpResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
