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

import com.eventhubs.client.amqp.AmqpException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;
import org.apache.qpid.protonj2.client.ErrorCondition;
import org.apache.qpid.protonj2.client.exceptions.ClientConnectionRemotelyClosedException;
import org.apache.qpid.protonj2.client.exceptions.ClientConnectionSecurityException;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.apache.qpid.protonj2.client.exceptions.ClientLinkRemotelyClosedException;
import org.apache.qpid.protonj2.client.exceptions.ClientOperationTimedOutException;
import org.apache.qpid.protonj2.client.exceptions.ClientResourceRemotelyClosedException;
import org.apache.qpid.protonj2.client.exceptions.ClientSessionRemotelyClosedException;

abstract class ExceptionUtils {

  static final String ERROR_UNAUTHORIZED_ACCESS = "amqp:unauthorized-access";
  static final String ERROR_NOT_FOUND = "amqp:not-found";
  static final String ERROR_RESOURCE_DELETED = "amqp:resource-deleted";

  private ExceptionUtils() {}

  static <T> T wrapGet(Future<T> future) throws ClientException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      if (e.getCause() instanceof ClientException) {
        throw (ClientException) e.getCause();
      } else {
        throw convert(e);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException(e);
    }
  }

  /**
   * Strip the wrappers {@link java.util.concurrent.CompletableFuture} adds around the cause of a
   * failure.
   */
  static Throwable unwrap(Throwable t) {
    Throwable result = t;
    while ((result instanceof CompletionException || result instanceof ExecutionException)
        && result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }

  /**
   * Convert a failure to the exception to report to the application.
   *
   * <p>{@link CancellationException}s, {@link AmqpException}s, and {@link
   * IllegalArgumentException}s are returned as-is.
   */
  static RuntimeException propagate(Throwable t) {
    Throwable cause = unwrap(t);
    if (cause instanceof CancellationException
        || cause instanceof AmqpException
        || cause instanceof IllegalArgumentException) {
      return (RuntimeException) cause;
    } else if (cause instanceof TimeoutException) {
      return new AmqpException.AmqpTimeoutException("Operation timed out: %s", cause.getMessage());
    } else if (cause instanceof ClientException) {
      return convert((ClientException) cause);
    } else {
      return new AmqpException(cause);
    }
  }

  static AmqpException convert(ClientException e) {
    return convert(e, null);
  }

  static AmqpException convert(ExecutionException e) {
    if (e.getCause() instanceof ClientException) {
      return convert((ClientException) e.getCause());
    } else {
      return new AmqpException(e.getCause() == null ? e : e.getCause());
    }
  }

  static AmqpException convert(ClientException e, String format, Object... args) {
    return convert(e, true, format, args);
  }

  private static AmqpException convert(
      ClientException e, boolean checkCause, String format, Object... args) {
    String message = format != null ? String.format(format, args) : null;
    AmqpException result;
    if (e.getCause() instanceof SSLException) {
      result = new AmqpException.AmqpSecurityException(message, e.getCause());
    } else if (e instanceof ClientConnectionSecurityException) {
      result = new AmqpException.AmqpSecurityException(message, e);
    } else if (e instanceof ClientOperationTimedOutException) {
      result =
          new AmqpException.AmqpTimeoutException(
              "%s", message == null ? e.getMessage() : message);
    } else if (isNetworkError(e)) {
      result = new AmqpException.AmqpConnectionException(e.getMessage(), e);
    } else if (e instanceof ClientLinkRemotelyClosedException) {
      ErrorCondition errorCondition =
          ((ClientResourceRemotelyClosedException) e).getErrorCondition();
      if (isUnauthorizedAccess(errorCondition)) {
        result = new AmqpException.AmqpSecurityException(e.getMessage(), e);
      } else if (isNotFound(errorCondition) || isResourceDeleted(errorCondition)) {
        result = new AmqpException.AmqpEntityDoesNotExistException(e.getMessage(), e);
      } else {
        result = new AmqpException.AmqpLinkException(e.getMessage(), e);
      }
    } else if (e instanceof ClientSessionRemotelyClosedException) {
      ErrorCondition errorCondition =
          ((ClientResourceRemotelyClosedException) e).getErrorCondition();
      if (isUnauthorizedAccess(errorCondition)) {
        result = new AmqpException.AmqpSecurityException(e.getMessage(), e);
      } else if (isNotFound(errorCondition) || isResourceDeleted(errorCondition)) {
        result = new AmqpException.AmqpEntityDoesNotExistException(e.getMessage(), e);
      } else {
        result = new AmqpException.AmqpResourceClosedException(e.getMessage(), e);
      }
    } else if (e instanceof ClientConnectionRemotelyClosedException) {
      ErrorCondition errorCondition =
          ((ClientConnectionRemotelyClosedException) e).getErrorCondition();
      if (isNetworkError(e) || !isUnauthorizedAccess(errorCondition)) {
        result = new AmqpException.AmqpConnectionException(e.getMessage(), e);
      } else {
        result = new AmqpException.AmqpSecurityException(e.getMessage(), e);
      }
    } else {
      result = new AmqpException(message, e);
    }
    if (checkCause
        && AmqpException.class.getName().equals(result.getClass().getName())
        && e.getCause() instanceof ClientException) {
      // generic exception, the cause may tell more
      result = convert((ClientException) e.getCause(), false, format, args);
    }
    return result;
  }

  private static boolean isUnauthorizedAccess(ErrorCondition errorCondition) {
    return errorConditionEquals(errorCondition, ERROR_UNAUTHORIZED_ACCESS);
  }

  private static boolean isNotFound(ErrorCondition errorCondition) {
    return errorConditionEquals(errorCondition, ERROR_NOT_FOUND);
  }

  private static boolean isResourceDeleted(ErrorCondition errorCondition) {
    return errorConditionEquals(errorCondition, ERROR_RESOURCE_DELETED);
  }

  private static boolean errorConditionEquals(ErrorCondition errorCondition, String expected) {
    return errorCondition != null && expected.equals(errorCondition.condition());
  }

  private static boolean isNetworkError(ClientException e) {
    if (e instanceof ClientConnectionRemotelyClosedException) {
      String message = e.getMessage();
      if (message != null) {
        message = message.toLowerCase();
        return message.contains("connection reset") || message.contains("connection refused");
      }
    }
    return false;
  }
}
