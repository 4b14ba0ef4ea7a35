// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
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
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package io.artemis.amqp.client.impl;

import io.artemis.amqp.client.AmqpException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

abstract class ExceptionUtils {

  static final String ERROR_UNAUTHORIZED_ACCESS = "amqp:unauthorized-access";
  static final String ERROR_TRANSACTION_UNKNOWN_ID = "amqp:transaction:unknown-id";

  private ExceptionUtils() {}

  static <T> T wrapGet(Future<T> future) {
    try {
      return future.get();
    } catch (ExecutionException e) {
      throw convert(e.getCause() == null ? e : e.getCause());
    } catch (CancellationException e) {
      throw new AmqpException.AmqpOperationCancelledException("Operation cancelled", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException(e);
    }
  }

  static <T> T wrapGet(Future<T> future, Duration timeout) {
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(false);
      throw new AmqpException.AmqpOperationCancelledException(
          "Operation timed out after " + timeout.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      throw convert(e.getCause() == null ? e : e.getCause());
    } catch (CancellationException e) {
      throw new AmqpException.AmqpOperationCancelledException("Operation cancelled", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException(e);
    }
  }

  /** Remove the wrappers {@link java.util.concurrent.CompletableFuture} adds to failures. */
  static Throwable unwrap(Throwable t) {
    Throwable result = t;
    while ((result instanceof CompletionException || result instanceof ExecutionException)
        && result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }

  static AmqpException convert(Throwable t) {
    Throwable e = unwrap(t);
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    } else if (e instanceof SSLException || e.getCause() instanceof SSLException) {
      return new AmqpException.AmqpSecurityException(e.getMessage(), e);
    } else if (e instanceof IOException) {
      return new AmqpException.AmqpConnectionException(e.getMessage(), e);
    } else if (e instanceof CancellationException) {
      return new AmqpException.AmqpOperationCancelledException("Operation cancelled", e);
    } else if (e instanceof TimeoutException) {
      return new AmqpException.AmqpOperationCancelledException(e.getMessage(), e);
    } else {
      return new AmqpException(e.getMessage(), e);
    }
  }

  static AmqpException convert(Throwable t, String format, Object... args) {
    AmqpException converted = convert(t);
    if (converted.getClass() == AmqpException.class) {
      return new AmqpException(String.format(format, args), unwrap(t));
    } else {
      return converted;
    }
  }

  /** Whether the failure comes from the network connection and warrants a new connection. */
  static boolean isConnectionFailure(Throwable t) {
    Throwable e = unwrap(t);
    return e instanceof AmqpException.AmqpConnectionException
        || (e instanceof IOException && !(e instanceof SSLException));
  }

  /** Failure for a link the peer closed, e.g. because the address does not exist. */
  static AmqpException remoteClose(Object resource, String condition, String description) {
    String message =
        String.format(
            "%s closed by peer (%s): %s",
            resource, condition == null ? "no error" : condition, description);
    if (ERROR_UNAUTHORIZED_ACCESS.equals(condition)) {
      return new AmqpException.AmqpSecurityException(message, null);
    } else {
      return new AmqpException.AmqpResourceClosedException(message);
    }
  }
}
