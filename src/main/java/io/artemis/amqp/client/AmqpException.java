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
package io.artemis.amqp.client;

/**
 * Root of the client exception hierarchy.
 *
 * <p>All client exceptions are unchecked. Asynchronous operations complete their {@link
 * java.util.concurrent.CompletableFuture} exceptionally with one of the subclasses.
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

  /** Exception thrown when the transport fails or the broker cannot be reached. */
  public static class AmqpConnectionException extends AmqpException {

    public AmqpConnectionException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpConnectionException(String format, Object... args) {
      super(format, args);
    }
  }

  /** Exception thrown for authentication and authorization failures. */
  public static class AmqpSecurityException extends AmqpException {

    public AmqpSecurityException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpSecurityException(Throwable cause) {
      super(cause);
    }
  }

  /** Exception thrown when a resource is used while not in the appropriate state. */
  public static class AmqpResourceInvalidStateException extends AmqpException {

    public AmqpResourceInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public AmqpResourceInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Exception thrown when a closed resource is used. */
  public static class AmqpResourceClosedException extends AmqpResourceInvalidStateException {

    public AmqpResourceClosedException(String message) {
      super(message);
    }

    public AmqpResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * Exception raised when a {@link Producer} cannot send because it is closed, detaching or
   * waiting for its connection to recover.
   */
  public static class AmqpProducerClosedException extends AmqpResourceClosedException {

    public AmqpProducerClosedException(String message) {
      super(message);
    }

    public AmqpProducerClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * Exception raised when the broker does not accept a message.
   *
   * <p>The error condition and description come from the broker when it rejects the message.
   */
  public static class AmqpMessageSendException extends AmqpException {

    /** Condition used when the broker releases a message. */
    public static final String MESSAGE_RELEASED = "amqp:message-released";

    /** Condition used when the broker returns an outcome the client does not expect. */
    public static final String INTERNAL_ERROR = "amqp:internal-error";

    private final String condition;
    private final String description;

    public AmqpMessageSendException(String condition, String description) {
      super(description == null ? condition : condition + ": " + description);
      this.condition = condition;
      this.description = description;
    }

    public AmqpMessageSendException(String message, Throwable cause) {
      super(message, cause);
      this.condition = INTERNAL_ERROR;
      this.description = message;
    }

    /**
     * AMQP error condition, e.g. <code>amqp:resource-limit-exceeded</code>.
     *
     * @return the error condition
     */
    public String condition() {
      return this.condition;
    }

    /**
     * Error description, can be null.
     *
     * @return the error description
     */
    public String description() {
      return this.description;
    }
  }

  /** Exception raised when the transaction coordinator refuses or cannot complete a request. */
  public static class AmqpCoordinatorException extends AmqpException {

    private final boolean stale;

    public AmqpCoordinatorException(String format, Object... args) {
      super(format, args);
      this.stale = false;
    }

    public AmqpCoordinatorException(String message, Throwable cause) {
      this(message, cause, false);
    }

    public AmqpCoordinatorException(String message, Throwable cause, boolean stale) {
      super(message, cause);
      this.stale = stale;
    }

    /**
     * Whether the transaction was declared on a coordinator that is gone because the connection
     * recovered in between.
     *
     * @return true if the transaction cannot be discharged anymore
     */
    public boolean isStale() {
      return this.stale;
    }
  }

  /** Exception reported when connection recovery gives up. */
  public static class AmqpRecoveryExhaustedException extends AmqpConnectionException {

    public AmqpRecoveryExhaustedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Exception used when an awaited operation is cancelled or times out locally. */
  public static class AmqpOperationCancelledException extends AmqpException {

    public AmqpOperationCancelledException(String format, Object... args) {
      super(format, args);
    }

    public AmqpOperationCancelledException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
