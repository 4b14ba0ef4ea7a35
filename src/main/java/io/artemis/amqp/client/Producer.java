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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * API to send messages to an address.
 *
 * <p>Instances are configured and created with a {@link ProducerBuilder}.
 *
 * <p>Implementations must be thread-safe.
 *
 * @see ProducerBuilder
 * @see Connection#producerBuilder()
 */
public interface Producer extends AutoCloseable, Resource {

  /**
   * Create an empty message.
   *
   * @return a new message
   */
  Message message();

  /**
   * Create a message with the provided body.
   *
   * @param body message body
   * @return a new message
   */
  Message message(byte[] body);

  /**
   * Send a message and wait for the broker outcome.
   *
   * <p>The future completes when the broker accepts the message. It completes exceptionally with
   * an {@link AmqpException.AmqpMessageSendException} when the broker rejects or releases the
   * message, with an {@link AmqpException.AmqpProducerClosedException} when the producer is
   * closed or recovering. Cancelling the future stops waiting for the outcome.
   *
   * <p>Messages with no explicit durability are sent durable unless the producer is configured
   * otherwise.
   *
   * @param message the message
   * @return future of the outcome
   */
  CompletableFuture<Void> sendAsync(Message message);

  /**
   * Send a message in a transaction and wait for the broker outcome.
   *
   * <p>The transaction is declared with the first message sent. A null transaction means no
   * transaction.
   *
   * @param message the message
   * @param transaction the transaction, can be null
   * @return future of the outcome
   */
  CompletableFuture<Void> sendAsync(Message message, Transaction transaction);

  /**
   * Send a message in a transaction and wait at most the provided time for the outcome.
   *
   * <p>The future completes with an {@link AmqpException.AmqpOperationCancelledException} if the
   * outcome does not come in time.
   *
   * @param message the message
   * @param transaction the transaction, can be null
   * @param timeout how long to wait for the outcome
   * @return future of the outcome
   */
  CompletableFuture<Void> sendAsync(Message message, Transaction transaction, Duration timeout);

  /**
   * Send a message without waiting for any outcome.
   *
   * <p>Messages with no explicit durability are sent non-durable unless the producer is
   * configured otherwise.
   *
   * @param message the message
   * @throws AmqpException.AmqpProducerClosedException if the producer is closed or recovering
   */
  void send(Message message);

  /** Close the producer. */
  @Override
  void close();
}
