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
 * API to receive messages from an address.
 *
 * <p>Received messages must be settled with {@link #accept(Message)}, {@link #reject(Message)} or
 * {@link #release(Message)}. Settling a message grants the broker a new credit.
 *
 * @see ConsumerBuilder
 * @see Connection#consumerBuilder()
 */
public interface Consumer extends AutoCloseable, Resource {

  /**
   * Receive the next message.
   *
   * @return future of the next message
   */
  CompletableFuture<Message> receiveAsync();

  /**
   * Receive the next message, waiting at most the provided time.
   *
   * <p>The future completes with an {@link AmqpException.AmqpOperationCancelledException} if no
   * message comes in time.
   *
   * @param timeout how long to wait
   * @return future of the next message
   */
  CompletableFuture<Message> receiveAsync(Duration timeout);

  /**
   * Accept a received message, the broker removes it.
   *
   * @param message the message
   */
  void accept(Message message);

  /**
   * Reject a received message, the broker does not deliver it again.
   *
   * @param message the message
   */
  void reject(Message message);

  /**
   * Release a received message, the broker can deliver it again.
   *
   * @param message the message
   */
  void release(Message message);

  /** Close the consumer. Pending receives complete exceptionally. */
  @Override
  void close();
}
