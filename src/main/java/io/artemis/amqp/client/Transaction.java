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
 * Local transaction grouping sends on a {@link Connection}.
 *
 * <p>A transaction is declared on the broker the first time a message is sent with it. Messages
 * sent with a transaction are visible to consumers only after a successful commit.
 *
 * <p>A transaction declared before a connection recovery cannot be discharged anymore: commit and
 * rollback then fail with an {@link AmqpException.AmqpCoordinatorException} flagged as stale.
 *
 * @see Producer#sendAsync(Message, Transaction)
 */
public interface Transaction extends AutoCloseable {

  /**
   * Commit the transaction.
   *
   * <p>Committing a transaction no message has been sent with is a no-op.
   *
   * @return a future completing when the broker confirmed the commit
   */
  CompletableFuture<Void> commitAsync();

  /**
   * Commit the transaction, with a timeout.
   *
   * @param timeout how long to wait for the broker
   * @return a future completing when the broker confirmed the commit
   */
  CompletableFuture<Void> commitAsync(Duration timeout);

  /**
   * Roll back the transaction.
   *
   * @return a future completing when the broker confirmed the rollback
   */
  CompletableFuture<Void> rollbackAsync();

  CompletableFuture<Void> rollbackAsync(Duration timeout);

  /**
   * Whether the transaction has been declared on the broker.
   *
   * @return true if declared
   */
  boolean isEnlisted();

  /**
   * Roll back the transaction if it is declared and not yet committed or rolled back.
   *
   * <p>The rollback is not awaited.
   */
  @Override
  void close();
}
