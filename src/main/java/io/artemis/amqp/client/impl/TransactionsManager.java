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
import io.artemis.amqp.client.metrics.MetricsCollector;
import io.artemis.amqp.client.transport.TransactionalState;
import io.artemis.amqp.client.transport.TransportSession;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares transactions lazily, on their first send, and discharges them.
 *
 * <p>A single coordinator link per network connection serves all the transactions. Enlistment
 * runs under an asynchronous mutex, so concurrent first sends with the same transaction result in
 * a single declare.
 */
final class TransactionsManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransactionsManager.class);

  private final Supplier<CompletableFuture<TransportSession>> sessionFactory;
  private final MetricsCollector metricsCollector;
  private final AsyncMutex mutex = new AsyncMutex();
  // guarded by the mutex, except for invalidation
  private volatile CompletableFuture<TransactionController> controller;

  TransactionsManager(
      Supplier<CompletableFuture<TransportSession>> sessionFactory,
      MetricsCollector metricsCollector) {
    this.sessionFactory = sessionFactory;
    this.metricsCollector = metricsCollector;
  }

  /**
   * Transactional state to attach a delivery to, declaring the transaction if necessary.
   *
   * @param transaction the transaction, can be null
   * @return future of the state, of null if there is no transaction
   */
  CompletableFuture<TransactionalState> transactionalState(AmqpTransaction transaction) {
    if (transaction == null) {
      return CompletableFuture.completedFuture(null);
    }
    try {
      TransactionalState state = transaction.boundState();
      if (state != null) {
        return CompletableFuture.completedFuture(state);
      }
    } catch (AmqpException e) {
      return CompletableFuture.failedFuture(e);
    }
    return this.mutex.withLock(
        () -> {
          TransactionalState state = transaction.boundState();
          if (state != null) {
            return CompletableFuture.completedFuture(state);
          }
          transaction.enlisting();
          return this.controller()
              .thenCompose(
                  c ->
                      c.declare()
                          .thenApply(
                              txnId -> {
                                TransactionalState declared = new TransactionalState(txnId);
                                transaction.bind(declared, c);
                                this.metricsCollector.declareTransaction();
                                LOGGER.debug("Declared {} with {}", transaction, declared);
                                return declared;
                              }))
              .whenComplete(
                  (s, t) -> {
                    if (t != null) {
                      transaction.enlistmentFailed();
                    }
                  });
        });
  }

  /**
   * Commit or roll back a transaction.
   *
   * <p>Discharging a transaction that has never been declared is a no-op.
   *
   * @param transaction the transaction
   * @param fail true to roll back, false to commit
   * @return future completing once the coordinator accepted the discharge
   */
  CompletableFuture<Void> discharge(AmqpTransaction transaction, boolean fail) {
    AmqpTransaction.Status status = transaction.status();
    switch (status) {
      case UNBOUND:
        if (transaction.markDischarged(AmqpTransaction.Status.UNBOUND)) {
          LOGGER.debug("{} not declared, nothing to discharge", transaction);
          return CompletableFuture.completedFuture(null);
        } else {
          return this.discharge(transaction, fail);
        }
      case ENLISTING:
        // wait for the enlistment to complete
        return this.mutex
            .withLock(() -> CompletableFuture.completedFuture(null))
            .thenCompose(ignored -> this.discharge(transaction, fail));
      case BOUND:
        if (!transaction.markDischarged(AmqpTransaction.Status.BOUND)) {
          return this.discharge(transaction, fail);
        }
        try {
          transaction.checkNotStale();
        } catch (AmqpException e) {
          return CompletableFuture.failedFuture(e);
        }
        LOGGER.debug("Discharging {}, rollback: {}", transaction, fail);
        return transaction
            .controller()
            .discharge(transaction.state().txnId(), fail)
            .thenRun(() -> this.metricsCollector.dischargeTransaction(!fail));
      case DISCHARGED:
      default:
        return CompletableFuture.failedFuture(
            new AmqpException.AmqpCoordinatorException(
                "Transaction %s already discharged", transaction));
    }
  }

  /**
   * Drop the current coordinator, its transactions become stale.
   *
   * @param cause the reason, usually the connection failure
   */
  void invalidate(Throwable cause) {
    CompletableFuture<TransactionController> current = this.controller;
    this.controller = null;
    if (current != null) {
      LOGGER.debug("Invalidating transaction controller");
      AmqpException.AmqpCoordinatorException invalidation =
          new AmqpException.AmqpCoordinatorException(
              "Transaction coordinator lost with the connection", cause, true);
      current.thenAccept(c -> c.invalidate(invalidation));
    }
  }

  void close() {
    this.invalidate(new AmqpException.AmqpResourceClosedException("Connection closed"));
  }

  boolean hasController() {
    CompletableFuture<TransactionController> current = this.controller;
    return current != null && current.isDone() && !current.isCompletedExceptionally();
  }

  private CompletableFuture<TransactionController> controller() {
    CompletableFuture<TransactionController> current = this.controller;
    if (current != null) {
      if (!current.isDone()) {
        return current;
      } else if (!current.isCompletedExceptionally() && current.join().isValid()) {
        return current;
      }
    }
    LOGGER.debug("Creating transaction controller");
    CompletableFuture<TransactionController> created =
        this.sessionFactory.get().thenCompose(TransactionController::create);
    this.controller = created;
    return created;
  }
}
