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
import io.artemis.amqp.client.Transaction;
import io.artemis.amqp.client.transport.TransactionalState;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpTransaction implements Transaction {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpTransaction.class);
  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  enum Status {
    UNBOUND,
    ENLISTING,
    BOUND,
    DISCHARGED
  }

  private final long id;
  private final AmqpConnection connection;
  private final TransactionsManager transactionsManager;
  private final ScheduledExecutorService scheduler;
  private final AtomicReference<Status> status = new AtomicReference<>(Status.UNBOUND);
  private volatile TransactionalState state;
  private volatile TransactionController controller;

  AmqpTransaction(
      AmqpConnection connection,
      TransactionsManager transactionsManager,
      ScheduledExecutorService scheduler) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.connection = connection;
    this.transactionsManager = transactionsManager;
    this.scheduler = scheduler;
  }

  @Override
  public CompletableFuture<Void> commitAsync() {
    return this.commitAsync(null);
  }

  @Override
  public CompletableFuture<Void> commitAsync(Duration timeout) {
    return this.discharge(false, timeout);
  }

  @Override
  public CompletableFuture<Void> rollbackAsync() {
    return this.rollbackAsync(null);
  }

  @Override
  public CompletableFuture<Void> rollbackAsync(Duration timeout) {
    return this.discharge(true, timeout);
  }

  private CompletableFuture<Void> discharge(boolean fail, Duration timeout) {
    CompletableFuture<Void> result = new CompletableFuture<>();
    this.transactionsManager
        .discharge(this, fail)
        .whenComplete(
            (v, t) -> {
              if (t == null) {
                result.complete(null);
              } else {
                result.completeExceptionally(ExceptionUtils.unwrap(t));
              }
            });
    return Utils.withTimeout(
        result,
        timeout,
        this.scheduler,
        "Transaction %s",
        fail ? "rollback" : "commit");
  }

  @Override
  public boolean isEnlisted() {
    return this.state != null;
  }

  @Override
  public void close() {
    if (this.status.compareAndSet(Status.UNBOUND, Status.DISCHARGED)) {
      return;
    }
    Status current = this.status.get();
    // a pending declaration completes first, the rollback follows
    if (current == Status.BOUND || current == Status.ENLISTING) {
      this.rollbackAsync()
          .exceptionally(
              t -> {
                LOGGER.debug("Error while rolling back transaction {}: {}", this, t.getMessage());
                return null;
              });
    }
  }

  /**
   * State to attach deliveries to, if the transaction has been declared.
   *
   * @return the state, null if not declared yet
   * @throws AmqpException.AmqpCoordinatorException if discharged or declared before a recovery
   */
  TransactionalState boundState() {
    Status current = this.status.get();
    if (current == Status.DISCHARGED) {
      throw new AmqpException.AmqpCoordinatorException("Transaction %s already discharged", this);
    }
    TransactionalState s = this.state;
    if (s == null) {
      return null;
    }
    checkNotStale();
    return s;
  }

  void checkNotStale() {
    TransactionController c = this.controller;
    if (c != null && !c.isValid()) {
      throw new AmqpException.AmqpCoordinatorException(
          "Transaction " + this + " was declared before connection recovery", null, true);
    }
  }

  boolean enlisting() {
    return this.status.compareAndSet(Status.UNBOUND, Status.ENLISTING);
  }

  void enlistmentFailed() {
    this.status.compareAndSet(Status.ENLISTING, Status.UNBOUND);
  }

  void bind(TransactionalState state, TransactionController controller) {
    this.state = state;
    this.controller = controller;
    this.status.set(Status.BOUND);
  }

  boolean markDischarged(Status expected) {
    return this.status.compareAndSet(expected, Status.DISCHARGED);
  }

  Status status() {
    return this.status.get();
  }

  TransactionalState state() {
    return this.state;
  }

  TransactionController controller() {
    return this.controller;
  }

  AmqpConnection connection() {
    return this.connection;
  }

  @Override
  public String toString() {
    return "transaction-" + this.id;
  }
}
