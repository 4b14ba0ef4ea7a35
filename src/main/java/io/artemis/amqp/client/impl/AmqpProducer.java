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

import static io.artemis.amqp.client.Resource.State.OPEN;
import static io.artemis.amqp.client.Resource.State.OPENING;
import static io.artemis.amqp.client.Resource.State.RECOVERING;

import io.artemis.amqp.client.AmqpException;
import io.artemis.amqp.client.Message;
import io.artemis.amqp.client.Producer;
import io.artemis.amqp.client.RoutingType;
import io.artemis.amqp.client.Transaction;
import io.artemis.amqp.client.metrics.MetricsCollector;
import io.artemis.amqp.client.transport.Link;
import io.artemis.amqp.client.transport.LinkTarget;
import io.artemis.amqp.client.transport.SenderLink;
import io.artemis.amqp.client.transport.TransactionalState;
import io.artemis.amqp.client.transport.TransportSession;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpProducer extends ResourceBase implements Producer, RecoverableEntity {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpProducer.class);

  private final long id;
  private final String address;
  private final RoutingType routingType;
  private final AmqpConnection connection;
  private final SendPipeline pipeline;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicBoolean opened = new AtomicBoolean(false);
  private final MetricsCollector metricsCollector;
  private volatile SenderLink link;

  AmqpProducer(AmqpProducerBuilder builder) {
    super(builder.listeners());
    this.connection = builder.connection();
    this.id = this.connection.nextEntityId();
    this.address = builder.address();
    this.routingType = builder.routingType();
    this.metricsCollector = this.connection.metricsCollector();
    this.pipeline =
        new SendPipeline(
            this.address,
            this.routingType,
            builder.durabilityMode(),
            builder.priority(),
            builder.setMessageCreationTime(),
            System::currentTimeMillis,
            this.metricsCollector);
  }

  CompletableFuture<AmqpProducer> open() {
    return this.connection
        .session()
        .thenCompose(this::attach)
        .thenApply(
            sender -> {
              if (this.closed.get()) {
                sender.detach();
                throw new AmqpException.AmqpProducerClosedException(
                    "Producer to '" + this.address + "' closed while opening");
              }
              this.link = sender;
              this.opened.set(true);
              this.metricsCollector.openProducer();
              // the connection may have started recovering in the meantime
              this.compareAndSetState(OPENING, OPEN, null);
              LOGGER.debug("Opened producer {} to '{}'", this.id, this.address);
              return this;
            });
  }

  @Override
  public Message message() {
    return new AmqpMessage();
  }

  @Override
  public Message message(byte[] body) {
    return new AmqpMessage(body);
  }

  @Override
  public CompletableFuture<Void> sendAsync(Message message) {
    return this.sendAsync(message, null, null);
  }

  @Override
  public CompletableFuture<Void> sendAsync(Message message, Transaction transaction) {
    return this.sendAsync(message, transaction, null);
  }

  @Override
  public CompletableFuture<Void> sendAsync(
      Message message, Transaction transaction, Duration timeout) {
    AmqpTransaction tx = this.checkTransaction(transaction);
    AmqpMessage amqpMessage = (AmqpMessage) message;
    if (this.state() != OPEN) {
      return CompletableFuture.failedFuture(this.producerClosed());
    }
    CompletableFuture<Void> result = new CompletableFuture<>();
    this.connection
        .transactionsManager()
        .transactionalState(tx)
        .whenComplete(
            (state, failure) -> {
              if (failure != null) {
                result.completeExceptionally(ExceptionUtils.unwrap(failure));
              } else if (!result.isDone()) {
                this.send(amqpMessage, state, result);
              }
            });
    return Utils.withTimeout(
        result,
        timeout,
        this.connection.environment().scheduledExecutorService(),
        "Send to '%s'",
        this.address);
  }

  private void send(
      AmqpMessage message, TransactionalState state, CompletableFuture<Void> result) {
    if (this.state() != OPEN) {
      result.completeExceptionally(this.producerClosed());
      return;
    }
    CompletableFuture<Void> delivery = this.pipeline.sendAsync(this.link, message, state);
    // cancelling or timing out the caller future withdraws the outcome callback
    result.whenComplete(
        (v, t) -> {
          if (t != null) {
            delivery.cancel(false);
          }
        });
    delivery.whenComplete(
        (v, t) -> {
          if (t == null) {
            result.complete(null);
          } else {
            result.completeExceptionally(ExceptionUtils.unwrap(t));
          }
        });
  }

  @Override
  public void send(Message message) {
    AmqpMessage amqpMessage = (AmqpMessage) message;
    if (this.state() != OPEN) {
      throw this.producerClosed();
    }
    this.pipeline.send(this.link, amqpMessage);
  }

  @Override
  public void close() {
    this.close(null);
  }

  // internal API

  @Override
  public long id() {
    return this.id;
  }

  @Override
  public void connectionLost(Throwable cause) {
    if (this.compareAndSetState(OPEN, RECOVERING, cause)
        || this.compareAndSetState(OPENING, RECOVERING, cause)) {
      this.pipeline.failInFlight(
          new AmqpException.AmqpProducerClosedException(
              "Connection lost, producer to '" + this.address + "' is recovering", cause));
    }
  }

  @Override
  public CompletableFuture<Void> recover(TransportSession session) {
    if (this.closed.get()) {
      return CompletableFuture.completedFuture(null);
    }
    return this.attach(session)
        .thenAccept(
            sender -> {
              // published before the state check, a concurrent close() then detaches it
              this.link = sender;
              if (!this.compareAndSetState(RECOVERING, OPEN, null) || this.closed.get()) {
                LOGGER.debug("Producer {} closed during recovery, detaching new link", this.id);
                sender.detach();
              }
            });
  }

  @Override
  public boolean isClosed() {
    return this.closed.get();
  }

  @Override
  public void close(Throwable cause) {
    if (this.closed.compareAndSet(false, true)) {
      this.state(State.CLOSING, cause);
      this.connection.unregister(this);
      this.pipeline.failInFlight(
          new AmqpException.AmqpProducerClosedException(
              "Producer to '" + this.address + "' has been closed", cause));
      SenderLink sender = this.link;
      if (sender != null) {
        try {
          sender.detach();
        } catch (Exception e) {
          LOGGER.warn("Error while closing sender link", e);
        }
      }
      this.state(State.CLOSED, cause);
      if (this.opened.compareAndSet(true, false)) {
        this.metricsCollector.closeProducer();
      }
    }
  }

  private CompletableFuture<SenderLink> attach(TransportSession session) {
    if (this.closed.get()) {
      return CompletableFuture.failedFuture(this.producerClosed());
    }
    return session.attachSender(
        Utils.linkName("sender-link"),
        LinkTarget.target(this.address, this.routingType.capability()),
        this::linkClosed);
  }

  private void linkClosed(Link closedLink, String condition, String description) {
    if (closedLink != this.link || this.closed.get()) {
      return;
    }
    if (this.connection.transportClosed()) {
      // connection failure, recovery attaches a new link
      return;
    }
    LOGGER.debug(
        "Sender link of producer {} closed by peer: {} {}", this.id, condition, description);
    this.close(ExceptionUtils.remoteClose(this, condition, description));
  }

  private AmqpTransaction checkTransaction(Transaction transaction) {
    if (transaction == null) {
      return null;
    }
    if (!(transaction instanceof AmqpTransaction)
        || ((AmqpTransaction) transaction).connection() != this.connection) {
      throw new IllegalArgumentException(
          "Transaction " + transaction + " does not belong to connection " + this.connection);
    }
    return (AmqpTransaction) transaction;
  }

  private AmqpException.AmqpProducerClosedException producerClosed() {
    State state = this.state();
    if (state == RECOVERING) {
      return new AmqpException.AmqpProducerClosedException(
          "Producer to '" + this.address + "' is recovering", this.closeReason());
    } else {
      return new AmqpException.AmqpProducerClosedException(
          "Producer to '" + this.address + "' is closed", this.closeReason());
    }
  }

  @Override
  public String toString() {
    return "producer-" + this.id + " ('" + this.address + "')";
  }
}
