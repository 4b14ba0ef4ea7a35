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
import io.artemis.amqp.client.Consumer;
import io.artemis.amqp.client.Message;
import io.artemis.amqp.client.RoutingType;
import io.artemis.amqp.client.metrics.MetricsCollector;
import io.artemis.amqp.client.transport.InboundDelivery;
import io.artemis.amqp.client.transport.Link;
import io.artemis.amqp.client.transport.LinkSource;
import io.artemis.amqp.client.transport.ReceiverLink;
import io.artemis.amqp.client.transport.TransportSession;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpConsumer extends ResourceBase implements Consumer, RecoverableEntity {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConsumer.class);

  private final long id;
  private final String address;
  private final RoutingType routingType;
  private final int initialCredit;
  private final AmqpConnection connection;
  private final MetricsCollector metricsCollector;
  private final Lock lock = new ReentrantLock();
  private final Deque<DeliveredMessage> buffer = new ArrayDeque<>();
  private final Deque<CompletableFuture<Message>> waiters = new ArrayDeque<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicBoolean opened = new AtomicBoolean(false);
  private volatile ReceiverLink link;

  AmqpConsumer(AmqpConsumerBuilder builder) {
    super(builder.listeners());
    this.connection = builder.connection();
    this.id = this.connection.nextEntityId();
    this.address = builder.address();
    this.routingType = builder.routingType();
    this.initialCredit = builder.initialCredit();
    this.metricsCollector = this.connection.metricsCollector();
  }

  CompletableFuture<AmqpConsumer> open() {
    return this.connection
        .session()
        .thenCompose(this::attach)
        .thenApply(
            receiver -> {
              if (this.closed.get()) {
                receiver.detach();
                throw new AmqpException.AmqpResourceClosedException(
                    "Consumer on '" + this.address + "' closed while opening");
              }
              this.link = receiver;
              receiver.addCredit(this.initialCredit);
              this.opened.set(true);
              this.metricsCollector.openConsumer();
              this.compareAndSetState(OPENING, OPEN, null);
              LOGGER.debug("Opened consumer {} on '{}'", this.id, this.address);
              return this;
            });
  }

  @Override
  public CompletableFuture<Message> receiveAsync() {
    return this.receiveAsync(null);
  }

  @Override
  public CompletableFuture<Message> receiveAsync(Duration timeout) {
    if (this.closed.get()) {
      return CompletableFuture.failedFuture(this.consumerClosed(this.closeReason()));
    }
    CompletableFuture<Message> result;
    this.lock.lock();
    try {
      DeliveredMessage next = this.buffer.poll();
      if (next != null) {
        return CompletableFuture.completedFuture(next);
      }
      result = new CompletableFuture<>();
      this.waiters.add(result);
    } finally {
      this.lock.unlock();
    }
    return Utils.withTimeout(
        result,
        timeout,
        this.connection.environment().scheduledExecutorService(),
        "Receive from '%s'",
        this.address);
  }

  @Override
  public void accept(Message message) {
    this.settle(message, MetricsCollector.ConsumeDisposition.ACCEPTED);
  }

  @Override
  public void reject(Message message) {
    this.settle(message, MetricsCollector.ConsumeDisposition.REJECTED);
  }

  @Override
  public void release(Message message) {
    this.settle(message, MetricsCollector.ConsumeDisposition.RELEASED);
  }

  private void settle(Message message, MetricsCollector.ConsumeDisposition disposition) {
    if (!(message instanceof DeliveredMessage)
        || ((DeliveredMessage) message).consumer != this) {
      throw new IllegalArgumentException("Message was not received by this consumer");
    }
    DeliveredMessage delivered = (DeliveredMessage) message;
    ReceiverLink current = this.link;
    if (this.closed.get() || this.state() != OPEN) {
      throw new AmqpException.AmqpResourceInvalidStateException(
          "Consumer on '%s' is not open, cannot settle message", this.address);
    }
    if (delivered.link != current) {
      throw new AmqpException.AmqpResourceInvalidStateException(
          "Message was received before connection recovery, it cannot be settled");
    }
    if (!delivered.settled.compareAndSet(false, true)) {
      throw new AmqpException.AmqpResourceInvalidStateException("Message already settled");
    }
    switch (disposition) {
      case ACCEPTED:
        delivered.delivery.accept();
        break;
      case REJECTED:
        delivered.delivery.reject();
        break;
      case RELEASED:
        delivered.delivery.release();
        break;
      default:
        throw new IllegalArgumentException("Unsupported disposition: " + disposition);
    }
    this.metricsCollector.consumeDisposition(disposition);
    current.addCredit(1);
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
    if (!this.compareAndSetState(OPEN, RECOVERING, cause)
        && !this.compareAndSetState(OPENING, RECOVERING, cause)) {
      return;
    }
    int dropped;
    this.lock.lock();
    try {
      // unsettled deliveries of the lost link go back to the queue on the broker
      dropped = this.buffer.size();
      this.buffer.clear();
    } finally {
      this.lock.unlock();
    }
    if (dropped > 0) {
      LOGGER.debug("Dropped {} buffered message(s) of consumer {}", dropped, this.id);
    }
  }

  @Override
  public CompletableFuture<Void> recover(TransportSession session) {
    if (this.closed.get()) {
      return CompletableFuture.completedFuture(null);
    }
    return this.attach(session)
        .thenAccept(
            receiver -> {
              // published before the state check, a concurrent close() then detaches it
              this.link = receiver;
              if (!this.compareAndSetState(RECOVERING, OPEN, null) || this.closed.get()) {
                LOGGER.debug("Consumer {} closed during recovery, detaching new link", this.id);
                receiver.detach();
              } else {
                receiver.addCredit(this.initialCredit);
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
      List<CompletableFuture<Message>> pending;
      this.lock.lock();
      try {
        pending = new ArrayList<>(this.waiters);
        this.waiters.clear();
        this.buffer.clear();
      } finally {
        this.lock.unlock();
      }
      AmqpException exception = this.consumerClosed(cause);
      pending.forEach(w -> w.completeExceptionally(exception));
      ReceiverLink receiver = this.link;
      if (receiver != null) {
        try {
          receiver.detach();
        } catch (Exception e) {
          LOGGER.warn("Error while closing receiver link", e);
        }
      }
      this.state(State.CLOSED, cause);
      if (this.opened.compareAndSet(true, false)) {
        this.metricsCollector.closeConsumer();
      }
    }
  }

  int bufferedCount() {
    this.lock.lock();
    try {
      return this.buffer.size();
    } finally {
      this.lock.unlock();
    }
  }

  private CompletableFuture<ReceiverLink> attach(TransportSession session) {
    if (this.closed.get()) {
      return CompletableFuture.failedFuture(this.consumerClosed(this.closeReason()));
    }
    return session.attachReceiver(
        Utils.linkName("receiver-link"),
        LinkSource.source(this.address, this.routingType.capability()),
        this::onDelivery,
        this::linkClosed);
  }

  private void onDelivery(InboundDelivery delivery) {
    ReceiverLink receiver = this.link;
    if (this.closed.get() || receiver == null) {
      LOGGER.debug("Delivery for closed consumer {}, releasing it", this.id);
      delivery.release();
      return;
    }
    this.metricsCollector.consume();
    DeliveredMessage message = new DeliveredMessage(this, receiver, delivery);
    while (true) {
      CompletableFuture<Message> waiter;
      this.lock.lock();
      try {
        waiter = this.waiters.poll();
        if (waiter == null) {
          this.buffer.add(message);
          return;
        }
      } finally {
        this.lock.unlock();
      }
      // timed out or cancelled waiters are skipped
      if (waiter.complete(message)) {
        return;
      }
    }
  }

  private void linkClosed(Link closedLink, String condition, String description) {
    if (closedLink != this.link || this.closed.get()) {
      return;
    }
    if (this.connection.transportClosed()) {
      return;
    }
    LOGGER.debug(
        "Receiver link of consumer {} closed by peer: {} {}", this.id, condition, description);
    this.close(ExceptionUtils.remoteClose(this, condition, description));
  }

  private AmqpException consumerClosed(Throwable cause) {
    return new AmqpException.AmqpResourceClosedException(
        "Consumer on '" + this.address + "' is closed", cause);
  }

  @Override
  public String toString() {
    return "consumer-" + this.id + " ('" + this.address + "')";
  }

  private static final class DeliveredMessage extends AmqpMessage {

    private final AmqpConsumer consumer;
    private final ReceiverLink link;
    private final InboundDelivery delivery;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    @SuppressWarnings("unchecked")
    private DeliveredMessage(
        AmqpConsumer consumer, ReceiverLink link, InboundDelivery delivery) {
      super((org.apache.qpid.protonj2.client.Message<byte[]>) delivery.message());
      this.consumer = consumer;
      this.link = link;
      this.delivery = delivery;
    }
  }
}
