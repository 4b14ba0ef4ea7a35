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
import io.artemis.amqp.client.DurabilityMode;
import io.artemis.amqp.client.RoutingType;
import io.artemis.amqp.client.metrics.MetricsCollector;
import io.artemis.amqp.client.transport.DeliveryOutcome;
import io.artemis.amqp.client.transport.SenderLink;
import io.artemis.amqp.client.transport.TransactionalState;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares messages with the producer defaults, hands them to the sender link and turns the
 * delivery outcome into the completion of the send future.
 */
final class SendPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(SendPipeline.class);

  static final String RELEASED_DESCRIPTION = "Message was released by remote peer.";

  private final String address;
  private final RoutingType routingType;
  private final DurabilityMode durabilityMode;
  private final Byte priority;
  private final boolean setCreationTime;
  private final LongSupplier clock;
  private final MetricsCollector metricsCollector;
  private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();

  SendPipeline(
      String address,
      RoutingType routingType,
      DurabilityMode durabilityMode,
      Byte priority,
      boolean setCreationTime,
      LongSupplier clock,
      MetricsCollector metricsCollector) {
    this.address = address;
    this.routingType = routingType;
    this.durabilityMode = durabilityMode;
    this.priority = priority;
    this.setCreationTime = setCreationTime;
    this.clock = clock;
    this.metricsCollector = metricsCollector;
  }

  /**
   * Send a message unsettled and track its outcome.
   *
   * <p>The returned future can be cancelled, the outcome is then ignored.
   */
  CompletableFuture<Void> sendAsync(
      SenderLink link, AmqpMessage message, TransactionalState state) {
    if (unusable(link)) {
      return CompletableFuture.failedFuture(producerClosed(null));
    }
    this.prepare(message, true);
    CompletableFuture<Void> result = new CompletableFuture<>();
    this.inFlight.add(result);
    result.whenComplete((ignored, failure) -> this.inFlight.remove(result));
    try {
      link.send(
          message.nativeMessage(),
          state,
          (sender, msg, outcome) -> this.handleOutcome(sender, outcome, result));
      this.metricsCollector.send();
    } catch (Exception e) {
      result.completeExceptionally(this.sendFailure(link, e));
    }
    return result;
  }

  /** Send a message pre-settled, no outcome is tracked. */
  void send(SenderLink link, AmqpMessage message) {
    if (unusable(link)) {
      throw producerClosed(null);
    }
    this.prepare(message, false);
    try {
      link.send(message.nativeMessage(), null, null);
      this.metricsCollector.send();
    } catch (Exception e) {
      throw this.sendFailure(link, e);
    }
  }

  /** Fail all the sends waiting for an outcome. */
  void failInFlight(AmqpException cause) {
    for (CompletableFuture<Void> pending : this.inFlight) {
      pending.completeExceptionally(cause);
    }
  }

  int inFlightCount() {
    return this.inFlight.size();
  }

  private void prepare(AmqpMessage message, boolean acknowledged) {
    boolean durable =
        this.durabilityMode == null ? acknowledged : this.durabilityMode == DurabilityMode.DURABLE;
    message.durableIfUnset(durable);
    if (this.setCreationTime) {
      message.creationTimeIfUnset(this.clock.getAsLong());
    }
    if (this.priority != null) {
      message.priorityIfUnset(this.priority);
    }
    message.to(this.address);
    message.annotation(RoutingType.ROUTING_TYPE_ANNOTATION, this.routingType.code());
  }

  private void handleOutcome(
      SenderLink link, DeliveryOutcome outcome, CompletableFuture<Void> result) {
    if (result.isDone()) {
      // cancelled or failed because the producer left the open state
      return;
    }
    if (outcome.type() == DeliveryOutcome.Type.ACCEPTED) {
      this.metricsCollector.sendDisposition(MetricsCollector.SendDisposition.ACCEPTED);
      LOGGER.trace("Message sent.");
      result.complete(null);
    } else if (unusable(link)) {
      result.completeExceptionally(producerClosed(null));
    } else {
      switch (outcome.type()) {
        case REJECTED:
          this.metricsCollector.sendDisposition(MetricsCollector.SendDisposition.REJECTED);
          result.completeExceptionally(
              new AmqpException.AmqpMessageSendException(
                  outcome.condition(), outcome.description()));
          break;
        case RELEASED:
          this.metricsCollector.sendDisposition(MetricsCollector.SendDisposition.RELEASED);
          result.completeExceptionally(
              new AmqpException.AmqpMessageSendException(
                  AmqpException.AmqpMessageSendException.MESSAGE_RELEASED, RELEASED_DESCRIPTION));
          break;
        case TRANSPORT_CLOSED:
          result.completeExceptionally(producerClosed(null));
          break;
        default:
          result.completeExceptionally(
              new AmqpException.AmqpMessageSendException(
                  AmqpException.AmqpMessageSendException.INTERNAL_ERROR, outcome.toString()));
          break;
      }
    }
  }

  private AmqpException sendFailure(SenderLink link, Exception e) {
    if (unusable(link)
        || e instanceof AmqpException.AmqpResourceClosedException
        || e instanceof IllegalStateException) {
      return producerClosed(e);
    } else {
      return new AmqpException.AmqpMessageSendException(
          "Failed to send message to '" + this.address + "': " + e.getMessage(), e);
    }
  }

  private AmqpException.AmqpProducerClosedException producerClosed(Throwable cause) {
    return new AmqpException.AmqpProducerClosedException(
        "Producer to '" + this.address + "' is closed", cause);
  }

  private static boolean unusable(SenderLink link) {
    return link == null || link.isDetaching() || link.isClosed();
  }
}
