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
import io.artemis.amqp.client.transport.DeliveryOutcome;
import io.artemis.amqp.client.transport.LinkTarget;
import io.artemis.amqp.client.transport.SenderLink;
import io.artemis.amqp.client.transport.TransportSession;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.qpid.protonj2.client.Message;
import org.apache.qpid.protonj2.types.Binary;
import org.apache.qpid.protonj2.types.transactions.Declare;
import org.apache.qpid.protonj2.types.transactions.Discharge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of a transaction coordinator link.
 *
 * <p>Declares and discharges transactions. Once invalidated (closed, or its connection lost), all
 * pending and future requests fail with an {@link AmqpException.AmqpCoordinatorException}.
 */
final class TransactionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransactionController.class);

  private final TransportSession session;
  private final SenderLink link;
  private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();
  private volatile AmqpException invalidationCause;

  private TransactionController(TransportSession session, SenderLink link) {
    this.session = session;
    this.link = link;
  }

  /** Attach a coordinator link on the session. */
  static CompletableFuture<TransactionController> create(TransportSession session) {
    String name = Utils.linkName("controller-link");
    LOGGER.debug("Attaching transaction controller link '{}'", name);
    CompletableFuture<TransactionController> result = new CompletableFuture<>();
    session
        .attachSender(
            name,
            LinkTarget.coordinator(),
            (link, condition, description) -> {
              TransactionController controller = result.getNow(null);
              if (controller != null) {
                controller.invalidate(
                    new AmqpException.AmqpCoordinatorException(
                        "Coordinator link closed: " + description, null, true));
              }
            })
        .whenComplete(
            (link, failure) -> {
              if (failure == null) {
                result.complete(new TransactionController(session, link));
              } else {
                session.close();
                result.completeExceptionally(
                    new AmqpException.AmqpCoordinatorException(
                        "Could not attach transaction controller", ExceptionUtils.unwrap(failure)));
              }
            });
    return result;
  }

  /**
   * Declare a new transaction.
   *
   * @return future of the transaction ID
   */
  CompletableFuture<byte[]> declare() {
    CompletableFuture<byte[]> result = this.track(new CompletableFuture<>());
    if (result.isDone()) {
      return result;
    }
    Message<Declare> message = Message.create(new Declare());
    try {
      this.link.send(
          message,
          null,
          (sender, msg, outcome) -> {
            if (outcome.type() == DeliveryOutcome.Type.DECLARED) {
              result.complete(outcome.txnId());
            } else if (outcome.type() == DeliveryOutcome.Type.REJECTED) {
              result.completeExceptionally(
                  new AmqpException.AmqpCoordinatorException(
                      "Transaction declare rejected (%s): %s",
                      outcome.condition(),
                      outcome.description()));
            } else {
              result.completeExceptionally(unexpectedOutcome("declare", outcome));
            }
          });
    } catch (Exception e) {
      result.completeExceptionally(
          new AmqpException.AmqpCoordinatorException("Could not declare transaction", e));
    }
    return result;
  }

  /**
   * Discharge a transaction.
   *
   * @param txnId the transaction ID
   * @param fail true to roll back, false to commit
   * @return future completing when the coordinator accepted the discharge
   */
  CompletableFuture<Void> discharge(byte[] txnId, boolean fail) {
    CompletableFuture<Void> result = this.track(new CompletableFuture<>());
    if (result.isDone()) {
      return result;
    }
    Discharge discharge = new Discharge();
    discharge.setTxnId(new Binary(txnId));
    discharge.setFail(fail);
    Message<Discharge> message = Message.create(discharge);
    try {
      this.link.send(
          message,
          null,
          (sender, msg, outcome) -> {
            if (outcome.type() == DeliveryOutcome.Type.ACCEPTED) {
              result.complete(null);
            } else if (outcome.type() == DeliveryOutcome.Type.REJECTED) {
              result.completeExceptionally(
                  new AmqpException.AmqpCoordinatorException(
                      "Transaction discharge rejected (%s): %s",
                      outcome.condition(),
                      outcome.description()));
            } else {
              result.completeExceptionally(unexpectedOutcome("discharge", outcome));
            }
          });
    } catch (Exception e) {
      result.completeExceptionally(
          new AmqpException.AmqpCoordinatorException("Could not discharge transaction", e));
    }
    return result;
  }

  boolean isValid() {
    return this.invalidationCause == null;
  }

  /**
   * Fail pending requests and release the link and its session.
   *
   * @param cause failure for the pending and future requests
   */
  void invalidate(AmqpException cause) {
    if (this.invalidationCause != null) {
      return;
    }
    this.invalidationCause = cause;
    LOGGER.debug("Invalidating transaction controller {}: {}", this.link.name(), cause.getMessage());
    for (CompletableFuture<?> request : this.pending) {
      request.completeExceptionally(cause);
    }
    try {
      this.link.detach();
      this.session.close();
    } catch (Exception e) {
      LOGGER.debug("Error while closing transaction controller link: {}", e.getMessage());
    }
  }

  private <T> CompletableFuture<T> track(CompletableFuture<T> request) {
    this.pending.add(request);
    request.whenComplete((r, t) -> this.pending.remove(request));
    AmqpException cause = this.invalidationCause;
    if (cause != null) {
      request.completeExceptionally(cause);
    }
    return request;
  }

  private AmqpException unexpectedOutcome(String operation, DeliveryOutcome outcome) {
    if (outcome.type() == DeliveryOutcome.Type.TRANSPORT_CLOSED) {
      return new AmqpException.AmqpCoordinatorException(
          "Transaction " + operation + " interrupted, coordinator link closed", null, true);
    } else {
      return new AmqpException.AmqpCoordinatorException(
          "Unexpected outcome for transaction %s: %s", operation, outcome);
    }
  }

  @Override
  public String toString() {
    return "TransactionController{" + this.link.name() + '}';
  }
}
