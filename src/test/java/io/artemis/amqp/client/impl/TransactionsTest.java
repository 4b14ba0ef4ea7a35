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

import static io.artemis.amqp.client.impl.TestUtils.endpoint;
import static io.artemis.amqp.client.impl.TestUtils.waitAtMost;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.artemis.amqp.client.AmqpException;
import io.artemis.amqp.client.Connection;
import io.artemis.amqp.client.Consumer;
import io.artemis.amqp.client.Endpoint;
import io.artemis.amqp.client.Environment;
import io.artemis.amqp.client.Message;
import io.artemis.amqp.client.Producer;
import io.artemis.amqp.client.RecoveryListener;
import io.artemis.amqp.client.RecoveryPolicy;
import io.artemis.amqp.client.Transaction;
import io.artemis.amqp.client.transport.DeliveryOutcome;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TransactionsTest {

  Endpoint e1 = endpoint(5672);
  Endpoint e2 = endpoint(5673);
  InMemoryBroker broker;
  Environment environment;
  Connection connection;
  AtomicInteger recoveries = new AtomicInteger(0);

  @BeforeEach
  void init() {
    broker = new InMemoryBroker();
    environment = TestUtils.environmentBuilder(broker).build();
    connection =
        environment
            .connectionBuilder()
            .endpoints(e1, e2)
            .recoveryListeners(
                new RecoveryListener() {
                  @Override
                  public void recovered(Endpoint endpoint) {
                    recoveries.incrementAndGet();
                  }
                })
            .recovery()
            .policy(RecoveryPolicy.fixed(Duration.ofMillis(20)))
            .connectionBuilder()
            .build();
  }

  @AfterEach
  void tearDown() {
    environment.close();
    broker.close();
  }

  @Test
  void messagesShouldBeVisibleOnlyAfterCommit() {
    Producer producer = connection.producerBuilder().address("q").build();
    Consumer consumer = connection.consumerBuilder().address("q").build();
    Transaction tx = connection.transaction();
    assertThat(tx.isEnlisted()).isFalse();

    producer.sendAsync(message(producer, "foo1"), tx).join();
    producer.sendAsync(message(producer, "foo2"), tx).join();
    assertThat(tx.isEnlisted()).isTrue();
    assertThat(broker.declareCount()).isEqualTo(1);
    assertThat(broker.queueSize("q")).isZero();
    assertThatThrownBy(() -> consumer.receiveAsync(Duration.ofMillis(500)).join())
        .hasCauseInstanceOf(AmqpException.AmqpOperationCancelledException.class);

    tx.commitAsync().join();
    assertThat(body(consumer.receiveAsync(Duration.ofSeconds(10)).join())).isEqualTo("foo1");
    assertThat(body(consumer.receiveAsync(Duration.ofSeconds(10)).join())).isEqualTo("foo2");
    assertThat(broker.dischargeCount()).isEqualTo(1);
  }

  @Test
  void rollbackShouldDiscardMessages() {
    Producer producer = connection.producerBuilder().address("q").build();
    Transaction tx = connection.transaction();
    producer.sendAsync(message(producer, "foo"), tx).join();
    tx.rollbackAsync().join();
    assertThat(broker.queueSize("q")).isZero();
    assertThat(broker.activeTransactions()).isZero();

    producer.sendAsync(message(producer, "bar")).join();
    assertThat(broker.queueSize("q")).isEqualTo(1);
  }

  @Test
  void transactionsShouldBeIsolated() {
    Producer producer = connection.producerBuilder().address("q").build();
    Transaction tx1 = connection.transaction();
    Transaction tx2 = connection.transaction();
    producer.sendAsync(message(producer, "tx1"), tx1).join();
    producer.sendAsync(message(producer, "tx2"), tx2).join();
    assertThat(broker.declareCount()).isEqualTo(2);
    assertThat(broker.coordinatorCount()).isEqualTo(1);

    tx2.rollbackAsync().join();
    tx1.commitAsync().join();
    assertThat(broker.queueSize("q")).isEqualTo(1);
    Consumer consumer = connection.consumerBuilder().address("q").build();
    assertThat(body(consumer.receiveAsync(Duration.ofSeconds(10)).join())).isEqualTo("tx1");
  }

  @Test
  void transactionCanSpanSeveralProducers() {
    Producer producer1 = connection.producerBuilder().address("q1").build();
    Producer producer2 = connection.producerBuilder().address("q2").build();
    Transaction tx = connection.transaction();
    producer1.sendAsync(message(producer1, "foo"), tx).join();
    producer2.sendAsync(message(producer2, "bar"), tx).join();
    assertThat(broker.declareCount()).isEqualTo(1);
    tx.commitAsync().join();
    assertThat(broker.queueSize("q1")).isEqualTo(1);
    assertThat(broker.queueSize("q2")).isEqualTo(1);
  }

  @Test
  void concurrentFirstSendsShouldDeclareTransactionOnce() {
    Producer producer = connection.producerBuilder().address("q").build();
    Transaction tx = connection.transaction();
    broker.holdOutcomes();
    List<CompletableFuture<Void>> sends =
        IntStream.range(0, 10)
            .mapToObj(i -> producer.sendAsync(message(producer, "m" + i), tx))
            .collect(Collectors.toList());
    assertThat(sends).noneMatch(CompletableFuture::isDone);
    broker.releaseOutcomes();
    sends.forEach(CompletableFuture::join);
    assertThat(broker.declareCount()).isEqualTo(1);
    tx.commitAsync().join();
    assertThat(broker.queueSize("q")).isEqualTo(10);
  }

  @Test
  void committingUnusedTransactionShouldBeNoOp() {
    Transaction tx = connection.transaction();
    tx.commitAsync().join();
    assertThat(broker.declareCount()).isZero();
    assertThat(broker.coordinatorCount()).isZero();
    assertThatThrownBy(() -> tx.commitAsync().join())
        .hasCauseInstanceOf(AmqpException.AmqpCoordinatorException.class);
  }

  @Test
  void dischargedTransactionCannotBeUsedAnymore() {
    Producer producer = connection.producerBuilder().address("q").build();
    Transaction tx = connection.transaction();
    producer.sendAsync(message(producer, "foo"), tx).join();
    tx.commitAsync().join();
    assertThatThrownBy(() -> producer.sendAsync(message(producer, "bar"), tx).join())
        .hasCauseInstanceOf(AmqpException.AmqpCoordinatorException.class);
    assertThatThrownBy(() -> tx.rollbackAsync().join())
        .hasCauseInstanceOf(AmqpException.AmqpCoordinatorException.class);
    assertThat(broker.queueSize("q")).isEqualTo(1);
  }

  @Test
  void transactionOfAnotherConnectionShouldBeRefused() {
    Connection other = environment.connectionBuilder().endpoint(e1).build();
    Producer producer = connection.producerBuilder().address("q").build();
    Transaction tx = other.transaction();
    assertThatThrownBy(() -> producer.sendAsync(producer.message(), tx))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void transactionDeclaredBeforeRecoveryShouldBeStale() {
    Producer producer = connection.producerBuilder().address("q").build();
    Transaction tx = connection.transaction();
    producer.sendAsync(message(producer, "foo"), tx).join();

    broker.stop(e1);
    waitAtMost(() -> recoveries.get() == 1);
    assertThat(broker.activeTransactions()).isZero();

    assertThatThrownBy(() -> producer.sendAsync(message(producer, "bar"), tx).join())
        .cause()
        .isInstanceOf(AmqpException.AmqpCoordinatorException.class)
        .satisfies(
            e -> assertThat(((AmqpException.AmqpCoordinatorException) e).isStale()).isTrue());
    assertThatThrownBy(() -> tx.commitAsync().join())
        .hasCauseInstanceOf(AmqpException.AmqpCoordinatorException.class);
    assertThat(broker.queueSize("q")).isZero();

    // a new transaction works on the recovered connection
    Transaction newTx = connection.transaction();
    producer.sendAsync(message(producer, "baz"), newTx).join();
    newTx.commitAsync().join();
    assertThat(broker.queueSize("q")).isEqualTo(1);
  }

  @Test
  void transactionNotDeclaredBeforeRecoveryShouldBeUsable() {
    Producer producer = connection.producerBuilder().address("q").build();
    Transaction tx = connection.transaction();
    broker.stop(e1);
    waitAtMost(() -> recoveries.get() == 1);
    producer.sendAsync(message(producer, "foo"), tx).join();
    tx.commitAsync().join();
    assertThat(broker.queueSize("q")).isEqualTo(1);
  }

  @Test
  void closingTransactionShouldRollItBack() {
    Producer producer = connection.producerBuilder().address("q").build();
    List<Transaction> transactions = new ArrayList<>();
    try (Transaction tx = connection.transaction()) {
      transactions.add(tx);
      producer.sendAsync(message(producer, "foo"), tx).join();
    }
    waitAtMost(() -> broker.dischargeCount() == 1);
    assertThat(broker.queueSize("q")).isZero();
    assertThatThrownBy(() -> transactions.get(0).commitAsync().join())
        .hasCauseInstanceOf(AmqpException.AmqpCoordinatorException.class);
  }

  @Test
  void rejectedDischargeShouldFailCommit() {
    Producer producer = connection.producerBuilder().address("q").build();
    Transaction tx = connection.transaction();
    producer.sendAsync(message(producer, "foo"), tx).join();
    broker.nextCoordinatorOutcome(
        DeliveryOutcome.rejected(
            "amqp:transaction:rollback", "transaction rolled back"));
    assertThatThrownBy(() -> tx.commitAsync().join())
        .hasCauseInstanceOf(AmqpException.AmqpCoordinatorException.class)
        .hasMessageContaining("transaction rolled back");
  }

  private static Message message(Producer producer, String body) {
    return producer.message(body.getBytes(StandardCharsets.UTF_8));
  }

  private static String body(Message message) {
    return new String(message.body(), StandardCharsets.UTF_8);
  }
}
