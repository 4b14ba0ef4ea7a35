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

import static io.artemis.amqp.client.Resource.State.CLOSED;
import static io.artemis.amqp.client.Resource.State.OPEN;
import static io.artemis.amqp.client.impl.TestUtils.endpoint;
import static io.artemis.amqp.client.impl.TestUtils.stateListener;
import static io.artemis.amqp.client.impl.TestUtils.sync;
import static io.artemis.amqp.client.impl.TestUtils.waitAtMost;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.artemis.amqp.client.AmqpException;
import io.artemis.amqp.client.Connection;
import io.artemis.amqp.client.Consumer;
import io.artemis.amqp.client.DurabilityMode;
import io.artemis.amqp.client.Endpoint;
import io.artemis.amqp.client.Environment;
import io.artemis.amqp.client.Message;
import io.artemis.amqp.client.Producer;
import io.artemis.amqp.client.RoutingType;
import io.artemis.amqp.client.metrics.MicrometerMetricsCollector;
import io.artemis.amqp.client.transport.DeliveryOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class AmqpTest {

  Endpoint e1 = endpoint(5672);
  InMemoryBroker broker;
  SimpleMeterRegistry registry;
  Environment environment;
  Connection connection;

  @BeforeEach
  void init() {
    broker = new InMemoryBroker();
    registry = new SimpleMeterRegistry();
    environment =
        TestUtils.environmentBuilder(broker)
            .metricsCollector(new MicrometerMetricsCollector(registry))
            .build();
    connection = environment.connectionBuilder().endpoint(e1).build();
  }

  @AfterEach
  void tearDown() {
    environment.close();
    broker.close();
  }

  @Test
  void sendAndReceive() {
    Producer producer = connection.producerBuilder().address("q").build();
    Consumer consumer = connection.consumerBuilder().address("q").build();
    producer.sendAsync(message(producer, "hello").subject("greeting")).join();

    Message message = consumer.receiveAsync(Duration.ofSeconds(10)).join();
    assertThat(body(message)).isEqualTo("hello");
    assertThat(message.subject()).isEqualTo("greeting");
    assertThat(message.to()).isEqualTo("q");
    assertThat(message.durable()).isTrue();
    assertThat(message.annotation(RoutingType.ROUTING_TYPE_ANNOTATION))
        .isEqualTo(RoutingType.ANYCAST.code());
    consumer.accept(message);
    assertThat(broker.queueSize("q")).isZero();

    assertThat(registry.get("artemis.amqp.connections").gauge().value()).isEqualTo(1);
    assertThat(registry.get("artemis.amqp.producers").gauge().value()).isEqualTo(1);
    assertThat(registry.get("artemis.amqp.consumers").gauge().value()).isEqualTo(1);
    assertThat(registry.get("artemis.amqp.sent_accepted").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("artemis.amqp.consumed_accepted").counter().count()).isEqualTo(1.0);

    producer.close();
    consumer.close();
    assertThat(registry.get("artemis.amqp.producers").gauge().value()).isZero();
    assertThat(registry.get("artemis.amqp.consumers").gauge().value()).isZero();
  }

  @Test
  void applicationPropertiesShouldBeReceivedUnchanged() {
    Producer producer = connection.producerBuilder().address("q").build();
    Consumer consumer = connection.consumerBuilder().address("q").build();
    UUID uuid = UUID.fromString("d50a5c8b-3ede-4fa0-93e5-5b6ab38eea3e");
    long timestamp = 1_700_000_000_000L;
    Map<String, Object> inner = new LinkedHashMap<>();
    inner.put("innerKey", "innerValue");
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("testKey", "testValue");
    map.put("testMapKey", inner);
    map.put("count", 42L);

    Message message =
        producer
            .message()
            .property("char", 'c')
            .property("string", "stringValue")
            .property("bool", true)
            .property("byte", Byte.MAX_VALUE)
            .property("short", Short.MAX_VALUE)
            .property("int", Integer.MAX_VALUE)
            .property("long", Long.MAX_VALUE)
            .property("float", Float.MAX_VALUE)
            .property("double", Double.MAX_VALUE)
            .propertyTimestamp("timestamp", timestamp)
            .property("uuid", uuid)
            .property("binary", new byte[] {1, 2, 3})
            .property("ints", new int[] {1, 2, 3})
            .property("strings", new String[] {"a", "b"})
            .property("map", map);
    producer.sendAsync(message).join();

    Message received = consumer.receiveAsync(Duration.ofSeconds(10)).join();
    assertThat(received.property("char")).isEqualTo('c');
    assertThat(received.property("string")).isEqualTo("stringValue");
    assertThat(received.property("bool")).isEqualTo(true);
    assertThat(received.property("byte")).isEqualTo(Byte.MAX_VALUE);
    assertThat(received.property("short")).isEqualTo(Short.MAX_VALUE);
    assertThat(received.property("int")).isEqualTo(Integer.MAX_VALUE);
    assertThat(received.property("long")).isEqualTo(Long.MAX_VALUE);
    assertThat(received.property("float")).isEqualTo(Float.MAX_VALUE);
    assertThat(received.property("double")).isEqualTo(Double.MAX_VALUE);
    assertThat(received.property("timestamp")).isEqualTo(new Date(timestamp));
    assertThat(received.property("uuid")).isEqualTo(uuid);
    assertThat(received.property("binary")).isEqualTo(new byte[] {1, 2, 3});
    assertThat(received.property("ints")).isEqualTo(new int[] {1, 2, 3});
    assertThat(received.property("strings")).isEqualTo(new String[] {"a", "b"});
    assertThat(received.property("map")).isEqualTo(map);

    received.property("int", 1);
    assertThat(message.property("int")).isEqualTo(Integer.MAX_VALUE);
    consumer.accept(received);
  }

  @Test
  void producerSettingsShouldApplyToMessages() {
    Producer producer =
        connection
            .producerBuilder()
            .address("q")
            .routingType(RoutingType.MULTICAST)
            .durabilityMode(DurabilityMode.NON_DURABLE)
            .priority((byte) 8)
            .setMessageCreationTime(true)
            .build();
    Consumer consumer = connection.consumerBuilder().address("q").build();
    long start = System.currentTimeMillis();
    producer.sendAsync(producer.message()).join();
    producer.send(producer.message().priority((byte) 2));

    Message first = consumer.receiveAsync(Duration.ofSeconds(10)).join();
    assertThat(first.durable()).isFalse();
    assertThat(first.priority()).isEqualTo((byte) 8);
    assertThat(first.creationTime()).isGreaterThanOrEqualTo(start);
    assertThat(first.annotation(RoutingType.ROUTING_TYPE_ANNOTATION))
        .isEqualTo(RoutingType.MULTICAST.code());
    Message second = consumer.receiveAsync(Duration.ofSeconds(10)).join();
    assertThat(second.priority()).isEqualTo((byte) 2);
  }

  @Test
  void fireAndForgetSendShouldRouteMessage() {
    Producer producer = connection.producerBuilder().address("q").build();
    producer.send(message(producer, "foo"));
    assertThat(broker.queueSize("q")).isEqualTo(1);
    assertThat(registry.get("artemis.amqp.sent").counter().count()).isEqualTo(1.0);
  }

  @Test
  void rejectedMessageShouldFailSend() {
    Producer producer = connection.producerBuilder().address("q").build();
    broker.nextSendOutcome(
        DeliveryOutcome.rejected("amqp:resource-limit-exceeded", "queue is full"));
    CompletableFuture<Void> send = producer.sendAsync(producer.message());
    assertThatThrownBy(send::join)
        .cause()
        .isInstanceOf(AmqpException.AmqpMessageSendException.class)
        .satisfies(
            e -> {
              AmqpException.AmqpMessageSendException ex =
                  (AmqpException.AmqpMessageSendException) e;
              assertThat(ex.condition()).isEqualTo("amqp:resource-limit-exceeded");
              assertThat(ex.description()).isEqualTo("queue is full");
            });
    assertThat(registry.get("artemis.amqp.sent_rejected").counter().count()).isEqualTo(1.0);

    // the producer is still usable
    producer.sendAsync(producer.message()).join();
  }

  @Test
  void releasedMessageShouldFailSend() {
    Producer producer = connection.producerBuilder().address("q").build();
    broker.nextSendOutcome(DeliveryOutcome.released());
    assertThatThrownBy(() -> producer.sendAsync(producer.message()).join())
        .cause()
        .isInstanceOf(AmqpException.AmqpMessageSendException.class)
        .satisfies(
            e ->
                assertThat(((AmqpException.AmqpMessageSendException) e).condition())
                    .isEqualTo(AmqpException.AmqpMessageSendException.MESSAGE_RELEASED));
  }

  @Test
  void sendShouldTimeOutIfNoOutcome() {
    Producer producer = connection.producerBuilder().address("q").build();
    broker.holdOutcomes();
    assertThatThrownBy(
            () -> producer.sendAsync(producer.message(), null, Duration.ofMillis(100)).join())
        .hasCauseInstanceOf(AmqpException.AmqpOperationCancelledException.class);
    broker.releaseOutcomes();
    producer.sendAsync(producer.message()).join();
  }

  @Test
  void closingProducerShouldFailInFlightSends() {
    Producer producer = connection.producerBuilder().address("q").build();
    broker.holdOutcomes();
    CompletableFuture<Void> send = producer.sendAsync(producer.message());
    producer.close();
    assertThatThrownBy(send::join)
        .hasCauseInstanceOf(AmqpException.AmqpProducerClosedException.class);
    assertThatThrownBy(() -> producer.sendAsync(producer.message()).join())
        .hasCauseInstanceOf(AmqpException.AmqpProducerClosedException.class);
    assertThat(broker.senderCount("q")).isZero();
  }

  @Test
  void remoteLinkCloseShouldCloseProducer() {
    AtomicReference<Throwable> cause = new AtomicReference<>();
    TestUtils.Sync closedSync = sync();
    Producer producer =
        connection
            .producerBuilder()
            .address("q")
            .listeners(stateListener(CLOSED, cause, closedSync))
            .build();
    broker.closeLinks("q", "amqp:not-found", "queue deleted");
    assertThat(closedSync.await()).isTrue();
    assertThat(cause.get())
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class)
        .hasMessageContaining("queue deleted");
    assertThatThrownBy(() -> producer.sendAsync(producer.message()).join())
        .hasCauseInstanceOf(AmqpException.AmqpProducerClosedException.class);
    assertThat(((AmqpConnection) connection).entityRegistry().size()).isZero();
    assertThat(((AmqpConnection) connection).state())
        .isEqualTo(OPEN);
  }

  @Test
  void remoteLinkCloseShouldCloseConsumer() {
    Consumer consumer = connection.consumerBuilder().address("q").build();
    CompletableFuture<Message> receive = consumer.receiveAsync();
    broker.closeLinks("q", "amqp:unauthorized-access", "access refused");
    assertThatThrownBy(receive::join)
        .hasCauseInstanceOf(AmqpException.AmqpResourceClosedException.class)
        .hasRootCauseInstanceOf(AmqpException.AmqpSecurityException.class);
  }

  @Test
  void consumerShouldNotExceedCredit() {
    Producer producer = connection.producerBuilder().address("q").build();
    AmqpConsumer consumer =
        (AmqpConsumer) connection.consumerBuilder().address("q").initialCredit(2).build();
    for (int i = 0; i < 5; i++) {
      producer.sendAsync(message(producer, "m" + i)).join();
    }
    waitAtMost(() -> consumer.bufferedCount() == 2);
    assertThat(broker.queueSize("q")).isEqualTo(3);

    Message m0 = consumer.receiveAsync().join();
    assertThat(body(m0)).isEqualTo("m0");
    consumer.accept(m0);
    waitAtMost(() -> broker.queueSize("q") == 2);
    assertThat(consumer.bufferedCount()).isEqualTo(2);
  }

  @Test
  void settlementRules() {
    Producer producer = connection.producerBuilder().address("q").build();
    Consumer consumer = connection.consumerBuilder().address("q").build();
    Consumer otherConsumer = connection.consumerBuilder().address("other").build();
    producer.sendAsync(message(producer, "foo")).join();
    Message message = consumer.receiveAsync(Duration.ofSeconds(10)).join();

    assertThatThrownBy(() -> otherConsumer.accept(message))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> consumer.accept(producer.message()))
        .isInstanceOf(IllegalArgumentException.class);
    consumer.reject(message);
    assertThatThrownBy(() -> consumer.accept(message))
        .isInstanceOf(AmqpException.AmqpResourceInvalidStateException.class);
    assertThat(broker.queueSize("q")).isZero();
    assertThat(registry.get("artemis.amqp.consumed_rejected").counter().count()).isEqualTo(1.0);
  }

  @Test
  void releasedMessageShouldBeRedelivered() {
    Producer producer = connection.producerBuilder().address("q").build();
    Consumer consumer = connection.consumerBuilder().address("q").build();
    producer.sendAsync(message(producer, "foo")).join();
    Message message = consumer.receiveAsync(Duration.ofSeconds(10)).join();
    consumer.release(message);
    Message redelivered = consumer.receiveAsync(Duration.ofSeconds(10)).join();
    assertThat(body(redelivered)).isEqualTo("foo");
    consumer.accept(redelivered);
  }

  @Test
  void timedOutReceiveShouldNotLoseMessage() {
    Producer producer = connection.producerBuilder().address("q").build();
    Consumer consumer = connection.consumerBuilder().address("q").build();
    assertThatThrownBy(() -> consumer.receiveAsync(Duration.ofMillis(100)).join())
        .hasCauseInstanceOf(AmqpException.AmqpOperationCancelledException.class);
    producer.sendAsync(message(producer, "foo")).join();
    Message message = consumer.receiveAsync(Duration.ofSeconds(10)).join();
    assertThat(body(message)).isEqualTo("foo");
  }

  @Test
  void closingConsumerShouldFailPendingReceives() {
    Consumer consumer = connection.consumerBuilder().address("q").build();
    CompletableFuture<Message> receive = consumer.receiveAsync();
    consumer.close();
    assertThatThrownBy(receive::join)
        .hasCauseInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThatThrownBy(() -> consumer.receiveAsync().join())
        .hasCauseInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThat(broker.receiverCount("q")).isZero();
  }

  @Test
  void closingConnectionShouldCloseProducersAndConsumers() {
    Producer producer = connection.producerBuilder().address("q").build();
    Consumer consumer = connection.consumerBuilder().address("q").build();
    connection.close();
    assertThat(((AmqpProducer) producer).state()).isEqualTo(CLOSED);
    assertThat(((AmqpConsumer) consumer).state()).isEqualTo(CLOSED);
    assertThatThrownBy(() -> connection.producerBuilder().address("q").build())
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThatThrownBy(connection::transaction)
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThat(registry.get("artemis.amqp.connections").gauge().value()).isZero();
  }

  @Test
  void builderValidation() {
    assertThatThrownBy(() -> connection.producerBuilder().build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> connection.producerBuilder().priority((byte) 10))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> connection.consumerBuilder().initialCredit(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> connection.consumerBuilder().address(" ").build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> environment.connectionBuilder().endpoints())
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static Message message(Producer producer, String body) {
    return producer.message(body.getBytes(StandardCharsets.UTF_8));
  }

  private static String body(Message message) {
    return new String(message.body(), StandardCharsets.UTF_8);
  }
}
