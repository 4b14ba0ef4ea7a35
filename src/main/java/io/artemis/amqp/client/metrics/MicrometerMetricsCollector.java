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
package io.artemis.amqp.client.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong connections;
  private final AtomicLong producers;
  private final AtomicLong consumers;
  private final Counter recoveries;
  private final Counter sent, sentAccepted, sentRejected, sentReleased;
  private final Counter consumed, consumedAccepted, consumedRejected, consumedReleased;
  private final Counter transactionsDeclared, transactionsCommitted, transactionsRolledBack;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "artemis.amqp");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.connections = registry.gauge(prefix + ".connections", tags, new AtomicLong(0));
    this.producers = registry.gauge(prefix + ".producers", tags, new AtomicLong(0));
    this.consumers = registry.gauge(prefix + ".consumers", tags, new AtomicLong(0));
    this.recoveries = registry.counter(prefix + ".recoveries", tags);
    this.sent = registry.counter(prefix + ".sent", tags);
    this.sentAccepted = registry.counter(prefix + ".sent_accepted", tags);
    this.sentRejected = registry.counter(prefix + ".sent_rejected", tags);
    this.sentReleased = registry.counter(prefix + ".sent_released", tags);
    this.consumed = registry.counter(prefix + ".consumed", tags);
    this.consumedAccepted = registry.counter(prefix + ".consumed_accepted", tags);
    this.consumedRejected = registry.counter(prefix + ".consumed_rejected", tags);
    this.consumedReleased = registry.counter(prefix + ".consumed_released", tags);
    this.transactionsDeclared = registry.counter(prefix + ".transactions_declared", tags);
    this.transactionsCommitted = registry.counter(prefix + ".transactions_committed", tags);
    this.transactionsRolledBack = registry.counter(prefix + ".transactions_rolled_back", tags);
  }

  @Override
  public void openConnection() {
    this.connections.incrementAndGet();
  }

  @Override
  public void closeConnection() {
    this.connections.decrementAndGet();
  }

  @Override
  public void recoverConnection() {
    this.recoveries.increment();
  }

  @Override
  public void openProducer() {
    this.producers.incrementAndGet();
  }

  @Override
  public void closeProducer() {
    this.producers.decrementAndGet();
  }

  @Override
  public void openConsumer() {
    this.consumers.incrementAndGet();
  }

  @Override
  public void closeConsumer() {
    this.consumers.decrementAndGet();
  }

  @Override
  public void send() {
    this.sent.increment();
  }

  @Override
  public void sendDisposition(SendDisposition disposition) {
    switch (disposition) {
      case ACCEPTED:
        this.sentAccepted.increment();
        break;
      case REJECTED:
        this.sentRejected.increment();
        break;
      case RELEASED:
        this.sentReleased.increment();
        break;
      default:
        break;
    }
  }

  @Override
  public void consume() {
    this.consumed.increment();
  }

  @Override
  public void consumeDisposition(ConsumeDisposition disposition) {
    switch (disposition) {
      case ACCEPTED:
        this.consumedAccepted.increment();
        break;
      case REJECTED:
        this.consumedRejected.increment();
        break;
      case RELEASED:
        this.consumedReleased.increment();
        break;
      default:
        break;
    }
  }

  @Override
  public void declareTransaction() {
    this.transactionsDeclared.increment();
  }

  @Override
  public void dischargeTransaction(boolean committed) {
    if (committed) {
      this.transactionsCommitted.increment();
    } else {
      this.transactionsRolledBack.increment();
    }
  }
}
