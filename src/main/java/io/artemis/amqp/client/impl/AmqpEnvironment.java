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

import io.artemis.amqp.client.ConnectionBuilder;
import io.artemis.amqp.client.Environment;
import io.artemis.amqp.client.metrics.MetricsCollector;
import io.artemis.amqp.client.metrics.NoOpMetricsCollector;
import io.artemis.amqp.client.transport.TransportFactory;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class AmqpEnvironment implements Environment {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpEnvironment.class);
  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final long id;
  private final TransportFactory transportFactory;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  // created by the environment, shut down with it
  private final List<ExecutorService> ownedExecutors = new CopyOnWriteArrayList<>();
  private final ExecutorService executorService;
  private final ScheduledExecutorService scheduledExecutorService;
  private final ConnectionManager connectionManager = new ConnectionManager(this);
  private final MetricsCollector metricsCollector;

  AmqpEnvironment(
      TransportFactory transportFactory,
      ExecutorService executorService,
      ScheduledExecutorService scheduledExecutorService,
      MetricsCollector metricsCollector) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.transportFactory = transportFactory;
    String threadPrefix = String.format("artemis-amqp-environment-%d-", this.id);
    this.executorService =
        executorService == null
            ? this.own(Executors.newCachedThreadPool(Utils.threadFactory(threadPrefix)))
            : executorService;
    this.scheduledExecutorService =
        scheduledExecutorService == null
            ? this.own(
                Executors.newScheduledThreadPool(
                    1, Utils.threadFactory(threadPrefix + "scheduler-")))
            : scheduledExecutorService;
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
  }

  @Override
  public ConnectionBuilder connectionBuilder() {
    return new AmqpConnectionBuilder(this);
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing environment {}", this);
      // connections first, their recovery tasks run on the executors
      this.connectionManager.close();
      this.ownedExecutors.forEach(ExecutorService::shutdownNow);
      LOGGER.debug("Environment {} has been closed", this);
    }
  }

  private <T extends ExecutorService> T own(T executor) {
    this.ownedExecutors.add(executor);
    return executor;
  }

  TransportFactory transportFactory() {
    return this.transportFactory;
  }

  ExecutorService executorService() {
    return this.executorService;
  }

  ScheduledExecutorService scheduledExecutorService() {
    return this.scheduledExecutorService;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  AmqpConnection connection(AmqpConnectionBuilder builder) {
    return this.connectionManager.connection(builder);
  }

  void removeConnection(AmqpConnection connection) {
    this.connectionManager.remove(connection);
  }

  int connectionCount() {
    return this.connectionManager.size();
  }

  @Override
  public String toString() {
    return "artemis-amqp-" + this.id;
  }
}
