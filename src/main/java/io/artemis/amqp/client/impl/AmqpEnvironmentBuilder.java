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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.artemis.amqp.client.Environment;
import io.artemis.amqp.client.metrics.MetricsCollector;
import io.artemis.amqp.client.metrics.NoOpMetricsCollector;
import io.artemis.amqp.client.transport.TransportFactory;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/** Builder to create an {@link Environment} instance of the Artemis AMQP 1.0 client. */
public class AmqpEnvironmentBuilder {

  private TransportFactory transportFactory;
  private ExecutorService executorService;
  private ScheduledExecutorService scheduledExecutorService;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;

  public AmqpEnvironmentBuilder() {}

  /**
   * Set the transport to open network connections, sessions and links with.
   *
   * @param transportFactory the transport factory
   * @return this builder instance
   */
  public AmqpEnvironmentBuilder transportFactory(TransportFactory transportFactory) {
    this.transportFactory = transportFactory;
    return this;
  }

  /**
   * Set executor service used for internal tasks (e.g. connection recovery).
   *
   * <p>The library uses sensible defaults, override only in case of problems.
   *
   * @param executorService the executor service
   * @return this builder instance
   */
  @SuppressFBWarnings("EI_EXPOSE_REP2")
  public AmqpEnvironmentBuilder executorService(ExecutorService executorService) {
    this.executorService = executorService;
    return this;
  }

  /**
   * Set scheduled executor service used for internal tasks (e.g. recovery delays, timeouts).
   *
   * <p>The library uses sensible defaults, override only in case of problems.
   *
   * @param scheduledExecutorService the scheduled executor service
   * @return this builder instance
   */
  @SuppressFBWarnings("EI_EXPOSE_REP2")
  public AmqpEnvironmentBuilder scheduledExecutorService(
      ScheduledExecutorService scheduledExecutorService) {
    this.scheduledExecutorService = scheduledExecutorService;
    return this;
  }

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see io.artemis.amqp.client.metrics.MicrometerMetricsCollector
   */
  public AmqpEnvironmentBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  /**
   * Create the environment instance.
   *
   * @return the configured environment
   */
  public Environment build() {
    if (this.transportFactory == null) {
      throw new IllegalStateException("A transport factory must be set");
    }
    return new AmqpEnvironment(
        this.transportFactory,
        this.executorService,
        this.scheduledExecutorService,
        this.metricsCollector);
  }
}
