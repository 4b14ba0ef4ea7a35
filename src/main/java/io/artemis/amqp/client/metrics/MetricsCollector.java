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

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a new {@link io.artemis.amqp.client.Connection} is opened. */
  void openConnection();

  /** Called when a {@link io.artemis.amqp.client.Connection} is closed. */
  void closeConnection();

  /** Called when a {@link io.artemis.amqp.client.Connection} has recovered. */
  void recoverConnection();

  /** Called when a new {@link io.artemis.amqp.client.Producer} is opened. */
  void openProducer();

  /** Called when a {@link io.artemis.amqp.client.Producer} is closed. */
  void closeProducer();

  /** Called when a new {@link io.artemis.amqp.client.Consumer} is opened. */
  void openConsumer();

  /** Called when a {@link io.artemis.amqp.client.Consumer} is closed. */
  void closeConsumer();

  /** Called when a {@link io.artemis.amqp.client.Message} is sent. */
  void send();

  /**
   * Called when a {@link io.artemis.amqp.client.Message} is settled by the broker.
   *
   * @param disposition disposition (outcome)
   */
  void sendDisposition(SendDisposition disposition);

  /**
   * Called when a {@link io.artemis.amqp.client.Message} is dispatched to a {@link
   * io.artemis.amqp.client.Consumer}.
   */
  void consume();

  /**
   * Called when a {@link io.artemis.amqp.client.Message} is settled by a {@link
   * io.artemis.amqp.client.Consumer}.
   *
   * @param disposition disposition
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** Called when a transaction is declared. */
  void declareTransaction();

  /**
   * Called when a transaction is discharged.
   *
   * @param committed true for a commit, false for a rollback
   */
  void dischargeTransaction(boolean committed);

  /** The broker-to-client dispositions. */
  enum SendDisposition {
    ACCEPTED,
    REJECTED,
    RELEASED
  }

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** see {@link io.artemis.amqp.client.Consumer#accept(io.artemis.amqp.client.Message)} */
    ACCEPTED,
    /** see {@link io.artemis.amqp.client.Consumer#reject(io.artemis.amqp.client.Message)} */
    REJECTED,
    /** see {@link io.artemis.amqp.client.Consumer#release(io.artemis.amqp.client.Message)} */
    RELEASED
  }
}
