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
package io.artemis.amqp.client;

/**
 * A connection to a broker that re-establishes itself after network failures.
 *
 * <p>Producers and consumers created from a connection survive recovery: they are attached again
 * on the new network connection, in the order they were created.
 *
 * <p>Instances are thread-safe.
 */
public interface Connection extends AutoCloseable, Resource {

  /**
   * Create a builder to configure and create a {@link Producer}.
   *
   * @return producer builder
   */
  ProducerBuilder producerBuilder();

  /**
   * Create a builder to configure and create a {@link Consumer}.
   *
   * @return consumer builder
   */
  ConsumerBuilder consumerBuilder();

  /**
   * Create a local transaction scoped to this connection.
   *
   * <p>The transaction is declared on the broker only when a message is first sent with it.
   *
   * @return a new transaction
   */
  Transaction transaction();

  /**
   * The endpoint the connection is currently connected to.
   *
   * @return the current endpoint, null if not connected
   */
  Endpoint endpoint();

  /**
   * Register a listener for recovery events.
   *
   * @param listener the listener
   * @return a registration to remove the listener
   */
  RecoveryListener.Registration addRecoveryListener(RecoveryListener listener);

  /**
   * Close the connection and its resources.
   *
   * <p>Closing never triggers recovery or recovery events.
   */
  @Override
  void close();
}
