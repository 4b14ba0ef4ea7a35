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

import java.util.concurrent.CompletableFuture;

/** API to configure and create a {@link Producer}. */
public interface ProducerBuilder {

  /**
   * The address to send to.
   *
   * @param address address
   * @return this builder instance
   */
  ProducerBuilder address(String address);

  /**
   * Routing type of the address.
   *
   * <p>Default is {@link RoutingType#ANYCAST}.
   *
   * @param routingType routing type
   * @return this builder instance
   */
  ProducerBuilder routingType(RoutingType routingType);

  /**
   * Durability of messages that do not set it.
   *
   * <p>If not set, messages sent with {@link Producer#sendAsync(Message)} are durable and
   * messages sent with {@link Producer#send(Message)} are not.
   *
   * @param durabilityMode durability mode
   * @return this builder instance
   */
  ProducerBuilder durabilityMode(DurabilityMode durabilityMode);

  /**
   * Priority of messages that do not set it.
   *
   * @param priority priority, between 0 and 9
   * @return this builder instance
   */
  ProducerBuilder priority(byte priority);

  /**
   * Whether to set the creation time of messages that do not set it.
   *
   * <p>Default is false.
   *
   * @param setMessageCreationTime flag
   * @return this builder instance
   */
  ProducerBuilder setMessageCreationTime(boolean setMessageCreationTime);

  /**
   * Add {@link io.artemis.amqp.client.Resource.StateListener}s to the producer.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  ProducerBuilder listeners(Resource.StateListener... listeners);

  /**
   * Create the producer and wait for its link to be attached.
   *
   * @return the configured producer
   */
  Producer build();

  /**
   * Create the producer.
   *
   * @return a future of the producer, completing once its link is attached
   */
  CompletableFuture<Producer> buildAsync();
}
