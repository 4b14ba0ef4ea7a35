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

import io.artemis.amqp.client.DurabilityMode;
import io.artemis.amqp.client.Producer;
import io.artemis.amqp.client.ProducerBuilder;
import io.artemis.amqp.client.Resource;
import io.artemis.amqp.client.RoutingType;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

class AmqpProducerBuilder implements ProducerBuilder {

  private final AmqpConnection connection;
  private final List<Resource.StateListener> listeners = new ArrayList<>();
  private String address;
  private RoutingType routingType = RoutingType.ANYCAST;
  private DurabilityMode durabilityMode;
  private Byte priority;
  private boolean setMessageCreationTime = false;

  AmqpProducerBuilder(AmqpConnection connection) {
    this.connection = connection;
  }

  @Override
  public ProducerBuilder address(String address) {
    this.address = address;
    return this;
  }

  @Override
  public ProducerBuilder routingType(RoutingType routingType) {
    this.routingType = routingType;
    return this;
  }

  @Override
  public ProducerBuilder durabilityMode(DurabilityMode durabilityMode) {
    this.durabilityMode = durabilityMode;
    return this;
  }

  @Override
  public ProducerBuilder priority(byte priority) {
    if (priority < 0 || priority > 9) {
      throw new IllegalArgumentException("Priority must be between 0 and 9");
    }
    this.priority = priority;
    return this;
  }

  @Override
  public ProducerBuilder setMessageCreationTime(boolean setMessageCreationTime) {
    this.setMessageCreationTime = setMessageCreationTime;
    return this;
  }

  @Override
  public ProducerBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public Producer build() {
    return ExceptionUtils.wrapGet(this.buildAsync());
  }

  @Override
  public CompletableFuture<Producer> buildAsync() {
    if (this.address == null || this.address.isBlank()) {
      throw new IllegalArgumentException("An address must be specified");
    }
    if (this.routingType == null) {
      throw new IllegalArgumentException("Routing type cannot be null");
    }
    return this.connection.createProducer(this).thenApply(p -> p);
  }

  AmqpConnection connection() {
    return this.connection;
  }

  String address() {
    return this.address;
  }

  RoutingType routingType() {
    return this.routingType;
  }

  DurabilityMode durabilityMode() {
    return this.durabilityMode;
  }

  Byte priority() {
    return this.priority;
  }

  boolean setMessageCreationTime() {
    return this.setMessageCreationTime;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }
}
