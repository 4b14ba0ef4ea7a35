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

import io.artemis.amqp.client.Consumer;
import io.artemis.amqp.client.ConsumerBuilder;
import io.artemis.amqp.client.Resource;
import io.artemis.amqp.client.RoutingType;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

class AmqpConsumerBuilder implements ConsumerBuilder {

  private final AmqpConnection connection;
  private final List<Resource.StateListener> listeners = new ArrayList<>();
  private String address;
  private RoutingType routingType = RoutingType.ANYCAST;
  private int initialCredit = 100;

  AmqpConsumerBuilder(AmqpConnection connection) {
    this.connection = connection;
  }

  @Override
  public ConsumerBuilder address(String address) {
    this.address = address;
    return this;
  }

  @Override
  public ConsumerBuilder routingType(RoutingType routingType) {
    this.routingType = routingType;
    return this;
  }

  @Override
  public ConsumerBuilder initialCredit(int initialCredit) {
    if (initialCredit <= 0) {
      throw new IllegalArgumentException("Initial credit must be strictly positive");
    }
    this.initialCredit = initialCredit;
    return this;
  }

  @Override
  public ConsumerBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public Consumer build() {
    return ExceptionUtils.wrapGet(this.buildAsync());
  }

  @Override
  public CompletableFuture<Consumer> buildAsync() {
    if (this.address == null || this.address.isBlank()) {
      throw new IllegalArgumentException("An address must be specified");
    }
    if (this.routingType == null) {
      throw new IllegalArgumentException("Routing type cannot be null");
    }
    return this.connection.createConsumer(this).thenApply(c -> c);
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

  int initialCredit() {
    return this.initialCredit;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }
}
