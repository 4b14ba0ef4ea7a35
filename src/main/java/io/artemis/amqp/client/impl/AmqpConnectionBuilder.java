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
import io.artemis.amqp.client.Connection;
import io.artemis.amqp.client.ConnectionBuilder;
import io.artemis.amqp.client.Endpoint;
import io.artemis.amqp.client.EndpointSelector;
import io.artemis.amqp.client.RecoveryListener;
import io.artemis.amqp.client.RecoveryPolicy;
import io.artemis.amqp.client.Resource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

class AmqpConnectionBuilder implements ConnectionBuilder {

  static final Endpoint DEFAULT_ENDPOINT = Endpoint.create("localhost", 5672);

  private final AmqpEnvironment environment;
  private final AmqpRecoveryConfiguration recoveryConfiguration =
      new AmqpRecoveryConfiguration(this);
  private final List<Endpoint> endpoints = new ArrayList<>();
  private final List<Resource.StateListener> listeners = new ArrayList<>();
  private final List<RecoveryListener> recoveryListeners = new ArrayList<>();
  private EndpointSelector endpointSelector = EndpointSelector.roundRobin();
  private String name;

  AmqpConnectionBuilder(AmqpEnvironment environment) {
    this.environment = environment;
  }

  @Override
  public ConnectionBuilder endpoint(Endpoint endpoint) {
    if (endpoint == null) {
      throw new IllegalArgumentException("Endpoint cannot be null");
    }
    this.endpoints.clear();
    this.endpoints.add(endpoint);
    return this;
  }

  @Override
  public ConnectionBuilder endpoints(Endpoint... endpoints) {
    if (endpoints == null || endpoints.length == 0) {
      throw new IllegalArgumentException("At least one endpoint must be specified");
    }
    this.endpoints.clear();
    this.endpoints.addAll(List.of(endpoints));
    return this;
  }

  @Override
  public ConnectionBuilder uri(String uri) {
    return this.endpoint(Endpoint.fromUri(uri));
  }

  @Override
  public ConnectionBuilder endpointSelector(EndpointSelector selector) {
    if (selector == null) {
      throw new IllegalArgumentException("Endpoint selector cannot be null");
    }
    this.endpointSelector = selector;
    return this;
  }

  @Override
  public ConnectionBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public RecoveryConfiguration recovery() {
    return this.recoveryConfiguration;
  }

  @Override
  public ConnectionBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public ConnectionBuilder recoveryListeners(RecoveryListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.recoveryListeners.clear();
    } else {
      this.recoveryListeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public Connection build() {
    return ExceptionUtils.wrapGet(this.buildAsync());
  }

  @Override
  public CompletableFuture<Connection> buildAsync() {
    return this.environment.connection(this).open().thenApply(c -> c);
  }

  void copyTo(AmqpConnectionBuilder copy) {
    copy.endpoints.addAll(this.endpoints);
    copy.endpointSelector(this.endpointSelector);
    this.recoveryConfiguration.copyTo(copy.recoveryConfiguration);
    copy.listeners.addAll(this.listeners);
    copy.recoveryListeners.addAll(this.recoveryListeners);
    copy.name(this.name);
  }

  AmqpEnvironment environment() {
    return this.environment;
  }

  AmqpRecoveryConfiguration recoveryConfiguration() {
    return this.recoveryConfiguration;
  }

  String name() {
    return this.name;
  }

  List<Endpoint> endpoints() {
    return this.endpoints.isEmpty() ? List.of(DEFAULT_ENDPOINT) : List.copyOf(this.endpoints);
  }

  EndpointSelector endpointSelector() {
    return this.endpointSelector;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }

  List<RecoveryListener> recoveryListeners() {
    return this.recoveryListeners;
  }

  static class AmqpRecoveryConfiguration implements RecoveryConfiguration {

    private final AmqpConnectionBuilder connectionBuilder;
    private boolean activated = true;
    private RecoveryPolicy policy = RecoveryPolicy.fixed(Duration.ofSeconds(5));

    AmqpRecoveryConfiguration(AmqpConnectionBuilder connectionBuilder) {
      this.connectionBuilder = connectionBuilder;
    }

    @Override
    public AmqpRecoveryConfiguration activated(boolean activated) {
      this.activated = activated;
      return this;
    }

    @Override
    public AmqpRecoveryConfiguration policy(RecoveryPolicy policy) {
      if (policy == null) {
        throw new IllegalArgumentException("Recovery policy cannot be null");
      }
      this.policy = policy;
      return this;
    }

    @Override
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ConnectionBuilder connectionBuilder() {
      return this.connectionBuilder;
    }

    boolean activated() {
      return this.activated;
    }

    RecoveryPolicy policy() {
      return this.policy;
    }

    void copyTo(AmqpRecoveryConfiguration copy) {
      copy.activated(this.activated);
      copy.policy(this.policy);
    }
  }
}
