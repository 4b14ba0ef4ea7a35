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

import io.artemis.amqp.client.AmqpException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Tracks the connections of an environment to close them with it. */
final class ConnectionManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

  private final AmqpEnvironment environment;
  private final Lock connectionsLock = new ReentrantLock();
  private final Set<AmqpConnection> connections = new HashSet<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  ConnectionManager(AmqpEnvironment environment) {
    this.environment = environment;
  }

  AmqpConnection connection(AmqpConnectionBuilder builder) {
    // the connection keeps its own copy, the application can reuse the builder
    AmqpConnectionBuilder copy = new AmqpConnectionBuilder(this.environment);
    builder.copyTo(copy);
    return doOnConnections(
        conns -> {
          if (this.closed.get()) {
            throw new AmqpException.AmqpResourceClosedException("Environment is closed");
          }
          AmqpConnection connection = new AmqpConnection(copy);
          conns.add(connection);
          return connection;
        });
  }

  void remove(AmqpConnection connection) {
    doOnConnections(
        conns -> {
          if (!this.closed.get()) {
            conns.remove(connection);
          }
          return null;
        });
  }

  int size() {
    return doOnConnections(Set::size);
  }

  void close() {
    if (this.closed.compareAndSet(false, true)) {
      List<AmqpConnection> toClose = doOnConnections(conns -> new ArrayList<>(conns));
      for (AmqpConnection connection : toClose) {
        try {
          connection.close();
        } catch (Exception e) {
          LOGGER.warn("Error while closing connection {}", connection, e);
        }
      }
      doOnConnections(
          conns -> {
            conns.clear();
            return null;
          });
    }
  }

  private <T> T doOnConnections(Function<Set<AmqpConnection>, T> operation) {
    this.connectionsLock.lock();
    try {
      return operation.apply(this.connections);
    } finally {
      this.connectionsLock.unlock();
    }
  }
}
