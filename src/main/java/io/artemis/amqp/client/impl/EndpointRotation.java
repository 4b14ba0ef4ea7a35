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

import io.artemis.amqp.client.Endpoint;
import io.artemis.amqp.client.EndpointSelector;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/** Picks the endpoint of each connection attempt, starting from the last attempted one. */
final class EndpointRotation {

  private final List<Endpoint> endpoints;
  private final EndpointSelector selector;
  private final Lock lock = new ReentrantLock();
  private Endpoint lastAttempted;

  EndpointRotation(List<Endpoint> endpoints, EndpointSelector selector) {
    if (endpoints == null || endpoints.isEmpty()) {
      throw new IllegalArgumentException("At least one endpoint is required");
    }
    this.endpoints = Collections.unmodifiableList(endpoints);
    this.selector = selector;
  }

  /**
   * Endpoint for the next connection attempt.
   *
   * @return the endpoint to connect to
   */
  Endpoint next() {
    lock.lock();
    try {
      Endpoint endpoint = this.selector.select(this.endpoints, this.lastAttempted);
      if (endpoint == null) {
        throw new IllegalStateException("Endpoint selector returned no endpoint");
      }
      this.lastAttempted = endpoint;
      return endpoint;
    } finally {
      lock.unlock();
    }
  }

  Endpoint first() {
    return this.endpoints.get(0);
  }

  /** The next attempt after a disconnection starts from the endpoint that was connected. */
  void connected(Endpoint endpoint) {
    lock.lock();
    try {
      this.lastAttempted = endpoint;
    } finally {
      lock.unlock();
    }
  }
}
