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

import io.artemis.amqp.client.Resource;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Notifies the state listeners of a connection, producer or consumer. */
final class StateEventSupport {

  private static final Logger LOGGER = LoggerFactory.getLogger(StateEventSupport.class);

  private final List<Resource.StateListener> listeners;

  StateEventSupport(List<Resource.StateListener> listeners) {
    this.listeners = List.copyOf(listeners);
  }

  void dispatch(
      Resource resource,
      Throwable failureCause,
      Resource.State previousState,
      Resource.State currentState) {
    LOGGER.trace("{}: {} -> {}", resource, previousState, currentState);
    if (this.listeners.isEmpty()) {
      return;
    }
    StateChange change = new StateChange(resource, failureCause, previousState, currentState);
    for (Resource.StateListener listener : this.listeners) {
      try {
        listener.handle(change);
      } catch (Exception e) {
        // a failing listener must not stop a recovery or a close
        LOGGER.warn("State listener failed on {}", change, e);
      }
    }
  }

  private static final class StateChange implements Resource.Context {

    private final Resource resource;
    private final Throwable failureCause;
    private final Resource.State from;
    private final Resource.State to;

    private StateChange(
        Resource resource, Throwable failureCause, Resource.State from, Resource.State to) {
      this.resource = resource;
      this.failureCause = failureCause;
      this.from = from;
      this.to = to;
    }

    @Override
    public Resource resource() {
      return this.resource;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public Resource.State previousState() {
      return this.from;
    }

    @Override
    public Resource.State currentState() {
      return this.to;
    }

    @Override
    public String toString() {
      return this.resource + " " + this.from + " -> " + this.to;
    }
  }
}
