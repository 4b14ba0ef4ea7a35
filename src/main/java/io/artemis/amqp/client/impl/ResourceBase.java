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

import static io.artemis.amqp.client.Resource.State.CLOSED;
import static io.artemis.amqp.client.Resource.State.CLOSING;
import static io.artemis.amqp.client.Resource.State.OPEN;
import static io.artemis.amqp.client.Resource.State.OPENING;

import io.artemis.amqp.client.AmqpException;
import io.artemis.amqp.client.Resource;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

abstract class ResourceBase implements Resource {

  private final AtomicReference<State> state = new AtomicReference<>();
  private final StateEventSupport stateEventSupport;
  private volatile Throwable closeReason;

  ResourceBase(List<StateListener> listeners) {
    this.stateEventSupport = new StateEventSupport(listeners);
    this.state(OPENING);
  }

  protected void checkOpen() {
    State state = this.state.get();
    if (state != OPEN && this.closeReason instanceof AmqpException) {
      throw (AmqpException) this.closeReason;
    } else if (state == CLOSED) {
      throw new AmqpException.AmqpResourceClosedException("Resource is closed");
    } else if (state != OPEN) {
      throw new AmqpException.AmqpResourceInvalidStateException(
          "Resource is not open, current state is %s", state.name());
    }
  }

  protected State state() {
    return this.state.get();
  }

  protected Throwable closeReason() {
    return this.closeReason;
  }

  protected void state(Resource.State state) {
    this.state(state, null);
  }

  /** Move to a new state, unless the resource is already {@link State#CLOSED}. */
  protected void state(Resource.State state, Throwable failureCause) {
    Resource.State previous;
    do {
      previous = this.state.get();
      if (previous == CLOSED) {
        return;
      }
    } while (!this.state.compareAndSet(previous, state));
    this.transitioned(previous, state, failureCause);
  }

  /**
   * Change the state only if the current state is the expected one.
   *
   * @return true if the state changed
   */
  protected boolean compareAndSetState(State expected, State state, Throwable failureCause) {
    if (expected == CLOSED || !this.state.compareAndSet(expected, state)) {
      return false;
    }
    this.transitioned(expected, state, failureCause);
    return true;
  }

  private void transitioned(State previous, State current, Throwable failureCause) {
    if (previous == current) {
      return;
    }
    if ((current == CLOSING || current == CLOSED) && this.closeReason == null) {
      this.closeReason = failureCause;
    }
    this.dispatch(previous, current, failureCause);
  }

  private void dispatch(State previous, State current, Throwable failureCause) {
    this.stateEventSupport.dispatch(this, failureCause, previous, current);
  }
}
