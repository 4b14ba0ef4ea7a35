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
 * A connection, producer or consumer, with a lifecycle applications can observe.
 *
 * <p>A connection that loses its transport goes to {@link State#RECOVERING}, and so do its
 * producers and consumers. They all return to {@link State#OPEN} once recovery re-attached them,
 * or end {@link State#CLOSED} if recovery gives up.
 *
 * @see Connection
 * @see Producer
 * @see Consumer
 */
public interface Resource {

  /**
   * Callback for state changes, registered on the builder of the resource.
   *
   * <p>Called on the thread that changes the state, it should not block.
   *
   * @see ConnectionBuilder#listeners(StateListener...)
   * @see ProducerBuilder#listeners(StateListener...)
   * @see ConsumerBuilder#listeners(StateListener...)
   */
  @FunctionalInterface
  interface StateListener {

    void handle(Context context);
  }

  /** A state change. */
  interface Context {

    Resource resource();

    /**
     * What caused the change, usually set for {@link State#RECOVERING} and {@link State#CLOSED}.
     *
     * @return the cause, or null
     */
    Throwable failureCause();

    State previousState();

    State currentState();
  }

  enum State {
    /** Attaching, for a connection the first connection attempt. */
    OPENING,
    OPEN,
    /** Transport lost, waiting for the connection to recover. */
    RECOVERING,
    CLOSING,
    /** Closed, no other state can follow. */
    CLOSED
  }
}
