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
 * Listener for connection recovery events.
 *
 * <p>Callbacks run on an internal thread, they must not block. Exceptions thrown by a listener are
 * logged and do not interrupt recovery.
 *
 * @see Connection#addRecoveryListener(RecoveryListener)
 * @see ConnectionBuilder#recoveryListeners(RecoveryListener...)
 */
public interface RecoveryListener {

  /**
   * Called once each time the connection is re-established and its producers and consumers are
   * attached again.
   *
   * @param endpoint the endpoint the connection is now connected to
   */
  default void recovered(Endpoint endpoint) {}

  /**
   * Called when recovery gives up. The connection is closed afterwards.
   *
   * @param cause the failure, never null
   */
  default void recoveryFailed(Throwable cause) {}

  /** Handle to remove a listener. */
  interface Registration {

    /** Remove the listener. */
    void unregister();
  }
}
