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

import io.artemis.amqp.client.transport.TransportSession;
import java.util.concurrent.CompletableFuture;

/** A link-backed resource the connection attaches again after recovery. */
interface RecoverableEntity {

  long id();

  /** Called when the connection is lost, the entity must reject new operations. */
  void connectionLost(Throwable cause);

  /**
   * Attach a new link on the recovered connection.
   *
   * <p>Entities closed in the meantime complete immediately and must not keep any new link.
   *
   * @param session session of the new connection
   * @return future completing when the entity is usable again
   */
  CompletableFuture<Void> recover(TransportSession session);

  boolean isClosed();

  /** Close the entity because the connection closes or its recovery failed. */
  void close(Throwable cause);
}
