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
package io.artemis.amqp.client.transport;

import io.artemis.amqp.client.Endpoint;
import java.util.concurrent.CompletableFuture;

/** Opens AMQP 1.0 network connections. */
@FunctionalInterface
public interface TransportFactory {

  /**
   * Connect to an endpoint.
   *
   * <p>The future completes once the AMQP connection is open. It completes exceptionally with an
   * {@link java.io.IOException} (or an {@link
   * io.artemis.amqp.client.AmqpException.AmqpConnectionException}) if the endpoint cannot be
   * reached.
   *
   * @param endpoint the endpoint to connect to
   * @param listener the listener notified of transport-level failures
   * @return future of the connection
   */
  CompletableFuture<TransportConnection> connect(Endpoint endpoint, TransportListener listener);
}
