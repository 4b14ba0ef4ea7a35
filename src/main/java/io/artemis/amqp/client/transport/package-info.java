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
/**
 * Contract between the client core and the AMQP 1.0 protocol engine.
 *
 * <p>The client core never touches sockets or frames: it drives a {@link
 * io.artemis.amqp.client.transport.TransportFactory} to open connections, sessions and links and
 * reacts to the outcomes and failures the transport reports.
 *
 * <p>Implementations must honor the following:
 *
 * <ul>
 *   <li>{@link io.artemis.amqp.client.transport.TransportListener#disconnected} is called only for
 *       transport-level failures, never after {@link
 *       io.artemis.amqp.client.transport.TransportConnection#close()}.
 *   <li>When the connection is lost, the connection reports {@code isClosed() == true} before any
 *       link close callback is delivered.
 *   <li>Every delivery sent with an {@link io.artemis.amqp.client.transport.OutcomeCallback} gets
 *       exactly one outcome, {@link io.artemis.amqp.client.transport.DeliveryOutcome#transportClosed()}
 *       if the link goes away first.
 * </ul>
 */
package io.artemis.amqp.client.transport;
