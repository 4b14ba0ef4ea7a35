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

import java.util.concurrent.CompletableFuture;

/** An AMQP 1.0 session. */
public interface TransportSession {

  /**
   * Attach a sending link.
   *
   * @param name link name
   * @param target target terminus
   * @param listener listener notified when the link closes
   * @return future of the link, completing when the peer has attached
   */
  CompletableFuture<SenderLink> attachSender(String name, LinkTarget target, LinkListener listener);

  /**
   * Attach a receiving link.
   *
   * <p>The link starts with no credit.
   *
   * @param name link name
   * @param source source terminus
   * @param deliveryListener listener of incoming deliveries
   * @param listener listener notified when the link closes
   * @return future of the link, completing when the peer has attached
   */
  CompletableFuture<ReceiverLink> attachReceiver(
      String name, LinkSource source, DeliveryListener deliveryListener, LinkListener listener);

  void close();
}
