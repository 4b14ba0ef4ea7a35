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

import org.apache.qpid.protonj2.client.Message;

/** A link to send messages. */
public interface SenderLink extends Link {

  /**
   * Send a message.
   *
   * <p>With a callback, the delivery is sent unsettled and the callback receives the remote
   * outcome. Without callback, the delivery is sent pre-settled and nothing is reported back.
   *
   * <p>The callback may run on the calling thread or on a transport thread.
   *
   * @param message the message
   * @param state transactional state, null if not transactional
   * @param callback outcome callback, null for fire-and-forget
   * @throws IllegalStateException if the link is closed
   */
  void send(Message<?> message, TransactionalState state, OutcomeCallback callback);
}
