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
import io.artemis.amqp.client.RecoveryListener;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class RecoveryEventSupport {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecoveryEventSupport.class);

  private final List<RecoveryListener> listeners;

  RecoveryEventSupport(List<RecoveryListener> listeners) {
    this.listeners = new CopyOnWriteArrayList<>(listeners);
  }

  RecoveryListener.Registration add(RecoveryListener listener) {
    this.listeners.add(listener);
    return () -> this.listeners.remove(listener);
  }

  void recovered(Endpoint endpoint) {
    this.dispatch(l -> l.recovered(endpoint));
  }

  void recoveryFailed(Throwable cause) {
    this.dispatch(l -> l.recoveryFailed(cause));
  }

  private void dispatch(Consumer<RecoveryListener> event) {
    for (RecoveryListener listener : this.listeners) {
      try {
        event.accept(listener);
      } catch (Exception e) {
        LOGGER.warn("Error in recovery listener", e);
      }
    }
  }
}
