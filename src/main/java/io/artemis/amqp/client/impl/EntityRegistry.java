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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Producers and consumers of a connection, in creation order.
 *
 * <p>Callers get snapshots and iterate them without holding any lock.
 */
final class EntityRegistry {

  private final Map<Long, RecoverableEntity> entities = new ConcurrentSkipListMap<>();
  private final Lock lock = new ReentrantLock();

  void register(RecoverableEntity entity) {
    lock.lock();
    try {
      this.entities.put(entity.id(), entity);
    } finally {
      lock.unlock();
    }
  }

  void unregister(RecoverableEntity entity) {
    lock.lock();
    try {
      this.entities.remove(entity.id(), entity);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Entities to attach again, in creation order, closed ones excluded.
   *
   * @return a snapshot of the open entities
   */
  List<RecoverableEntity> snapshot() {
    lock.lock();
    try {
      List<RecoverableEntity> result = new ArrayList<>(this.entities.size());
      for (RecoverableEntity entity : this.entities.values()) {
        if (!entity.isClosed()) {
          result.add(entity);
        }
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Remove and return all the entities.
   *
   * @return the entities in creation order
   */
  List<RecoverableEntity> clear() {
    lock.lock();
    try {
      List<RecoverableEntity> result = new ArrayList<>(this.entities.values());
      this.entities.clear();
      return result;
    } finally {
      lock.unlock();
    }
  }

  int size() {
    return this.entities.size();
  }
}
