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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;

/** Transactional delivery state, attaches a delivery to a declared transaction. */
public final class TransactionalState {

  private final byte[] txnId;

  @SuppressFBWarnings("CT_CONSTRUCTOR_THROW")
  public TransactionalState(byte[] txnId) {
    if (txnId == null || txnId.length == 0) {
      throw new IllegalArgumentException("Transaction ID cannot be null or empty");
    }
    this.txnId = txnId.clone();
  }

  /**
   * The transaction ID the coordinator returned.
   *
   * @return a copy of the transaction ID
   */
  public byte[] txnId() {
    return this.txnId.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(txnId, ((TransactionalState) o).txnId);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(txnId);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("TransactionalState{txnId=");
    for (byte b : txnId) {
      builder.append(String.format("%02x", b));
    }
    return builder.append('}').toString();
  }
}
