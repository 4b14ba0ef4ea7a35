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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.qpid.protonj2.types.transport.ReceiverSettleMode;
import org.apache.qpid.protonj2.types.transport.SenderSettleMode;

/** Target terminus of a sending link, either a regular address or a transaction coordinator. */
public final class LinkTarget {

  /** Capability of a coordinator supporting local transactions. */
  public static final String LOCAL_TRANSACTIONS = "amqp:local-transactions";

  private final String address;
  private final boolean coordinator;
  private final List<String> capabilities;
  private final SenderSettleMode senderSettleMode;
  private final ReceiverSettleMode receiverSettleMode;

  private LinkTarget(
      String address,
      boolean coordinator,
      List<String> capabilities,
      SenderSettleMode senderSettleMode,
      ReceiverSettleMode receiverSettleMode) {
    this.address = address;
    this.coordinator = coordinator;
    this.capabilities = capabilities;
    this.senderSettleMode = senderSettleMode;
    this.receiverSettleMode = receiverSettleMode;
  }

  /**
   * Target for an address, with mixed sender settlement so that sends can be acknowledged or
   * fire-and-forget.
   *
   * @param address the address
   * @param capabilities desired capabilities
   * @return the target
   */
  public static LinkTarget target(String address, String... capabilities) {
    return new LinkTarget(
        address,
        false,
        Collections.unmodifiableList(Arrays.asList(capabilities)),
        SenderSettleMode.MIXED,
        ReceiverSettleMode.FIRST);
  }

  /**
   * Transaction coordinator target, for local transactions.
   *
   * <p>Transactional control messages are sent unsettled, the receiver settles first.
   *
   * @return the coordinator target
   */
  public static LinkTarget coordinator() {
    return new LinkTarget(
        null,
        true,
        Collections.singletonList(LOCAL_TRANSACTIONS),
        SenderSettleMode.UNSETTLED,
        ReceiverSettleMode.FIRST);
  }

  public String address() {
    return this.address;
  }

  public boolean isCoordinator() {
    return this.coordinator;
  }

  public List<String> capabilities() {
    return this.capabilities;
  }

  public SenderSettleMode senderSettleMode() {
    return this.senderSettleMode;
  }

  public ReceiverSettleMode receiverSettleMode() {
    return this.receiverSettleMode;
  }

  @Override
  public String toString() {
    return "LinkTarget{"
        + "address='"
        + address
        + '\''
        + ", coordinator="
        + coordinator
        + ", capabilities="
        + capabilities
        + ", senderSettleMode="
        + senderSettleMode
        + ", receiverSettleMode="
        + receiverSettleMode
        + '}';
  }
}
