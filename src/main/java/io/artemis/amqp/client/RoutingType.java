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

/** How the broker routes messages sent to an address. */
public enum RoutingType {
  /** Point-to-point, each message goes to one consumer. */
  ANYCAST((byte) 1, "queue"),
  /** Publish-subscribe, each message goes to every subscriber. */
  MULTICAST((byte) 0, "topic");

  /** Message annotation carrying the routing type of a message. */
  public static final String ROUTING_TYPE_ANNOTATION = "x-opt-routing-type";

  private final byte code;
  private final String capability;

  RoutingType(byte code, String capability) {
    this.code = code;
    this.capability = capability;
  }

  /**
   * Value of the routing type message annotation.
   *
   * @return annotation value
   */
  public byte code() {
    return this.code;
  }

  /**
   * Link terminus capability matching the routing type.
   *
   * @return capability
   */
  public String capability() {
    return this.capability;
  }
}
