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

import java.util.concurrent.CompletableFuture;

/** API to configure and create a {@link Consumer}. */
public interface ConsumerBuilder {

  ConsumerBuilder address(String address);

  /**
   * Routing type of the address.
   *
   * <p>Default is {@link RoutingType#ANYCAST}.
   *
   * @param routingType routing type
   * @return this builder instance
   */
  ConsumerBuilder routingType(RoutingType routingType);

  /**
   * Number of messages the broker can deliver before the application settles any.
   *
   * <p>Default is 100.
   *
   * @param initialCredit initial credit
   * @return this builder instance
   */
  ConsumerBuilder initialCredit(int initialCredit);

  ConsumerBuilder listeners(Resource.StateListener... listeners);

  Consumer build();

  CompletableFuture<Consumer> buildAsync();
}
