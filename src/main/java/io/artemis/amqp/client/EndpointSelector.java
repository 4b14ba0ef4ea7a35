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

import java.util.List;

/**
 * Strategy to pick the endpoint for the next connection attempt.
 *
 * @see ConnectionBuilder#endpointSelector(EndpointSelector)
 */
@FunctionalInterface
public interface EndpointSelector {

  /**
   * Selects the endpoint to try next.
   *
   * @param endpoints the configured endpoints, never empty
   * @param lastAttempted the endpoint of the previous attempt, null for the very first attempt
   * @return the endpoint to connect to
   */
  Endpoint select(List<Endpoint> endpoints, Endpoint lastAttempted);

  /**
   * Selector cycling through the endpoints in their configured order.
   *
   * <p>The first attempt uses the first endpoint, each following attempt the endpoint after the
   * last attempted one, wrapping around at the end of the list.
   *
   * @return round-robin selector
   */
  static EndpointSelector roundRobin() {
    return (endpoints, lastAttempted) -> {
      if (lastAttempted == null) {
        return endpoints.get(0);
      }
      int index = endpoints.indexOf(lastAttempted);
      return endpoints.get((index + 1) % endpoints.size());
    };
  }
}
