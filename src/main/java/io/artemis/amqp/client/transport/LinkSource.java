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

/** Source terminus of a receiving link. */
public final class LinkSource {

  private final String address;
  private final List<String> capabilities;

  private LinkSource(String address, List<String> capabilities) {
    this.address = address;
    this.capabilities = capabilities;
  }

  public static LinkSource source(String address, String... capabilities) {
    return new LinkSource(address, Collections.unmodifiableList(Arrays.asList(capabilities)));
  }

  public String address() {
    return this.address;
  }

  public List<String> capabilities() {
    return this.capabilities;
  }

  @Override
  public String toString() {
    return "LinkSource{" + "address='" + address + '\'' + ", capabilities=" + capabilities + '}';
  }
}
