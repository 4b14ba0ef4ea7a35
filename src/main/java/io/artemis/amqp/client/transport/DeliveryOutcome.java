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

/**
 * Remote outcome of a delivery.
 *
 * <p>Instances are created with the static factory methods.
 */
public abstract class DeliveryOutcome {

  private static final DeliveryOutcome ACCEPTED = new SimpleOutcome(Type.ACCEPTED);
  private static final DeliveryOutcome RELEASED = new SimpleOutcome(Type.RELEASED);
  private static final DeliveryOutcome TRANSPORT_CLOSED = new SimpleOutcome(Type.TRANSPORT_CLOSED);

  /** Kind of outcome. */
  public enum Type {
    /** The message has been accepted. */
    ACCEPTED,
    /** The message has been rejected, see {@link #condition()} and {@link #description()}. */
    REJECTED,
    /** The message has been released. */
    RELEASED,
    /** The coordinator declared a transaction, see {@link #txnId()}. */
    DECLARED,
    /** The link or connection went away before any outcome. */
    TRANSPORT_CLOSED,
    /** An outcome the client does not know, e.g. modified. */
    UNKNOWN
  }

  private final Type type;

  private DeliveryOutcome(Type type) {
    this.type = type;
  }

  public static DeliveryOutcome accepted() {
    return ACCEPTED;
  }

  public static DeliveryOutcome rejected(String condition, String description) {
    return new Rejected(condition, description);
  }

  public static DeliveryOutcome released() {
    return RELEASED;
  }

  public static DeliveryOutcome declared(byte[] txnId) {
    return new Declared(txnId);
  }

  public static DeliveryOutcome transportClosed() {
    return TRANSPORT_CLOSED;
  }

  public static DeliveryOutcome unknown(String description) {
    return new Unknown(description);
  }

  public Type type() {
    return this.type;
  }

  /**
   * Error condition of a rejected delivery.
   *
   * @return the condition, null for other outcomes
   */
  public String condition() {
    return null;
  }

  /**
   * Error description of a rejected delivery, or description of an unknown outcome.
   *
   * @return the description, can be null
   */
  public String description() {
    return null;
  }

  /**
   * Transaction ID of a declared outcome.
   *
   * @return the transaction ID, null for other outcomes
   */
  public byte[] txnId() {
    return null;
  }

  @Override
  public String toString() {
    return this.type.name();
  }

  private static final class SimpleOutcome extends DeliveryOutcome {

    private SimpleOutcome(Type type) {
      super(type);
    }
  }

  private static final class Rejected extends DeliveryOutcome {

    private final String condition;
    private final String description;

    private Rejected(String condition, String description) {
      super(Type.REJECTED);
      this.condition = condition;
      this.description = description;
    }

    @Override
    public String condition() {
      return this.condition;
    }

    @Override
    public String description() {
      return this.description;
    }

    @Override
    public String toString() {
      return "REJECTED{" + condition + ", " + description + "}";
    }
  }

  private static final class Declared extends DeliveryOutcome {

    private final byte[] txnId;

    private Declared(byte[] txnId) {
      super(Type.DECLARED);
      this.txnId = txnId.clone();
    }

    @Override
    public byte[] txnId() {
      return this.txnId.clone();
    }
  }

  private static final class Unknown extends DeliveryOutcome {

    private final String description;

    private Unknown(String description) {
      super(Type.UNKNOWN);
      this.description = description;
    }

    @Override
    public String description() {
      return this.description;
    }

    @Override
    public String toString() {
      return "UNKNOWN{" + description + "}";
    }
  }
}
