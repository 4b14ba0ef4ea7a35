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

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.function.BiConsumer;

/**
 * AMQP 1.0 message.
 *
 * <p>Header fields left unset (durability, priority, creation time) get the defaults of the
 * {@link Producer} that sends the message.
 *
 * @see Producer#message()
 * @see Consumer#receiveAsync()
 */
public interface Message {

  /**
   * The message ID, can be null.
   *
   * @return the message ID
   */
  Object messageId();

  /**
   * Set the message ID.
   *
   * @param id message ID
   * @return the message
   */
  Message messageId(String id);

  /**
   * Set the message ID as an unsigned long.
   *
   * @param id message ID
   * @return the message
   */
  Message messageId(long id);

  /**
   * Set the message ID.
   *
   * @param id message ID
   * @return the message
   */
  Message messageId(UUID id);

  Object correlationId();

  Message correlationId(String correlationId);

  Message correlationId(UUID correlationId);

  /**
   * The destination address of the message.
   *
   * <p>Set by the {@link Producer} when the message is sent.
   *
   * @return the address
   */
  String to();

  String subject();

  Message subject(String subject);

  String contentType();

  Message contentType(String contentType);

  /**
   * Creation time, as a timestamp in milliseconds, 0 if not set.
   *
   * @return creation time
   */
  long creationTime();

  Message creationTime(long creationTime);

  /**
   * Get the value of an application property.
   *
   * <p>Binary values are returned as <code>byte[]</code>, timestamps as {@link java.util.Date}.
   *
   * @param key property key
   * @return the value, null if the property does not exist
   */
  Object property(String key);

  Message property(String key, boolean value);

  Message property(String key, byte value);

  Message property(String key, short value);

  Message property(String key, int value);

  Message property(String key, long value);

  Message property(String key, float value);

  Message property(String key, double value);

  Message property(String key, char value);

  /**
   * Set a timestamp application property.
   *
   * @param key property key
   * @param value timestamp in milliseconds
   * @return the message
   */
  Message propertyTimestamp(String key, long value);

  Message property(String key, UUID value);

  Message property(String key, byte[] value);

  Message property(String key, String value);

  /**
   * Set a map application property.
   *
   * <p>Keys and values of the map follow the same type rules as application properties, nested
   * maps included.
   *
   * @param key property key
   * @param value map value
   * @return the message
   */
  Message property(String key, Map<String, ?> value);

  Message property(String key, int[] value);

  Message property(String key, long[] value);

  Message property(String key, String[] value);

  boolean hasProperty(String key);

  boolean hasProperties();

  Object removeProperty(String key);

  /**
   * Iterate over the application properties.
   *
   * @param action the action to call for each property
   * @return the message
   */
  Message forEachProperty(BiConsumer<String, Object> action);

  Message body(byte[] body);

  byte[] body();

  /**
   * Whether the message is durable.
   *
   * @return durable flag
   */
  boolean durable();

  /**
   * Set the durable flag.
   *
   * <p>The producer does not override an explicitly set value with its default durability.
   *
   * @param durable durable flag
   * @return the message
   */
  Message durable(boolean durable);

  /**
   * Set the priority, between 0 and 9.
   *
   * @param priority message priority
   * @return the message
   */
  Message priority(byte priority);

  byte priority();

  /**
   * Set the time-to-live.
   *
   * @param ttl time-to-live
   * @return the message
   */
  Message ttl(Duration ttl);

  Duration ttl();

  /**
   * Get the value of a message annotation.
   *
   * @param key annotation key
   * @return the value, null if the annotation does not exist
   */
  Object annotation(String key);

  /**
   * Set a message annotation.
   *
   * <p>Keys must start with <code>x-</code>.
   *
   * @param key annotation key
   * @param value annotation value
   * @return the message
   */
  Message annotation(String key, Object value);

  boolean hasAnnotation(String key);

  Message forEachAnnotation(BiConsumer<String, Object> action);
}
