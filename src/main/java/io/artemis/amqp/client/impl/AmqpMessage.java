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

import io.artemis.amqp.client.AmqpException;
import io.artemis.amqp.client.Message;
import java.time.Duration;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.BiConsumer;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.apache.qpid.protonj2.types.Binary;
import org.apache.qpid.protonj2.types.UnsignedLong;

class AmqpMessage implements Message {

  private static final byte[] EMPTY_BODY = new byte[0];

  private final org.apache.qpid.protonj2.client.Message<byte[]> delegate;
  private volatile boolean durableSet = false;
  private volatile boolean prioritySet = false;

  AmqpMessage() {
    this(org.apache.qpid.protonj2.client.Message.create(EMPTY_BODY));
  }

  AmqpMessage(byte[] body) {
    this(org.apache.qpid.protonj2.client.Message.create(body));
  }

  AmqpMessage(org.apache.qpid.protonj2.client.Message<byte[]> delegate) {
    this.delegate = delegate;
  }

  // properties

  @Override
  public Object messageId() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::messageId);
  }

  @Override
  public Message messageId(String id) {
    callOnDelegate(m -> m.messageId(id));
    return this;
  }

  @Override
  public Message messageId(long id) {
    callOnDelegate(m -> m.messageId(new UnsignedLong(id)));
    return this;
  }

  @Override
  public Message messageId(UUID id) {
    callOnDelegate(m -> m.messageId(id));
    return this;
  }

  @Override
  public Object correlationId() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::correlationId);
  }

  @Override
  public Message correlationId(String correlationId) {
    callOnDelegate(m -> m.correlationId(correlationId));
    return this;
  }

  @Override
  public Message correlationId(UUID correlationId) {
    callOnDelegate(m -> m.correlationId(correlationId));
    return this;
  }

  @Override
  public String to() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::to);
  }

  Message to(String address) {
    callOnDelegate(m -> m.to(address));
    return this;
  }

  @Override
  public String subject() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::subject);
  }

  @Override
  public Message subject(String subject) {
    callOnDelegate(m -> m.subject(subject));
    return this;
  }

  @Override
  public String contentType() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::contentType);
  }

  @Override
  public Message contentType(String contentType) {
    callOnDelegate(m -> m.contentType(contentType));
    return this;
  }

  @Override
  public long creationTime() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::creationTime);
  }

  @Override
  public Message creationTime(long creationTime) {
    callOnDelegate(m -> m.creationTime(creationTime));
    return this;
  }

  void creationTimeIfUnset(long creationTime) {
    if (this.creationTime() == 0) {
      this.creationTime(creationTime);
    }
  }

  // application properties

  @Override
  public Object property(String key) {
    Object value = returnFromDelegate(m -> m.property(key));
    return value instanceof Binary ? ((Binary) value).asByteArray() : value;
  }

  @Override
  public Message property(String key, boolean value) {
    callOnDelegate(m -> m.property(key, value));
    return this;
  }

  @Override
  public Message property(String key, byte value) {
    callOnDelegate(m -> m.property(key, value));
    return this;
  }

  @Override
  public Message property(String key, short value) {
    callOnDelegate(m -> m.property(key, value));
    return this;
  }

  @Override
  public Message property(String key, int value) {
    callOnDelegate(m -> m.property(key, value));
    return this;
  }

  @Override
  public Message property(String key, long value) {
    callOnDelegate(m -> m.property(key, value));
    return this;
  }

  @Override
  public Message property(String key, float value) {
    callOnDelegate(m -> m.property(key, value));
    return this;
  }

  @Override
  public Message property(String key, double value) {
    callOnDelegate(m -> m.property(key, value));
    return this;
  }

  @Override
  public Message property(String key, char value) {
    callOnDelegate(m -> m.property(key, value));
    return this;
  }

  @Override
  public Message propertyTimestamp(String key, long value) {
    callOnDelegate(m -> m.property(key, new Date(value)));
    return this;
  }

  @Override
  public Message property(String key, UUID value) {
    callOnDelegate(m -> m.property(key, value));
    return this;
  }

  @Override
  public Message property(String key, byte[] value) {
    callOnDelegate(m -> m.property(key, new Binary(value.clone())));
    return this;
  }

  @Override
  public Message property(String key, String value) {
    callOnDelegate(m -> m.property(key, value));
    return this;
  }

  @Override
  public Message property(String key, Map<String, ?> value) {
    if (value == null) {
      throw new IllegalArgumentException("Map property value cannot be null");
    }
    Map<String, Object> copy = new LinkedHashMap<>(value);
    callOnDelegate(m -> m.property(key, copy));
    return this;
  }

  @Override
  public Message property(String key, int[] value) {
    callOnDelegate(m -> m.property(key, value.clone()));
    return this;
  }

  @Override
  public Message property(String key, long[] value) {
    callOnDelegate(m -> m.property(key, value.clone()));
    return this;
  }

  @Override
  public Message property(String key, String[] value) {
    callOnDelegate(m -> m.property(key, value.clone()));
    return this;
  }

  @Override
  public boolean hasProperty(String key) {
    return returnFromDelegate(m -> m.hasProperty(key));
  }

  @Override
  public boolean hasProperties() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::hasProperties);
  }

  @Override
  public Object removeProperty(String key) {
    return returnFromDelegate(m -> m.removeProperty(key));
  }

  @Override
  public Message forEachProperty(BiConsumer<String, Object> action) {
    callOnDelegate(m -> m.forEachProperty(action));
    return this;
  }

  // body

  @Override
  public Message body(byte[] body) {
    callOnDelegate(m -> m.body(body));
    return this;
  }

  @Override
  public byte[] body() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::body);
  }

  // header

  @Override
  public boolean durable() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::durable);
  }

  @Override
  public Message durable(boolean durable) {
    callOnDelegate(m -> m.durable(durable));
    this.durableSet = true;
    return this;
  }

  boolean hasDurable() {
    return this.durableSet;
  }

  void durableIfUnset(boolean durable) {
    if (!this.durableSet) {
      callOnDelegate(m -> m.durable(durable));
    }
  }

  @Override
  public Message priority(byte priority) {
    if (priority < 0 || priority > 9) {
      throw new IllegalArgumentException("Priority must be between 0 and 9: " + priority);
    }
    callOnDelegate(m -> m.priority(priority));
    this.prioritySet = true;
    return this;
  }

  @Override
  public byte priority() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::priority);
  }

  boolean hasPriority() {
    return this.prioritySet;
  }

  void priorityIfUnset(byte priority) {
    if (!this.prioritySet) {
      callOnDelegate(m -> m.priority(priority));
    }
  }

  @Override
  public Message ttl(Duration ttl) {
    if (ttl == null) {
      throw new IllegalArgumentException("TTL cannot be null");
    }
    callOnDelegate(m -> m.timeToLive(ttl.toMillis()));
    return this;
  }

  @Override
  public Duration ttl() {
    return returnFromDelegate(m -> Duration.ofMillis(m.timeToLive()));
  }

  // message annotations

  @Override
  public Object annotation(String key) {
    return returnFromDelegate(m -> m.annotation(key));
  }

  @Override
  public Message annotation(String key, Object value) {
    if (!key.startsWith("x-")) {
      throw new IllegalArgumentException("Message annotation keys must start with 'x-': " + key);
    }
    callOnDelegate(m -> m.annotation(key, value));
    return this;
  }

  @Override
  public boolean hasAnnotation(String key) {
    return returnFromDelegate(m -> m.hasAnnotation(key));
  }

  @Override
  public Message forEachAnnotation(BiConsumer<String, Object> action) {
    callOnDelegate(m -> m.forEachAnnotation(action));
    return this;
  }

  private void callOnDelegate(CallableConsumer call) {
    try {
      call.accept(this.delegate);
    } catch (ClientException e) {
      throw new AmqpException(e.getMessage(), e);
    }
  }

  private <E> E returnFromDelegate(MessageFunctionCallable<E> call) {
    try {
      return call.call(this.delegate);
    } catch (ClientException e) {
      throw new AmqpException(e.getMessage(), e);
    }
  }

  private interface CallableConsumer {

    void accept(org.apache.qpid.protonj2.client.Message<byte[]> message) throws ClientException;
  }

  private interface MessageFunctionCallable<T> {

    T call(org.apache.qpid.protonj2.client.Message<byte[]> message) throws ClientException;
  }

  org.apache.qpid.protonj2.client.Message<byte[]> nativeMessage() {
    return this.delegate;
  }
}
