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

import static io.artemis.amqp.client.Resource.State.OPEN;
import static io.artemis.amqp.client.Resource.State.OPENING;
import static io.artemis.amqp.client.Resource.State.RECOVERING;

import io.artemis.amqp.client.AmqpException;
import io.artemis.amqp.client.Connection;
import io.artemis.amqp.client.ConsumerBuilder;
import io.artemis.amqp.client.Endpoint;
import io.artemis.amqp.client.ProducerBuilder;
import io.artemis.amqp.client.RecoveryListener;
import io.artemis.amqp.client.RecoveryPolicy;
import io.artemis.amqp.client.Transaction;
import io.artemis.amqp.client.metrics.MetricsCollector;
import io.artemis.amqp.client.transport.TransportConnection;
import io.artemis.amqp.client.transport.TransportFactory;
import io.artemis.amqp.client.transport.TransportListener;
import io.artemis.amqp.client.transport.TransportSession;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpConnection extends ResourceBase implements Connection {

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final Predicate<Throwable> RECOVERY_PREDICATE =
      ExceptionUtils::isConnectionFailure;

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConnection.class);

  private final long id;
  private final String name;
  private final AmqpEnvironment environment;
  private final TransportFactory transportFactory;
  private final EndpointRotation endpointRotation;
  private final boolean recoveryActivated;
  private final RecoveryPolicy recoveryPolicy;
  private final EntityRegistry entityRegistry = new EntityRegistry();
  private final AtomicLong entityIdSequence = new AtomicLong(0);
  private final TransactionsManager transactionsManager;
  private final RecoveryEventSupport recoveryEventSupport;
  private final MetricsCollector metricsCollector;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicBoolean recoveringConnection = new AtomicBoolean(false);
  private final AtomicBoolean opened = new AtomicBoolean(false);
  private final Lock instanceLock = new ReentrantLock();
  private final TransportListener transportListener = this::transportFailure;
  private volatile TransportConnectionWrapper transport;
  private volatile CompletableFuture<TransportSession> session;
  private volatile CompletableFuture<?> connectionTask;

  AmqpConnection(AmqpConnectionBuilder builder) {
    super(builder.listeners());
    this.id = ID_SEQUENCE.getAndIncrement();
    this.name = builder.name() == null ? "connection-" + this.id : builder.name();
    this.environment = builder.environment();
    this.transportFactory = this.environment.transportFactory();
    this.endpointRotation = new EndpointRotation(builder.endpoints(), builder.endpointSelector());
    AmqpConnectionBuilder.AmqpRecoveryConfiguration recoveryConfiguration =
        builder.recoveryConfiguration();
    this.recoveryActivated = recoveryConfiguration.activated();
    this.recoveryPolicy = recoveryConfiguration.policy();
    this.metricsCollector = this.environment.metricsCollector();
    this.recoveryEventSupport = new RecoveryEventSupport(builder.recoveryListeners());
    this.transactionsManager =
        new TransactionsManager(this::transactionSession, this.metricsCollector);
  }

  /**
   * Run the initial connection attempts.
   *
   * <p>With recovery activated, a failed attempt is retried on the next endpoint according to the
   * recovery policy. Otherwise only the first endpoint is tried, once.
   */
  CompletableFuture<AmqpConnection> open() {
    LOGGER.debug("Opening connection '{}'...", this.name);
    RecoveryPolicy policy;
    Supplier<CompletableFuture<TransportConnectionWrapper>> task;
    if (this.recoveryActivated) {
      // first attempt right away, the policy drives the retries
      policy = attempt -> attempt == 0 ? Duration.ZERO : this.recoveryPolicy.delay(attempt);
      task = this::connectToNextEndpoint;
    } else {
      policy = RecoveryPolicy.noRetry();
      task = () -> this.connect(this.endpointRotation.first());
    }
    CompletableFuture<TransportConnectionWrapper> attempts =
        AsyncRetry.asyncRetry(task)
            .description("Connection '%s' opening", this.name)
            .scheduler(this.environment.scheduledExecutorService())
            .delayPolicy(policy)
            .retry(RECOVERY_PREDICATE)
            .build();
    this.connectionTask = attempts;
    return attempts.handle(
        (ncw, failure) -> {
          if (failure != null) {
            AmqpException exception =
                ExceptionUtils.convert(failure, "Could not open connection '%s'", this.name);
            LOGGER.debug("Could not open connection '{}': {}", this.name, exception.getMessage());
            this.close(exception);
            throw exception;
          }
          this.sync(ncw);
          if (!this.compareAndSetState(OPENING, OPEN, null)) {
            throw new AmqpException.AmqpResourceClosedException(
                "Connection '" + this.name + "' closed while opening");
          }
          this.opened.set(true);
          this.metricsCollector.openConnection();
          LOGGER.debug("Opened connection '{}' on {}.", this.name, ncw.endpoint());
          return this;
        });
  }

  @Override
  public ProducerBuilder producerBuilder() {
    return new AmqpProducerBuilder(this);
  }

  @Override
  public ConsumerBuilder consumerBuilder() {
    return new AmqpConsumerBuilder(this);
  }

  @Override
  public Transaction transaction() {
    if (this.closed.get()) {
      throw new AmqpException.AmqpResourceClosedException(
          "Connection '" + this.name + "' is closed");
    }
    return new AmqpTransaction(
        this, this.transactionsManager, this.environment.scheduledExecutorService());
  }

  @Override
  public Endpoint endpoint() {
    TransportConnectionWrapper ncw = this.transport;
    return ncw == null ? null : ncw.endpoint();
  }

  @Override
  public RecoveryListener.Registration addRecoveryListener(RecoveryListener listener) {
    return this.recoveryEventSupport.add(listener);
  }

  @Override
  public void close() {
    this.close(null);
  }

  // internal API

  CompletableFuture<AmqpProducer> createProducer(AmqpProducerBuilder builder) {
    try {
      this.checkOpen();
    } catch (AmqpException e) {
      return CompletableFuture.failedFuture(e);
    }
    AmqpProducer producer = new AmqpProducer(builder);
    this.entityRegistry.register(producer);
    return producer
        .open()
        .whenComplete(
            (p, failure) -> {
              if (failure != null) {
                producer.close(ExceptionUtils.unwrap(failure));
              }
            });
  }

  CompletableFuture<AmqpConsumer> createConsumer(AmqpConsumerBuilder builder) {
    try {
      this.checkOpen();
    } catch (AmqpException e) {
      return CompletableFuture.failedFuture(e);
    }
    AmqpConsumer consumer = new AmqpConsumer(builder);
    this.entityRegistry.register(consumer);
    return consumer
        .open()
        .whenComplete(
            (c, failure) -> {
              if (failure != null) {
                consumer.close(ExceptionUtils.unwrap(failure));
              }
            });
  }

  /** Session shared by the producers and consumers of the current network connection. */
  CompletableFuture<TransportSession> session() {
    CompletableFuture<TransportSession> result = this.session;
    if (result == null || result.isCompletedExceptionally()) {
      this.instanceLock.lock();
      try {
        result = this.session;
        if (result == null || result.isCompletedExceptionally()) {
          TransportConnectionWrapper ncw = this.transport;
          if (ncw == null) {
            return CompletableFuture.failedFuture(
                new AmqpException.AmqpConnectionException(
                    "Connection '%s' is not connected", this.name));
          }
          LOGGER.debug("Opening session for connection '{}'", this.name);
          result = ncw.connection().openSession();
          this.session = result;
        }
      } finally {
        this.instanceLock.unlock();
      }
    }
    return result;
  }

  void unregister(RecoverableEntity entity) {
    this.entityRegistry.unregister(entity);
  }

  long nextEntityId() {
    return this.entityIdSequence.getAndIncrement();
  }

  /** Whether the current network connection is gone, i.e. recovery is or will be running. */
  boolean transportClosed() {
    TransportConnectionWrapper ncw = this.transport;
    return ncw == null || ncw.connection().isClosed();
  }

  AmqpEnvironment environment() {
    return this.environment;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  TransactionsManager transactionsManager() {
    return this.transactionsManager;
  }

  EntityRegistry entityRegistry() {
    return this.entityRegistry;
  }

  String name() {
    return this.name;
  }

  long id() {
    return this.id;
  }

  private CompletableFuture<TransportSession> transactionSession() {
    TransportConnectionWrapper ncw = this.transport;
    if (ncw == null || this.state() != OPEN) {
      return CompletableFuture.failedFuture(
          new AmqpException.AmqpConnectionException(
              "Connection '%s' is not open", this.name));
    }
    return ncw.connection().openSession();
  }

  private CompletableFuture<TransportConnectionWrapper> connectToNextEndpoint() {
    return this.connect(this.endpointRotation.next());
  }

  private CompletableFuture<TransportConnectionWrapper> connect(Endpoint endpoint) {
    LOGGER.debug("Connecting '{}' to {}...", this.name, endpoint);
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    CompletableFuture<TransportConnection> attempt;
    try {
      attempt = this.transportFactory.connect(endpoint, this.transportListener);
    } catch (Exception e) {
      attempt = CompletableFuture.failedFuture(e);
    }
    return attempt.handle(
        (connection, failure) -> {
          if (failure != null) {
            LOGGER.debug(
                "Connection attempt of '{}' to {} failed: {}",
                this.name,
                endpoint,
                ExceptionUtils.unwrap(failure).getMessage());
            throw ExceptionUtils.convert(failure);
          }
          if (this.closed.get()) {
            connection.close();
            throw new AmqpException.AmqpResourceClosedException(
                "Connection '" + this.name + "' has been closed");
          }
          LOGGER.debug(
              "Connection attempt of '{}' to {} took {}", this.name, endpoint, stopWatch.stop());
          return new TransportConnectionWrapper(connection, endpoint);
        });
  }

  private void sync(TransportConnectionWrapper ncw) {
    this.instanceLock.lock();
    try {
      this.transport = ncw;
      this.session = null;
    } finally {
      this.instanceLock.unlock();
    }
    this.endpointRotation.connected(ncw.endpoint());
  }

  private void transportFailure(TransportConnection connection, Throwable cause) {
    TransportConnectionWrapper current = this.transport;
    if (current == null || current.connection() != connection) {
      LOGGER.debug("Disconnection of a previous transport of '{}', ignoring it", this.name);
      return;
    }
    LOGGER.debug(
        "Disconnect handler of '{}', error is the following: {}",
        this.name,
        cause == null ? "none" : cause.getMessage());
    if (this.state() == OPENING) {
      LOGGER.debug("Connection is still opening, disconnect handler skipped");
      return;
    }
    if (this.closed.get()) {
      LOGGER.debug("Connection '{}' is closed, disconnect handler skipped", this.name);
      return;
    }
    AmqpException exception;
    if (ExceptionUtils.isConnectionFailure(cause)) {
      exception = ExceptionUtils.convert(cause);
    } else {
      exception =
          new AmqpException.AmqpConnectionException(
              "Connection '" + this.name + "' lost", cause);
    }
    if (this.recoveryActivated) {
      if (this.recoveringConnection.get()) {
        LOGGER.debug(
            "Filtering recovery task scheduling, connection recovery of '{}' already in progress",
            this.name);
        return;
      }
      LOGGER.debug(
          "Queueing recovery task for '{}', error is {}", this.name, exception.getMessage());
      this.environment
          .executorService()
          .submit(() -> this.recoverAfterConnectionFailure(exception));
    } else {
      LOGGER.info(
          "Connection '{}' to {} has been disconnected, recovery is deactivated, closing",
          this.name,
          current.endpoint());
      this.close(exception);
    }
  }

  private void recoverAfterConnectionFailure(AmqpException failureCause) {
    if (this.closed.get()) {
      return;
    }
    if (!this.recoveringConnection.compareAndSet(false, true)) {
      LOGGER.debug("Connection '{}' already recovering, returning.", this.name);
      return;
    }
    TransportConnectionWrapper previous = this.transport;
    LOGGER.info(
        "Connection '{}' to {} has been disconnected, initializing recovery.",
        this.name,
        previous == null ? "?" : previous.endpoint());
    this.instanceLock.lock();
    try {
      this.transport = null;
      this.session = null;
    } finally {
      this.instanceLock.unlock();
    }
    if (previous != null) {
      closeQuietly(previous);
    }
    this.state(RECOVERING, failureCause);
    this.transactionsManager.invalidate(failureCause);
    for (RecoverableEntity entity : this.entityRegistry.snapshot()) {
      entity.connectionLost(failureCause);
    }

    LOGGER.debug("Scheduling connection attempt for '{}'.", this.name);
    CompletableFuture<TransportConnectionWrapper> reconnection =
        AsyncRetry.asyncRetry(this::connectToNextEndpoint)
            .description("Connection '%s' recovery", this.name)
            .scheduler(this.environment.scheduledExecutorService())
            .delayPolicy(this.recoveryPolicy)
            .retry(RECOVERY_PREDICATE)
            .build();
    this.connectionTask = reconnection;
    reconnection
        .thenCompose(
            ncw -> {
              this.sync(ncw);
              LOGGER.debug("Reconnected '{}' to {}", this.name, ncw.endpoint());
              return this.recoverEntities();
            })
        .whenComplete(
            (ignored, failure) -> {
              this.recoveringConnection.set(false);
              if (this.closed.get()) {
                LOGGER.debug("Connection '{}' closed during recovery", this.name);
              } else if (failure == null) {
                this.recoveryCompleted();
              } else {
                this.recoveryFailed(reconnection, ExceptionUtils.unwrap(failure));
              }
            });
  }

  private void recoveryCompleted() {
    TransportConnectionWrapper ncw = this.transport;
    if (ncw == null || ncw.connection().isClosed()) {
      LOGGER.debug("Connection '{}' lost again during recovery, restarting it", this.name);
      this.restartRecovery(
          new AmqpException.AmqpConnectionException(
              "Connection '%s' lost during recovery", this.name));
      return;
    }
    if (this.closed.get() || !this.compareAndSetState(RECOVERING, OPEN, null)) {
      LOGGER.debug("Connection '{}' closed at the end of recovery", this.name);
      return;
    }
    this.metricsCollector.recoverConnection();
    LOGGER.info("Recovered connection '{}' to {}", this.name, ncw.endpoint());
    this.recoveryEventSupport.recovered(ncw.endpoint());
  }

  private void recoveryFailed(
      CompletableFuture<TransportConnectionWrapper> reconnection, Throwable cause) {
    if (!reconnection.isCompletedExceptionally() && RECOVERY_PREDICATE.test(cause)) {
      LOGGER.debug(
          "Error during producer and consumer recovery, queueing recovery task for '{}', error is {}",
          this.name,
          cause.getMessage());
      this.restartRecovery(ExceptionUtils.convert(cause));
    } else {
      LOGGER.warn("Could not recover connection '{}': {}", this.name, cause.getMessage());
      AmqpException.AmqpRecoveryExhaustedException exception =
          new AmqpException.AmqpRecoveryExhaustedException(
              "Could not recover connection '" + this.name + "'", cause);
      if (this.closed.compareAndSet(false, true)) {
        this.recoveryEventSupport.recoveryFailed(exception);
        this.doClose(exception);
      }
    }
  }

  private void restartRecovery(AmqpException cause) {
    this.environment.executorService().submit(() -> this.recoverAfterConnectionFailure(cause));
  }

  private CompletableFuture<Void> recoverEntities() {
    List<RecoverableEntity> entities = this.entityRegistry.snapshot();
    if (entities.isEmpty()) {
      LOGGER.debug("No producers or consumers to recover");
      return CompletableFuture.completedFuture(null);
    }
    LOGGER.debug("{} producer(s) and consumer(s) to recover", entities.size());
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (RecoverableEntity entity : entities) {
      chain =
          chain
              .thenCompose(ignored -> this.session())
              .thenCompose(s -> this.recoverEntity(entity, s));
    }
    return chain;
  }

  private CompletableFuture<Void> recoverEntity(RecoverableEntity entity, TransportSession s) {
    if (entity.isClosed()) {
      return CompletableFuture.completedFuture(null);
    }
    LOGGER.debug("Recovering {}", entity);
    return entity
        .recover(s)
        .handle(
            (ignored, failure) -> {
              if (failure == null) {
                LOGGER.debug("Recovered {}", entity);
                return null;
              }
              Throwable cause = ExceptionUtils.unwrap(failure);
              if (RECOVERY_PREDICATE.test(cause)) {
                throw ExceptionUtils.convert(cause);
              }
              LOGGER.warn("Error while recovering {}, closing it: {}", entity, cause.getMessage());
              entity.close(cause);
              return null;
            });
  }

  void close(Throwable cause) {
    if (this.closed.compareAndSet(false, true)) {
      this.doClose(cause);
    }
  }

  private void doClose(Throwable cause) {
    LOGGER.debug("Closing connection {}", this);
    this.state(State.CLOSING, cause);
    CompletableFuture<?> task = this.connectionTask;
    if (task != null) {
      task.cancel(false);
    }
    this.environment.removeConnection(this);
    for (RecoverableEntity entity : this.entityRegistry.clear()) {
      try {
        entity.close(cause);
      } catch (Exception e) {
        LOGGER.warn("Error while closing {}", entity, e);
      }
    }
    this.transactionsManager.close();
    TransportConnectionWrapper ncw;
    this.instanceLock.lock();
    try {
      ncw = this.transport;
      this.transport = null;
      this.session = null;
    } finally {
      this.instanceLock.unlock();
    }
    if (ncw != null) {
      closeQuietly(ncw);
    }
    this.state(State.CLOSED, cause);
    if (this.opened.compareAndSet(true, false)) {
      this.metricsCollector.closeConnection();
    }
    LOGGER.debug("Connection {} has been closed", this);
  }

  private static void closeQuietly(TransportConnectionWrapper ncw) {
    try {
      ncw.connection().close();
    } catch (Exception e) {
      LOGGER.warn("Error while closing transport connection to {}", ncw.endpoint(), e);
    }
  }

  @Override
  public String toString() {
    return this.name;
  }

  static class TransportConnectionWrapper {

    private final TransportConnection connection;
    private final Endpoint endpoint;

    private TransportConnectionWrapper(TransportConnection connection, Endpoint endpoint) {
      this.connection = connection;
      this.endpoint = endpoint;
    }

    TransportConnection connection() {
      return this.connection;
    }

    Endpoint endpoint() {
      return this.endpoint;
    }
  }
}
