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

import io.artemis.amqp.client.Endpoint;
import io.artemis.amqp.client.transport.DeliveryListener;
import io.artemis.amqp.client.transport.DeliveryOutcome;
import io.artemis.amqp.client.transport.InboundDelivery;
import io.artemis.amqp.client.transport.Link;
import io.artemis.amqp.client.transport.LinkListener;
import io.artemis.amqp.client.transport.LinkSource;
import io.artemis.amqp.client.transport.LinkTarget;
import io.artemis.amqp.client.transport.OutcomeCallback;
import io.artemis.amqp.client.transport.ReceiverLink;
import io.artemis.amqp.client.transport.SenderLink;
import io.artemis.amqp.client.transport.TransactionalState;
import io.artemis.amqp.client.transport.TransportConnection;
import io.artemis.amqp.client.transport.TransportFactory;
import io.artemis.amqp.client.transport.TransportListener;
import io.artemis.amqp.client.transport.TransportSession;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.qpid.protonj2.client.Message;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.apache.qpid.protonj2.client.impl.ClientMessageSupport;
import org.apache.qpid.protonj2.types.Binary;
import org.apache.qpid.protonj2.types.transactions.Declare;
import org.apache.qpid.protonj2.types.transactions.Discharge;

/**
 * Broker living in the test JVM, reachable through several endpoints that share the same queues.
 *
 * <p>Endpoints can be stopped (connections dropped, new connections refused) and started again.
 * Dropped connections notify their {@link TransportListener} on a separate thread, after their
 * links are closed. A locally detached link does not notify its {@link LinkListener}.
 *
 * <p>Messages are encoded when the broker takes them and decoded again for each delivery, so
 * senders and receivers never share a message instance.
 */
final class InMemoryBroker implements TransportFactory, AutoCloseable {

  private final Map<Endpoint, Node> nodes = new ConcurrentHashMap<>();
  private final Map<String, BrokerQueue> queues = new ConcurrentHashMap<>();
  private final Map<Binary, BrokerTransaction> transactions = new ConcurrentHashMap<>();
  private final AtomicInteger txnIdSequence = new AtomicInteger(0);
  private final AtomicInteger declareCount = new AtomicInteger(0);
  private final AtomicInteger dischargeCount = new AtomicInteger(0);
  private final AtomicInteger connectAttempts = new AtomicInteger(0);
  private final Queue<DeliveryOutcome> nextSendOutcomes = new ConcurrentLinkedQueue<>();
  private final Queue<DeliveryOutcome> nextCoordinatorOutcomes = new ConcurrentLinkedQueue<>();
  private volatile boolean holdOutcomes = false;
  private final ExecutorService dispatcher =
      Executors.newSingleThreadExecutor(Utils.threadFactory("in-memory-broker-dispatcher-"));
  private final ExecutorService notifier =
      Executors.newCachedThreadPool(Utils.threadFactory("in-memory-broker-notifier-"));

  @Override
  public CompletableFuture<TransportConnection> connect(
      Endpoint endpoint, TransportListener listener) {
    Node node = this.node(endpoint);
    this.connectAttempts.incrementAndGet();
    node.connectAttempts.incrementAndGet();
    synchronized (node) {
      if (!node.running) {
        return CompletableFuture.failedFuture(
            new ConnectException("Connection refused: " + endpoint));
      }
      BrokerConnection connection = new BrokerConnection(node, listener);
      node.connections.add(connection);
      return CompletableFuture.completedFuture(connection);
    }
  }

  /** Drop the connections of the endpoint and refuse new ones. */
  void stop(Endpoint endpoint) {
    Node node = this.node(endpoint);
    List<BrokerConnection> toDrop;
    synchronized (node) {
      node.running = false;
      toDrop = new ArrayList<>(node.connections);
      node.connections.clear();
    }
    toDrop.forEach(c -> c.drop(new IOException("Connection reset by peer")));
  }

  void start(Endpoint endpoint) {
    Node node = this.node(endpoint);
    synchronized (node) {
      node.running = true;
    }
  }

  /** Drop the connections of the endpoint, new connections are accepted. */
  void dropConnections(Endpoint endpoint) {
    this.stop(endpoint);
    this.start(endpoint);
  }

  /** Close the links attached to an address, as a broker does when the address is deleted. */
  void closeLinks(String address, String condition, String description) {
    for (Node node : this.nodes.values()) {
      for (BrokerConnection connection : node.connections) {
        for (BrokerLink link : connection.links) {
          if (address.equals(link.address())) {
            link.remoteClose(condition, description);
          }
        }
      }
    }
  }

  /** Settle the next regular send with the provided outcome instead of routing it. */
  void nextSendOutcome(DeliveryOutcome outcome) {
    this.nextSendOutcomes.add(outcome);
  }

  /** Answer the next coordinator request with the provided outcome. */
  void nextCoordinatorOutcome(DeliveryOutcome outcome) {
    this.nextCoordinatorOutcomes.add(outcome);
  }

  /** Keep unsettled deliveries pending until {@link #releaseOutcomes()} or the link closes. */
  void holdOutcomes() {
    this.holdOutcomes = true;
  }

  void releaseOutcomes() {
    this.holdOutcomes = false;
    for (Node node : this.nodes.values()) {
      for (BrokerConnection connection : node.connections) {
        for (BrokerLink link : connection.links) {
          link.processHeld();
        }
      }
    }
  }

  int declareCount() {
    return this.declareCount.get();
  }

  int dischargeCount() {
    return this.dischargeCount.get();
  }

  int connectAttempts() {
    return this.connectAttempts.get();
  }

  int connectAttempts(Endpoint endpoint) {
    return this.node(endpoint).connectAttempts.get();
  }

  int connectionCount(Endpoint endpoint) {
    return this.node(endpoint).connections.size();
  }

  int queueSize(String address) {
    return this.queue(address).size();
  }

  int activeTransactions() {
    return this.transactions.size();
  }

  /** Number of attached sending links to an address, all endpoints included. */
  int senderCount(String address) {
    return this.linkCount(address, BrokerSender.class);
  }

  int receiverCount(String address) {
    return this.linkCount(address, BrokerReceiver.class);
  }

  int coordinatorCount() {
    return this.linkCount(null, CoordinatorLink.class);
  }

  @Override
  public void close() {
    this.dispatcher.shutdownNow();
    this.notifier.shutdownNow();
  }

  private int linkCount(String address, Class<? extends BrokerLink> type) {
    int count = 0;
    for (Node node : this.nodes.values()) {
      for (BrokerConnection connection : node.connections) {
        for (BrokerLink link : connection.links) {
          if (type.isInstance(link)
              && !link.isClosed()
              && (address == null || address.equals(link.address()))) {
            count++;
          }
        }
      }
    }
    return count;
  }

  private static Message<?> copy(Message<?> message) {
    try {
      return ClientMessageSupport.decodeMessage(
          message.toAdvancedMessage().encode(null), deliveryAnnotations -> {});
    } catch (ClientException e) {
      throw new IllegalStateException("Could not copy message through the codec", e);
    }
  }

  private Node node(Endpoint endpoint) {
    return this.nodes.computeIfAbsent(endpoint, Node::new);
  }

  private BrokerQueue queue(String address) {
    return this.queues.computeIfAbsent(address, BrokerQueue::new);
  }

  private static final class Node {

    private final Endpoint endpoint;
    private final Set<BrokerConnection> connections = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectAttempts = new AtomicInteger(0);
    private volatile boolean running = true;

    private Node(Endpoint endpoint) {
      this.endpoint = endpoint;
    }
  }

  private final class BrokerConnection implements TransportConnection {

    private final Node node;
    private final TransportListener listener;
    private final Set<BrokerLink> links = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private BrokerConnection(Node node, TransportListener listener) {
      this.node = node;
      this.listener = listener;
    }

    @Override
    public CompletableFuture<TransportSession> openSession() {
      if (this.closed.get()) {
        return CompletableFuture.failedFuture(new IOException("Connection is closed"));
      }
      return CompletableFuture.completedFuture(new BrokerSession(this));
    }

    @Override
    public boolean isClosed() {
      return this.closed.get();
    }

    @Override
    public void close() {
      if (this.closed.compareAndSet(false, true)) {
        this.node.connections.remove(this);
        this.discardTransactions();
        new ArrayList<>(this.links).forEach(BrokerLink::detach);
      }
    }

    private void drop(Throwable cause) {
      if (this.closed.compareAndSet(false, true)) {
        this.discardTransactions();
        new ArrayList<>(this.links).forEach(l -> l.remoteClose("amqp:connection:forced", null));
        notifier.submit(() -> this.listener.disconnected(this, cause));
      }
    }

    // a broker rolls back the transactions of a connection that goes away
    private void discardTransactions() {
      transactions.values().removeIf(tx -> tx.owner == this);
    }

    @Override
    public String toString() {
      return "broker-connection(" + this.node.endpoint + ")";
    }
  }

  private final class BrokerSession implements TransportSession {

    private final BrokerConnection connection;
    private final Set<BrokerLink> links = ConcurrentHashMap.newKeySet();

    private BrokerSession(BrokerConnection connection) {
      this.connection = connection;
    }

    @Override
    public CompletableFuture<SenderLink> attachSender(
        String name, LinkTarget target, LinkListener listener) {
      if (this.connection.isClosed()) {
        return CompletableFuture.failedFuture(new IOException("Connection is closed"));
      }
      BrokerLink link;
      if (target.isCoordinator()) {
        link = new CoordinatorLink(name, this.connection, listener);
      } else {
        link = new BrokerSender(name, this.connection, listener, target.address());
      }
      this.register(link);
      return CompletableFuture.completedFuture((SenderLink) link);
    }

    @Override
    public CompletableFuture<ReceiverLink> attachReceiver(
        String name, LinkSource source, DeliveryListener deliveryListener, LinkListener listener) {
      if (this.connection.isClosed()) {
        return CompletableFuture.failedFuture(new IOException("Connection is closed"));
      }
      BrokerReceiver link =
          new BrokerReceiver(
              name, this.connection, listener, queue(source.address()), deliveryListener);
      this.register(link);
      link.queue.receivers.add(link);
      return CompletableFuture.completedFuture(link);
    }

    @Override
    public void close() {
      new ArrayList<>(this.links).forEach(BrokerLink::detach);
    }

    private void register(BrokerLink link) {
      this.links.add(link);
      this.connection.links.add(link);
    }
  }

  private abstract class BrokerLink implements Link {

    private final String name;
    final BrokerConnection connection;
    private final LinkListener listener;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Queue<Held> held = new ConcurrentLinkedQueue<>();

    BrokerLink(String name, BrokerConnection connection, LinkListener listener) {
      this.name = name;
      this.connection = connection;
      this.listener = listener;
    }

    @Override
    public String name() {
      return this.name;
    }

    @Override
    public boolean isDetaching() {
      return false;
    }

    @Override
    public boolean isClosed() {
      return this.closed.get();
    }

    @Override
    public void detach() {
      if (this.closed.compareAndSet(false, true)) {
        this.connection.links.remove(this);
        this.closing();
      }
    }

    String address() {
      return null;
    }

    void remoteClose(String condition, String description) {
      if (this.closed.compareAndSet(false, true)) {
        this.connection.links.remove(this);
        this.closing();
        this.listener.closed(this, condition, description);
      }
    }

    void closing() {
      Held h;
      while ((h = this.held.poll()) != null) {
        h.callback.onOutcome((SenderLink) this, h.message, DeliveryOutcome.transportClosed());
      }
    }

    void hold(Message<?> message, TransactionalState state, OutcomeCallback callback) {
      this.held.add(new Held(message, state, callback));
    }

    void processHeld() {
      Held h;
      while ((h = this.held.poll()) != null) {
        h.callback.onOutcome(
            (SenderLink) this, h.message, this.process(h.message, h.state));
      }
    }

    DeliveryOutcome process(Message<?> message, TransactionalState state) {
      throw new UnsupportedOperationException();
    }
  }

  private static final class Held {

    private final Message<?> message;
    private final TransactionalState state;
    private final OutcomeCallback callback;

    private Held(Message<?> message, TransactionalState state, OutcomeCallback callback) {
      this.message = message;
      this.state = state;
      this.callback = callback;
    }
  }

  private final class BrokerSender extends BrokerLink implements SenderLink {

    private final String address;

    private BrokerSender(
        String name, BrokerConnection connection, LinkListener listener, String address) {
      super(name, connection, listener);
      this.address = address;
    }

    @Override
    String address() {
      return this.address;
    }

    @Override
    public void send(Message<?> message, TransactionalState state, OutcomeCallback callback) {
      if (this.isClosed()) {
        throw new IllegalStateException("Sender link is closed");
      }
      if (callback == null) {
        this.process(message, state);
        return;
      }
      DeliveryOutcome forced = nextSendOutcomes.poll();
      if (forced != null) {
        callback.onOutcome(this, message, forced);
      } else if (holdOutcomes) {
        this.hold(message, state, callback);
      } else {
        callback.onOutcome(this, message, this.process(message, state));
      }
    }

    @Override
    DeliveryOutcome process(Message<?> message, TransactionalState state) {
      if (state == null) {
        queue(this.address).enqueue(copy(message));
        return DeliveryOutcome.accepted();
      }
      BrokerTransaction transaction = transactions.get(new Binary(state.txnId()));
      if (transaction == null) {
        return DeliveryOutcome.rejected(
            ExceptionUtils.ERROR_TRANSACTION_UNKNOWN_ID, "Unknown transaction " + state);
      }
      transaction.add(this.address, copy(message));
      return DeliveryOutcome.accepted();
    }
  }

  private final class CoordinatorLink extends BrokerLink implements SenderLink {

    private CoordinatorLink(String name, BrokerConnection connection, LinkListener listener) {
      super(name, connection, listener);
    }

    @Override
    public void send(Message<?> message, TransactionalState state, OutcomeCallback callback) {
      if (this.isClosed()) {
        throw new IllegalStateException("Coordinator link is closed");
      }
      DeliveryOutcome forced = nextCoordinatorOutcomes.poll();
      if (forced != null) {
        callback.onOutcome(this, message, forced);
      } else if (holdOutcomes) {
        this.hold(message, state, callback);
      } else {
        callback.onOutcome(this, message, this.process(message, state));
      }
    }

    @Override
    DeliveryOutcome process(Message<?> message, TransactionalState state) {
      Object body;
      try {
        body = message.body();
      } catch (ClientException e) {
        throw new IllegalStateException(e);
      }
      if (body instanceof Declare) {
        declareCount.incrementAndGet();
        byte[] txnId = ByteBuffer.allocate(4).putInt(txnIdSequence.incrementAndGet()).array();
        transactions.put(new Binary(txnId), new BrokerTransaction(this.connection));
        return DeliveryOutcome.declared(txnId);
      } else if (body instanceof Discharge) {
        Discharge discharge = (Discharge) body;
        BrokerTransaction transaction = transactions.remove(discharge.getTxnId());
        if (transaction == null) {
          return DeliveryOutcome.rejected(
              ExceptionUtils.ERROR_TRANSACTION_UNKNOWN_ID, "Unknown transaction ID");
        }
        dischargeCount.incrementAndGet();
        if (!discharge.getFail()) {
          transaction.commit();
        }
        return DeliveryOutcome.accepted();
      } else {
        return DeliveryOutcome.rejected("amqp:not-implemented", "Unexpected coordinator message");
      }
    }
  }

  private final class BrokerTransaction {

    private final BrokerConnection owner;
    private final List<Object[]> work = new ArrayList<>();

    private BrokerTransaction(BrokerConnection owner) {
      this.owner = owner;
    }

    private synchronized void add(String address, Message<?> message) {
      this.work.add(new Object[] {address, message});
    }

    private synchronized void commit() {
      for (Object[] w : this.work) {
        queue((String) w[0]).enqueue((Message<?>) w[1]);
      }
      this.work.clear();
    }
  }

  private final class BrokerQueue {

    private final String name;
    private final Deque<Message<?>> messages = new ArrayDeque<>();
    private final List<BrokerReceiver> receivers = new CopyOnWriteArrayList<>();

    private BrokerQueue(String name) {
      this.name = name;
    }

    private void enqueue(Message<?> message) {
      synchronized (this) {
        this.messages.add(message);
      }
      this.dispatch();
    }

    private void requeue(Message<?> message) {
      synchronized (this) {
        this.messages.addFirst(message);
      }
      this.dispatch();
    }

    private synchronized int size() {
      return this.messages.size();
    }

    private void dispatch() {
      dispatcher.execute(this::doDispatch);
    }

    private void doDispatch() {
      while (true) {
        BrokerReceiver receiver = null;
        Message<?> message;
        synchronized (this) {
          if (this.messages.isEmpty()) {
            return;
          }
          for (BrokerReceiver r : this.receivers) {
            if (!r.isClosed() && r.credit.get() > 0) {
              receiver = r;
              break;
            }
          }
          if (receiver == null) {
            return;
          }
          receiver.credit.decrementAndGet();
          message = this.messages.poll();
        }
        receiver.deliver(message);
      }
    }

    @Override
    public String toString() {
      return "queue(" + this.name + ")";
    }
  }

  private final class BrokerReceiver extends BrokerLink implements ReceiverLink {

    private final BrokerQueue queue;
    private final DeliveryListener deliveryListener;
    private final AtomicInteger credit = new AtomicInteger(0);
    private final Set<BrokerDelivery> unsettled = ConcurrentHashMap.newKeySet();

    private BrokerReceiver(
        String name,
        BrokerConnection connection,
        LinkListener listener,
        BrokerQueue queue,
        DeliveryListener deliveryListener) {
      super(name, connection, listener);
      this.queue = queue;
      this.deliveryListener = deliveryListener;
    }

    @Override
    String address() {
      return this.queue.name;
    }

    @Override
    public void addCredit(int credit) {
      if (this.isClosed()) {
        throw new IllegalStateException("Receiver link is closed");
      }
      this.credit.addAndGet(credit);
      this.queue.dispatch();
    }

    private void deliver(Message<?> message) {
      BrokerDelivery delivery = new BrokerDelivery(this, message);
      this.unsettled.add(delivery);
      this.deliveryListener.onDelivery(delivery);
    }

    @Override
    void closing() {
      this.queue.receivers.remove(this);
      for (BrokerDelivery delivery : new ArrayList<>(this.unsettled)) {
        delivery.release();
      }
    }
  }

  private static final class BrokerDelivery implements InboundDelivery {

    private final BrokerReceiver receiver;
    private final Message<?> message;
    private final Message<?> delivered;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    private BrokerDelivery(BrokerReceiver receiver, Message<?> message) {
      this.receiver = receiver;
      this.message = message;
      this.delivered = copy(message);
    }

    @Override
    public Message<?> message() {
      return this.delivered;
    }

    @Override
    public void accept() {
      this.settle();
    }

    @Override
    public void reject() {
      this.settle();
    }

    @Override
    public void release() {
      if (this.settle()) {
        this.receiver.queue.requeue(this.message);
      }
    }

    private boolean settle() {
      if (this.settled.compareAndSet(false, true)) {
        this.receiver.unsettled.remove(this);
        return true;
      }
      return false;
    }
  }
}
