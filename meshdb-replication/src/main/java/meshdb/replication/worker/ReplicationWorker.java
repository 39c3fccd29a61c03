/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package meshdb.replication.worker;

import com.google.common.util.concurrent.ListenableFuture;
import meshdb.interfaces.workers.WorkerHandle;
import meshdb.replication.connection.NodeReplicationConnection;
import meshdb.replication.connection.ReplicationClient;
import meshdb.replication.messages.SubscribeToNode;
import meshdb.replication.messages.UnsubscribeFromNode;
import meshdb.util.FiberOnly;
import meshdb.util.FiberSupplier;
import meshdb.util.MeshFutures;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * A network worker: owns the outbound subscription connections the coordinator assigned to it.
 * Messages from the coordinator are handled one at a time on the worker's fiber; connection events
 * go back through the pool.
 */
public class ReplicationWorker implements WorkerHandle {
  private static final Logger LOG = LoggerFactory.getLogger(ReplicationWorker.class);

  private final int workerId;
  private final boolean coordinator;
  private final ReplicationClient client;
  private final BiConsumer<WorkerHandle, Object> toCoordinator;
  private final Fiber fiber;

  @FiberOnly
  private final Map<String, NodeReplicationConnection> connections = new HashMap<>();
  private volatile boolean stopped;

  ReplicationWorker(int workerId,
                    boolean coordinator,
                    ReplicationClient client,
                    FiberSupplier fiberSupplier,
                    BiConsumer<WorkerHandle, Object> toCoordinator,
                    Consumer<ReplicationWorker> onFailure) {
    this.workerId = workerId;
    this.coordinator = coordinator;
    this.client = client;
    this.toCoordinator = toCoordinator;
    this.fiber = fiberSupplier.getFiber(throwable -> failed(throwable, onFailure));
  }

  @Override
  public int getWorkerId() {
    return workerId;
  }

  @Override
  public boolean isCoordinator() {
    return coordinator;
  }

  void start() {
    fiber.start();
  }

  void deliver(Object message) {
    fiber.execute(() -> handle(message));
  }

  /**
   * Close every connection and stop the fiber.
   */
  void stop() {
    stopped = true;
    fiber.execute(this::closeConnections);
  }

  boolean isStopped() {
    return stopped;
  }

  /**
   * Runs on the failing fiber; connections are closed before the exit is reported.
   */
  @FiberOnly
  private void failed(Throwable throwable, Consumer<ReplicationWorker> onFailure) {
    LOG.error("replication worker {} failed", workerId, throwable);
    stopped = true;
    closeConnections();
    onFailure.accept(this);
  }

  @FiberOnly
  private void closeConnections() {
    for (NodeReplicationConnection connection : connections.values()) {
      connection.close();
    }
    connections.clear();
    fiber.dispose();
  }

  public ListenableFuture<Integer> getConnectionCount() {
    return MeshFutures.callOnFiber(fiber, connections::size);
  }

  @FiberOnly
  private void handle(Object message) {
    try {
      if (message instanceof SubscribeToNode) {
        subscribe((SubscribeToNode) message);
      } else if (message instanceof UnsubscribeFromNode) {
        unsubscribe((UnsubscribeFromNode) message);
      } else {
        LOG.warn("worker {} ignoring unknown message {}", workerId, message);
      }
    } catch (RuntimeException e) {
      LOG.error("worker {} failed to handle {}", workerId, message, e);
    }
  }

  @FiberOnly
  private void subscribe(SubscribeToNode message) {
    String key = key(message.primary().url, message.database);
    NodeReplicationConnection existing = connections.get(key);
    if (existing != null) {
      existing.update(message);
      return;
    }
    NodeReplicationConnection connection =
        client.newConnection(fiber, message, event -> toCoordinator.accept(this, event));
    connections.put(key, connection);
    LOG.debug("worker {} replicating {} from {}", workerId, message.database, message.primary().name);
    connection.start();
  }

  @FiberOnly
  private void unsubscribe(UnsubscribeFromNode message) {
    NodeReplicationConnection connection = connections.remove(key(message.url, message.database));
    if (connection != null) {
      connection.close();
    }
  }

  private static String key(String url, String database) {
    return url + "/" + database;
  }

  @Override
  public String toString() {
    return "ReplicationWorker{" + workerId + (coordinator ? ", coordinator" : "") + '}';
  }
}
