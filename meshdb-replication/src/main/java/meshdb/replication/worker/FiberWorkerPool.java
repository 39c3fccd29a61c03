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

import com.google.common.collect.ImmutableList;
import meshdb.interfaces.workers.WorkerHandle;
import meshdb.interfaces.workers.WorkerPool;
import meshdb.replication.connection.ReplicationClient;
import meshdb.util.FiberSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * In-process worker pool: every network worker is a {@link ReplicationWorker} with its own fiber.
 * A worker whose fiber fails closes its connections and is then treated as exited.
 */
public class FiberWorkerPool implements WorkerPool {
  private static final Logger LOG = LoggerFactory.getLogger(FiberWorkerPool.class);

  private final ReplicationClient client;
  private final FiberSupplier fiberSupplier;
  private final List<ReplicationWorker> workers = new CopyOnWriteArrayList<>();
  private final List<Consumer<WorkerHandle>> exitCallbacks = new CopyOnWriteArrayList<>();
  private final List<MessageCallback<?>> messageCallbacks = new CopyOnWriteArrayList<>();
  private final AtomicInteger cursor = new AtomicInteger();
  private final ReplicationWorker coordinatorWorker;

  public FiberWorkerPool(int workerCount, ReplicationClient client, FiberSupplier fiberSupplier) {
    this.client = client;
    this.fiberSupplier = fiberSupplier;
    for (int id = 1; id <= workerCount; id++) {
      workers.add(newWorker(id, false));
    }
    this.coordinatorWorker = newWorker(0, true);
  }

  private ReplicationWorker newWorker(int id, boolean coordinator) {
    return new ReplicationWorker(id, coordinator, client, fiberSupplier, this::reportFromWorker, this::exited);
  }

  public void start() {
    coordinatorWorker.start();
    for (ReplicationWorker worker : workers) {
      worker.start();
    }
  }

  public void stop() {
    for (ReplicationWorker worker : workers) {
      worker.stop();
    }
    coordinatorWorker.stop();
  }

  @Override
  public List<WorkerHandle> getWorkers(String tag) {
    if (!NETWORK_TAG.equals(tag)) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(workers);
  }

  @Override
  public WorkerHandle assignWorker(String tag) {
    List<WorkerHandle> tagged = getWorkers(tag);
    if (tagged.isEmpty()) {
      return coordinatorWorker;
    }
    return tagged.get(Math.floorMod(cursor.getAndIncrement(), tagged.size()));
  }

  @Override
  public WorkerHandle coordinatorWorker() {
    return coordinatorWorker;
  }

  @Override
  public void sendToWorker(WorkerHandle worker, Object message) {
    ReplicationWorker target = find(worker.getWorkerId());
    if (target == null || target.isStopped()) {
      LOG.warn("dropping {} for worker {}, which is gone", message, worker.getWorkerId());
      return;
    }
    target.deliver(message);
  }

  @Override
  public void onWorkerExit(Consumer<WorkerHandle> callback) {
    exitCallbacks.add(callback);
  }

  @Override
  public <T> void onMessageFromWorker(Class<T> type, BiConsumer<WorkerHandle, T> callback) {
    messageCallbacks.add(new MessageCallback<>(type, callback));
  }

  /**
   * Stop the worker and tell everyone who asked that it exited.
   */
  public void stopWorker(WorkerHandle worker) {
    ReplicationWorker target = find(worker.getWorkerId());
    if (target != null && !target.isCoordinator()) {
      target.stop();
      exited(target);
    }
  }

  private void exited(ReplicationWorker worker) {
    if (!workers.remove(worker)) {
      return;
    }
    LOG.warn("replication worker {} exited", worker.getWorkerId());
    for (Consumer<WorkerHandle> callback : exitCallbacks) {
      try {
        callback.accept(worker);
      } catch (RuntimeException e) {
        LOG.error("worker exit callback failed for {}", worker, e);
      }
    }
  }

  private void reportFromWorker(WorkerHandle worker, Object message) {
    for (MessageCallback<?> callback : messageCallbacks) {
      callback.offer(worker, message);
    }
  }

  private ReplicationWorker find(int workerId) {
    if (workerId == coordinatorWorker.getWorkerId()) {
      return coordinatorWorker;
    }
    for (ReplicationWorker worker : workers) {
      if (worker.getWorkerId() == workerId) {
        return worker;
      }
    }
    return null;
  }

  private static final class MessageCallback<T> {
    private final Class<T> type;
    private final BiConsumer<WorkerHandle, T> callback;

    MessageCallback(Class<T> type, BiConsumer<WorkerHandle, T> callback) {
      this.type = type;
      this.callback = callback;
    }

    void offer(WorkerHandle worker, Object message) {
      if (type.isInstance(message)) {
        callback.accept(worker, type.cast(message));
      }
    }
  }
}
