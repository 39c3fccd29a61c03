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

package meshdb.replication.coordinator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import meshdb.interfaces.replication.ClusterStatus;
import meshdb.interfaces.replication.NodeRecord;
import meshdb.interfaces.replication.NodeSubscription;
import meshdb.interfaces.replication.Replicates;
import meshdb.interfaces.storage.AuditStore;
import meshdb.interfaces.workers.WorkerHandle;
import meshdb.interfaces.workers.WorkerPool;
import meshdb.replication.ReplicationConfiguration;
import meshdb.replication.messages.ClusterStatusRequest;
import meshdb.replication.messages.NodeConnectionEvent;
import meshdb.replication.messages.NodeTarget;
import meshdb.replication.messages.UnsubscribeFromNode;
import meshdb.replication.registry.NodeEvent;
import meshdb.replication.registry.NodeRegistry;
import meshdb.util.FiberOnly;
import meshdb.util.FiberSupplier;
import org.jetbrains.annotations.Nullable;
import org.jetlang.channels.MemoryRequestChannel;
import org.jetlang.channels.Request;
import org.jetlang.channels.RequestChannel;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Turns node registry state into replication assignments spread over the network workers, and
 * keeps them right as nodes come and go, connections drop, and workers exit.
 * <p>
 * All assignment state lives on the coordinator fiber. Registry events, worker reports and status
 * queries are all delivered onto that fiber; each handler catches and logs its own failures so that
 * one bad record never stops the others from being handled.
 */
public class SubscriptionCoordinator extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(SubscriptionCoordinator.class);

  private final NodeRegistry registry;
  private final WorkerPool workerPool;
  private final AuditStore auditStore;
  private final ReplicationConfiguration config;
  private final LongSupplier clock;
  private final Fiber fiber;
  private final RequestChannel<ClusterStatusRequest, ClusterStatus> statusRequests = new MemoryRequestChannel<>();

  @FiberOnly
  private final Map<AssignmentKey, ReplicationAssignment> assignments = new TreeMap<>();
  /** Latest locally applied time per database, until the first assignment for it consumes it. */
  @FiberOnly
  private final Map<String, Double> selfCatchupTimes = new HashMap<>();
  @FiberOnly
  private Boolean thisNodeReplicates;

  private Disposable registrySubscription;

  public SubscriptionCoordinator(NodeRegistry registry,
                                 WorkerPool workerPool,
                                 AuditStore auditStore,
                                 FiberSupplier fiberSupplier,
                                 ReplicationConfiguration config,
                                 LongSupplier clock) {
    this.registry = registry;
    this.workerPool = workerPool;
    this.auditStore = auditStore;
    this.config = config;
    this.clock = clock;
    this.fiber = fiberSupplier.getFiber(this::failCoordinator);
  }

  public SubscriptionCoordinator(NodeRegistry registry,
                                 WorkerPool workerPool,
                                 AuditStore auditStore,
                                 FiberSupplier fiberSupplier,
                                 ReplicationConfiguration config) {
    this(registry, workerPool, auditStore, fiberSupplier, config, System::currentTimeMillis);
  }

  public RequestChannel<ClusterStatusRequest, ClusterStatus> getStatusChannel() {
    return statusRequests;
  }

  public ListenableFuture<ClusterStatus> getClusterStatus() {
    SettableFuture<ClusterStatus> future = SettableFuture.create();
    fiber.execute(() -> {
      try {
        future.set(buildStatus(ClusterStatusRequest.ALL));
      } catch (RuntimeException e) {
        future.setException(e);
      }
    });
    return future;
  }

  @Override
  protected void doStart() {
    fiber.start();

    fiber.execute(() -> {
      try {
        for (String database : registry.getLocalDatabases()) {
          double lastApplied = auditStore.getLastAppliedTime(database);
          if (config.replicatesDatabase(database) && lastApplied > 0) {
            selfCatchupTimes.put(database, lastApplied);
          }
        }
        NodeRecord self = registry.getThisNode();
        thisNodeReplicates = self == null || self.replicates != Replicates.NONE;

        workerPool.onMessageFromWorker(NodeConnectionEvent.class,
            (worker, event) -> fiber.execute(() -> handleConnectionEvent(worker, event)));
        workerPool.onWorkerExit(worker -> fiber.execute(() -> handleWorkerExit(worker)));
        statusRequests.subscribe(fiber, this::handleStatusRequest);
        registrySubscription = registry.subscribe(fiber, this::handleNodeEvent, true);

        LOG.info("subscription coordinator for {} started, catchup times {}",
            registry.getThisNodeName(), selfCatchupTimes);
        notifyStarted();
      } catch (RuntimeException e) {
        notifyFailed(e);
      }
    });
  }

  @Override
  protected void doStop() {
    fiber.execute(() -> {
      if (registrySubscription != null) {
        registrySubscription.dispose();
      }
      for (ReplicationAssignment assignment : assignments.values()) {
        assignment.cancelActivation();
      }
      assignments.clear();
      fiber.dispose();
      notifyStopped();
    });
  }

  private void failCoordinator(Throwable throwable) {
    LOG.error("subscription coordinator fiber error", throwable);
  }

  /************* Registry events ***************/

  @FiberOnly
  private void handleNodeEvent(NodeEvent event) {
    try {
      if (event.name.equals(registry.getThisNodeName())) {
        handleThisNodeUpdate(event);
      } else if (event.type == NodeEvent.Type.DELETE) {
        removeAssignmentsFor(event.name, "node deleted from registry");
      } else if (event.value != null) {
        handleNodeUpdate(event.value);
      }
    } catch (RuntimeException e) {
      LOG.error("failed to handle registry event {}", event, e);
    }
  }

  @FiberOnly
  private void handleThisNodeUpdate(NodeEvent event) {
    boolean replicating = event.type == NodeEvent.Type.PUT
        && event.value != null
        && event.value.replicates != Replicates.NONE;
    if (thisNodeReplicates != null && thisNodeReplicates == replicating) {
      return;
    }
    LOG.info("this node ({}) full replication is now {}", event.name, replicating);
    thisNodeReplicates = replicating;
    for (NodeRecord peer : registry.getPeers()) {
      try {
        handleNodeUpdate(peer);
      } catch (RuntimeException e) {
        LOG.error("failed to re-evaluate node {}", peer.name, e);
      }
    }
  }

  @FiberOnly
  private void handleNodeUpdate(NodeRecord node) {
    if (node.url == null) {
      if (node.replicates != Replicates.NONE || node.hasSubscriptions()) {
        LOG.warn("node {} wants replication but has no url, skipping it", node.name);
      }
      return;
    }

    // a node that moved to a new url leaves its old assignments behind
    for (ReplicationAssignment stale : assignmentsWithPrimary(node.name)) {
      if (!stale.key.url.equals(node.url)) {
        removeAssignment(stale, "node url changed to " + node.url);
      }
    }

    for (String database : new TreeSet<>(registry.getLocalDatabases())) {
      if (!config.replicatesDatabase(database)) {
        continue;
      }
      AssignmentKey key = new AssignmentKey(node.url, database);
      ReplicationAssignment existing = assignments.get(key);
      boolean shouldReplicate = registry.shouldReplicateToNode(node, database);
      ImmutableSet<String> tables = subscribedTables(node, database);
      boolean replicateByDefault = node.replicates != Replicates.NONE || subscribesWholeDatabase(node, database);

      if (existing != null) {
        if (shouldReplicate) {
          updateAssignment(existing, node, replicateByDefault, tables);
        } else {
          removeAssignment(existing, "replication to " + node.name + " for " + database + " no longer wanted ("
              + "replicates=" + node.replicates + ", subscriptions=" + node.subscriptions + ")");
        }
      } else if (shouldReplicate) {
        createAssignment(key, node, replicateByDefault, tables);
      }
    }
  }

  @FiberOnly
  private void createAssignment(AssignmentKey key, NodeRecord node, boolean replicateByDefault,
                                ImmutableSet<String> tables) {
    WorkerHandle worker = workerPool.assignWorker(WorkerPool.NETWORK_TAG);
    ReplicationAssignment assignment = new ReplicationAssignment(key, node.name, worker);
    assignment.replicateByDefault = replicateByDefault;
    assignment.tables = tables;
    assignment.nodes.add(new NodeTarget(node.name, node.url, subscriptionStartTime(node, key.database), 0));

    Double catchupFrom = selfCatchupTimes.remove(key.database);
    if (catchupFrom != null) {
      NodeTarget self = new NodeTarget(registry.getThisNodeName(), config.thisNodeUrl(), catchupFrom,
          clock.getAsLong());
      assignment.nodes.add(self);
      LOG.info("asking {} to replay {} writes of this node from {}", node.name, key.database, catchupFrom);
    }

    assignments.put(key, assignment);
    assignment.pendingActivation = fiber.schedule(() -> activate(assignment),
        config.subscribeDelayMillis, TimeUnit.MILLISECONDS);
    LOG.info("assigned {} to worker {}", key, worker.getWorkerId());
  }

  @FiberOnly
  private void activate(ReplicationAssignment assignment) {
    assignment.pendingActivation = null;
    if (assignment.state == ReplicationAssignment.State.REMOVED) {
      return;
    }
    try {
      workerPool.sendToWorker(assignment.worker, assignment.toSubscribeMessage());
    } catch (RuntimeException e) {
      LOG.error("unable to send subscription {} to worker {}", assignment.key, assignment.worker, e);
    }
    // the self-catchup range is asked for exactly once
    assignment.removeNode(registry.getThisNodeName());
  }

  @FiberOnly
  private void updateAssignment(ReplicationAssignment assignment, NodeRecord node, boolean replicateByDefault,
                                ImmutableSet<String> tables) {
    boolean changed = assignment.replicateByDefault != replicateByDefault || !assignment.tables.equals(tables);
    assignment.replicateByDefault = replicateByDefault;
    assignment.tables = tables;
    if (changed && assignment.isActivated()) {
      LOG.debug("updating subscription {} for {}", assignment.key, node.name);
      workerPool.sendToWorker(assignment.worker, assignment.toSubscribeMessage());
    }
  }

  @FiberOnly
  private void removeAssignmentsFor(String nodeName, String reason) {
    for (ReplicationAssignment assignment : assignmentsWithPrimary(nodeName)) {
      removeAssignment(assignment, reason);
    }
    // stop relaying the node's writes through failover targets
    for (ReplicationAssignment assignment : assignments.values()) {
      if (assignment.removeNode(nodeName) && assignment.isActivated()) {
        workerPool.sendToWorker(assignment.worker, assignment.toSubscribeMessage());
      }
    }
  }

  @FiberOnly
  private void removeAssignment(ReplicationAssignment assignment, String reason) {
    LOG.info("removing assignment {} from worker {}: {}", assignment.key, assignment.worker.getWorkerId(), reason);
    boolean wasActivated = assignment.isActivated();
    assignment.cancelActivation();
    assignment.state = ReplicationAssignment.State.REMOVED;
    assignments.remove(assignment.key);
    if (wasActivated) {
      workerPool.sendToWorker(assignment.worker,
          new UnsubscribeFromNode(assignment.key.url, assignment.key.database));
    }
    failoverAgain(releaseRedirects(assignment));
  }

  /**
   * Undo failover in both directions for an assignment that is no longer in the map: the node it
   * relayed leaves its target, and the assignments relaying through it lose their target.
   *
   * @return the assignments that were relaying through it.
   */
  @FiberOnly
  private List<ReplicationAssignment> releaseRedirects(ReplicationAssignment gone) {
    if (gone.redirectingTo != null) {
      ReplicationAssignment target = assignments.get(gone.redirectingTo);
      gone.redirectingTo = null;
      if (target != null && target.removeNode(gone.primaryName)) {
        LOG.info("no longer relaying {} writes of {} through {}", gone.key.database, gone.primaryName,
            target.primaryName);
        if (target.isActivated()) {
          workerPool.sendToWorker(target.worker, target.toSubscribeMessage());
        }
      }
    }
    List<ReplicationAssignment> stranded = new ArrayList<>();
    for (ReplicationAssignment other : assignments.values()) {
      if (gone.key.equals(other.redirectingTo)) {
        other.redirectingTo = null;
        stranded.add(other);
      }
    }
    return stranded;
  }

  @FiberOnly
  private void failoverAgain(List<ReplicationAssignment> stranded) {
    for (ReplicationAssignment assignment : stranded) {
      if (assignments.get(assignment.key) == assignment && !assignment.connected) {
        failover(assignment);
      }
    }
  }

  /************* Worker reports ***************/

  @FiberOnly
  private void handleConnectionEvent(WorkerHandle worker, NodeConnectionEvent event) {
    try {
      ReplicationAssignment assignment = assignments.get(new AssignmentKey(event.url, event.database));
      switch (event.type) {
        case CONNECTED:
          onConnected(assignment, event);
          break;
        case DISCONNECTED:
          onDisconnected(assignment, event);
          break;
        default:
          throw new IllegalStateException("unknown connection event " + event.type);
      }
    } catch (RuntimeException e) {
      LOG.error("failed to handle {} from worker {}", event, worker, e);
    }
  }

  @FiberOnly
  private void onConnected(@Nullable ReplicationAssignment assignment, NodeConnectionEvent event) {
    if (assignment == null) {
      LOG.debug("connection event for unknown assignment {}", event);
      return;
    }
    assignment.connected = true;
    assignment.status = event.status;
    assignment.latency = event.latency;
    assignment.state = ReplicationAssignment.State.CONNECTED;

    if (assignment.redirectingTo != null) {
      ReplicationAssignment target = assignments.get(assignment.redirectingTo);
      assignment.redirectingTo = null;
      if (target != null && target.removeNode(event.nodeName)) {
        LOG.info("{} is back, no longer relaying its {} writes through {}",
            event.nodeName, event.database, target.primaryName);
        if (target.isActivated()) {
          workerPool.sendToWorker(target.worker, target.toSubscribeMessage());
        }
      }
    }
  }

  @FiberOnly
  private void onDisconnected(@Nullable ReplicationAssignment assignment, NodeConnectionEvent event) {
    if (assignment == null) {
      return;
    }
    assignment.connected = false;
    assignment.status = event.status;
    if (assignment.redirectingTo == null) {
      assignment.state = ReplicationAssignment.State.DISCONNECTED;
    }
    if (event.finished || assignment.redirectingTo != null) {
      return;
    }
    failover(assignment);
  }

  @FiberOnly
  private void failover(ReplicationAssignment disconnected) {
    String database = disconnected.key.database;
    List<String> names = new ArrayList<>();
    for (NodeRecord peer : registry.getPeers()) {
      names.add(peer.name);
    }
    Optional<String> targetName = FailoverPlanner.findFailoverTarget(names, disconnected.primaryName,
        name -> findAssignment(name, database) != null);
    if (!targetName.isPresent()) {
      LOG.warn("no peer available to relay {} writes of {}", database, disconnected.primaryName);
      return;
    }

    ReplicationAssignment target = findAssignment(targetName.get(), database);
    for (NodeTarget node : disconnected.nodes) {
      if (!target.hasNode(node.name)) {
        target.nodes.add(node);
      }
    }
    disconnected.redirectingTo = target.key;
    disconnected.state = ReplicationAssignment.State.REDIRECTED;
    LOG.info("relaying {} writes of {} through {}", database, disconnected.primaryName, target.primaryName);
    if (target.isActivated()) {
      workerPool.sendToWorker(target.worker, target.toSubscribeMessage());
    }
  }

  @FiberOnly
  private void handleWorkerExit(WorkerHandle worker) {
    try {
      List<ReplicationAssignment> orphaned = new ArrayList<>();
      for (ReplicationAssignment assignment : assignments.values()) {
        if (assignment.worker.getWorkerId() == worker.getWorkerId()) {
          orphaned.add(assignment);
        }
      }
      if (orphaned.isEmpty()) {
        return;
      }
      LOG.warn("worker {} exited, reassigning {} subscriptions", worker.getWorkerId(), orphaned.size());
      for (ReplicationAssignment assignment : orphaned) {
        assignment.cancelActivation();
        assignment.state = ReplicationAssignment.State.REMOVED;
        assignments.remove(assignment.key);
      }
      List<ReplicationAssignment> stranded = new ArrayList<>();
      for (ReplicationAssignment assignment : orphaned) {
        stranded.addAll(releaseRedirects(assignment));
      }
      for (ReplicationAssignment assignment : orphaned) {
        NodeRecord node = registry.get(assignment.primaryName);
        if (node != null) {
          handleNodeUpdate(node);
        }
      }
      failoverAgain(stranded);
    } catch (RuntimeException e) {
      LOG.error("failed to reassign subscriptions of worker {}", worker, e);
    }
  }

  /************* Status ***************/

  @FiberOnly
  private void handleStatusRequest(Request<ClusterStatusRequest, ClusterStatus> request) {
    try {
      request.reply(buildStatus(request.getRequest()));
    } catch (RuntimeException e) {
      LOG.error("failed to build cluster status", e);
    }
  }

  @FiberOnly
  private ClusterStatus buildStatus(ClusterStatusRequest request) {
    Map<String, List<ReplicationAssignment>> byNode = new LinkedHashMap<>();
    if (request.includeUnassigned) {
      for (NodeRecord peer : registry.getPeers()) {
        byNode.put(peer.name, new ArrayList<>());
      }
    }
    for (ReplicationAssignment assignment : assignments.values()) {
      byNode.computeIfAbsent(assignment.primaryName, k -> new ArrayList<>()).add(assignment);
    }

    ImmutableList.Builder<ClusterStatus.Connection> connections = ImmutableList.builder();
    for (Map.Entry<String, List<ReplicationAssignment>> entry : byNode.entrySet()) {
      NodeRecord node = registry.get(entry.getKey());
      String url = node != null && node.url != null ? node.url : "";
      ImmutableList.Builder<ClusterStatus.DatabaseSocket> sockets = ImmutableList.builder();
      for (ReplicationAssignment assignment : entry.getValue()) {
        url = assignment.key.url;
        sockets.add(new ClusterStatus.DatabaseSocket(assignment.key.database, assignment.connected,
            assignment.status, assignment.latency, assignment.nodeNames()));
      }
      connections.add(new ClusterStatus.Connection(entry.getKey(), url, sockets.build()));
    }
    return new ClusterStatus(registry.getThisNodeName(), isRunning(), connections.build());
  }

  /************* Helpers ***************/

  @FiberOnly
  private List<ReplicationAssignment> assignmentsWithPrimary(String nodeName) {
    List<ReplicationAssignment> matching = new ArrayList<>();
    for (ReplicationAssignment assignment : assignments.values()) {
      if (assignment.primaryName.equals(nodeName)) {
        matching.add(assignment);
      }
    }
    return matching;
  }

  @FiberOnly
  @Nullable
  private ReplicationAssignment findAssignment(String nodeName, String database) {
    for (ReplicationAssignment assignment : assignments.values()) {
      if (assignment.primaryName.equals(nodeName) && assignment.key.database.equals(database)) {
        return assignment;
      }
    }
    return null;
  }

  private static double subscriptionStartTime(NodeRecord node, String database) {
    for (NodeSubscription subscription : node.subscriptions) {
      if (subscription.database.equals(database) && subscription.table == null && subscription.startTime != null) {
        return subscription.startTime;
      }
    }
    return 0;
  }

  private static boolean subscribesWholeDatabase(NodeRecord node, String database) {
    for (NodeSubscription subscription : node.subscriptions) {
      if (subscription.database.equals(database) && subscription.table == null
          && (subscription.subscribe || subscription.publish)) {
        return true;
      }
    }
    return false;
  }

  private static ImmutableSet<String> subscribedTables(NodeRecord node, String database) {
    ImmutableSet.Builder<String> tables = ImmutableSet.builder();
    for (NodeSubscription subscription : node.subscriptions) {
      if (subscription.database.equals(database) && subscription.table != null
          && (subscription.subscribe || subscription.publish)) {
        tables.add(subscription.table);
      }
    }
    return tables.build();
  }
}
