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

package meshdb.replication;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.ListenableFuture;
import io.netty.channel.EventLoopGroup;
import meshdb.ReplicationConstants;
import meshdb.interfaces.replication.ClusterStatus;
import meshdb.interfaces.replication.NodeRecord;
import meshdb.interfaces.replication.NodeStore;
import meshdb.interfaces.security.CertificateSource;
import meshdb.interfaces.storage.AuditStore;
import meshdb.replication.confirmation.ConfirmationCounters;
import meshdb.replication.confirmation.ConfirmationTracker;
import meshdb.replication.connection.ReplicationClient;
import meshdb.replication.connection.ReplicationServer;
import meshdb.replication.coordinator.SubscriptionCoordinator;
import meshdb.replication.operations.AddNodeRequest;
import meshdb.replication.operations.NodeOperations;
import meshdb.replication.operations.WirePeerOperationClient;
import meshdb.replication.registry.NodeRegistry;
import meshdb.replication.registry.Route;
import meshdb.replication.registry.Routes;
import meshdb.replication.worker.FiberWorkerPool;
import meshdb.util.FiberSupplier;
import meshdb.util.MeshFutures;
import org.jetbrains.annotations.Nullable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.InetSocketAddress;
import java.util.Collection;
import java.util.List;

/**
 * Replication for one node: the registry of known nodes, the server peers subscribe to, the worker
 * pool holding our own subscriptions, the coordinator deciding which subscriptions exist, and the
 * confirmation tracker behind awaitReplication.
 * <p>
 * Starting the service ensures the configured routes into the registry, binds the replication port
 * and then starts the coordinator. It owns fibers and must be stopped to release them; the Netty
 * event loop groups belong to the caller.
 */
public class ReplicationService extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(ReplicationService.class);

  private final ReplicationConfiguration config;
  private final AuditStore auditStore;
  private final FiberSupplier fiberSupplier;

  private final NodeRegistry registry;
  private final ConfirmationCounters counters;
  private final ConfirmationTracker confirmationTracker;
  private final NodeOperations nodeOperations;
  private final ReplicationServer server;
  private final FiberWorkerPool workerPool;
  private final SubscriptionCoordinator coordinator;

  private Fiber fiber;
  private InetSocketAddress boundAddress;

  public ReplicationService(ReplicationConfiguration config,
                            NodeStore nodeStore,
                            AuditStore auditStore,
                            @Nullable CertificateSource certificateSource,
                            FiberSupplier fiberSupplier,
                            EventLoopGroup bossGroup,
                            EventLoopGroup workerGroup) {
    this.config = config;
    this.auditStore = auditStore;
    this.fiberSupplier = fiberSupplier;

    this.registry = new NodeRegistry(nodeStore, config.nodeName, auditStore::databaseNames);
    this.counters = config.confirmationFile == null
        ? ConfirmationCounters.inMemory()
        : ConfirmationCounters.mapped(new File(config.confirmationFile),
            ReplicationConstants.CONFIRMATION_COUNTER_SLOTS);
    this.confirmationTracker = new ConfirmationTracker(counters, this::confirmingPeers, fiberSupplier,
        config.confirmationFile == null ? 0 : ReplicationConstants.CONFIRMATION_POLL_INTERVAL_MILLISECONDS);

    ReplicationClient client = new ReplicationClient(workerGroup, config, auditStore, certificateSource);
    this.nodeOperations = new NodeOperations(registry, config, new WirePeerOperationClient(client),
        certificateSource);
    this.server = new ReplicationServer(config, registry, auditStore, counters,
        confirmationTracker.getUpdateChannel(), nodeOperations, certificateSource, fiberSupplier,
        bossGroup, workerGroup);
    this.workerPool = new FiberWorkerPool(config.workerCount, client, fiberSupplier);
    this.coordinator = new SubscriptionCoordinator(registry, workerPool, auditStore, fiberSupplier, config);
  }

  /************* Public operations ***************/

  public NodeRegistry getRegistry() {
    return registry;
  }

  public NodeOperations getNodeOperations() {
    return nodeOperations;
  }

  public ListenableFuture<String> addNode(AddNodeRequest request) {
    return nodeOperations.addNode(request);
  }

  public ListenableFuture<String> updateNode(AddNodeRequest request) {
    return nodeOperations.updateNode(request);
  }

  public ListenableFuture<String> removeNode(@Nullable String nodeName, @Nullable String url) {
    return nodeOperations.removeNode(nodeName, url);
  }

  public ListenableFuture<ClusterStatus> getClusterStatus() {
    return coordinator.getClusterStatus();
  }

  /**
   * Completes once requiredCount peers have confirmed the database up to txnTime.
   */
  public ListenableFuture<Void> awaitReplication(String database, double txnTime, int requiredCount) {
    return confirmationTracker.awaitReplication(database, txnTime, requiredCount);
  }

  /**
   * The address the replication server is listening on, or null before the service has started.
   */
  @Nullable
  public InetSocketAddress getBoundAddress() {
    return boundAddress;
  }

  /************* Lifecycle ***************/

  @Override
  protected void doStart() {
    fiber = fiberSupplier.getFiber(this::failService);
    fiber.start();

    fiber.execute(() -> {
      try {
        ensureRoutes();
        confirmationTracker.startAsync().awaitRunning();
        workerPool.start();
      } catch (RuntimeException e) {
        failService(e);
        return;
      }

      MeshFutures.addCallback(server.bind(),
          (InetSocketAddress address) -> {
            boundAddress = address;
            LOG.info("node {} replicating on {}", config.nodeName, address);
            coordinator.startAsync().awaitRunning();
            notifyStarted();
          },
          this::failService,
          fiber);
    });
  }

  @Override
  protected void doStop() {
    fiber.execute(() -> {
      try {
        coordinator.stopAsync().awaitTerminated();
        workerPool.stop();
        confirmationTracker.close();
      } catch (RuntimeException e) {
        LOG.error("error stopping replication components", e);
      }

      MeshFutures.addCallback(server.close(),
          (ignore) -> {
            counters.close();
            fiber.dispose();
            notifyStopped();
          },
          this::failService,
          fiber);
    });
  }

  private void failService(Throwable t) {
    LOG.error("replication service failed", t);
    notifyFailed(t);
  }

  private void ensureRoutes() {
    ImmutableList.Builder<Route> routes = ImmutableList.builder();
    for (String route : config.routes) {
      routes.add(Route.of(route));
    }
    for (Routes.ResolvedRoute resolved : Routes.resolve(routes.build(), config)) {
      LOG.debug("ensuring route {}", resolved);
      registry.ensure(resolved.nodeName, resolved.patch);
    }
  }

  private Collection<String> confirmingPeers(String database) {
    ImmutableList.Builder<String> peers = ImmutableList.builder();
    List<NodeRecord> records = registry.getPeers();
    for (NodeRecord record : records) {
      if (registry.shouldReplicateToNode(record, database)) {
        peers.add(record.name);
      }
    }
    return peers.build();
  }
}
