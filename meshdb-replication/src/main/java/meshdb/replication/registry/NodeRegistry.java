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

package meshdb.replication.registry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import meshdb.interfaces.replication.NodePatch;
import meshdb.interfaces.replication.NodeRecord;
import meshdb.interfaces.replication.NodeStore;
import meshdb.interfaces.replication.NodeSubscription;
import meshdb.interfaces.replication.Replicates;
import org.jetbrains.annotations.Nullable;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.core.Callback;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * The single source of truth for peer identity and replication intent. All mutations funnel
 * through {@link #ensure}, {@link #restore} and {@link #delete}; each one is published to
 * subscribers in the order it was written.
 * <p>
 * Pure data: the registry never touches the network.
 */
public class NodeRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(NodeRegistry.class);

  private final NodeStore store;
  private final String thisNodeName;
  private final Supplier<Set<String>> localDatabases;
  private final LongSupplier clock;
  private final MemoryChannel<NodeEvent> events = new MemoryChannel<>();

  public NodeRegistry(NodeStore store,
                      String thisNodeName,
                      Supplier<Set<String>> localDatabases,
                      LongSupplier clock) {
    this.store = store;
    this.thisNodeName = thisNodeName;
    this.localDatabases = localDatabases;
    this.clock = clock;
  }

  public NodeRegistry(NodeStore store, String thisNodeName, Supplier<Set<String>> localDatabases) {
    this(store, thisNodeName, localDatabases, System::currentTimeMillis);
  }

  public String getThisNodeName() {
    return thisNodeName;
  }

  @Nullable
  public NodeRecord get(String name) {
    return store.get(name);
  }

  /**
   * Distinguishes an explicitly deleted record from one that never existed.
   */
  public boolean isDeleted(String name) {
    return store.isDeleted(name);
  }

  @Nullable
  public NodeRecord getThisNode() {
    return store.get(thisNodeName);
  }

  public List<NodeRecord> getAll() {
    return ImmutableList.copyOf(store.scan());
  }

  /**
   * Every record except this node's own, sorted by name.
   */
  public List<NodeRecord> getPeers() {
    List<NodeRecord> peers = new ArrayList<>();
    for (NodeRecord record : store.scan()) {
      if (!record.name.equals(thisNodeName)) {
        peers.add(record);
      }
    }
    peers.sort((a, b) -> a.name.compareTo(b.name));
    return peers;
  }

  /**
   * Insert the record if absent, merge the patch into it if present. A record that was explicitly
   * deleted is left deleted; a stale ensure must not bring it back.
   *
   * @return the stored record, or null if the name is tombstoned.
   */
  @Nullable
  public synchronized NodeRecord ensure(String name, NodePatch patch) {
    if (store.isDeleted(name)) {
      LOG.debug("not recreating deleted node {} from {}", name, patch);
      return null;
    }
    return write(name, patch);
  }

  /**
   * Like ensure, but clears a tombstone. Only an explicit operator request (add_node) does this.
   */
  public synchronized NodeRecord restore(String name, NodePatch patch) {
    return write(name, patch);
  }

  public synchronized boolean delete(String name) {
    NodeRecord existing = store.get(name);
    if (existing == null && store.isDeleted(name)) {
      return false;
    }
    store.delete(name);
    LOG.info("node {} removed from registry", name);
    events.publish(new NodeEvent(NodeEvent.Type.DELETE, name, existing, false));
    return existing != null;
  }

  private NodeRecord write(String name, NodePatch patch) {
    long now = clock.getAsLong();
    NodeRecord existing = store.get(name);
    NodeRecord updated = existing == null
        ? NodeRecord.create(name, patch, now)
        : existing.merge(patch, now);
    store.put(updated);
    LOG.debug("node {} {}: {}", name, existing == null ? "added" : "updated", updated);
    events.publish(new NodeEvent(NodeEvent.Type.PUT, name, updated, false));
    return updated;
  }

  /**
   * Deliver every future put/delete to the listener on the given fiber, in write order. With
   * includeCurrent, every existing record is delivered first as an initial PUT. Exceptions thrown by
   * the listener are logged and do not stop later deliveries.
   */
  public synchronized Disposable subscribe(Fiber fiber, Callback<NodeEvent> listener, boolean includeCurrent) {
    Callback<NodeEvent> guarded = event -> {
      try {
        listener.onMessage(event);
      } catch (RuntimeException e) {
        LOG.error("node registry listener failed on {}", event, e);
      }
    };
    if (includeCurrent) {
      List<NodeRecord> current = ImmutableList.copyOf(store.scan());
      fiber.execute(() -> {
        for (NodeRecord record : current) {
          guarded.onMessage(new NodeEvent(NodeEvent.Type.PUT, record.name, record, true));
        }
      });
    }
    return events.subscribe(fiber, guarded);
  }

  /**
   * Whether this node should hold a connection to the given node for the database: the node fully
   * replicates (or sends) and the database exists here and this node is not opted out of full
   * replication, or one of its subscriptions names the database.
   */
  public boolean shouldReplicateToNode(NodeRecord node, String database) {
    if (replicatesFully(node.replicates) && localDatabases.get().contains(database)) {
      NodeRecord self = getThisNode();
      if (self == null || self.replicates != Replicates.NONE) {
        return true;
      }
    }
    for (NodeSubscription subscription : node.subscriptions) {
      if (subscription.database.equals(database) && (subscription.subscribe || subscription.publish)) {
        return true;
      }
    }
    return false;
  }

  private static boolean replicatesFully(Replicates replicates) {
    switch (replicates) {
      case FULL:
      case SEND_ONLY:
        return true;
      case RECEIVE_ONLY:
      case NONE:
        return false;
      default:
        throw new IllegalStateException("unhandled replicates variant " + replicates);
    }
  }

  /**
   * Current records grouped by shard; records without a shard are left out.
   */
  public Map<Integer, List<NodeRecord>> nodesByShard() {
    Map<Integer, List<NodeRecord>> shards = new TreeMap<>();
    for (NodeRecord record : store.scan()) {
      if (record.shard != null) {
        shards.computeIfAbsent(record.shard, k -> new ArrayList<>()).add(record);
      }
    }
    return ImmutableMap.copyOf(shards);
  }

  public Set<String> getLocalDatabases() {
    return localDatabases.get();
  }
}
