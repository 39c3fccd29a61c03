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
import meshdb.interfaces.replication.ClusterStatus;
import meshdb.interfaces.workers.WorkerHandle;
import meshdb.replication.messages.NodeTarget;
import meshdb.replication.messages.SubscribeToNode;
import meshdb.util.FiberOnly;
import org.jetbrains.annotations.Nullable;
import org.jetlang.core.Disposable;

import java.util.ArrayList;
import java.util.List;

/**
 * The coordinator's record of which worker serves a (peer url, database) pair. Owned by the
 * coordinator fiber; nothing else reads or writes it.
 */
final class ReplicationAssignment {
  enum State {
    ASSIGNED,
    CONNECTED,
    DISCONNECTED,
    REDIRECTED,
    REMOVED,
  }

  final AssignmentKey key;
  final String primaryName;
  final WorkerHandle worker;
  final List<NodeTarget> nodes = new ArrayList<>();

  State state = State.ASSIGNED;
  boolean connected;
  String status = ClusterStatus.DatabaseSocket.CONNECTING;
  double latency;
  boolean replicateByDefault;
  ImmutableSet<String> tables = ImmutableSet.of();
  @Nullable
  AssignmentKey redirectingTo;
  /** Set until the debounced activation has been sent to the worker. */
  @Nullable
  Disposable pendingActivation;

  ReplicationAssignment(AssignmentKey key, String primaryName, WorkerHandle worker) {
    this.key = key;
    this.primaryName = primaryName;
    this.worker = worker;
  }

  @FiberOnly
  boolean isActivated() {
    return pendingActivation == null;
  }

  @FiberOnly
  boolean hasNode(String name) {
    for (NodeTarget node : nodes) {
      if (node.name.equals(name)) {
        return true;
      }
    }
    return false;
  }

  @FiberOnly
  boolean removeNode(String name) {
    return nodes.removeIf(node -> node.name.equals(name));
  }

  @FiberOnly
  void cancelActivation() {
    if (pendingActivation != null) {
      pendingActivation.dispose();
      pendingActivation = null;
    }
  }

  @FiberOnly
  SubscribeToNode toSubscribeMessage() {
    return new SubscribeToNode(key.database, ImmutableList.copyOf(nodes), replicateByDefault, tables);
  }

  @FiberOnly
  ImmutableList<String> nodeNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (NodeTarget node : nodes) {
      names.add(node.name);
    }
    return names.build();
  }

  @Override
  public String toString() {
    return "ReplicationAssignment{" +
        "key=" + key +
        ", primaryName='" + primaryName + '\'' +
        ", worker=" + worker +
        ", state=" + state +
        ", status='" + status + '\'' +
        ", nodes=" + nodes +
        ", redirectingTo=" + redirectingTo +
        '}';
  }
}
