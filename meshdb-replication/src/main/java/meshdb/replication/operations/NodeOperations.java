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

package meshdb.replication.operations;

import com.google.common.util.concurrent.AsyncFunction;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import meshdb.interfaces.replication.NodePatch;
import meshdb.interfaces.replication.NodeRecord;
import meshdb.interfaces.replication.NodeSubscription;
import meshdb.interfaces.replication.Replicates;
import meshdb.interfaces.security.CertificateAuthority;
import meshdb.interfaces.security.CertificateSource;
import meshdb.replication.ReplicationConfiguration;
import meshdb.replication.connection.OperationHandler;
import meshdb.replication.registry.NodeNames;
import meshdb.replication.registry.NodeRegistry;
import meshdb.replication.wire.OperationEnvelope;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator-facing node management: add_node, update_node and remove_node, plus the halves other
 * nodes run against this one (add_node_back, remove_node_back). Failures the operator should see
 * come back as {@link NodeOperationException}s in failed futures.
 */
public class NodeOperations implements OperationHandler {
  private static final Logger LOG = LoggerFactory.getLogger(NodeOperations.class);

  private final NodeRegistry registry;
  private final ReplicationConfiguration config;
  private final PeerOperationClient peers;
  @Nullable
  private final CertificateSource certificateSource;

  public NodeOperations(NodeRegistry registry,
                        ReplicationConfiguration config,
                        PeerOperationClient peers,
                        @Nullable CertificateSource certificateSource) {
    this.registry = registry;
    this.config = config;
    this.peers = peers;
    this.certificateSource = certificateSource;
  }

  public ListenableFuture<String> addNode(AddNodeRequest request) {
    return setNode(request, false);
  }

  public ListenableFuture<String> updateNode(AddNodeRequest request) {
    return setNode(request, true);
  }

  private ListenableFuture<String> setNode(AddNodeRequest request, boolean update) {
    String url = request.url;
    if (url == null) {
      return failed("url required for this operation");
    }
    if (config.url == null) {
      return failed("replication url is missing");
    }
    boolean secure;
    try {
      secure = NodeNames.isSecure(url);
    } catch (IllegalArgumentException e) {
      return failed(e.getMessage());
    }
    if (!update) {
      if (secure && request.authorization == null) {
        return failed("authorization parameter is required");
      }
      String expectedName = request.nodeName != null ? request.nodeName : NodeNames.urlToNodeName(url);
      if (expectedName != null && registry.get(expectedName) != null) {
        return failed("node already added, use update_node");
      }
    }

    OperationEnvelope addBack = OperationEnvelope.request(OperationEnvelope.ADD_NODE_BACK);
    addBack.nodeName = config.nodeName;
    addBack.targetNodeName = request.nodeName;
    addBack.url = config.url;
    addBack.certificateAuthority = certificateAuthorityPem();
    addBack.authorization = request.authorization;
    if (request.hasSubscriptions()) {
      List<NodeSubscription> reversed = new ArrayList<>();
      for (NodeSubscription subscription : request.subscriptions) {
        reversed.add(subscription.reversed());
      }
      addBack.setSubscriptions(reversed);
    }

    AsyncFunction<OperationEnvelope, String> onResponse = response -> {
      if (response.isError()) {
        throw new NodeOperationException("Error returned from " + url + ": " + response.error);
      }
      String nodeName = response.nodeName != null ? response.nodeName
          : request.nodeName != null ? request.nodeName : NodeNames.urlToNodeName(url);

      NodePatch.Builder patch = NodePatch.builder().url(url);
      if (response.certificateAuthority != null) {
        patch.ca(response.certificateAuthority);
      }
      if (request.hasSubscriptions()) {
        patch.subscriptions(request.subscriptions);
      } else {
        patch.replicates(Replicates.FULL);
        ensureThisNodeReplicates();
      }
      registry.restore(nodeName, patch.build());
      LOG.info("{} node {} at {}", update ? "updated" : "added", nodeName, url);
      return Futures.immediateFuture(update
          ? "Successfully updated '" + url + "'"
          : "Successfully added '" + url + "' to manifest");
    };
    return Futures.transformAsync(
        Futures.catchingAsync(peers.send(url, addBack, request.rejectUnauthorized), Exception.class,
            e -> Futures.immediateFailedFuture(e instanceof NodeOperationException ? e
                : new NodeOperationException("Error returned from " + url + ": " + e.getMessage(), e)),
            MoreExecutors.directExecutor()),
        onResponse, MoreExecutors.directExecutor());
  }

  /**
   * Remove a node by name, or by the name its url implies. Records that only carry explicit
   * subscriptions are deleted; fully replicating records are downgraded in place so that the change
   * itself still replicates.
   */
  public ListenableFuture<String> removeNode(@Nullable String nodeName, @Nullable String url) {
    if (nodeName == null && url == null) {
      return failed("url or node_name is required for remove_node operation");
    }
    String name;
    try {
      name = nodeName != null ? nodeName : NodeNames.urlToNodeName(url);
    } catch (IllegalArgumentException e) {
      return failed(e.getMessage());
    }
    NodeRecord record = name == null ? null : registry.get(name);
    if (record == null) {
      return failed(name + " does not exist");
    }

    if (record.url != null) {
      OperationEnvelope removeBack = OperationEnvelope.request(OperationEnvelope.REMOVE_NODE_BACK);
      removeBack.targetNodeName = name;
      // with explicit subscriptions the peer forgets us; with full replication it stops replicating
      removeBack.nodeName = record.hasSubscriptions() ? config.nodeName : name;
      Futures.addCallback(peers.send(record.url, removeBack, true), new FutureCallback<OperationEnvelope>() {
        @Override
        public void onSuccess(OperationEnvelope result) {
          if (result.isError()) {
            LOG.warn("node {} could not remove its side: {}", name, result.error);
          }
        }

        @Override
        public void onFailure(Throwable t) {
          LOG.warn("Error removing node from target node {}; if it comes back online it may need to be"
              + " cleaned up manually", name, t);
        }
      }, MoreExecutors.directExecutor());
    }

    if (record.hasSubscriptions()) {
      registry.delete(name);
    } else {
      registry.ensure(name, downgrade(record));
    }
    LOG.info("removed node {}", name);
    return Futures.immediateFuture("Successfully removed '" + name + "' from manifest");
  }

  @Override
  public ListenableFuture<OperationEnvelope> handle(OperationEnvelope request) {
    if (OperationEnvelope.ADD_NODE_BACK.equals(request.operation)) {
      return Futures.immediateFuture(addNodeBack(request));
    } else if (OperationEnvelope.REMOVE_NODE_BACK.equals(request.operation)) {
      return Futures.immediateFuture(removeNodeBack(request));
    }
    return Futures.immediateFuture(OperationEnvelope.failure("unknown operation " + request.operation));
  }

  OperationEnvelope addNodeBack(OperationEnvelope request) {
    if (request.targetNodeName != null && !request.targetNodeName.equals(config.nodeName)) {
      return OperationEnvelope.failure("node_name does not match configured node name " + config.nodeName);
    }
    if (request.nodeName == null || request.url == null) {
      return OperationEnvelope.failure("node_name and url are required");
    }
    NodePatch.Builder patch = NodePatch.builder().url(request.url);
    if (request.certificateAuthority != null) {
      patch.ca(request.certificateAuthority);
    }
    List<NodeSubscription> subscriptions = request.toSubscriptions();
    if (!subscriptions.isEmpty()) {
      patch.subscriptions(subscriptions);
    } else {
      patch.replicates(Replicates.FULL);
      ensureThisNodeReplicates();
    }
    registry.restore(request.nodeName, patch.build());
    LOG.info("node {} at {} added this node", request.nodeName, request.url);

    OperationEnvelope response = new OperationEnvelope();
    response.nodeName = config.nodeName;
    response.url = config.url;
    response.certificateAuthority = certificateAuthorityPem();
    return response;
  }

  OperationEnvelope removeNodeBack(OperationEnvelope request) {
    if (request.nodeName == null) {
      return OperationEnvelope.failure("node_name is required");
    }
    if (request.nodeName.equals(config.nodeName)) {
      NodeRecord self = registry.getThisNode();
      if (self != null) {
        registry.ensure(config.nodeName, downgrade(self));
      }
      LOG.info("this node no longer replicates fully, as requested by a peer");
    } else {
      registry.delete(request.nodeName);
      LOG.info("node {} removed by its own request", request.nodeName);
    }
    OperationEnvelope response = new OperationEnvelope();
    response.nodeName = config.nodeName;
    return response;
  }

  private void ensureThisNodeReplicates() {
    NodePatch.Builder self = NodePatch.builder().replicates(Replicates.FULL);
    if (config.url != null) {
      self.url(config.url);
    }
    String ca = certificateAuthorityPem();
    if (ca != null) {
      self.ca(ca);
    }
    registry.ensure(config.nodeName, self.build());
  }

  private static NodePatch downgrade(NodeRecord record) {
    List<NodeSubscription> off = new ArrayList<>();
    for (NodeSubscription subscription : record.subscriptions) {
      off.add(subscription.withFlags(false, false));
    }
    return NodePatch.builder()
        .replicates(Replicates.NONE)
        .subscriptions(off)
        .build();
  }

  @Nullable
  private String certificateAuthorityPem() {
    if (certificateSource == null) {
      return null;
    }
    CertificateAuthority ca = certificateSource.getCertificateAuthority();
    return ca == null ? null : ca.certificatePem;
  }

  private static <V> ListenableFuture<V> failed(String message) {
    return Futures.immediateFailedFuture(new NodeOperationException(message));
  }
}
