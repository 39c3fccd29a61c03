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

package meshdb.interfaces.replication;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A known peer, keyed by its name. The name must equal the CN of the certificate the peer presents.
 * <p>
 * Instances are immutable; updates go through {@link #merge(NodePatch, long)}, which merges the
 * subscription list by (database, table) and leaves every field the patch does not carry untouched.
 */
public final class NodeRecord {
  public final String name;
  @Nullable
  public final String url;
  public final ImmutableList<NodeSubscription> subscriptions;
  public final Replicates replicates;
  @Nullable
  public final Integer shard;
  @Nullable
  public final String ca;
  @Nullable
  public final CertificateAuthorityInfo caInfo;
  @Nullable
  public final SystemInfo systemInfo;
  public final ImmutableSet<String> revokedCertificates;
  public final ImmutableList<String> routes;
  public final long createdAt;
  public final long updatedAt;

  private NodeRecord(Builder b) {
    this.name = Objects.requireNonNull(b.name, "name");
    this.url = b.url;
    this.subscriptions = ImmutableList.copyOf(b.subscriptions);
    this.replicates = b.replicates;
    this.shard = b.shard;
    this.ca = b.ca;
    this.caInfo = b.caInfo;
    this.systemInfo = b.systemInfo;
    this.revokedCertificates = ImmutableSet.copyOf(b.revokedCertificates);
    this.routes = ImmutableList.copyOf(b.routes);
    this.createdAt = b.createdAt;
    this.updatedAt = b.updatedAt;
  }

  /**
   * A new record built entirely from the patch.
   */
  public static NodeRecord create(String name, NodePatch patch, long now) {
    Builder b = new Builder(name);
    b.createdAt = now;
    return b.build().merge(patch, now);
  }

  public NodeRecord merge(NodePatch patch, long now) {
    Builder b = toBuilder();
    if (patch.url != null) {
      b.url = patch.url;
    }
    if (patch.subscriptions != null) {
      b.subscriptions = mergeSubscriptions(subscriptions, patch.subscriptions);
    }
    if (patch.replicates != null) {
      b.replicates = patch.replicates;
    }
    if (patch.shard != null) {
      b.shard = patch.shard;
    }
    if (patch.ca != null) {
      b.ca = patch.ca;
    }
    if (patch.caInfo != null) {
      b.caInfo = patch.caInfo;
    }
    if (patch.systemInfo != null) {
      b.systemInfo = patch.systemInfo;
    }
    if (patch.revokedCertificates != null) {
      Set<String> union = new LinkedHashSet<>(revokedCertificates);
      union.addAll(patch.revokedCertificates);
      b.revokedCertificates = union;
    }
    if (patch.routes != null) {
      b.routes = patch.routes;
    }
    b.updatedAt = now;
    return b.build();
  }

  static List<NodeSubscription> mergeSubscriptions(List<NodeSubscription> existing,
                                                   List<NodeSubscription> updates) {
    List<NodeSubscription> merged = new ArrayList<>(existing);
    for (NodeSubscription update : updates) {
      boolean replaced = false;
      for (int i = 0; i < merged.size(); i++) {
        NodeSubscription current = merged.get(i);
        if (current.key().equals(update.key())) {
          Double startTime = update.startTime != null ? update.startTime : current.startTime;
          merged.set(i, new NodeSubscription(update.database, update.table, update.publish, update.subscribe,
              startTime));
          replaced = true;
          break;
        }
      }
      if (!replaced) {
        merged.add(update);
      }
    }
    return merged;
  }

  public boolean hasSubscriptions() {
    return !subscriptions.isEmpty();
  }

  public Builder toBuilder() {
    Builder b = new Builder(name);
    b.url = url;
    b.subscriptions = subscriptions;
    b.replicates = replicates;
    b.shard = shard;
    b.ca = ca;
    b.caInfo = caInfo;
    b.systemInfo = systemInfo;
    b.revokedCertificates = revokedCertificates;
    b.routes = routes;
    b.createdAt = createdAt;
    b.updatedAt = updatedAt;
    return b;
  }

  @Override
  public String toString() {
    return "NodeRecord{" +
        "name='" + name + '\'' +
        ", url='" + url + '\'' +
        ", subscriptions=" + subscriptions +
        ", replicates=" + replicates +
        ", shard=" + shard +
        ", revokedCertificates=" + revokedCertificates +
        ", updatedAt=" + updatedAt +
        '}';
  }

  public static final class Builder {
    private final String name;
    private String url;
    private List<NodeSubscription> subscriptions = ImmutableList.of();
    private Replicates replicates = Replicates.NONE;
    private Integer shard;
    private String ca;
    private CertificateAuthorityInfo caInfo;
    private SystemInfo systemInfo;
    private Set<String> revokedCertificates = ImmutableSet.of();
    private List<String> routes = ImmutableList.of();
    private long createdAt;
    private long updatedAt;

    public Builder(String name) {
      this.name = name;
    }

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder subscriptions(List<NodeSubscription> subscriptions) {
      this.subscriptions = subscriptions;
      return this;
    }

    public Builder replicates(Replicates replicates) {
      this.replicates = replicates;
      return this;
    }

    public Builder shard(Integer shard) {
      this.shard = shard;
      return this;
    }

    public Builder ca(String ca) {
      this.ca = ca;
      return this;
    }

    public Builder updatedAt(long updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public NodeRecord build() {
      return new NodeRecord(this);
    }
  }
}
