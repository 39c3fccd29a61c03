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

import java.util.Collection;
import java.util.List;

/**
 * A partial NodeRecord: every null field means "not part of this update".
 */
public final class NodePatch {
  @Nullable
  public final String url;
  @Nullable
  public final ImmutableList<NodeSubscription> subscriptions;
  @Nullable
  public final Replicates replicates;
  @Nullable
  public final Integer shard;
  @Nullable
  public final String ca;
  @Nullable
  public final CertificateAuthorityInfo caInfo;
  @Nullable
  public final SystemInfo systemInfo;
  @Nullable
  public final ImmutableSet<String> revokedCertificates;
  @Nullable
  public final ImmutableList<String> routes;

  private NodePatch(Builder b) {
    this.url = b.url;
    this.subscriptions = b.subscriptions;
    this.replicates = b.replicates;
    this.shard = b.shard;
    this.ca = b.ca;
    this.caInfo = b.caInfo;
    this.systemInfo = b.systemInfo;
    this.revokedCertificates = b.revokedCertificates;
    this.routes = b.routes;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "NodePatch{" +
        "url='" + url + '\'' +
        ", subscriptions=" + subscriptions +
        ", replicates=" + replicates +
        ", shard=" + shard +
        ", revokedCertificates=" + revokedCertificates +
        '}';
  }

  public static final class Builder {
    private String url;
    private ImmutableList<NodeSubscription> subscriptions;
    private Replicates replicates;
    private Integer shard;
    private String ca;
    private CertificateAuthorityInfo caInfo;
    private SystemInfo systemInfo;
    private ImmutableSet<String> revokedCertificates;
    private ImmutableList<String> routes;

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder subscriptions(List<NodeSubscription> subscriptions) {
      this.subscriptions = ImmutableList.copyOf(subscriptions);
      return this;
    }

    public Builder replicates(Replicates replicates) {
      this.replicates = replicates;
      return this;
    }

    public Builder shard(int shard) {
      this.shard = shard;
      return this;
    }

    public Builder ca(String ca) {
      this.ca = ca;
      return this;
    }

    public Builder caInfo(CertificateAuthorityInfo caInfo) {
      this.caInfo = caInfo;
      return this;
    }

    public Builder systemInfo(SystemInfo systemInfo) {
      this.systemInfo = systemInfo;
      return this;
    }

    public Builder revokedCertificates(Collection<String> revokedCertificates) {
      this.revokedCertificates = ImmutableSet.copyOf(revokedCertificates);
      return this;
    }

    public Builder routes(List<String> routes) {
      this.routes = ImmutableList.copyOf(routes);
      return this;
    }

    public NodePatch build() {
      return new NodePatch(this);
    }
  }
}
