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
import meshdb.interfaces.replication.NodeSubscription;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A configured route to a peer, as written in the configuration: a URL, or a host with an optional
 * port, optionally restricted to a list of subscriptions.
 */
public final class Route {
  @Nullable
  public final String url;
  @Nullable
  public final String host;
  @Nullable
  public final Integer port;
  /** Null means the peer is authorized to fully replicate. */
  @Nullable
  public final ImmutableList<NodeSubscription> subscriptions;
  public final ImmutableList<String> revokedCertificates;

  public Route(@Nullable String url,
               @Nullable String host,
               @Nullable Integer port,
               @Nullable List<NodeSubscription> subscriptions,
               List<String> revokedCertificates) {
    this.url = url;
    this.host = host;
    this.port = port;
    this.subscriptions = subscriptions == null ? null : ImmutableList.copyOf(subscriptions);
    this.revokedCertificates = ImmutableList.copyOf(revokedCertificates);
  }

  /**
   * A plain route string is a url if it has a scheme, otherwise a host (possibly with a port).
   */
  public static Route of(String route) {
    if (route.contains("://")) {
      return new Route(route, null, null, null, ImmutableList.of());
    }
    return new Route(null, route, null, null, ImmutableList.of());
  }

  @Override
  public String toString() {
    return "Route{" +
        "url='" + url + '\'' +
        ", host='" + host + '\'' +
        ", port=" + port +
        ", subscriptions=" + subscriptions +
        '}';
  }
}
