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
import com.google.common.net.HostAndPort;
import meshdb.interfaces.replication.NodePatch;
import meshdb.interfaces.replication.Replicates;
import meshdb.replication.ReplicationConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns configured routes into registry entries.
 */
public final class Routes {
  private static final Logger LOG = LoggerFactory.getLogger(Routes.class);

  private Routes() {
  }

  public static final class ResolvedRoute {
    public final String nodeName;
    public final String url;
    public final NodePatch patch;

    ResolvedRoute(String nodeName, String url, NodePatch patch) {
      this.nodeName = nodeName;
      this.url = url;
      this.patch = patch;
    }

    @Override
    public String toString() {
      return "ResolvedRoute{nodeName='" + nodeName + "', url='" + url + "'}";
    }
  }

  /**
   * Resolve each route to a URL and the registry patch it implies. Host-only routes get a port from
   * the host itself, the route, or the configured replication port (secure port preferred, in which
   * case the scheme is tls). Routes with neither url nor host are logged and skipped.
   */
  public static List<ResolvedRoute> resolve(List<Route> routes, ReplicationConfiguration configuration) {
    ImmutableList.Builder<ResolvedRoute> resolved = ImmutableList.builder();
    for (Route route : routes) {
      String url = route.url;
      if (url == null && route.host != null) {
        HostAndPort hostAndPort = HostAndPort.fromString(route.host);
        int port;
        if (hostAndPort.hasPort()) {
          port = hostAndPort.getPort();
        } else if (route.port != null) {
          port = route.port;
        } else {
          port = configuration.listenPort();
        }
        String scheme = configuration.securePort != null ? NodeNames.TLS_SCHEME : NodeNames.TCP_SCHEME;
        url = scheme + "://" + hostAndPort.getHost() + ":" + port;
      }
      if (url == null) {
        LOG.error("Invalid route {}, must specify a url or host (with port)", route);
        continue;
      }

      NodePatch.Builder patch = NodePatch.builder().url(url);
      if (route.subscriptions == null) {
        patch.replicates(Replicates.FULL);
      } else {
        patch.subscriptions(route.subscriptions);
      }
      if (!route.revokedCertificates.isEmpty()) {
        patch.revokedCertificates(route.revokedCertificates);
      }
      resolved.add(new ResolvedRoute(NodeNames.urlToNodeName(url), url, patch.build()));
    }
    return resolved.build();
  }
}
