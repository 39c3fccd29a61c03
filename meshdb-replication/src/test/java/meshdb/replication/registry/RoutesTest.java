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
import meshdb.interfaces.replication.NodeSubscription;
import meshdb.interfaces.replication.Replicates;
import meshdb.replication.ReplicationConfiguration;
import org.junit.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class RoutesTest {
  private final ReplicationConfiguration plain = ReplicationConfiguration.fromMap(ImmutableMap.of(
      ReplicationConfiguration.PORT, "9925"));
  private final ReplicationConfiguration secure = ReplicationConfiguration.fromMap(ImmutableMap.of(
      ReplicationConfiguration.PORT, "9925",
      ReplicationConfiguration.SECURE_PORT, "9926"));

  @Test
  public void aUrlRouteIsUsedAsIsAndNamedByItsHost() {
    List<Routes.ResolvedRoute> resolved = Routes.resolve(ImmutableList.of(Route.of("tcp://db-2.example:7000")), plain);

    assertThat(resolved.size(), is(1));
    assertThat(resolved.get(0).url, is("tcp://db-2.example:7000"));
    assertThat(resolved.get(0).nodeName, is("db-2.example"));
  }

  @Test
  public void aHostRouteGetsTheConfiguredPort() {
    List<Routes.ResolvedRoute> resolved = Routes.resolve(ImmutableList.of(Route.of("db-2")), plain);

    assertThat(resolved.get(0).url, is("tcp://db-2:9925"));
  }

  @Test
  public void aHostRouteUsesTlsAndTheSecurePortWhenOneIsConfigured() {
    List<Routes.ResolvedRoute> resolved = Routes.resolve(ImmutableList.of(Route.of("db-2")), secure);

    assertThat(resolved.get(0).url, is("tls://db-2:9926"));
  }

  @Test
  public void aHostRouteKeepsItsOwnPort() {
    List<Routes.ResolvedRoute> resolved = Routes.resolve(ImmutableList.of(Route.of("db-2:8000")), secure);

    assertThat(resolved.get(0).url, is("tls://db-2:8000"));
  }

  @Test
  public void routesWithoutSubscriptionsReplicateFully() {
    List<Routes.ResolvedRoute> resolved = Routes.resolve(ImmutableList.of(Route.of("db-2")), plain);

    assertThat(resolved.get(0).patch.replicates, is(Replicates.FULL));
    assertThat(resolved.get(0).patch.subscriptions, is(nullValue()));
  }

  @Test
  public void routesWithSubscriptionsCarryThemInsteadOfFullReplication() {
    NodeSubscription subscription = new NodeSubscription("data", true, true);
    Route route = new Route(null, "db-2", 7000, ImmutableList.of(subscription), ImmutableList.of("serial-9"));

    Routes.ResolvedRoute resolved = Routes.resolve(ImmutableList.of(route), plain).get(0);

    assertThat(resolved.url, is("tcp://db-2:7000"));
    assertThat(resolved.patch.replicates, is(nullValue()));
    assertThat(resolved.patch.subscriptions, contains(subscription));
    assertThat(resolved.patch.revokedCertificates, contains("serial-9"));
  }

  @Test
  public void routesWithNeitherUrlNorHostAreSkipped() {
    Route route = new Route(null, null, 7000, null, ImmutableList.of());

    assertThat(Routes.resolve(ImmutableList.of(route), plain), is(empty()));
  }

  @Test
  public void nodeNamesComeFromTheUrlHost() {
    assertThat(NodeNames.urlToNodeName("tls://node-b.example:9926"), is("node-b.example"));
    assertThat(NodeNames.isSecure("tls://node-b.example:9926"), is(true));
    assertThat(NodeNames.isSecure("tcp://node-b.example:9925"), is(false));
    assertThat(NodeNames.hostAndPort("tcp://node-b:9925").getPort(), is(9925));
  }

  @Test(expected = IllegalArgumentException.class)
  public void urlsWithoutAPortCannotBeDialed() {
    NodeNames.hostAndPort("tcp://node-b");
  }
}
