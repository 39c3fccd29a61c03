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

import com.google.common.collect.ImmutableMap;
import meshdb.ReplicationConstants;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class ReplicationConfigurationTest {

  @Test
  public void defaultsComeFromReplicationConstants() {
    ReplicationConfiguration config = ReplicationConfiguration.defaults();

    assertThat(config.nodeName, is(ReplicationConstants.REPLICATION_DEFAULT_NODE_NAME));
    assertThat(config.port, is(ReplicationConstants.REPLICATION_DEFAULT_PORT));
    assertThat(config.databases, is(nullValue()));
    assertThat(config.replicatesDatabase("anything"), is(true));
    assertThat(config.thisNodeUrl(), is("tcp://127.0.0.1:" + ReplicationConstants.REPLICATION_DEFAULT_PORT));
  }

  @Test
  public void theNodeNameFallsBackToTheUrlHost() {
    ReplicationConfiguration config = ReplicationConfiguration.fromMap(ImmutableMap.of(
        ReplicationConfiguration.URL, "tls://db-1.example:9926"));

    assertThat(config.nodeName, is("db-1.example"));
    assertThat(config.thisNodeUrl(), is("tls://db-1.example:9926"));
  }

  @Test
  public void anExplicitNodeNameWins() {
    ReplicationConfiguration config = ReplicationConfiguration.fromMap(ImmutableMap.of(
        ReplicationConfiguration.URL, "tcp://10.0.0.1:9925",
        ReplicationConfiguration.NODE_NAME, "db-1"));

    assertThat(config.nodeName, is("db-1"));
  }

  @Test
  public void theSecurePortIsListenedOnWhenConfigured() {
    ReplicationConfiguration config = ReplicationConfiguration.fromMap(ImmutableMap.of(
        ReplicationConfiguration.NODE_NAME, "db-1",
        ReplicationConfiguration.PORT, "9925",
        ReplicationConfiguration.SECURE_PORT, "9926"));

    assertThat(config.listenPort(), is(9926));
    assertThat(config.thisNodeUrl(), is("tls://db-1:9926"));
  }

  @Test
  public void databaseAndRouteListsAreSplitOnCommas() {
    ReplicationConfiguration config = ReplicationConfiguration.fromMap(ImmutableMap.of(
        ReplicationConfiguration.DATABASES, "data, metrics",
        ReplicationConfiguration.ROUTES, "db-2, tcp://db-3:9925,"));

    assertThat(config.databases, contains("data", "metrics"));
    assertThat(config.replicatesDatabase("system"), is(false));
    assertThat(config.routes, contains("db-2", "tcp://db-3:9925"));
  }

  @Test
  public void anAsteriskMeansEveryDatabase() {
    ReplicationConfiguration config = ReplicationConfiguration.fromMap(ImmutableMap.of(
        ReplicationConfiguration.DATABASES, "*"));

    assertThat(config.databases, is(nullValue()));
  }

  @Test(expected = IllegalArgumentException.class)
  public void nonNumericPortsAreRejected() {
    ReplicationConfiguration.fromMap(ImmutableMap.of(ReplicationConfiguration.PORT, "ninety"));
  }
}
