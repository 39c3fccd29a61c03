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

/**
 * Snapshot answered by the cluster_status query.
 */
public final class ClusterStatus {
  public final String nodeName;
  public final boolean isEnabled;
  public final ImmutableList<Connection> connections;

  public ClusterStatus(String nodeName, boolean isEnabled, ImmutableList<Connection> connections) {
    this.nodeName = nodeName;
    this.isEnabled = isEnabled;
    this.connections = connections;
  }

  @Override
  public String toString() {
    return "ClusterStatus{" +
        "nodeName='" + nodeName + '\'' +
        ", isEnabled=" + isEnabled +
        ", connections=" + connections +
        '}';
  }

  public static final class Connection {
    public final String nodeName;
    public final String url;
    public final ImmutableList<DatabaseSocket> databaseSockets;

    public Connection(String nodeName, String url, ImmutableList<DatabaseSocket> databaseSockets) {
      this.nodeName = nodeName;
      this.url = url;
      this.databaseSockets = databaseSockets;
    }

    @Override
    public String toString() {
      return "Connection{" +
          "nodeName='" + nodeName + '\'' +
          ", url='" + url + '\'' +
          ", databaseSockets=" + databaseSockets +
          '}';
    }
  }

  public static final class DatabaseSocket {
    public static final String CONNECTING = "connecting";
    public static final String CONNECTED = "connected";
    public static final String DISCONNECTED = "disconnected";
    /** Nothing accepted the connection at the node's url. */
    public static final String NO_RESPONDERS = "no responders";
    /** The connection went silent and was closed. */
    public static final String TIMEOUT = "timeout";

    public final String database;
    public final boolean connected;
    public final String status;
    public final double latency;
    public final ImmutableList<String> nodes;

    public DatabaseSocket(String database, boolean connected, String status, double latency,
                          ImmutableList<String> nodes) {
      this.database = database;
      this.connected = connected;
      this.status = status;
      this.latency = latency;
      this.nodes = nodes;
    }

    @Override
    public String toString() {
      return "DatabaseSocket{" +
          "database='" + database + '\'' +
          ", connected=" + connected +
          ", status='" + status + '\'' +
          ", latency=" + latency +
          ", nodes=" + nodes +
          '}';
    }
  }
}
