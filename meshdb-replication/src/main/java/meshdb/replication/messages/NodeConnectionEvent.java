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

package meshdb.replication.messages;

import meshdb.interfaces.replication.ClusterStatus;

/**
 * Worker to coordinator: a subscription connection came up, went down, or measured a new latency.
 */
public final class NodeConnectionEvent {
  public enum Type {
    CONNECTED,
    DISCONNECTED,
  }

  public final Type type;
  public final String nodeName;
  public final String url;
  public final String database;
  /** One of the {@link ClusterStatus.DatabaseSocket} status names. */
  public final String status;
  /** Last measured round trip in milliseconds; only meaningful for CONNECTED. */
  public final double latency;
  /** The peer told us to stop (or we unsubscribed), so there is nothing to fail over. */
  public final boolean finished;

  public NodeConnectionEvent(Type type, String nodeName, String url, String database, String status,
                             double latency, boolean finished) {
    this.type = type;
    this.nodeName = nodeName;
    this.url = url;
    this.database = database;
    this.status = status;
    this.latency = latency;
    this.finished = finished;
  }

  public static NodeConnectionEvent connected(String nodeName, String url, String database, double latency) {
    return new NodeConnectionEvent(Type.CONNECTED, nodeName, url, database, ClusterStatus.DatabaseSocket.CONNECTED,
        latency, false);
  }

  public static NodeConnectionEvent disconnected(String nodeName, String url, String database, boolean finished) {
    return disconnected(nodeName, url, database, ClusterStatus.DatabaseSocket.DISCONNECTED, finished);
  }

  public static NodeConnectionEvent disconnected(String nodeName, String url, String database, String status,
                                                 boolean finished) {
    return new NodeConnectionEvent(Type.DISCONNECTED, nodeName, url, database, status, 0, finished);
  }

  @Override
  public String toString() {
    return "NodeConnectionEvent{" +
        "type=" + type +
        ", nodeName='" + nodeName + '\'' +
        ", url='" + url + '\'' +
        ", database='" + database + '\'' +
        ", status='" + status + '\'' +
        ", latency=" + latency +
        ", finished=" + finished +
        '}';
  }
}
