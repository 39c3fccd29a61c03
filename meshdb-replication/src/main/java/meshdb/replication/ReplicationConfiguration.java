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

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import meshdb.ReplicationConstants;
import meshdb.replication.registry.NodeNames;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Replication settings, read from the replication.* keys of the server configuration. Reading the
 * configuration file itself is someone else's job; this only interprets the values.
 */
public final class ReplicationConfiguration {
  public static final String NODE_NAME = "replication.nodename";
  public static final String URL = "replication.url";
  public static final String PORT = "replication.port";
  public static final String SECURE_PORT = "replication.secureport";
  public static final String DATABASES = "replication.databases";
  public static final String ROUTES = "replication.routes";
  public static final String WORKERS = "replication.workers";
  public static final String SUBSCRIBE_DELAY = "replication.subscribeDelayMs";
  public static final String RECONNECT_DELAY = "replication.reconnectDelayMs";
  public static final String COMMITTED_UPDATE_DELAY = "replication.committedUpdateDelayMs";
  public static final String PING_INTERVAL = "replication.pingIntervalMs";
  public static final String CONFIRMATION_FILE = "replication.confirmationFile";

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  public final String nodeName;
  @Nullable
  public final String url;
  public final int port;
  @Nullable
  public final Integer securePort;
  /** Null means every database. */
  @Nullable
  public final ImmutableList<String> databases;
  public final ImmutableList<String> routes;
  public final int workerCount;
  public final long subscribeDelayMillis;
  public final long reconnectDelayMillis;
  public final long committedUpdateDelayMillis;
  public final long pingIntervalMillis;
  @Nullable
  public final String confirmationFile;

  private ReplicationConfiguration(Map<String, String> values) {
    this.url = Strings.emptyToNull(values.get(URL));
    this.port = intValue(values, PORT, ReplicationConstants.REPLICATION_DEFAULT_PORT);
    String secure = values.get(SECURE_PORT);
    this.securePort = Strings.isNullOrEmpty(secure) ? null : Integer.parseInt(secure.trim());
    String configuredName = Strings.emptyToNull(values.get(NODE_NAME));
    if (configuredName != null) {
      this.nodeName = configuredName;
    } else if (url != null) {
      this.nodeName = NodeNames.urlToNodeName(url);
    } else {
      this.nodeName = ReplicationConstants.REPLICATION_DEFAULT_NODE_NAME;
    }
    String databaseList = Strings.nullToEmpty(values.get(DATABASES)).trim();
    this.databases = databaseList.isEmpty() || databaseList.equals("*")
        ? null
        : ImmutableList.copyOf(LIST_SPLITTER.split(databaseList));
    this.routes = ImmutableList.copyOf(LIST_SPLITTER.split(Strings.nullToEmpty(values.get(ROUTES))));
    this.workerCount = intValue(values, WORKERS, ReplicationConstants.REPLICATION_DEFAULT_WORKER_COUNT);
    this.subscribeDelayMillis = intValue(values, SUBSCRIBE_DELAY,
        ReplicationConstants.REPLICATION_SUBSCRIBE_DELAY_MILLISECONDS);
    this.reconnectDelayMillis = intValue(values, RECONNECT_DELAY,
        ReplicationConstants.REPLICATION_RECONNECT_DELAY_MILLISECONDS);
    this.committedUpdateDelayMillis = intValue(values, COMMITTED_UPDATE_DELAY,
        ReplicationConstants.REPLICATION_COMMITTED_UPDATE_DELAY_MILLISECONDS);
    this.pingIntervalMillis = intValue(values, PING_INTERVAL,
        ReplicationConstants.REPLICATION_PING_INTERVAL_MILLISECONDS);
    this.confirmationFile = Strings.emptyToNull(values.get(CONFIRMATION_FILE));
  }

  public static ReplicationConfiguration fromMap(Map<String, String> values) {
    return new ReplicationConfiguration(values);
  }

  public static ReplicationConfiguration defaults() {
    return new ReplicationConfiguration(ImmutableMap.of());
  }

  /**
   * The URL other nodes use to reach this one: the configured URL, else one built from the node name
   * and the plain or secure replication port.
   */
  public String thisNodeUrl() {
    if (url != null) {
      return url;
    }
    if (securePort != null) {
      return NodeNames.TLS_SCHEME + "://" + nodeName + ":" + securePort;
    }
    return NodeNames.TCP_SCHEME + "://" + nodeName + ":" + port;
  }

  public int listenPort() {
    return securePort != null ? securePort : port;
  }

  public boolean replicatesDatabase(String database) {
    return databases == null || databases.contains(database);
  }

  private static int intValue(Map<String, String> values, String key, int defaultValue) {
    String value = values.get(key);
    if (Strings.isNullOrEmpty(value)) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Configuration value " + key + " is not a number: " + value, e);
    }
  }

  @Override
  public String toString() {
    return "ReplicationConfiguration{" +
        "nodeName='" + nodeName + '\'' +
        ", url='" + url + '\'' +
        ", port=" + port +
        ", securePort=" + securePort +
        ", databases=" + databases +
        ", routes=" + routes +
        ", workerCount=" + workerCount +
        '}';
  }
}
