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

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One entry of a node's subscription list. A null table means the whole database.
 */
public final class NodeSubscription {
  public final String database;
  @Nullable
  public final String table;
  public final boolean publish;
  public final boolean subscribe;
  @Nullable
  public final Double startTime;

  public NodeSubscription(String database,
                          @Nullable String table,
                          boolean publish,
                          boolean subscribe,
                          @Nullable Double startTime) {
    this.database = Objects.requireNonNull(database, "database");
    this.table = table;
    this.publish = publish;
    this.subscribe = subscribe;
    this.startTime = startTime;
  }

  public NodeSubscription(String database, boolean publish, boolean subscribe) {
    this(database, null, publish, subscribe, null);
  }

  /**
   * Subscription lists are merged by this key.
   */
  public String key() {
    return table == null ? database : database + "." + table;
  }

  /**
   * The same subscription as seen from the other end of the link: what we publish, they subscribe to.
   */
  public NodeSubscription reversed() {
    return new NodeSubscription(database, table, subscribe, publish, startTime);
  }

  public NodeSubscription withFlags(boolean publish, boolean subscribe) {
    return new NodeSubscription(database, table, publish, subscribe, startTime);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NodeSubscription)) {
      return false;
    }
    NodeSubscription that = (NodeSubscription) o;
    return publish == that.publish
        && subscribe == that.subscribe
        && database.equals(that.database)
        && Objects.equals(table, that.table)
        && Objects.equals(startTime, that.startTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(database, table, publish, subscribe, startTime);
  }

  @Override
  public String toString() {
    return "NodeSubscription{" +
        "database='" + database + '\'' +
        ", table='" + table + '\'' +
        ", publish=" + publish +
        ", subscribe=" + subscribe +
        ", startTime=" + startTime +
        '}';
  }
}
