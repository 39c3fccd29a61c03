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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Coordinator to worker: open (or update) the subscription for a database on the connection to the
 * first node of the list.
 */
public final class SubscribeToNode {
  public final String database;
  public final ImmutableList<NodeTarget> nodes;
  public final boolean replicateByDefault;
  /** Tables to accept when not replicating by default. */
  public final ImmutableSet<String> tables;

  public SubscribeToNode(String database,
                         ImmutableList<NodeTarget> nodes,
                         boolean replicateByDefault,
                         ImmutableSet<String> tables) {
    if (nodes.isEmpty()) {
      throw new IllegalArgumentException("a subscription needs at least one node");
    }
    this.database = database;
    this.nodes = nodes;
    this.replicateByDefault = replicateByDefault;
    this.tables = tables;
  }

  public NodeTarget primary() {
    return nodes.get(0);
  }

  @Override
  public String toString() {
    return "SubscribeToNode{" +
        "database='" + database + '\'' +
        ", nodes=" + nodes +
        ", replicateByDefault=" + replicateByDefault +
        ", tables=" + tables +
        '}';
  }
}
