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
import meshdb.interfaces.replication.NodeRecord;
import meshdb.interfaces.replication.NodeStore;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * NodeStore kept in memory, for embedding without a storage engine and for tests.
 */
public class InMemoryNodeStore implements NodeStore {
  private final Map<String, NodeRecord> records = new TreeMap<>();
  private final Set<String> tombstones = new HashSet<>();

  @Nullable
  @Override
  public synchronized NodeRecord get(String name) {
    return records.get(name);
  }

  @Override
  public synchronized void put(NodeRecord record) {
    tombstones.remove(record.name);
    records.put(record.name, record);
  }

  @Override
  public synchronized void delete(String name) {
    records.remove(name);
    tombstones.add(name);
  }

  @Override
  public synchronized boolean isDeleted(String name) {
    return tombstones.contains(name);
  }

  @Override
  public synchronized Iterable<NodeRecord> scan() {
    return ImmutableList.copyOf(records.values());
  }
}
