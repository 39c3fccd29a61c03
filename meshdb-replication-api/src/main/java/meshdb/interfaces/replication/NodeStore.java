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

/**
 * Durable table of node records, provided by the storage engine. Writes are expected to be
 * linearizable; the registry funnels every mutation through {@link #put} and {@link #delete}.
 */
public interface NodeStore {
  @Nullable
  NodeRecord get(String name);

  void put(NodeRecord record);

  /**
   * Removes the record and leaves a tombstone, so that {@link #isDeleted} reports true afterwards.
   */
  void delete(String name);

  /**
   * True if the record was explicitly deleted (as opposed to never having existed).
   */
  boolean isDeleted(String name);

  Iterable<NodeRecord> scan();
}
