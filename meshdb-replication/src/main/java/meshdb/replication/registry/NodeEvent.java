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

import meshdb.interfaces.replication.NodeRecord;
import org.jetbrains.annotations.Nullable;

/**
 * A change to the node registry. Delete events carry the record as it was before removal (when it
 * was known) so that listeners can tell which connections it affected.
 */
public final class NodeEvent {
  public enum Type {
    PUT,
    DELETE,
  }

  public final Type type;
  public final String name;
  @Nullable
  public final NodeRecord value;
  /** True for the synthetic deliveries of existing rows that precede live events. */
  public final boolean initial;

  public NodeEvent(Type type, String name, @Nullable NodeRecord value, boolean initial) {
    this.type = type;
    this.name = name;
    this.value = value;
    this.initial = initial;
  }

  @Override
  public String toString() {
    return "NodeEvent{" +
        "type=" + type +
        ", name='" + name + '\'' +
        ", initial=" + initial +
        ", value=" + value +
        '}';
  }
}
