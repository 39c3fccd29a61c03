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

package meshdb.interfaces.storage;

import com.google.common.collect.ImmutableMap;

import java.util.Objects;

/**
 * An audit entry after the receiving side decoded it with the table's structure.
 */
public final class DecodedAuditEntry {
  public final int tableId;
  public final String table;
  public final String id;
  public final AuditAction action;
  public final double version;
  public final String origin;
  public final ImmutableMap<String, String> values;

  public DecodedAuditEntry(int tableId,
                           String table,
                           String id,
                           AuditAction action,
                           double version,
                           String origin,
                           ImmutableMap<String, String> values) {
    this.tableId = tableId;
    this.table = table;
    this.id = id;
    this.action = action;
    this.version = version;
    this.origin = origin;
    this.values = values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DecodedAuditEntry)) {
      return false;
    }
    DecodedAuditEntry that = (DecodedAuditEntry) o;
    return tableId == that.tableId
        && Double.compare(that.version, version) == 0
        && table.equals(that.table)
        && id.equals(that.id)
        && action == that.action
        && origin.equals(that.origin)
        && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tableId, table, id, action, version, origin, values);
  }

  @Override
  public String toString() {
    return "DecodedAuditEntry{" +
        "table='" + table + '\'' +
        ", id='" + id + '\'' +
        ", action=" + action +
        ", version=" + version +
        ", origin='" + origin + '\'' +
        ", values=" + values +
        '}';
  }
}
