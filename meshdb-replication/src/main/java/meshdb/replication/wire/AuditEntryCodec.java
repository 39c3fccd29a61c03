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

package meshdb.replication.wire;

import com.google.common.collect.ImmutableMap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import meshdb.interfaces.storage.AuditAction;
import meshdb.interfaces.storage.DecodedAuditEntry;
import meshdb.interfaces.storage.TableStructure;

import java.util.Map;

/**
 * Layout of an encoded audit entry: action code, record id, origin node, then (field index, value)
 * pairs where the index refers to the table's fixed structure. Entries for the same record start with
 * the same bytes, which is what the transaction frame's prefix compaction exploits.
 */
public final class AuditEntryCodec {
  private AuditEntryCodec() {
  }

  /**
   * @throws IllegalArgumentException if a value names a field the structure does not have.
   */
  public static byte[] encode(AuditAction action,
                              String id,
                              String origin,
                              Map<String, String> values,
                              TableStructure structure) {
    ByteBuf out = Unpooled.buffer();
    try {
      out.writeByte(action.code);
      WireFormat.writeString(out, id);
      WireFormat.writeString(out, origin);
      for (Map.Entry<String, String> field : values.entrySet()) {
        int index = structure.indexOf(field.getKey());
        if (index < 0) {
          throw new IllegalArgumentException("field " + field.getKey() + " is not in " + structure);
        }
        WireFormat.writeVarint(out, index);
        WireFormat.writeString(out, field.getValue());
      }
      return WireFormat.readRemaining(out);
    } finally {
      out.release();
    }
  }

  public static DecodedAuditEntry decode(int tableId,
                                         String table,
                                         double txnTime,
                                         byte[] encoded,
                                         TableStructure structure) {
    ByteBuf in = Unpooled.wrappedBuffer(encoded);
    try {
      AuditAction action = AuditAction.fromCode(in.readUnsignedByte());
      String id = WireFormat.readString(in);
      String origin = WireFormat.readString(in);
      ImmutableMap.Builder<String, String> values = ImmutableMap.builder();
      while (in.isReadable()) {
        int index = WireFormat.readVarint(in);
        values.put(structure.fieldName(index), WireFormat.readString(in));
      }
      return new DecodedAuditEntry(tableId, table, id, action, txnTime, origin, values.build());
    } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
      throw new ReplicationProtocolException("undecodable audit entry for table " + table, e);
    }
  }
}
