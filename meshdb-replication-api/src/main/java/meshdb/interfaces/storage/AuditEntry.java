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

/**
 * One committed write as the storage engine hands it to replication: the encoded bytes are opaque
 * to the connection layer and are decoded on the receiving side against the table's structure.
 * <p>
 * {@code txnTime} is the version assigned by the originating node. {@code localTime} is when this
 * node committed the entry to its own log; it orders the log and is the sequence a sending
 * connection reports to its subscriber.
 */
public final class AuditEntry {
  public final double txnTime;
  public final double localTime;
  public final int tableId;
  public final String origin;
  public final byte[] encoded;

  public AuditEntry(double txnTime, double localTime, int tableId, String origin, byte[] encoded) {
    this.txnTime = txnTime;
    this.localTime = localTime;
    this.tableId = tableId;
    this.origin = origin;
    this.encoded = encoded;
  }

  @Override
  public String toString() {
    return "AuditEntry{" +
        "txnTime=" + txnTime +
        ", localTime=" + localTime +
        ", tableId=" + tableId +
        ", origin='" + origin + '\'' +
        ", encodedLength=" + encoded.length +
        '}';
  }
}
