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

import com.google.common.collect.ImmutableList;
import meshdb.interfaces.storage.TableSchema;
import meshdb.interfaces.storage.TableStructure;
import meshdb.replication.messages.NodeTarget;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * A decoded replication frame. Each subclass maps to one opcode, except {@link Transaction}, which is
 * every frame that starts with a transaction time.
 */
public abstract class ReplicationMessage {
  ReplicationMessage() {
  }

  public static final class NodeName extends ReplicationMessage {
    public final String name;

    public NodeName(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return "NodeName{" + name + '}';
    }
  }

  /**
   * With no node list the subscriber wants the source's own writes from startTime. A node list names
   * the origins it wants and over which window; an empty list stops the stream.
   */
  public static final class Subscribe extends ReplicationMessage {
    public final String database;
    public final double startTime;
    @Nullable
    public final ImmutableList<NodeTarget> nodes;

    public Subscribe(String database, double startTime, @Nullable ImmutableList<NodeTarget> nodes) {
      this.database = database;
      this.startTime = startTime;
      this.nodes = nodes;
    }

    public Subscribe(String database, double startTime) {
      this(database, startTime, null);
    }

    @Override
    public String toString() {
      return "Subscribe{" +
          "database='" + database + '\'' +
          ", startTime=" + startTime +
          ", nodes=" + nodes +
          '}';
    }
  }

  public static final class Disconnect extends ReplicationMessage {
    public final String reason;

    public Disconnect(String reason) {
      this.reason = reason;
    }

    @Override
    public String toString() {
      return "Disconnect{" + reason + '}';
    }
  }

  public static final class SequenceIdUpdate extends ReplicationMessage {
    public final double sequenceId;

    public SequenceIdUpdate(double sequenceId) {
      this.sequenceId = sequenceId;
    }

    @Override
    public String toString() {
      return "SequenceIdUpdate{" + sequenceId + '}';
    }
  }

  /**
   * Keepalive from the subscribing side. The time is the sender's own monotonic clock in
   * milliseconds and is only ever compared on the sender.
   */
  public static final class Ping extends ReplicationMessage {
    public final double sentTime;

    public Ping(double sentTime) {
      this.sentTime = sentTime;
    }

    @Override
    public String toString() {
      return "Ping{" + sentTime + '}';
    }
  }

  /**
   * Echoes the time of the {@link Ping} it answers.
   */
  public static final class Pong extends ReplicationMessage {
    public final double sentTime;

    public Pong(double sentTime) {
      this.sentTime = sentTime;
    }

    @Override
    public String toString() {
      return "Pong{" + sentTime + '}';
    }
  }

  public static final class CommittedUpdate extends ReplicationMessage {
    public final double txnTime;

    public CommittedUpdate(double txnTime) {
      this.txnTime = txnTime;
    }

    @Override
    public String toString() {
      return "CommittedUpdate{" + txnTime + '}';
    }
  }

  public static final class TableName extends ReplicationMessage {
    public final int tableId;
    public final String name;

    public TableName(int tableId, String name) {
      this.tableId = tableId;
      this.name = name;
    }

    @Override
    public String toString() {
      return "TableName{" + tableId + "=" + name + '}';
    }
  }

  public static final class TableStructureMessage extends ReplicationMessage {
    public final int tableId;
    public final TableSchema schema;

    public TableStructureMessage(int tableId, TableSchema schema) {
      this.tableId = tableId;
      this.schema = schema;
    }

    @Override
    public String toString() {
      return "TableStructure{" + tableId + "=" + schema + '}';
    }
  }

  public static final class TableFixedStructure extends ReplicationMessage {
    public final int tableId;
    public final TableStructure structure;

    public TableFixedStructure(int tableId, TableStructure structure) {
      this.tableId = tableId;
      this.structure = structure;
    }

    @Override
    public String toString() {
      return "TableFixedStructure{" + tableId + "=" + structure + '}';
    }
  }

  /**
   * All records of one committed transaction. The time is written once for the frame.
   */
  public static final class Transaction extends ReplicationMessage {
    public final double txnTime;
    public final ImmutableList<Record> records;

    public Transaction(double txnTime, ImmutableList<Record> records) {
      if (txnTime < 0 || Double.isNaN(txnTime)) {
        throw new IllegalArgumentException("transaction time must be a non-negative number: " + txnTime);
      }
      this.txnTime = txnTime;
      this.records = records;
    }

    @Override
    public String toString() {
      return "Transaction{txnTime=" + txnTime + ", records=" + records.size() + '}';
    }
  }

  public static final class Record {
    public final int tableId;
    public final byte[] encoded;

    public Record(int tableId, byte[] encoded) {
      this.tableId = tableId;
      this.encoded = encoded;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Record)) {
        return false;
      }
      Record that = (Record) o;
      return tableId == that.tableId && Arrays.equals(encoded, that.encoded);
    }

    @Override
    public int hashCode() {
      return 31 * tableId + Arrays.hashCode(encoded);
    }

    @Override
    public String toString() {
      return "Record{tableId=" + tableId + ", length=" + encoded.length + '}';
    }
  }

  public static final class OperationRequest extends ReplicationMessage {
    public final int requestId;
    public final OperationEnvelope envelope;

    public OperationRequest(int requestId, OperationEnvelope envelope) {
      this.requestId = requestId;
      this.envelope = envelope;
    }

    @Override
    public String toString() {
      return "OperationRequest{" + requestId + ", " + envelope + '}';
    }
  }

  public static final class OperationResponse extends ReplicationMessage {
    public final int requestId;
    public final OperationEnvelope envelope;

    public OperationResponse(int requestId, OperationEnvelope envelope) {
      this.requestId = requestId;
      this.envelope = envelope;
    }

    @Override
    public String toString() {
      return "OperationResponse{" + requestId + ", " + envelope + '}';
    }
  }
}
