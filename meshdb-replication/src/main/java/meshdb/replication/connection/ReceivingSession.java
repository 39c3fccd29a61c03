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

package meshdb.replication.connection;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import meshdb.interfaces.storage.AuditStore;
import meshdb.interfaces.storage.DecodedAuditEntry;
import meshdb.interfaces.storage.TableSchema;
import meshdb.interfaces.storage.TableStructure;
import meshdb.replication.wire.AuditEntryCodec;
import meshdb.replication.wire.ReplicationMessage;
import meshdb.replication.wire.ReplicationProtocolException;
import meshdb.util.FiberOnly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Receiving half of a subscription: keeps the per-table decoders the source describes in-band,
 * applies each transaction frame to the local store as one unit, and records the source's sequence
 * updates so that a reconnect resumes from the source's own log position.
 * <p>
 * Table dictionaries belong to one stream and are dropped on reconnect; sequences are kept in the
 * store.
 */
public class ReceivingSession {
  private static final Logger LOG = LoggerFactory.getLogger(ReceivingSession.class);
  private static final TableSchema DEFAULT_SCHEMA = new TableSchema("id", ImmutableList.of());

  private final String database;
  private final AuditStore store;
  private boolean replicateByDefault;
  private ImmutableSet<String> tables;

  private final Map<Integer, String> tableNames = new HashMap<>();
  private final Map<Integer, TableSchema> schemas = new HashMap<>();
  private final Map<Integer, TableStructure> structures = new HashMap<>();
  private final Map<Integer, Integer> localTableIds = new HashMap<>();
  private final Map<String, Double> sequences = new HashMap<>();

  public ReceivingSession(String database, AuditStore store, boolean replicateByDefault, ImmutableSet<String> tables) {
    this.database = database;
    this.store = store;
    this.replicateByDefault = replicateByDefault;
    this.tables = tables;
  }

  @FiberOnly
  public void setTableFilter(boolean replicateByDefault, ImmutableSet<String> tables) {
    this.replicateByDefault = replicateByDefault;
    this.tables = tables;
  }

  @FiberOnly
  public void resetStream() {
    tableNames.clear();
    schemas.clear();
    structures.clear();
    localTableIds.clear();
  }

  @FiberOnly
  public void onTableName(ReplicationMessage.TableName message) {
    tableNames.put(message.tableId, message.name);
    localTableIds.remove(message.tableId);
  }

  @FiberOnly
  public void onTableStructure(ReplicationMessage.TableStructureMessage message) {
    schemas.put(message.tableId, message.schema);
    localTableIds.remove(message.tableId);
  }

  @FiberOnly
  public void onFixedStructure(ReplicationMessage.TableFixedStructure message) {
    structures.put(message.tableId, message.structure);
  }

  /**
   * Decode and apply one transaction frame.
   *
   * @return the number of entries applied; entries for tables this subscription does not accept are
   * skipped.
   */
  @FiberOnly
  public int onTransaction(ReplicationMessage.Transaction txn) {
    List<DecodedAuditEntry> entries = new ArrayList<>(txn.records.size());
    for (ReplicationMessage.Record record : txn.records) {
      String table = tableNames.get(record.tableId);
      if (table == null) {
        throw new ReplicationProtocolException("record for table " + record.tableId + " before its name");
      }
      if (!accepts(table)) {
        continue;
      }
      TableStructure structure = structures.getOrDefault(record.tableId, TableStructure.EMPTY);
      entries.add(AuditEntryCodec.decode(localTableId(record.tableId, table), table, txn.txnTime,
          record.encoded, structure));
    }

    if (!entries.isEmpty()) {
      store.applyTransaction(database, txn.txnTime, entries);
    }
    LOG.trace("{}: applied {} of {} records at {}", database, entries.size(), txn.records.size(), txn.txnTime);
    return entries.size();
  }

  /**
   * The source has sent everything in its log up to the given local commit time. Every frame before
   * this update has already been applied, so the position can be made durable.
   */
  @FiberOnly
  public void onSequenceUpdate(String source, double sequenceId) {
    if (sequenceId > sequences.getOrDefault(source, 0.0)) {
      sequences.put(source, sequenceId);
      store.recordReceivedSequence(database, source, sequenceId);
    }
  }

  /**
   * Where to resume streaming the given node's log: the last sequence it reported, else the
   * newest write applied from it. A node logs its own writes at their version, so the fallback
   * can only replay.
   */
  @FiberOnly
  public double resumePoint(String node) {
    Double sequence = sequences.get(node);
    if (sequence != null) {
      return sequence;
    }
    double recorded = store.getReceivedSequence(database, node);
    return recorded > 0 ? recorded : store.getLastAppliedTime(database, node);
  }

  @FiberOnly
  public boolean accepts(String table) {
    return replicateByDefault || tables.contains(table);
  }

  private int localTableId(int remoteId, String table) {
    Integer local = localTableIds.get(remoteId);
    if (local == null) {
      local = store.ensureTable(database, table, schemas.getOrDefault(remoteId, DEFAULT_SCHEMA));
      localTableIds.put(remoteId, local);
    }
    return local;
  }
}
