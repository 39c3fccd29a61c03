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

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * The storage engine as seen by replication. It persists records, keeps an ordered audit log of
 * committed writes, and applies replicated writes idempotently.
 */
public interface AuditStore {
  Set<String> databaseNames();

  /**
   * Time of the latest audit entry applied locally to the database, from any origin; 0 when empty.
   */
  double getLastAppliedTime(String database);

  /**
   * Time of the latest applied entry that originated at the given node; 0 when none.
   */
  double getLastAppliedTime(String database, String origin);

  /**
   * Applies every entry of one replicated transaction as a single atomic unit. Re-applying an
   * entry whose version is already present is a no-op.
   */
  void applyTransaction(String database, double txnTime, List<DecodedAuditEntry> entries);

  default void applyAuditEntry(String database, DecodedAuditEntry entry) {
    applyTransaction(database, entry.version, Collections.singletonList(entry));
  }

  /**
   * A finite snapshot of the audit entries committed locally at or after the given local time,
   * ordered by local commit time. Every entry committed later carries a strictly greater local
   * time than every entry already returned.
   */
  Iterator<AuditEntry> streamAuditEntriesSince(String database, double localTime);

  /**
   * The last sequence id a replication source reported for this database, in the source's local
   * commit time; 0 when nothing has been recorded.
   */
  double getReceivedSequence(String database, String source);

  /**
   * Records how far a replication source has been consumed. Only called after every transaction
   * the source sent before the sequence update has been applied.
   */
  void recordReceivedSequence(String database, String source, double sequence);

  @Nullable
  String tableName(String database, int tableId);

  @Nullable
  TableSchema tableSchema(String database, int tableId);

  TableStructure tableStructure(String database, int tableId);

  /**
   * Called by the receiving side so that decoded entries can name tables the local engine has not
   * seen yet. Returns the local id the engine uses for the table.
   */
  int ensureTable(String database, String tableName, TableSchema schema);

  void addCommitListener(String database, CommitListener listener);

  void removeCommitListener(String database, CommitListener listener);
}
