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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import meshdb.InMemoryAuditStore;
import meshdb.interfaces.storage.AuditAction;
import meshdb.interfaces.storage.TableSchema;
import meshdb.interfaces.storage.TableStructure;
import meshdb.replication.wire.AuditEntryCodec;
import meshdb.replication.wire.ReplicationMessage;
import meshdb.replication.wire.ReplicationProtocolException;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class ReceivingSessionTest {
  private static final int REMOTE_USERS = 11;
  private static final int REMOTE_ORDERS = 12;
  private static final TableStructure FIELDS = new TableStructure(ImmutableList.of("name", "total"));

  private final InMemoryAuditStore store = new InMemoryAuditStore("node-a", "data");
  private final ReceivingSession session = new ReceivingSession("data", store, true, ImmutableSet.of());

  @Before
  public void describeTables() {
    describe(REMOTE_USERS, "users");
    describe(REMOTE_ORDERS, "orders");
  }

  private void describe(int tableId, String name) {
    session.onTableName(new ReplicationMessage.TableName(tableId, name));
    session.onTableStructure(new ReplicationMessage.TableStructureMessage(tableId,
        new TableSchema("id", ImmutableList.of("name", "total"))));
    session.onFixedStructure(new ReplicationMessage.TableFixedStructure(tableId, FIELDS));
  }

  private static ReplicationMessage.Record record(int tableId, String id, String origin, Map<String, String> values) {
    return new ReplicationMessage.Record(tableId, AuditEntryCodec.encode(AuditAction.PUT, id, origin, values, FIELDS));
  }

  @Test
  public void aTransactionIsAppliedAsOneUnit() {
    ReplicationMessage.Transaction txn = new ReplicationMessage.Transaction(100, ImmutableList.of(
        record(REMOTE_USERS, "u1", "node-b", ImmutableMap.of("name", "bo")),
        record(REMOTE_ORDERS, "o1", "node-b", ImmutableMap.of("total", "12"))));

    assertThat(session.onTransaction(txn), is(2));

    assertThat(store.getTransactionCount(), is(1));
    assertThat(store.get("data", "users", "u1"), is(ImmutableMap.of("name", "bo")));
    assertThat(store.get("data", "orders", "o1"), is(ImmutableMap.of("total", "12")));
  }

  @Test
  public void applyingTheSameTransactionTwiceChangesNothing() {
    ReplicationMessage.Transaction txn = new ReplicationMessage.Transaction(100, ImmutableList.of(
        record(REMOTE_USERS, "u1", "node-b", ImmutableMap.of("name", "bo"))));

    session.onTransaction(txn);
    session.onTransaction(txn);

    assertThat(store.getTransactionCount(), is(1));
    assertThat(store.rowCount("data", "users"), is(1));
  }

  @Test
  public void anOlderWriteDoesNotReplaceANewerOne() {
    session.onTransaction(new ReplicationMessage.Transaction(200, ImmutableList.of(
        record(REMOTE_USERS, "u1", "node-b", ImmutableMap.of("name", "newer")))));
    session.onTransaction(new ReplicationMessage.Transaction(150, ImmutableList.of(
        record(REMOTE_USERS, "u1", "node-c", ImmutableMap.of("name", "older")))));

    assertThat(store.get("data", "users", "u1"), is(ImmutableMap.of("name", "newer")));
  }

  @Test
  public void tablesOutsideTheFilterAreSkipped() {
    session.setTableFilter(false, ImmutableSet.of("users"));

    int applied = session.onTransaction(new ReplicationMessage.Transaction(300, ImmutableList.of(
        record(REMOTE_ORDERS, "o1", "node-d", ImmutableMap.of("total", "3")))));

    assertThat(applied, is(0));
    assertThat(store.get("data", "orders", "o1"), is(nullValue()));
    assertThat(store.getTransactionCount(), is(0));
  }

  @Test
  public void sequenceUpdatesMoveTheResumePointForwardAndAreRecorded() {
    session.onSequenceUpdate("node-b", 500);
    session.onSequenceUpdate("node-b", 400);

    assertThat(session.resumePoint("node-b"), is(500.0));
    assertThat(store.getReceivedSequence("data", "node-b"), is(500.0));
  }

  @Test
  public void transactionsDoNotMoveTheResumePoint() {
    session.onSequenceUpdate("node-b", 50);
    session.onTransaction(new ReplicationMessage.Transaction(5000, ImmutableList.of(
        record(REMOTE_USERS, "u1", "node-b", ImmutableMap.of("name", "bo")))));

    assertThat(session.resumePoint("node-b"), is(50.0));
  }

  @Test
  public void aNewSessionResumesFromTheRecordedSequence() {
    session.onSequenceUpdate("node-b", 640);

    ReceivingSession restarted = new ReceivingSession("data", store, true, ImmutableSet.of());

    assertThat(restarted.resumePoint("node-b"), is(640.0));
  }

  @Test
  public void withNoSequenceTheNewestAppliedWriteDecidesWhereToResume() {
    store.putFrom("node-e", 777, "data", "users", "u9", ImmutableMap.of("name", "eve"));

    assertThat(session.resumePoint("node-e"), is(777.0));
    assertThat(session.resumePoint("node-f"), is(0.0));
  }

  @Test(expected = ReplicationProtocolException.class)
  public void recordsForAnUnnamedTableAreAProtocolError() {
    session.resetStream();

    session.onTransaction(new ReplicationMessage.Transaction(100, ImmutableList.of(
        record(REMOTE_USERS, "u1", "node-b", ImmutableMap.of("name", "bo")))));
  }
}
