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
import com.google.common.collect.ImmutableMap;
import meshdb.interfaces.storage.AuditAction;
import meshdb.interfaces.storage.DecodedAuditEntry;
import meshdb.interfaces.storage.TableStructure;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class AuditEntryCodecTest {
  private final TableStructure structure = new TableStructure(ImmutableList.of("name", "email", "age"));

  @Test
  public void entriesDecodeAgainstTheTablesFieldDictionary() {
    byte[] encoded = AuditEntryCodec.encode(AuditAction.PUT, "user-1", "node-b",
        ImmutableMap.of("email", "bo@example.com", "age", "41"), structure);

    DecodedAuditEntry entry = AuditEntryCodec.decode(5, "users", 1234.0, encoded, structure);

    assertThat(entry, is(new DecodedAuditEntry(5, "users", "user-1", AuditAction.PUT, 1234.0, "node-b",
        ImmutableMap.of("email", "bo@example.com", "age", "41"))));
  }

  @Test
  public void deletesCarryNoValues() {
    byte[] encoded = AuditEntryCodec.encode(AuditAction.DELETE, "user-1", "node-b", ImmutableMap.of(), structure);

    DecodedAuditEntry entry = AuditEntryCodec.decode(5, "users", 10, encoded, TableStructure.EMPTY);

    assertThat(entry.action, is(AuditAction.DELETE));
    assertThat(entry.values.isEmpty(), is(true));
  }

  @Test(expected = IllegalArgumentException.class)
  public void fieldsMissingFromTheDictionaryCannotBeEncoded() {
    AuditEntryCodec.encode(AuditAction.PUT, "user-1", "node-b", ImmutableMap.of("phone", "555"), structure);
  }

  @Test(expected = ReplicationProtocolException.class)
  public void anIndexPastAnOutdatedDictionaryIsAProtocolError() {
    byte[] encoded = AuditEntryCodec.encode(AuditAction.PUT, "user-1", "node-b",
        ImmutableMap.of("age", "41"), structure);

    AuditEntryCodec.decode(5, "users", 10, encoded, new TableStructure(ImmutableList.of("name")));
  }
}
