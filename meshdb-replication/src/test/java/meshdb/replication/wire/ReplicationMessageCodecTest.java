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
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import meshdb.interfaces.replication.NodeSubscription;
import meshdb.interfaces.storage.AuditAction;
import meshdb.interfaces.storage.TableSchema;
import meshdb.interfaces.storage.TableStructure;
import meshdb.replication.connection.ReplicationPipeline;
import meshdb.replication.messages.NodeTarget;
import org.junit.After;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.nullValue;

public class ReplicationMessageCodecTest {
  private final EmbeddedChannel sender = pipeline();
  private final EmbeddedChannel receiver = pipeline();

  private static EmbeddedChannel pipeline() {
    EmbeddedChannel channel = new EmbeddedChannel();
    ReplicationPipeline.configure(channel.pipeline(), null, new ChannelInboundHandlerAdapter());
    return channel;
  }

  @After
  public void closeChannels() {
    sender.finishAndReleaseAll();
    receiver.finishAndReleaseAll();
  }

  @SuppressWarnings("unchecked")
  private <T extends ReplicationMessage> T sendThrough(ReplicationMessage message) {
    sender.writeOutbound(message);
    ByteBuf framed = sender.readOutbound();
    receiver.writeInbound(framed);
    return (T) receiver.readInbound();
  }

  private static ByteBuf encode(ReplicationMessage message) {
    ByteBuf out = Unpooled.buffer();
    ReplicationMessageEncoder.encode(message, out);
    return out;
  }

  @Test
  public void aPlainSubscribeIsOpcodeDatabaseAndStartTime() {
    ByteBuf frame = encode(new ReplicationMessage.Subscribe("data", 1500.25));

    assertThat(frame.readUnsignedByte(), is((short) ReplicationOpcodes.SUBSCRIBE));
    assertThat(frame.readUnsignedByte(), is((short) 4));
    assertThat(frame.readCharSequence(4, StandardCharsets.UTF_8).toString(), is("data"));
    assertThat(frame.readDouble(), is(1500.25));
    assertThat(frame.isReadable(), is(false));
    frame.release();
  }

  @Test
  public void aSubscribeCarriesItsOriginWindows() {
    ReplicationMessage.Subscribe subscribe = sendThrough(new ReplicationMessage.Subscribe("data", 10,
        ImmutableList.of(new NodeTarget("node-b", null, 10, 0), new NodeTarget("node-c", null, 5, 20))));

    assertThat(subscribe.database, is("data"));
    assertThat(subscribe.nodes, contains(new NodeTarget("node-b", null, 10, 0), new NodeTarget("node-c", null, 5, 20)));
  }

  @Test
  public void anEmptyNodeListSurvivesAsAnUnsubscribe() {
    ReplicationMessage.Subscribe subscribe = sendThrough(new ReplicationMessage.Subscribe("data", 0, ImmutableList.of()));

    assertThat(subscribe.nodes, is(empty()));
  }

  @Test
  public void aSubscribeWithoutANodeListMeansOwnWrites() {
    ReplicationMessage.Subscribe subscribe = sendThrough(new ReplicationMessage.Subscribe("data", 0));

    assertThat(subscribe.nodes, is(nullValue()));
  }

  @Test
  public void pingAndPongCarryOnlyTheSendTime() {
    ByteBuf frame = encode(new ReplicationMessage.Ping(42.5));

    assertThat(frame.readUnsignedByte(), is((short) ReplicationOpcodes.PING));
    assertThat(frame.readDouble(), is(42.5));
    assertThat(frame.isReadable(), is(false));
    frame.release();

    ReplicationMessage.Pong pong = sendThrough(new ReplicationMessage.Pong(42.5));
    assertThat(pong.sentTime, is(42.5));
  }

  @Test
  public void transactionFramesStartWithTheTimeNotAnOpcode() {
    ByteBuf frame = encode(new ReplicationMessage.Transaction(1.7e12, ImmutableList.of(
        new ReplicationMessage.Record(3, new byte[]{1, 2, 3}))));

    assertThat(ReplicationOpcodes.isControl(frame.getUnsignedByte(0)), is(false));
    assertThat(frame.readDouble(), is(1.7e12));
    frame.release();
  }

  @Test
  public void recordsOfOneTransactionOnlyCarryWhatDiffersFromThePreviousRecord() {
    TableStructure structure = new TableStructure(ImmutableList.of("name", "email"));
    byte[] first = AuditEntryCodec.encode(AuditAction.PUT, "user-1", "node-a",
        ImmutableMap.of("name", "ann"), structure);
    byte[] second = AuditEntryCodec.encode(AuditAction.PUT, "user-1", "node-a",
        ImmutableMap.of("email", "ann@example.com"), structure);
    ReplicationMessage.Transaction txn = new ReplicationMessage.Transaction(42, ImmutableList.of(
        new ReplicationMessage.Record(1, first), new ReplicationMessage.Record(1, second)));

    ByteBuf frame = encode(txn);
    int compacted = frame.readableBytes();
    ReplicationMessage.Transaction decoded = (ReplicationMessage.Transaction) ReplicationMessageDecoder.decode(frame);
    frame.release();

    assertThat(compacted, is(lessThan(8 + first.length + second.length + 6)));
    assertThat(decoded.txnTime, is(42.0));
    assertThat(decoded.records, contains(txn.records.get(0), txn.records.get(1)));
  }

  @Test
  public void tableDescriptionsCarrySchemaAndFieldDictionary() {
    TableSchema schema = new TableSchema("id", ImmutableList.of("name", "email"));
    ReplicationMessage.TableStructureMessage described = sendThrough(new ReplicationMessage.TableStructureMessage(7, schema));
    ReplicationMessage.TableFixedStructure fixed = sendThrough(new ReplicationMessage.TableFixedStructure(7,
        new TableStructure(ImmutableList.of("name", "email", "age"))));

    assertThat(described.tableId, is(7));
    assertThat(described.schema.primaryKey, is("id"));
    assertThat(described.schema.attributes, contains("name", "email"));
    assertThat(fixed.structure.fieldNames, contains("name", "email", "age"));
  }

  @Test
  public void operationRequestsCarryTheirEnvelope() {
    OperationEnvelope envelope = OperationEnvelope.request(OperationEnvelope.ADD_NODE_BACK);
    envelope.nodeName = "node-a";
    envelope.url = "tcp://node-a:9925";
    envelope.setSubscriptions(ImmutableList.of(new NodeSubscription("data", "users", true, false, 12.5)));

    ReplicationMessage.OperationRequest request = sendThrough(new ReplicationMessage.OperationRequest(9, envelope));

    assertThat(request.requestId, is(9));
    assertThat(request.envelope.operation, is(OperationEnvelope.ADD_NODE_BACK));
    assertThat(request.envelope.url, is("tcp://node-a:9925"));
    assertThat(request.envelope.toSubscriptions(),
        contains(new NodeSubscription("data", "users", true, false, 12.5)));
  }

  @Test
  public void failedOperationsCarryTheirError() {
    ReplicationMessage.OperationResponse response = sendThrough(
        new ReplicationMessage.OperationResponse(3, OperationEnvelope.failure("no such node")));

    assertThat(response.envelope.isError(), is(true));
    assertThat(response.envelope.error, is("no such node"));
  }

  @Test
  public void disconnectReasonsAreReadable() {
    ReplicationMessage.Disconnect disconnect = sendThrough(new ReplicationMessage.Disconnect("not authorized"));

    assertThat(disconnect.reason, is("not authorized"));
  }

  @Test(expected = ReplicationProtocolException.class)
  public void unknownOpcodesAreAProtocolError() {
    ReplicationMessageDecoder.decode(Unpooled.wrappedBuffer(new byte[]{(byte) 200, 1, 2}));
  }

  @Test(expected = ReplicationProtocolException.class)
  public void emptyFramesAreAProtocolError() {
    ReplicationMessageDecoder.decode(Unpooled.EMPTY_BUFFER);
  }

  @Test(expected = ReplicationProtocolException.class)
  public void truncatedFramesAreAProtocolError() {
    ByteBuf frame = encode(new ReplicationMessage.SequenceIdUpdate(99));
    ReplicationMessageDecoder.decode(frame.slice(0, 5));
  }

  @Test(expected = ReplicationProtocolException.class)
  public void aRecordCannotShareBytesWithoutAPreviousRecord() {
    ByteBuf frame = Unpooled.buffer();
    frame.writeDouble(10);
    WireFormat.writeVarint(frame, 1);
    WireFormat.writeVarint(frame, 4);
    WireFormat.writeVarint(frame, 0);
    ReplicationMessageDecoder.decode(frame);
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativeTransactionTimesCannotBeSent() {
    new ReplicationMessage.Transaction(-1, ImmutableList.of());
  }

  @Test
  public void aProtocolErrorInThePipelineSurfacesAsAnException() {
    ByteBuf bad = Unpooled.buffer();
    bad.writeByte(2);
    bad.writeByte(201);
    bad.writeByte(0);

    try {
      receiver.writeInbound(bad);
      throw new AssertionError("expected a protocol error");
    } catch (ReplicationProtocolException e) {
      assertThat(e, is(instanceOf(ReplicationProtocolException.class)));
    }
  }

  @Test
  public void varintsUseSevenBitGroups() {
    ByteBuf buf = Unpooled.buffer();
    WireFormat.writeVarint(buf, 300);

    assertThat(buf.readableBytes(), is(2));
    assertThat(WireFormat.readVarint(buf), is(300));
    buf.release();
  }
}
