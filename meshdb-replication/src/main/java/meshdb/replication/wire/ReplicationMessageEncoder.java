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

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import meshdb.replication.messages.NodeTarget;

import java.nio.charset.StandardCharsets;

/**
 * Writes one frame body per message; the length prefix is added further down the pipeline.
 */
@ChannelHandler.Sharable
public class ReplicationMessageEncoder extends MessageToByteEncoder<ReplicationMessage> {

  @Override
  protected void encode(ChannelHandlerContext ctx, ReplicationMessage msg, ByteBuf out) throws Exception {
    encode(msg, out);
  }

  public static void encode(ReplicationMessage msg, ByteBuf out) {
    if (msg instanceof ReplicationMessage.Transaction) {
      encodeTransaction((ReplicationMessage.Transaction) msg, out);
    } else if (msg instanceof ReplicationMessage.Subscribe) {
      ReplicationMessage.Subscribe subscribe = (ReplicationMessage.Subscribe) msg;
      out.writeByte(ReplicationOpcodes.SUBSCRIBE);
      WireFormat.writeShortString(out, subscribe.database);
      out.writeDouble(subscribe.startTime);
      if (subscribe.nodes != null) {
        out.writeShort(subscribe.nodes.size());
        for (NodeTarget node : subscribe.nodes) {
          WireFormat.writeShortString(out, node.name);
          out.writeDouble(node.startTime);
          out.writeDouble(node.endTime);
        }
      }
    } else if (msg instanceof ReplicationMessage.NodeName) {
      out.writeByte(ReplicationOpcodes.NODE_NAME);
      WireFormat.writeShortString(out, ((ReplicationMessage.NodeName) msg).name);
    } else if (msg instanceof ReplicationMessage.Disconnect) {
      out.writeByte(ReplicationOpcodes.DISCONNECT);
      out.writeBytes(((ReplicationMessage.Disconnect) msg).reason.getBytes(StandardCharsets.UTF_8));
    } else if (msg instanceof ReplicationMessage.SequenceIdUpdate) {
      out.writeByte(ReplicationOpcodes.SEQUENCE_ID_UPDATE);
      out.writeDouble(((ReplicationMessage.SequenceIdUpdate) msg).sequenceId);
    } else if (msg instanceof ReplicationMessage.CommittedUpdate) {
      out.writeByte(ReplicationOpcodes.COMMITTED_UPDATE);
      out.writeDouble(((ReplicationMessage.CommittedUpdate) msg).txnTime);
    } else if (msg instanceof ReplicationMessage.Ping) {
      out.writeByte(ReplicationOpcodes.PING);
      out.writeDouble(((ReplicationMessage.Ping) msg).sentTime);
    } else if (msg instanceof ReplicationMessage.Pong) {
      out.writeByte(ReplicationOpcodes.PONG);
      out.writeDouble(((ReplicationMessage.Pong) msg).sentTime);
    } else if (msg instanceof ReplicationMessage.TableName) {
      ReplicationMessage.TableName tableName = (ReplicationMessage.TableName) msg;
      out.writeByte(ReplicationOpcodes.SEND_TABLE_NAME);
      WireFormat.writeVarint(out, tableName.tableId);
      WireFormat.writeString(out, tableName.name);
    } else if (msg instanceof ReplicationMessage.TableStructureMessage) {
      ReplicationMessage.TableStructureMessage structure = (ReplicationMessage.TableStructureMessage) msg;
      out.writeByte(ReplicationOpcodes.SEND_TABLE_STRUCTURE);
      WireFormat.writeVarint(out, structure.tableId);
      out.writeBytes(ProtostuffBodies.toBytes(TableSchemaDescriptor.from(structure.schema),
          TableSchemaDescriptor.class));
    } else if (msg instanceof ReplicationMessage.TableFixedStructure) {
      ReplicationMessage.TableFixedStructure structure = (ReplicationMessage.TableFixedStructure) msg;
      out.writeByte(ReplicationOpcodes.SEND_TABLE_FIXED_STRUCTURE);
      WireFormat.writeVarint(out, structure.tableId);
      out.writeBytes(ProtostuffBodies.toBytes(FixedStructureDescriptor.from(structure.structure),
          FixedStructureDescriptor.class));
    } else if (msg instanceof ReplicationMessage.OperationRequest) {
      ReplicationMessage.OperationRequest request = (ReplicationMessage.OperationRequest) msg;
      out.writeByte(ReplicationOpcodes.OPERATION_REQUEST);
      WireFormat.writeVarint(out, request.requestId);
      out.writeBytes(ProtostuffBodies.toBytes(request.envelope, OperationEnvelope.class));
    } else if (msg instanceof ReplicationMessage.OperationResponse) {
      ReplicationMessage.OperationResponse response = (ReplicationMessage.OperationResponse) msg;
      out.writeByte(ReplicationOpcodes.OPERATION_RESPONSE);
      WireFormat.writeVarint(out, response.requestId);
      out.writeBytes(ProtostuffBodies.toBytes(response.envelope, OperationEnvelope.class));
    } else {
      throw new IllegalArgumentException("cannot encode " + msg);
    }
  }

  /**
   * The time goes out once; each record after the first only carries the bytes that differ from the
   * start of the record before it.
   */
  private static void encodeTransaction(ReplicationMessage.Transaction txn, ByteBuf out) {
    out.writeDouble(txn.txnTime);
    byte[] previous = null;
    for (ReplicationMessage.Record record : txn.records) {
      int shared = previous == null ? 0 : sharedPrefix(previous, record.encoded);
      WireFormat.writeVarint(out, record.tableId);
      WireFormat.writeVarint(out, shared);
      WireFormat.writeVarint(out, record.encoded.length - shared);
      out.writeBytes(record.encoded, shared, record.encoded.length - shared);
      previous = record.encoded;
    }
  }

  static int sharedPrefix(byte[] a, byte[] b) {
    int max = Math.min(a.length, b.length);
    int i = 0;
    while (i < max && a[i] == b[i]) {
      i++;
    }
    return i;
  }
}
