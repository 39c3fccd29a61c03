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
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import meshdb.replication.messages.NodeTarget;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Turns one length-delimited frame into a {@link ReplicationMessage}. Any frame that does not parse
 * completely raises a {@link ReplicationProtocolException}.
 */
public class ReplicationMessageDecoder extends MessageToMessageDecoder<ByteBuf> {

  @Override
  protected void decode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out) throws Exception {
    out.add(decode(msg));
  }

  public static ReplicationMessage decode(ByteBuf in) {
    if (!in.isReadable()) {
      throw new ReplicationProtocolException("empty frame");
    }
    try {
      int first = in.getUnsignedByte(in.readerIndex());
      if (!ReplicationOpcodes.isControl(first)) {
        return decodeTransaction(in);
      }
      in.skipBytes(1);
      return decodeControl(first, in);
    } catch (IndexOutOfBoundsException e) {
      throw new ReplicationProtocolException("truncated frame", e);
    }
  }

  private static ReplicationMessage decodeControl(int opcode, ByteBuf in) {
    switch (opcode) {
      case ReplicationOpcodes.SUBSCRIBE: {
        String database = WireFormat.readShortString(in);
        double startTime = in.readDouble();
        if (!in.isReadable()) {
          return new ReplicationMessage.Subscribe(database, startTime);
        }
        int count = in.readUnsignedShort();
        ImmutableList.Builder<NodeTarget> nodes = ImmutableList.builder();
        for (int i = 0; i < count; i++) {
          String name = WireFormat.readShortString(in);
          double start = in.readDouble();
          double end = in.readDouble();
          nodes.add(new NodeTarget(name, null, start, end));
        }
        return new ReplicationMessage.Subscribe(database, startTime, nodes.build());
      }
      case ReplicationOpcodes.NODE_NAME:
        return new ReplicationMessage.NodeName(WireFormat.readShortString(in));
      case ReplicationOpcodes.DISCONNECT:
        return new ReplicationMessage.Disconnect(new String(WireFormat.readRemaining(in), StandardCharsets.UTF_8));
      case ReplicationOpcodes.SEQUENCE_ID_UPDATE:
        return new ReplicationMessage.SequenceIdUpdate(in.readDouble());
      case ReplicationOpcodes.COMMITTED_UPDATE:
        return new ReplicationMessage.CommittedUpdate(in.readDouble());
      case ReplicationOpcodes.PING:
        return new ReplicationMessage.Ping(in.readDouble());
      case ReplicationOpcodes.PONG:
        return new ReplicationMessage.Pong(in.readDouble());
      case ReplicationOpcodes.SEND_TABLE_NAME: {
        int tableId = WireFormat.readVarint(in);
        return new ReplicationMessage.TableName(tableId, WireFormat.readString(in));
      }
      case ReplicationOpcodes.SEND_TABLE_STRUCTURE: {
        int tableId = WireFormat.readVarint(in);
        TableSchemaDescriptor descriptor =
            ProtostuffBodies.fromBytes(WireFormat.readRemaining(in), TableSchemaDescriptor.class);
        return new ReplicationMessage.TableStructureMessage(tableId, descriptor.toSchema());
      }
      case ReplicationOpcodes.SEND_TABLE_FIXED_STRUCTURE: {
        int tableId = WireFormat.readVarint(in);
        FixedStructureDescriptor descriptor =
            ProtostuffBodies.fromBytes(WireFormat.readRemaining(in), FixedStructureDescriptor.class);
        return new ReplicationMessage.TableFixedStructure(tableId, descriptor.toStructure());
      }
      case ReplicationOpcodes.OPERATION_REQUEST: {
        int requestId = WireFormat.readVarint(in);
        return new ReplicationMessage.OperationRequest(requestId,
            ProtostuffBodies.fromBytes(WireFormat.readRemaining(in), OperationEnvelope.class));
      }
      case ReplicationOpcodes.OPERATION_RESPONSE: {
        int requestId = WireFormat.readVarint(in);
        return new ReplicationMessage.OperationResponse(requestId,
            ProtostuffBodies.fromBytes(WireFormat.readRemaining(in), OperationEnvelope.class));
      }
      default:
        throw new ReplicationProtocolException("unknown opcode " + opcode);
    }
  }

  private static ReplicationMessage.Transaction decodeTransaction(ByteBuf in) {
    double txnTime = in.readDouble();
    ImmutableList.Builder<ReplicationMessage.Record> records = ImmutableList.builder();
    byte[] previous = null;
    while (in.isReadable()) {
      int tableId = WireFormat.readVarint(in);
      int shared = WireFormat.readVarint(in);
      int restLength = WireFormat.readVarint(in);
      if (shared > 0 && (previous == null || shared > previous.length)) {
        throw new ReplicationProtocolException("record shares " + shared + " bytes with a shorter previous record");
      }
      if (restLength > in.readableBytes()) {
        throw new ReplicationProtocolException("record of " + restLength + " bytes runs past the end of the frame");
      }
      byte[] encoded = new byte[shared + restLength];
      if (shared > 0) {
        System.arraycopy(previous, 0, encoded, 0, shared);
      }
      in.readBytes(encoded, shared, restLength);
      records.add(new ReplicationMessage.Record(tableId, encoded));
      previous = encoded;
    }
    return new ReplicationMessage.Transaction(txnTime, records.build());
  }
}
