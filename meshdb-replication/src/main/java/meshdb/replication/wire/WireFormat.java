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

import java.nio.charset.StandardCharsets;

/**
 * Primitive readers and writers shared by the frame codec and the audit entry codec.
 */
public final class WireFormat {
  private WireFormat() {
  }

  public static void writeVarint(ByteBuf out, int value) {
    if (value < 0) {
      throw new IllegalArgumentException("varint must not be negative: " + value);
    }
    while ((value & ~0x7F) != 0) {
      out.writeByte((value & 0x7F) | 0x80);
      value >>>= 7;
    }
    out.writeByte(value);
  }

  public static int readVarint(ByteBuf in) {
    int result = 0;
    for (int shift = 0; shift < 32; shift += 7) {
      if (!in.isReadable()) {
        throw new ReplicationProtocolException("truncated varint");
      }
      byte b = in.readByte();
      result |= (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        if (result < 0) {
          throw new ReplicationProtocolException("varint out of range");
        }
        return result;
      }
    }
    throw new ReplicationProtocolException("malformed varint");
  }

  /**
   * A string with a one byte length prefix, as used for database and node names.
   */
  public static void writeShortString(ByteBuf out, String value) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length > 0xFF) {
      throw new IllegalArgumentException("name longer than 255 bytes: " + value);
    }
    out.writeByte(bytes.length);
    out.writeBytes(bytes);
  }

  public static String readShortString(ByteBuf in) {
    int length = in.readUnsignedByte();
    return readUtf8(in, length);
  }

  public static void writeString(ByteBuf out, String value) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    writeVarint(out, bytes.length);
    out.writeBytes(bytes);
  }

  public static String readString(ByteBuf in) {
    return readUtf8(in, readVarint(in));
  }

  public static byte[] readRemaining(ByteBuf in) {
    byte[] bytes = new byte[in.readableBytes()];
    in.readBytes(bytes);
    return bytes;
  }

  private static String readUtf8(ByteBuf in, int length) {
    if (in.readableBytes() < length) {
      throw new ReplicationProtocolException("string of " + length + " bytes runs past the end of the frame");
    }
    String value = in.toString(in.readerIndex(), length, StandardCharsets.UTF_8);
    in.skipBytes(length);
    return value;
  }
}
