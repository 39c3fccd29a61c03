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

/**
 * First byte of a control frame. All of them have the high bit set, which is how they are told apart
 * from the big-endian float64 transaction time that starts a transaction frame. The values are fixed
 * for compatibility between versions.
 */
public final class ReplicationOpcodes {
  public static final int SUBSCRIBE = 129;
  public static final int SEND_TABLE_NAME = 130;
  public static final int SEND_TABLE_STRUCTURE = 131;
  public static final int SEND_TABLE_FIXED_STRUCTURE = 132;
  public static final int OPERATION_REQUEST = 136;
  public static final int OPERATION_RESPONSE = 137;
  public static final int NODE_NAME = 140;
  public static final int DISCONNECT = 142;
  public static final int SEQUENCE_ID_UPDATE = 143;
  public static final int COMMITTED_UPDATE = 144;
  public static final int PING = 147;
  public static final int PONG = 148;

  private ReplicationOpcodes() {
  }

  public static boolean isControl(int firstByte) {
    return (firstByte & 0x80) != 0;
  }
}
