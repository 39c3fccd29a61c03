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

import io.netty.handler.codec.DecoderException;

/**
 * A frame the decoder cannot make sense of: unknown opcode, truncated body, bad varint. The
 * connection carrying it is closed; there is no attempt to resynchronize mid-stream.
 */
public class ReplicationProtocolException extends DecoderException {
  public ReplicationProtocolException(String message) {
    super(message);
  }

  public ReplicationProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
