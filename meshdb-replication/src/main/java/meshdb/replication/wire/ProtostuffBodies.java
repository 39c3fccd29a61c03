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

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Protostuff serialization of the descriptor bodies carried inside control frames.
 */
final class ProtostuffBodies {
  private static final int BUFFER_SIZE = 512;

  private ProtostuffBodies() {
  }

  static <T> byte[] toBytes(T body, Class<T> type) {
    Schema<T> schema = RuntimeSchema.getSchema(type);
    LinkedBuffer buffer = LinkedBuffer.allocate(BUFFER_SIZE);
    try {
      return ProtostuffIOUtil.toByteArray(body, schema, buffer);
    } finally {
      buffer.clear();
    }
  }

  static <T> T fromBytes(byte[] bytes, Class<T> type) {
    Schema<T> schema = RuntimeSchema.getSchema(type);
    T body = schema.newMessage();
    try {
      ProtostuffIOUtil.mergeFrom(bytes, body, schema);
    } catch (RuntimeException e) {
      throw new ReplicationProtocolException("unable to decode " + type.getSimpleName(), e);
    }
    return body;
  }
}
