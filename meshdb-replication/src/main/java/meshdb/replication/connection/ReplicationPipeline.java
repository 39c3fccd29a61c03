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

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.protobuf.ProtobufVarint32FrameDecoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;
import io.netty.handler.ssl.SslHandler;
import meshdb.replication.wire.ReplicationMessageDecoder;
import meshdb.replication.wire.ReplicationMessageEncoder;
import org.jetbrains.annotations.Nullable;

/**
 * The handler stack every replication socket uses, inbound and outbound.
 */
public final class ReplicationPipeline {
  public static final String SSL = "ssl";
  public static final String SESSION = "session";

  private static final ReplicationMessageEncoder ENCODER = new ReplicationMessageEncoder();

  private ReplicationPipeline() {
  }

  public static void configure(ChannelPipeline p, @Nullable SslHandler sslHandler, ChannelHandler session) {
    if (sslHandler != null) {
      p.addLast(SSL, sslHandler);
    }
    p.addLast("frameDecode", new ProtobufVarint32FrameDecoder());
    p.addLast("replicationDecode", new ReplicationMessageDecoder());

    p.addLast("frameEncode", new ProtobufVarint32LengthFieldPrepender());
    p.addLast("replicationEncode", ENCODER);

    p.addLast(SESSION, session);
  }
}
