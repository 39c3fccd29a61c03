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

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import meshdb.ReplicationConstants;
import meshdb.interfaces.security.CertificateSource;
import meshdb.interfaces.storage.AuditStore;
import meshdb.replication.ReplicationConfiguration;
import meshdb.replication.messages.NodeConnectionEvent;
import meshdb.replication.messages.SubscribeToNode;
import org.jetbrains.annotations.Nullable;
import org.jetlang.fibers.Fiber;

import java.util.function.Consumer;

/**
 * Everything outbound connections share: the event loop, the local store they apply into, and where
 * TLS identities come from.
 */
public class ReplicationClient {
  private final EventLoopGroup eventLoopGroup;
  private final ReplicationConfiguration config;
  private final AuditStore auditStore;
  @Nullable
  private final CertificateSource certificateSource;

  public ReplicationClient(EventLoopGroup eventLoopGroup,
                           ReplicationConfiguration config,
                           AuditStore auditStore,
                           @Nullable CertificateSource certificateSource) {
    this.eventLoopGroup = eventLoopGroup;
    this.config = config;
    this.auditStore = auditStore;
    this.certificateSource = certificateSource;
  }

  public NodeReplicationConnection newConnection(Fiber fiber,
                                                 SubscribeToNode subscription,
                                                 Consumer<NodeConnectionEvent> events) {
    return new NodeReplicationConnection(this, fiber, subscription, events);
  }

  public Bootstrap bootstrap(@Nullable SslContext sslContext, String host, int port, ChannelHandler session) {
    return new Bootstrap()
        .group(eventLoopGroup)
        .channel(NioSocketChannel.class)
        .option(ChannelOption.SO_REUSEADDR, true)
        .option(ChannelOption.TCP_NODELAY, true)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, ReplicationConstants.REPLICATION_CONNECT_TIMEOUT_MILLISECONDS)
        .handler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) throws Exception {
            ReplicationPipeline.configure(ch.pipeline(),
                sslContext == null ? null : sslContext.newHandler(ch.alloc(), host, port),
                session);
          }
        });
  }

  public ReplicationConfiguration getConfig() {
    return config;
  }

  AuditStore getAuditStore() {
    return auditStore;
  }

  @Nullable
  public CertificateSource getCertificateSource() {
    return certificateSource;
  }
}
