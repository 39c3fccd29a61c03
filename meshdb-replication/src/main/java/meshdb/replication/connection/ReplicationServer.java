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

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.util.concurrent.GlobalEventExecutor;
import meshdb.interfaces.security.CertificateSource;
import meshdb.interfaces.security.ConnectionIdentity;
import meshdb.interfaces.storage.AuditStore;
import meshdb.replication.ReplicationConfiguration;
import meshdb.replication.confirmation.ConfirmationCounters;
import meshdb.replication.confirmation.ConfirmationUpdate;
import meshdb.replication.registry.NodeRegistry;
import meshdb.util.FiberSupplier;
import org.jetbrains.annotations.Nullable;
import org.jetlang.channels.Channel;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.InetSocketAddress;

/**
 * Accepts replication sockets from other nodes. Every accepted socket gets its own
 * {@link SendingSession} running on its own fiber.
 */
public class ReplicationServer {
  private static final Logger LOG = LoggerFactory.getLogger(ReplicationServer.class);

  private final ReplicationConfiguration config;
  private final NodeRegistry registry;
  private final AuditStore auditStore;
  private final ConfirmationCounters confirmationCounters;
  private final Channel<ConfirmationUpdate> confirmationUpdates;
  private final OperationHandler operationHandler;
  @Nullable
  private final CertificateSource certificateSource;
  private final FiberSupplier fiberSupplier;
  private final EventLoopGroup bossGroup;
  private final EventLoopGroup workerGroup;
  private final ChannelGroup allChannels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

  private io.netty.channel.Channel listenChannel;

  public ReplicationServer(ReplicationConfiguration config,
                           NodeRegistry registry,
                           AuditStore auditStore,
                           ConfirmationCounters confirmationCounters,
                           Channel<ConfirmationUpdate> confirmationUpdates,
                           OperationHandler operationHandler,
                           @Nullable CertificateSource certificateSource,
                           FiberSupplier fiberSupplier,
                           EventLoopGroup bossGroup,
                           EventLoopGroup workerGroup) {
    this.config = config;
    this.registry = registry;
    this.auditStore = auditStore;
    this.confirmationCounters = confirmationCounters;
    this.confirmationUpdates = confirmationUpdates;
    this.operationHandler = operationHandler;
    this.certificateSource = certificateSource;
    this.fiberSupplier = fiberSupplier;
    this.bossGroup = bossGroup;
    this.workerGroup = workerGroup;
  }

  /**
   * Bind the replication port: the secure port with TLS when one is configured, the plain port
   * otherwise.
   *
   * @return the bound address, so that callers binding port 0 learn the real one.
   */
  public ListenableFuture<InetSocketAddress> bind() {
    SettableFuture<InetSocketAddress> bound = SettableFuture.create();
    SslContext sslContext;
    try {
      sslContext = serverTlsContext();
    } catch (SSLException | RuntimeException e) {
      bound.setException(e);
      return bound;
    }

    ServerBootstrap serverBootstrap = new ServerBootstrap();
    serverBootstrap.group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .option(ChannelOption.SO_REUSEADDR, true)
        .option(ChannelOption.SO_BACKLOG, 100)
        .childOption(ChannelOption.TCP_NODELAY, true)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) throws Exception {
            allChannels.add(ch);
            Fiber fiber = fiberSupplier.getFiber(throwable -> {
              LOG.error("replication session on {} failed", ch, throwable);
              ch.close();
            });
            ReplicationPipeline.configure(ch.pipeline(),
                sslContext == null ? null : sslContext.newHandler(ch.alloc()),
                new SendingSession(ReplicationServer.this, fiber));
          }
        });

    int port = config.listenPort();
    serverBootstrap.bind(port).addListener((ChannelFutureListener) future -> {
      if (future.isSuccess()) {
        listenChannel = future.channel();
        InetSocketAddress address = (InetSocketAddress) listenChannel.localAddress();
        LOG.info("replication server for {} listening on {}{}", config.nodeName, address,
            sslContext == null ? "" : " (TLS)");
        bound.set(address);
      } else {
        LOG.error("Unable to bind replication port {}", port, future.cause());
        bound.setException(future.cause());
      }
    });
    return bound;
  }

  @Nullable
  private SslContext serverTlsContext() throws SSLException {
    if (config.securePort == null) {
      return null;
    }
    ConnectionIdentity identity = certificateSource == null
        ? null
        : certificateSource.getConnectionIdentity(config.nodeName);
    if (identity == null) {
      throw new IllegalStateException("secure replication port configured but no certificate for "
          + config.nodeName);
    }
    return ReplicationSsl.serverContext(identity);
  }

  /**
   * Stop listening and close every accepted socket.
   */
  public ListenableFuture<Void> close() {
    SettableFuture<Void> closed = SettableFuture.create();
    if (listenChannel != null) {
      listenChannel.close();
    }
    allChannels.close().addListener(future -> closed.set(null));
    return closed;
  }

  ReplicationConfiguration getConfig() {
    return config;
  }

  String getThisNodeName() {
    return config.nodeName;
  }

  NodeRegistry getRegistry() {
    return registry;
  }

  AuditStore getAuditStore() {
    return auditStore;
  }

  ConfirmationCounters getConfirmationCounters() {
    return confirmationCounters;
  }

  Channel<ConfirmationUpdate> getConfirmationUpdates() {
    return confirmationUpdates;
  }

  OperationHandler getOperationHandler() {
    return operationHandler;
  }
}
