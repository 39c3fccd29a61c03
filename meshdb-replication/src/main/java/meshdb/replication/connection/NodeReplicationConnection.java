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

import com.google.common.collect.ImmutableList;
import com.google.common.net.HostAndPort;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import meshdb.ReplicationConstants;
import meshdb.interfaces.replication.ClusterStatus;
import meshdb.interfaces.security.CertificateSource;
import meshdb.interfaces.security.ConnectionIdentity;
import meshdb.replication.messages.NodeConnectionEvent;
import meshdb.replication.messages.NodeTarget;
import meshdb.replication.messages.SubscribeToNode;
import meshdb.replication.registry.NodeNames;
import meshdb.replication.wire.ReplicationMessage;
import meshdb.util.FiberOnly;
import org.jetbrains.annotations.Nullable;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Outbound subscription to one node for one database. Connects, exchanges node names, subscribes,
 * and applies what the node streams back. Whenever the socket goes away it waits a fixed delay and
 * starts over; only {@link #close()} stops it.
 * <p>
 * A connected node is pinged every interval. Each answer refreshes the reported latency, and a
 * node silent for two intervals is dropped as timed out.
 * <p>
 * All state is confined to the owning worker's fiber; Netty callbacks are re-posted onto it.
 */
public class NodeReplicationConnection {
  private static final Logger LOG = LoggerFactory.getLogger(NodeReplicationConnection.class);

  private final ReplicationClient client;
  private final Fiber fiber;
  private final Consumer<NodeConnectionEvent> events;
  private final String database;
  private final String url;
  private final String expectedName;
  private final HostAndPort address;
  private final ReceivingSession session;

  private List<NodeTarget> targets;
  @Nullable
  private Channel channel;
  private boolean closed;
  private boolean connected;
  @Nullable
  private String reportedStatus;
  private boolean timedOut;
  private long lastHeardNanos;
  private int retries;
  private long handshakeStartNanos;
  private double latency;
  @Nullable
  private Disposable reconnectTimer;
  @Nullable
  private Disposable committedTimer;
  @Nullable
  private Disposable pingTimer;
  private double pendingCommitted;

  NodeReplicationConnection(ReplicationClient client,
                            Fiber fiber,
                            SubscribeToNode subscription,
                            Consumer<NodeConnectionEvent> events) {
    this.client = client;
    this.fiber = fiber;
    this.events = events;
    this.database = subscription.database;
    this.expectedName = subscription.primary().name;
    this.url = subscription.primary().url;
    if (url == null) {
      throw new IllegalArgumentException("subscription to " + expectedName + " has no url");
    }
    this.address = NodeNames.hostAndPort(url);
    this.targets = subscription.nodes;
    this.session = new ReceivingSession(database, client.getAuditStore(), subscription.replicateByDefault,
        subscription.tables);
  }

  public String getUrl() {
    return url;
  }

  public String getDatabase() {
    return database;
  }

  @FiberOnly
  public boolean isConnected() {
    return connected;
  }

  @FiberOnly
  public void start() {
    connect();
  }

  /**
   * Take a new node list or table filter. A live socket is re-subscribed right away.
   */
  @FiberOnly
  public void update(SubscribeToNode subscription) {
    targets = subscription.nodes;
    session.setTableFilter(subscription.replicateByDefault, subscription.tables);
    if (connected) {
      sendSubscribe();
    }
  }

  @FiberOnly
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    cancelTimers();
    if (channel != null) {
      channel.close();
      channel = null;
    }
    connected = false;
    LOG.info("closed replication of {} from {}", database, expectedName);
  }

  @FiberOnly
  private void connect() {
    reconnectTimer = null;
    if (closed) {
      return;
    }
    session.resetStream();

    SslContext sslContext = null;
    if (NodeNames.isSecure(url)) {
      try {
        sslContext = tlsContext();
      } catch (SSLException | RuntimeException e) {
        LOG.error("unable to set up TLS to {} ({})", expectedName, url, e);
      }
      if (sslContext == null) {
        markDown(ClusterStatus.DatabaseSocket.DISCONNECTED);
        scheduleReconnect();
        return;
      }
    }

    client.bootstrap(sslContext, address.getHost(), address.getPort(), new SessionHandler())
        .connect(address.getHost(), address.getPort())
        .addListener((ChannelFutureListener) future -> {
          if (!future.isSuccess()) {
            Throwable cause = future.cause();
            fiber.execute(() -> onConnectFailed(cause));
          }
        });
  }

  @Nullable
  private SslContext tlsContext() throws SSLException {
    CertificateSource certificates = client.getCertificateSource();
    ConnectionIdentity identity = certificates == null ? null : certificates.getConnectionIdentity(expectedName);
    if (identity == null) {
      LOG.error("no certificate available to connect to {} at {}", expectedName, url);
      return null;
    }
    return ReplicationSsl.clientContext(identity);
  }

  @FiberOnly
  private void onConnectFailed(Throwable cause) {
    if (closed) {
      return;
    }
    if (retries == 0) {
      LOG.info("unable to connect to {} at {}: {}", expectedName, url, cause.toString());
    } else {
      LOG.debug("unable to connect to {} at {}", expectedName, url, cause);
    }
    markDown(cause instanceof ConnectException
        ? ClusterStatus.DatabaseSocket.NO_RESPONDERS
        : ClusterStatus.DatabaseSocket.DISCONNECTED);
    scheduleReconnect();
  }

  @FiberOnly
  private void scheduleReconnect() {
    if (closed || reconnectTimer != null) {
      return;
    }
    retries++;
    if (retries % ReplicationConstants.REPLICATION_RETRY_LOG_INTERVAL == 0) {
      LOG.warn("still unable to replicate {} from {} at {} after {} attempts", database, expectedName, url, retries);
    }
    reconnectTimer = fiber.schedule(this::connect, client.getConfig().reconnectDelayMillis, TimeUnit.MILLISECONDS);
  }

  @FiberOnly
  private void onActive(Channel ch) {
    if (closed) {
      ch.close();
      return;
    }
    channel = ch;
    handshakeStartNanos = System.nanoTime();
    ch.writeAndFlush(new ReplicationMessage.NodeName(client.getConfig().nodeName));
  }

  @FiberOnly
  private void onInactive(Channel ch) {
    if (ch != channel) {
      return;
    }
    channel = null;
    connected = false;
    if (committedTimer != null) {
      committedTimer.dispose();
      committedTimer = null;
    }
    stopPinging();
    String status = timedOut ? ClusterStatus.DatabaseSocket.TIMEOUT : ClusterStatus.DatabaseSocket.DISCONNECTED;
    timedOut = false;
    if (closed) {
      return;
    }
    LOG.info("lost connection to {} for {} ({})", expectedName, database, status);
    markDown(status);
    scheduleReconnect();
  }

  @FiberOnly
  private void onMessage(Channel ch, ReplicationMessage msg) {
    if (ch != channel) {
      return;
    }
    lastHeardNanos = System.nanoTime();
    try {
      if (msg instanceof ReplicationMessage.NodeName) {
        onNodeName(ch, ((ReplicationMessage.NodeName) msg).name);
      } else if (msg instanceof ReplicationMessage.Transaction) {
        ReplicationMessage.Transaction txn = (ReplicationMessage.Transaction) msg;
        session.onTransaction(txn);
        scheduleCommittedUpdate(txn.txnTime);
      } else if (msg instanceof ReplicationMessage.TableName) {
        session.onTableName((ReplicationMessage.TableName) msg);
      } else if (msg instanceof ReplicationMessage.TableStructureMessage) {
        session.onTableStructure((ReplicationMessage.TableStructureMessage) msg);
      } else if (msg instanceof ReplicationMessage.TableFixedStructure) {
        session.onFixedStructure((ReplicationMessage.TableFixedStructure) msg);
      } else if (msg instanceof ReplicationMessage.SequenceIdUpdate) {
        session.onSequenceUpdate(expectedName, ((ReplicationMessage.SequenceIdUpdate) msg).sequenceId);
      } else if (msg instanceof ReplicationMessage.Pong) {
        onPong(((ReplicationMessage.Pong) msg).sentTime);
      } else if (msg instanceof ReplicationMessage.Disconnect) {
        LOG.warn("{} refused replication of {}: {}", expectedName, database,
            ((ReplicationMessage.Disconnect) msg).reason);
        finish();
      } else {
        LOG.debug("ignoring {} from {}", msg, expectedName);
      }
    } catch (RuntimeException e) {
      LOG.error("dropping connection to {} for {} after {}", expectedName, database, msg, e);
      ch.close();
    }
  }

  @FiberOnly
  private void onNodeName(Channel ch, String name) {
    String certificateName = null;
    SslHandler ssl = ch.pipeline().get(SslHandler.class);
    if (ssl != null) {
      certificateName = ReplicationSsl.peerCommonName(ssl);
    }
    if (!name.equals(expectedName) || (ssl != null && !name.equals(certificateName))) {
      LOG.error("node at {} says it is {} (certificate {}), expected {}; giving up on it",
          url, name, certificateName, expectedName);
      ch.writeAndFlush(new ReplicationMessage.Disconnect("expected node " + expectedName));
      finish();
      return;
    }

    latency = (System.nanoTime() - handshakeStartNanos) / 1_000_000.0;
    lastHeardNanos = System.nanoTime();
    connected = true;
    reportedStatus = null;
    if (retries > 0) {
      LOG.info("connected to {} for {} after {} attempts", expectedName, database, retries);
    } else {
      LOG.info("connected to {} for {}", expectedName, database);
    }
    retries = 0;
    events.accept(NodeConnectionEvent.connected(expectedName, url, database, latency));
    sendSubscribe();
    long interval = client.getConfig().pingIntervalMillis;
    pingTimer = fiber.scheduleAtFixedRate(this::ping, interval, interval, TimeUnit.MILLISECONDS);
  }

  @FiberOnly
  private void ping() {
    if (channel == null || !connected) {
      return;
    }
    long silentMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastHeardNanos);
    if (silentMillis > 2 * client.getConfig().pingIntervalMillis) {
      LOG.warn("nothing from {} for {} ms, dropping replication of {}", expectedName, silentMillis, database);
      timedOut = true;
      channel.close();
      return;
    }
    channel.writeAndFlush(new ReplicationMessage.Ping(nowMillis()));
  }

  @FiberOnly
  private void onPong(double sentTime) {
    if (!connected) {
      return;
    }
    latency = nowMillis() - sentTime;
    events.accept(NodeConnectionEvent.connected(expectedName, url, database, latency));
  }

  private static double nowMillis() {
    return System.nanoTime() / 1_000_000.0;
  }

  @FiberOnly
  private void stopPinging() {
    if (pingTimer != null) {
      pingTimer.dispose();
      pingTimer = null;
    }
  }

  @FiberOnly
  private void sendSubscribe() {
    if (channel == null) {
      return;
    }
    ImmutableList.Builder<NodeTarget> nodes = ImmutableList.builder();
    double startTime = Double.MAX_VALUE;
    for (NodeTarget target : targets) {
      double start = target.isBounded()
          ? target.startTime
          : Math.max(target.startTime, session.resumePoint(target.name));
      nodes.add(new NodeTarget(target.name, null, start, target.endTime));
      startTime = Math.min(startTime, start);
    }
    ReplicationMessage.Subscribe subscribe = new ReplicationMessage.Subscribe(database, startTime, nodes.build());
    LOG.debug("subscribing to {}: {}", expectedName, subscribe);
    channel.writeAndFlush(subscribe);
  }

  @FiberOnly
  private void scheduleCommittedUpdate(double txnTime) {
    pendingCommitted = Math.max(pendingCommitted, txnTime);
    if (committedTimer != null) {
      return;
    }
    committedTimer = fiber.schedule(() -> {
      committedTimer = null;
      if (channel != null && connected) {
        channel.writeAndFlush(new ReplicationMessage.CommittedUpdate(pendingCommitted));
      }
    }, client.getConfig().committedUpdateDelayMillis, TimeUnit.MILLISECONDS);
  }

  /**
   * The peer (or its identity) told us to stop: close without retrying and without asking for
   * failover.
   */
  @FiberOnly
  private void finish() {
    close();
    events.accept(NodeConnectionEvent.disconnected(expectedName, url, database, true));
  }

  /**
   * Report the node as down, again only if the reason changed.
   */
  @FiberOnly
  private void markDown(String status) {
    if (status.equals(reportedStatus)) {
      return;
    }
    reportedStatus = status;
    events.accept(NodeConnectionEvent.disconnected(expectedName, url, database, status, false));
  }

  private void cancelTimers() {
    if (reconnectTimer != null) {
      reconnectTimer.dispose();
      reconnectTimer = null;
    }
    if (committedTimer != null) {
      committedTimer.dispose();
      committedTimer = null;
    }
    stopPinging();
  }

  private class SessionHandler extends SimpleChannelInboundHandler<ReplicationMessage> {
    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
      Channel ch = ctx.channel();
      fiber.execute(() -> onActive(ch));
      super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ReplicationMessage msg) throws Exception {
      Channel ch = ctx.channel();
      fiber.execute(() -> onMessage(ch, msg));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
      Channel ch = ctx.channel();
      fiber.execute(() -> onInactive(ch));
      super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
      LOG.warn("replication channel to {} failed, closing", url, cause);
      ctx.close();
    }
  }
}
