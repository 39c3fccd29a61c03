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
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.ssl.SslHandler;
import meshdb.ReplicationConstants;
import meshdb.interfaces.replication.NodeRecord;
import meshdb.interfaces.replication.NodeSubscription;
import meshdb.interfaces.storage.AuditEntry;
import meshdb.interfaces.storage.AuditStore;
import meshdb.interfaces.storage.CommitListener;
import meshdb.interfaces.storage.TableSchema;
import meshdb.interfaces.storage.TableStructure;
import meshdb.replication.confirmation.ConfirmationCounter;
import meshdb.replication.confirmation.ConfirmationUpdate;
import meshdb.replication.messages.NodeTarget;
import meshdb.replication.wire.OperationEnvelope;
import meshdb.replication.wire.ReplicationMessage;
import meshdb.util.FiberOnly;
import meshdb.util.MeshFutures;
import org.jetbrains.annotations.Nullable;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Source side of one inbound replication socket. After the peer names itself and subscribes, it
 * streams the audit log entries the peer asked for, one frame per transaction, then keeps following
 * local commits until the socket closes or the peer unsubscribes.
 * <p>
 * The peer's confirmations of what it applied are written into the shared confirmation counter for
 * (database, peer).
 */
public class SendingSession extends SimpleChannelInboundHandler<ReplicationMessage> {
  private static final Logger LOG = LoggerFactory.getLogger(SendingSession.class);

  private final ReplicationServer server;
  private final Fiber fiber;
  private final AuditStore store;

  private ChannelHandlerContext ctx;
  @Nullable
  private String peerName;
  @Nullable
  private String database;
  /** Null means only this node's own writes. */
  @Nullable
  private ImmutableList<NodeTarget> origins;
  private double ownStartTime;
  private boolean allTables;
  private Set<String> tables = new HashSet<>();
  @Nullable
  private CommitListener commitListener;
  @Nullable
  private ConfirmationCounter counter;

  private final Set<Integer> describedTables = new HashSet<>();
  private final Map<Integer, Integer> describedStructureSizes = new HashMap<>();
  private double scanFrom;
  private boolean firstPassDone;
  private double lastScanned;
  private double lastSequenceSent;
  @Nullable
  private Disposable skippedUpdateTimer;
  @Nullable
  private Disposable silenceCheck;
  private volatile long lastHeardNanos;

  SendingSession(ReplicationServer server, Fiber fiber) {
    this.server = server;
    this.fiber = fiber;
    this.store = server.getAuditStore();
  }

  @Override
  public void channelActive(ChannelHandlerContext ctx) throws Exception {
    this.ctx = ctx;
    lastHeardNanos = System.nanoTime();
    fiber.start();
    long interval = server.getConfig().pingIntervalMillis;
    fiber.execute(() -> silenceCheck = fiber.scheduleAtFixedRate(this::checkSilence, interval, interval,
        TimeUnit.MILLISECONDS));
    ctx.writeAndFlush(new ReplicationMessage.NodeName(server.getThisNodeName()));
    super.channelActive(ctx);
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, ReplicationMessage msg) throws Exception {
    lastHeardNanos = System.nanoTime();
    fiber.execute(() -> {
      try {
        handle(msg);
      } catch (RuntimeException e) {
        LOG.error("closing replication session with {} after {}", peerName, msg, e);
        ctx.close();
      }
    });
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    fiber.execute(() -> {
      if (silenceCheck != null) {
        silenceCheck.dispose();
        silenceCheck = null;
      }
      stopStreaming();
      fiber.dispose();
    });
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
    LOG.warn("replication session with {} failed, closing", peerName, cause);
    ctx.close();
  }

  @FiberOnly
  private void handle(ReplicationMessage msg) {
    if (msg instanceof ReplicationMessage.NodeName) {
      onNodeName(((ReplicationMessage.NodeName) msg).name);
    } else if (msg instanceof ReplicationMessage.Subscribe) {
      onSubscribe((ReplicationMessage.Subscribe) msg);
    } else if (msg instanceof ReplicationMessage.Ping) {
      ctx.writeAndFlush(new ReplicationMessage.Pong(((ReplicationMessage.Ping) msg).sentTime));
    } else if (msg instanceof ReplicationMessage.CommittedUpdate) {
      onCommittedUpdate(((ReplicationMessage.CommittedUpdate) msg).txnTime);
    } else if (msg instanceof ReplicationMessage.OperationRequest) {
      onOperationRequest((ReplicationMessage.OperationRequest) msg);
    } else if (msg instanceof ReplicationMessage.Disconnect) {
      LOG.info("{} disconnected: {}", peerName, ((ReplicationMessage.Disconnect) msg).reason);
      ctx.close();
    } else {
      LOG.debug("ignoring {} from {}", msg, peerName);
    }
  }

  /**
   * Subscribers ping every interval; two intervals without a word means the socket is dead.
   */
  @FiberOnly
  private void checkSilence() {
    long interval = server.getConfig().pingIntervalMillis;
    long silentMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastHeardNanos);
    if (silentMillis > 2 * interval) {
      LOG.warn("nothing from {} for {} ms, closing its replication session", peerName, silentMillis);
      ctx.close();
    }
  }

  @FiberOnly
  private void onNodeName(String name) {
    SslHandler ssl = ctx.pipeline().get(SslHandler.class);
    if (ssl != null) {
      String certificateName = ReplicationSsl.peerCommonName(ssl);
      if (!name.equals(certificateName)) {
        refuse("certificate is for " + certificateName + ", not " + name);
        return;
      }
    }
    peerName = name;
    LOG.debug("replication session from {}", name);
  }

  @FiberOnly
  private void onSubscribe(ReplicationMessage.Subscribe subscribe) {
    if (peerName == null) {
      refuse("node name required before subscribing");
      return;
    }
    if (subscribe.nodes != null && subscribe.nodes.isEmpty()) {
      LOG.info("{} unsubscribed from {}", peerName, database);
      stopStreaming();
      return;
    }
    NodeRecord peer = server.getRegistry().get(peerName);
    if (!isAuthorized(peer, subscribe.database)) {
      refuse("not authorized to replicate " + subscribe.database);
      return;
    }
    if (!store.databaseNames().contains(subscribe.database)) {
      refuse("no database " + subscribe.database);
      return;
    }

    stopStreaming();
    if (!subscribe.database.equals(database)) {
      describedTables.clear();
      describedStructureSizes.clear();
      counter = server.getConfirmationCounters().writer(subscribe.database, peerName);
    }
    database = subscribe.database;
    origins = subscribe.nodes;
    ownStartTime = subscribe.startTime;
    setTableFilter(peer, database);
    scanFrom = subscribe.startTime;
    firstPassDone = false;
    lastScanned = 0;
    lastSequenceSent = 0;

    String subscribed = database;
    commitListener = (db, txnTime) -> fiber.execute(() -> {
      if (subscribed.equals(database) && commitListener != null) {
        catchUp();
      }
    });
    store.addCommitListener(database, commitListener);
    LOG.info("{} subscribed to {} from {} for {}", peerName, database, subscribe.startTime,
        origins == null ? "own writes" : origins);
    catchUp();
  }

  /**
   * Send every entry committed locally since the last pass that the peer wants, then report how far
   * the log was read. The log is walked by local commit time, so a write relayed from another node or
   * stamped by a clock running ahead is still seen by the next pass.
   */
  @FiberOnly
  private void catchUp() {
    List<ReplicationMessage.Record> buffered = new ArrayList<>();
    AuditEntry bufferedFrom = null;
    boolean sentAny = false;
    boolean skipped = false;

    Iterator<AuditEntry> entries = store.streamAuditEntriesSince(database, scanFrom);
    while (entries.hasNext()) {
      AuditEntry entry = entries.next();
      if (firstPassDone && entry.localTime <= lastScanned) {
        continue;
      }
      lastScanned = Math.max(lastScanned, entry.localTime);
      String table = store.tableName(database, entry.tableId);
      if (table == null || !wants(entry, table)) {
        skipped = true;
        continue;
      }
      if (bufferedFrom != null && !sameTransaction(bufferedFrom, entry)) {
        write(bufferedFrom.txnTime, buffered);
        sentAny = true;
        buffered = new ArrayList<>();
      }
      describeTable(entry.tableId, table);
      bufferedFrom = entry;
      buffered.add(new ReplicationMessage.Record(entry.tableId, entry.encoded));
    }
    if (bufferedFrom != null) {
      write(bufferedFrom.txnTime, buffered);
      sentAny = true;
    }
    firstPassDone = true;
    scanFrom = Math.max(scanFrom, lastScanned);

    if (sentAny) {
      sendSequenceUpdate();
    } else if (skipped && skippedUpdateTimer == null) {
      skippedUpdateTimer = fiber.schedule(() -> {
            skippedUpdateTimer = null;
            sendSequenceUpdate();
            ctx.flush();
          }, ReplicationConstants.REPLICATION_SKIPPED_SEQUENCE_UPDATE_DELAY_MILLISECONDS,
          TimeUnit.MILLISECONDS);
    }
    ctx.flush();
  }

  private static boolean sameTransaction(AuditEntry a, AuditEntry b) {
    return a.localTime == b.localTime && a.txnTime == b.txnTime;
  }

  @FiberOnly
  private void write(double txnTime, List<ReplicationMessage.Record> records) {
    ctx.write(new ReplicationMessage.Transaction(txnTime, ImmutableList.copyOf(records)));
  }

  @FiberOnly
  private void sendSequenceUpdate() {
    if (lastScanned > lastSequenceSent && ctx.channel().isActive()) {
      lastSequenceSent = lastScanned;
      ctx.write(new ReplicationMessage.SequenceIdUpdate(lastScanned));
    }
  }

  @FiberOnly
  private void describeTable(int tableId, String table) {
    if (describedTables.add(tableId)) {
      ctx.write(new ReplicationMessage.TableName(tableId, table));
      TableSchema schema = store.tableSchema(database, tableId);
      if (schema != null) {
        ctx.write(new ReplicationMessage.TableStructureMessage(tableId, schema));
      }
    }
    TableStructure structure = store.tableStructure(database, tableId);
    if (structure.size() > describedStructureSizes.getOrDefault(tableId, 0)) {
      ctx.write(new ReplicationMessage.TableFixedStructure(tableId, structure));
      describedStructureSizes.put(tableId, structure.size());
    }
  }

  @FiberOnly
  private boolean wants(AuditEntry entry, String table) {
    if (!allTables && !tables.contains(table)) {
      return false;
    }
    if (origins == null) {
      return entry.origin.equals(server.getThisNodeName()) && entry.localTime >= ownStartTime;
    }
    for (NodeTarget origin : origins) {
      if (origin.name.equals(entry.origin)) {
        return entry.localTime >= origin.startTime
            && (!origin.isBounded() || entry.localTime <= origin.endTime);
      }
    }
    return false;
  }

  @FiberOnly
  private void setTableFilter(NodeRecord peer, String database) {
    allTables = peer.replicates.receives();
    tables = new HashSet<>();
    for (NodeSubscription subscription : peer.subscriptions) {
      if (subscription.database.equals(database) && subscription.publish) {
        if (subscription.table == null) {
          allTables = true;
        } else {
          tables.add(subscription.table);
        }
      }
    }
  }

  static boolean isAuthorized(@Nullable NodeRecord peer, String database) {
    if (peer == null) {
      return false;
    }
    if (peer.replicates.receives()) {
      return true;
    }
    for (NodeSubscription subscription : peer.subscriptions) {
      if (subscription.database.equals(database) && subscription.publish) {
        return true;
      }
    }
    return false;
  }

  @FiberOnly
  private void onCommittedUpdate(double txnTime) {
    if (counter != null && counter.confirm(txnTime)) {
      server.getConfirmationUpdates().publish(new ConfirmationUpdate(counter.database, counter.peer, txnTime));
    }
  }

  @FiberOnly
  private void onOperationRequest(ReplicationMessage.OperationRequest request) {
    LOG.debug("operation {} from {}", request.envelope, peerName);
    MeshFutures.addCallback(server.getOperationHandler().handle(request.envelope),
        response -> ctx.writeAndFlush(new ReplicationMessage.OperationResponse(request.requestId, response)),
        error -> {
          LOG.warn("operation {} from {} failed", request.envelope.operation, peerName, error);
          ctx.writeAndFlush(new ReplicationMessage.OperationResponse(request.requestId,
              OperationEnvelope.failure(String.valueOf(error.getMessage()))));
        },
        fiber);
  }

  @FiberOnly
  private void refuse(String reason) {
    LOG.warn("refusing replication session from {}: {}", peerName, reason);
    ctx.writeAndFlush(new ReplicationMessage.Disconnect(reason))
        .addListener(future -> ctx.close());
  }

  @FiberOnly
  private void stopStreaming() {
    if (commitListener != null && database != null) {
      store.removeCommitListener(database, commitListener);
    }
    commitListener = null;
    if (skippedUpdateTimer != null) {
      skippedUpdateTimer.dispose();
      skippedUpdateTimer = null;
    }
  }
}
