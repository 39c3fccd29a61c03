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

package meshdb.replication.worker;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import meshdb.AsyncChannelAsserts;
import meshdb.InMemoryAuditStore;
import meshdb.interfaces.replication.ClusterStatus;
import meshdb.interfaces.workers.WorkerHandle;
import meshdb.interfaces.workers.WorkerPool;
import meshdb.replication.ReplicationConfiguration;
import meshdb.replication.connection.NodeReplicationConnection;
import meshdb.replication.connection.ReplicationClient;
import meshdb.replication.connection.ReplicationPipeline;
import meshdb.replication.messages.NodeConnectionEvent;
import meshdb.replication.messages.NodeTarget;
import meshdb.replication.messages.SubscribeToNode;
import meshdb.replication.messages.UnsubscribeFromNode;
import meshdb.replication.wire.ReplicationMessage;
import meshdb.util.ThreadFiberSupplier;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.fibers.Fiber;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static meshdb.AsyncChannelAsserts.assertEventually;
import static meshdb.AsyncChannelAsserts.listenTo;
import static meshdb.FutureMatchers.resultsIn;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

public class FiberWorkerPoolTest {
  private final NioEventLoopGroup eventLoopGroup = new NioEventLoopGroup(1);
  private final ReplicationConfiguration config = ReplicationConfiguration.fromMap(ImmutableMap.of(
      ReplicationConfiguration.NODE_NAME, "node-a",
      ReplicationConfiguration.RECONNECT_DELAY, "50",
      ReplicationConfiguration.PING_INTERVAL, "50"));
  private final ReplicationClient client =
      new ReplicationClient(eventLoopGroup, config, new InMemoryAuditStore("node-a", "data"), null);
  private final FiberWorkerPool pool = new FiberWorkerPool(3, client, new ThreadFiberSupplier("pool-test"));

  private final MemoryChannel<NodeConnectionEvent> events = new MemoryChannel<>();
  private AsyncChannelAsserts.ChannelListener<NodeConnectionEvent> listener;

  @Before
  public void startPool() {
    listener = listenTo(events);
    pool.onMessageFromWorker(NodeConnectionEvent.class, (worker, event) -> events.publish(event));
    pool.start();
  }

  @After
  public void stopPool() throws Exception {
    pool.stop();
    listener.dispose();
    eventLoopGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
  }

  @Test
  public void assignmentCyclesThroughTheNetworkWorkers() {
    List<Integer> assigned = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      assigned.add(pool.assignWorker(WorkerPool.NETWORK_TAG).getWorkerId());
    }

    assertThat(assigned, contains(1, 2, 3, 1, 2, 3));
  }

  @Test
  public void anUnknownTagFallsBackToTheCoordinatorWorker() {
    assertThat(pool.getWorkers("disk"), hasSize(0));
    assertThat(pool.assignWorker("disk"), is(sameInstance(pool.coordinatorWorker())));
  }

  @Test
  public void stoppingAWorkerReportsItsExitOnce() {
    List<WorkerHandle> exited = new CopyOnWriteArrayList<>();
    pool.onWorkerExit(exited::add);
    WorkerHandle worker = pool.getWorkers(WorkerPool.NETWORK_TAG).get(1);

    pool.stopWorker(worker);
    pool.stopWorker(worker);

    assertThat(exited, contains(worker));
    assertThat(pool.getWorkers(WorkerPool.NETWORK_TAG), not(hasWorker(worker.getWorkerId())));
    for (int i = 0; i < 4; i++) {
      assertThat(pool.assignWorker(WorkerPool.NETWORK_TAG).getWorkerId(), is(not(equalTo(worker.getWorkerId()))));
    }
  }

  @Test
  public void aFailingExitCallbackDoesNotStopTheOthers() {
    List<WorkerHandle> exited = new CopyOnWriteArrayList<>();
    pool.onWorkerExit(worker -> {
      throw new IllegalStateException("listener bug");
    });
    pool.onWorkerExit(exited::add);
    WorkerHandle worker = pool.getWorkers(WorkerPool.NETWORK_TAG).get(0);

    pool.stopWorker(worker);

    assertThat(exited, contains(worker));
  }

  @Test
  public void theCoordinatorWorkerCannotBeStopped() {
    List<WorkerHandle> exited = new CopyOnWriteArrayList<>();
    pool.onWorkerExit(exited::add);

    pool.stopWorker(pool.coordinatorWorker());

    assertThat(exited, hasSize(0));
  }

  @Test
  public void aWorkerReportsAnUnreachablePeerAsDisconnectedAndDropsItOnUnsubscribe() throws Throwable {
    String url = "tcp://127.0.0.1:" + unusedPort();
    WorkerHandle handle = pool.assignWorker(WorkerPool.NETWORK_TAG);
    ReplicationWorker worker = (ReplicationWorker) handle;

    pool.sendToWorker(handle, new SubscribeToNode("data",
        ImmutableList.of(new NodeTarget("node-b", url)), true, ImmutableSet.of()));

    assertEventually(listener, isDisconnectFrom("node-b", "data"));
    assertThat(worker.getConnectionCount(), resultsIn(equalTo(1)));

    pool.sendToWorker(handle, new UnsubscribeFromNode(url, "data"));
    assertThat(worker.getConnectionCount(), resultsIn(equalTo(0)));
  }

  @Test
  public void aWorkerWhoseFiberFailsClosesItsConnectionsBeforeItsExitIsReported() throws Throwable {
    ReplicationClient crashing = new ReplicationClient(eventLoopGroup, config,
        new InMemoryAuditStore("node-a", "data", "broken"), null) {
      @Override
      public NodeReplicationConnection newConnection(Fiber fiber, SubscribeToNode subscription,
                                                     Consumer<NodeConnectionEvent> events) {
        if (subscription.database.equals("broken")) {
          throw new AssertionError("worker fiber failure");
        }
        return super.newConnection(fiber, subscription, events);
      }
    };
    FiberWorkerPool failing = new FiberWorkerPool(2, crashing, new ThreadFiberSupplier("failing-test"));
    List<Boolean> stoppedWhenReported = new CopyOnWriteArrayList<>();
    failing.onWorkerExit(worker -> stoppedWhenReported.add(((ReplicationWorker) worker).isStopped()));
    failing.onMessageFromWorker(NodeConnectionEvent.class, (worker, event) -> events.publish(event));
    failing.start();
    try {
      String url = "tcp://127.0.0.1:" + unusedPort();
      WorkerHandle handle = failing.assignWorker(WorkerPool.NETWORK_TAG);
      failing.sendToWorker(handle, new SubscribeToNode("data",
          ImmutableList.of(new NodeTarget("node-b", url)), true, ImmutableSet.of()));
      assertEventually(listener, isDisconnectFrom("node-b", "data"));

      failing.sendToWorker(handle, new SubscribeToNode("broken",
          ImmutableList.of(new NodeTarget("node-b", url)), true, ImmutableSet.of()));

      assertEventually(() -> stoppedWhenReported, contains(true));
      assertThat(failing.getWorkers(WorkerPool.NETWORK_TAG), not(hasWorker(handle.getWorkerId())));
      assertThat(((ReplicationWorker) handle).isStopped(), is(true));
    } finally {
      failing.stop();
    }
  }

  @Test
  public void anUnreachablePeerIsReportedAsHavingNoResponders() throws Throwable {
    String url = "tcp://127.0.0.1:" + unusedPort();
    pool.sendToWorker(pool.assignWorker(WorkerPool.NETWORK_TAG), new SubscribeToNode("data",
        ImmutableList.of(new NodeTarget("node-b", url)), true, ImmutableSet.of()));

    assertEventually(listener, hasSocketStatus(ClusterStatus.DatabaseSocket.NO_RESPONDERS));
  }

  @Test
  public void aPeerThatStopsAnsweringPingsIsReportedAsTimedOut() throws Throwable {
    Channel server = new ServerBootstrap()
        .group(eventLoopGroup)
        .channel(NioServerSocketChannel.class)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            ReplicationPipeline.configure(ch.pipeline(), null, new NamesItselfThenGoesQuiet());
          }
        })
        .bind(0).sync().channel();
    try {
      String url = "tcp://127.0.0.1:" + ((InetSocketAddress) server.localAddress()).getPort();
      pool.sendToWorker(pool.assignWorker(WorkerPool.NETWORK_TAG), new SubscribeToNode("data",
          ImmutableList.of(new NodeTarget("node-b", url)), true, ImmutableSet.of()));

      assertEventually(listener, hasSocketStatus(ClusterStatus.DatabaseSocket.CONNECTED));
      assertEventually(listener, hasSocketStatus(ClusterStatus.DatabaseSocket.TIMEOUT));
    } finally {
      server.close().sync();
    }
  }

  /**
   * Answers the handshake and nothing else.
   */
  private static class NamesItselfThenGoesQuiet extends SimpleChannelInboundHandler<ReplicationMessage> {
    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ReplicationMessage msg) {
      if (msg instanceof ReplicationMessage.NodeName) {
        ctx.writeAndFlush(new ReplicationMessage.NodeName("node-b"));
      }
    }
  }

  private static Matcher<NodeConnectionEvent> hasSocketStatus(String status) {
    return new TypeSafeMatcher<NodeConnectionEvent>() {
      @Override
      protected boolean matchesSafely(NodeConnectionEvent item) {
        return "node-b".equals(item.nodeName) && status.equals(item.status);
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("an event for node-b with status ").appendValue(status);
      }
    };
  }

  private static int unusedPort() throws IOException {
    try (ServerSocket socket = new ServerSocket(0)) {
      return socket.getLocalPort();
    }
  }

  private static Matcher<NodeConnectionEvent> isDisconnectFrom(String nodeName, String database) {
    return new TypeSafeMatcher<NodeConnectionEvent>() {
      @Override
      protected boolean matchesSafely(NodeConnectionEvent item) {
        return item.type == NodeConnectionEvent.Type.DISCONNECTED
            && !item.finished
            && nodeName.equals(item.nodeName)
            && database.equals(item.database);
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("a disconnect from ").appendValue(nodeName).appendText(" for ").appendValue(database);
      }
    };
  }

  private static Matcher<List<WorkerHandle>> hasWorker(int workerId) {
    return new TypeSafeMatcher<List<WorkerHandle>>() {
      @Override
      protected boolean matchesSafely(List<WorkerHandle> item) {
        for (WorkerHandle worker : item) {
          if (worker.getWorkerId() == workerId) {
            return true;
          }
        }
        return false;
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("a list containing worker ").appendValue(workerId);
      }
    };
  }
}
