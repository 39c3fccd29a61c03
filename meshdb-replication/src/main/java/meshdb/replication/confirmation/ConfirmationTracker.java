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

package meshdb.replication.confirmation;

import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import meshdb.util.FiberOnly;
import meshdb.util.FiberSupplier;
import org.jetlang.channels.Channel;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Lets a writer wait until enough distinct peers have confirmed receipt of a transaction time.
 * <p>
 * Counter updates from connections in this process arrive on {@link #getUpdateChannel()}; counters
 * written by other processes sharing the counters file are picked up by polling, when a poll
 * interval is configured. Waiters are kept in registration order per database and are checked on
 * every update. There is no timeout here; callers add their own.
 */
public class ConfirmationTracker extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(ConfirmationTracker.class);

  private final ConfirmationCounters counters;
  private final Function<String, Collection<String>> peersForDatabase;
  private final long pollIntervalMillis;
  private final Fiber fiber;
  private final Channel<ConfirmationUpdate> updateChannel = new MemoryChannel<>();
  private final AtomicInteger waiterCount = new AtomicInteger();
  private final Object registrationLock = new Object();
  /** Guarded by registrationLock. */
  private boolean stopping;

  @FiberOnly
  private final Map<String, List<Waiter>> waitersByDatabase = new HashMap<>();

  /**
   * @param peersForDatabase   names of the peers that can confirm writes to a database.
   * @param pollIntervalMillis how often to re-read every counter, or 0 to rely on the update channel.
   */
  public ConfirmationTracker(ConfirmationCounters counters,
                             Function<String, Collection<String>> peersForDatabase,
                             FiberSupplier fiberSupplier,
                             long pollIntervalMillis) {
    this.counters = counters;
    this.peersForDatabase = peersForDatabase;
    this.pollIntervalMillis = pollIntervalMillis;
    this.fiber = fiberSupplier.getFiber(this::notifyFailed);
  }

  public Channel<ConfirmationUpdate> getUpdateChannel() {
    return updateChannel;
  }

  /**
   * @return a future that completes once requiredCount distinct peers have confirmed a time at or
   * after txnTime.
   * @throws IllegalArgumentException if more confirmations are asked for than there are peers.
   */
  public ListenableFuture<Void> awaitReplication(String database, double txnTime, int requiredCount) {
    Collection<String> peers = peersForDatabase.apply(database);
    if (requiredCount > peers.size()) {
      throw new IllegalArgumentException("cannot wait for " + requiredCount + " confirmations of "
          + database + " with only " + peers.size() + " peers");
    }
    SettableFuture<Void> future = SettableFuture.create();
    if (requiredCount <= 0) {
      future.set(null);
      return future;
    }
    Waiter waiter = new Waiter(txnTime, requiredCount, future);
    synchronized (registrationLock) {
      if (stopping || !isRunning()) {
        future.setException(new CancellationException("confirmation tracker is not running"));
        return future;
      }
      waiterCount.incrementAndGet();
      fiber.execute(() -> register(database, peers, waiter));
    }
    return future;
  }

  /**
   * Posted under the same lock as the stop task, so it either runs before that task or never gets posted.
   */
  @FiberOnly
  private void register(String database, Collection<String> peers, Waiter waiter) {
    for (String peer : peers) {
      if (counters.confirmedTime(database, peer) >= waiter.txnTime) {
        waiter.confirmedBy.add(peer);
      }
    }
    if (waiter.isSatisfied()) {
      waiter.resolve();
      waiterCount.decrementAndGet();
    } else {
      waitersByDatabase.computeIfAbsent(database, k -> new ArrayList<>()).add(waiter);
    }
  }

  /**
   * Outstanding waiters, including ones still being registered.
   */
  public int getWaiterCount() {
    return waiterCount.get();
  }

  @Override
  protected void doStart() {
    fiber.start();
    updateChannel.subscribe(fiber, this::handleUpdate);
    if (pollIntervalMillis > 0) {
      fiber.scheduleWithFixedDelay(this::pollCounters, pollIntervalMillis, pollIntervalMillis,
          TimeUnit.MILLISECONDS);
    }
    notifyStarted();
  }

  @Override
  protected void doStop() {
    synchronized (registrationLock) {
      stopping = true;
      fiber.execute(this::failWaitersAndDispose);
    }
  }

  @FiberOnly
  private void failWaitersAndDispose() {
    CancellationException closed = new CancellationException("confirmation tracker closed");
    int failed = 0;
    for (List<Waiter> waiters : waitersByDatabase.values()) {
      for (Waiter waiter : waiters) {
        waiter.future.setException(closed);
        failed++;
      }
    }
    waitersByDatabase.clear();
    waiterCount.addAndGet(-failed);
    if (failed > 0) {
      LOG.info("confirmation tracker closed with {} outstanding waiters", failed);
    }
    fiber.dispose();
    notifyStopped();
  }

  public void close() {
    stopAsync().awaitTerminated();
  }

  @FiberOnly
  private void handleUpdate(ConfirmationUpdate update) {
    double confirmed = counters.confirmedTime(update.database, update.peer);
    confirm(update.database, update.peer, Math.max(confirmed, update.txnTime));
  }

  @FiberOnly
  private void pollCounters() {
    for (String database : new ArrayList<>(waitersByDatabase.keySet())) {
      for (String peer : peersForDatabase.apply(database)) {
        confirm(database, peer, counters.confirmedTime(database, peer));
      }
    }
  }

  @FiberOnly
  private void confirm(String database, String peer, double confirmed) {
    List<Waiter> waiters = waitersByDatabase.get(database);
    if (waiters == null) {
      return;
    }
    Iterator<Waiter> iterator = waiters.iterator();
    while (iterator.hasNext()) {
      Waiter waiter = iterator.next();
      if (confirmed >= waiter.txnTime && waiter.confirmedBy.add(peer) && waiter.isSatisfied()) {
        waiter.resolve();
        iterator.remove();
        waiterCount.decrementAndGet();
      }
    }
    if (waiters.isEmpty()) {
      waitersByDatabase.remove(database);
    }
  }

  private static final class Waiter {
    final double txnTime;
    final int requiredCount;
    final SettableFuture<Void> future;
    final Set<String> confirmedBy = new HashSet<>();

    Waiter(double txnTime, int requiredCount, SettableFuture<Void> future) {
      this.txnTime = txnTime;
      this.requiredCount = requiredCount;
      this.future = future;
    }

    boolean isSatisfied() {
      return confirmedBy.size() >= requiredCount;
    }

    void resolve() {
      future.set(null);
    }
  }
}
