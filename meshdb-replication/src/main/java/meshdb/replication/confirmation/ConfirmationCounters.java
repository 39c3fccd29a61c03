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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import meshdb.ReplicationConstants;
import org.agrona.IoUtil;
import org.agrona.concurrent.UnsafeBuffer;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Fixed array of per-(database, peer) confirmation counters, one cache line each. The buffer can be
 * backed by a memory mapped file so that every process on the machine sees the same counters.
 * <p>
 * Slot layout:
 * <pre>
 *   0: confirmed transaction time (double bits, ordered writes)
 *   8: key hash of (database, peer)
 *  16: slot state (free, claiming, allocated)
 *  20: padding to {@value ReplicationConstants#CONFIRMATION_COUNTER_SLOT_LENGTH} bytes
 * </pre>
 * Slots are claimed with a compare-and-set on the state word, so concurrent processes agree on which
 * index a key lives at without talking to each other. Slots are never freed.
 */
public class ConfirmationCounters implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(ConfirmationCounters.class);

  static final int VALUE_OFFSET = 0;
  static final int KEY_OFFSET = 8;
  static final int STATE_OFFSET = 16;

  private static final int FREE = 0;
  private static final int CLAIMING = 1;
  private static final int ALLOCATED = 2;

  private static final HashFunction KEY_HASH = Hashing.murmur3_128();

  private final UnsafeBuffer buffer;
  private final int slots;
  @Nullable
  private final MappedByteBuffer mapped;

  private ConfirmationCounters(UnsafeBuffer buffer, int slots, @Nullable MappedByteBuffer mapped) {
    this.buffer = buffer;
    this.slots = slots;
    this.mapped = mapped;
  }

  public static ConfirmationCounters inMemory(int slots) {
    ByteBuffer direct = ByteBuffer.allocateDirect(slots * ReplicationConstants.CONFIRMATION_COUNTER_SLOT_LENGTH);
    return new ConfirmationCounters(new UnsafeBuffer(direct), slots, null);
  }

  public static ConfirmationCounters inMemory() {
    return inMemory(ReplicationConstants.CONFIRMATION_COUNTER_SLOTS);
  }

  /**
   * Map the counters file, creating it if it does not exist yet. Every process that maps the same file
   * shares the same counters.
   */
  public static ConfirmationCounters mapped(File file, int slots) {
    long length = (long) slots * ReplicationConstants.CONFIRMATION_COUNTER_SLOT_LENGTH;
    MappedByteBuffer mapped;
    if (file.exists() && file.length() == length) {
      mapped = IoUtil.mapExistingFile(file, "confirmation counters");
    } else {
      if (file.exists()) {
        LOG.warn("confirmation counters file {} has length {}, expected {}; recreating it",
            file, file.length(), length);
        IoUtil.delete(file, false);
      }
      mapped = IoUtil.mapNewFile(file, length);
    }
    LOG.info("mapped {} confirmation counters from {}", slots, file);
    return new ConfirmationCounters(new UnsafeBuffer(mapped), slots, mapped);
  }

  /**
   * Index of the slot for the key, claiming a free slot the first time the key is seen.
   *
   * @throws IllegalStateException when every slot is taken.
   */
  public int slotFor(String database, String peer) {
    long hash = keyHash(database, peer);
    int start = (int) Math.floorMod(hash, (long) slots);
    for (int step = 0; step < slots; step++) {
      int slot = (start + step) % slots;
      int offset = offset(slot);
      int state = awaitStable(offset);
      if (state == FREE) {
        if (buffer.compareAndSetInt(offset + STATE_OFFSET, FREE, CLAIMING)) {
          buffer.putLong(offset + KEY_OFFSET, hash);
          buffer.putLongOrdered(offset + VALUE_OFFSET, Double.doubleToRawLongBits(0));
          buffer.putIntOrdered(offset + STATE_OFFSET, ALLOCATED);
          return slot;
        }
        state = awaitStable(offset);
      }
      if (state == ALLOCATED && buffer.getLongVolatile(offset + KEY_OFFSET) == hash) {
        return slot;
      }
    }
    throw new IllegalStateException("no free confirmation counter slot for " + database + "/" + peer);
  }

  /**
   * The writable handle for one key. Only the worker that holds the connection to the peer asks for
   * one.
   */
  public ConfirmationCounter writer(String database, String peer) {
    return new ConfirmationCounter(this, slotFor(database, peer), database, peer);
  }

  public double confirmedTime(String database, String peer) {
    return confirmedTime(slotFor(database, peer));
  }

  public double confirmedTime(int slot) {
    return Double.longBitsToDouble(buffer.getLongVolatile(offset(slot) + VALUE_OFFSET));
  }

  void putConfirmedTime(int slot, double txnTime) {
    buffer.putLongOrdered(offset(slot) + VALUE_OFFSET, Double.doubleToRawLongBits(txnTime));
  }

  public int getSlotCount() {
    return slots;
  }

  @Override
  public void close() {
    if (mapped != null) {
      IoUtil.unmap(mapped);
    }
  }

  private int awaitStable(int offset) {
    int state = buffer.getIntVolatile(offset + STATE_OFFSET);
    while (state == CLAIMING) {
      Thread.onSpinWait();
      state = buffer.getIntVolatile(offset + STATE_OFFSET);
    }
    return state;
  }

  private static int offset(int slot) {
    return slot * ReplicationConstants.CONFIRMATION_COUNTER_SLOT_LENGTH;
  }

  private static long keyHash(String database, String peer) {
    return KEY_HASH.newHasher()
        .putString(database, StandardCharsets.UTF_8)
        .putByte((byte) 0)
        .putString(peer, StandardCharsets.UTF_8)
        .hash()
        .asLong();
  }
}
