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

/**
 * Single-writer handle on one confirmation slot.
 */
public final class ConfirmationCounter {
  private final ConfirmationCounters counters;
  private final int slot;
  public final String database;
  public final String peer;

  ConfirmationCounter(ConfirmationCounters counters, int slot, String database, String peer) {
    this.counters = counters;
    this.slot = slot;
    this.database = database;
    this.peer = peer;
  }

  /**
   * Record that the peer confirmed everything up to txnTime. The counter never moves backwards.
   *
   * @return true if the counter advanced.
   */
  public boolean confirm(double txnTime) {
    if (txnTime <= counters.confirmedTime(slot)) {
      return false;
    }
    counters.putConfirmedTime(slot, txnTime);
    return true;
  }

  public double get() {
    return counters.confirmedTime(slot);
  }

  public int getSlot() {
    return slot;
  }

  @Override
  public String toString() {
    return "ConfirmationCounter{" + database + "/" + peer + " @" + slot + "=" + get() + '}';
  }
}
