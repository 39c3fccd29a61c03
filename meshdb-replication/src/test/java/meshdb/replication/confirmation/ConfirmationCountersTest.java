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

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.HashSet;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class ConfirmationCountersTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private final ConfirmationCounters counters = ConfirmationCounters.inMemory(16);

  @After
  public void closeCounters() {
    counters.close();
  }

  @Test
  public void eachDatabaseAndPeerGetsItsOwnStableSlot() {
    int first = counters.slotFor("data", "node-b");

    assertThat(counters.slotFor("data", "node-b"), is(first));
    assertThat(counters.slotFor("data", "node-c"), is(not(first)));
    assertThat(counters.slotFor("metrics", "node-b"), is(not(first)));
  }

  @Test
  public void countersOnlyMoveForward() {
    ConfirmationCounter counter = counters.writer("data", "node-b");

    assertThat(counter.confirm(100), is(true));
    assertThat(counter.confirm(90), is(false));
    assertThat(counter.confirm(100), is(false));
    assertThat(counter.get(), is(100.0));
    assertThat(counters.confirmedTime("data", "node-b"), is(100.0));
  }

  @Test
  public void anUnconfirmedKeyReadsAsZero() {
    assertThat(counters.confirmedTime("data", "node-z"), is(0.0));
  }

  @Test
  public void collidingKeysLandInDistinctSlots() {
    ConfirmationCounters small = ConfirmationCounters.inMemory(4);
    Set<Integer> slots = new HashSet<>();
    for (String peer : new String[]{"node-b", "node-c", "node-d", "node-e"}) {
      slots.add(small.slotFor("data", peer));
    }

    assertThat(slots.size(), is(4));
    small.close();
  }

  @Test(expected = IllegalStateException.class)
  public void runningOutOfSlotsIsAnError() {
    ConfirmationCounters tiny = ConfirmationCounters.inMemory(1);
    tiny.slotFor("data", "node-b");
    tiny.slotFor("data", "node-c");
  }

  @Test
  public void processesMappingTheSameFileShareCounters() throws Exception {
    File file = new File(folder.getRoot(), "confirmations");
    ConfirmationCounters writerSide = ConfirmationCounters.mapped(file, 16);
    ConfirmationCounters readerSide = ConfirmationCounters.mapped(file, 16);
    try {
      writerSide.writer("data", "node-b").confirm(1234.5);

      assertThat(readerSide.confirmedTime("data", "node-b"), is(1234.5));
      assertThat(readerSide.slotFor("data", "node-b"), is(writerSide.slotFor("data", "node-b")));
    } finally {
      writerSide.close();
      readerSide.close();
    }
  }

  @Test
  public void aMappedFileKeepsItsCountersAcrossRestarts() throws Exception {
    File file = new File(folder.getRoot(), "confirmations");
    ConfirmationCounters before = ConfirmationCounters.mapped(file, 16);
    before.writer("data", "node-b").confirm(77);
    before.close();

    ConfirmationCounters after = ConfirmationCounters.mapped(file, 16);
    assertThat(after.confirmedTime("data", "node-b"), is(77.0));
    after.close();
  }
}
