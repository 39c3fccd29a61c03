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

package meshdb.replication.coordinator;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Picks the node that takes over relaying a disconnected node's writes. Every process derives the
 * same answer from the same set of names: the names are sorted, and the walk goes forward from the
 * disconnected node, wrapping around, to the first node that already serves the database.
 */
public final class FailoverPlanner {
  private FailoverPlanner() {
  }

  public static ImmutableList<String> sortedNames(Collection<String> names) {
    return ImmutableList.sortedCopyOf(names);
  }

  /**
   * @param names               all known node names, in any order.
   * @param disconnected        the node whose connection was lost.
   * @param servesDatabase      whether a node already has a live assignment for the database.
   * @return the failover node, or empty if the walk comes back to the start without finding one.
   */
  public static Optional<String> findFailoverTarget(Collection<String> names,
                                                    String disconnected,
                                                    Predicate<String> servesDatabase) {
    ImmutableList<String> sorted = sortedNames(names);
    int start = sorted.indexOf(disconnected);
    if (start < 0) {
      return Optional.empty();
    }
    int size = sorted.size();
    for (int step = 1; step < size; step++) {
      String candidate = sorted.get((start + step) % size);
      if (servesDatabase.test(candidate)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
