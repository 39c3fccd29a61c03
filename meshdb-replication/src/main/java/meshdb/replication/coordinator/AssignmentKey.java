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

import java.util.Objects;

/**
 * Assignments are keyed by the peer's url and the database.
 */
public final class AssignmentKey implements Comparable<AssignmentKey> {
  public final String url;
  public final String database;

  public AssignmentKey(String url, String database) {
    this.url = Objects.requireNonNull(url, "url");
    this.database = Objects.requireNonNull(database, "database");
  }

  @Override
  public int compareTo(AssignmentKey o) {
    int byUrl = url.compareTo(o.url);
    return byUrl != 0 ? byUrl : database.compareTo(o.database);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AssignmentKey)) {
      return false;
    }
    AssignmentKey that = (AssignmentKey) o;
    return url.equals(that.url) && database.equals(that.database);
  }

  @Override
  public int hashCode() {
    return Objects.hash(url, database);
  }

  @Override
  public String toString() {
    return url + "/" + database;
  }
}
