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

package meshdb.replication.messages;

/**
 * Request for a {@link meshdb.interfaces.replication.ClusterStatus} snapshot from the coordinator.
 */
public final class ClusterStatusRequest {
  public static final ClusterStatusRequest ALL = new ClusterStatusRequest(true);
  public static final ClusterStatusRequest ASSIGNED_ONLY = new ClusterStatusRequest(false);

  /** Also list peers that have no assignment, with no database sockets. */
  public final boolean includeUnassigned;

  public ClusterStatusRequest(boolean includeUnassigned) {
    this.includeUnassigned = includeUnassigned;
  }

  @Override
  public String toString() {
    return "ClusterStatusRequest{includeUnassigned=" + includeUnassigned + '}';
  }
}
