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

package meshdb.replication.operations;

import com.google.common.collect.ImmutableList;
import meshdb.interfaces.replication.NodeSubscription;
import org.jetbrains.annotations.Nullable;

/**
 * Arguments of add_node and update_node. Without subscriptions the two nodes replicate fully.
 */
public final class AddNodeRequest {
  @Nullable
  public final String url;
  @Nullable
  public final String nodeName;
  @Nullable
  public final ImmutableList<NodeSubscription> subscriptions;
  @Nullable
  public final String authorization;
  public final boolean rejectUnauthorized;

  public AddNodeRequest(@Nullable String url,
                        @Nullable String nodeName,
                        @Nullable ImmutableList<NodeSubscription> subscriptions,
                        @Nullable String authorization,
                        boolean rejectUnauthorized) {
    this.url = url;
    this.nodeName = nodeName;
    this.subscriptions = subscriptions;
    this.authorization = authorization;
    this.rejectUnauthorized = rejectUnauthorized;
  }

  public static AddNodeRequest fullReplication(String url) {
    return new AddNodeRequest(url, null, null, null, true);
  }

  public boolean hasSubscriptions() {
    return subscriptions != null && !subscriptions.isEmpty();
  }

  @Override
  public String toString() {
    return "AddNodeRequest{" +
        "url='" + url + '\'' +
        ", nodeName='" + nodeName + '\'' +
        ", subscriptions=" + subscriptions +
        ", rejectUnauthorized=" + rejectUnauthorized +
        '}';
  }
}
