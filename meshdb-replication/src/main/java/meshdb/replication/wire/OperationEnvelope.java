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

package meshdb.replication.wire;

import meshdb.interfaces.replication.NodeSubscription;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of OPERATION_REQUEST and OPERATION_RESPONSE. Requests fill in the operation and its
 * arguments; responses fill in either the node identity fields or the error.
 */
public class OperationEnvelope {
  public static final String ADD_NODE_BACK = "add_node_back";
  public static final String REMOVE_NODE_BACK = "remove_node_back";

  public String operation;
  /** The name the caller believes the receiving node has. */
  public String targetNodeName;
  public String nodeName;
  public String url;
  public String certificateAuthority;
  public String authorization;
  public List<SubscriptionDescriptor> subscriptions = new ArrayList<>();
  public String error;

  public OperationEnvelope() {
  }

  public static OperationEnvelope request(String operation) {
    OperationEnvelope envelope = new OperationEnvelope();
    envelope.operation = operation;
    return envelope;
  }

  public static OperationEnvelope failure(String error) {
    OperationEnvelope envelope = new OperationEnvelope();
    envelope.error = error;
    return envelope;
  }

  public boolean isError() {
    return error != null;
  }

  public List<NodeSubscription> toSubscriptions() {
    List<NodeSubscription> result = new ArrayList<>();
    if (subscriptions != null) {
      for (SubscriptionDescriptor descriptor : subscriptions) {
        result.add(descriptor.toSubscription());
      }
    }
    return result;
  }

  public void setSubscriptions(List<NodeSubscription> list) {
    subscriptions = new ArrayList<>();
    for (NodeSubscription subscription : list) {
      subscriptions.add(SubscriptionDescriptor.from(subscription));
    }
  }

  @Override
  public String toString() {
    return "OperationEnvelope{" +
        "operation='" + operation + '\'' +
        ", targetNodeName='" + targetNodeName + '\'' +
        ", nodeName='" + nodeName + '\'' +
        ", url='" + url + '\'' +
        ", subscriptions=" + (subscriptions == null ? 0 : subscriptions.size()) +
        ", error='" + error + '\'' +
        '}';
  }

  public static class SubscriptionDescriptor {
    String database;
    String table;
    boolean publish;
    boolean subscribe;
    Double startTime;

    public SubscriptionDescriptor() {
    }

    static SubscriptionDescriptor from(NodeSubscription subscription) {
      SubscriptionDescriptor descriptor = new SubscriptionDescriptor();
      descriptor.database = subscription.database;
      descriptor.table = subscription.table;
      descriptor.publish = subscription.publish;
      descriptor.subscribe = subscription.subscribe;
      descriptor.startTime = subscription.startTime;
      return descriptor;
    }

    NodeSubscription toSubscription() {
      return new NodeSubscription(database, table, publish, subscribe, startTime);
    }
  }
}
