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

import com.google.common.util.concurrent.ListenableFuture;
import meshdb.replication.wire.OperationEnvelope;

/**
 * Runs one operation on the node at the given url and returns its response envelope. The future
 * fails if the node cannot be reached or does not answer in time; an error answered by the node
 * arrives as a response with its error set.
 */
public interface PeerOperationClient {
  /**
   * @param rejectUnauthorized whether a TLS peer must present a certificate this node trusts.
   */
  ListenableFuture<OperationEnvelope> send(String url, OperationEnvelope request, boolean rejectUnauthorized);
}
