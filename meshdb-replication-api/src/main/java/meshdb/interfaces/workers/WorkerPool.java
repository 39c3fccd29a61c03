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

package meshdb.interfaces.workers;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * The process/thread manager as consumed by replication. Messages to and from workers are delivered
 * asynchronously; no object graph is shared between the coordinator and a worker.
 */
public interface WorkerPool {
  /**
   * Tag carried by workers that serve network connections.
   */
  String NETWORK_TAG = "network";

  List<WorkerHandle> getWorkers(String tag);

  /**
   * Pick a worker carrying the tag, cycling through them.
   */
  WorkerHandle assignWorker(String tag);

  /**
   * A handle that runs work inside the coordinating process, used when no worker carries a tag.
   */
  WorkerHandle coordinatorWorker();

  void sendToWorker(WorkerHandle worker, Object message);

  void onWorkerExit(Consumer<WorkerHandle> callback);

  <T> void onMessageFromWorker(Class<T> type, BiConsumer<WorkerHandle, T> callback);
}
