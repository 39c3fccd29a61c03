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

package meshdb;

public class ReplicationConstants {
  public static final int REPLICATION_DEFAULT_PORT = 9933;
  public static final String REPLICATION_DEFAULT_NODE_NAME = "127.0.0.1";

  public static final int REPLICATION_DEFAULT_WORKER_COUNT = 2;
  public static final int REPLICATION_SUBSCRIBE_DELAY_MILLISECONDS = 200;
  public static final int REPLICATION_RECONNECT_DELAY_MILLISECONDS = 500;
  public static final int REPLICATION_COMMITTED_UPDATE_DELAY_MILLISECONDS = 2;
  public static final int REPLICATION_SKIPPED_SEQUENCE_UPDATE_DELAY_MILLISECONDS = 300;
  public static final int REPLICATION_CONNECT_TIMEOUT_MILLISECONDS = 3000;
  /** A connection that hears nothing for two intervals is closed. */
  public static final int REPLICATION_PING_INTERVAL_MILLISECONDS = 30000;
  public static final int REPLICATION_OPERATION_TIMEOUT_MILLISECONDS = 10000;

  /** Reconnect failures are only logged once every this many attempts. */
  public static final int REPLICATION_RETRY_LOG_INTERVAL = 20;

  public static final int CONFIRMATION_COUNTER_SLOTS = 1024;
  public static final int CONFIRMATION_COUNTER_SLOT_LENGTH = 64;
  public static final int CONFIRMATION_POLL_INTERVAL_MILLISECONDS = 100;
}
