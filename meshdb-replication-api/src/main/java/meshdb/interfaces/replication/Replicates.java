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

package meshdb.interfaces.replication;

/**
 * How much a peer replicates with us. The registry's durable form of this was historically either a
 * boolean or an object with directional flags; those shapes map onto these variants.
 */
public enum Replicates {
  /** Replicates every database in both directions. */
  FULL(true, true),
  /** Only sends its writes to us. */
  SEND_ONLY(true, false),
  /** Only receives our writes. */
  RECEIVE_ONLY(false, true),
  /** No full replication; explicit subscriptions (if any) decide routing. */
  NONE(false, false);

  private final boolean sends;
  private final boolean receives;

  Replicates(boolean sends, boolean receives) {
    this.sends = sends;
    this.receives = receives;
  }

  public boolean sends() {
    return sends;
  }

  public boolean receives() {
    return receives;
  }

  public static Replicates fromFlags(boolean sends, boolean receives) {
    if (sends && receives) {
      return FULL;
    } else if (sends) {
      return SEND_ONLY;
    } else if (receives) {
      return RECEIVE_ONLY;
    }
    return NONE;
  }
}
