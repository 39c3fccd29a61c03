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
 * Last capacity/version snapshot a peer reported about itself.
 */
public final class SystemInfo {
  public final String softwareVersion;
  public final int availableProcessors;
  public final long totalMemory;

  public SystemInfo(String softwareVersion, int availableProcessors, long totalMemory) {
    this.softwareVersion = softwareVersion;
    this.availableProcessors = availableProcessors;
    this.totalMemory = totalMemory;
  }

  @Override
  public String toString() {
    return "SystemInfo{" +
        "softwareVersion='" + softwareVersion + '\'' +
        ", availableProcessors=" + availableProcessors +
        ", totalMemory=" + totalMemory +
        '}';
  }
}
