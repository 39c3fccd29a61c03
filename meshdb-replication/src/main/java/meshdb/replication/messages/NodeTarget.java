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

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One node whose writes a subscription asks for. The first target of a subscription is the node the
 * connection is opened to; any further targets are origins whose writes are relayed through it
 * (failover redirection, self-catchup).
 * <p>
 * A start time of 0 lets the worker resume from what it has already received; an end time of 0 means
 * open-ended.
 */
public final class NodeTarget {
  public final String name;
  @Nullable
  public final String url;
  public final double startTime;
  public final double endTime;

  public NodeTarget(String name, @Nullable String url, double startTime, double endTime) {
    this.name = name;
    this.url = url;
    this.startTime = startTime;
    this.endTime = endTime;
  }

  public NodeTarget(String name, @Nullable String url) {
    this(name, url, 0, 0);
  }

  public boolean isBounded() {
    return endTime > 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NodeTarget)) {
      return false;
    }
    NodeTarget that = (NodeTarget) o;
    return Double.compare(that.startTime, startTime) == 0
        && Double.compare(that.endTime, endTime) == 0
        && name.equals(that.name)
        && Objects.equals(url, that.url);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, url, startTime, endTime);
  }

  @Override
  public String toString() {
    return "NodeTarget{" +
        "name='" + name + '\'' +
        ", url='" + url + '\'' +
        ", startTime=" + startTime +
        ", endTime=" + endTime +
        '}';
  }
}
