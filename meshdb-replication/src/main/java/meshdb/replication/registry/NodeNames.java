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

package meshdb.replication.registry;

import com.google.common.net.HostAndPort;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Node naming rules: a node's name is the host part of its replication URL, which must also be the
 * CN of its certificate.
 */
public final class NodeNames {
  public static final String TCP_SCHEME = "tcp";
  public static final String TLS_SCHEME = "tls";

  private NodeNames() {
  }

  @Nullable
  public static String urlToNodeName(@Nullable String url) {
    if (url == null) {
      return null;
    }
    return parse(url).getHost();
  }

  public static HostAndPort hostAndPort(String url) {
    URI uri = parse(url);
    if (uri.getHost() == null || uri.getPort() < 0) {
      throw new IllegalArgumentException("Replication url must have a host and port: " + url);
    }
    return HostAndPort.fromParts(uri.getHost(), uri.getPort());
  }

  public static boolean isSecure(String url) {
    String scheme = parse(url).getScheme();
    return TLS_SCHEME.equalsIgnoreCase(scheme) || "wss".equalsIgnoreCase(scheme);
  }

  private static URI parse(String url) {
    try {
      return new URI(url);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid replication url " + url, e);
    }
  }
}
