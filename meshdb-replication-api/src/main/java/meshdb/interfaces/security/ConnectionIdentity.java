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

package meshdb.interfaces.security;

import com.google.common.collect.ImmutableList;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;

/**
 * Everything needed to open a mutually authenticated TLS connection to one peer.
 */
public final class ConnectionIdentity {
  public final ImmutableList<X509Certificate> certificateChain;
  public final PrivateKey privateKey;
  public final ImmutableList<X509Certificate> trustedAuthorities;

  public ConnectionIdentity(ImmutableList<X509Certificate> certificateChain,
                            PrivateKey privateKey,
                            ImmutableList<X509Certificate> trustedAuthorities) {
    this.certificateChain = certificateChain;
    this.privateKey = privateKey;
    this.trustedAuthorities = trustedAuthorities;
  }
}
