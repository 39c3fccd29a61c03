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

import org.jetbrains.annotations.Nullable;

/**
 * The certificate subsystem. Issuance and rotation happen elsewhere; replication only asks for
 * ready-to-use material.
 */
public interface CertificateSource {
  /**
   * @return the identity to present to the named peer, or null if none is available.
   */
  @Nullable
  ConnectionIdentity getConnectionIdentity(String peerName);

  /**
   * @return the CA this node currently uses for replication certificates, or null.
   */
  @Nullable
  CertificateAuthority getCertificateAuthority();
}
