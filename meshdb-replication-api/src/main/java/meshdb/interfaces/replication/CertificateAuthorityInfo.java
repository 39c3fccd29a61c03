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
 * Descriptive fields parsed out of a peer's CA certificate; for display only.
 */
public final class CertificateAuthorityInfo {
  public final String issuer;
  public final String subject;
  public final long validFrom;
  public final long validTo;

  public CertificateAuthorityInfo(String issuer, String subject, long validFrom, long validTo) {
    this.issuer = issuer;
    this.subject = subject;
    this.validFrom = validFrom;
    this.validTo = validTo;
  }

  @Override
  public String toString() {
    return "CertificateAuthorityInfo{" +
        "issuer='" + issuer + '\'' +
        ", subject='" + subject + '\'' +
        ", validFrom=" + validFrom +
        ", validTo=" + validTo +
        '}';
  }
}
