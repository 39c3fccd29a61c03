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

package meshdb.replication.connection;

import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import meshdb.interfaces.security.ConnectionIdentity;
import org.jetbrains.annotations.Nullable;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLPeerUnverifiedException;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;

/**
 * TLS contexts for replication sockets, built from the identity the certificate subsystem hands out.
 * Both ends present a certificate; the peer's common name must be its node name.
 */
public final class ReplicationSsl {
  private ReplicationSsl() {
  }

  public static SslContext clientContext(ConnectionIdentity identity) throws SSLException {
    return clientContext(identity, true);
  }

  /**
   * @param verifyPeer false to accept whatever certificate the server presents.
   */
  public static SslContext clientContext(ConnectionIdentity identity, boolean verifyPeer) throws SSLException {
    SslContextBuilder builder = SslContextBuilder.forClient()
        .keyManager(identity.privateKey, identity.certificateChain.toArray(new X509Certificate[0]));
    if (!verifyPeer) {
      return builder.trustManager(InsecureTrustManagerFactory.INSTANCE).build();
    }
    return trusting(builder, identity).build();
  }

  public static SslContext serverContext(ConnectionIdentity identity) throws SSLException {
    SslContextBuilder builder = SslContextBuilder.forServer(identity.privateKey,
        identity.certificateChain.toArray(new X509Certificate[0]))
        .clientAuth(ClientAuth.REQUIRE);
    return trusting(builder, identity).build();
  }

  // with no CAs of its own the identity falls back to the JVM trust store
  private static SslContextBuilder trusting(SslContextBuilder builder, ConnectionIdentity identity) {
    if (identity.trustedAuthorities.isEmpty()) {
      return builder;
    }
    return builder.trustManager(identity.trustedAuthorities.toArray(new X509Certificate[0]));
  }

  /**
   * The CN of the certificate the peer presented, or null if it presented none with a CN.
   */
  @Nullable
  public static String peerCommonName(SslHandler sslHandler) {
    try {
      Certificate[] chain = sslHandler.engine().getSession().getPeerCertificates();
      if (chain.length == 0 || !(chain[0] instanceof X509Certificate)) {
        return null;
      }
      return commonName((X509Certificate) chain[0]);
    } catch (SSLPeerUnverifiedException e) {
      return null;
    }
  }

  @Nullable
  static String commonName(X509Certificate certificate) {
    try {
      LdapName name = new LdapName(certificate.getSubjectX500Principal().getName());
      for (Rdn rdn : name.getRdns()) {
        if ("CN".equalsIgnoreCase(rdn.getType())) {
          return rdn.getValue().toString();
        }
      }
      return null;
    } catch (InvalidNameException e) {
      throw new IllegalArgumentException("certificate subject is not a valid name", e);
    }
  }
}
