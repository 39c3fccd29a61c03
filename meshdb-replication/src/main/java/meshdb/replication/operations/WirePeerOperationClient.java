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

package meshdb.replication.operations;

import com.google.common.net.HostAndPort;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.ssl.SslContext;
import meshdb.ReplicationConstants;
import meshdb.interfaces.security.CertificateSource;
import meshdb.interfaces.security.ConnectionIdentity;
import meshdb.replication.connection.ReplicationClient;
import meshdb.replication.connection.ReplicationSsl;
import meshdb.replication.registry.NodeNames;
import meshdb.replication.wire.OperationEnvelope;
import meshdb.replication.wire.ReplicationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends a node operation over a short-lived replication socket: connect, name ourselves, send one
 * OPERATION_REQUEST, wait for the matching OPERATION_RESPONSE, close.
 */
public class WirePeerOperationClient implements PeerOperationClient {
  private static final Logger LOG = LoggerFactory.getLogger(WirePeerOperationClient.class);

  private final ReplicationClient client;
  private final AtomicInteger requestIds = new AtomicInteger();

  public WirePeerOperationClient(ReplicationClient client) {
    this.client = client;
  }

  @Override
  public ListenableFuture<OperationEnvelope> send(String url, OperationEnvelope request, boolean rejectUnauthorized) {
    SettableFuture<OperationEnvelope> response = SettableFuture.create();
    HostAndPort address;
    SslContext sslContext;
    try {
      address = NodeNames.hostAndPort(url);
      sslContext = NodeNames.isSecure(url) ? tlsContext(url, rejectUnauthorized) : null;
    } catch (SSLException | RuntimeException e) {
      response.setException(e);
      return response;
    }

    int requestId = requestIds.incrementAndGet();
    ResponseHandler handler = new ResponseHandler(requestId, request, response);
    client.bootstrap(sslContext, address.getHost(), address.getPort(), handler)
        .connect(address.getHost(), address.getPort())
        .addListener((ChannelFutureListener) future -> {
          if (!future.isSuccess()) {
            response.setException(future.cause());
            return;
          }
          Channel channel = future.channel();
          channel.eventLoop().schedule(() -> {
            if (response.setException(new TimeoutException("no response to " + request.operation + " from " + url))) {
              channel.close();
            }
          }, ReplicationConstants.REPLICATION_OPERATION_TIMEOUT_MILLISECONDS, TimeUnit.MILLISECONDS);
        });
    return response;
  }

  private SslContext tlsContext(String url, boolean rejectUnauthorized) throws SSLException {
    CertificateSource certificates = client.getCertificateSource();
    String peerName = NodeNames.urlToNodeName(url);
    ConnectionIdentity identity = certificates == null ? null : certificates.getConnectionIdentity(peerName);
    if (identity == null) {
      throw new IllegalStateException("no certificate available to reach " + url);
    }
    return ReplicationSsl.clientContext(identity, rejectUnauthorized);
  }

  private class ResponseHandler extends SimpleChannelInboundHandler<ReplicationMessage> {
    private final int requestId;
    private final OperationEnvelope request;
    private final SettableFuture<OperationEnvelope> response;

    ResponseHandler(int requestId, OperationEnvelope request, SettableFuture<OperationEnvelope> response) {
      this.requestId = requestId;
      this.request = request;
      this.response = response;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
      ctx.write(new ReplicationMessage.NodeName(client.getConfig().nodeName));
      ctx.writeAndFlush(new ReplicationMessage.OperationRequest(requestId, request));
      super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ReplicationMessage msg) throws Exception {
      if (msg instanceof ReplicationMessage.OperationResponse
          && ((ReplicationMessage.OperationResponse) msg).requestId == requestId) {
        response.set(((ReplicationMessage.OperationResponse) msg).envelope);
        ctx.close();
      } else if (msg instanceof ReplicationMessage.Disconnect) {
        response.setException(new IllegalStateException(((ReplicationMessage.Disconnect) msg).reason));
        ctx.close();
      }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
      response.setException(new IllegalStateException("connection closed before " + request.operation + " completed"));
      super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
      LOG.debug("operation {} failed", request.operation, cause);
      response.setException(cause);
      ctx.close();
    }
  }
}
