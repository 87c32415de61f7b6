package xzy.webdav.frontend;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.webdav.auth.AuthResult;
import xzy.webdav.response.DavResponse;
import xzy.webdav.server.DavRequest;
import xzy.webdav.server.DavServices;
import xzy.webdav.server.NettyResponseChannel;
import xzy.webdav.server.ResourceHandler;

import java.nio.charset.StandardCharsets;

/**
 * Runs one request end to end: authenticate, hand the request to the resource layer (or
 * build the 401 challenge), send the response and write the access log line.
 * <p>
 * Meant to be added with a blocking executor group, since resource handlers and the sender
 * read files.
 */
public final class DavFrontendHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger log = LoggerFactory.getLogger(DavFrontendHandler.class);

    private final DavServices services;
    private final ResourceHandler resourceHandler;

    public DavFrontendHandler(DavServices services, ResourceHandler resourceHandler) {
        this.services = services;
        this.resourceHandler = resourceHandler;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest msg) throws Exception {
        if (msg.decoderResult().isFailure()) {
            sendError(ctx, HttpResponseStatus.BAD_REQUEST, "Bad Request");
            return;
        }

        DavRequest request = DavRequest.fromHttpRequest(ctx.channel(), msg);
        AuthResult result = services.authenticator().authenticate(request);
        request.authResult(result);

        DavResponse response;
        if (result.isAuthenticated()) {
            response = resourceHandler.handle(request, result.user());
        } else {
            log.debug("Authentication failed for {} {} from {}: {}",
                    request.method(), request.path(), request.clientIp(), result.failureReason());
            response = services.authenticator().createChallengeResponse(request, result.failureReason());
        }

        NettyResponseChannel channel = new NettyResponseChannel(ctx.channel(), HttpUtil.isKeepAlive(msg));
        services.sender().send(request, response, channel);

        services.accessLog().logRequest(
                request.clientIp(),
                request.method(),
                request.path(),
                channel.status(),
                request.elapsedMillis(),
                channel.bytesWritten(),
                result.user() == null ? null : result.user().username(),
                result.scheme() == null ? null : result.scheme().wireName(),
                response.compressionMethod().contentEncoding(),
                channel.contentType());
    }

    /**
     * Sends a minimal HTML error and closes the connection.
     */
    static void sendError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        ByteBuf content = Unpooled.copiedBuffer(
                "<html><body><h1>" + message + "</h1></body></html>", StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, content);
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, "text/html; charset=utf-8")
                .set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes())
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);

        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent idleEvent && idleEvent.state() == IdleState.ALL_IDLE) {
            log.debug("Closing idle connection: {}", ctx.channel().remoteAddress());
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Request failed on {}, closing connection", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
