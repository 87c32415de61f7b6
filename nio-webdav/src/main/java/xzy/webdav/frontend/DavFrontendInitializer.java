package xzy.webdav.frontend;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpServerExpectContinueHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.EventExecutorGroup;
import xzy.webdav.server.DavServices;
import xzy.webdav.server.ResourceHandler;

import java.util.concurrent.TimeUnit;

public final class DavFrontendInitializer extends ChannelInitializer<SocketChannel> {
    private final DavServices services;
    private final ResourceHandler resourceHandler;
    private final SslContext sslContext;
    private final EventExecutorGroup blockingGroup;

    /**
     * @param sslContext    server TLS context, null for plain HTTP
     * @param blockingGroup executors the request handler runs on
     */
    public DavFrontendInitializer(DavServices services,
                                  ResourceHandler resourceHandler,
                                  SslContext sslContext,
                                  EventExecutorGroup blockingGroup) {
        this.services = services;
        this.resourceHandler = resourceHandler;
        this.sslContext = sslContext;
        this.blockingGroup = blockingGroup;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();
        if (sslContext != null) {
            pipeline.addLast("tls", sslContext.newHandler(ch.alloc()));
        }
        // closes connections after 120s of inactivity
        pipeline.addLast("idle", new IdleStateHandler(0, 0, 120, TimeUnit.SECONDS));
        pipeline.addLast("http-codec", new HttpServerCodec());
        pipeline.addLast("http-aggregator", new HttpObjectAggregator(services.config().maxContentLength()));
        pipeline.addLast("expect-continue", new HttpServerExpectContinueHandler());
        pipeline.addLast(blockingGroup, "webdav-handler", new DavFrontendHandler(services, resourceHandler));
    }
}
