package xzy.webdav.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.webdav.config.DavConfig;
import xzy.webdav.frontend.DavFrontendInitializer;

import javax.net.ssl.SSLException;
import java.io.File;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Owns the listener and its event loops.
 * <ul>
 *   <li><b>Boss group</b> - accepts incoming connections (single thread)</li>
 *   <li><b>Worker group</b> - socket I/O</li>
 *   <li><b>Blocking group</b> - authentication, resource handling and file reads</li>
 * </ul>
 */
public final class WebDavApplication {
    private static final Logger log = LoggerFactory.getLogger(WebDavApplication.class);

    private final DavServices services;
    private final ResourceHandler resourceHandler;
    private final EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup workerGroup = new NioEventLoopGroup();
    private final EventExecutorGroup blockingGroup;
    private volatile ChannelFuture httpServer;

    public WebDavApplication(DavServices services, ResourceHandler resourceHandler) {
        this.services = services;
        this.resourceHandler = resourceHandler;
        this.blockingGroup = new DefaultEventExecutorGroup(services.config().blockingThreads());
    }

    public void start() {
        DavConfig config = services.config();
        SslContext sslContext = buildSslContext(config);
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new DavFrontendInitializer(services, resourceHandler, sslContext, blockingGroup));
        httpServer = bootstrap.bind(config.listenHost(), config.listenPort()).syncUninterruptibly();

        log.info("WebDAV listening on {}://{}:{} (realm={}, users={})",
                sslContext != null ? "https" : "http",
                config.listenHost(), port(), config.realm(), services.credentials().size());
    }

    private static SslContext buildSslContext(DavConfig config) {
        if (!config.tlsEnabled()) {
            return null;
        }
        try {
            return SslContextBuilder.forServer(new File(config.tlsCertFile()), new File(config.tlsKeyFile())).build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to create SSL context", e);
        }
    }

    /**
     * @return the bound port, useful when listening on port 0
     */
    public int port() {
        return ((InetSocketAddress) httpServer.channel().localAddress()).getPort();
    }

    /**
     * Blocks until the listener is closed.
     */
    public void awaitClose() throws InterruptedException {
        if (httpServer != null) {
            httpServer.channel().closeFuture().sync();
        }
    }

    public void stop() {
        log.info("Shutting down nio-webdav...");
        if (httpServer != null) {
            httpServer.channel().close().syncUninterruptibly();
        }
        bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        blockingGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        services.accessLog().close();
    }
}
