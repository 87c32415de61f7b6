package xzy.webdav.server;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.DefaultFileRegion;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.DefaultLastHttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.ssl.SslHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.webdav.response.ResponseChannel;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link ResponseChannel} on top of a Netty HTTP/1.1 pipeline.
 * <p>
 * Without a declared Content-Length the response is sent with chunked transfer coding.
 * Zero-copy uses {@link DefaultFileRegion}, which is only possible while no TLS handler has
 * to see the bytes.
 * <p>
 * Writes may come from any thread; Netty queues them on the event loop in call order. A caller
 * off the event loop is held in {@link #body} while the channel is above its write buffer high
 * water mark, so a slow client stops the body source instead of filling the outbound buffer.
 */
public final class NettyResponseChannel implements ResponseChannel {
    private static final Logger log = LoggerFactory.getLogger(NettyResponseChannel.class);

    /**
     * Longest wait for one body frame to reach the socket. Matches the idle timeout of the
     * connection, whose idle event cannot be handled while the sending thread waits.
     */
    static final long WRITE_TIMEOUT_SECONDS = 120;

    private final Channel channel;
    private final boolean keepAlive;
    private long bytesWritten;
    private int status;
    private String contentType;

    public NettyResponseChannel(Channel channel, boolean keepAlive) {
        this.channel = channel;
        this.keepAlive = keepAlive;
    }

    @Override
    public void start(int status, Map<String, String> headers) {
        this.status = status;
        HttpResponse response = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.valueOf(status));
        headers.forEach((name, value) -> response.headers().add(name, value));
        if (!response.headers().contains(HttpHeaderNames.CONTENT_LENGTH)) {
            HttpUtil.setTransferEncodingChunked(response, true);
        }
        if (!keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        }
        contentType = response.headers().get(HttpHeaderNames.CONTENT_TYPE);
        channel.write(response).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    @Override
    public void body(ByteBuf body, boolean moreBody) {
        bytesWritten += body.readableBytes();
        if (moreBody) {
            ChannelFuture future = channel.writeAndFlush(new DefaultHttpContent(body))
                    .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
            awaitWritable(future);
        } else {
            complete(channel.writeAndFlush(new DefaultLastHttpContent(body)));
        }
    }

    /**
     * Blocks until {@code lastWrite} has reached the socket when the channel is not writable.
     * Never waits on the event loop, which is the thread that drains the buffer.
     */
    private void awaitWritable(ChannelFuture lastWrite) {
        if (!channel.isWritable() && !channel.eventLoop().inEventLoop()) {
            log.trace("Channel {} not writable, waiting for the peer to drain", channel.id());
            try {
                if (!lastWrite.await(WRITE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    channel.close();
                    throw new UncheckedIOException(new IOException(
                            "Peer did not read for " + WRITE_TIMEOUT_SECONDS + "s: " + channel));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UncheckedIOException(new InterruptedIOException("Interrupted while waiting for " + channel));
            }
        }
        if (lastWrite.isDone() && !lastWrite.isSuccess()) {
            Throwable cause = lastWrite.cause();
            throw new UncheckedIOException("Failed to write response body to " + channel,
                    cause instanceof IOException io ? io : new IOException(cause));
        }
    }

    @Override
    public boolean supportsZeroCopy() {
        return channel.pipeline().get(SslHandler.class) == null;
    }

    @Override
    public void zeroCopy(FileChannel file, Long offset, Long count, boolean moreBody) {
        try {
            long position = offset != null ? offset : file.position();
            long length = count != null ? count : Math.max(0, file.size() - position);
            bytesWritten += length;
            log.debug("Zero-copy transfer of {} bytes from position {}", length, position);
            channel.write(new DefaultFileRegion(file, position, length))
                    .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to size file region", e);
        }
        if (moreBody) {
            channel.flush();
        } else {
            complete(channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT));
        }
    }

    private void complete(ChannelFuture future) {
        if (keepAlive) {
            future.addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        } else {
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }

    public long bytesWritten() {
        return bytesWritten;
    }

    public int status() {
        return status;
    }

    public String contentType() {
        return contentType;
    }
}
