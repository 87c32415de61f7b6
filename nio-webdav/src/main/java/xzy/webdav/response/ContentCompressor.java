package xzy.webdav.response;

import com.aayushatharva.brotli4j.encoder.Encoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.CompositeByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.compression.BrotliEncoder;
import io.netty.handler.codec.compression.ZlibCodecFactory;
import io.netty.handler.codec.compression.ZlibWrapper;
import xzy.webdav.config.CompressionLevel;

/**
 * Incremental compressor fed one body chunk at a time.
 * <p>
 * Wraps a Netty encoder in an {@link EmbeddedChannel}, the same way Netty's own HTTP content
 * encoder does. Every {@link #compress(byte[])} flushes the codec so the output of a chunk is
 * available before the next one arrives; {@link #finish()} writes the stream trailer.
 * Chunks must be fed in source order.
 */
final class ContentCompressor implements AutoCloseable {
    private final EmbeddedChannel encoder;
    private boolean finished;

    private ContentCompressor(ChannelHandler handler) {
        this.encoder = new EmbeddedChannel(handler);
    }

    static ContentCompressor create(CompressionMethod method, CompressionLevel level) {
        return switch (method) {
            case GZIP -> new ContentCompressor(ZlibCodecFactory.newZlibEncoder(ZlibWrapper.GZIP, gzipLevel(level)));
            case BROTLI -> new ContentCompressor(new BrotliEncoder(new Encoder.Parameters()
                    .setQuality(brotliQuality(level))
                    .setMode(Encoder.Mode.TEXT)));
            case NONE -> throw new IllegalArgumentException("No compressor for " + method);
        };
    }

    static int gzipLevel(CompressionLevel level) {
        return switch (level) {
            case FAST -> 1;
            case BEST -> 9;
            case DEFAULT -> 4;
        };
    }

    static int brotliQuality(CompressionLevel level) {
        return switch (level) {
            case FAST -> 1;
            case BEST -> 11;
            case DEFAULT -> 4;
        };
    }

    /**
     * Compresses one chunk. The returned buffer may be empty and is owned by the caller.
     */
    ByteBuf compress(byte[] data) {
        if (finished) {
            throw new IllegalStateException("Compressor already finished");
        }
        if (data.length > 0) {
            encoder.writeOutbound(Unpooled.wrappedBuffer(data));
        }
        return drain();
    }

    /**
     * Ends the compressed stream and returns its remaining bytes, owned by the caller.
     */
    ByteBuf finish() {
        if (finished) {
            return Unpooled.EMPTY_BUFFER;
        }
        finished = true;
        encoder.finish();
        return drain();
    }

    private ByteBuf drain() {
        CompositeByteBuf out = Unpooled.compositeBuffer();
        ByteBuf buf;
        while ((buf = encoder.readOutbound()) != null) {
            if (buf.isReadable()) {
                out.addComponent(true, buf);
            } else {
                buf.release();
            }
        }
        return out;
    }

    @Override
    public void close() {
        if (!finished) {
            finished = true;
            encoder.finishAndReleaseAll();
        }
    }
}
