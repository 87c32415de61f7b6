package xzy.webdav.response;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.webdav.auth.AuthResult;
import xzy.webdav.config.CompressionLevel;
import xzy.webdav.config.DavConfig;
import xzy.webdav.server.DavRequest;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.util.Arrays;

/**
 * Frames a {@link DavResponse} onto a {@link ResponseChannel}.
 * <p>
 * Four strategies:
 * <ul>
 *   <li><b>Direct</b> - declared Content-Length when known, body chunks in their original
 *       boundaries</li>
 *   <li><b>Zero-copy</b> - the file is handed to the transport when it supports it</li>
 *   <li><b>Manual file read</b> - block sized reads when it does not</li>
 *   <li><b>Compressed</b> - gzip or brotli fed chunk by chunk; the header frame waits for
 *       the first compressed output</li>
 * </ul>
 * File reads block. {@link #send} is meant to run on a blocking executor, never on an
 * event loop thread.
 */
public final class ResponseSender {
    private static final Logger log = LoggerFactory.getLogger(ResponseSender.class);

    public static final String AUTHENTICATION_INFO = "Authentication-Info";

    private final CompressionNegotiator negotiator;
    private final CompressionLevel level;
    private final int blockSize;

    public ResponseSender(CompressionNegotiator negotiator, CompressionLevel level, int blockSize) {
        this.negotiator = negotiator;
        this.level = level;
        this.blockSize = blockSize;
    }

    public static ResponseSender fromConfig(DavConfig config) {
        return new ResponseSender(new CompressionNegotiator(config.compression()),
                config.compression().level(), config.responseBlockSize());
    }

    public void send(DavRequest request, DavResponse response, ResponseChannel channel) throws IOException {
        AuthResult auth = request.authResult();
        if (auth != null && auth.authenticationInfo() != null) {
            response.header(AUTHENTICATION_INFO, auth.authenticationInfo());
        }

        if (response.isContentRange()) {
            narrowToRange(response);
        }

        CompressionMethod method = negotiator.select(
                response.header("Content-Type"), response.contentLength(), request.acceptEncoding());
        response.compressionMethod(method);
        log.debug("Sending {} {} as {}", request.method(), request.path(), response);

        boolean handedOver = false;
        try {
            if (method == CompressionMethod.NONE) {
                handedOver = sendDirect(response, channel);
            } else {
                sendCompressed(response, method, channel);
            }
        } finally {
            if (!handedOver && response.content() instanceof ResponseContent.ZeroCopyFile file) {
                closeQuietly(file.file());
            }
        }
    }

    /**
     * @return true when a file was handed to the transport, which then owns it
     */
    private boolean sendDirect(DavResponse response, ResponseChannel channel) throws IOException {
        if (response.contentLength() != null) {
            response.header("Content-Length", String.valueOf(response.contentLength()));
        }
        channel.start(response.status(), response.headers());

        ResponseContent content = response.content();
        if (content instanceof ResponseContent.Bytes bytes) {
            channel.body(Unpooled.wrappedBuffer(bytes.data()), false);
        } else if (content instanceof ResponseContent.Stream stream) {
            streamBody(stream.source(), channel);
        } else if (content instanceof ResponseContent.ZeroCopyFile file) {
            if (channel.supportsZeroCopy()) {
                channel.zeroCopy(file.file(), file.offset(), file.count(), false);
                return true;
            }
            log.debug("Transport has no zero-copy support, reading file in {} byte blocks", blockSize);
            streamBody(new FileBodySource(file.file(), file.offset(), file.count(), blockSize), channel);
        }
        return false;
    }

    private static void streamBody(BodySource source, ResponseChannel channel) throws IOException {
        while (true) {
            BodyChunk chunk = source.next();
            if (chunk == null) {
                // source ended without a closing chunk
                channel.body(Unpooled.EMPTY_BUFFER, false);
                return;
            }
            channel.body(Unpooled.wrappedBuffer(chunk.data()), chunk.moreBody());
            if (!chunk.moreBody()) {
                return;
            }
        }
    }

    /**
     * Content-Length of a compressed body is only known up front when the whole source
     * arrives in its first chunk. Otherwise the header frame goes out without a length and
     * the body is sent chunked.
     */
    private void sendCompressed(DavResponse response, CompressionMethod method, ResponseChannel channel)
            throws IOException {
        response.header("Content-Encoding", method.contentEncoding());
        BodySource source = bodySource(response.content());

        try (ContentCompressor compressor = ContentCompressor.create(method, level)) {
            boolean first = true;
            while (true) {
                BodyChunk chunk = source.next();
                if (chunk == null) {
                    chunk = BodyChunk.emptyLast();
                }
                ByteBuf out = compressor.compress(chunk.data());
                if (!chunk.moreBody()) {
                    out = Unpooled.wrappedBuffer(out, compressor.finish());
                }

                if (first) {
                    first = false;
                    if (chunk.moreBody()) {
                        response.removeHeader("Content-Length");
                    } else {
                        response.header("Content-Length", String.valueOf(out.readableBytes()));
                    }
                    channel.start(response.status(), response.headers());
                }

                channel.body(out, chunk.moreBody());
                if (!chunk.moreBody()) {
                    return;
                }
            }
        }
    }

    /**
     * Cuts a full body down to the advertised range, so that the declared length is what goes
     * out. Streams are expected to produce the range themselves.
     */
    private static void narrowToRange(DavResponse response) {
        long start = response.contentRangeStart();
        long length = response.contentLength();
        ResponseContent content = response.content();
        if (content instanceof ResponseContent.Bytes bytes && bytes.data().length != length) {
            byte[] data = bytes.data();
            int from = (int) Math.min(start, data.length);
            int to = (int) Math.min(from + length, data.length);
            response.bytes(Arrays.copyOfRange(data, from, to));
        } else if (content instanceof ResponseContent.ZeroCopyFile file) {
            long offset = file.offset() != null ? file.offset() : start;
            response.zeroCopy(file.file(), offset, length);
        }
    }

    private BodySource bodySource(ResponseContent content) {
        if (content instanceof ResponseContent.Bytes bytes) {
            return BodySource.of(bytes.data());
        } else if (content instanceof ResponseContent.Stream stream) {
            return stream.source();
        } else if (content instanceof ResponseContent.ZeroCopyFile file) {
            return new FileBodySource(file.file(), file.offset(), file.count(), blockSize);
        }
        throw new IllegalStateException("Unknown content " + content);
    }

    private static void closeQuietly(FileChannel file) {
        try {
            file.close();
        } catch (IOException e) {
            log.debug("Failed to close file: {}", e.getMessage());
        }
    }
}
