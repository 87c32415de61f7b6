package xzy.webdav.response;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response envelope handed from resource logic to the {@link ResponseSender}.
 * <p>
 * Header names keep the case they are sent with. The sender adds Content-Length,
 * Content-Encoding and Authentication-Info while sending, so an instance belongs to a
 * single request and is not shared.
 */
public final class DavResponse {
    private static final byte[] EMPTY = new byte[0];

    private final int status;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private ResponseContent content;
    private Long contentLength;
    private boolean contentRange;
    private Long contentRangeStart;
    private CompressionMethod compressionMethod = CompressionMethod.NONE;

    public DavResponse(int status) {
        this(status, ResponseType.HTML);
    }

    public DavResponse(int status, ResponseType type) {
        this.status = status;
        if (type.contentType() != null) {
            headers.put("Content-Type", type.contentType());
        }
        bytes(EMPTY);
    }

    /**
     * 405 answer for a method the resource layer does not handle.
     */
    public static DavResponse methodNotAllowed(String method) {
        byte[] body = ("method:" + method + " is not support method").getBytes(StandardCharsets.UTF_8);
        return new DavResponse(405).bytes(body);
    }

    public DavResponse bytes(byte[] data) {
        content = new ResponseContent.Bytes(data);
        contentLength = (long) data.length;
        return this;
    }

    /**
     * Streamed body of unknown length. Call {@link #contentLength(long)} afterwards when the
     * length is known in advance.
     */
    public DavResponse stream(BodySource source) {
        content = new ResponseContent.Stream(source);
        contentLength = null;
        return this;
    }

    /**
     * File body. The length is {@code count}, or the bytes between {@code offset} (or the
     * current position) and the end of the file. A {@code count} reaching past the end of the
     * file is cut to what the file holds.
     */
    public DavResponse zeroCopy(FileChannel file, Long offset, Long count) {
        long available;
        try {
            long start = offset != null ? offset : file.position();
            available = Math.max(0, file.size() - start);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to size file content", e);
        }
        Long length = count == null ? null : Math.min(count, available);
        content = new ResponseContent.ZeroCopyFile(file, offset, length);
        contentLength = length != null ? length : available;
        return this;
    }

    public DavResponse contentLength(long length) {
        contentLength = length;
        return this;
    }

    /**
     * Marks a partial response starting at {@code start} of a {@code totalLength} byte entity.
     * The advertised range ends at the total length, and the remaining
     * {@code totalLength - start} bytes become the content length.
     */
    public DavResponse contentRange(long totalLength, long start) {
        contentRange = true;
        contentRangeStart = start;
        contentLength = totalLength - start;
        headers.put("Content-Range", "bytes " + start + "-" + totalLength + "/" + totalLength);
        return this;
    }

    public DavResponse header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public void removeHeader(String name) {
        headers.remove(name);
    }

    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    public int status() {
        return status;
    }

    public ResponseContent content() {
        return content;
    }

    /**
     * @return the body length, null while unknown
     */
    public Long contentLength() {
        return contentLength;
    }

    public boolean isContentRange() {
        return contentRange;
    }

    public Long contentRangeStart() {
        return contentRangeStart;
    }

    public CompressionMethod compressionMethod() {
        return compressionMethod;
    }

    void compressionMethod(CompressionMethod method) {
        this.compressionMethod = method;
    }

    @Override
    public String toString() {
        return status + "|" + contentLength + "|" + content.getClass().getSimpleName()
                + "|" + contentRange + "|" + contentRangeStart + " " + headers;
    }
}
