package xzy.webdav.response;

import io.netty.buffer.ByteBuf;

import java.nio.channels.FileChannel;
import java.util.Map;

/**
 * Outbound side of one request: a header frame, then one or more body frames, the last one
 * with {@code moreBody == false}.
 */
public interface ResponseChannel {

    void start(int status, Map<String, String> headers);

    /**
     * Sends a body frame. Ownership of {@code body} passes to the channel. May block the caller
     * until the peer has taken earlier frames.
     */
    void body(ByteBuf body, boolean moreBody);

    /**
     * Whether {@link #zeroCopy} can hand the file to the transport without copying it through
     * user space.
     */
    default boolean supportsZeroCopy() {
        return false;
    }

    /**
     * @param offset absolute start position, null for the channel's current position
     * @param count  number of bytes, null for the rest of the file
     */
    default void zeroCopy(FileChannel file, Long offset, Long count, boolean moreBody) {
        throw new UnsupportedOperationException("zero-copy file transmission is not supported");
    }
}
