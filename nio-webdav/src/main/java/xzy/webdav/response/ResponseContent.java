package xzy.webdav.response;

import java.nio.channels.FileChannel;
import java.util.Objects;

/**
 * The body of a {@link DavResponse}: fixed bytes, a lazy stream, or a file region that the
 * transport may send without copying.
 */
public sealed interface ResponseContent {

    record Bytes(byte[] data) implements ResponseContent {
        public Bytes {
            Objects.requireNonNull(data, "data");
        }
    }

    record Stream(BodySource source) implements ResponseContent {
        public Stream {
            Objects.requireNonNull(source, "source");
        }
    }

    /**
     * File content. The file belongs to the response from here on: it is closed after it
     * has been read, or by the transport once a zero-copy transfer completes.
     *
     * @param offset absolute start position, null to start at the channel's current position
     * @param count  number of bytes, null to send until end of file
     */
    record ZeroCopyFile(FileChannel file, Long offset, Long count) implements ResponseContent {
        public ZeroCopyFile {
            Objects.requireNonNull(file, "file");
        }
    }
}
