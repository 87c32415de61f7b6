package xzy.webdav.response;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * Reads a file channel in fixed-size blocks. Used when the transport cannot send the file
 * itself and whenever the file content has to pass through a compressor.
 * <p>
 * The channel is positioned at {@code offset} before the first read when one is given. With a
 * {@code count} at most that many bytes are read, fewer when the file ends first; without one,
 * reading stops at the first short block. All reads block and must not run on an event loop thread.
 */
final class FileBodySource implements BodySource {
    private final FileChannel file;
    private final Long offset;
    private final int blockSize;
    private long remaining;
    private final boolean bounded;
    private boolean started;
    private boolean done;

    FileBodySource(FileChannel file, Long offset, Long count, int blockSize) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
        }
        this.file = file;
        this.offset = offset;
        this.blockSize = blockSize;
        this.bounded = count != null;
        this.remaining = count == null ? 0 : count;
    }

    @Override
    public BodyChunk next() throws IOException {
        if (done) {
            return null;
        }
        if (!started) {
            started = true;
            if (offset != null) {
                file.position(offset);
            }
        }

        if (bounded) {
            int length = (int) Math.min(blockSize, remaining);
            byte[] data = read(length);
            remaining -= data.length;
            // the file may be shorter than the requested count
            done = remaining == 0 || data.length < length;
            return new BodyChunk(data, !done);
        }

        byte[] data = read(blockSize);
        if (data.length == blockSize) {
            return new BodyChunk(data, true);
        }
        done = true;
        return BodyChunk.last(data);
    }

    private byte[] read(int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            if (file.read(buffer) < 0) {
                break;
            }
        }
        buffer.flip();
        byte[] data = new byte[buffer.remaining()];
        buffer.get(data);
        return data;
    }
}
