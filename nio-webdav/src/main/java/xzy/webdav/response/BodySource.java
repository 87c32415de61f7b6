package xzy.webdav.response;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Single-pass, pull based producer of body chunks. Sources are not restartable.
 * <p>
 * A source returns chunks until one with {@code moreBody == false}; calling {@link #next()}
 * after that, or on an exhausted source, returns null.
 */
@FunctionalInterface
public interface BodySource {

    BodyChunk next() throws IOException;

    /**
     * Emits the given arrays as chunks in order, the last one closing the body.
     */
    static BodySource of(byte[]... chunks) {
        List<byte[]> list = Arrays.asList(chunks);
        Iterator<byte[]> it = list.iterator();
        return () -> {
            if (!it.hasNext()) {
                return null;
            }
            byte[] data = it.next();
            return new BodyChunk(data, it.hasNext());
        };
    }

    /**
     * Reads an input stream in blocks of at most {@code blockSize} bytes. The stream is closed
     * once the last chunk has been produced.
     */
    static BodySource fromInputStream(InputStream in, int blockSize) {
        return new BodySource() {
            private boolean done;

            @Override
            public BodyChunk next() throws IOException {
                if (done) {
                    return null;
                }
                byte[] block = in.readNBytes(blockSize);
                if (block.length < blockSize) {
                    done = true;
                    in.close();
                    return BodyChunk.last(block);
                }
                return new BodyChunk(block, true);
            }
        };
    }
}
