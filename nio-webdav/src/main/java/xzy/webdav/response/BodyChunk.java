package xzy.webdav.response;

/**
 * One piece of a response body and whether more pieces follow.
 */
public record BodyChunk(byte[] data, boolean moreBody) {
    private static final byte[] EMPTY = new byte[0];

    public static BodyChunk last(byte[] data) {
        return new BodyChunk(data, false);
    }

    public static BodyChunk emptyLast() {
        return new BodyChunk(EMPTY, false);
    }
}
