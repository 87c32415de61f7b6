package xzy.webdav.response;

public enum CompressionMethod {
    NONE(null),
    GZIP("gzip"),
    BROTLI("br");

    private final String contentEncoding;

    CompressionMethod(String contentEncoding) {
        this.contentEncoding = contentEncoding;
    }

    /**
     * Value of the Content-Encoding header, null for {@link #NONE}.
     */
    public String contentEncoding() {
        return contentEncoding;
    }
}
