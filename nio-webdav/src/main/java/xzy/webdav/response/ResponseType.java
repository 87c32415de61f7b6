package xzy.webdav.response;

/**
 * Selects the default Content-Type of a response.
 */
public enum ResponseType {
    UNDECIDED(null),
    HTML("text/html"),
    XML("application/xml");

    private final String contentType;

    ResponseType(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }
}
