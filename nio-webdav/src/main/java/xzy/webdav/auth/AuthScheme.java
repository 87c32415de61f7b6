package xzy.webdav.auth;

public enum AuthScheme {
    BASIC("Basic"),
    DIGEST("Digest");

    private final String wireName;

    AuthScheme(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
