package xzy.webdav.auth;

/**
 * HTTP Basic authentication (RFC 7617).
 * <p>
 * The credential map is keyed by the encoded {@code username:password} form, so verification
 * is a direct lookup of the header token and nothing is decoded.
 */
public final class BasicAuthenticator implements HttpAuthScheme {
    private static final String PREFIX = "basic ";

    private final String realm;
    private final CredentialStore credentials;

    public BasicAuthenticator(String realm, CredentialStore credentials) {
        this.realm = realm;
        this.credentials = credentials;
    }

    @Override
    public AuthScheme scheme() {
        return AuthScheme.BASIC;
    }

    @Override
    public boolean isCredential(String authorizationHeader) {
        return HttpAuthScheme.hasSchemePrefix(authorizationHeader, PREFIX);
    }

    @Override
    public String challengeString() {
        return "Basic realm=\"" + realm + "\"";
    }

    /**
     * @return the matching user, or null when the credential is unknown
     */
    public User verify(String authorizationHeader) {
        if (!isCredential(authorizationHeader)) {
            return null;
        }
        return credentials.userByBasicCredential(authorizationHeader.substring(PREFIX.length()));
    }
}
