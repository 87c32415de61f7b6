package xzy.webdav.auth;

import java.util.Locale;

/**
 * Contract shared by the supported HTTP authentication schemes.
 */
public sealed interface HttpAuthScheme permits BasicAuthenticator, DigestAuthenticator {

    AuthScheme scheme();

    /**
     * Whether the {@code Authorization} header value carries credentials of this scheme.
     */
    boolean isCredential(String authorizationHeader);

    /**
     * Value of the {@code WWW-Authenticate} header for a 401 response.
     */
    String challengeString();

    static boolean hasSchemePrefix(String header, String prefix) {
        return header != null
                && header.length() >= prefix.length()
                && header.substring(0, prefix.length()).toLowerCase(Locale.ROOT).equals(prefix);
    }
}
