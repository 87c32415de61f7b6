package xzy.webdav.auth;

/**
 * Outcome of authenticating one request.
 *
 * @param user               The verified user, null on failure
 * @param failureReason      Generic reason for logs and the 401 body, empty on success
 * @param scheme             Scheme found on the request, null when none was recognized
 * @param authenticationInfo Digest mutual authentication info to echo, null otherwise
 */
public record AuthResult(User user, String failureReason, AuthScheme scheme, String authenticationInfo) {

    public static final String MISSING_HEADER = "missing header: authorization";
    public static final String NO_PERMISSION = "no permission";
    public static final String UNKNOWN_METHOD = "unknown authentication method";

    public static AuthResult success(User user, AuthScheme scheme, String authenticationInfo) {
        return new AuthResult(user, "", scheme, authenticationInfo);
    }

    public static AuthResult failure(String reason, AuthScheme scheme) {
        return new AuthResult(null, reason, scheme, null);
    }

    public boolean isAuthenticated() {
        return user != null;
    }
}
