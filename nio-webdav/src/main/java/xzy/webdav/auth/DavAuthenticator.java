package xzy.webdav.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.webdav.config.DavConfig;
import xzy.webdav.response.DavResponse;
import xzy.webdav.response.ResponseType;
import xzy.webdav.server.DavRequest;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks the authentication scheme present on a request, verifies it, and builds the
 * 401 challenge when verification fails.
 * <p>
 * Every failure collapses into a generic reason so the client cannot tell an unknown user
 * from a wrong password. Nothing here throws on bad credentials.
 */
public final class DavAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(DavAuthenticator.class);

    static final String MESSAGE_401_TEMPLATE = """
            <!DOCTYPE html>
            <html>
              <head>
                <meta charset="UTF-8" />
                <title>Error</title>
              </head>
              <body>
                <h1>401 Unauthorized. %s</h1>
              </body>
            </html>""";

    private final CredentialStore credentials;
    private final BasicAuthenticator basicAuth;
    private final DigestAuthenticator digestAuth;
    private final boolean digestEnabled;
    private final Pattern digestEnableRule;
    private final Pattern digestDisableRule;

    public DavAuthenticator(CredentialStore credentials, String realm, DavConfig.DigestAuth digestConfig) {
        this(credentials, new BasicAuthenticator(realm, credentials), new DigestAuthenticator(realm), digestConfig);
    }

    public DavAuthenticator(CredentialStore credentials,
                            BasicAuthenticator basicAuth,
                            DigestAuthenticator digestAuth,
                            DavConfig.DigestAuth digestConfig) {
        this.credentials = credentials;
        this.basicAuth = basicAuth;
        this.digestAuth = digestAuth;
        this.digestEnabled = digestConfig.enable();
        this.digestEnableRule = compileRule(digestConfig.enableRule());
        this.digestDisableRule = compileRule(digestConfig.disableRule());
    }

    public static DavAuthenticator fromConfig(DavConfig config, CredentialStore credentials) {
        return new DavAuthenticator(credentials, config.realm(), config.digestAuth());
    }

    public AuthResult authenticate(DavRequest request) {
        String header = request.header("authorization");
        if (header == null) {
            return AuthResult.failure(AuthResult.MISSING_HEADER, null);
        }

        if (basicAuth.isCredential(header)) {
            User user = basicAuth.verify(header);
            if (user == null) {
                return AuthResult.failure(AuthResult.NO_PERMISSION, AuthScheme.BASIC);
            }
            return AuthResult.success(user, AuthScheme.BASIC, null);
        }

        if (digestAuth.isCredential(header)) {
            return authenticateDigest(request, header);
        }

        return AuthResult.failure(AuthResult.UNKNOWN_METHOD, null);
    }

    private AuthResult authenticateDigest(DavRequest request, String header) {
        Map<String, String> fields = digestAuth.parseCredential(header);
        if (!DigestAuthenticator.hasRequiredFields(fields)) {
            log.debug("Digest credential is missing required fields: {}", fields.keySet());
            return AuthResult.failure(AuthResult.NO_PERMISSION, AuthScheme.DIGEST);
        }

        User user = credentials.userByName(fields.get("username"));
        if (user == null) {
            return AuthResult.failure(AuthResult.NO_PERMISSION, AuthScheme.DIGEST);
        }

        if (!digestAuth.verifyRequestDigest(fields, user, request.method(), fields.get("response"))) {
            return AuthResult.failure(AuthResult.NO_PERMISSION, AuthScheme.DIGEST);
        }

        // echoed as Authentication-Info, macOS Finder checks it
        String info = digestAuth.buildAuthenticationInfo(fields, user, request.method());
        return AuthResult.success(user, AuthScheme.DIGEST, info);
    }

    /**
     * Builds the 401 response with a Basic or Digest challenge, chosen from the client's
     * user agent and the digest rules.
     */
    public DavResponse createChallengeResponse(DavRequest request, String message) {
        String userAgent = request.userAgent();
        boolean useDigest;
        if (digestEnabled) {
            useDigest = !matchUserAgent(digestDisableRule, userAgent);
        } else {
            useDigest = matchUserAgent(digestEnableRule, userAgent);
        }

        HttpAuthScheme scheme = useDigest ? digestAuth : basicAuth;
        log.debug("Responding with {} auth challenge to '{}'", scheme.scheme().wireName(), userAgent);

        DavResponse response = new DavResponse(401, ResponseType.HTML);
        response.header("WWW-Authenticate", scheme.challengeString());
        response.bytes(MESSAGE_401_TEMPLATE.formatted(message).getBytes(StandardCharsets.UTF_8));
        return response;
    }

    public DigestAuthenticator digestAuth() {
        return digestAuth;
    }

    /**
     * An empty rule is an ordinary pattern and matches every user agent.
     */
    private static Pattern compileRule(String rule) {
        return Pattern.compile(rule == null ? "" : rule);
    }

    private static boolean matchUserAgent(Pattern rule, String userAgent) {
        return rule.matcher(userAgent == null ? "" : userAgent).lookingAt();
    }
}
