package xzy.webdav.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * HTTP Digest authentication with MD5 (RFC 2617, RFC 7616).
 * <p>
 * Nonces are {@code MD5(random + secret)} and are never stored. Verification only recomputes
 * the request digest, so an issued nonce stays valid until the secret changes, which happens
 * at process restart. There is no replay window.
 * <p>
 * For historical reasons {@code rspauth} and {@code cnonce} are quoted in Authentication-Info
 * while {@code qop} and {@code nc} are not (RFC 7616 section 3.5).
 */
public final class DigestAuthenticator implements HttpAuthScheme {
    private static final Logger log = LoggerFactory.getLogger(DigestAuthenticator.class);

    private static final String PREFIX = "digest ";
    private static final String QOP_AUTH = "auth";

    public static final Set<String> REQUIRED_FIELDS = Set.of(
            "username", "realm", "nonce", "uri", "response",
            "algorithm", "opaque", "qop", "nc", "cnonce");

    private final String realm;
    private final String secret;
    private final String opaque;

    public DigestAuthenticator(String realm) {
        this(realm, null);
    }

    /**
     * @param secret seed for nonce generation, a random value when null
     */
    public DigestAuthenticator(String realm, String secret) {
        this.realm = realm;
        this.secret = secret == null ? randomHex() : secret;
        this.opaque = randomHex().toUpperCase(Locale.ROOT);
    }

    @Override
    public AuthScheme scheme() {
        return AuthScheme.DIGEST;
    }

    public String opaque() {
        return opaque;
    }

    @Override
    public boolean isCredential(String authorizationHeader) {
        return HttpAuthScheme.hasSchemePrefix(authorizationHeader, PREFIX);
    }

    @Override
    public String challengeString() {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("realm", realm);
        data.put("qop", QOP_AUTH);
        data.put("nonce", generateNonce());
        data.put("opaque", opaque);
        data.put("algorithm", "MD5");
        data.put("stale", "false");
        return "Digest " + buildAuthorizationString(data);
    }

    public String generateNonce() {
        return md5Hex(randomHex() + secret);
    }

    /**
     * Splits the parameters of a Digest {@code Authorization} header, without the scheme token.
     * Fragments without {@code =} are logged and skipped.
     */
    public static Map<String, String> parseAuthorizationFields(String authorization) {
        Map<String, String> data = new LinkedHashMap<>();
        for (String fragment : authorization.split(",")) {
            int eq = fragment.indexOf('=');
            if (eq < 0) {
                log.warn("Skipping malformed digest field: {}", fragment);
                continue;
            }
            String key = strip(fragment.substring(0, eq));
            String value = strip(fragment.substring(eq + 1));
            data.put(key, value);
        }
        return data;
    }

    /**
     * Parses the fields of a full {@code Authorization: Digest ...} header value.
     */
    public Map<String, String> parseCredential(String authorizationHeader) {
        return parseAuthorizationFields(authorizationHeader.substring(PREFIX.length()));
    }

    /**
     * Serializes parameters as {@code key="value"} pairs joined with {@code ", "}.
     */
    public static String buildAuthorizationString(Map<String, String> data) {
        StringJoiner joiner = new StringJoiner(", ");
        data.forEach((k, v) -> joiner.add(k + "=\"" + v + "\""));
        return joiner.toString();
    }

    public static boolean hasRequiredFields(Map<String, String> fields) {
        return fields.keySet().containsAll(REQUIRED_FIELDS);
    }

    /**
     * @return {@code [HA1, HA2]} where HA1 = MD5(username:realm:password), HA2 = MD5(method:uri)
     */
    public String[] buildHa1Ha2(String username, String password, String method, String uri) {
        String ha1 = md5Digest(username, realm, password);
        String ha2 = md5Digest(method, uri);
        return new String[] {ha1, ha2};
    }

    public String buildRequestDigest(Map<String, String> fields, User user, String method) {
        String[] ha = buildHa1Ha2(user.username(), user.password(), method, fields.get("uri"));
        if (QOP_AUTH.equals(fields.get("qop"))) {
            // MD5(HA1:nonce:nc:cnonce:qop:HA2)
            return md5Digest(ha[0], fields.get("nonce"), fields.get("nc"),
                    fields.get("cnonce"), fields.get("qop"), ha[1]);
        }
        // legacy clients without qop: MD5(HA1:nonce:HA2)
        return md5Digest(ha[0], fields.get("nonce"), ha[1]);
    }

    public boolean verifyRequestDigest(Map<String, String> fields, User user, String method, String submitted) {
        if (submitted == null) {
            return false;
        }
        String expected = buildRequestDigest(fields, user, method);
        boolean match = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), submitted.getBytes(StandardCharsets.UTF_8));
        if (!match) {
            log.debug("Expected request digest {}, but got {}", expected, submitted);
        }
        return match;
    }

    /**
     * Builds the {@code Authentication-Info} value. rspauth reuses the request digest formula
     * with the request method and uri.
     */
    public String buildAuthenticationInfo(Map<String, String> fields, User user, String method) {
        String[] ha = buildHa1Ha2(user.username(), user.password(), method, fields.get("uri"));
        String rspauth = md5Digest(ha[0], fields.get("nonce"), fields.get("nc"),
                fields.get("cnonce"), fields.get("qop"), ha[1]);
        return "rspauth=\"" + rspauth + "\", cnonce=\"" + fields.get("cnonce")
                + "\", qop=" + fields.get("qop") + ", nc=" + fields.get("nc");
    }

    static String md5Digest(String... parts) {
        return md5Hex(String.join(":", parts));
    }

    static String md5Hex(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }

    private static String randomHex() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static String strip(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isStripped(value.charAt(start))) {
            start++;
        }
        while (end > start && isStripped(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isStripped(char c) {
        return c == ' ' || c == '\t' || c == '"' || c == '\'';
    }
}
