package xzy.webdav.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xzy.webdav.config.DavConfig;
import xzy.webdav.response.DavResponse;
import xzy.webdav.response.ResponseContent;
import xzy.webdav.server.DavRequest;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DavAuthenticatorTest {
    private static final String REALM = "ASGI-WebDAV";

    private CredentialStore store;
    private DigestAuthenticator digest;

    @BeforeEach
    void setUp() {
        store = CredentialStore.of(List.of(new User("alice", "secret", List.of("+"), false)));
        digest = new DigestAuthenticator(REALM, "nonce-secret");
    }

    private DavAuthenticator authenticator(DavConfig.DigestAuth digestConfig) {
        return new DavAuthenticator(store, new BasicAuthenticator(REALM, store), digest, digestConfig);
    }

    private static DavRequest request(String method, String authorization, String userAgent) {
        Map<String, String> headers = new HashMap<>();
        if (authorization != null) {
            headers.put("Authorization", authorization);
        }
        if (userAgent != null) {
            headers.put("User-Agent", userAgent);
        }
        return DavRequest.of(method, "/docs/", headers);
    }

    private Map<String, String> digestFields(String method) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("username", "alice");
        fields.put("realm", REALM);
        fields.put("nonce", digest.generateNonce());
        fields.put("uri", "/docs/");
        fields.put("algorithm", "MD5");
        fields.put("opaque", digest.opaque());
        fields.put("qop", "auth");
        fields.put("nc", "00000001");
        fields.put("cnonce", "abcdef01");
        fields.put("response", digest.buildRequestDigest(fields, store.userByName("alice"), method));
        return fields;
    }

    private static String digestHeader(Map<String, String> fields) {
        return "Digest " + DigestAuthenticator.buildAuthorizationString(fields);
    }

    @Test
    void missingHeader() {
        AuthResult result = authenticator(new DavConfig.DigestAuth(false, "", "")).authenticate(request("GET", null, null));

        assertThat(result.isAuthenticated()).isFalse();
        assertThat(result.failureReason()).isEqualTo(AuthResult.MISSING_HEADER);
    }

    @Test
    void basicSuccess() {
        AuthResult result = authenticator(new DavConfig.DigestAuth(false, "", ""))
                .authenticate(request("GET", "Basic YWxpY2U6c2VjcmV0", null));

        assertThat(result.isAuthenticated()).isTrue();
        assertThat(result.user().username()).isEqualTo("alice");
        assertThat(result.scheme()).isEqualTo(AuthScheme.BASIC);
        assertThat(result.authenticationInfo()).isNull();
    }

    @Test
    void basicWrongPassword() {
        AuthResult result = authenticator(new DavConfig.DigestAuth(false, "", ""))
                .authenticate(request("GET", "Basic " + CredentialStore.basicCredential("alice", "wrong"), null));

        assertThat(result.isAuthenticated()).isFalse();
        assertThat(result.failureReason()).isEqualTo(AuthResult.NO_PERMISSION);
    }

    @Test
    void unknownScheme() {
        AuthResult result = authenticator(new DavConfig.DigestAuth(true, "", ""))
                .authenticate(request("GET", "Bearer abc", null));

        assertThat(result.failureReason()).isEqualTo(AuthResult.UNKNOWN_METHOD);
    }

    @Test
    void digestSuccessCarriesAuthenticationInfo() {
        Map<String, String> fields = digestFields("PROPFIND");
        AuthResult result = authenticator(new DavConfig.DigestAuth(true, "", ""))
                .authenticate(request("PROPFIND", digestHeader(fields), null));

        assertThat(result.isAuthenticated()).isTrue();
        assertThat(result.scheme()).isEqualTo(AuthScheme.DIGEST);
        assertThat(result.authenticationInfo())
                .startsWith("rspauth=\"")
                .endsWith("cnonce=\"abcdef01\", qop=auth, nc=00000001");
    }

    @Test
    void digestIsVerifiedAgainstRequestMethod() {
        Map<String, String> fields = digestFields("GET");
        AuthResult result = authenticator(new DavConfig.DigestAuth(true, "", ""))
                .authenticate(request("DELETE", digestHeader(fields), null));

        assertThat(result.isAuthenticated()).isFalse();
        assertThat(result.failureReason()).isEqualTo(AuthResult.NO_PERMISSION);
    }

    @Test
    void digestMissingCnonceHasNoPermission() {
        Map<String, String> fields = digestFields("GET");
        fields.remove("cnonce");
        AuthResult result = authenticator(new DavConfig.DigestAuth(true, "", ""))
                .authenticate(request("GET", digestHeader(fields), null));

        assertThat(result.isAuthenticated()).isFalse();
        assertThat(result.failureReason()).isEqualTo("no permission");
    }

    @Test
    void digestUnknownUserHasNoPermission() {
        Map<String, String> fields = digestFields("GET");
        fields.put("username", "mallory");
        AuthResult result = authenticator(new DavConfig.DigestAuth(true, "", ""))
                .authenticate(request("GET", digestHeader(fields), null));

        assertThat(result.failureReason()).isEqualTo(AuthResult.NO_PERMISSION);
    }

    @Test
    void challengeIsBasicWhenDigestDisabled() {
        DavResponse response = authenticator(new DavConfig.DigestAuth(false, "WebDAVFS", "neon/"))
                .createChallengeResponse(request("GET", null, "Microsoft-WebDAV-MiniRedir/10.0"), AuthResult.MISSING_HEADER);

        assertThat(response.status()).isEqualTo(401);
        assertThat(response.header("WWW-Authenticate")).isEqualTo("Basic realm=\"ASGI-WebDAV\"");
        assertThat(response.header("Content-Type")).isEqualTo("text/html");
        String body = new String(((ResponseContent.Bytes) response.content()).data(), StandardCharsets.UTF_8);
        assertThat(body).contains("<h1>401 Unauthorized. missing header: authorization</h1>");
        assertThat(response.contentLength()).isEqualTo((long) body.getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    void enableRuleSelectsDigestForMatchingClients() {
        DavAuthenticator auth = authenticator(new DavConfig.DigestAuth(false, "WebDAVFS|TestAgent", "neon/"));

        assertThat(auth.createChallengeResponse(request("GET", null, "WebDAVFS/3.0.0 (03008000) Darwin"), "x")
                .header("WWW-Authenticate")).startsWith("Digest realm=\"ASGI-WebDAV\"");
        assertThat(auth.createChallengeResponse(request("GET", null, "Mozilla/5.0 WebDAVFS"), "x")
                .header("WWW-Authenticate")).startsWith("Basic ");
    }

    @Test
    void disableRuleSelectsBasicForMatchingClients() {
        DavAuthenticator auth = authenticator(new DavConfig.DigestAuth(true, "", "neon/"));

        assertThat(auth.createChallengeResponse(request("GET", null, "neon/0.31.2"), "x")
                .header("WWW-Authenticate")).startsWith("Basic ");
        assertThat(auth.createChallengeResponse(request("GET", null, "Microsoft-WebDAV-MiniRedir/10.0"), "x")
                .header("WWW-Authenticate")).startsWith("Digest ");
        assertThat(auth.createChallengeResponse(request("GET", null, null), "x")
                .header("WWW-Authenticate")).startsWith("Digest ");
    }

    @Test
    void blankDisableRuleMatchesEveryClient() {
        DavAuthenticator auth = authenticator(new DavConfig.DigestAuth(true, "", ""));

        assertThat(auth.createChallengeResponse(request("GET", null, "neon/0.31.2"), "x")
                .header("WWW-Authenticate")).startsWith("Basic ");
        assertThat(auth.createChallengeResponse(request("GET", null, null), "x")
                .header("WWW-Authenticate")).startsWith("Basic ");
    }

    @Test
    void blankEnableRuleSelectsDigestForEveryClient() {
        DavAuthenticator auth = authenticator(new DavConfig.DigestAuth(false, "", "neon/"));

        assertThat(auth.createChallengeResponse(request("GET", null, "curl/8"), "x")
                .header("WWW-Authenticate")).startsWith("Digest ");
        assertThat(auth.createChallengeResponse(request("GET", null, null), "x")
                .header("WWW-Authenticate")).startsWith("Digest ");
    }
}
