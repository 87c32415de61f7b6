package xzy.webdav.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BasicAuthenticatorTest {
    private User alice;
    private BasicAuthenticator basic;

    @BeforeEach
    void setUp() {
        alice = new User("alice", "secret", List.of(), false);
        basic = new BasicAuthenticator("ASGI-WebDAV", CredentialStore.of(List.of(alice)));
    }

    @Test
    void challengeNamesTheRealm() {
        assertThat(basic.challengeString()).isEqualTo("Basic realm=\"ASGI-WebDAV\"");
    }

    @Test
    void acceptsKnownCredential() {
        assertThat(basic.verify("Basic YWxpY2U6c2VjcmV0")).isEqualTo(alice);
    }

    @Test
    void schemePrefixIsCaseInsensitive() {
        assertThat(basic.isCredential("basic YWxpY2U6c2VjcmV0")).isTrue();
        assertThat(basic.isCredential("BASIC YWxpY2U6c2VjcmV0")).isTrue();
        assertThat(basic.isCredential("Digest username=\"alice\"")).isFalse();
        assertThat(basic.isCredential("Basic")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Basic YWxpY2U6c2VjcmV1",
            "Basic ZWxpY2U6c2VjcmV0",
            "Basic YWxpY2U6c2VjcmV0 ",
            "Basic YWxpY2U6c2Vjcm",
            "Basic  YWxpY2U6c2VjcmV0"
    })
    void rejectsAnyMutation(String header) {
        assertThat(basic.verify(header)).isNull();
    }
}
