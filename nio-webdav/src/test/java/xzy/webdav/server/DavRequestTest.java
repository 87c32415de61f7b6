package xzy.webdav.server;

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;
import xzy.webdav.auth.AuthResult;
import xzy.webdav.auth.AuthScheme;
import xzy.webdav.auth.User;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DavRequestTest {

    @Test
    void headersIgnoreCase() {
        DavRequest request = DavRequest.of("GET", "/", Map.of("User-Agent", "curl/8.4.0", "Accept-Encoding", "gzip"));

        assertThat(request.header("user-agent")).isEqualTo("curl/8.4.0");
        assertThat(request.header("USER-AGENT")).isEqualTo("curl/8.4.0");
        assertThat(request.userAgent()).isEqualTo("curl/8.4.0");
        assertThat(request.acceptEncoding().gzip()).isTrue();
        assertThat(DavRequest.of("GET", "/", Map.of()).userAgent()).isEmpty();
    }

    @Test
    void fromNettyRequest() {
        DefaultFullHttpRequest http = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.valueOf("PROPFIND"),
                "/docs/My%20File.txt?x=1");
        http.headers().add("Depth", "1");
        http.headers().add("Depth", "infinity");

        DavRequest request = DavRequest.fromHttpRequest(new EmbeddedChannel(), http);

        assertThat(request.method()).isEqualTo("PROPFIND");
        assertThat(request.path()).isEqualTo("/docs/My File.txt");
        assertThat(request.header("depth")).isEqualTo("1");
        assertThat(request.clientIp()).isEqualTo("0.0.0.0");
        http.release();
    }

    @Test
    void carriesAuthResult() {
        DavRequest request = DavRequest.of("GET", "/", Map.of());
        assertThat(request.user()).isNull();

        User alice = new User("alice", "secret", List.of(), false);
        request.authResult(AuthResult.success(alice, AuthScheme.BASIC, null));

        assertThat(request.user()).isEqualTo(alice);
        assertThat(request.elapsedMillis()).isNotNegative();
    }
}
