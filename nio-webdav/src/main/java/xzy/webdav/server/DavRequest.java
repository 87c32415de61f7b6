package xzy.webdav.server;

import io.netty.channel.Channel;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;
import xzy.webdav.auth.AuthResult;
import xzy.webdav.auth.User;
import xzy.webdav.response.AcceptEncoding;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Request data the core works with: method, path, headers and, once authenticated, the
 * {@link AuthResult}. Header lookup ignores case.
 */
public final class DavRequest {
    private final String clientIp;
    private final String method;
    private final String path;
    private final Map<String, String> headers;
    private final AcceptEncoding acceptEncoding;
    private final long startNanos = System.nanoTime();

    private volatile AuthResult authResult;

    private DavRequest(String clientIp, String method, String path, Map<String, String> headers) {
        this.clientIp = clientIp;
        this.method = method;
        this.path = path;
        Map<String, String> lowerCased = new HashMap<>();
        headers.forEach((k, v) -> lowerCased.put(k.toLowerCase(Locale.ROOT), v));
        this.headers = Collections.unmodifiableMap(lowerCased);
        this.acceptEncoding = AcceptEncoding.parse(this.headers.get("accept-encoding"));
    }

    public static DavRequest of(String method, String path, Map<String, String> headers) {
        return new DavRequest("0.0.0.0", method, path, headers);
    }

    public static DavRequest fromHttpRequest(Channel channel, HttpRequest request) {
        Map<String, String> headers = new HashMap<>();
        // repeated headers: the first one wins
        request.headers().forEach(e -> headers.putIfAbsent(e.getKey(), e.getValue()));
        String path = new QueryStringDecoder(request.uri()).path();
        return new DavRequest(clientIp(channel), request.method().name(), path, headers);
    }

    public static String clientIp(Channel channel) {
        if (!(channel instanceof SocketChannel socket) || socket.remoteAddress() == null) {
            return "0.0.0.0";
        }
        return socket.remoteAddress().getAddress().getHostAddress();
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public String userAgent() {
        String ua = headers.get(HttpHeaderNames.USER_AGENT.toString());
        return ua == null ? "" : ua;
    }

    public AcceptEncoding acceptEncoding() {
        return acceptEncoding;
    }

    public String clientIp() {
        return clientIp;
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public AuthResult authResult() {
        return authResult;
    }

    public void authResult(AuthResult result) {
        this.authResult = result;
    }

    /**
     * @return the authenticated user, or null
     */
    public User user() {
        AuthResult result = authResult;
        return result == null ? null : result.user();
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
