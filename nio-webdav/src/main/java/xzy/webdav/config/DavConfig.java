package xzy.webdav.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable configuration record for nio-webdav.
 * <p>
 * Configuration is loaded in priority order by {@link ConfigLoader}:
 * <ol>
 *   <li>Classpath resource /config.properties (lowest priority)</li>
 *   <li>CLI-specified config file (--config=path)</li>
 *   <li>Individual CLI overrides (--key=value) (highest priority)</li>
 * </ol>
 *
 * @param listenHost          Local bind address
 * @param listenPort          HTTP listen port
 * @param tlsCertFile         PEM certificate chain, null for plain HTTP
 * @param tlsKeyFile          PEM private key, null for plain HTTP
 * @param maxContentLength    Maximum aggregated request body size
 * @param blockingThreads     Threads of the executor group running request handlers
 * @param responseBlockSize   Block size of manual file reads
 * @param realm               Authentication realm
 * @param accounts            Configured accounts, in declaration order
 * @param digestAuth          Digest challenge selection
 * @param compression         Response compression settings
 * @param hideFileInDir       Directory listing filter settings
 * @param accessLogFile       Access log file, null or blank to disable the file output
 * @param accessLogConsole    Whether access log lines also go to stdout
 * @param recentLogSize       Number of log messages kept in memory
 */
public record DavConfig(
        String listenHost,
        int listenPort,
        String tlsCertFile,
        String tlsKeyFile,
        int maxContentLength,
        int blockingThreads,
        int responseBlockSize,
        String realm,
        List<Account> accounts,
        DigestAuth digestAuth,
        Compression compression,
        HideFileInDir hideFileInDir,
        String accessLogFile,
        boolean accessLogConsole,
        int recentLogSize
) {
    public static final String DEFAULT_REALM = "ASGI-WebDAV";
    public static final int DEFAULT_BLOCK_SIZE = 64 * 1024;
    public static final int DEFAULT_COMPRESSION_MIN_LENGTH = 1000;

    public DavConfig {
        accounts = List.copyOf(accounts);
    }

    public boolean tlsEnabled() {
        return tlsCertFile != null && !tlsCertFile.isBlank();
    }

    /**
     * A configured user account.
     */
    public record Account(String username, String password, List<String> permissions, boolean admin) {
        public Account {
            permissions = List.copyOf(permissions);
        }

        @Override
        public String toString() {
            return "Account[username=" + username + ", permissions=" + permissions + ", admin=" + admin + "]";
        }
    }

    /**
     * Digest challenge selection. When {@code enable} is true every client gets a Digest
     * challenge unless its user agent matches {@code disableRule}; otherwise only clients
     * matching {@code enableRule} get one.
     */
    public record DigestAuth(boolean enable, String enableRule, String disableRule) {
    }

    public record Compression(
            boolean enableGzip,
            boolean enableBrotli,
            CompressionLevel level,
            String contentTypeUserRule,
            int minLength
    ) {
    }

    /**
     * @param userRules user agent regex to file name regex, in declaration order. The empty
     *                  key holds the rule applied to every client.
     */
    public record HideFileInDir(boolean enable, boolean enableDefaultRules, Map<String, String> userRules) {
        public HideFileInDir {
            userRules = Collections.unmodifiableMap(new LinkedHashMap<>(userRules));
        }
    }
}
