package xzy.webdav.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple command-line argument parser for nio-webdav.
 * <p>
 * Supports the following argument formats:
 * <ul>
 *   <li>{@code --key=value} - Set a configuration property</li>
 *   <li>{@code --flag} - Set a boolean flag to true</li>
 *   <li>{@code --help} or {@code -h} - Request help message</li>
 * </ul>
 *
 * @param options Parsed command-line options as key-value pairs
 */
public record Cli(Map<String, String> options) {

    /**
     * Parses command-line arguments into a Cli instance.
     *
     * @param args Command-line arguments from main()
     * @return Parsed Cli instance
     */
    public static Cli parse(String[] args) {
        Map<String, String> opts = new ConcurrentHashMap<>();
        if (args == null) {
            return new Cli(opts);
        }

        for (String arg : args) {
            if (arg == null) continue;

            if (arg.equals("--help") || arg.equals("-h")) {
                opts.put("help", "true");
                continue;
            }

            // Skip non-option arguments
            if (!arg.startsWith("--")) continue;

            String token = arg.substring(2);
            int eq = token.indexOf('=');
            if (eq > 0) {
                opts.put(token.substring(0, eq), token.substring(eq + 1));
            } else if (!token.isEmpty()) {
                opts.put(token, "true");
            }
        }

        return new Cli(opts);
    }

    /**
     * Checks if help was requested via --help or -h.
     *
     * @return true if help was requested
     */
    public boolean helpRequested() {
        return Boolean.parseBoolean(options.getOrDefault("help", "false"));
    }

    /**
     * Path of an extra properties file given with {@code --config=path}, or null.
     */
    public Path customConfigPath() {
        String value = options.get("config");
        return value == null || value.isBlank() ? null : Path.of(value);
    }

    /**
     * Prints the help message to stdout.
     */
    public static void printHelp() {
        String help = """
            nio-webdav - WebDAV gateway with Basic/Digest authentication and compressed responses

            Options:
              --config=PATH                        Path to external config properties file
              --listen.host=HOST                   Listen address (default: 127.0.0.1)
              --listen.port=PORT                   HTTP listen port (default: 8000)
              --listen.tls.cert=FILE               PEM certificate chain, enables TLS
              --listen.tls.key=FILE                PEM private key (PKCS#8)
              --realm=NAME                         Authentication realm (default: ASGI-WebDAV)
              --account.NAME.password=PASS         Add or override an account
              --account.NAME.permissions=LIST      Comma separated permission rules
              --account.NAME.admin=BOOL            Mark the account as administrator
              --digest.enable=BOOL                 Challenge with Digest by default (default: false)
              --digest.enableRule=REGEX            User agents that get Digest when it is disabled
              --digest.disableRule=REGEX           User agents that get Basic when it is enabled
              --compression.gzip=BOOL              Enable gzip (default: true)
              --compression.brotli=BOOL            Enable brotli (default: true)
              --compression.level=LEVEL            FAST, DEFAULT or BEST (default: DEFAULT)
              --compression.contentTypeUserRule=RE Extra compressible content types
              --hideFileInDir.enable=BOOL          Hide files in directory listings (default: true)
              --log.access.file=FILE               Access log file
              --help, -h                           Show this help

            Example:
              java -jar nio-webdav.jar --account.alice.password=secret --digest.enable=true

            Configuration Priority (highest to lowest):
              1. CLI arguments (--key=value)
              2. Config file specified via --config=path
              3. config.properties in JAR (defaults)
            """;
        System.out.println(help);
    }
}
