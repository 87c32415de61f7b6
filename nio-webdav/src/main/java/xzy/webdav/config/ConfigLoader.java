package xzy.webdav.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.TreeSet;

public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String ACCOUNT_PREFIX = "account.";
    private static final String HIDE_RULE_PREFIX = "hideFileInDir.rule.";

    private ConfigLoader() {
    }

    public static DavConfig load(Cli cli) {
        Properties props = new Properties();
        try (InputStream in = ConfigLoader.class.getResourceAsStream("/config.properties")) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ioe) {
            throw new IllegalStateException("Unable to read default config.properties", ioe);
        }

        Path extraConfig = cli.customConfigPath();
        if (extraConfig != null) {
            if (!Files.exists(extraConfig)) {
                throw new IllegalStateException("Config file not found: " + extraConfig);
            }
            try (InputStream in = Files.newInputStream(extraConfig)) {
                props.load(in);
            } catch (IOException ioe) {
                throw new IllegalStateException("Unable to read custom config " + extraConfig, ioe);
            }
        }

        for (Map.Entry<String, String> entry : cli.options().entrySet()) {
            if (!entry.getKey().equals("config") && !entry.getKey().equals("help")) {
                props.setProperty(entry.getKey(), entry.getValue());
            }
        }

        return fromProperties(props);
    }

    public static DavConfig fromProperties(Properties props) {
        return new DavConfig(
                props.getProperty("listen.host", "127.0.0.1"),
                intProp(props, "listen.port", 8000),
                blankToNull(props.getProperty("listen.tls.cert")),
                blankToNull(props.getProperty("listen.tls.key")),
                intProp(props, "http.maxContentLength", 16 * 1024 * 1024),
                intProp(props, "blocking.threads", 16),
                intProp(props, "response.blockSize", DavConfig.DEFAULT_BLOCK_SIZE),
                props.getProperty("realm", DavConfig.DEFAULT_REALM),
                accounts(props),
                new DavConfig.DigestAuth(
                        boolProp(props, "digest.enable", false),
                        props.getProperty("digest.enableRule", ""),
                        props.getProperty("digest.disableRule", "neon/")),
                new DavConfig.Compression(
                        boolProp(props, "compression.gzip", true),
                        boolProp(props, "compression.brotli", true),
                        levelProp(props, "compression.level"),
                        props.getProperty("compression.contentTypeUserRule", ""),
                        intProp(props, "compression.minLength", DavConfig.DEFAULT_COMPRESSION_MIN_LENGTH)),
                new DavConfig.HideFileInDir(
                        boolProp(props, "hideFileInDir.enable", true),
                        boolProp(props, "hideFileInDir.enableDefaultRules", true),
                        hideRules(props)),
                blankToNull(props.getProperty("log.access.file")),
                boolProp(props, "log.access.console", false),
                intProp(props, "log.recent.size", 100));
    }

    /**
     * Collects {@code account.<name>.password}, {@code .permissions} and {@code .admin}
     * entries. Accounts are ordered by name.
     */
    private static List<DavConfig.Account> accounts(Properties props) {
        TreeSet<String> names = new TreeSet<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(ACCOUNT_PREFIX) && key.endsWith(".password")) {
                names.add(key.substring(ACCOUNT_PREFIX.length(), key.length() - ".password".length()));
            }
        }
        List<DavConfig.Account> accounts = new ArrayList<>();
        for (String name : names) {
            String prefix = ACCOUNT_PREFIX + name + ".";
            String permissions = props.getProperty(prefix + "permissions", "");
            List<String> permissionList = permissions.isBlank()
                    ? List.of()
                    : Arrays.stream(permissions.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
            accounts.add(new DavConfig.Account(
                    name,
                    props.getProperty(prefix + "password"),
                    permissionList,
                    boolProp(props, prefix + "admin", false)));
        }
        return accounts;
    }

    /**
     * Collects {@code hideFileInDir.rule.<n>.userAgent} / {@code .fileName} pairs ordered by n.
     * A missing or empty user agent makes the rule apply to every client.
     */
    private static Map<String, String> hideRules(Properties props) {
        TreeMap<Integer, String[]> ordered = new TreeMap<>();
        for (String key : props.stringPropertyNames()) {
            if (!key.startsWith(HIDE_RULE_PREFIX) || !key.endsWith(".fileName")) {
                continue;
            }
            String index = key.substring(HIDE_RULE_PREFIX.length(), key.length() - ".fileName".length());
            int n;
            try {
                n = Integer.parseInt(index);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Hide rule index must be a number: " + key, e);
            }
            String userAgent = props.getProperty(HIDE_RULE_PREFIX + index + ".userAgent", "");
            ordered.put(n, new String[] {userAgent, props.getProperty(key)});
        }
        Map<String, String> rules = new LinkedHashMap<>();
        for (String[] rule : ordered.values()) {
            String previous = rules.get(rule[0]);
            rules.put(rule[0], previous == null ? rule[1] : previous + "|" + rule[1]);
        }
        if (!rules.isEmpty()) {
            log.debug("Loaded {} hide file rules", rules.size());
        }
        return rules;
    }

    private static CompressionLevel levelProp(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return CompressionLevel.DEFAULT;
        }
        try {
            return CompressionLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown compression level: " + value, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intProp(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        return value == null ? defaultValue : Integer.parseInt(value.trim());
    }

    private static boolean boolProp(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
