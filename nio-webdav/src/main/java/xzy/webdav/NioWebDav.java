package xzy.webdav;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.webdav.config.Cli;
import xzy.webdav.config.ConfigLoader;
import xzy.webdav.config.DavConfig;
import xzy.webdav.log.RecentLogAppender;
import xzy.webdav.server.DavServices;
import xzy.webdav.server.ResourceHandler;
import xzy.webdav.server.WebDavApplication;

/**
 * WebDAV server front end on Netty.
 *
 * <h2>Configuration:</h2>
 * Configuration is loaded from multiple sources (later overrides earlier):
 * <ol>
 *   <li>Classpath resource /config.properties (defaults)</li>
 *   <li>CLI-specified config file (--config=path)</li>
 *   <li>CLI argument overrides (--key=value)</li>
 * </ol>
 *
 * <h2>Request flow:</h2>
 * <pre>
 *  request ──▶ DavAuthenticator ──▶ ResourceHandler ──▶ ResponseSender ──▶ channel
 *                    │                                      ▲
 *                    └────────── 401 challenge ─────────────┘
 * </pre>
 */
public final class NioWebDav {
    private static final Logger log = LoggerFactory.getLogger(NioWebDav.class);

    private NioWebDav() {
        // Main class - prevent instantiation
    }

    public static void main(String[] args) {
        Cli cli = Cli.parse(args);
        if (cli.helpRequested()) {
            Cli.printHelp();
            return;
        }

        DavConfig config = ConfigLoader.load(cli);
        if (config.accounts().isEmpty()) {
            log.warn("No accounts configured, every request will be answered with 401");
        }

        RecentLogAppender recentLog = RecentLogAppender.attach(Logger.ROOT_LOGGER_NAME, config.recentLogSize());
        log.info("Starting nio-webdav with config: {}", config);

        DavServices services = DavServices.fromConfig(config);
        WebDavApplication server = new WebDavApplication(services, ResourceHandler.methodNotAllowed());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            recentLog.detach(Logger.ROOT_LOGGER_NAME);
        }, "nio-webdav-shutdown"));
        server.start();

        try {
            server.awaitClose();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Server interrupted");
        }
    }
}
