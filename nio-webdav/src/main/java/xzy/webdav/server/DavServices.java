package xzy.webdav.server;

import xzy.webdav.auth.CredentialStore;
import xzy.webdav.auth.DavAuthenticator;
import xzy.webdav.config.DavConfig;
import xzy.webdav.listing.DirectoryEntryFilter;
import xzy.webdav.log.AccessLog;
import xzy.webdav.response.ResponseSender;

/**
 * The request-scoped collaborators shared by every connection. Built once at startup and
 * handed to the frontend and to the resource layer.
 */
public record DavServices(
        DavConfig config,
        CredentialStore credentials,
        DavAuthenticator authenticator,
        ResponseSender sender,
        DirectoryEntryFilter directoryFilter,
        AccessLog accessLog
) {

    public static DavServices fromConfig(DavConfig config) {
        CredentialStore credentials = CredentialStore.fromConfig(config);
        return new DavServices(
                config,
                credentials,
                DavAuthenticator.fromConfig(config, credentials),
                ResponseSender.fromConfig(config),
                new DirectoryEntryFilter(config.hideFileInDir()),
                new AccessLog(config.accessLogFile(), config.accessLogConsole()));
    }
}
