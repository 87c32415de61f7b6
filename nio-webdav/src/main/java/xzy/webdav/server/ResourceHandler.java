package xzy.webdav.server;

import xzy.webdav.auth.User;
import xzy.webdav.response.DavResponse;

import java.io.IOException;

/**
 * Resource layer seam: produces the response for an authenticated request. WebDAV method
 * semantics and storage live behind this interface.
 */
@FunctionalInterface
public interface ResourceHandler {

    DavResponse handle(DavRequest request, User user) throws IOException;

    /**
     * Answers every request with 405.
     */
    static ResourceHandler methodNotAllowed() {
        return (request, user) -> DavResponse.methodNotAllowed(request.method());
    }
}
