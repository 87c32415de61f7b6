package xzy.webdav.response;

import io.netty.handler.codec.compression.Brotli;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.webdav.config.DavConfig;

import java.util.function.BooleanSupplier;
import java.util.regex.Pattern;

/**
 * Chooses the codec for a response before its first byte is sent.
 * <p>
 * Bodies shorter than the minimum length are never compressed. Otherwise a compressible
 * content type gets brotli when the codec is present, enabled and accepted, then gzip when
 * enabled and accepted. A missing brotli native library only means falling back.
 */
public final class CompressionNegotiator {
    private static final Logger log = LoggerFactory.getLogger(CompressionNegotiator.class);

    public static final Pattern DEFAULT_CONTENT_TYPE_RULE =
            Pattern.compile("^application/(?:javascript|json|xml)|^image/svg\\+xml|^text/");

    private final DavConfig.Compression config;
    private final Pattern contentTypeUserRule;
    private final BooleanSupplier brotliAvailable;

    public CompressionNegotiator(DavConfig.Compression config) {
        this(config, Brotli::isAvailable);
    }

    public CompressionNegotiator(DavConfig.Compression config, BooleanSupplier brotliAvailable) {
        this.config = config;
        String userRule = config.contentTypeUserRule();
        this.contentTypeUserRule = userRule == null || userRule.isBlank() ? null : Pattern.compile(userRule);
        this.brotliAvailable = brotliAvailable;
    }

    public CompressionMethod select(String contentType, Long contentLength, AcceptEncoding acceptEncoding) {
        if (contentLength != null && contentLength < config.minLength()) {
            return CompressionMethod.NONE;
        }
        if (!canBeCompressed(contentType)) {
            return CompressionMethod.NONE;
        }
        if (config.enableBrotli() && acceptEncoding.brotli()) {
            if (brotliAvailable.getAsBoolean()) {
                return CompressionMethod.BROTLI;
            }
            log.debug("Brotli requested but the codec is not available");
        }
        if (config.enableGzip() && acceptEncoding.gzip()) {
            return CompressionMethod.GZIP;
        }
        return CompressionMethod.NONE;
    }

    public boolean canBeCompressed(String contentType) {
        if (contentType == null || contentType.isEmpty()) {
            return false;
        }
        if (DEFAULT_CONTENT_TYPE_RULE.matcher(contentType).lookingAt()) {
            return true;
        }
        return contentTypeUserRule != null && contentTypeUserRule.matcher(contentType).lookingAt();
    }
}
