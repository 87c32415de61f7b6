package xzy.webdav.config;

/**
 * Compression effort, mapped to codec specific levels by the response senders.
 */
public enum CompressionLevel {
    FAST,
    DEFAULT,
    BEST
}
