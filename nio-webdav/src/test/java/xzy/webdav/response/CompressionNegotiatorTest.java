package xzy.webdav.response;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import xzy.webdav.config.CompressionLevel;
import xzy.webdav.config.DavConfig;

import static org.assertj.core.api.Assertions.assertThat;

class CompressionNegotiatorTest {
    private static final AcceptEncoding BOTH = AcceptEncoding.parse("gzip, br");

    private static CompressionNegotiator negotiator(boolean gzip, boolean brotli, String userRule, boolean brotliAvailable) {
        return new CompressionNegotiator(
                new DavConfig.Compression(gzip, brotli, CompressionLevel.DEFAULT, userRule, 1000),
                () -> brotliAvailable);
    }

    @Test
    void prefersBrotliThenGzip() {
        assertThat(negotiator(true, true, "", true).select("text/plain", 5000L, BOTH)).isEqualTo(CompressionMethod.BROTLI);
        assertThat(negotiator(true, false, "", true).select("text/plain", 5000L, BOTH)).isEqualTo(CompressionMethod.GZIP);
        assertThat(negotiator(false, false, "", true).select("text/plain", 5000L, BOTH)).isEqualTo(CompressionMethod.NONE);
    }

    @Test
    void fallsBackToGzipWithoutBrotliCodec() {
        assertThat(negotiator(true, true, "", false).select("text/plain", 5000L, BOTH)).isEqualTo(CompressionMethod.GZIP);
        assertThat(negotiator(false, true, "", false).select("text/plain", 5000L, BOTH)).isEqualTo(CompressionMethod.NONE);
    }

    @Test
    void followsWhatTheClientAccepts() {
        CompressionNegotiator negotiator = negotiator(true, true, "", true);

        assertThat(negotiator.select("text/plain", 5000L, AcceptEncoding.parse("gzip"))).isEqualTo(CompressionMethod.GZIP);
        assertThat(negotiator.select("text/plain", 5000L, AcceptEncoding.parse("identity"))).isEqualTo(CompressionMethod.NONE);
        assertThat(negotiator.select("text/plain", 5000L, AcceptEncoding.NONE)).isEqualTo(CompressionMethod.NONE);
        assertThat(negotiator.select("text/plain", 5000L, AcceptEncoding.parse("*;q=1, br;q=0"))).isEqualTo(CompressionMethod.GZIP);
    }

    @Test
    void shortBodiesAreNotCompressed() {
        CompressionNegotiator negotiator = negotiator(true, true, "", true);

        assertThat(negotiator.select("text/plain", 999L, BOTH)).isEqualTo(CompressionMethod.NONE);
        assertThat(negotiator.select("text/plain", 1000L, BOTH)).isEqualTo(CompressionMethod.BROTLI);
        assertThat(negotiator.select("text/plain", null, BOTH)).isEqualTo(CompressionMethod.BROTLI);
    }

    @Test
    void sameInputsGiveSameChoice() {
        CompressionNegotiator negotiator = negotiator(true, true, "", true);
        CompressionMethod first = negotiator.select("application/xml", 4096L, BOTH);

        for (int i = 0; i < 10; i++) {
            assertThat(negotiator.select("application/xml", 4096L, BOTH)).isEqualTo(first);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "text/html", "text/plain; charset=utf-8", "application/xml", "application/json",
            "application/javascript", "image/svg+xml"})
    void defaultRuleCoversTextTypes(String contentType) {
        assertThat(negotiator(true, true, "", true).canBeCompressed(contentType)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"image/png", "application/octet-stream", "video/mp4", "application/zip", ""})
    void binaryTypesAreNotCompressed(String contentType) {
        assertThat(negotiator(true, true, "", true).canBeCompressed(contentType)).isFalse();
        assertThat(negotiator(true, true, "", true).canBeCompressed(null)).isFalse();
    }

    @Test
    void userRuleExtendsCompressibleTypes() {
        CompressionNegotiator negotiator = negotiator(true, true, "^application/x-yaml", true);

        assertThat(negotiator.canBeCompressed("application/x-yaml")).isTrue();
        assertThat(negotiator.canBeCompressed("application/zip")).isFalse();
    }
}
