package xzy.webdav.response;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;
import xzy.webdav.config.CompressionLevel;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentCompressorTest {

    @Test
    void levelsMapToCodecSettings() {
        assertThat(ContentCompressor.gzipLevel(CompressionLevel.FAST)).isEqualTo(1);
        assertThat(ContentCompressor.gzipLevel(CompressionLevel.DEFAULT)).isEqualTo(4);
        assertThat(ContentCompressor.gzipLevel(CompressionLevel.BEST)).isEqualTo(9);
        assertThat(ContentCompressor.brotliQuality(CompressionLevel.BEST)).isEqualTo(11);
    }

    @Test
    void eachChunkProducesOutputBeforeFinish() throws IOException {
        try (ContentCompressor compressor = ContentCompressor.create(CompressionMethod.GZIP, CompressionLevel.FAST)) {
            ByteBuf first = compressor.compress("first chunk ".getBytes(StandardCharsets.UTF_8));
            assertThat(first.readableBytes()).isPositive();
            ByteBuf rest = Unpooled.wrappedBuffer(
                    compressor.compress("second chunk".getBytes(StandardCharsets.UTF_8)), compressor.finish());

            byte[] gzip = ByteBufUtil.getBytes(Unpooled.wrappedBuffer(first, rest));
            try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(gzip))) {
                assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("first chunk second chunk");
            }
            assertThat(compressor.finish().readableBytes()).isZero();
            assertThatThrownBy(() -> compressor.compress(new byte[1])).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void noCompressorForIdentity() {
        assertThatThrownBy(() -> ContentCompressor.create(CompressionMethod.NONE, CompressionLevel.DEFAULT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
